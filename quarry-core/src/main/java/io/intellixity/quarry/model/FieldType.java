package io.intellixity.quarry.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Declared type of a model field.
 *
 * <p>The set of kinds is closed: every operator/coercion table keys on {@link Kind}, so a new kind
 * needs an explicit entry in each backend's table. {@code list<...>} carries its element type.</p>
 */
public final class FieldType {
  public enum Kind {
    ID, TEXT, INTEGER, LONG, FLOAT, DECIMAL, BOOLEAN, DATETIME, DATE, UUID, DOCUMENT, LIST
  }

  public static final FieldType ID = new FieldType(Kind.ID, null);
  public static final FieldType TEXT = new FieldType(Kind.TEXT, null);
  public static final FieldType INTEGER = new FieldType(Kind.INTEGER, null);
  public static final FieldType LONG = new FieldType(Kind.LONG, null);
  public static final FieldType FLOAT = new FieldType(Kind.FLOAT, null);
  public static final FieldType DECIMAL = new FieldType(Kind.DECIMAL, null);
  public static final FieldType BOOLEAN = new FieldType(Kind.BOOLEAN, null);
  public static final FieldType DATETIME = new FieldType(Kind.DATETIME, null);
  public static final FieldType DATE = new FieldType(Kind.DATE, null);
  public static final FieldType UUID = new FieldType(Kind.UUID, null);
  public static final FieldType DOCUMENT = new FieldType(Kind.DOCUMENT, null);

  private final Kind kind;
  private final FieldType element;

  private FieldType(Kind kind, FieldType element) {
    this.kind = kind;
    this.element = element;
  }

  public static FieldType listOf(FieldType element) {
    Objects.requireNonNull(element, "element");
    return new FieldType(Kind.LIST, element);
  }

  public Kind kind() { return kind; }

  /** Element type for {@code list<...>}, otherwise null. */
  public FieldType element() { return element; }

  public boolean isList() { return kind == Kind.LIST; }

  /** Value a mapped record carries when the raw document does not contain the field at all. */
  public Object absentValue() {
    return kind == Kind.LIST ? List.of() : null;
  }

  /** Canonical id, e.g. {@code text}, {@code list<datetime>}. */
  public String id() {
    if (kind == Kind.LIST) return "list<" + element.id() + ">";
    return kind.name().toLowerCase(Locale.ROOT);
  }

  /** Parses ids such as {@code decimal}, {@code list<id>} or {@code list<list<text>>}. */
  public static FieldType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    String t = s.trim().toLowerCase(Locale.ROOT);
    if (t.startsWith("list<") && t.endsWith(">")) {
      return listOf(parse(t.substring(5, t.length() - 1)));
    }
    switch (t) {
      case "id": case "objectid": return ID;
      case "text": case "string": return TEXT;
      case "int": case "integer": return INTEGER;
      case "long": return LONG;
      case "float": case "double": return FLOAT;
      case "decimal": return DECIMAL;
      case "bool": case "boolean": return BOOLEAN;
      case "datetime": case "instant": return DATETIME;
      case "date": return DATE;
      case "uuid": return UUID;
      case "document": case "json": return DOCUMENT;
      default: throw new IllegalArgumentException("Unknown field type: " + s);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FieldType other)) return false;
    return kind == other.kind && Objects.equals(element, other.element);
  }

  @Override
  public int hashCode() { return Objects.hash(kind, element); }

  @Override
  public String toString() { return id(); }
}
