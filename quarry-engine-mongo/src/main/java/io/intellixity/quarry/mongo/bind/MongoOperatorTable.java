package io.intellixity.quarry.mongo.bind;

import io.intellixity.quarry.domain.DomainNormalizer;
import io.intellixity.quarry.domain.Operator;
import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.error.QueryEngineException;
import io.intellixity.quarry.error.UnsupportedOperatorException;
import io.intellixity.quarry.mapping.Coercions;
import io.intellixity.quarry.model.FieldType;
import io.intellixity.quarry.spi.compile.OperatorTable;

import java.util.*;

/** Operator tokens and value codecs for MongoDB (backend id {@code mongo}). */
public final class MongoOperatorTable implements OperatorTable {
  public static final String BACKEND_ID = "mongo";

  private static final Map<Operator, String> TOKENS = tokens();

  private final Map<FieldType.Kind, MongoValueCodec> codecs;

  public MongoOperatorTable() {
    this(MongoValueCodecs.defaults());
  }

  public MongoOperatorTable(Map<FieldType.Kind, MongoValueCodec> codecs) {
    Map<FieldType.Kind, MongoValueCodec> m = new EnumMap<>(FieldType.Kind.class);
    m.putAll(codecs);
    for (FieldType.Kind k : FieldType.Kind.values()) {
      if (k != FieldType.Kind.LIST && !m.containsKey(k)) {
        throw new IllegalArgumentException("No Mongo codec for field kind " + k);
      }
    }
    this.codecs = Collections.unmodifiableMap(m);
  }

  private static Map<Operator, String> tokens() {
    Map<Operator, String> m = new EnumMap<>(Operator.class);
    m.put(Operator.EQ, "$eq");
    m.put(Operator.NEQ, "$ne");
    m.put(Operator.GT, "$gt");
    m.put(Operator.GTE, "$gte");
    m.put(Operator.LT, "$lt");
    m.put(Operator.LTE, "$lte");
    m.put(Operator.IN, "$in");
    m.put(Operator.NOT_IN, "$nin");
    m.put(Operator.LIKE, "$regex");
    m.put(Operator.ILIKE, "$regex");
    m.put(Operator.NOT_LIKE, "$not");
    m.put(Operator.NOT_ILIKE, "$not");
    m.put(Operator.IS_NULL, "$eq");
    m.put(Operator.IS_NOT_NULL, "$ne");
    for (Operator op : Operator.values()) {
      if (!m.containsKey(op)) throw new IllegalStateException("No Mongo token for operator " + op);
    }
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String backendId() { return BACKEND_ID; }

  @Override
  public String nativeToken(Operator op) { return TOKENS.get(Objects.requireNonNull(op, "op")); }

  @Override
  public void checkApplicable(Operator op, FieldType type, String field) {
    FieldType.Kind k = type.kind();
    boolean ok;
    if (op.isPattern()) {
      ok = k == FieldType.Kind.TEXT || (k == FieldType.Kind.LIST && type.element().kind() == FieldType.Kind.TEXT);
    } else if (op.isOrdering()) {
      ok = k != FieldType.Kind.BOOLEAN && k != FieldType.Kind.DOCUMENT && k != FieldType.Kind.LIST;
    } else if (k == FieldType.Kind.DOCUMENT) {
      ok = op == Operator.EQ || op == Operator.NEQ || op == Operator.IS_NULL || op == Operator.IS_NOT_NULL;
    } else {
      ok = true;
    }
    if (!ok) throw new UnsupportedOperatorException(op, type, field);
  }

  @Override
  public Object coerceOperandValue(Operator op, FieldType type, Object value) {
    switch (op.shape()) {
      case NONE:
        return null;
      case LIST: {
        FieldType element = type.isList() ? type.element() : type;
        List<Object> out = new ArrayList<>();
        for (Object v : DomainNormalizer.listValue(value)) out.add(coerceForCompile(element, v));
        return out;
      }
      default:
        if (op.isPattern()) return value;
        if (type.isList() && !(value instanceof Collection<?>) && (value == null || !value.getClass().isArray())) {
          return coerceForCompile(type.element(), value);
        }
        return coerceForCompile(type, value);
    }
  }

  private Object coerceForCompile(FieldType type, Object value) {
    try {
      return coerce(type, value);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CompilationException("Value " + value + " cannot be used as " + type + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Object coerce(FieldType type, Object value) {
    if (value == null) return null;
    if (type.isList()) {
      List<Object> out = new ArrayList<>();
      for (Object v : Coercions.iterable(value)) out.add(coerce(type.element(), v));
      return out;
    }
    return codecs.get(type.kind()).coerce(value);
  }

  @Override
  public Object decoerce(FieldType type, Object raw) {
    if (raw == null) return null;
    try {
      if (type.isList()) {
        if (!(raw instanceof Collection<?>) && !(raw instanceof Object[])) {
          throw new MappingException(null, "Expected a list for " + type + " but got " + raw.getClass().getSimpleName());
        }
        return Coercions.toList(Coercions.iterable(raw), x -> decoerce(type.element(), x));
      }
      return codecs.get(type.kind()).decoerce(raw);
    } catch (MappingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new MappingException(null, -1, "Cannot map " + raw.getClass().getSimpleName() + " to " + type + ": " + e.getMessage(), e);
    }
  }
}
