package io.intellixity.quarry.mapping;

import java.util.*;

/** One result row: logical field name to decoded value, in output-field order. Immutable. */
public final class TypedRecord {
  private final Map<String, Object> values;

  private TypedRecord(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public static TypedRecord of(Map<String, ?> values) {
    return new TypedRecord(new LinkedHashMap<>(values));
  }

  public Object get(String field) { return values.get(field); }

  public <T> T get(String field, Class<T> type) {
    Object v = values.get(field);
    if (v == null) return null;
    if (!type.isInstance(v)) {
      throw new ClassCastException("Field '" + field + "' holds " + v.getClass().getName() + ", not " + type.getName());
    }
    return type.cast(v);
  }

  public boolean has(String field) { return values.containsKey(field); }
  public Set<String> fields() { return values.keySet(); }
  public Map<String, Object> asMap() { return values; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof TypedRecord r && values.equals(r.values);
  }

  @Override
  public int hashCode() { return values.hashCode(); }

  @Override
  public String toString() { return "TypedRecord" + values; }
}
