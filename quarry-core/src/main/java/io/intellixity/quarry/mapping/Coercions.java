package io.intellixity.quarry.mapping;

import java.util.*;
import java.util.function.*;

public final class Coercions {
  private Coercions() {}

  public static <T> List<T> toList(Iterable<?> raw, Function<Object, T> decode) {
    if (raw == null) return null;
    List<T> out = new ArrayList<>();
    for (Object o : raw) out.add(decode.apply(o));
    return Collections.unmodifiableList(out);
  }

  @SuppressWarnings("unchecked")
  public static <V> Map<String, V> toMap(Object raw, Function<Object, V> dv) {
    if (raw == null) return null;
    if (raw instanceof Map<?, ?> m) {
      Map<String, V> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) out.put(String.valueOf(e.getKey()), dv.apply(e.getValue()));
      return Collections.unmodifiableMap(out);
    }
    throw new IllegalArgumentException("Expected map but got: " + raw.getClass());
  }

  /** Iterates a collection or array value. */
  public static Iterable<?> iterable(Object raw) {
    if (raw instanceof Iterable<?> it) return it;
    if (raw instanceof Object[] a) return Arrays.asList(a);
    throw new IllegalArgumentException("Expected a list but got: " + (raw == null ? "null" : raw.getClass().getName()));
  }
}
