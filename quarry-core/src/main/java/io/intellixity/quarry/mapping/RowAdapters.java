package io.intellixity.quarry.mapping;

import java.util.*;

public final class RowAdapters {
  private RowAdapters() {}

  public static RowAdapter fromMap(Map<String, Object> map) {
    return new MapRowAdapter(map);
  }

  @SuppressWarnings("unchecked")
  public static RowAdapter fromObject(Object raw) {
    if (raw == null) return null;
    if (raw instanceof Map<?, ?> m) return fromMap((Map<String, Object>) m);
    throw new IllegalArgumentException("Expected Map for nested object but got: " + raw.getClass());
  }

  static Object getByPath(Map<String, Object> root, String path) {
    if (path == null || path.isBlank()) return root;
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }

  static boolean hasPath(Map<String, Object> root, String path) {
    if (path == null || path.isBlank()) return true;
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m) || !m.containsKey(p)) return false;
      cur = m.get(p);
    }
    return true;
  }

  static final class MapRowAdapter implements RowAdapter {
    private final Map<String, Object> root;

    MapRowAdapter(Map<String, Object> root) {
      this.root = Objects.requireNonNull(root, "root");
    }

    @Override public boolean has(String path) { return hasPath(root, path); }
    @Override public Object raw(String path) { return getByPath(root, path); }

    @Override
    public RowAdapter object(String path) {
      Object v = raw(path);
      @SuppressWarnings("unchecked")
      Map<String, Object> m = (v instanceof Map<?, ?> mm) ? (Map<String, Object>) mm : null;
      return m == null ? null : new MapRowAdapter(m);
    }

    @SuppressWarnings("unchecked")
    @Override
    public Iterable<Object> arrayRaw(String path) {
      Object v = raw(path);
      if (v == null) return null;
      if (v instanceof List<?> l) return (List<Object>) l;
      if (v instanceof Object[] a) return Arrays.asList(a);
      throw new IllegalArgumentException("Not an array: " + v.getClass());
    }

    @SuppressWarnings("unchecked")
    @Override
    public Map<String, Object> map(String path) {
      Object v = raw(path);
      if (v == null) return null;
      if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
      throw new IllegalArgumentException("Not a map: " + v.getClass());
    }
  }
}
