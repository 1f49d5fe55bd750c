package io.intellixity.quarry.mapping;

import java.util.Map;

/** Read access to one raw backend row by (possibly dotted) storage path. */
public interface RowAdapter {
  /** True when the path exists in the row, even if it holds null. */
  boolean has(String path);

  Object raw(String path);

  default boolean isNull(String path) { return raw(path) == null; }

  RowAdapter object(String path);
  Iterable<Object> arrayRaw(String path);
  Map<String, Object> map(String path);
}
