package io.intellixity.quarry.spi.exec;

import java.util.Iterator;
import java.util.Map;

/** Lazily fetched raw documents from one native query run. Closing stops the fetch. */
public interface RawCursor extends Iterator<Map<String, Object>>, AutoCloseable {
  @Override
  void close();
}
