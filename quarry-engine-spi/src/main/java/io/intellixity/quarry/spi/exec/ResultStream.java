package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.error.QueryEngineException;
import io.intellixity.quarry.error.QueryExecutionException;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass sequence of result rows backed by an open cursor.
 *
 * <p>Rows are mapped one at a time as they are pulled. The stream closes itself when exhausted or when a
 * row fails; {@link #close()} cancels it early. In every case the cursor is closed and the connection
 * released exactly once. Use try-with-resources or {@link #stream()} inside try-with-resources.</p>
 */
public final class ResultStream<T> implements Iterator<T>, AutoCloseable {
  private final RawCursor cursor;
  private final Function<Map<String, Object>, T> mapper;
  private final Runnable onClose;
  private long index;
  private boolean closed;

  ResultStream(RawCursor cursor, Function<Map<String, Object>, T> mapper, Runnable onClose) {
    this.cursor = Objects.requireNonNull(cursor, "cursor");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.onClose = onClose == null ? () -> {} : onClose;
  }

  /** A stream that yields nothing and holds no resources. */
  public static <T> ResultStream<T> empty() {
    ResultStream<T> s = new ResultStream<>(EmptyCursor.INSTANCE, raw -> null, null);
    s.closed = true;
    return s;
  }

  @Override
  public boolean hasNext() {
    if (closed) return false;
    boolean more;
    try {
      more = cursor.hasNext();
    } catch (RuntimeException e) {
      throw fail(e);
    }
    if (!more) close();
    return more;
  }

  @Override
  public T next() {
    if (!hasNext()) throw new NoSuchElementException();
    Map<String, Object> raw;
    try {
      raw = cursor.next();
    } catch (RuntimeException e) {
      throw fail(e);
    }
    long row = index++;
    try {
      return mapper.apply(raw);
    } catch (MappingException e) {
      close();
      throw e.atRow(row);
    } catch (RuntimeException e) {
      close();
      throw new MappingException(null, row, "Row " + row + ": " + e.getMessage(), e);
    }
  }

  /** Number of rows handed out so far. */
  public long rowsRead() { return index; }

  public boolean isClosed() { return closed; }

  @Override
  public void close() {
    if (closed) return;
    closed = true;
    try {
      cursor.close();
    } finally {
      onClose.run();
    }
  }

  /** Sequential stream over the remaining rows; closing it closes this result stream. */
  public Stream<T> stream() {
    Spliterator<T> sp = Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(sp, false).onClose(this::close);
  }

  /** Drains all remaining rows; on failure nothing is returned and the stream is closed. */
  public List<T> toList() {
    try (ResultStream<T> self = this) {
      List<T> out = new ArrayList<>();
      while (self.hasNext()) out.add(self.next());
      return out;
    }
  }

  private RuntimeException fail(RuntimeException e) {
    close();
    if (e instanceof QueryEngineException qe) return qe;
    return new QueryExecutionException("Failed to read from cursor: " + e.getMessage(), null, e);
  }

  private static final class EmptyCursor implements RawCursor {
    static final EmptyCursor INSTANCE = new EmptyCursor();

    @Override public boolean hasNext() { return false; }
    @Override public Map<String, Object> next() { throw new NoSuchElementException(); }
    @Override public void close() {}
  }
}
