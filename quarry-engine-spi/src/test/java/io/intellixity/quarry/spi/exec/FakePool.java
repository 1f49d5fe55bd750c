package io.intellixity.quarry.spi.exec;

import java.util.*;

/** Counts leases and serves each artifact's rows from memory; failures can be injected. */
final class FakePool implements ConnectionPool<FakeArtifact> {
  int acquired;
  int released;
  RuntimeException acquireFailure;
  RuntimeException runFailure;
  int readFailureAt = -1;
  final List<FakeCursor> cursors = new ArrayList<>();

  @Override
  public Connection<FakeArtifact> acquire() {
    if (acquireFailure != null) throw acquireFailure;
    acquired++;
    return artifact -> {
      if (runFailure != null) throw runFailure;
      FakeCursor c = new FakeCursor(artifact.rows(), readFailureAt);
      cursors.add(c);
      return c;
    };
  }

  @Override
  public void release(Connection<FakeArtifact> connection) {
    released++;
  }

  FakeCursor lastCursor() { return cursors.get(cursors.size() - 1); }

  static final class FakeCursor implements RawCursor {
    private final List<Map<String, Object>> rows;
    private final int failAt;
    private int position;
    boolean closed;

    FakeCursor(List<Map<String, Object>> rows, int failAt) {
      this.rows = rows;
      this.failAt = failAt;
    }

    @Override
    public boolean hasNext() {
      if (position == failAt) throw new IllegalStateException("connection reset");
      return position < rows.size();
    }

    @Override
    public Map<String, Object> next() {
      if (position >= rows.size()) throw new NoSuchElementException();
      return rows.get(position++);
    }

    int fetched() { return position; }

    @Override
    public void close() { closed = true; }
  }
}
