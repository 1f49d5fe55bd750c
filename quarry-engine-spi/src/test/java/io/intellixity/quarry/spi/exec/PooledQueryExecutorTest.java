package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.error.QueryExecutionException;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class PooledQueryExecutorTest {
  private static final List<Map<String, Object>> ROWS = List.of(
      Map.of("n", 1), Map.of("n", 2), Map.of("n", 3));

  private final FakePool pool = new FakePool();
  private final PooledQueryExecutor<FakeArtifact> executor = new PooledQueryExecutor<>(pool);

  @Test
  void exhaustion_releasesOnce() {
    ResultStream<Map<String, Object>> rs = executor.execute(FakeArtifact.of("t", ROWS));
    assertEquals(ROWS, rs.toList());
    rs.close();
    assertEquals(1, pool.acquired);
    assertEquals(1, pool.released);
    assertTrue(pool.lastCursor().closed);
    assertEquals(3, rs.rowsRead());
  }

  @Test
  void earlyClose_releasesOnce_andStopsFetching() {
    ResultStream<Map<String, Object>> rs = executor.execute(FakeArtifact.of("t", ROWS));
    assertEquals(Map.of("n", 1), rs.next());
    rs.close();
    rs.close();
    assertFalse(rs.hasNext());
    assertTrue(rs.isClosed());
    assertEquals(1, pool.released);
    assertEquals(1, pool.lastCursor().fetched());
  }

  @Test
  void emptyResult_neverTouchesPool() {
    ResultStream<Map<String, Object>> rs = executor.execute(new FakeArtifact("t", ROWS, true));
    assertFalse(rs.hasNext());
    assertTrue(rs.toList().isEmpty());
    assertEquals(0, pool.acquired);
    assertEquals(0, pool.released);
  }

  @Test
  void runFailure_isWrapped_andReleased() {
    pool.runFailure = new IllegalStateException("unknown operator $foo");
    QueryExecutionException e = assertThrows(QueryExecutionException.class,
        () -> executor.execute(FakeArtifact.of("t", ROWS)));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals(1, pool.acquired);
    assertEquals(1, pool.released);
  }

  @Test
  void runFailure_keepsBackendException() {
    QueryExecutionException native_ = new QueryExecutionException("bad query", "2", null);
    pool.runFailure = native_;
    QueryExecutionException e = assertThrows(QueryExecutionException.class,
        () -> executor.execute(FakeArtifact.of("t", ROWS)));
    assertSame(native_, e);
    assertEquals("2", e.nativeCode());
    assertEquals(1, pool.released);
  }

  @Test
  void acquireFailure_releasesNothing() {
    pool.acquireFailure = new IllegalStateException("pool exhausted");
    assertThrows(QueryExecutionException.class, () -> executor.execute(FakeArtifact.of("t", ROWS)));
    assertEquals(0, pool.released);
  }

  @Test
  void mappingFailure_carriesRowIndex_afterEarlierRows() {
    ResultStream<Integer> rs = executor.execute(FakeArtifact.of("t", ROWS), raw -> {
      int n = (Integer) raw.get("n");
      if (n == 3) throw new MappingException("n", "cannot map 3");
      return n;
    });
    assertEquals(1, rs.next());
    assertEquals(2, rs.next());
    MappingException e = assertThrows(MappingException.class, rs::next);
    assertEquals(2, e.rowIndex());
    assertEquals("n", e.field());
    assertTrue(rs.isClosed());
    assertFalse(rs.hasNext());
    assertEquals(1, pool.released);
  }

  @Test
  void mapperRuntimeFailure_becomesMappingException() {
    ResultStream<Object> rs = executor.execute(FakeArtifact.of("t", ROWS), raw -> {
      throw new IllegalArgumentException("boom");
    });
    MappingException e = assertThrows(MappingException.class, rs::toList);
    assertEquals(0, e.rowIndex());
    assertInstanceOf(IllegalArgumentException.class, e.getCause());
    assertEquals(1, pool.released);
  }

  @Test
  void readFailure_midStream_isWrapped_andReleased() {
    pool.readFailureAt = 1;
    ResultStream<Map<String, Object>> rs = executor.execute(FakeArtifact.of("t", ROWS));
    assertEquals(Map.of("n", 1), rs.next());
    assertThrows(QueryExecutionException.class, rs::hasNext);
    assertTrue(pool.lastCursor().closed);
    assertEquals(1, pool.released);
  }

  @Test
  void javaStream_closeReleases() {
    ResultStream<Map<String, Object>> rs = executor.execute(FakeArtifact.of("t", ROWS));
    List<Object> first;
    try (Stream<Map<String, Object>> s = rs.stream()) {
      first = s.limit(1).map(m -> m.get("n")).collect(Collectors.toList());
    }
    assertEquals(List.of(1), first);
    assertEquals(1, pool.released);
  }

  @Test
  void cancellation_doesNotMapUnreadRows() {
    List<Object> seen = new ArrayList<>();
    ResultStream<Object> rs = executor.execute(FakeArtifact.of("t", ROWS), raw -> {
      seen.add(raw.get("n"));
      if ((Integer) raw.get("n") > 1) throw new MappingException("n", "never reached");
      return raw.get("n");
    });
    assertEquals(1, rs.next());
    rs.close();
    assertEquals(List.of(1), seen);
    assertEquals(1, pool.released);
  }
}
