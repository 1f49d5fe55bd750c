package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.error.QueryEngineException;
import io.intellixity.quarry.error.QueryExecutionException;
import io.intellixity.quarry.spi.compile.CompiledArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs compiled artifacts on connections leased from a {@link ConnectionPool}.
 *
 * <p>A connection is acquired per {@code execute} call and released exactly once when the returned
 * {@link ResultStream} is exhausted, closed, or fails. Artifacts that report {@link CompiledArtifact#emptyResult()}
 * never touch the pool. Backend failures are not retried.</p>
 */
public final class PooledQueryExecutor<A extends CompiledArtifact> {
  private static final Logger log = LoggerFactory.getLogger(PooledQueryExecutor.class);

  private final ConnectionPool<A> pool;

  public PooledQueryExecutor(ConnectionPool<A> pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  public ResultStream<Map<String, Object>> execute(A artifact) {
    return execute(artifact, raw -> raw);
  }

  public <T> ResultStream<T> execute(A artifact, Function<Map<String, Object>, T> mapper) {
    Objects.requireNonNull(artifact, "artifact");
    Objects.requireNonNull(mapper, "mapper");
    if (artifact.emptyResult()) {
      if (log.isDebugEnabled()) {
        log.debug("quarry.exec op=skip collection={} reason=emptyResult", artifact.collection());
      }
      return ResultStream.empty();
    }

    Connection<A> connection;
    try {
      connection = pool.acquire();
    } catch (RuntimeException e) {
      throw translate("Failed to acquire connection for " + artifact.collection(), e);
    }
    if (connection == null) {
      throw new QueryExecutionException("Connection pool returned no connection for " + artifact.collection(), null, null);
    }

    long started = System.nanoTime();
    AtomicBoolean released = new AtomicBoolean();
    Runnable release = () -> {
      if (released.compareAndSet(false, true)) {
        pool.release(connection);
        if (log.isDebugEnabled()) {
          log.debug("quarry.exec_done collection={} durationMs={}", artifact.collection(),
              (System.nanoTime() - started) / 1_000_000.0);
        }
      }
    };

    if (log.isDebugEnabled()) {
      log.debug("quarry.exec op=execute collection={} artifact={}", artifact.collection(), artifact.getClass().getSimpleName());
    }
    RawCursor cursor;
    try {
      cursor = connection.run(artifact);
    } catch (RuntimeException e) {
      release.run();
      throw translate("Failed to execute query on " + artifact.collection(), e);
    }
    return new ResultStream<>(cursor, mapper, release);
  }

  private static QueryEngineException translate(String message, RuntimeException e) {
    if (e instanceof QueryEngineException qe) return qe;
    return new QueryExecutionException(message + ": " + e.getMessage(), null, e);
  }
}
