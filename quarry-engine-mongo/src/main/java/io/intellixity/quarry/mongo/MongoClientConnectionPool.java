package io.intellixity.quarry.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import io.intellixity.quarry.error.QueryExecutionException;
import io.intellixity.quarry.spi.exec.Connection;
import io.intellixity.quarry.spi.exec.ConnectionPool;
import io.intellixity.quarry.spi.exec.RawCursor;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConnectionPool} over the MongoDB sync driver. The driver pools sockets itself, so a lease is a
 * lightweight view of the handle's database; the pool only tracks how many leases are open.
 */
public final class MongoClientConnectionPool implements ConnectionPool<MongoStatement> {
  private static final Logger log = LoggerFactory.getLogger(MongoClientConnectionPool.class);

  private final MongoHandle handle;
  private final AtomicInteger leased = new AtomicInteger();

  public MongoClientConnectionPool(MongoHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  @Override
  public Connection<MongoStatement> acquire() {
    leased.incrementAndGet();
    return new MongoClientConnection(handle);
  }

  @Override
  public void release(Connection<MongoStatement> connection) {
    leased.decrementAndGet();
  }

  /** Leases not yet released. */
  public int leased() { return leased.get(); }

  static final class MongoClientConnection implements Connection<MongoStatement> {
    private final MongoHandle handle;

    MongoClientConnection(MongoHandle handle) {
      this.handle = handle;
    }

    @Override
    public RawCursor run(MongoStatement st) {
      debug(st);
      try {
        MongoCollection<Document> col = handle.db().getCollection(st.collection());
        MongoCursor<Document> cursor = st.kind() == MongoStatement.Kind.AGGREGATE
            ? configure(col.aggregate(st.pipeline()), st.options()).cursor()
            : configure(col.find(st.filter()), st).cursor();
        return new DriverCursor(cursor);
      } catch (MongoException e) {
        throw translate(e);
      }
    }

    static FindIterable<Document> configure(FindIterable<Document> find, MongoStatement st) {
      if (st.projection() != null) find = find.projection(st.projection());
      if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
      if (st.skip() != null) find = find.skip(st.skip());
      if (st.limit() != null) find = find.limit(st.limit());
      MongoExecutionOptions opts = st.options();
      if (opts.batchSize() != null) find = find.batchSize(opts.batchSize());
      if (opts.hintName() != null) find = find.hintString(opts.hintName());
      if (opts.hintKeys() != null) find = find.hint(opts.hintKeys());
      return find;
    }

    static AggregateIterable<Document> configure(AggregateIterable<Document> agg, MongoExecutionOptions opts) {
      if (opts.allowDiskUse() != null) agg = agg.allowDiskUse(opts.allowDiskUse());
      if (opts.batchSize() != null) agg = agg.batchSize(opts.batchSize());
      if (opts.hintName() != null) agg = agg.hintString(opts.hintName());
      if (opts.hintKeys() != null) agg = agg.hint(opts.hintKeys());
      return agg;
    }

    private void debug(MongoStatement st) {
      if (!log.isDebugEnabled()) return;
      MongoExecutionOptions opts = st.options();
      log.debug("quarry.mongo op={} handleId={} database={} collection={} stages={} skip={} limit={} hint={}",
          st.kind() == MongoStatement.Kind.AGGREGATE ? "aggregate" : "find",
          handle.id(), handle.database(), st.collection(),
          st.pipeline().size(), st.skip(), st.limit(),
          opts.hintName() != null ? opts.hintName() : opts.hintKeys());
      if (log.isTraceEnabled()) log.trace("quarry.mongo statement={}", st.toJson());
    }
  }

  static final class DriverCursor implements RawCursor {
    private final MongoCursor<Document> cursor;

    DriverCursor(MongoCursor<Document> cursor) {
      this.cursor = cursor;
    }

    @Override
    public boolean hasNext() {
      try {
        return cursor.hasNext();
      } catch (MongoException e) {
        throw translate(e);
      }
    }

    @Override
    public Map<String, Object> next() {
      try {
        return cursor.next();
      } catch (MongoException e) {
        throw translate(e);
      }
    }

    @Override
    public void close() {
      cursor.close();
    }
  }

  static QueryExecutionException translate(MongoException e) {
    return new QueryExecutionException("Mongo error " + e.getCode() + ": " + e.getMessage(), String.valueOf(e.getCode()), e);
  }
}
