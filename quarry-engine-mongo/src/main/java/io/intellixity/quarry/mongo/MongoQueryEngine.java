package io.intellixity.quarry.mongo;

import io.intellixity.quarry.query.QuerySpecification;
import io.intellixity.quarry.spi.compile.QueryCompiler;
import io.intellixity.quarry.spi.exec.AbstractQueryEngine;
import io.intellixity.quarry.spi.exec.ConnectionPool;

import java.util.Objects;

/**
 * MongoDB query engine: {@code engine.query(model).filter(...).orderBy(...).limit(...).toList()}.
 */
public final class MongoQueryEngine extends AbstractQueryEngine<MongoStatement> {
  private final ConnectionPool<MongoStatement> pool;
  private final MongoExecutionOptions options;

  public MongoQueryEngine(MongoHandle handle) {
    this(handle, MongoExecutionOptions.defaults());
  }

  public MongoQueryEngine(MongoHandle handle, MongoExecutionOptions options) {
    this(new MongoClientConnectionPool(handle), options);
  }

  public MongoQueryEngine(ConnectionPool<MongoStatement> pool, MongoExecutionOptions options) {
    this(new MongoQueryCompiler(), pool, options);
  }

  public MongoQueryEngine(QueryCompiler<MongoStatement> compiler, ConnectionPool<MongoStatement> pool,
                          MongoExecutionOptions options) {
    super(compiler, pool);
    this.pool = pool;
    this.options = options == null ? MongoExecutionOptions.defaults() : options;
  }

  public MongoExecutionOptions options() { return options; }

  /**
   * Same compiler and pool, different execution options; e.g.
   * {@code engine.withOptions(engine.options().withHint("status_1")).query(model)...}.
   */
  public MongoQueryEngine withOptions(MongoExecutionOptions options) {
    return new MongoQueryEngine(compiler(), pool, options);
  }

  @Override
  protected MongoStatement finalizeArtifact(MongoStatement compiled, QuerySpecification spec) {
    return Objects.equals(compiled.options(), options) ? compiled : compiled.withOptions(options);
  }
}
