package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.mapping.TypedRecord;
import io.intellixity.quarry.model.EntityModel;
import io.intellixity.quarry.model.FieldLookup;
import io.intellixity.quarry.query.QuerySpecification;
import io.intellixity.quarry.spi.compile.CompiledArtifact;
import io.intellixity.quarry.spi.compile.OutputFields;
import io.intellixity.quarry.spi.compile.QueryCompiler;
import io.intellixity.quarry.spi.mapping.ResultMapper;

import java.util.Map;
import java.util.Objects;

/**
 * Template-method orchestrator for reads.
 *
 * <p>Compile ({@link QueryCompiler}), let the backend adjust the artifact ({@link #finalizeArtifact}), run it
 * on a pooled connection ({@link PooledQueryExecutor}) and map rows ({@link ResultMapper}).</p>
 */
public abstract class AbstractQueryEngine<A extends CompiledArtifact> {
  private final QueryCompiler<A> compiler;
  private final PooledQueryExecutor<A> executor;

  protected AbstractQueryEngine(QueryCompiler<A> compiler, ConnectionPool<A> pool) {
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.executor = new PooledQueryExecutor<>(Objects.requireNonNull(pool, "pool"));
  }

  /** Starts a fluent query over {@code model}'s collection. */
  public ExecutableQuery<A> query(EntityModel model) {
    return new ExecutableQuery<>(this, model);
  }

  public final A compile(QuerySpecification spec, FieldLookup model) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(model, "model");
    return finalizeArtifact(compiler.compile(spec, model), spec);
  }

  /** Backend hook applied to every freshly compiled artifact, e.g. to attach execution options. */
  protected A finalizeArtifact(A compiled, QuerySpecification spec) {
    return compiled;
  }

  public final ResultStream<TypedRecord> execute(QuerySpecification spec, FieldLookup model) {
    return execute(compile(spec, model), spec, model);
  }

  /** Runs an artifact previously compiled from {@code spec}. */
  public final ResultStream<TypedRecord> execute(A artifact, QuerySpecification spec, FieldLookup model) {
    ResultMapper mapper = new ResultMapper(OutputFields.resolve(spec, model), compiler.operators());
    return executor.execute(artifact, mapper);
  }

  /** Runs an artifact and hands back raw backend documents. */
  public final ResultStream<Map<String, Object>> executeRaw(A artifact) {
    return executor.execute(artifact);
  }

  protected final QueryCompiler<A> compiler() { return compiler; }
  protected final PooledQueryExecutor<A> executor() { return executor; }
}
