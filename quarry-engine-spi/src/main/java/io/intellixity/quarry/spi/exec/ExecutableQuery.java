package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.mapping.TypedRecord;
import io.intellixity.quarry.model.EntityModel;
import io.intellixity.quarry.query.AbstractQueryBuilder;
import io.intellixity.quarry.query.QuerySpecification;
import io.intellixity.quarry.spi.compile.CompiledArtifact;

import java.util.List;
import java.util.Objects;

/**
 * Fluent query bound to an engine and a model.
 * <p>
 * The compiled artifact is cached and discarded by every builder call, so {@link #compile()} always
 * reflects the current state.
 */
public final class ExecutableQuery<A extends CompiledArtifact> extends AbstractQueryBuilder<ExecutableQuery<A>> {
  private final AbstractQueryEngine<A> engine;
  private final EntityModel model;
  private QuerySpecification compiledSpec;
  private A compiled;

  ExecutableQuery(AbstractQueryEngine<A> engine, EntityModel model) {
    super(Objects.requireNonNull(model, "model").collection());
    this.engine = Objects.requireNonNull(engine, "engine");
    this.model = model;
  }

  @Override
  protected ExecutableQuery<A> self() { return this; }

  @Override
  protected void changed() {
    compiled = null;
    compiledSpec = null;
  }

  public EntityModel model() { return model; }

  public A compile() {
    if (compiled == null) {
      QuerySpecification spec = build();
      compiled = engine.compile(spec, model);
      compiledSpec = spec;
    }
    return compiled;
  }

  public ResultStream<TypedRecord> execute() {
    A artifact = compile();
    return engine.execute(artifact, compiledSpec, model);
  }

  public List<TypedRecord> toList() {
    return execute().toList();
  }
}
