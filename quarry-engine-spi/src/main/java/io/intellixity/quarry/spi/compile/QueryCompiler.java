package io.intellixity.quarry.spi.compile;

import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.model.FieldLookup;
import io.intellixity.quarry.query.QuerySpecification;

/**
 * Compiles a {@link QuerySpecification} into a backend artifact.
 * <p>
 * Implementations are pure and deterministic: the same specification and model always produce equal
 * artifacts. They are listed in {@code META-INF/quarry.factories} and resolved through {@link QueryCompilers}.
 */
public interface QueryCompiler<A extends CompiledArtifact> {
  String backendId();

  OperatorTable operators();

  /** @throws CompilationException when the specification refers to unknown fields or is inconsistent */
  A compile(QuerySpecification spec, FieldLookup model);
}
