package io.intellixity.quarry.spi.compile;

/** Backend-native, immutable form of a query. Produced by a {@link QueryCompiler}, never mutated afterwards. */
public interface CompiledArtifact {
  /** Collection the artifact runs against. */
  String collection();

  /** True when the artifact can yield no rows (limit 0); executors skip the backend entirely. */
  boolean emptyResult();
}
