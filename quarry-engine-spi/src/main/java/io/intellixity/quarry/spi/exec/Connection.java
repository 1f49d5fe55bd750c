package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.error.QueryExecutionException;
import io.intellixity.quarry.spi.compile.CompiledArtifact;

/** A backend connection leased from a {@link ConnectionPool}. */
public interface Connection<A extends CompiledArtifact> {
  /**
   * Starts running {@code artifact}; documents are fetched as the cursor is consumed.
   *
   * @throws QueryExecutionException when the backend rejects the artifact
   */
  RawCursor run(A artifact);
}
