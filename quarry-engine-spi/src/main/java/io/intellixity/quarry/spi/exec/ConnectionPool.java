package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.spi.compile.CompiledArtifact;

/**
 * Externally supplied source of connections. The executor calls {@link #release} exactly once for every
 * successful {@link #acquire}.
 */
public interface ConnectionPool<A extends CompiledArtifact> {
  Connection<A> acquire();

  void release(Connection<A> connection);
}
