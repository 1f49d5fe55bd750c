package io.intellixity.quarry.spi.compile;

import io.intellixity.quarry.util.QuarryFactoriesLoader;

import java.util.*;

/** Compilers discovered via {@code META-INF/quarry.factories}, keyed by backend id. */
public final class QueryCompilers {
  private final Map<String, QueryCompiler<?>> byBackend;

  public QueryCompilers() {
    this(discover());
  }

  public QueryCompilers(Collection<? extends QueryCompiler<?>> compilers) {
    Map<String, QueryCompiler<?>> m = new LinkedHashMap<>();
    for (QueryCompiler<?> c : compilers) {
      if (c == null) continue;
      m.putIfAbsent(c.backendId(), c);
    }
    this.byBackend = Collections.unmodifiableMap(m);
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static List<QueryCompiler<?>> discover() {
    List raw = QuarryFactoriesLoader.load(QueryCompiler.class);
    return (List<QueryCompiler<?>>) raw;
  }

  public Set<String> backends() { return byBackend.keySet(); }

  public QueryCompiler<?> get(String backendId) {
    QueryCompiler<?> c = byBackend.get(backendId);
    if (c == null) {
      throw new IllegalArgumentException("No query compiler for backend '" + backendId + "'; available: " + byBackend.keySet());
    }
    return c;
  }

  /** Typed lookup for callers that know the backend's artifact type. */
  public <A extends CompiledArtifact> QueryCompiler<A> get(String backendId, Class<A> artifactType) {
    @SuppressWarnings("unchecked")
    QueryCompiler<A> c = (QueryCompiler<A>) get(backendId);
    return c;
  }
}
