package io.intellixity.quarry.error;

/**
 * Wraps a backend failure raised while running a compiled artifact. Not retried by the engine.
 */
public final class QueryExecutionException extends QueryEngineException {
  private final String nativeCode;

  public QueryExecutionException(String message, String nativeCode, Throwable cause) {
    super(message, cause);
    this.nativeCode = nativeCode;
  }

  /** Backend error code (e.g. Mongo server error code), or null when the backend reported none. */
  public String nativeCode() { return nativeCode; }
}
