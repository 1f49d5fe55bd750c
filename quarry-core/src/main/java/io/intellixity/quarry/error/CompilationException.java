package io.intellixity.quarry.error;

/** Raised when a query or one of its operations is internally inconsistent (unknown field, bad window frame...). */
public final class CompilationException extends QueryEngineException {
  public CompilationException(String message) {
    super(message);
  }

  public CompilationException(String message, Throwable cause) {
    super(message, cause);
  }
}
