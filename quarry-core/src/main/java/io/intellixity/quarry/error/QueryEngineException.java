package io.intellixity.quarry.error;

/**
 * Base of every failure raised by the query engine.
 * <p>
 * Unchecked: compile-time failures surface from {@code build()}/{@code end()}/{@code compile()} before any I/O,
 * execution and mapping failures surface while the result stream is consumed.
 */
public abstract class QueryEngineException extends RuntimeException {
  protected QueryEngineException(String message) {
    super(message);
  }

  protected QueryEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
