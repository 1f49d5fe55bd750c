package io.intellixity.quarry.error;

public final class InvalidRangeException extends QueryEngineException {
  public InvalidRangeException(String message) {
    super(message);
  }
}
