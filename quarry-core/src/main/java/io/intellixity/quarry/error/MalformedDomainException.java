package io.intellixity.quarry.error;

/** Raised when a domain expression has a bad shape (starved combinator, leftover expressions, bad leaf). */
public final class MalformedDomainException extends QueryEngineException {
  public MalformedDomainException(String message) {
    super(message);
  }
}
