package io.intellixity.quarry.error;

/** Raised when a raw backend value cannot be converted to the declared field type. */
public final class MappingException extends QueryEngineException {
  private final String field;
  private final long rowIndex;

  public MappingException(String field, String message) {
    this(field, -1, message, null);
  }

  public MappingException(String field, long rowIndex, String message, Throwable cause) {
    super(message, cause);
    this.field = field;
    this.rowIndex = rowIndex;
  }

  public String field() { return field; }

  /** Zero-based index of the failing row in its result stream, or -1 when raised outside a stream. */
  public long rowIndex() { return rowIndex; }

  public MappingException atRow(long index) {
    return new MappingException(field, index, "Row " + index + ": " + getMessage(), this);
  }
}
