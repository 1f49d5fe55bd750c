package io.intellixity.quarry.error;

import io.intellixity.quarry.domain.Operator;
import io.intellixity.quarry.model.FieldType;

/** Raised when an operator is applied to a field type it cannot apply to (e.g. LIKE on a number). */
public final class UnsupportedOperatorException extends QueryEngineException {
  private final Operator operator;
  private final FieldType fieldType;

  public UnsupportedOperatorException(Operator operator, FieldType fieldType, String field) {
    super("Operator " + operator + " is not supported for field '" + field + "' of type " + fieldType);
    this.operator = operator;
    this.fieldType = fieldType;
  }

  public Operator operator() { return operator; }
  public FieldType fieldType() { return fieldType; }
}
