package io.intellixity.quarry.spi.compile;

import io.intellixity.quarry.domain.Operator;
import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.error.UnsupportedOperatorException;
import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.model.FieldType;

/**
 * Backend operator and value table.
 *
 * <p>Every {@link Operator} maps to a native token and every {@link FieldType.Kind} has a codec; a new
 * operator or kind needs an explicit entry here. For every kind {@code T} and value {@code v}
 * representable in it, {@code decoerce(T, coerce(T, v)).equals(v)}.</p>
 */
public interface OperatorTable {
  String backendId();

  String nativeToken(Operator op);

  /** @throws UnsupportedOperatorException when {@code op} cannot apply to {@code type} */
  void checkApplicable(Operator op, FieldType type, String field);

  /** Caller value to wire value. */
  Object coerce(FieldType type, Object value);

  /**
   * Wire value to caller value.
   *
   * @throws MappingException when {@code raw} cannot be represented as {@code type}
   */
  Object decoerce(FieldType type, Object raw);

  /**
   * Applicability check, then coercion of a leaf operand: list operands element-wise, pattern operands
   * kept as text, a scalar against a list field coerced as one element.
   */
  default Object coerceOperand(Operator op, FieldDef field, Object value) {
    checkApplicable(op, field.type(), field.name());
    return coerceOperandValue(op, field.type(), value);
  }

  Object coerceOperandValue(Operator op, FieldType type, Object value);
}
