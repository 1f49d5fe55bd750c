package io.intellixity.quarry.query.operation;

import java.util.Objects;

/**
 * One accumulator of an aggregate: {@code (function, source field, output alias)}.
 * {@code field} is {@code "*"} for a plain row count.
 */
public record Metric(AggregateFunction function, String field, String alias) {
  public static final String ALL = "*";

  public Metric {
    Objects.requireNonNull(function, "function");
    if (field == null || field.isBlank()) field = ALL;
    if (alias == null || alias.isBlank()) alias = defaultAlias(function, field);
  }

  public boolean countsRows() { return function == AggregateFunction.COUNT && ALL.equals(field); }

  /** {@code count} for a row count, otherwise {@code <function>_<field>}. */
  public static String defaultAlias(AggregateFunction function, String field) {
    if (function == AggregateFunction.COUNT && (field == null || ALL.equals(field))) return "count";
    return function.token() + "_" + field;
  }
}
