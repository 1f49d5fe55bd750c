package io.intellixity.quarry.query.operation;

import io.intellixity.quarry.query.SortField;

import java.util.*;

/**
 * One window function over partitions of rows; without a frame it runs over the whole partition.
 */
public record WindowSpec(List<String> partitionBy, List<SortField> orderBy, WindowFrame frame,
                         WindowFunction function, String sourceField, String alias) implements OperationSpec {
  public WindowSpec {
    Objects.requireNonNull(function, "function");
    partitionBy = List.copyOf(partitionBy == null ? List.of() : partitionBy);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    if (alias == null || alias.isBlank()) alias = defaultAlias(function, sourceField);
  }

  /** The function name for ranking functions, otherwise {@code <function>_<field>}. */
  public static String defaultAlias(WindowFunction function, String sourceField) {
    if (function.isRanking() || sourceField == null) return function.token();
    return function.token() + "_" + sourceField;
  }

  @Override
  public <R> R accept(OperationVisitor<R> visitor) { return visitor.visit(this); }
}
