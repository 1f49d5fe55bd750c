package io.intellixity.quarry.query.operation;

/**
 * A higher-level query feature compiled into one or more pipeline stages after the base filter stages.
 * The set is closed: a new kind needs a new variant and a new branch in every {@link OperationVisitor}.
 */
public sealed interface OperationSpec permits AggregateSpec, JoinSpec, WindowSpec {
  <R> R accept(OperationVisitor<R> visitor);
}
