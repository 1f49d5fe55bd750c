package io.intellixity.quarry.query.operation;

public interface OperationVisitor<R> {
  R visit(AggregateSpec aggregate);
  R visit(JoinSpec join);
  R visit(WindowSpec window);
}
