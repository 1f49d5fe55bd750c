package io.intellixity.quarry.domain;

import java.util.Objects;

/** Unary NOT over a subtree (a {@link Leaf} or a combined node). */
public record NotNode(DomainNode operand) implements DomainNode {
  public NotNode {
    Objects.requireNonNull(operand, "operand");
  }

  @Override
  public <R> R accept(DomainVisitor<R> visitor) { return visitor.visit(this); }
}
