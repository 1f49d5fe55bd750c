package io.intellixity.quarry.domain;

import java.util.Objects;

public record OrNode(DomainNode left, DomainNode right) implements DomainNode {
  public OrNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(DomainVisitor<R> visitor) { return visitor.visit(this); }
}
