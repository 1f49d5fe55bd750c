package io.intellixity.quarry.domain;

import java.util.Objects;

public record AndNode(DomainNode left, DomainNode right) implements DomainNode {
  public AndNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(DomainVisitor<R> visitor) { return visitor.visit(this); }
}
