package io.intellixity.quarry.domain;

/** Identity node of an empty domain; matches everything. */
public final class TrueNode implements DomainNode {
  public static final TrueNode INSTANCE = new TrueNode();

  private TrueNode() {}

  @Override
  public <R> R accept(DomainVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return "TRUE"; }
}
