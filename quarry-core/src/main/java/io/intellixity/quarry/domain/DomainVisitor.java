package io.intellixity.quarry.domain;

public interface DomainVisitor<R> {
  R visit(Leaf leaf);
  R visit(AndNode and);
  R visit(OrNode or);
  R visit(NotNode not);
  R visit(TrueNode identity);
}
