package io.intellixity.quarry.domain;

/**
 * Node of a normalized domain tree: {@link Leaf}, {@link AndNode}, {@link OrNode}, {@link NotNode} or {@link TrueNode}.
 */
public interface DomainNode {
  <R> R accept(DomainVisitor<R> visitor);
}
