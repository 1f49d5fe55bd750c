package io.intellixity.quarry.domain;

/** One item of a flat prefix domain sequence: either a {@link Leaf} or a {@link Combinator}. */
public interface DomainTerm {
}
