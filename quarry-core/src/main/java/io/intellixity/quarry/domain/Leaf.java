package io.intellixity.quarry.domain;

import java.util.*;

/** Atomic comparison {@code (field, operator, value)}. Collection and array values are copied into a read-only list. */
public record Leaf(String field, Operator operator, Object value) implements DomainTerm, DomainNode {
  public Leaf {
    Objects.requireNonNull(operator, "operator");
    if (value instanceof Collection<?> c) value = Collections.unmodifiableList(new ArrayList<>(c));
    else if (value instanceof Object[] a) value = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(a)));
  }

  @Override
  public <R> R accept(DomainVisitor<R> visitor) { return visitor.visit(this); }
}
