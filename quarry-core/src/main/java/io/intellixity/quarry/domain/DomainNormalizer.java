package io.intellixity.quarry.domain;

import io.intellixity.quarry.error.MalformedDomainException;

import java.util.*;

/**
 * Turns a flat prefix {@link Domain} into a binary {@link DomainNode} tree.
 *
 * <p>Top-level expressions are split left to right, an implicit {@code AND} is inserted before every one
 * except the last, and the resulting sequence is reduced right to left. {@code [l1, l2, l3]} therefore
 * normalizes to {@code AND(l1, AND(l2, l3))}.</p>
 */
public final class DomainNormalizer {
  private DomainNormalizer() {}

  /** Normalizes; an empty domain yields {@link TrueNode#INSTANCE}. */
  public static DomainNode normalize(Domain domain) {
    return normalize(domain, false);
  }

  public static DomainNode normalize(Domain domain, boolean requireNonEmpty) {
    if (domain == null || domain.isEmpty()) {
      if (requireNonEmpty) throw new MalformedDomainException("Domain must not be empty");
      return TrueNode.INSTANCE;
    }
    List<DomainTerm> terms = domain.terms();
    for (int i = 0; i < terms.size(); i++) {
      if (terms.get(i) instanceof Leaf leaf) validate(leaf, i);
    }
    return reduce(withImplicitAnd(segments(terms)));
  }

  /** Checks a single leaf's shape: field, operator and value shape. */
  public static void validate(Leaf leaf, int position) {
    if (leaf.field() == null || leaf.field().isBlank()) {
      throw new MalformedDomainException("Leaf at position " + position + " has a blank field");
    }
    Operator op = leaf.operator();
    Object v = leaf.value();
    switch (op.shape()) {
      case NONE:
        if (v != null) {
          throw new MalformedDomainException("Operator " + op.symbol() + " on '" + leaf.field() + "' takes no value");
        }
        break;
      case LIST:
        if (!(v instanceof Collection<?>) && !(v instanceof Object[])) {
          throw new MalformedDomainException("Operator " + op.symbol() + " on '" + leaf.field() + "' needs a list value");
        }
        break;
      case SCALAR:
        if (v instanceof Collection<?> || v instanceof Object[]) {
          throw new MalformedDomainException("Operator " + op.symbol() + " on '" + leaf.field() + "' needs a scalar value");
        }
        if (v == null && (op.isOrdering() || op.isPattern())) {
          throw new MalformedDomainException("Operator " + op.symbol() + " on '" + leaf.field() + "' needs a non-null value");
        }
        if (op.isPattern() && !(v instanceof String)) {
          throw new MalformedDomainException("Operator " + op.symbol() + " on '" + leaf.field() + "' needs a text pattern");
        }
        break;
    }
  }

  /** Splits the sequence into complete top-level expressions. */
  static List<List<DomainTerm>> segments(List<DomainTerm> terms) {
    List<List<DomainTerm>> out = new ArrayList<>();
    List<DomainTerm> current = new ArrayList<>();
    int need = 1;
    for (DomainTerm t : terms) {
      current.add(t);
      if (t instanceof Combinator c) need += c.arity() - 1;
      else need -= 1;
      if (need == 0) {
        out.add(current);
        current = new ArrayList<>();
        need = 1;
      }
    }
    if (!current.isEmpty()) {
      throw new MalformedDomainException("Combinator is missing " + need + " operand(s) at end of domain " + terms);
    }
    return out;
  }

  static List<DomainTerm> withImplicitAnd(List<List<DomainTerm>> segments) {
    List<DomainTerm> out = new ArrayList<>();
    for (int i = 0; i < segments.size(); i++) {
      if (i < segments.size() - 1) out.add(Combinator.AND);
      out.addAll(segments.get(i));
    }
    return out;
  }

  static DomainNode reduce(List<DomainTerm> prefix) {
    Deque<DomainNode> stack = new ArrayDeque<>();
    for (int i = prefix.size() - 1; i >= 0; i--) {
      DomainTerm t = prefix.get(i);
      if (t instanceof Leaf leaf) {
        stack.push(leaf);
        continue;
      }
      Combinator c = (Combinator) t;
      if (stack.size() < c.arity()) {
        throw new MalformedDomainException("Combinator " + c.symbol() + " at position " + i + " is missing operands");
      }
      switch (c) {
        case NOT -> stack.push(new NotNode(stack.pop()));
        case AND -> stack.push(new AndNode(stack.pop(), stack.pop()));
        case OR -> stack.push(new OrNode(stack.pop(), stack.pop()));
      }
    }
    if (stack.size() != 1) {
      throw new MalformedDomainException("Domain reduced to " + stack.size() + " expressions instead of one");
    }
    return stack.pop();
  }

  /** Copies a list-shaped leaf value (collection or object array) into a list. */
  public static List<Object> listValue(Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] a) return new ArrayList<>(Arrays.asList(a));
    throw new MalformedDomainException("Expected a list value but got " + (v == null ? "null" : v.getClass().getName()));
  }
}
