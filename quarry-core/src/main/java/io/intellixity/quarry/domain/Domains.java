package io.intellixity.quarry.domain;

import java.util.*;

/** Static factories for domain sequences. */
public final class Domains {
  private Domains() {}

  public static Domain leaf(String field, Operator op, Object value) {
    return Domain.of(new Leaf(field, op, value));
  }

  public static Domain eq(String field, Object value) { return leaf(field, Operator.EQ, value); }
  public static Domain neq(String field, Object value) { return leaf(field, Operator.NEQ, value); }
  public static Domain gt(String field, Object value) { return leaf(field, Operator.GT, value); }
  public static Domain gte(String field, Object value) { return leaf(field, Operator.GTE, value); }
  public static Domain lt(String field, Object value) { return leaf(field, Operator.LT, value); }
  public static Domain lte(String field, Object value) { return leaf(field, Operator.LTE, value); }

  public static Domain in(String field, Collection<?> values) { return leaf(field, Operator.IN, values); }
  public static Domain in(String field, Object... values) { return in(field, Arrays.asList(values)); }
  public static Domain notIn(String field, Collection<?> values) { return leaf(field, Operator.NOT_IN, values); }
  public static Domain notIn(String field, Object... values) { return notIn(field, Arrays.asList(values)); }

  public static Domain like(String field, String pattern) { return leaf(field, Operator.LIKE, pattern); }
  public static Domain ilike(String field, String pattern) { return leaf(field, Operator.ILIKE, pattern); }
  public static Domain notLike(String field, String pattern) { return leaf(field, Operator.NOT_LIKE, pattern); }
  public static Domain notIlike(String field, String pattern) { return leaf(field, Operator.NOT_ILIKE, pattern); }

  public static Domain isNull(String field) { return leaf(field, Operator.IS_NULL, null); }
  public static Domain isNotNull(String field) { return leaf(field, Operator.IS_NOT_NULL, null); }

  /** {@code [&, a..., b...]}. */
  public static Domain and(Domain a, Domain b) { return binary(Combinator.AND, a, b); }

  /** {@code [|, a..., b...]}. */
  public static Domain or(Domain a, Domain b) { return binary(Combinator.OR, a, b); }

  /** Right-nested conjunction of all given domains. */
  public static Domain and(Domain... parts) { return fold(Combinator.AND, parts); }

  /** Right-nested disjunction of all given domains. */
  public static Domain or(Domain... parts) { return fold(Combinator.OR, parts); }

  public static Domain not(Domain d) {
    return Domain.of(Combinator.NOT).concat(Objects.requireNonNull(d, "domain"));
  }

  private static Domain binary(Combinator c, Domain a, Domain b) {
    Objects.requireNonNull(a, "left");
    Objects.requireNonNull(b, "right");
    return Domain.of(c).concat(a).concat(b);
  }

  private static Domain fold(Combinator c, Domain[] parts) {
    if (parts == null || parts.length == 0) return Domain.empty();
    Domain acc = parts[parts.length - 1];
    for (int i = parts.length - 2; i >= 0; i--) acc = binary(c, parts[i], acc);
    return acc;
  }
}
