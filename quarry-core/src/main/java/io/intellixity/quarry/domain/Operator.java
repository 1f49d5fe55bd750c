package io.intellixity.quarry.domain;

import java.util.*;

/** Comparison/membership operators of the domain language. */
public enum Operator {
  EQ("eq", "=", ValueShape.SCALAR),
  NEQ("neq", "!=", ValueShape.SCALAR),
  GT("gt", ">", ValueShape.SCALAR),
  GTE("gte", ">=", ValueShape.SCALAR),
  LT("lt", "<", ValueShape.SCALAR),
  LTE("lte", "<=", ValueShape.SCALAR),

  IN("in", "in", ValueShape.LIST),
  NOT_IN("not_in", "not in", ValueShape.LIST),

  LIKE("like", "like", ValueShape.SCALAR),
  ILIKE("ilike", "ilike", ValueShape.SCALAR),
  NOT_LIKE("not_like", "not like", ValueShape.SCALAR),
  NOT_ILIKE("not_ilike", "not ilike", ValueShape.SCALAR),

  IS_NULL("is_null", "is null", ValueShape.NONE),
  IS_NOT_NULL("is_not_null", "is not null", ValueShape.NONE);

  /** Expected shape of a leaf's value. */
  public enum ValueShape { SCALAR, LIST, NONE }

  private static final Map<String, Operator> BY_TOKEN;

  static {
    Map<String, Operator> m = new HashMap<>();
    for (Operator op : values()) {
      m.put(op.token, op);
      m.put(op.symbol, op);
    }
    m.put("==", EQ);
    m.put("<>", NEQ);
    m.put("ne", NEQ);
    m.put("nin", NOT_IN);
    BY_TOKEN = Map.copyOf(m);
  }

  private final String token;
  private final String symbol;
  private final ValueShape shape;

  Operator(String token, String symbol, ValueShape shape) {
    this.token = token;
    this.symbol = symbol;
    this.shape = shape;
  }

  public String token() { return token; }
  public String symbol() { return symbol; }
  public ValueShape shape() { return shape; }

  /** Ordering comparisons; require a non-null scalar. */
  public boolean isOrdering() {
    return this == GT || this == GTE || this == LT || this == LTE;
  }

  /** SQL-LIKE pattern operators; apply to text only. */
  public boolean isPattern() {
    return this == LIKE || this == ILIKE || this == NOT_LIKE || this == NOT_ILIKE;
  }

  /** Resolves {@code "gte"}, {@code ">="}, {@code "not in"}, {@code "NOT_IN"}...; null if unknown. */
  public static Operator fromToken(String s) {
    if (s == null) return null;
    String k = s.trim().toLowerCase(Locale.ROOT);
    Operator op = BY_TOKEN.get(k);
    if (op != null) return op;
    return BY_TOKEN.get(k.replace('_', ' '));
  }
}
