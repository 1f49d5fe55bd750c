package io.intellixity.quarry.domain;

import java.util.Locale;

/** Prefix combinators; AND/OR consume the next two sub-expressions, NOT the next one. */
public enum Combinator implements DomainTerm {
  AND("&", 2),
  OR("|", 2),
  NOT("!", 1);

  private final String symbol;
  private final int arity;

  Combinator(String symbol, int arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  public String symbol() { return symbol; }
  public int arity() { return arity; }

  /** Resolves {@code "&"}, {@code "|"}, {@code "!"} or their names; null if unknown. */
  public static Combinator fromToken(String s) {
    if (s == null) return null;
    String k = s.trim();
    for (Combinator c : values()) {
      if (c.symbol.equals(k) || c.name().equals(k.toUpperCase(Locale.ROOT))) return c;
    }
    return null;
  }
}
