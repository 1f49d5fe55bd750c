package io.intellixity.quarry.query.operation;

import java.util.Locale;

public enum WindowFunction {
  ROW_NUMBER(true),
  RANK(true),
  DENSE_RANK(true),
  SUM(false),
  AVG(false),
  MIN(false),
  MAX(false);

  private final boolean ranking;

  WindowFunction(boolean ranking) {
    this.ranking = ranking;
  }

  /** Ranking functions number rows by order and take no source field or frame. */
  public boolean isRanking() { return ranking; }

  public String token() { return name().toLowerCase(Locale.ROOT); }
}
