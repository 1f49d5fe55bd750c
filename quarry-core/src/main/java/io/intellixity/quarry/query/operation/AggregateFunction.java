package io.intellixity.quarry.query.operation;

import java.util.Locale;

public enum AggregateFunction {
  COUNT, SUM, AVG, MIN, MAX;

  public String token() { return name().toLowerCase(Locale.ROOT); }
}
