package io.intellixity.quarry.query.operation;

import java.util.Objects;

/**
 * Relative frame {@code [start, end]} (inclusive), counted from the current row; a negative start reaches
 * back. A null bound is unbounded on that side. {@code RANGE} frames measure the distance on the single
 * order key's value instead of row positions.
 */
public record WindowFrame(Unit unit, Long start, Long end) {
  public enum Unit { ROWS, RANGE }

  public WindowFrame {
    Objects.requireNonNull(unit, "unit");
  }

  public static WindowFrame rows(long start, long end) { return new WindowFrame(Unit.ROWS, start, end); }
  public static WindowFrame range(long start, long end) { return new WindowFrame(Unit.RANGE, start, end); }
}
