package io.intellixity.quarry.query.operation;

public enum JoinKind {
  /** Rows without a match are dropped. */
  INNER,
  /** Rows without a match are kept with an empty joined list. */
  LEFT
}
