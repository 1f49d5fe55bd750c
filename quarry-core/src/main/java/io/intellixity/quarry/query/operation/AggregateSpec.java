package io.intellixity.quarry.query.operation;

import io.intellixity.quarry.domain.Domain;

import java.util.*;

/**
 * Grouping with accumulators and an optional {@code having} domain over group fields and metric aliases.
 * An empty {@code groupBy} computes a single global row.
 */
public record AggregateSpec(List<String> groupBy, List<Metric> metrics, Domain having) implements OperationSpec {
  public AggregateSpec {
    groupBy = List.copyOf(groupBy == null ? List.of() : groupBy);
    metrics = List.copyOf(metrics == null ? List.of() : metrics);
    having = having == null ? Domain.empty() : having;
  }

  /** Names visible after the grouping stage: group fields then metric aliases. */
  public Set<String> outputNames() {
    Set<String> out = new LinkedHashSet<>(groupBy);
    for (Metric m : metrics) out.add(m.alias());
    return out;
  }

  @Override
  public <R> R accept(OperationVisitor<R> visitor) { return visitor.visit(this); }
}
