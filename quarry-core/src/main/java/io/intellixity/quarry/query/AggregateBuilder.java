package io.intellixity.quarry.query;

import io.intellixity.quarry.domain.Domain;
import io.intellixity.quarry.domain.DomainTerm;
import io.intellixity.quarry.query.operation.*;

import java.util.*;

/**
 * Collects metrics and a {@code having} domain for one grouping. {@link #end()} validates and returns the
 * parent builder.
 */
public final class AggregateBuilder<P extends AbstractQueryBuilder<P>> {
  private final P parent;
  private final List<String> groupBy;
  private final List<Metric> metrics = new ArrayList<>();
  private Domain having = Domain.empty();

  AggregateBuilder(P parent, List<String> groupBy) {
    this.parent = parent;
    this.groupBy = new ArrayList<>(groupBy);
  }

  public AggregateBuilder<P> count() { return metric(AggregateFunction.COUNT, Metric.ALL, null); }
  public AggregateBuilder<P> count(String alias) { return metric(AggregateFunction.COUNT, Metric.ALL, alias); }
  public AggregateBuilder<P> count(String field, String alias) { return metric(AggregateFunction.COUNT, field, alias); }

  public AggregateBuilder<P> sum(String field) { return metric(AggregateFunction.SUM, field, null); }
  public AggregateBuilder<P> sum(String field, String alias) { return metric(AggregateFunction.SUM, field, alias); }
  public AggregateBuilder<P> avg(String field) { return metric(AggregateFunction.AVG, field, null); }
  public AggregateBuilder<P> avg(String field, String alias) { return metric(AggregateFunction.AVG, field, alias); }
  public AggregateBuilder<P> min(String field) { return metric(AggregateFunction.MIN, field, null); }
  public AggregateBuilder<P> min(String field, String alias) { return metric(AggregateFunction.MIN, field, alias); }
  public AggregateBuilder<P> max(String field) { return metric(AggregateFunction.MAX, field, null); }
  public AggregateBuilder<P> max(String field, String alias) { return metric(AggregateFunction.MAX, field, alias); }

  public AggregateBuilder<P> metric(AggregateFunction fn, String field, String alias) {
    metrics.add(new Metric(fn, field, alias));
    return this;
  }

  /** Cumulative, like {@code filter}; leaves refer to group fields and metric aliases. */
  public AggregateBuilder<P> having(Domain d) {
    having = having.concat(Objects.requireNonNull(d, "having"));
    return this;
  }

  public AggregateBuilder<P> having(DomainTerm... terms) { return having(Domain.of(terms)); }

  public P end() {
    AggregateSpec spec = new AggregateSpec(groupBy, metrics, having);
    OperationChecks.check(spec);
    AbstractQueryBuilder<P> owner = parent;
    owner.attach(this, spec);
    return parent;
  }
}
