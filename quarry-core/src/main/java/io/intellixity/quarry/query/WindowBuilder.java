package io.intellixity.quarry.query;

import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.query.operation.*;

import java.util.*;

/**
 * Describes one window function. Partition and order keys accumulate; exactly one function is allowed.
 */
public final class WindowBuilder<P extends AbstractQueryBuilder<P>> {
  private final P parent;
  private final List<String> partitionBy = new ArrayList<>();
  private final List<SortField> orderBy = new ArrayList<>();
  private WindowFrame frame;
  private WindowFunction function;
  private String sourceField;
  private String alias;

  WindowBuilder(P parent) {
    this.parent = parent;
  }

  public WindowBuilder<P> partitionBy(String... fields) {
    partitionBy.addAll(Arrays.asList(fields));
    return this;
  }

  public WindowBuilder<P> orderBy(String field, SortField.Direction direction) {
    orderBy.add(new SortField(field, direction));
    return this;
  }

  public WindowBuilder<P> orderBy(String field) { return orderBy(field, SortField.Direction.ASC); }

  public WindowBuilder<P> rows(long start, long end) { frame = WindowFrame.rows(start, end); return this; }
  public WindowBuilder<P> range(long start, long end) { frame = WindowFrame.range(start, end); return this; }
  public WindowBuilder<P> frame(WindowFrame frame) { this.frame = frame; return this; }

  public WindowBuilder<P> rowNumber(String alias) { return function(WindowFunction.ROW_NUMBER, null, alias); }
  public WindowBuilder<P> rank(String alias) { return function(WindowFunction.RANK, null, alias); }
  public WindowBuilder<P> denseRank(String alias) { return function(WindowFunction.DENSE_RANK, null, alias); }
  public WindowBuilder<P> sum(String field, String alias) { return function(WindowFunction.SUM, field, alias); }
  public WindowBuilder<P> avg(String field, String alias) { return function(WindowFunction.AVG, field, alias); }
  public WindowBuilder<P> min(String field, String alias) { return function(WindowFunction.MIN, field, alias); }
  public WindowBuilder<P> max(String field, String alias) { return function(WindowFunction.MAX, field, alias); }

  public WindowBuilder<P> function(WindowFunction fn, String sourceField, String alias) {
    if (function != null) {
      throw new CompilationException("Window already computes " + function.token() + "; open another window for " + fn.token());
    }
    this.function = Objects.requireNonNull(fn, "function");
    this.sourceField = sourceField;
    this.alias = alias;
    return this;
  }

  public P end() {
    if (function == null) throw new CompilationException("Window needs a function");
    WindowSpec spec = new WindowSpec(partitionBy, orderBy, frame, function, sourceField, alias);
    OperationChecks.check(spec);
    AbstractQueryBuilder<P> owner = parent;
    owner.attach(this, spec);
    return parent;
  }
}
