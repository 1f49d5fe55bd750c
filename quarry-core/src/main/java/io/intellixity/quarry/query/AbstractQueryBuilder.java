package io.intellixity.quarry.query;

import io.intellixity.quarry.domain.Domain;
import io.intellixity.quarry.domain.DomainTerm;
import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.error.InvalidRangeException;
import io.intellixity.quarry.model.CollectionRef;
import io.intellixity.quarry.query.operation.OperationSpec;

import java.util.*;

/**
 * Self-typed, chainable accumulator of a {@link QuerySpecification}.
 *
 * <p>Two update rules apply. {@code filter} and {@code orderBy} are cumulative: each call appends (filters
 * end up implicitly conjoined, the first order key is the primary one). {@code select}, {@code limit} and
 * {@code offset} are last-write-wins: each call replaces the previous value.</p>
 *
 * <p>{@code groupBy}/{@code aggregate}/{@code join}/{@code window} open a sub-builder that must be closed
 * with {@code end()}; {@link #build()} fails while one is open. Subclasses get {@link #changed()} after
 * every mutation.</p>
 */
public abstract class AbstractQueryBuilder<B extends AbstractQueryBuilder<B>> {
  private final CollectionRef target;
  private Domain domain = Domain.empty();
  private List<String> projection;
  private final List<SortField> order = new ArrayList<>();
  private Integer limit;
  private Integer offset;
  private final List<OperationSpec> operations = new ArrayList<>();
  private Object openSubBuilder;
  private String openKind;

  protected AbstractQueryBuilder(CollectionRef target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  protected abstract B self();

  /** Mutation hook. */
  protected void changed() {}

  public CollectionRef target() { return target; }

  public B filter(Domain d) {
    domain = domain.concat(Objects.requireNonNull(d, "domain"));
    changed();
    return self();
  }

  public B filter(DomainTerm... terms) { return filter(Domain.of(terms)); }

  public B orderBy(String field, SortField.Direction direction) {
    order.add(new SortField(field, direction));
    changed();
    return self();
  }

  public B orderBy(String field) { return orderBy(field, SortField.Direction.ASC); }

  public B limit(int n) {
    if (n < 0) throw new InvalidRangeException("limit must be >= 0 but was " + n);
    limit = n;
    changed();
    return self();
  }

  public B offset(int n) {
    if (n < 0) throw new InvalidRangeException("offset must be >= 0 but was " + n);
    offset = n;
    changed();
    return self();
  }

  public B select(String... fields) { return select(Arrays.asList(fields)); }

  /** @throws CompilationException when {@code fields} is empty */
  public B select(Collection<String> fields) {
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) throw new CompilationException("select needs at least one field");
    projection = new ArrayList<>(fields);
    changed();
    return self();
  }

  /** Opens a grouping; an empty field list groups everything into a single row. */
  public AggregateBuilder<B> groupBy(String... fields) {
    return open("groupBy", new AggregateBuilder<>(self(), Arrays.asList(fields)));
  }

  /** Global aggregate: same as {@code groupBy()} with no fields. */
  public AggregateBuilder<B> aggregate() { return groupBy(); }

  public JoinBuilder<B> join(String targetCollection) {
    return open("join", new JoinBuilder<>(self(), new CollectionRef(targetCollection)));
  }

  public WindowBuilder<B> window() {
    return open("window", new WindowBuilder<>(self()));
  }

  public QuerySpecification build() {
    if (openSubBuilder != null) {
      throw new CompilationException("Sub-builder '" + openKind + "' was not finalized with end()");
    }
    return new QuerySpecification(target, domain, projection, order, limit, offset, operations);
  }

  /** Only the currently open sub-builder may attach, and only once. */
  void attach(Object subBuilder, OperationSpec op) {
    if (openSubBuilder != subBuilder) {
      throw new CompilationException("end() called on a sub-builder that is no longer open");
    }
    operations.add(op);
    openSubBuilder = null;
    openKind = null;
    changed();
  }

  private <S> S open(String kind, S subBuilder) {
    if (openSubBuilder != null) {
      throw new CompilationException("Cannot open '" + kind + "' while '" + openKind + "' is not finalized");
    }
    openSubBuilder = subBuilder;
    openKind = kind;
    return subBuilder;
  }
}
