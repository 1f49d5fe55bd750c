package io.intellixity.quarry.query;

import io.intellixity.quarry.model.CollectionRef;
import io.intellixity.quarry.query.operation.*;

import java.util.*;

/** Describes one foreign lookup. Inner by default. */
public final class JoinBuilder<P extends AbstractQueryBuilder<P>> {
  private final P parent;
  private final CollectionRef target;
  private String localField;
  private String foreignField;
  private JoinKind kind = JoinKind.INNER;
  private List<String> select;
  private String alias;

  JoinBuilder(P parent, CollectionRef target) {
    this.parent = parent;
    this.target = target;
  }

  public JoinBuilder<P> on(String localField, String foreignField) {
    this.localField = localField;
    this.foreignField = foreignField;
    return this;
  }

  public JoinBuilder<P> inner() { this.kind = JoinKind.INNER; return this; }
  public JoinBuilder<P> left() { this.kind = JoinKind.LEFT; return this; }
  public JoinBuilder<P> kind(JoinKind kind) { this.kind = Objects.requireNonNull(kind, "kind"); return this; }

  /** Restricts the joined documents to these foreign fields; last call wins. */
  public JoinBuilder<P> select(String... fields) {
    this.select = new ArrayList<>(Arrays.asList(fields));
    return this;
  }

  public JoinBuilder<P> as(String alias) { this.alias = alias; return this; }

  public P end() {
    JoinSpec spec = new JoinSpec(target, localField, foreignField, kind, select, alias);
    OperationChecks.check(spec);
    AbstractQueryBuilder<P> owner = parent;
    owner.attach(this, spec);
    return parent;
  }
}
