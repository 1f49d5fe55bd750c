package io.intellixity.quarry.query;

import io.intellixity.quarry.model.CollectionRef;

/** Plain builder producing {@link QuerySpecification}s; engines extend {@link AbstractQueryBuilder} instead. */
public final class QueryBuilder extends AbstractQueryBuilder<QueryBuilder> {
  public QueryBuilder(CollectionRef target) {
    super(target);
  }

  public static QueryBuilder from(String collection) { return new QueryBuilder(new CollectionRef(collection)); }

  @Override
  protected QueryBuilder self() { return this; }
}
