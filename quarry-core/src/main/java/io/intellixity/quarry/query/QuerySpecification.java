package io.intellixity.quarry.query;

import io.intellixity.quarry.domain.Domain;
import io.intellixity.quarry.model.CollectionRef;
import io.intellixity.quarry.query.operation.OperationSpec;

import java.util.*;

/**
 * Immutable snapshot of a query: target, filter domain, projection, order, pagination and operations.
 *
 * <p>{@code projection}, {@code limit} and {@code offset} are null when absent. An offset without a limit
 * skips only; a limit of zero yields no rows.</p>
 */
public record QuerySpecification(CollectionRef target, Domain domain, List<String> projection,
                                 List<SortField> order, Integer limit, Integer offset,
                                 List<OperationSpec> operations) {
  public QuerySpecification {
    Objects.requireNonNull(target, "target");
    domain = domain == null ? Domain.empty() : domain;
    if (projection != null && projection.isEmpty()) throw new IllegalArgumentException("projection must not be empty");
    projection = projection == null ? null : List.copyOf(new LinkedHashSet<>(projection));
    order = List.copyOf(order == null ? List.of() : order);
    operations = List.copyOf(operations == null ? List.of() : operations);
  }

  public boolean hasProjection() { return projection != null; }
  public boolean hasOperations() { return !operations.isEmpty(); }
}
