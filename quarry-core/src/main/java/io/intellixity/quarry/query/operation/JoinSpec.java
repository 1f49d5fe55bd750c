package io.intellixity.quarry.query.operation;

import io.intellixity.quarry.model.CollectionRef;

import java.util.*;

/**
 * Foreign lookup of {@code target} documents whose {@code foreignField} equals the row's {@code localField}.
 * The matches land as a list under {@code alias}, which defaults to the target collection name.
 */
public record JoinSpec(CollectionRef target, String localField, String foreignField, JoinKind kind,
                       List<String> select, String alias) implements OperationSpec {
  public JoinSpec {
    Objects.requireNonNull(target, "target");
    kind = kind == null ? JoinKind.INNER : kind;
    select = select == null ? null : List.copyOf(new LinkedHashSet<>(select));
    if (alias == null || alias.isBlank()) alias = target.name();
  }

  public boolean hasSelection() { return select != null && !select.isEmpty(); }

  @Override
  public <R> R accept(OperationVisitor<R> visitor) { return visitor.visit(this); }
}
