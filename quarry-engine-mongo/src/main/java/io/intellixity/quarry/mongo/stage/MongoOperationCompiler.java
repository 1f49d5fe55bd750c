package io.intellixity.quarry.mongo.stage;

import io.intellixity.quarry.query.operation.*;
import io.intellixity.quarry.spi.compile.FieldScope;
import io.intellixity.quarry.spi.compile.OperatorTable;
import io.intellixity.quarry.spi.compile.OutputFields;
import org.bson.Document;

import java.util.*;

/** Appends each operation's stages in declaration order, advancing the visible field scope after each one. */
public final class MongoOperationCompiler {
  private final MongoAggregateCompiler aggregates;
  private final MongoJoinCompiler joins = new MongoJoinCompiler();
  private final MongoWindowCompiler windows = new MongoWindowCompiler();

  public MongoOperationCompiler(OperatorTable operators) {
    this.aggregates = new MongoAggregateCompiler(operators);
  }

  public List<Document> compile(List<OperationSpec> operations, FieldScope base) {
    List<Document> stages = new ArrayList<>();
    FieldScope scope = base;
    for (OperationSpec op : operations) {
      OperationChecks.check(op);
      FieldScope current = scope;
      stages.addAll(op.accept(new OperationVisitor<List<Document>>() {
        @Override public List<Document> visit(AggregateSpec a) { return aggregates.compile(a, current); }
        @Override public List<Document> visit(JoinSpec j) { return joins.compile(j, current); }
        @Override public List<Document> visit(WindowSpec w) { return windows.compile(w, current); }
      }));
      scope = OutputFields.after(op, scope);
    }
    return stages;
  }
}
