package io.intellixity.quarry.mongo.stage;

import io.intellixity.quarry.mongo.MongoDomainCompiler;
import io.intellixity.quarry.query.operation.AggregateSpec;
import io.intellixity.quarry.query.operation.Metric;
import io.intellixity.quarry.spi.compile.FieldScope;
import io.intellixity.quarry.spi.compile.OperatorTable;
import io.intellixity.quarry.spi.compile.OutputFields;
import org.bson.Document;

import java.util.*;

/**
 * {@code $group} keyed by the group fields (or {@code null} for a global row), a {@code $project} lifting
 * the keys out of {@code _id}, then a {@code $match} for {@code having} over group fields and aliases.
 */
public final class MongoAggregateCompiler {
  private final OperatorTable operators;

  public MongoAggregateCompiler(OperatorTable operators) {
    this.operators = Objects.requireNonNull(operators, "operators");
  }

  public List<Document> compile(AggregateSpec spec, FieldScope scope) {
    Document key = null;
    if (!spec.groupBy().isEmpty()) {
      key = new Document();
      for (String g : spec.groupBy()) {
        key.append(g, "$" + OutputFields.require(scope, g, "group by").storageName());
      }
    }

    Document group = new Document("_id", key);
    for (Metric m : spec.metrics()) group.append(m.alias(), accumulator(m, scope));

    Document project = new Document("_id", 0);
    for (String g : spec.groupBy()) project.append(g, "$_id." + g);
    for (Metric m : spec.metrics()) project.append(m.alias(), 1);

    List<Document> stages = new ArrayList<>();
    stages.add(new Document("$group", group));
    stages.add(new Document("$project", project));

    if (!spec.having().isEmpty()) {
      FieldScope grouped = OutputFields.after(spec, scope);
      Document having = MongoDomainCompiler.compile(spec.having(), grouped, operators);
      if (!having.isEmpty()) stages.add(new Document("$match", having));
    }
    return stages;
  }

  private static Document accumulator(Metric m, FieldScope scope) {
    if (m.countsRows()) return new Document("$sum", 1);
    String ref = "$" + OutputFields.require(scope, m.field(), m.function().token()).storageName();
    return switch (m.function()) {
      case COUNT -> new Document("$sum", new Document("$cond", Arrays.asList(new Document("$gt", Arrays.asList(ref, null)), 1, 0)));
      case SUM -> new Document("$sum", ref);
      case AVG -> new Document("$avg", ref);
      case MIN -> new Document("$min", ref);
      case MAX -> new Document("$max", ref);
    };
  }
}
