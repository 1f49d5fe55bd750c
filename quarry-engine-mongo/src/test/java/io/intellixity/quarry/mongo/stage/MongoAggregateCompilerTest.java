package io.intellixity.quarry.mongo.stage;

import io.intellixity.quarry.domain.Domain;
import io.intellixity.quarry.domain.Domains;
import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.model.EntityModel;
import io.intellixity.quarry.model.FieldType;
import io.intellixity.quarry.mongo.bind.MongoOperatorTable;
import io.intellixity.quarry.query.operation.*;
import io.intellixity.quarry.spi.compile.FieldScope;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoAggregateCompilerTest {
  private static final EntityModel ORDER = EntityModel.builder("Order")
      .collection("orders")
      .field("status", FieldType.TEXT)
      .field("region", FieldType.TEXT, "shipping.region")
      .field("amount", FieldType.DECIMAL)
      .field("discount", FieldType.DECIMAL)
      .build();

  private static final FieldScope SCOPE = FieldScope.of(ORDER.fields());

  private final MongoAggregateCompiler compiler = new MongoAggregateCompiler(new MongoOperatorTable());

  @Test
  void groupCountHaving_filtersOnAlias() {
    AggregateSpec spec = new AggregateSpec(List.of("status"),
        List.of(new Metric(AggregateFunction.COUNT, Metric.ALL, "total")),
        Domains.gt("total", 10));
    assertEquals(List.of(
        new Document("$group", new Document("_id", new Document("status", "$status"))
            .append("total", new Document("$sum", 1))),
        new Document("$project", new Document("_id", 0).append("status", "$_id.status").append("total", 1)),
        new Document("$match", new Document("total", new Document("$gt", 10L)))), compiler.compile(spec, SCOPE));
  }

  @Test
  void globalAggregate_groupsOnNull() {
    AggregateSpec spec = new AggregateSpec(List.of(),
        List.of(new Metric(AggregateFunction.SUM, "amount", null), new Metric(AggregateFunction.AVG, "amount", null)),
        Domain.empty());
    List<Document> stages = compiler.compile(spec, SCOPE);
    assertEquals(2, stages.size());
    Document group = stages.get(0).get("$group", Document.class);
    assertTrue(group.containsKey("_id"));
    assertNull(group.get("_id"));
    assertEquals(new Document("$sum", "$amount"), group.get("sum_amount"));
    assertEquals(new Document("$avg", "$amount"), group.get("avg_amount"));
  }

  @Test
  void groupKeys_readStoragePaths() {
    AggregateSpec spec = new AggregateSpec(List.of("region"),
        List.of(new Metric(AggregateFunction.MAX, "amount", "top")), Domain.empty());
    Document group = compiler.compile(spec, SCOPE).get(0).get("$group", Document.class);
    assertEquals(new Document("region", "$shipping.region"), group.get("_id"));
  }

  @Test
  void fieldCount_skipsNulls() {
    AggregateSpec spec = new AggregateSpec(List.of("status"),
        List.of(new Metric(AggregateFunction.COUNT, "discount", "discounted")), Domain.empty());
    Document group = compiler.compile(spec, SCOPE).get(0).get("$group", Document.class);
    Document expected = new Document("$sum", new Document("$cond",
        Arrays.asList(new Document("$gt", Arrays.asList("$discount", null)), 1, 0)));
    assertEquals(expected, group.get("discounted"));
  }

  @Test
  void havingOnGroupField_usesGroupedName() {
    AggregateSpec spec = new AggregateSpec(List.of("region"),
        List.of(new Metric(AggregateFunction.SUM, "amount", "revenue")), Domains.neq("region", "EU"));
    List<Document> stages = compiler.compile(spec, SCOPE);
    assertEquals(new Document("$match", new Document("region", new Document("$ne", "EU"))), stages.get(2));
  }

  @Test
  void unknownSourceField_fails() {
    AggregateSpec spec = new AggregateSpec(List.of("status"),
        List.of(new Metric(AggregateFunction.SUM, "tax", "t")), Domain.empty());
    assertThrows(CompilationException.class, () -> compiler.compile(spec, SCOPE));
  }
}
