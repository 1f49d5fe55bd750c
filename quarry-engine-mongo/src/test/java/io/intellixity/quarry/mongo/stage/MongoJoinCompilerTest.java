package io.intellixity.quarry.mongo.stage;

import io.intellixity.quarry.model.CollectionRef;
import io.intellixity.quarry.model.EntityModel;
import io.intellixity.quarry.model.FieldType;
import io.intellixity.quarry.query.operation.JoinKind;
import io.intellixity.quarry.query.operation.JoinSpec;
import io.intellixity.quarry.spi.compile.FieldScope;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoJoinCompilerTest {
  private static final FieldScope SCOPE = FieldScope.of(EntityModel.builder("Order")
      .field("id", FieldType.ID)
      .field("customerId", FieldType.ID, "customer_id")
      .build().fields());

  private final MongoJoinCompiler compiler = new MongoJoinCompiler();

  @Test
  void innerJoin_dropsUnmatchedRows() {
    JoinSpec spec = new JoinSpec(new CollectionRef("customers"), "customerId", "id", null, null, null);
    assertEquals(List.of(
        new Document("$lookup", new Document("from", "customers")
            .append("localField", "customer_id")
            .append("foreignField", "_id")
            .append("as", "customers")),
        new Document("$match", new Document("customers", new Document("$ne", List.of())))), compiler.compile(spec, SCOPE));
  }

  @Test
  void leftJoin_keepsRows_andProjectsSelection() {
    JoinSpec spec = new JoinSpec(new CollectionRef("customers"), "customerId", "id", JoinKind.LEFT,
        List.of("name", "email"), "customer");
    List<Document> stages = compiler.compile(spec, SCOPE);
    assertEquals(1, stages.size());
    Document lookup = stages.get(0).get("$lookup", Document.class);
    assertEquals("customer", lookup.getString("as"));
    assertEquals(List.of(new Document("$project", new Document("_id", 0).append("name", 1).append("email", 1))),
        lookup.get("pipeline"));
  }

  @Test
  void selectionWithId_keepsPrimaryKey() {
    JoinSpec spec = new JoinSpec(new CollectionRef("customers"), "customerId", "id", JoinKind.LEFT,
        List.of("id", "name"), null);
    Document lookup = compiler.compile(spec, SCOPE).get(0).get("$lookup", Document.class);
    assertEquals(List.of(new Document("$project", new Document("_id", 1).append("name", 1))), lookup.get("pipeline"));
  }
}
