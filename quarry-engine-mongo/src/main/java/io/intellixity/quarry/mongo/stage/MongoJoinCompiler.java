package io.intellixity.quarry.mongo.stage;

import io.intellixity.quarry.query.operation.JoinKind;
import io.intellixity.quarry.query.operation.JoinSpec;
import io.intellixity.quarry.spi.compile.FieldScope;
import io.intellixity.quarry.spi.compile.OutputFields;
import org.bson.Document;

import java.util.*;

/**
 * {@code $lookup} on {@code localField = foreignField}; inner joins add a {@code $match} dropping rows
 * whose joined list is empty. Foreign fields are storage names, with {@code id} standing for {@code _id}.
 */
public final class MongoJoinCompiler {
  public List<Document> compile(JoinSpec spec, FieldScope scope) {
    String local = OutputFields.require(scope, spec.localField(), "join").storageName();
    Document lookup = new Document("from", spec.target().name())
        .append("localField", local)
        .append("foreignField", foreignPath(spec.foreignField()))
        .append("as", spec.alias());

    if (spec.hasSelection()) {
      boolean keepsId = spec.select().stream().anyMatch(f -> "_id".equals(foreignPath(f)));
      Document project = keepsId ? new Document() : new Document("_id", 0);
      for (String f : spec.select()) project.append(foreignPath(f), 1);
      lookup.append("pipeline", List.of(new Document("$project", project)));
    }

    List<Document> stages = new ArrayList<>();
    stages.add(new Document("$lookup", lookup));
    if (spec.kind() == JoinKind.INNER) {
      stages.add(new Document("$match", new Document(spec.alias(), new Document("$ne", List.of()))));
    }
    return stages;
  }

  static String foreignPath(String field) {
    return "id".equals(field) ? "_id" : field;
  }
}
