package io.intellixity.quarry.mongo;

import io.intellixity.quarry.model.FieldLookup;
import io.intellixity.quarry.mongo.bind.MongoOperatorTable;
import io.intellixity.quarry.mongo.stage.MongoOperationCompiler;
import io.intellixity.quarry.query.QuerySpecification;
import io.intellixity.quarry.query.SortField;
import io.intellixity.quarry.spi.compile.OperatorTable;
import io.intellixity.quarry.spi.compile.OutputFields;
import io.intellixity.quarry.spi.compile.QueryCompiler;
import org.bson.Document;

import java.util.*;

/**
 * Compiles specifications to {@link MongoStatement}s.
 *
 * <p>Without operations the result is a {@code find}. Otherwise it is a pipeline: {@code $match},
 * {@code $sort}, {@code $skip}, {@code $limit}, {@code $project}, then each operation's stages in order.</p>
 */
public final class MongoQueryCompiler implements QueryCompiler<MongoStatement> {
  private final OperatorTable operators;
  private final MongoOperationCompiler operations;

  public MongoQueryCompiler() {
    this(new MongoOperatorTable());
  }

  public MongoQueryCompiler(OperatorTable operators) {
    this.operators = Objects.requireNonNull(operators, "operators");
    this.operations = new MongoOperationCompiler(operators);
  }

  @Override
  public String backendId() { return MongoOperatorTable.BACKEND_ID; }

  @Override
  public OperatorTable operators() { return operators; }

  @Override
  public MongoStatement compile(QuerySpecification spec, FieldLookup model) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(model, "model");
    String collection = spec.target().name();

    Document filter = MongoDomainCompiler.compile(spec.domain(), model, operators);
    Document sort = sort(spec, model);
    Document projection = projection(spec, model);

    if (!spec.hasOperations()) {
      return MongoStatement.find(collection, filter, projection, sort, spec.offset(), spec.limit());
    }

    List<Document> pipeline = new ArrayList<>();
    if (!filter.isEmpty()) pipeline.add(new Document("$match", filter));
    if (sort != null) pipeline.add(new Document("$sort", sort));
    if (spec.offset() != null && spec.offset() > 0) pipeline.add(new Document("$skip", spec.offset()));
    if (spec.limit() != null) pipeline.add(new Document("$limit", spec.limit()));
    if (projection != null) pipeline.add(new Document("$project", projection));
    pipeline.addAll(operations.compile(spec.operations(), OutputFields.base(spec, model)));
    return MongoStatement.aggregate(collection, pipeline, spec.limit());
  }

  private static Document sort(QuerySpecification spec, FieldLookup model) {
    if (spec.order().isEmpty()) return null;
    Document sort = new Document();
    for (SortField s : spec.order()) {
      String path = OutputFields.require(model, s.field(), "order by").storageName();
      if (sort.containsKey(path)) continue;
      sort.append(path, s.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    return sort;
  }

  private static Document projection(QuerySpecification spec, FieldLookup model) {
    if (!spec.hasProjection()) return null;
    Document p = new Document();
    boolean keepsId = false;
    for (String name : spec.projection()) {
      String path = OutputFields.require(model, name, "projection").storageName();
      if ("_id".equals(path)) keepsId = true;
      p.append(path, 1);
    }
    if (!keepsId) p.append("_id", 0);
    return p;
  }
}
