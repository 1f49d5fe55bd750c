package io.intellixity.quarry.mongo;

import io.intellixity.quarry.spi.compile.CompiledArtifact;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

import java.util.List;
import java.util.Objects;

/**
 * Backend-native statement for MongoDB: a {@code find} with options, or an aggregation pipeline.
 * <p>
 * Documents held here are read-only once compiled. {@link #toJson()} renders the query shape (options are
 * execution settings and are left out), identically for equal specifications.
 */
public record MongoStatement(
    Kind kind,
    String collection,
    Document filter,
    Document projection,
    Document sort,
    Integer skip,
    Integer limit,
    List<Document> pipeline,
    MongoExecutionOptions options
) implements CompiledArtifact {
  public enum Kind {
    FIND,
    AGGREGATE
  }

  private static final JsonWriterSettings JSON = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

  public MongoStatement {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(collection, "collection");
    filter = filter == null ? new Document() : filter;
    pipeline = List.copyOf(pipeline == null ? List.of() : pipeline);
    options = options == null ? MongoExecutionOptions.defaults() : options;
  }

  public static MongoStatement find(String collection, Document filter, Document projection, Document sort,
                                    Integer skip, Integer limit) {
    return new MongoStatement(Kind.FIND, collection, filter, projection, sort, skip, limit, null, null);
  }

  public static MongoStatement aggregate(String collection, List<Document> pipeline, Integer limit) {
    return new MongoStatement(Kind.AGGREGATE, collection, null, null, null, null, limit, pipeline, null);
  }

  public MongoStatement withOptions(MongoExecutionOptions options) {
    return new MongoStatement(kind, collection, filter, projection, sort, skip, limit, pipeline, options);
  }

  @Override
  public boolean emptyResult() {
    return limit != null && limit == 0;
  }

  public String toJson() {
    Document d = new Document("kind", kind.name()).append("collection", collection);
    if (kind == Kind.AGGREGATE) {
      d.append("pipeline", pipeline);
    } else {
      d.append("filter", filter);
      if (projection != null) d.append("projection", projection);
      if (sort != null && !sort.isEmpty()) d.append("sort", sort);
      if (skip != null) d.append("skip", skip);
      if (limit != null) d.append("limit", limit);
    }
    return d.toJson(JSON);
  }
}
