package io.intellixity.quarry.mongo.stage;

import io.intellixity.quarry.query.SortField;
import io.intellixity.quarry.query.operation.WindowFrame;
import io.intellixity.quarry.query.operation.WindowSpec;
import io.intellixity.quarry.spi.compile.FieldScope;
import io.intellixity.quarry.spi.compile.OutputFields;
import org.bson.Document;

import java.util.*;

/**
 * One {@code $setWindowFields} stage. Ranking functions map to {@code $documentNumber}, {@code $rank} and
 * {@code $denseRank}; aggregates carry a {@code documents} or {@code range} window when a frame is given and
 * otherwise run over the whole partition.
 */
public final class MongoWindowCompiler {
  static final String UNBOUNDED = "unbounded";

  public List<Document> compile(WindowSpec spec, FieldScope scope) {
    Document stage = new Document();

    if (spec.partitionBy().size() == 1) {
      stage.append("partitionBy", "$" + path(scope, spec.partitionBy().get(0), "window partition"));
    } else if (!spec.partitionBy().isEmpty()) {
      Document key = new Document();
      for (String p : spec.partitionBy()) key.append(p, "$" + path(scope, p, "window partition"));
      stage.append("partitionBy", key);
    }

    if (!spec.orderBy().isEmpty()) {
      Document sortBy = new Document();
      for (SortField s : spec.orderBy()) {
        sortBy.append(path(scope, s.field(), "window order"), s.direction() == SortField.Direction.DESC ? -1 : 1);
      }
      stage.append("sortBy", sortBy);
    }

    stage.append("output", new Document(spec.alias(), output(spec, scope)));
    return List.of(new Document("$setWindowFields", stage));
  }

  private static Document output(WindowSpec spec, FieldScope scope) {
    switch (spec.function()) {
      case ROW_NUMBER:
        return new Document("$documentNumber", new Document());
      case RANK:
        return new Document("$rank", new Document());
      case DENSE_RANK:
        return new Document("$denseRank", new Document());
      default:
        break;
    }
    String ref = "$" + path(scope, spec.sourceField(), "window " + spec.function().token());
    Document out = new Document("$" + spec.function().token(), ref);
    WindowFrame frame = spec.frame();
    if (frame != null) {
      String unit = frame.unit() == WindowFrame.Unit.RANGE ? "range" : "documents";
      out.append("window", new Document(unit, Arrays.asList(bound(frame.start()), bound(frame.end()))));
    }
    return out;
  }

  private static Object bound(Long b) {
    return b == null ? UNBOUNDED : b;
  }

  private static String path(FieldScope scope, String field, String where) {
    return OutputFields.require(scope, field, where).storageName();
  }
}
