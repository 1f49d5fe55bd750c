package io.intellixity.quarry.spi.compile;

import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.model.FieldLookup;
import io.intellixity.quarry.model.FieldType;
import io.intellixity.quarry.query.QuerySpecification;
import io.intellixity.quarry.query.operation.*;

import java.util.*;

/**
 * Tracks which fields exist, under which storage path and type, as a query's stages run.
 *
 * <p>The base scope is the model restricted to the projection. An aggregate replaces it with its group
 * fields and metric aliases ({@code count} is LONG, {@code avg} FLOAT, {@code sum} over INTEGER LONG, others keep the source type); a join
 * adds its alias as {@code list<document>}; a window adds its alias (ranking functions LONG, {@code avg}
 * FLOAT, {@code sum} over INTEGER LONG, others the source type). Fields produced by operations are stored under their own names.</p>
 */
public final class OutputFields {
  public static final FieldType JOINED = FieldType.listOf(FieldType.DOCUMENT);

  private OutputFields() {}

  /** Fields of the rows a specification produces, in output order. */
  public static List<FieldDef> resolve(QuerySpecification spec, FieldLookup model) {
    FieldScope scope = base(spec, model);
    for (OperationSpec op : spec.operations()) scope = after(op, scope);
    return scope.asList();
  }

  public static FieldScope base(QuerySpecification spec, FieldLookup model) {
    if (!spec.hasProjection()) return FieldScope.of(model.fields());
    List<FieldDef> out = new ArrayList<>();
    for (String name : spec.projection()) out.add(require(model, name, "projection"));
    return FieldScope.of(out);
  }

  public static FieldScope after(OperationSpec op, FieldScope scope) {
    return op.accept(new OperationVisitor<>() {
      @Override
      public FieldScope visit(AggregateSpec a) {
        List<FieldDef> out = new ArrayList<>();
        for (String g : a.groupBy()) {
          FieldDef src = require(scope, g, "group by");
          out.add(new FieldDef(g, src.type(), g));
        }
        for (Metric m : a.metrics()) out.add(new FieldDef(m.alias(), metricType(m, scope), m.alias()));
        return FieldScope.of(out);
      }

      @Override
      public FieldScope visit(JoinSpec j) {
        require(scope, j.localField(), "join");
        return scope.with(new FieldDef(j.alias(), JOINED, j.alias()));
      }

      @Override
      public FieldScope visit(WindowSpec w) {
        for (String p : w.partitionBy()) require(scope, p, "window partition");
        for (var s : w.orderBy()) require(scope, s.field(), "window order");
        return scope.with(new FieldDef(w.alias(), windowType(w, scope), w.alias()));
      }
    });
  }

  static FieldType metricType(Metric m, FieldLookup scope) {
    return switch (m.function()) {
      case COUNT -> {
        if (!m.countsRows()) require(scope, m.field(), "count");
        yield FieldType.LONG;
      }
      case AVG -> {
        require(scope, m.field(), "avg");
        yield FieldType.FLOAT;
      }
      case SUM -> widenSum(require(scope, m.field(), "sum").type());
      case MIN, MAX -> require(scope, m.field(), m.function().token()).type();
    };
  }

  static FieldType windowType(WindowSpec w, FieldLookup scope) {
    if (w.function().isRanking()) return FieldType.LONG;
    FieldType src = require(scope, w.sourceField(), "window " + w.function().token()).type();
    if (w.function() == WindowFunction.AVG) return FieldType.FLOAT;
    return w.function() == WindowFunction.SUM ? widenSum(src) : src;
  }

  // $sum promotes int32 totals to int64 on overflow
  static FieldType widenSum(FieldType src) {
    return src == FieldType.INTEGER ? FieldType.LONG : src;
  }

  /** @throws CompilationException when {@code name} is not visible in {@code scope} */
  public static FieldDef require(FieldLookup scope, String name, String where) {
    FieldDef f = scope.field(name);
    if (f == null) {
      throw new CompilationException("Unknown field '" + name + "' in " + where);
    }
    return f;
  }
}
