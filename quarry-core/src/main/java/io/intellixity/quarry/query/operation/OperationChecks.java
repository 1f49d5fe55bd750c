package io.intellixity.quarry.query.operation;

import io.intellixity.quarry.domain.DomainNormalizer;
import io.intellixity.quarry.domain.Leaf;
import io.intellixity.quarry.error.CompilationException;

import java.util.*;

/**
 * Consistency checks on operation specs. Run when a sub-builder is finalized and again by the compilers,
 * so specs assembled by hand fail the same way before any I/O.
 */
public final class OperationChecks {
  private OperationChecks() {}

  public static void check(OperationSpec op) {
    if (op instanceof AggregateSpec a) check(a);
    else if (op instanceof JoinSpec j) check(j);
    else if (op instanceof WindowSpec w) check(w);
  }

  public static void check(AggregateSpec a) {
    if (a.groupBy().isEmpty() && a.metrics().isEmpty()) {
      throw new CompilationException("Aggregate needs at least one group field or metric");
    }
    Set<String> names = new HashSet<>();
    for (String g : a.groupBy()) {
      if (g == null || g.isBlank()) throw new CompilationException("Aggregate group field is blank");
      if (!names.add(g)) throw new CompilationException("Duplicate group field '" + g + "'");
    }
    for (Metric m : a.metrics()) {
      if (!names.add(m.alias())) throw new CompilationException("Duplicate aggregate alias '" + m.alias() + "'");
      if (m.function() != AggregateFunction.COUNT && Metric.ALL.equals(m.field())) {
        throw new CompilationException("Aggregate " + m.function().token() + " needs a source field");
      }
    }
    if (!a.having().isEmpty()) {
      DomainNormalizer.normalize(a.having());
      for (Leaf l : a.having().leaves()) {
        if (!names.contains(l.field())) {
          throw new CompilationException("Having refers to '" + l.field() + "', which is neither a group field nor an alias");
        }
      }
    }
  }

  public static void check(JoinSpec j) {
    if (isBlank(j.localField()) || isBlank(j.foreignField())) {
      throw new CompilationException("Join with '" + j.target().name() + "' needs a local and a foreign field");
    }
  }

  public static void check(WindowSpec w) {
    WindowFunction fn = w.function();
    WindowFrame frame = w.frame();
    if (isBlank(w.alias())) throw new CompilationException("Window function " + fn.token() + " needs an alias");
    if (frame != null && frame.start() != null && frame.end() != null && frame.start() > frame.end()) {
      throw new CompilationException("Window frame start " + frame.start() + " is after end " + frame.end());
    }
    if (fn.isRanking()) {
      if (w.orderBy().isEmpty()) throw new CompilationException("Window function " + fn.token() + " needs an order");
      if (frame != null) throw new CompilationException("Window function " + fn.token() + " does not take a frame");
      if (fn != WindowFunction.ROW_NUMBER && w.orderBy().size() != 1) {
        throw new CompilationException("Window function " + fn.token() + " needs exactly one order key");
      }
      if (w.sourceField() != null) {
        throw new CompilationException("Window function " + fn.token() + " does not take a source field");
      }
    } else if (isBlank(w.sourceField())) {
      throw new CompilationException("Window function " + fn.token() + " needs a source field");
    }
    if (frame != null && w.orderBy().isEmpty()) {
      throw new CompilationException("Window frame needs an order");
    }
    if (frame != null && frame.unit() == WindowFrame.Unit.RANGE && w.orderBy().size() != 1) {
      throw new CompilationException("Range window frame needs exactly one order key");
    }
  }

  private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
