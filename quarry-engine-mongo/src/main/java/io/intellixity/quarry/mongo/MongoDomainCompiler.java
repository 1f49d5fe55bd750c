package io.intellixity.quarry.mongo;

import io.intellixity.quarry.domain.*;
import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.model.FieldLookup;
import io.intellixity.quarry.spi.compile.OperatorTable;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders a normalized domain tree to a MongoDB filter {@link Document}.
 *
 * <p>Nested AND (OR) nodes are flattened into a single {@code $and} ({@code $or}) list and identity children
 * are dropped; NOT becomes {@code $nor}. LIKE patterns become anchored regexes ({@code %} any run,
 * {@code _} one character, everything else literal).</p>
 */
public final class MongoDomainCompiler implements DomainVisitor<Document> {
  private final FieldLookup scope;
  private final OperatorTable operators;

  public MongoDomainCompiler(FieldLookup scope, OperatorTable operators) {
    this.scope = Objects.requireNonNull(scope, "scope");
    this.operators = Objects.requireNonNull(operators, "operators");
  }

  /** Normalizes {@code domain} and renders it; an empty domain renders to an empty document. */
  public static Document compile(Domain domain, FieldLookup scope, OperatorTable operators) {
    return DomainNormalizer.normalize(domain).accept(new MongoDomainCompiler(scope, operators));
  }

  @Override
  public Document visit(Leaf leaf) {
    FieldDef f = scope.field(leaf.field());
    if (f == null) throw new CompilationException("Unknown field '" + leaf.field() + "' in filter");
    String path = f.storageName();
    Operator op = leaf.operator();
    Object operand = operators.coerceOperand(op, f, leaf.value());

    switch (op) {
      case LIKE:
        return new Document(path, regex((String) operand, false));
      case ILIKE:
        return new Document(path, regex((String) operand, true));
      case NOT_LIKE:
        return new Document(path, new Document(operators.nativeToken(op), regex((String) operand, false)));
      case NOT_ILIKE:
        return new Document(path, new Document(operators.nativeToken(op), regex((String) operand, true)));
      default:
        return new Document(path, new Document(operators.nativeToken(op), operand));
    }
  }

  @Override
  public Document visit(AndNode and) {
    List<DomainNode> children = new ArrayList<>();
    flattenAnd(and, children);
    return combine("$and", children);
  }

  @Override
  public Document visit(OrNode or) {
    List<DomainNode> children = new ArrayList<>();
    flattenOr(or, children);
    return combine("$or", children);
  }

  @Override
  public Document visit(NotNode not) {
    return new Document("$nor", List.of(not.operand().accept(this)));
  }

  @Override
  public Document visit(TrueNode identity) {
    return new Document();
  }

  private Document combine(String key, List<DomainNode> children) {
    List<Document> parts = new ArrayList<>(children.size());
    for (DomainNode child : children) {
      Document d = child.accept(this);
      if (!d.isEmpty()) parts.add(d);
    }
    if (parts.isEmpty()) return new Document();
    if (parts.size() == 1) return parts.get(0);
    return new Document(key, parts);
  }

  private static void flattenAnd(DomainNode n, List<DomainNode> out) {
    if (n instanceof AndNode a) {
      flattenAnd(a.left(), out);
      flattenAnd(a.right(), out);
    } else {
      out.add(n);
    }
  }

  private static void flattenOr(DomainNode n, List<DomainNode> out) {
    if (n instanceof OrNode o) {
      flattenOr(o.left(), out);
      flattenOr(o.right(), out);
    } else {
      out.add(n);
    }
  }

  private static Document regex(String likePattern, boolean caseInsensitive) {
    Document d = new Document("$regex", likeToRegex(likePattern));
    if (caseInsensitive) d.append("$options", "i");
    return d;
  }

  /** Translates a SQL LIKE pattern to an anchored regex; literal runs are quoted as a whole. */
  static String likeToRegex(String likePattern) {
    StringBuilder re = new StringBuilder("^");
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          re.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        re.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) re.append(Pattern.quote(literal.toString()));
    return re.append("$").toString();
  }
}
