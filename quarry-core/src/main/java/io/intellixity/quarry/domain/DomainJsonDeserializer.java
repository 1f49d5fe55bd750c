package io.intellixity.quarry.domain;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;
import io.intellixity.quarry.error.MalformedDomainException;

import java.io.IOException;
import java.util.*;

/**
 * Reads the JSON list form of a {@link Domain}.
 * <p>
 * Combinators may be spelled {@code &amp;}/{@code |}/{@code !} or {@code and}/{@code or}/{@code not};
 * operators accept both symbolic ({@code >=}, {@code not in}) and named ({@code gte}, {@code not_in}) spellings.
 */
public final class DomainJsonDeserializer extends JsonDeserializer<Domain> {
  @Override
  public Domain deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isArray()) throw new MalformedDomainException("Domain JSON must be an array");

    List<DomainTerm> terms = new ArrayList<>();
    int i = 0;
    for (JsonNode n : root) {
      terms.add(parseTerm(n, i++, codec));
    }
    return Domain.of(terms);
  }

  private static DomainTerm parseTerm(JsonNode n, int position, ObjectCodec codec) throws IOException {
    if (n.isTextual()) {
      Combinator c = Combinator.fromToken(n.asText());
      if (c == null) throw new MalformedDomainException("Unknown combinator '" + n.asText() + "' at position " + position);
      return c;
    }
    if (!n.isArray() || n.size() < 2 || n.size() > 3) {
      throw new MalformedDomainException("Leaf at position " + position + " must be [field, operator, value]");
    }
    JsonNode f = n.get(0);
    JsonNode o = n.get(1);
    if (!f.isTextual() || !o.isTextual()) {
      throw new MalformedDomainException("Leaf at position " + position + " must start with a field name and an operator");
    }
    Operator op = Operator.fromToken(o.asText());
    if (op == null) throw new MalformedDomainException("Unknown operator '" + o.asText() + "' at position " + position);
    JsonNode v = n.size() == 3 ? n.get(2) : null;
    return new Leaf(f.asText(), op, toValue(v, codec));
  }

  private static Object toValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull() || v.isMissingNode()) return null;
    if (v.isArray()) {
      List<Object> out = new ArrayList<>(v.size());
      for (JsonNode x : v) out.add(toValue(x, codec));
      return out;
    }
    if (v.isObject()) return codec.treeToValue(v, Map.class);
    if (v.isTextual()) return v.asText();
    if (v.isBoolean()) return v.booleanValue();
    if (v.isIntegralNumber()) return v.canConvertToInt() ? (Object) v.intValue() : (Object) v.longValue();
    if (v.isBigDecimal()) return v.decimalValue();
    if (v.isNumber()) return v.doubleValue();
    return codec.treeToValue(v, Object.class);
  }
}
