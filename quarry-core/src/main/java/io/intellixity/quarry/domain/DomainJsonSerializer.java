package io.intellixity.quarry.domain;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON list form for {@link Domain}: combinators as symbols, leaves as {@code [field, op, value]}. */
public final class DomainJsonSerializer extends JsonSerializer<Domain> {
  @Override
  public void serialize(Domain d, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (d == null) {
      g.writeNull();
      return;
    }
    g.writeStartArray();
    for (DomainTerm t : d.terms()) {
      if (t instanceof Combinator c) {
        g.writeString(c.symbol());
      } else if (t instanceof Leaf leaf) {
        g.writeStartArray();
        g.writeString(leaf.field());
        g.writeString(leaf.operator().symbol());
        if (leaf.value() == null) g.writeNull();
        else serializers.defaultSerializeValue(leaf.value(), g);
        g.writeEndArray();
      }
    }
    g.writeEndArray();
  }
}
