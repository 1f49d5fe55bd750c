package io.intellixity.quarry.mongo.bind;

import io.intellixity.quarry.domain.Operator;
import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.error.UnsupportedOperatorException;
import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.model.FieldType;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class MongoOperatorTableTest {
  private final MongoOperatorTable ops = new MongoOperatorTable();

  @Test
  void everyOperator_hasToken() {
    for (Operator op : Operator.values()) assertNotNull(ops.nativeToken(op));
    assertEquals("$nin", ops.nativeToken(Operator.NOT_IN));
    assertEquals("$not", ops.nativeToken(Operator.NOT_ILIKE));
    assertEquals("mongo", ops.backendId());
  }

  @Test
  void coerceThenDecoerce_returnsOriginal() {
    Map<FieldType, Object> samples = new LinkedHashMap<>();
    samples.put(FieldType.ID, "507f1f77bcf86cd799439011");
    samples.put(FieldType.TEXT, "hello");
    samples.put(FieldType.INTEGER, 42);
    samples.put(FieldType.LONG, 9_000_000_000L);
    samples.put(FieldType.FLOAT, 1.5d);
    samples.put(FieldType.DECIMAL, new BigDecimal("12.50"));
    samples.put(FieldType.BOOLEAN, true);
    samples.put(FieldType.DATETIME, Instant.parse("2024-03-01T10:15:30.123Z"));
    samples.put(FieldType.DATE, LocalDate.of(2024, 2, 29));
    samples.put(FieldType.UUID, UUID.fromString("123e4567-e89b-12d3-a456-426614174000"));
    samples.put(FieldType.DOCUMENT, Map.of("city", "Oslo", "geo", Map.of("lat", 59)));
    samples.put(FieldType.listOf(FieldType.TEXT), List.of("a", "b"));
    samples.put(FieldType.listOf(FieldType.DATE), List.of(LocalDate.of(2020, 1, 1)));

    for (Map.Entry<FieldType, Object> e : samples.entrySet()) {
      Object wire = ops.coerce(e.getKey(), e.getValue());
      assertEquals(e.getValue(), ops.decoerce(e.getKey(), wire), "round trip for " + e.getKey());
    }
  }

  @Test
  void wireForms() {
    assertInstanceOf(ObjectId.class, ops.coerce(FieldType.ID, "507f1f77bcf86cd799439011"));
    assertEquals("order-7", ops.coerce(FieldType.ID, "order-7"));
    assertInstanceOf(Decimal128.class, ops.coerce(FieldType.DECIMAL, new BigDecimal("1.10")));
    assertInstanceOf(Date.class, ops.coerce(FieldType.DATETIME, Instant.EPOCH));
    assertInstanceOf(Document.class, ops.coerce(FieldType.DOCUMENT, Map.of("a", 1)));
    assertEquals(7L, ops.decoerce(FieldType.LONG, 7));
  }

  @Test
  void applicability() {
    assertThrows(UnsupportedOperatorException.class,
        () -> ops.checkApplicable(Operator.LIKE, FieldType.INTEGER, "age"));
    assertThrows(UnsupportedOperatorException.class,
        () -> ops.checkApplicable(Operator.GT, FieldType.BOOLEAN, "active"));
    assertThrows(UnsupportedOperatorException.class,
        () -> ops.checkApplicable(Operator.IN, FieldType.DOCUMENT, "address"));
    assertThrows(UnsupportedOperatorException.class,
        () -> ops.checkApplicable(Operator.LT, FieldType.listOf(FieldType.INTEGER), "scores"));
    assertDoesNotThrow(() -> ops.checkApplicable(Operator.ILIKE, FieldType.listOf(FieldType.TEXT), "tags"));
    assertDoesNotThrow(() -> ops.checkApplicable(Operator.IS_NULL, FieldType.DOCUMENT, "address"));
  }

  @Test
  void operands() {
    FieldDef age = FieldDef.of("age", FieldType.LONG);
    assertEquals(List.of(1L, 2L), ops.coerceOperand(Operator.IN, age, List.of(1, 2)));
    assertEquals(18L, ops.coerceOperand(Operator.GTE, age, 18));
    assertNull(ops.coerceOperand(Operator.IS_NULL, age, null));

    FieldDef tags = FieldDef.of("tags", FieldType.listOf(FieldType.TEXT));
    assertEquals("vip", ops.coerceOperand(Operator.EQ, tags, "vip"));
    assertEquals(List.of("a", "b"), ops.coerceOperand(Operator.IN, tags, new String[] {"a", "b"}));

    assertThrows(CompilationException.class, () -> ops.coerceOperand(Operator.EQ, age, "eighteen"));
    assertThrows(UnsupportedOperatorException.class, () -> ops.coerceOperand(Operator.LIKE, age, "1%"));
  }

  @Test
  void decoerce_failures_areMappingErrors() {
    assertThrows(MappingException.class, () -> ops.decoerce(FieldType.LONG, "many"));
    assertThrows(MappingException.class, () -> ops.decoerce(FieldType.listOf(FieldType.TEXT), "single"));
    assertThrows(MappingException.class, () -> ops.decoerce(FieldType.BOOLEAN, 1));
    assertNull(ops.decoerce(FieldType.listOf(FieldType.TEXT), null));
  }

  @Test
  void missingCodec_isRejected() {
    Map<FieldType.Kind, MongoValueCodec> partial = new EnumMap<>(MongoValueCodecs.defaults());
    partial.remove(FieldType.Kind.UUID);
    assertThrows(IllegalArgumentException.class, () -> new MongoOperatorTable(partial));
  }
}
