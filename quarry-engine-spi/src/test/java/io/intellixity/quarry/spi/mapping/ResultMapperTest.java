package io.intellixity.quarry.spi.mapping;

import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.mapping.TypedRecord;
import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.model.FieldType;
import io.intellixity.quarry.spi.PassThroughOperatorTable;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ResultMapperTest {
  private final ResultMapper mapper = new ResultMapper(List.of(
      FieldDef.of("id", FieldType.ID),
      new FieldDef("city", FieldType.TEXT, "address.city"),
      FieldDef.of("visits", FieldType.LONG),
      FieldDef.of("tags", FieldType.listOf(FieldType.TEXT))), new PassThroughOperatorTable());

  @Test
  void readsStorageNamesAndNestedPaths() {
    TypedRecord r = mapper.apply(Map.of("_id", "u1", "address", Map.of("city", "Oslo"), "visits", 4));
    assertEquals("u1", r.get("id"));
    assertEquals("Oslo", r.get("city"));
    assertEquals(4L, r.get("visits"));
    assertEquals(List.of(), r.get("tags"));
  }

  @Test
  void presentNull_staysNull() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("tags", null);
    TypedRecord r = mapper.apply(raw);
    assertTrue(r.has("tags"));
    assertNull(r.get("tags"));
  }

  @Test
  void failure_namesField() {
    MappingException e = assertThrows(MappingException.class, () -> mapper.apply(Map.of("visits", "many")));
    assertEquals("visits", e.field());
  }
}
