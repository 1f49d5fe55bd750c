package io.intellixity.quarry.mapping;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class RowAdaptersTest {
  @Test
  void paths_distinguishMissingFromNull() {
    Map<String, Object> address = new HashMap<>();
    address.put("city", "Oslo");
    address.put("zip", null);
    Map<String, Object> row = new HashMap<>();
    row.put("address", address);
    RowAdapter r = RowAdapters.fromMap(row);

    assertEquals("Oslo", r.raw("address.city"));
    assertTrue(r.has("address.zip"));
    assertNull(r.raw("address.zip"));
    assertFalse(r.has("address.street"));
    assertFalse(r.has("phone.number"));
    assertEquals("Oslo", r.object("address").raw("city"));
  }

  @Test
  void coercions_listAndMap() {
    assertEquals(List.of(2, 4), Coercions.toList(List.of(1, 2), o -> (Integer) o * 2));
    assertEquals(Map.of("a", "1"), Coercions.toMap(Map.of("a", 1), String::valueOf));
    assertThrows(IllegalArgumentException.class, () -> Coercions.iterable("x"));
  }

  @Test
  void typedRecord_keepsOrderAndChecksTypes() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("b", 1L);
    m.put("a", "x");
    TypedRecord r = TypedRecord.of(m);
    assertEquals(List.of("b", "a"), List.copyOf(r.fields()));
    assertEquals(1L, r.get("b", Long.class));
    assertThrows(ClassCastException.class, () -> r.get("a", Long.class));
    assertThrows(UnsupportedOperationException.class, () -> r.asMap().put("c", 1));
  }
}
