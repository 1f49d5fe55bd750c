package io.intellixity.quarry.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.quarry.error.QueryExecutionException;
import io.intellixity.quarry.spi.exec.Connection;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoClientConnectionPoolTest {
  @Test
  void translate_keepsServerCode() {
    MongoException cause = new MongoException(11000, "E11000 duplicate key error");
    QueryExecutionException e = MongoClientConnectionPool.translate(cause);
    assertEquals("11000", e.nativeCode());
    assertSame(cause, e.getCause());
    assertTrue(e.getMessage().contains("E11000"));
  }

  @Test
  void leases_areCounted() {
    try (MongoClient client = MongoClients.create("mongodb://localhost:27017/?serverSelectionTimeoutMS=100")) {
      MongoHandle handle = new MongoHandle("primary", client, "shop");
      MongoClientConnectionPool pool = new MongoClientConnectionPool(handle);
      Connection<MongoStatement> a = pool.acquire();
      Connection<MongoStatement> b = pool.acquire();
      assertEquals(2, pool.leased());
      pool.release(a);
      pool.release(b);
      assertEquals(0, pool.leased());
      assertEquals("shop", handle.db().getName());
    }
  }

  @Test
  void find_appliesNamedHintAndCursorOptions() {
    Map<String, Object> calls = new LinkedHashMap<>();
    MongoStatement st = MongoStatement.find("orders", new Document("status", "paid"), null, null, null, 10)
        .withOptions(MongoExecutionOptions.defaults().withBatchSize(50).withHint("status_1"));

    MongoClientConnectionPool.MongoClientConnection.configure(recorder(FindIterable.class, calls), st);

    assertEquals(List.of("limit", "batchSize", "hintString"), List.copyOf(calls.keySet()));
    assertEquals("status_1", calls.get("hintString"));
  }

  @Test
  void aggregate_appliesKeyHintAndDiskUse() {
    Map<String, Object> calls = new LinkedHashMap<>();
    Document keys = new Document("status", 1).append("amount", -1);
    MongoExecutionOptions opts = new MongoExecutionOptions(null, true).withHint(keys);

    MongoClientConnectionPool.MongoClientConnection.configure(recorder(AggregateIterable.class, calls), opts);

    assertEquals(List.of("allowDiskUse", "hint"), List.copyOf(calls.keySet()));
    assertEquals(keys, calls.get("hint"));
  }

  @Test
  void noHint_leavesDriverDefaults() {
    Map<String, Object> calls = new LinkedHashMap<>();
    MongoClientConnectionPool.MongoClientConnection.configure(
        recorder(AggregateIterable.class, calls), MongoExecutionOptions.defaults());
    assertTrue(calls.isEmpty());
  }

  @Test
  void hintOptions_areValidated() {
    assertThrows(IllegalArgumentException.class,
        () -> new MongoExecutionOptions(null, null, "status_1", new Document("status", 1)));
    assertThrows(IllegalArgumentException.class, () -> MongoExecutionOptions.defaults().withHint(" "));
    assertThrows(IllegalArgumentException.class, () -> MongoExecutionOptions.defaults().withHint(new Document()));
    assertThrows(IllegalArgumentException.class,
        () -> MongoExecutionOptions.defaults().withHint(new Document("status", 2)));

    MongoExecutionOptions named = MongoExecutionOptions.defaults().withHint(new Document("a", 1)).withHint("a_1");
    assertEquals("a_1", named.hintName());
    assertNull(named.hintKeys());
  }

  @Test
  void hintKeys_areCopied() {
    Document keys = new Document("status", 1);
    MongoExecutionOptions opts = MongoExecutionOptions.defaults().withHint(keys);
    keys.append("amount", -1);
    assertEquals(new Document("status", 1), opts.hintKeys());
  }

  /** Fluent stand-in for a driver iterable that records the last argument of each call. */
  @SuppressWarnings("unchecked")
  private static <T> T recorder(Class<?> type, Map<String, Object> calls) {
    return (T) Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]{type}, (proxy, method, args) -> {
      calls.put(method.getName(), args == null ? null : args[0]);
      return proxy;
    });
  }
}
