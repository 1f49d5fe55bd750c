package io.intellixity.quarry.spi.exec;

import io.intellixity.quarry.error.CompilationException;
import io.intellixity.quarry.mapping.TypedRecord;
import io.intellixity.quarry.model.EntityModel;
import io.intellixity.quarry.model.FieldLookup;
import io.intellixity.quarry.model.FieldType;
import io.intellixity.quarry.query.QuerySpecification;
import io.intellixity.quarry.spi.PassThroughOperatorTable;
import io.intellixity.quarry.spi.compile.OperatorTable;
import io.intellixity.quarry.spi.compile.QueryCompiler;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutableQueryTest {
  private static final EntityModel USER = EntityModel.builder("User")
      .collection("users")
      .field("name", FieldType.TEXT)
      .field("age", FieldType.LONG)
      .field("tags", FieldType.listOf(FieldType.TEXT))
      .build();

  private static final List<Map<String, Object>> ROWS = List.of(
      Map.of("name", "ada", "age", 36, "password", "x"),
      Map.of("name", "alan"));

  private final CountingCompiler compiler = new CountingCompiler();
  private final FakePool pool = new FakePool();
  private final TestEngine engine = new TestEngine(compiler, pool);

  @Test
  void compile_isCached_untilBuilderChanges() {
    ExecutableQuery<FakeArtifact> q = engine.query(USER).orderBy("name");
    FakeArtifact first = q.compile();
    assertSame(first, q.compile());
    assertEquals(1, compiler.compiles);

    q.limit(1);
    assertNotSame(first, q.compile());
    assertEquals(2, compiler.compiles);
  }

  @Test
  void execute_mapsToDeclaredFields() {
    List<TypedRecord> rows = engine.query(USER).toList();
    assertEquals(2, rows.size());
    assertEquals(List.of("name", "age", "tags"), List.copyOf(rows.get(0).fields()));
    assertEquals(36L, rows.get(0).get("age"));
    assertFalse(rows.get(0).has("password"));
    assertNull(rows.get(1).get("age"));
    assertEquals(List.of(), rows.get(1).get("tags"));
    assertEquals(1, pool.released);
  }

  @Test
  void execute_projectionRestrictsFields() {
    List<TypedRecord> rows = engine.query(USER).select("name").toList();
    assertEquals(Set.of("name"), rows.get(0).fields());
  }

  @Test
  void limitZero_skipsBackend() {
    assertTrue(engine.query(USER).limit(0).toList().isEmpty());
    assertEquals(0, pool.acquired);
  }

  @Test
  void unfinishedSubBuilder_failsBeforeIo() {
    ExecutableQuery<FakeArtifact> q = engine.query(USER);
    q.groupBy("name").count();
    assertThrows(CompilationException.class, q::compile);
    assertEquals(0, pool.acquired);
  }

  @Test
  void unknownProjection_failsBeforeIo() {
    assertThrows(CompilationException.class, () -> engine.query(USER).select("email").toList());
    assertEquals(0, pool.acquired);
  }

  private static final class CountingCompiler implements QueryCompiler<FakeArtifact> {
    int compiles;

    @Override
    public String backendId() { return "test"; }

    @Override
    public OperatorTable operators() { return new PassThroughOperatorTable(); }

    @Override
    public FakeArtifact compile(QuerySpecification spec, FieldLookup model) {
      compiles++;
      boolean empty = spec.limit() != null && spec.limit() == 0;
      return new FakeArtifact(spec.target().name(), ROWS, empty);
    }
  }

  private static final class TestEngine extends AbstractQueryEngine<FakeArtifact> {
    TestEngine(QueryCompiler<FakeArtifact> compiler, ConnectionPool<FakeArtifact> pool) {
      super(compiler, pool);
    }
  }
}
