package io.intellixity.quarry.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.quarry.error.MalformedDomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DomainJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesPrefixList() throws Exception {
    String s = """
        ["|", ["role", "=", "admin"], ["role", "=", "manager"]]
        """;
    Domain d = JSON.readValue(s, Domain.class);
    assertEquals(List.of(Combinator.OR,
        new Leaf("role", Operator.EQ, "admin"),
        new Leaf("role", Operator.EQ, "manager")), d.terms());
  }

  @Test
  void acceptsNamedSpellings() throws Exception {
    String s = """
        ["and", ["age", "gte", 18], "not", ["role", "not_in", ["guest", "bot"]], ["deletedAt", "is null"]]
        """;
    Domain d = JSON.readValue(s, Domain.class);
    assertEquals(Combinator.AND, d.terms().get(0));
    assertEquals(new Leaf("age", Operator.GTE, 18), d.terms().get(1));
    assertEquals(Combinator.NOT, d.terms().get(2));
    assertEquals(new Leaf("role", Operator.NOT_IN, List.of("guest", "bot")), d.terms().get(3));
    assertEquals(new Leaf("deletedAt", Operator.IS_NULL, null), d.terms().get(4));
  }

  @Test
  void notCombinatorAcceptsName() throws Exception {
    Domain d = JSON.readValue("[\"not\", [\"role\", \"in\", [\"guest\"]]]", Domain.class);
    assertEquals(List.of(Combinator.NOT, new Leaf("role", Operator.IN, List.of("guest"))), d.terms());
  }

  @Test
  void writesSymbols() throws Exception {
    Domain d = Domains.or(Domains.eq("role", "admin"), Domains.isNull("role"));
    assertEquals("[\"|\",[\"role\",\"=\",\"admin\"],[\"role\",\"is null\",null]]", JSON.writeValueAsString(d));
  }

  @Test
  void writtenFormReadsBack() throws Exception {
    Domain d = Domains.and(Domains.gte("age", 18), Domains.notLike("name", "bot%"));
    assertEquals(d, JSON.readValue(JSON.writeValueAsString(d), Domain.class));
  }

  @Test
  void unknownOperator_isMalformed() {
    Exception e = assertThrows(Exception.class, () -> JSON.readValue("[[\"age\", \"~\", 1]]", Domain.class));
    assertTrue(e instanceof MalformedDomainException || e.getCause() instanceof MalformedDomainException);
  }
}
