package io.intellixity.quarry.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Immutable, ordered prefix sequence of {@link DomainTerm}s.
 *
 * <p>{@code AND}/{@code OR} consume the next two complete sub-expressions, {@code NOT} the next one.
 * Adjacent complete expressions at the top level are implicitly conjoined. The JSON form is a list
 * such as {@code ["|", ["role", "=", "admin"], ["role", "=", "manager"]]}.</p>
 */
@JsonSerialize(using = DomainJsonSerializer.class)
@JsonDeserialize(using = DomainJsonDeserializer.class)
public final class Domain {
  private static final Domain EMPTY = new Domain(List.of());

  private final List<DomainTerm> terms;

  private Domain(List<DomainTerm> terms) {
    this.terms = terms;
  }

  public static Domain empty() { return EMPTY; }

  public static Domain of(DomainTerm... terms) {
    return of(Arrays.asList(terms));
  }

  public static Domain of(List<? extends DomainTerm> terms) {
    if (terms == null || terms.isEmpty()) return EMPTY;
    List<DomainTerm> out = new ArrayList<>(terms.size());
    for (DomainTerm t : terms) out.add(Objects.requireNonNull(t, "domain term"));
    return new Domain(Collections.unmodifiableList(out));
  }

  public List<DomainTerm> terms() { return terms; }
  public int size() { return terms.size(); }
  public boolean isEmpty() { return terms.isEmpty(); }

  /** Appends {@code other} after this sequence; the two become implicitly conjoined top-level expressions. */
  public Domain concat(Domain other) {
    if (other == null || other.isEmpty()) return this;
    if (isEmpty()) return other;
    List<DomainTerm> out = new ArrayList<>(terms.size() + other.terms.size());
    out.addAll(terms);
    out.addAll(other.terms);
    return new Domain(Collections.unmodifiableList(out));
  }

  /** Leaves in sequence order. */
  public List<Leaf> leaves() {
    List<Leaf> out = new ArrayList<>();
    for (DomainTerm t : terms) if (t instanceof Leaf l) out.add(l);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Domain d && terms.equals(d.terms);
  }

  @Override
  public int hashCode() { return terms.hashCode(); }

  @Override
  public String toString() { return terms.toString(); }
}
