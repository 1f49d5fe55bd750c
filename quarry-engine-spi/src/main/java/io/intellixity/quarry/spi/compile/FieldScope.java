package io.intellixity.quarry.spi.compile;

import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.model.FieldLookup;

import java.util.*;

/** Ordered set of fields visible at one point of a pipeline. */
public final class FieldScope implements FieldLookup {
  private final Map<String, FieldDef> fields;

  private FieldScope(Map<String, FieldDef> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  public static FieldScope of(Collection<FieldDef> defs) {
    Map<String, FieldDef> m = new LinkedHashMap<>();
    for (FieldDef d : defs) m.put(d.name(), d);
    return new FieldScope(m);
  }

  @Override
  public FieldDef field(String name) { return name == null ? null : fields.get(name); }

  @Override
  public Collection<FieldDef> fields() { return fields.values(); }

  /** Copy with {@code def} added, or replacing an existing field of the same name. */
  public FieldScope with(FieldDef def) {
    Map<String, FieldDef> m = new LinkedHashMap<>(fields);
    m.put(def.name(), def);
    return new FieldScope(m);
  }

  public List<FieldDef> asList() { return List.copyOf(fields.values()); }
}
