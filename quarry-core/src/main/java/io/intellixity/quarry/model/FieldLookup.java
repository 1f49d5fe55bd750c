package io.intellixity.quarry.model;

import java.util.Collection;

/** Lookup from logical field name to {@link FieldDef}. */
public interface FieldLookup {
  /** Returns the field, or null if the name is unknown. */
  FieldDef field(String name);

  /** All fields in declaration order. */
  Collection<FieldDef> fields();
}
