package io.intellixity.quarry.spi.mapping;

import io.intellixity.quarry.error.MappingException;
import io.intellixity.quarry.mapping.RowAdapter;
import io.intellixity.quarry.mapping.RowAdapters;
import io.intellixity.quarry.mapping.TypedRecord;
import io.intellixity.quarry.model.FieldDef;
import io.intellixity.quarry.spi.compile.OperatorTable;

import java.util.*;
import java.util.function.Function;

/**
 * Maps raw backend documents to {@link TypedRecord}s over a fixed list of output fields.
 * <p>
 * Raw fields not in the list are dropped. A listed field missing from the document takes its type's absent
 * value; a present one goes through {@link OperatorTable#decoerce}.
 */
public final class ResultMapper implements Function<Map<String, Object>, TypedRecord> {
  private final List<FieldDef> fields;
  private final OperatorTable operators;

  public ResultMapper(List<FieldDef> fields, OperatorTable operators) {
    this.fields = List.copyOf(fields);
    this.operators = Objects.requireNonNull(operators, "operators");
  }

  public List<FieldDef> fields() { return fields; }

  @Override
  public TypedRecord apply(Map<String, Object> raw) {
    return map(RowAdapters.fromMap(raw));
  }

  public TypedRecord map(RowAdapter row) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (FieldDef f : fields) {
      String path = f.storageName();
      if (!row.has(path)) {
        out.put(f.name(), f.type().absentValue());
        continue;
      }
      Object raw = row.raw(path);
      try {
        out.put(f.name(), operators.decoerce(f.type(), raw));
      } catch (MappingException e) {
        if (e.field() != null) throw e;
        throw new MappingException(f.name(), e.rowIndex(), "Field '" + f.name() + "': " + e.getMessage(), e);
      }
    }
    return TypedRecord.of(out);
  }
}
