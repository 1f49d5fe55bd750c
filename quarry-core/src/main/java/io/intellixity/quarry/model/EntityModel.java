package io.intellixity.quarry.model;

import java.util.*;

/**
 * Field metadata for one stored entity: its name, the collection that stores it and its fields.
 */
public final class EntityModel implements FieldLookup {
  private final String name;
  private final CollectionRef collection;
  private final Map<String, FieldDef> fields;

  private EntityModel(String name, CollectionRef collection, Map<String, FieldDef> fields) {
    this.name = name;
    this.collection = collection;
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public String name() { return name; }
  public CollectionRef collection() { return collection; }

  @Override
  public FieldDef field(String name) { return name == null ? null : fields.get(name); }

  @Override
  public Collection<FieldDef> fields() { return fields.values(); }

  public static Builder builder(String name) { return new Builder(name); }

  public static final class Builder {
    private final String name;
    private String collection;
    private final Map<String, FieldDef> fields = new LinkedHashMap<>();

    private Builder(String name) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("entity name is required");
      this.name = name;
    }

    public Builder collection(String collection) { this.collection = collection; return this; }

    public Builder field(String name, FieldType type) { return field(FieldDef.of(name, type)); }

    public Builder field(String name, String typeId) { return field(FieldDef.of(name, FieldType.parse(typeId))); }

    public Builder field(String name, FieldType type, String storageName) {
      return field(new FieldDef(name, type, storageName));
    }

    public Builder field(FieldDef def) {
      Objects.requireNonNull(def, "def");
      if (fields.putIfAbsent(def.name(), def) != null) {
        throw new IllegalArgumentException("Duplicate field '" + def.name() + "' in entity '" + name + "'");
      }
      return this;
    }

    public EntityModel build() {
      String c = (collection == null || collection.isBlank()) ? name.toLowerCase(Locale.ROOT) : collection;
      return new EntityModel(name, new CollectionRef(c), fields);
    }
  }
}
