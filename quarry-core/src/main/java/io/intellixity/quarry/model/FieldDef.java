package io.intellixity.quarry.model;

import java.util.Objects;

/** Field metadata consumed from the model layer: logical name, declared type, storage name. */
public record FieldDef(String name, FieldType type, String storageName) {
  public FieldDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(type, "type");
    if (storageName == null || storageName.isBlank()) storageName = defaultStorageName(name, type);
  }

  public static FieldDef of(String name, FieldType type) {
    return new FieldDef(name, type, null);
  }

  private static String defaultStorageName(String name, FieldType type) {
    // the identifier field lives in Mongo's primary key slot unless mapped explicitly
    if ("id".equals(name) && type.kind() == FieldType.Kind.ID) return "_id";
    return name;
  }
}
