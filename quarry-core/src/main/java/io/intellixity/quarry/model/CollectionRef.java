package io.intellixity.quarry.model;

public record CollectionRef(String name) {
  public CollectionRef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("collection name is required");
  }
}
