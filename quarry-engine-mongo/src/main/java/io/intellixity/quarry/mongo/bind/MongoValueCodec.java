package io.intellixity.quarry.mongo.bind;

import io.intellixity.quarry.model.FieldType;

/** Converts values of one scalar field kind between caller types and Mongo wire types. */
public interface MongoValueCodec {
  FieldType.Kind kind();

  /** Caller value to wire value; rejects values the kind cannot represent with IllegalArgumentException. */
  Object coerce(Object value);

  /** Wire value to caller value; rejects unexpected wire types with IllegalArgumentException. */
  Object decoerce(Object raw);
}
