package io.intellixity.quarry.mongo;

import org.bson.Document;

import java.util.Map;

/**
 * Driver-level settings applied to every statement an engine runs.
 *
 * @param batchSize    documents per cursor batch; null leaves the driver default
 * @param allowDiskUse lets aggregation stages spill to disk; null leaves the server default
 * @param hintName     index to force, by name; exclusive with {@code hintKeys}
 * @param hintKeys     index to force, by key specification ({@code {field: 1|-1}}); exclusive with {@code hintName}
 */
public record MongoExecutionOptions(Integer batchSize, Boolean allowDiskUse, String hintName, Document hintKeys) {
  private static final MongoExecutionOptions DEFAULTS = new MongoExecutionOptions(null, null);

  public MongoExecutionOptions {
    if (batchSize != null && batchSize < 0) throw new IllegalArgumentException("batchSize must be >= 0");
    if (hintName != null && hintKeys != null) {
      throw new IllegalArgumentException("Index hint is either a name or a key specification, not both");
    }
    if (hintName != null && hintName.isBlank()) throw new IllegalArgumentException("hintName must not be blank");
    if (hintKeys != null) hintKeys = keySpec(hintKeys);
  }

  public MongoExecutionOptions(Integer batchSize, Boolean allowDiskUse) {
    this(batchSize, allowDiskUse, null, null);
  }

  public static MongoExecutionOptions defaults() { return DEFAULTS; }

  public MongoExecutionOptions withBatchSize(Integer batchSize) {
    return new MongoExecutionOptions(batchSize, allowDiskUse, hintName, hintKeys);
  }

  public MongoExecutionOptions withAllowDiskUse(Boolean allowDiskUse) {
    return new MongoExecutionOptions(batchSize, allowDiskUse, hintName, hintKeys);
  }

  /** Forces the index named {@code indexName}; replaces any previous hint. */
  public MongoExecutionOptions withHint(String indexName) {
    return new MongoExecutionOptions(batchSize, allowDiskUse, indexName, null);
  }

  /** Forces the index with these keys, in order; replaces any previous hint. */
  public MongoExecutionOptions withHint(Document keys) {
    return new MongoExecutionOptions(batchSize, allowDiskUse, null, keys);
  }

  public boolean hasHint() { return hintName != null || hintKeys != null; }

  private static Document keySpec(Document keys) {
    if (keys.isEmpty()) throw new IllegalArgumentException("hintKeys must name at least one field");
    Document copy = new Document();
    for (Map.Entry<String, Object> e : keys.entrySet()) {
      Object dir = e.getValue();
      if (!(dir instanceof Integer i) || (i != 1 && i != -1)) {
        throw new IllegalArgumentException("Index direction for '" + e.getKey() + "' must be 1 or -1, got " + dir);
      }
      copy.append(e.getKey(), dir);
    }
    return copy;
  }
}
