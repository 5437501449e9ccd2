package org.dbms.dsource.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scan options shared by the file-backed data sources.
 *
 * <p>All fields are nullable. A null value means the default is used. Options can be built with
 * {@link #builder()} or read from a flat map of dotted keys with {@link #fromStringMap(Map)}.
 *
 * @param batchSize Maximum number of rows per yielded batch (default 8192)
 * @param strictProjection Whether a projected name absent from a Parquet file fails the scan
 *     (default true). When false, unmatched names are dropped from the projection silently.
 */
public record SourceOptions(Integer batchSize, Boolean strictProjection) {

  /** Default maximum number of rows per batch. */
  public static final int DEFAULT_BATCH_SIZE = 8192;

  private static final String PREFIX = "dbms.source.";
  static final String BATCH_SIZE_KEY = PREFIX + "batch_size";
  static final String STRICT_PROJECTION_KEY = PREFIX + "strict_projection";

  public SourceOptions {
    if (batchSize != null && batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
    }
  }

  /** Returns options with every field unset. */
  public static SourceOptions defaults() {
    return new SourceOptions(null, null);
  }

  /** Returns a new builder. */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads options from dotted keys such as {@code dbms.source.batch_size}. Unknown keys are
   * ignored.
   *
   * @param options the options map
   * @return the parsed options
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static SourceOptions fromStringMap(Map<String, String> options) {
    Builder builder = builder();
    String batchSize = options.get(BATCH_SIZE_KEY);
    if (batchSize != null) {
      try {
        builder.batchSize(Integer.parseInt(batchSize.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Invalid value for " + BATCH_SIZE_KEY + ": " + batchSize, e);
      }
    }
    String strict = options.get(STRICT_PROJECTION_KEY);
    if (strict != null) {
      builder.strictProjection(parseBoolean(STRICT_PROJECTION_KEY, strict.trim()));
    }
    return builder.build();
  }

  private static boolean parseBoolean(String key, String value) {
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
  }

  /** Returns the batch size, or {@link #DEFAULT_BATCH_SIZE} if unset. */
  public int effectiveBatchSize() {
    return batchSize != null ? batchSize : DEFAULT_BATCH_SIZE;
  }

  /** Returns the projection policy, or {@code true} if unset. */
  public boolean effectiveStrictProjection() {
    return strictProjection == null || strictProjection;
  }

  /** Serializes the non-null options into a map with dotted keys. */
  public Map<String, String> toOptionsMap() {
    Map<String, String> map = new LinkedHashMap<>();
    writeTo(map);
    return map;
  }

  void writeTo(Map<String, String> map) {
    putIfPresent(map, BATCH_SIZE_KEY, batchSize);
    putIfPresent(map, STRICT_PROJECTION_KEY, strictProjection);
  }

  private static void putIfPresent(Map<String, String> map, String key, Object value) {
    if (value != null) {
      map.put(key, value.toString());
    }
  }

  /** Builder for SourceOptions. */
  public static final class Builder {
    private Integer batchSize;
    private Boolean strictProjection;

    private Builder() {}

    /**
     * Sets the maximum number of rows per batch.
     *
     * @param batchSize a positive row count
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets whether unmatched projected names fail a Parquet scan.
     *
     * @param strictProjection true to fail fast
     * @return this builder
     */
    public Builder strictProjection(boolean strictProjection) {
      this.strictProjection = strictProjection;
      return this;
    }

    /** Builds the SourceOptions. */
    public SourceOptions build() {
      return new SourceOptions(batchSize, strictProjection);
    }
  }
}
