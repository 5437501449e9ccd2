package org.dbms.dsource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.dataset.file.FileFormat;
import org.apache.arrow.memory.BufferAllocator;
import org.dbms.dsource.config.SourceOptions;
import org.dbms.dtype.Schema;

/**
 * A data source that reads from CSV files.
 *
 * <p>The first row is always a header naming the columns. When no schema is given, column types
 * are inferred by the decoder from a sample of rows each time {@link #schema()} is called; any
 * inferred type outside {@link org.dbms.dtype.DataType} fails with an {@link
 * org.dbms.dtype.UnsupportedTypeException}.
 *
 * <p>Yielded batches are allocated from the allocator given at construction, which must outlive
 * them.
 */
public final class CsvDataSource implements DataSource {
  private final Path path;
  private final Schema schema;
  private final SourceOptions options;
  private final BufferAllocator allocator;

  /**
   * Creates a CSV source.
   *
   * @param path the CSV file
   * @param schema the schema to decode with, or null to infer it
   * @param batchSize maximum rows per batch
   * @param allocator allocator for decoded batches
   */
  public CsvDataSource(Path path, Schema schema, int batchSize, BufferAllocator allocator) {
    this(path, schema, SourceOptions.builder().batchSize(batchSize).build(), allocator);
  }

  /**
   * Creates a CSV source from options. {@link SourceOptions#strictProjection()} does not apply:
   * unknown projected names always fail.
   *
   * @param path the CSV file
   * @param schema the schema to decode with, or null to infer it
   * @param options scan options
   * @param allocator allocator for decoded batches
   */
  public CsvDataSource(
      Path path, Schema schema, SourceOptions options, BufferAllocator allocator) {
    this.path = Objects.requireNonNull(path, "path");
    this.schema = schema;
    this.options = Objects.requireNonNull(options, "options");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
  }

  @Override
  public Schema schema() {
    if (schema != null) {
      return schema;
    }
    return Schema.fromArrowSchema(DatasetFiles.inspect(allocator, FileFormat.CSV, path));
  }

  @Override
  public RecordBatchStream scan(List<String> projection) {
    Schema full = schema();
    Schema target = full;
    List<String> columns = null;
    if (projection != null) {
      int[] indices = full.indicesOf(projection);
      target = full.project(indices);
      columns = new ArrayList<>();
      for (int index : indices) {
        String name = full.field(index).name();
        if (!columns.contains(name)) {
          columns.add(name);
        }
      }
    }
    return DatasetFiles.open(
        allocator,
        FileFormat.CSV,
        path,
        full.toArrowSchema(),
        columns,
        options.effectiveBatchSize(),
        target);
  }

  @Override
  public String toString() {
    return "CsvDataSource[" + path + "]";
  }
}
