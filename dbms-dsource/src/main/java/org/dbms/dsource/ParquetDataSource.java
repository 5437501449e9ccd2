package org.dbms.dsource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.arrow.dataset.file.FileFormat;
import org.apache.arrow.memory.BufferAllocator;
import org.dbms.dsource.config.SourceOptions;
import org.dbms.dtype.Field;
import org.dbms.dtype.FieldNotFoundException;
import org.dbms.dtype.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A data source that reads from a Parquet file.
 *
 * <p>The schema is the one embedded in the file. A projection is pushed down to the decoder as a
 * leaf mask, so only the selected columns are read from disk. Yielded batches list their columns in
 * the order the caller named them.
 *
 * <p>With {@link SourceOptions#strictProjection()} disabled, projected names that match no column
 * are dropped instead of failing the scan.
 */
public final class ParquetDataSource implements DataSource {
  private static final Logger logger = LoggerFactory.getLogger(ParquetDataSource.class);

  private final Path path;
  private final SourceOptions options;
  private final BufferAllocator allocator;

  public ParquetDataSource(Path path, int batchSize, BufferAllocator allocator) {
    this(path, SourceOptions.builder().batchSize(batchSize).build(), allocator);
  }

  public ParquetDataSource(Path path, SourceOptions options, BufferAllocator allocator) {
    this.path = Objects.requireNonNull(path, "path");
    this.options = Objects.requireNonNull(options, "options");
    this.allocator = Objects.requireNonNull(allocator, "allocator");
  }

  @Override
  public Schema schema() {
    return Schema.fromArrowSchema(fileSchema());
  }

  private org.apache.arrow.vector.types.pojo.Schema fileSchema() {
    return DatasetFiles.inspect(allocator, FileFormat.PARQUET, path);
  }

  @Override
  public RecordBatchStream scan(List<String> projection) {
    org.apache.arrow.vector.types.pojo.Schema fileSchema = fileSchema();
    if (projection == null) {
      return open(ProjectionMask.all(fileSchema), Schema.fromArrowSchema(fileSchema));
    }

    List<Field> targetFields = new ArrayList<>(projection.size());
    for (String name : projection) {
      Optional<org.apache.arrow.vector.types.pojo.Field> found = findTopLevel(fileSchema, name);
      if (found.isPresent()) {
        targetFields.add(Field.fromArrowField(found.get()));
      } else if (options.effectiveStrictProjection()) {
        throw new FieldNotFoundException(name);
      } else {
        logger.debug("Dropping unknown column {} from projection of {}", name, path);
      }
    }
    return open(ProjectionMask.leaves(fileSchema, projection), new Schema(targetFields));
  }

  private RecordBatchStream open(ProjectionMask mask, Schema target) {
    List<String> columns = mask.selectedColumns();
    logger.debug(
        "Scanning {} columns ({} of {} leaves) from {}",
        columns.size(),
        mask.selectedLeafCount(),
        mask.leafCount(),
        path);
    return DatasetFiles.open(
        allocator,
        FileFormat.PARQUET,
        path,
        null,
        columns,
        options.effectiveBatchSize(),
        target);
  }

  private static Optional<org.apache.arrow.vector.types.pojo.Field> findTopLevel(
      org.apache.arrow.vector.types.pojo.Schema fileSchema, String name) {
    return fileSchema.getFields().stream().filter(f -> f.getName().equals(name)).findFirst();
  }

  @Override
  public String toString() {
    return "ParquetDataSource[" + path + "]";
  }
}
