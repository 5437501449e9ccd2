package org.dbms.dsource;

import java.util.List;
import org.dbms.dtype.Schema;

/**
 * A data source that can be scanned to produce record batches.
 *
 * <p>This is the only surface the query engine uses to read a table, whatever its backend.
 *
 * <p>Example:
 *
 * <pre>{@code
 * DataSource source = new CsvDataSource(path, null, 1024, allocator);
 * try (RecordBatchStream stream = source.scan(List.of("name", "age"))) {
 *     while (stream.hasNext()) {
 *         try (RecordBatch batch = stream.next()) {
 *             // batch.schema() lists "name" then "age"
 *         }
 *     }
 * }
 * }</pre>
 */
public interface DataSource {
  /**
   * Returns the schema of this data source.
   *
   * <p>File-backed sources may open the file to read or infer the schema. Repeated calls derive the
   * same result.
   *
   * @return the unprojected schema
   * @throws DataSourceIoException if the underlying storage cannot be read
   * @throws org.dbms.dtype.UnsupportedTypeException if a stored or inferred type is unsupported
   */
  Schema schema();

  /**
   * Scans the data source, optionally projecting to a subset of columns.
   *
   * <p>Each name is resolved against the unprojected schema, taking the first field with that
   * name. Yielded batches contain exactly the named columns in the order given, repeats included.
   * Resolution happens before any batch is produced.
   *
   * <p>The returned stream is lazy, forward-only and cannot be restarted; call {@code scan} again
   * to re-read. File-backed sources open an independent handle per call, so scans of one source
   * do not share cursor state.
   *
   * @param projection column names to read, or null for all columns in schema order
   * @return a stream of batches that the caller must close
   * @throws org.dbms.dtype.FieldNotFoundException if a projected name is absent
   * @throws DataSourceIoException if the underlying storage cannot be opened
   */
  RecordBatchStream scan(List<String> projection);

  /** Scans all columns in schema order. Equivalent to {@code scan(null)}. */
  default RecordBatchStream scan() {
    return scan(null);
  }
}
