package org.dbms.dsource;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.apache.arrow.dataset.file.FileFormat;
import org.apache.arrow.dataset.file.FileSystemDatasetFactory;
import org.apache.arrow.dataset.jni.NativeMemoryPool;
import org.apache.arrow.dataset.scanner.ScanOptions;
import org.apache.arrow.dataset.scanner.Scanner;
import org.apache.arrow.dataset.source.Dataset;
import org.apache.arrow.dataset.source.DatasetFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.dbms.dtype.DbmsException;
import org.dbms.dtype.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Internal bridge to Arrow Dataset, which decodes CSV and Parquet files.
 *
 * <p>Every call opens its own dataset factory, so the returned schemas and streams never share
 * native state with earlier calls.
 */
final class DatasetFiles {
  private static final Logger logger = LoggerFactory.getLogger(DatasetFiles.class);

  private DatasetFiles() {}

  /**
   * Reads or infers the Arrow schema of a file.
   *
   * <p>For Parquet this is the embedded schema. For CSV the decoder infers names from the header
   * row and types from a sample of the following rows.
   *
   * @throws DataSourceIoException if the file cannot be opened or read
   */
  static org.apache.arrow.vector.types.pojo.Schema inspect(
      BufferAllocator allocator, FileFormat format, Path path) {
    try (DatasetFactory factory = openFactory(allocator, format, path)) {
      org.apache.arrow.vector.types.pojo.Schema schema = factory.inspect();
      logger.debug("Inspected {} file {}: {}", format, path, schema);
      return schema;
    } catch (DbmsException e) {
      throw e;
    } catch (Exception e) {
      throw new DataSourceIoException(path.toString(), e);
    }
  }

  /**
   * Opens a scan over a file.
   *
   * @param datasetSchema schema the decoder should produce, or null to use the file's own
   * @param columns names of the columns to decode, or null for all
   * @param batchSize maximum rows per batch
   * @param target schema of the yielded batches; columns are taken from decoded batches by name
   * @throws DataSourceIoException if the file cannot be opened
   */
  static RecordBatchStream open(
      BufferAllocator allocator,
      FileFormat format,
      Path path,
      org.apache.arrow.vector.types.pojo.Schema datasetSchema,
      List<String> columns,
      long batchSize,
      Schema target) {
    Deque<AutoCloseable> opened = new ArrayDeque<>();
    try {
      DatasetFactory factory = openFactory(allocator, format, path);
      opened.push(factory);
      Dataset dataset = datasetSchema == null ? factory.finish() : factory.finish(datasetSchema);
      opened.push(dataset);
      Optional<String[]> selection =
          columns == null ? Optional.empty() : Optional.of(columns.toArray(new String[0]));
      Scanner scanner = dataset.newScan(new ScanOptions(batchSize, selection));
      opened.push(scanner);
      ArrowReader reader = scanner.scanBatches();
      opened.push(reader);
      logger.debug("Opened {} scan of {} with columns {}", format, path, columns);
      return new DatasetBatchStream(path.toString(), allocator, reader, opened, target);
    } catch (RuntimeException e) {
      DatasetBatchStream.closeAll(opened, path.toString());
      if (e instanceof DbmsException) {
        throw e;
      }
      throw new DataSourceIoException(path.toString(), e);
    }
  }

  private static DatasetFactory openFactory(
      BufferAllocator allocator, FileFormat format, Path path) {
    if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
      throw new DataSourceIoException(path.toString(), new NoSuchFileException(path.toString()));
    }
    String uri = path.toAbsolutePath().toUri().toString();
    return new FileSystemDatasetFactory(allocator, NativeMemoryPool.getDefault(), format, uri);
  }
}
