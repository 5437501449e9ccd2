package org.dbms.dsource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.dbms.dtype.Column;
import org.dbms.dtype.DbmsException;
import org.dbms.dtype.Field;
import org.dbms.dtype.FieldNotFoundException;
import org.dbms.dtype.RecordBatch;
import org.dbms.dtype.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream over the batches of an Arrow Dataset scan.
 *
 * <p>The reader reuses one {@code VectorSchemaRoot} for every batch, so each loaded batch is
 * transferred into vectors owned by the returned {@link RecordBatch} before the next load. Columns
 * are then arranged to match the target schema by name.
 *
 * <p>The first failure ends the stream: it is thrown from {@link #next()} and the native scan is
 * released immediately.
 */
final class DatasetBatchStream implements RecordBatchStream {
  private static final Logger logger = LoggerFactory.getLogger(DatasetBatchStream.class);

  private final String location;
  private final BufferAllocator allocator;
  private final ArrowReader reader;
  private final Deque<AutoCloseable> resources;
  private final Schema target;
  private boolean loaded = false;
  private boolean exhausted = false;
  private boolean released = false;
  private boolean closed = false;
  private DbmsException failure;
  private long batchCount;
  private long rowCount;

  /**
   * Creates a stream that owns {@code resources}, closed in stack order when the stream ends.
   *
   * @param resources opened handles, most recently opened first; includes {@code reader}
   */
  DatasetBatchStream(
      String location,
      BufferAllocator allocator,
      ArrowReader reader,
      Deque<AutoCloseable> resources,
      Schema target) {
    this.location = location;
    this.allocator = allocator;
    this.reader = reader;
    this.resources = resources;
    this.target = target;
  }

  @Override
  public boolean hasNext() {
    if (closed || exhausted) {
      return false;
    }
    if (!loaded && failure == null) {
      load();
    }
    return loaded || failure != null;
  }

  private void load() {
    try {
      loaded = reader.loadNextBatch();
      if (!loaded) {
        logger.debug("End of scan reached for {}", location);
        exhausted = true;
        release();
      }
    } catch (IOException | RuntimeException e) {
      failure = new DecodeException("Failed to decode batch from " + location, e);
    }
  }

  @Override
  public RecordBatch next() {
    if (closed) {
      throw new IllegalStateException("RecordBatchStream has been closed");
    }
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    if (failure != null) {
      throw terminate(failure);
    }
    loaded = false;
    RecordBatch batch;
    try {
      int rows = reader.getVectorSchemaRoot().getRowCount();
      try (RecordBatch decoded = RecordBatch.fromArrow(reader.getVectorSchemaRoot(), allocator)) {
        batch = arrange(decoded, target);
      }
      logger.debug("Loaded batch with {} rows from {}", rows, location);
    } catch (DbmsException e) {
      throw terminate(e);
    } catch (IOException | RuntimeException e) {
      throw terminate(new DecodeException("Failed to convert batch from " + location, e));
    }
    batchCount++;
    rowCount += batch.rowCount();
    return batch;
  }

  private DbmsException terminate(DbmsException e) {
    exhausted = true;
    failure = null;
    release();
    return e;
  }

  /**
   * Builds a batch of {@code target}'s columns, taken by name from {@code decoded}.
   *
   * @throws DecodeException if a column is missing or decoded as a different type
   */
  static RecordBatch arrange(RecordBatch decoded, Schema target) {
    List<Column> columns = new ArrayList<>(target.size());
    try {
      for (Field field : target.fields()) {
        Column column = decoded.column(decodedIndex(decoded.schema(), field.name()));
        if (column.dtype() != field.dtype()) {
          throw new DecodeException(
              String.format(
                  "Column %s decoded as %s, expected %s",
                  field.name(), column.dtype(), field.dtype()));
        }
        columns.add(column.share());
      }
      return new RecordBatch(target, columns);
    } catch (RuntimeException e) {
      columns.forEach(Column::close);
      throw e;
    }
  }

  private static int decodedIndex(Schema decoded, String name) {
    try {
      return decoded.indexOf(name);
    } catch (FieldNotFoundException e) {
      throw new DecodeException("Decoder did not produce column " + name, e);
    }
  }

  @Override
  public long batchCount() {
    return batchCount;
  }

  @Override
  public long rowCount() {
    return rowCount;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      release();
      logger.debug("Closed scan of {} after {} batches", location, batchCount);
    }
  }

  private void release() {
    if (!released) {
      released = true;
      closeAll(resources, location);
    }
  }

  /** Closes the given handles in stack order, logging rather than throwing failures. */
  static void closeAll(Deque<AutoCloseable> resources, String location) {
    while (!resources.isEmpty()) {
      AutoCloseable resource = resources.pop();
      try {
        resource.close();
      } catch (Exception e) {
        logger.error("Error closing scan resource for {}", location, e);
      }
    }
  }
}
