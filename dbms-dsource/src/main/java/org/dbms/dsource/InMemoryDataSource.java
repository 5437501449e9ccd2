package org.dbms.dsource;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.dbms.dtype.Column;
import org.dbms.dtype.RecordBatch;
import org.dbms.dtype.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A data source that stores data in memory.
 *
 * <p>The source takes ownership of its batches and keeps them until {@link #close()}. Scans yield
 * shared handles to the stored columns, so no values are copied and the stored batches are never
 * modified; several scans may run at the same time.
 */
public final class InMemoryDataSource implements DataSource, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(InMemoryDataSource.class);

  private final Schema schema;
  private final List<RecordBatch> batches;

  /**
   * Creates an in-memory source.
   *
   * @param schema the schema every batch conforms to
   * @param batches the batches, in scan order; ownership passes to this source
   * @throws IllegalArgumentException if a batch's schema differs from {@code schema}
   */
  public InMemoryDataSource(Schema schema, List<RecordBatch> batches) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.batches = List.copyOf(batches);
    for (int i = 0; i < this.batches.size(); i++) {
      if (!this.batches.get(i).schema().equals(schema)) {
        throw new IllegalArgumentException(
            String.format(
                "Batch %d has schema %s, expected %s", i, this.batches.get(i).schema(), schema));
      }
    }
    logger.debug("Created in-memory source with {} batches", this.batches.size());
  }

  @Override
  public Schema schema() {
    return schema;
  }

  @Override
  public RecordBatchStream scan(List<String> projection) {
    if (projection == null) {
      return new SharedBatchStream(batches.iterator(), null, null);
    }
    int[] indices = schema.indicesOf(projection);
    return new SharedBatchStream(batches.iterator(), indices, schema.project(indices));
  }

  @Override
  public void close() {
    batches.forEach(RecordBatch::close);
    logger.debug("Closed in-memory source");
  }

  /** Yields shared handles to stored batches, reselecting columns when a projection is given. */
  private static final class SharedBatchStream implements RecordBatchStream {
    private final Iterator<RecordBatch> source;
    private final int[] indices;
    private final Schema projected;
    private long batchCount;
    private long rowCount;
    private boolean closed;

    SharedBatchStream(Iterator<RecordBatch> source, int[] indices, Schema projected) {
      this.source = source;
      this.indices = indices;
      this.projected = projected;
    }

    @Override
    public boolean hasNext() {
      return !closed && source.hasNext();
    }

    @Override
    public RecordBatch next() {
      if (closed) {
        throw new IllegalStateException("RecordBatchStream has been closed");
      }
      if (!source.hasNext()) {
        throw new NoSuchElementException();
      }
      RecordBatch stored = source.next();
      RecordBatch batch = indices == null ? stored.share() : reselect(stored);
      batchCount++;
      rowCount += batch.rowCount();
      return batch;
    }

    private RecordBatch reselect(RecordBatch stored) {
      List<Column> columns = new ArrayList<>(indices.length);
      for (int index : indices) {
        columns.add(stored.column(index).share());
      }
      return new RecordBatch(projected, columns);
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
      closed = true;
    }
  }
}
