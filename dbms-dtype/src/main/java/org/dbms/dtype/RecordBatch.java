package org.dbms.dtype;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.util.TransferPair;

/**
 * A batch of columnar data with a schema.
 *
 * <p>Column {@code i} is described by field {@code i} of the schema, and every column has the same
 * length. These invariants are checked once, at construction; accessors do not re-check them.
 *
 * <p>A batch owns its column handles and releases them on {@link #close()}. Columns may share
 * storage with other batches (see {@link Column#share()}); a batch never mutates a column.
 */
public final class RecordBatch implements AutoCloseable {
  private final Schema schema;
  private final List<Column> columns;

  /**
   * Creates a batch, taking ownership of the given columns.
   *
   * @throws IllegalArgumentException if the columns do not match the schema or differ in length
   */
  public RecordBatch(Schema schema, List<Column> columns) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.columns = List.copyOf(columns);
    checkConsistent();
  }

  private void checkConsistent() {
    if (columns.size() != schema.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Batch has %d columns but schema has %d fields", columns.size(), schema.size()));
    }
    for (int i = 0; i < columns.size(); i++) {
      Column column = columns.get(i);
      Field field = schema.field(i);
      if (column.dtype() != field.dtype()) {
        throw new IllegalArgumentException(
            String.format(
                "Column %d (%s) has type %s but field declares %s",
                i, field.name(), column.dtype(), field.dtype()));
      }
      if (column.length() != columns.get(0).length()) {
        throw new IllegalArgumentException(
            String.format(
                "Column %d (%s) has %d rows, expected %d",
                i, field.name(), column.length(), columns.get(0).length()));
      }
    }
  }

  /**
   * Converts an Arrow batch.
   *
   * <p>Every column type is validated before anything is taken, so an unsupported column fails the
   * whole batch and leaves {@code root} untouched. On success the buffers are transferred out of
   * {@code root} into vectors owned by the returned batch, and {@code root} may be reloaded.
   *
   * @param root the Arrow batch to convert
   * @param allocator allocator that will own the transferred buffers
   * @return a batch independent of {@code root}
   * @throws UnsupportedTypeException if any column's type has no {@link DataType}
   * @throws IllegalArgumentException if the vectors hold different numbers of values; the
   *     transferred buffers are released
   */
  public static RecordBatch fromArrow(VectorSchemaRoot root, BufferAllocator allocator) {
    Schema schema = Schema.fromArrowSchema(root.getSchema());
    List<Column> columns = new ArrayList<>(schema.size());
    try {
      for (FieldVector vector : root.getFieldVectors()) {
        TransferPair pair = vector.getTransferPair(allocator);
        pair.transfer();
        columns.add(Column.fromArrow((FieldVector) pair.getTo()));
      }
      return new RecordBatch(schema, columns);
    } catch (RuntimeException e) {
      columns.forEach(Column::close);
      throw e;
    }
  }

  /** Returns the schema of this batch. */
  public Schema schema() {
    return schema;
  }

  /**
   * Returns the column at the given index.
   *
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public Column column(int index) {
    return columns.get(index);
  }

  /** Returns the columns of this batch, in schema order. The list is unmodifiable. */
  public List<Column> columns() {
    return columns;
  }

  /** Returns the number of rows in this batch, or 0 if it has no columns. */
  public int rowCount() {
    return columns.isEmpty() ? 0 : columns.get(0).length();
  }

  /** Returns the number of columns in this batch. */
  public int columnCount() {
    return columns.size();
  }

  /**
   * Returns a batch of the columns at the given positions, in that order.
   *
   * <p>The returned batch holds shared handles: no values are copied, and it must be closed
   * independently of this batch.
   *
   * @throws IndexOutOfBoundsException if any position is out of range
   */
  public RecordBatch project(int... indices) {
    Schema projected = schema.project(indices);
    List<Column> selected = new ArrayList<>(indices.length);
    for (int index : indices) {
      selected.add(columns.get(index).share());
    }
    return new RecordBatch(projected, selected);
  }

  /** Returns a batch holding shared handles to all columns of this batch. */
  public RecordBatch share() {
    List<Column> shared = new ArrayList<>(columns.size());
    for (Column column : columns) {
      shared.add(column.share());
    }
    return new RecordBatch(schema, shared);
  }

  /**
   * Exports this batch as an Arrow batch owned by the caller.
   *
   * <p>Array columns are shared, literal columns are materialized.
   */
  public VectorSchemaRoot toVectorSchemaRoot(BufferAllocator allocator) {
    List<FieldVector> vectors = new ArrayList<>(columns.size());
    try {
      for (int i = 0; i < columns.size(); i++) {
        vectors.add(columns.get(i).toArrowVector(schema.field(i).name(), allocator));
      }
    } catch (RuntimeException e) {
      vectors.forEach(FieldVector::close);
      throw e;
    }
    VectorSchemaRoot root = new VectorSchemaRoot(vectors);
    root.setRowCount(rowCount());
    return root;
  }

  @Override
  public void close() {
    columns.forEach(Column::close);
  }

  @Override
  public String toString() {
    return "RecordBatch[schema=" + schema + ", rows=" + rowCount() + "]";
  }
}
