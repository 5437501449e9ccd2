package org.dbms.dtype;

import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.util.TransferPair;

/**
 * A column of data, either materialized as an Arrow vector or a literal value.
 *
 * <p>Callers work through this interface only: {@link #length()}, {@link #dtype()} and {@link
 * #get(int)} behave the same for both variants.
 *
 * <p>A column is a handle. {@link #share()} returns a second handle to the same storage without
 * copying data; each handle must be closed by its holder, and the storage is released when the last
 * handle is closed.
 */
public sealed interface Column extends AutoCloseable permits Column.Array, Column.Literal {

  /**
   * Wraps an Arrow vector, taking ownership of it.
   *
   * @param vector the vector to wrap
   * @return an array column
   * @throws UnsupportedTypeException if the vector's type has no {@link DataType}
   */
  static Column fromArrow(FieldVector vector) {
    return new Array(vector);
  }

  /**
   * Creates a literal column holding {@code value} repeated {@code length} times.
   *
   * @param value the scalar to broadcast
   * @param length the number of rows
   * @return a literal column
   */
  static Column literal(Scalar value, int length) {
    return new Literal(value, length);
  }

  /** Returns the number of rows in this column. */
  int length();

  /** Returns true if this column has no rows. */
  default boolean isEmpty() {
    return length() == 0;
  }

  /** Returns the data type of this column. */
  DataType dtype();

  /**
   * Returns the value at the given row.
   *
   * @param index the row index
   * @return the value, or a null scalar of {@link #dtype()} when the row is null
   * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, length())}
   */
  Scalar get(int index);

  /**
   * Returns a new handle to the same storage.
   *
   * <p>No values are copied. The returned handle is independent of this one: closing either leaves
   * the other readable.
   */
  Column share();

  /**
   * Exports this column as an Arrow vector named {@code name}.
   *
   * <p>Array columns return a shared handle to their buffers; literal columns are materialized.
   * The caller owns the returned vector.
   *
   * @param name the field name of the returned vector
   * @param allocator allocator for materialized vectors
   * @return a vector with {@link #length()} values
   */
  FieldVector toArrowVector(String name, BufferAllocator allocator);

  /** Releases this handle. */
  @Override
  void close();

  /** A column backed by an Arrow vector. */
  final class Array implements Column {
    private final FieldVector vector;
    private final DataType dtype;

    private Array(FieldVector vector) {
      Objects.requireNonNull(vector, "vector");
      this.dtype = DataType.fromArrowType(vector.getField().getType());
      this.vector = vector;
    }

    /** Returns the underlying vector. The vector remains owned by this column. */
    public FieldVector vector() {
      return vector;
    }

    @Override
    public int length() {
      return vector.getValueCount();
    }

    @Override
    public DataType dtype() {
      return dtype;
    }

    @Override
    public Scalar get(int index) {
      Objects.checkIndex(index, length());
      return ArrowValues.read(vector, dtype, index);
    }

    @Override
    public Column share() {
      return new Array(transfer(vector.getField().getName(), vector.getAllocator()));
    }

    @Override
    public FieldVector toArrowVector(String name, BufferAllocator allocator) {
      return transfer(name, allocator);
    }

    private FieldVector transfer(String name, BufferAllocator allocator) {
      TransferPair pair = vector.getTransferPair(name, allocator);
      pair.splitAndTransfer(0, vector.getValueCount());
      return (FieldVector) pair.getTo();
    }

    @Override
    public void close() {
      vector.close();
    }

    @Override
    public String toString() {
      return "Array[dtype=" + dtype + ", length=" + length() + "]";
    }
  }

  /**
   * A scalar value broadcast to a given length. The value is stored once.
   *
   * @param value the broadcast value
   * @param length the number of rows
   */
  record Literal(Scalar value, int length) implements Column {
    public Literal {
      Objects.requireNonNull(value, "value");
      if (length < 0) {
        throw new IllegalArgumentException("Negative literal length: " + length);
      }
    }

    @Override
    public DataType dtype() {
      return value.dtype();
    }

    @Override
    public Scalar get(int index) {
      Objects.checkIndex(index, length);
      return value;
    }

    @Override
    public Column share() {
      return this;
    }

    @Override
    public FieldVector toArrowVector(String name, BufferAllocator allocator) {
      FieldVector vector =
          new org.apache.arrow.vector.types.pojo.Field(
                  name, FieldType.nullable(dtype().toArrowType()), null)
              .createVector(allocator);
      try {
        vector.setInitialCapacity(length);
        vector.allocateNew();
        ArrowValues.fill(vector, value, length);
        return vector;
      } catch (RuntimeException e) {
        vector.close();
        throw new IllegalStateException("Failed to materialize literal column " + name, e);
      }
    }

    @Override
    public void close() {}
  }
}
