package org.dbms.dtype;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Reads and writes {@link Scalar} values from and to Arrow vectors.
 *
 * <p>Callers must have validated the vector against {@link DataType} first; a vector class that
 * does not match the expected data type is a programming error.
 */
final class ArrowValues {
  private ArrowValues() {}

  /**
   * Reads the value at {@code index}.
   *
   * @return the value, or a null scalar of {@code dtype} when the slot is null
   */
  static Scalar read(FieldVector vector, DataType dtype, int index) {
    if (vector.isNull(index)) {
      return Scalar.nullOf(dtype);
    }
    return switch (dtype) {
      case BOOLEAN -> new Scalar.BooleanValue(((BitVector) vector).get(index) != 0);
      case INT8 -> new Scalar.Int8(((TinyIntVector) vector).get(index));
      case INT16 -> new Scalar.Int16(((SmallIntVector) vector).get(index));
      case INT32 -> new Scalar.Int32(((IntVector) vector).get(index));
      case INT64 -> new Scalar.Int64(((BigIntVector) vector).get(index));
      case UINT8 ->
          new Scalar.UInt8((short) Byte.toUnsignedInt(((UInt1Vector) vector).get(index)));
      case UINT16 -> new Scalar.UInt16((int) ((UInt2Vector) vector).get(index));
      case UINT32 ->
          new Scalar.UInt32(Integer.toUnsignedLong(((UInt4Vector) vector).get(index)));
      case UINT64 -> {
        long bits = ((UInt8Vector) vector).get(index);
        yield new Scalar.UInt64(new BigInteger(Long.toUnsignedString(bits)));
      }
      case FLOAT32 -> new Scalar.Float32(((Float4Vector) vector).get(index));
      case FLOAT64 -> new Scalar.Float64(((Float8Vector) vector).get(index));
      case UTF8 ->
          new Scalar.Utf8(new String(((VarCharVector) vector).get(index), StandardCharsets.UTF_8));
      case BINARY -> new Scalar.Binary(((VarBinaryVector) vector).get(index));
    };
  }

  /**
   * Fills {@code length} slots of a freshly allocated vector with {@code value} and sets the value
   * count. Null values leave the validity bits cleared.
   */
  static void fill(FieldVector vector, Scalar value, int length) {
    if (!value.isNull()) {
      for (int i = 0; i < length; i++) {
        write(vector, value, i);
      }
    }
    vector.setValueCount(length);
  }

  private static void write(FieldVector vector, Scalar value, int index) {
    if (value instanceof Scalar.BooleanValue v) {
      ((BitVector) vector).setSafe(index, v.value() ? 1 : 0);
    } else if (value instanceof Scalar.Int8 v) {
      ((TinyIntVector) vector).setSafe(index, v.value());
    } else if (value instanceof Scalar.Int16 v) {
      ((SmallIntVector) vector).setSafe(index, v.value());
    } else if (value instanceof Scalar.Int32 v) {
      ((IntVector) vector).setSafe(index, v.value());
    } else if (value instanceof Scalar.Int64 v) {
      ((BigIntVector) vector).setSafe(index, v.value());
    } else if (value instanceof Scalar.UInt8 v) {
      ((UInt1Vector) vector).setSafe(index, v.value().intValue());
    } else if (value instanceof Scalar.UInt16 v) {
      ((UInt2Vector) vector).setSafe(index, v.value().intValue());
    } else if (value instanceof Scalar.UInt32 v) {
      ((UInt4Vector) vector).setSafe(index, v.value().intValue());
    } else if (value instanceof Scalar.UInt64 v) {
      ((UInt8Vector) vector).setSafe(index, v.value().longValue());
    } else if (value instanceof Scalar.Float32 v) {
      ((Float4Vector) vector).setSafe(index, v.value());
    } else if (value instanceof Scalar.Float64 v) {
      ((Float8Vector) vector).setSafe(index, v.value());
    } else if (value instanceof Scalar.Utf8 v) {
      ((VarCharVector) vector).setSafe(index, v.value().getBytes(StandardCharsets.UTF_8));
    } else if (value instanceof Scalar.Binary v) {
      ((VarBinaryVector) vector).setSafe(index, v.value());
    } else {
      throw new IllegalStateException("Unhandled scalar: " + value);
    }
  }
}
