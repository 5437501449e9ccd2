package org.dbms.dtype;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * A single typed value that may be null.
 *
 * <p>This sealed interface has one record per {@link DataType}. Each record wraps a boxed payload
 * where {@code null} means SQL null, so every data type can produce its own null through {@link
 * #nullOf(DataType)} without looking at a sample value. Equality is structural: same variant and
 * equal payload.
 *
 * <p>Unsigned variants are widened to the next larger Java type, following Arrow Java's {@code
 * getObjectNoOverflow} conventions ({@code UInt64} uses {@link BigInteger}).
 */
public sealed interface Scalar {

  /** Returns the data type of this scalar. */
  DataType dtype();

  /**
   * Returns this scalar's payload as its natural Java type.
   *
   * @return the payload, or {@code null} if this scalar is null
   */
  Object getObject();

  /** Returns true if this scalar is null. */
  default boolean isNull() {
    return getObject() == null;
  }

  /**
   * Returns the null scalar of the given type.
   *
   * @param dtype the data type
   * @return a null scalar whose {@link #dtype()} is {@code dtype}
   */
  static Scalar nullOf(DataType dtype) {
    return switch (dtype) {
      case BOOLEAN -> new BooleanValue(null);
      case INT8 -> new Int8(null);
      case INT16 -> new Int16(null);
      case INT32 -> new Int32(null);
      case INT64 -> new Int64(null);
      case UINT8 -> new UInt8(null);
      case UINT16 -> new UInt16(null);
      case UINT32 -> new UInt32(null);
      case UINT64 -> new UInt64(null);
      case FLOAT32 -> new Float32(null);
      case FLOAT64 -> new Float64(null);
      case UTF8 -> new Utf8(null);
      case BINARY -> new Binary(null);
    };
  }

  // -- Boolean --
  record BooleanValue(Boolean value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.BOOLEAN;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  // -- Signed integers --
  record Int8(Byte value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.INT8;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record Int16(Short value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.INT16;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record Int32(Integer value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.INT32;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record Int64(Long value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.INT64;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  // -- Unsigned integers --
  record UInt8(Short value) implements Scalar {
    public UInt8 {
      if (value != null && (value < 0 || value > 0xFF)) {
        throw new IllegalArgumentException("UInt8 out of range: " + value);
      }
    }

    @Override
    public DataType dtype() {
      return DataType.UINT8;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record UInt16(Integer value) implements Scalar {
    public UInt16 {
      if (value != null && (value < 0 || value > 0xFFFF)) {
        throw new IllegalArgumentException("UInt16 out of range: " + value);
      }
    }

    @Override
    public DataType dtype() {
      return DataType.UINT16;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record UInt32(Long value) implements Scalar {
    public UInt32 {
      if (value != null && (value < 0 || value > 0xFFFF_FFFFL)) {
        throw new IllegalArgumentException("UInt32 out of range: " + value);
      }
    }

    @Override
    public DataType dtype() {
      return DataType.UINT32;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record UInt64(BigInteger value) implements Scalar {
    private static final BigInteger MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    public UInt64 {
      if (value != null && (value.signum() < 0 || value.compareTo(MAX) > 0)) {
        throw new IllegalArgumentException("UInt64 out of range: " + value);
      }
    }

    @Override
    public DataType dtype() {
      return DataType.UINT64;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  // -- Floats --
  record Float32(Float value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.FLOAT32;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  record Float64(Double value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.FLOAT64;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  // -- Strings --
  record Utf8(String value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.UTF8;
    }

    @Override
    public Object getObject() {
      return value;
    }
  }

  // -- Binary --
  record Binary(byte[] value) implements Scalar {
    @Override
    public DataType dtype() {
      return DataType.BINARY;
    }

    @Override
    public Object getObject() {
      return value;
    }

    // Records compare arrays by reference; compare contents instead.
    @Override
    public boolean equals(Object o) {
      return o instanceof Binary other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "Binary[value=" + Arrays.toString(value) + "]";
    }
  }
}
