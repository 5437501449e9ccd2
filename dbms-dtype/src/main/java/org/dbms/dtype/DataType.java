package org.dbms.dtype;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Supported data types, a subset of Arrow's type system.
 *
 * <p>Every constant maps to exactly one {@link ArrowType}. The reverse mapping is only defined for
 * that subset: {@link #fromArrowType(ArrowType)} rejects everything else with an {@link
 * UnsupportedTypeException}.
 */
public enum DataType {
  BOOLEAN(ArrowType.Bool.INSTANCE),
  INT8(new ArrowType.Int(8, true)),
  INT16(new ArrowType.Int(16, true)),
  INT32(new ArrowType.Int(32, true)),
  INT64(new ArrowType.Int(64, true)),
  UINT8(new ArrowType.Int(8, false)),
  UINT16(new ArrowType.Int(16, false)),
  UINT32(new ArrowType.Int(32, false)),
  UINT64(new ArrowType.Int(64, false)),
  FLOAT32(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)),
  FLOAT64(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)),
  UTF8(ArrowType.Utf8.INSTANCE),
  BINARY(ArrowType.Binary.INSTANCE);

  private final ArrowType arrowType;

  DataType(ArrowType arrowType) {
    this.arrowType = arrowType;
  }

  /** Returns the Arrow type this data type is stored as. */
  public ArrowType toArrowType() {
    return arrowType;
  }

  /**
   * Maps an Arrow type to its data type.
   *
   * @param arrowType the Arrow type
   * @return the matching data type
   * @throws UnsupportedTypeException if the Arrow type is outside the supported subset
   */
  public static DataType fromArrowType(ArrowType arrowType) {
    DataType dataType = lookup(arrowType);
    if (dataType == null) {
      throw new UnsupportedTypeException(arrowType);
    }
    return dataType;
  }

  /** Returns true if {@link #fromArrowType(ArrowType)} would succeed for the given type. */
  public static boolean isSupported(ArrowType arrowType) {
    return lookup(arrowType) != null;
  }

  private static DataType lookup(ArrowType arrowType) {
    if (arrowType instanceof ArrowType.Bool) {
      return BOOLEAN;
    } else if (arrowType instanceof ArrowType.Int intType) {
      return switch (intType.getBitWidth()) {
        case 8 -> intType.getIsSigned() ? INT8 : UINT8;
        case 16 -> intType.getIsSigned() ? INT16 : UINT16;
        case 32 -> intType.getIsSigned() ? INT32 : UINT32;
        case 64 -> intType.getIsSigned() ? INT64 : UINT64;
        default -> null;
      };
    } else if (arrowType instanceof ArrowType.FloatingPoint fp) {
      return switch (fp.getPrecision()) {
        case SINGLE -> FLOAT32;
        case DOUBLE -> FLOAT64;
        case HALF -> null;
      };
    } else if (arrowType instanceof ArrowType.Utf8) {
      return UTF8;
    } else if (arrowType instanceof ArrowType.Binary) {
      return BINARY;
    }
    return null;
  }
}
