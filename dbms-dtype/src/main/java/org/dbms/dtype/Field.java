package org.dbms.dtype;

import java.util.Objects;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * A field in a schema, consisting of a name and data type.
 *
 * <p>Names are not required to be unique within a schema; see {@link Schema} for how lookups treat
 * duplicates.
 *
 * @param name the column name
 * @param dtype the column data type
 */
public record Field(String name, DataType dtype) {
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(dtype, "dtype");
  }

  /** Converts this field to a nullable Arrow field. */
  public org.apache.arrow.vector.types.pojo.Field toArrowField() {
    return new org.apache.arrow.vector.types.pojo.Field(
        name, FieldType.nullable(dtype.toArrowType()), null);
  }

  /**
   * Converts an Arrow field.
   *
   * @param arrowField the Arrow field
   * @return the equivalent field
   * @throws UnsupportedTypeException if the Arrow field's type has no {@link DataType}
   */
  public static Field fromArrowField(org.apache.arrow.vector.types.pojo.Field arrowField) {
    return new Field(arrowField.getName(), DataType.fromArrowType(arrowField.getType()));
  }
}
