package org.dbms.dtype;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An ordered list of fields.
 *
 * <p>Field order is significant: the field at position {@code i} describes column {@code i} of any
 * {@link RecordBatch} carrying this schema.
 *
 * <p>Field names are not deduplicated. Every name lookup ({@link #indexOf}, {@link #findField},
 * {@link #select}) returns the first matching field, so a later field with the same name is
 * shadowed.
 */
public final class Schema {
  private final List<Field> fields;

  public Schema(List<Field> fields) {
    this.fields = List.copyOf(fields);
  }

  /** Creates a schema from the given fields, in order. */
  public static Schema of(Field... fields) {
    return new Schema(Arrays.asList(fields));
  }

  /** Returns the fields of this schema, in order. The list is unmodifiable. */
  public List<Field> fields() {
    return fields;
  }

  /**
   * Returns the field at the given position.
   *
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public Field field(int index) {
    return fields.get(index);
  }

  /** Returns the number of fields. */
  public int size() {
    return fields.size();
  }

  /**
   * Returns the position of the first field named {@code name}.
   *
   * @throws FieldNotFoundException if no field has that name
   */
  public int indexOf(String name) {
    for (int i = 0; i < fields.size(); i++) {
      if (fields.get(i).name().equals(name)) {
        return i;
      }
    }
    throw new FieldNotFoundException(name);
  }

  /** Returns the first field named {@code name}, if any. */
  public Optional<Field> findField(String name) {
    return fields.stream().filter(f -> f.name().equals(name)).findFirst();
  }

  /**
   * Resolves each name to the position of its first matching field.
   *
   * @param names the names to resolve
   * @return the positions, in the order of {@code names}
   * @throws FieldNotFoundException if any name is absent
   */
  public int[] indicesOf(List<String> names) {
    int[] indices = new int[names.size()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = indexOf(names.get(i));
    }
    return indices;
  }

  /**
   * Projects the schema to the fields at the given positions.
   *
   * <p>Positions may repeat and need not be increasing; the result follows their order.
   *
   * @throws IndexOutOfBoundsException if any position is out of range
   */
  public Schema project(int... indices) {
    List<Field> projected = new ArrayList<>(indices.length);
    for (int index : indices) {
      projected.add(fields.get(index));
    }
    return new Schema(projected);
  }

  /** List form of {@link #project(int...)}. */
  public Schema project(List<Integer> indices) {
    return project(indices.stream().mapToInt(Integer::intValue).toArray());
  }

  /**
   * Selects fields by name, in the order of {@code names}.
   *
   * @throws FieldNotFoundException if any name is absent
   */
  public Schema select(List<String> names) {
    return project(indicesOf(names));
  }

  /** Varargs form of {@link #select(List)}. */
  public Schema select(String... names) {
    return select(Arrays.asList(names));
  }

  /** Converts this schema to an Arrow schema with nullable fields. */
  public org.apache.arrow.vector.types.pojo.Schema toArrowSchema() {
    return new org.apache.arrow.vector.types.pojo.Schema(
        fields.stream().map(Field::toArrowField).collect(Collectors.toList()));
  }

  /**
   * Converts an Arrow schema.
   *
   * @throws UnsupportedTypeException if any field's type has no {@link DataType}
   */
  public static Schema fromArrowSchema(org.apache.arrow.vector.types.pojo.Schema arrowSchema) {
    return new Schema(
        arrowSchema.getFields().stream().map(Field::fromArrowField).collect(Collectors.toList()));
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Schema other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "Schema" + fields;
  }
}
