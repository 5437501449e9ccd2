package org.dbms.dsource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A column selection over the leaf columns of a columnar file.
 *
 * <p>A file's top-level columns do not map one to one onto its stored leaves: a nested column owns
 * one leaf per primitive descendant. The mask holds one flag per leaf, in file order, and a
 * top-level column is read when any of its leaves is selected.
 *
 * <p>Names that match no top-level column select nothing. Whether that is an error is decided by
 * the caller.
 */
final class ProjectionMask {
  private final Schema fileSchema;
  private final int[] leafOwners;
  private final boolean[] selected;

  private ProjectionMask(Schema fileSchema, int[] leafOwners, boolean[] selected) {
    this.fileSchema = fileSchema;
    this.leafOwners = leafOwners;
    this.selected = selected;
  }

  /** Selects every leaf of the file. */
  static ProjectionMask all(Schema fileSchema) {
    int[] owners = leafOwners(fileSchema);
    boolean[] selected = new boolean[owners.length];
    Arrays.fill(selected, true);
    return new ProjectionMask(fileSchema, owners, selected);
  }

  /** Selects the leaves of every top-level column whose name is in {@code names}. */
  static ProjectionMask leaves(Schema fileSchema, Collection<String> names) {
    int[] owners = leafOwners(fileSchema);
    boolean[] selected = new boolean[owners.length];
    for (int leaf = 0; leaf < owners.length; leaf++) {
      selected[leaf] = names.contains(fileSchema.getFields().get(owners[leaf]).getName());
    }
    return new ProjectionMask(fileSchema, owners, selected);
  }

  /** Returns the number of leaf columns in the file. */
  int leafCount() {
    return selected.length;
  }

  /** Returns the number of selected leaf columns. */
  int selectedLeafCount() {
    int count = 0;
    for (boolean leaf : selected) {
      if (leaf) {
        count++;
      }
    }
    return count;
  }

  /** Returns the names of the top-level columns with at least one selected leaf, in file order. */
  List<String> selectedColumns() {
    List<String> columns = new ArrayList<>();
    int last = -1;
    for (int leaf = 0; leaf < selected.length; leaf++) {
      if (selected[leaf] && leafOwners[leaf] != last) {
        last = leafOwners[leaf];
        columns.add(fileSchema.getFields().get(last).getName());
      }
    }
    return columns;
  }

  /** Maps each leaf, in depth-first order, to the index of its top-level column. */
  private static int[] leafOwners(Schema fileSchema) {
    List<Field> fields = fileSchema.getFields();
    List<Integer> owners = new ArrayList<>();
    for (int column = 0; column < fields.size(); column++) {
      int leaves = countLeaves(fields.get(column));
      for (int i = 0; i < leaves; i++) {
        owners.add(column);
      }
    }
    return owners.stream().mapToInt(Integer::intValue).toArray();
  }

  private static int countLeaves(Field field) {
    if (field.getChildren().isEmpty()) {
      return 1;
    }
    int leaves = 0;
    for (Field child : field.getChildren()) {
      leaves += countLeaves(child);
    }
    return leaves;
  }
}
