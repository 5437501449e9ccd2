package org.dbms.dsource;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.junit.jupiter.api.Test;

public class ProjectionMaskTest {

  private static Field leaf(String name, ArrowType type) {
    return new Field(name, FieldType.nullable(type), null);
  }

  // a | s { x, t { y, z } } | b
  private static final Schema NESTED =
      new Schema(
          List.of(
              leaf("a", new ArrowType.Int(32, true)),
              new Field(
                  "s",
                  FieldType.nullable(ArrowType.Struct.INSTANCE),
                  List.of(
                      leaf("x", new ArrowType.Int(64, true)),
                      new Field(
                          "t",
                          FieldType.nullable(ArrowType.Struct.INSTANCE),
                          List.of(
                              leaf("y", ArrowType.Utf8.INSTANCE),
                              leaf("z", ArrowType.Bool.INSTANCE))))),
              leaf("b", ArrowType.Utf8.INSTANCE)));

  @Test
  void nestedColumnsOwnOneLeafPerPrimitive() {
    ProjectionMask mask = ProjectionMask.all(NESTED);
    assertEquals(5, mask.leafCount());
    assertEquals(5, mask.selectedLeafCount());
    assertEquals(List.of("a", "s", "b"), mask.selectedColumns());
  }

  @Test
  void selectsLeavesOfNamedColumnsInFileOrder() {
    ProjectionMask mask = ProjectionMask.leaves(NESTED, List.of("b", "s"));
    assertEquals(4, mask.selectedLeafCount());
    assertEquals(List.of("s", "b"), mask.selectedColumns());
  }

  @Test
  void unknownNamesSelectNothing() {
    ProjectionMask mask = ProjectionMask.leaves(NESTED, List.of("ghost", "x"));
    assertEquals(List.of(), mask.selectedColumns());
    assertEquals(0, mask.selectedLeafCount());
  }

  @Test
  void repeatedNamesSelectOnce() {
    ProjectionMask mask = ProjectionMask.leaves(NESTED, List.of("a", "a"));
    assertEquals(List.of("a"), mask.selectedColumns());
    assertEquals(1, mask.selectedLeafCount());
  }
}
