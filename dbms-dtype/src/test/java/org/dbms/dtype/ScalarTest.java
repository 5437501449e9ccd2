package org.dbms.dtype;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class ScalarTest {

  @ParameterizedTest
  @EnumSource(DataType.class)
  void nullOfCarriesItsType(DataType dtype) {
    Scalar scalar = Scalar.nullOf(dtype);
    assertEquals(dtype, scalar.dtype());
    assertTrue(scalar.isNull());
    assertNull(scalar.getObject());
  }

  @Test
  void nullsOfDifferentTypesAreNotEqual() {
    assertNotEquals(Scalar.nullOf(DataType.INT32), Scalar.nullOf(DataType.INT64));
    assertEquals(Scalar.nullOf(DataType.UTF8), new Scalar.Utf8(null));
  }

  @Test
  void equalityIsStructural() {
    assertEquals(new Scalar.Int32(7), new Scalar.Int32(7));
    assertNotEquals(new Scalar.Int32(7), new Scalar.Int64(7L));
    assertEquals(new Scalar.Utf8("Alice"), new Scalar.Utf8("Alice"));
  }

  @Test
  void binaryComparesContents() {
    Scalar a = new Scalar.Binary(new byte[] {1, 2, 3});
    Scalar b = new Scalar.Binary(new byte[] {1, 2, 3});
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new Scalar.Binary(new byte[] {1, 2}));
  }

  @Test
  void unsignedRangesAreChecked() {
    assertEquals((short) 255, new Scalar.UInt8((short) 255).getObject());
    assertThrows(IllegalArgumentException.class, () -> new Scalar.UInt8((short) 256));
    assertThrows(IllegalArgumentException.class, () -> new Scalar.UInt16(-1));
    assertThrows(IllegalArgumentException.class, () -> new Scalar.UInt32(0x1_0000_0000L));

    BigInteger max = new BigInteger("18446744073709551615");
    assertEquals(max, new Scalar.UInt64(max).getObject());
    assertThrows(IllegalArgumentException.class, () -> new Scalar.UInt64(max.add(BigInteger.ONE)));
  }
}
