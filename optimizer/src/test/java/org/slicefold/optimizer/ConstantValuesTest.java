// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.slicefold.optimizer.ConstantValues.PyList;
import org.slicefold.optimizer.ConstantValues.PyTuple;
import org.slicefold.optimizer.ConstantValues.ResolvedSliceIndices;
import org.slicefold.optimizer.ConstantValues.SliceValue;

public class ConstantValuesTest {

  @Test
  public void resolveIndices() {
    assertEquals(new ResolvedSliceIndices(1, 3), ConstantValues.resolveSliceIndices(1, 3, 5));
    assertEquals(
        new ResolvedSliceIndices(0, 5), ConstantValues.resolveSliceIndices(null, null, 5));
    assertEquals(new ResolvedSliceIndices(3, 4), ConstantValues.resolveSliceIndices(-2, -1, 5));
    assertEquals(
        new ResolvedSliceIndices(0, 5), ConstantValues.resolveSliceIndices(-10, 100, 5));
    assertEquals(new ResolvedSliceIndices(1, 2), ConstantValues.resolveSliceIndices(true, 2L, 5));
    assertEquals(new ResolvedSliceIndices(4, 4), ConstantValues.resolveSliceIndices(4, 1, 5));
  }

  @Test
  public void hugeIndicesSaturate() {
    var huge = BigInteger.TWO.pow(100);
    assertEquals(
        new ResolvedSliceIndices(0, 5), ConstantValues.resolveSliceIndices(huge.negate(), huge, 5));
    assertEquals(
        new ResolvedSliceIndices(5, 5), ConstantValues.resolveSliceIndices(huge, null, 5));
    assertEquals(
        new ResolvedSliceIndices(2, 3),
        ConstantValues.resolveSliceIndices(BigInteger.TWO, BigInteger.valueOf(-2), 5));
  }

  @Test
  public void sliceIndices() {
    assertTrue(ConstantValues.isSliceIndex(null));
    assertTrue(ConstantValues.isSliceIndex(3));
    assertTrue(ConstantValues.isSliceIndex(3L));
    assertTrue(ConstantValues.isSliceIndex(false));
    assertTrue(ConstantValues.isSliceIndex(BigInteger.TEN.pow(30)));
    assertFalse(ConstantValues.isSliceIndex(1.0));
    assertFalse(ConstantValues.isSliceIndex("1"));
    assertFalse(ConstantValues.isSliceIndex(new PyList(List.of())));
  }

  @Test
  public void iterate() {
    assertEquals(Optional.of(List.of("a", "b")), ConstantValues.iterate("ab"));
    assertEquals(
        Optional.of(List.of("\uD83D\uDE00", "x")), ConstantValues.iterate("\uD83D\uDE00x"));
    assertEquals(Optional.of(List.of(1, 2)), ConstantValues.iterate(new PyTuple(List.of(1, 2))));
    assertEquals(Optional.empty(), ConstantValues.iterate(5));
    assertEquals(Optional.empty(), ConstantValues.iterate(null));
    assertEquals(Optional.empty(), ConstantValues.iterate(new SliceValue(1, 2, null)));
  }

  @Test
  public void reprAndTypeNames() {
    assertEquals("None", ConstantValues.repr(null));
    assertEquals("True", ConstantValues.repr(true));
    assertEquals("'it\\'s'", ConstantValues.repr("it's"));
    assertEquals("[1, None, 'x']", new PyList(Arrays.asList(1, null, "x")).toString());
    assertEquals("(1,)", new PyTuple(List.of(1)).toString());
    assertEquals("()", new PyTuple(List.of()).toString());
    assertEquals("slice(None, 2, None)", new SliceValue(null, 2, null).toString());

    assertEquals("NoneType", ConstantValues.typeName(null));
    assertEquals("list", ConstantValues.typeName(new PyList(List.of())));
    assertEquals("float", ConstantValues.typeName(1.5));
  }

  @Test
  public void sequencesAreCopied() {
    var elements = new ArrayList<Object>(List.of(1, 2));
    var list = new PyList(elements);
    elements.add(3);
    assertEquals(2, list.elements().size());
    assertThrows(UnsupportedOperationException.class, () -> list.elements().add(4));
  }

  @Test
  public void shapes() {
    assertEquals(Shape.NONE, Shape.of(null));
    assertEquals(Shape.BOOL, Shape.of(true));
    assertEquals(Shape.INT, Shape.of(7L));
    assertEquals(Shape.INT, Shape.of(BigInteger.TEN.pow(20)));
    assertEquals(Shape.STR, Shape.of("s"));
    assertEquals(Shape.TUPLE, Shape.of(new PyTuple(List.of())));
    assertEquals(Shape.SLICE, Shape.of(new SliceValue(null, null, null)));
    assertEquals(Shape.UNKNOWN, Shape.of(new Object()));
    assertEquals(Optional.empty(), Shape.UNKNOWN.iterable());
    assertEquals(Optional.of(true), Shape.STR.iterable());
  }
}
