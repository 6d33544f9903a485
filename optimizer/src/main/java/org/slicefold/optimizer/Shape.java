// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import java.math.BigInteger;
import java.util.Optional;
import org.slicefold.optimizer.ConstantValues.PyList;
import org.slicefold.optimizer.ConstantValues.PyTuple;
import org.slicefold.optimizer.ConstantValues.SliceValue;

/** Coarse static approximation of the runtime type of a value. */
public enum Shape {
  UNKNOWN("object", Optional.empty()),
  NONE("NoneType", Optional.of(false)),
  BOOL("bool", Optional.of(false)),
  INT("int", Optional.of(false)),
  FLOAT("float", Optional.of(false)),
  STR("str", Optional.of(true)),
  LIST("list", Optional.of(true)),
  TUPLE("tuple", Optional.of(true)),
  SLICE("slice", Optional.of(false));

  private final String pythonName;
  private final Optional<Boolean> iterable;

  Shape(String pythonName, Optional<Boolean> iterable) {
    this.pythonName = pythonName;
    this.iterable = iterable;
  }

  public String pythonName() {
    return pythonName;
  }

  /** Whether values of this shape are iterable, or empty if unknown. */
  public Optional<Boolean> iterable() {
    return iterable;
  }

  public static Shape of(Object constant) {
    if (constant == null) {
      return NONE;
    } else if (constant instanceof Boolean) {
      return BOOL;
    } else if (constant instanceof Integer
        || constant instanceof Long
        || constant instanceof BigInteger) {
      return INT;
    } else if (constant instanceof Double) {
      return FLOAT;
    } else if (constant instanceof String) {
      return STR;
    } else if (constant instanceof PyList) {
      return LIST;
    } else if (constant instanceof PyTuple) {
      return TUPLE;
    } else if (constant instanceof SliceValue) {
      return SLICE;
    }
    return UNKNOWN;
  }
}
