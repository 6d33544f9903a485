// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static java.util.stream.Collectors.joining;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Literal values known at compile time.
 *
 * <p>None is represented by Java {@code null}, bool by {@link Boolean}, int by {@link Integer},
 * {@link Long} or, beyond 64 bits, {@link BigInteger}, float by {@link Double} and str by {@link
 * String}. Sequences and slice objects use the immutable records declared here.
 */
public class ConstantValues {
  private ConstantValues() {}

  public record PyList(List<Object> elements) {
    public PyList {
      elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String toString() {
      return elements.stream().map(ConstantValues::repr).collect(joining(", ", "[", "]"));
    }
  }

  public record PyTuple(List<Object> elements) {
    public PyTuple {
      elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public String toString() {
      return elements.size() == 1
          ? "(%s,)".formatted(repr(elements.get(0)))
          : elements.stream().map(ConstantValues::repr).collect(joining(", ", "(", ")"));
    }
  }

  /** Value of the builtin {@code slice(start, stop, step)}; any component may be None. */
  public record SliceValue(Object start, Object stop, Object step) {
    @Override
    public String toString() {
      return "slice(%s, %s, %s)".formatted(repr(start), repr(stop), repr(step));
    }
  }

  /** Bounds of a two-bound slice resolved against a sequence, with {@code lower <= upper}. */
  public record ResolvedSliceIndices(int lower, int upper) {}

  /**
   * Resolves slice bounds against a sequence of the given length. Negative bounds count from the
   * end and out of range bounds are clamped, so the result never indexes outside the sequence.
   *
   * @param lower a slice index as accepted by {@link #isSliceIndex}
   * @param upper a slice index as accepted by {@link #isSliceIndex}
   */
  public static ResolvedSliceIndices resolveSliceIndices(
      Object lower, Object upper, int sequenceLength) {
    int resolvedLower = lower == null ? 0 : clamp(toIndex(lower), sequenceLength);
    int resolvedUpper = upper == null ? sequenceLength : clamp(toIndex(upper), sequenceLength);
    return new ResolvedSliceIndices(resolvedLower, Math.max(resolvedLower, resolvedUpper));
  }

  private static int clamp(long index, int length) {
    long resolved = index < 0 ? length + index : index;
    return (int) Math.max(0, Math.min(resolved, length));
  }

  /** Returns true for values accepted as slice bounds: ints, bools and None. */
  public static boolean isSliceIndex(Object value) {
    return value == null
        || value instanceof Integer
        || value instanceof Long
        || value instanceof BigInteger
        || value instanceof Boolean;
  }

  // Ints beyond 64 bits saturate; any sequence is shorter than either limit.
  private static long toIndex(Object value) {
    if (value instanceof Boolean bool) {
      return bool ? 1 : 0;
    } else if (value instanceof BigInteger big && big.bitLength() >= Long.SIZE) {
      return big.signum() < 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
    return ((Number) value).longValue();
  }

  /** Returns the elements produced by iterating the value, or empty if it isn't iterable. */
  public static Optional<List<Object>> iterate(Object value) {
    if (value instanceof PyList list) {
      return Optional.of(list.elements());
    } else if (value instanceof PyTuple tuple) {
      return Optional.of(tuple.elements());
    } else if (value instanceof String string) {
      // One element per code point, so characters outside the BMP are never split.
      return Optional.of(
          string.codePoints().mapToObj(c -> (Object) Character.toString(c)).toList());
    }
    return Optional.empty();
  }

  public static String typeName(Object value) {
    if (value == null) {
      return "NoneType";
    }
    return Shape.of(value).pythonName();
  }

  public static String repr(Object value) {
    if (value == null) {
      return "None";
    } else if (value instanceof Boolean bool) {
      return bool ? "True" : "False";
    } else if (value instanceof String string) {
      return "'%s'".formatted(string.replace("\\", "\\\\").replace("'", "\\'"));
    }
    return value.toString();
  }
}
