// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slicefold.optimizer.ConstantValues.PyList;
import org.slicefold.optimizer.ConstantValues.PyTuple;
import org.slicefold.optimizer.ConstantValues.ResolvedSliceIndices;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;
import org.slicefold.optimizer.SliceNodes.SliceAssignment;
import org.slicefold.optimizer.SliceNodes.SliceDeletion;
import org.slicefold.optimizer.SliceNodes.SliceLookup;
import org.slicefold.optimizer.Tree.ConstantRef;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.RaiseExpression;
import org.slicefold.optimizer.Tree.RaiseStatement;
import org.slicefold.optimizer.Tree.SourceRef;
import org.slicefold.optimizer.Tree.Statement;

/** Registry of {@link SliceHandler} keyed by the shape of the sliced value. */
public class SliceHandlers {
  private SliceHandlers() {}

  private static final SliceHandler NOT_APPLICABLE = new SliceHandler() {};

  private static final Map<Shape, SliceHandler> handlers;

  static {
    var map = new EnumMap<Shape, SliceHandler>(Shape.class);
    map.put(Shape.LIST, new SequenceHandler(Shape.LIST));
    map.put(Shape.TUPLE, new SequenceHandler(Shape.TUPLE));
    map.put(Shape.STR, new SequenceHandler(Shape.STR));
    for (var shape : List.of(Shape.NONE, Shape.BOOL, Shape.INT, Shape.FLOAT, Shape.SLICE)) {
      map.put(shape, new UnsliceableHandler(shape));
    }
    handlers = Collections.unmodifiableMap(map);
  }

  /** Returns the handler for subjects of the shape; shapes without one leave nodes unchanged. */
  public static SliceHandler forShape(Shape shape) {
    return handlers.getOrDefault(shape, NOT_APPLICABLE);
  }

  /** Shapes whose literal values have their slices computed at compile time. */
  public static List<Shape> foldedShapes() {
    return handlers.entrySet().stream()
        .filter(entry -> entry.getValue() instanceof SequenceHandler)
        .map(Map.Entry::getKey)
        .toList();
  }

  static final String SLICE_INDICES_MESSAGE =
      "slice indices must be integers or None or have an __index__ method";

  private static List<Statement> raisingStatements(
      List<Expression> evaluated, String message, SourceRef sourceRef) {
    var statements = new ArrayList<>(Tree.statementsForEffect(evaluated));
    statements.add(new RaiseStatement(ExceptionCategory.TYPE_ERROR, message, sourceRef));
    return statements;
  }

  private static Expression raisingExpression(
      List<Expression> evaluated, String message, SourceRef sourceRef) {
    return Tree.withSideEffects(
        evaluated,
        new RaiseExpression(ExceptionCategory.TYPE_ERROR, message, sourceRef),
        sourceRef);
  }

  /** Literal values of both bounds, absent bounds being None. */
  private record ConstantBounds(Object lower, Object upper) {
    static Optional<ConstantBounds> of(Optional<Expression> lower, Optional<Expression> upper) {
      if (!isConstantOrAbsent(lower) || !isConstantOrAbsent(upper)) {
        return Optional.empty();
      }
      return Optional.of(new ConstantBounds(valueOf(lower), valueOf(upper)));
    }

    private static boolean isConstantOrAbsent(Optional<Expression> bound) {
      return bound.map(b -> b instanceof ConstantRef).orElse(true);
    }

    private static Object valueOf(Optional<Expression> bound) {
      return bound.map(b -> ((ConstantRef) b).value()).orElse(null);
    }

    boolean areIndices() {
      return ConstantValues.isSliceIndex(lower) && ConstantValues.isSliceIndex(upper);
    }

    ResolvedSliceIndices resolve(int sequenceLength) {
      return ConstantValues.resolveSliceIndices(lower, upper, sequenceLength);
    }
  }

  /** Sequences: list, tuple and str. Only lists support slice assignment and deletion. */
  private static class SequenceHandler implements SliceHandler {
    private final Shape shape;

    SequenceHandler(Shape shape) {
      this.shape = shape;
    }

    private boolean isMutable() {
      return shape == Shape.LIST;
    }

    @Override
    public RewriteOutcome onSliceRead(SliceLookup lookup, TraceCollection trace) {
      var bounds = ConstantBounds.of(lookup.lower(), lookup.upper());
      if (bounds.isEmpty()) {
        return RewriteOutcome.unchanged();
      }
      if (!bounds.get().areIndices()) {
        return RewriteOutcome.replacedBy(
            raisingExpression(lookup.evaluationOrder(), SLICE_INDICES_MESSAGE, lookup.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Slice lookup on %s with non-integer bounds raises TypeError."
                .formatted(shape.pythonName()));
      }
      if (!(lookup.subject() instanceof ConstantRef subject)) {
        return RewriteOutcome.unchanged();
      }
      var result = sliceOf(subject.value(), bounds.get());
      return RewriteOutcome.replacedBy(
          new ConstantRef(result, lookup.sourceRef()),
          ChangeKind.CONSTANT_FOLD,
          "Slice lookup on constant %s predicted to %s."
              .formatted(shape.pythonName(), ConstantValues.repr(result)));
    }

    @Override
    public RewriteOutcome onSliceAssign(SliceAssignment assignment, TraceCollection trace) {
      if (!isMutable()) {
        return RewriteOutcome.replacedBy(
            raisingStatements(
                assignment.evaluationOrder(),
                "'%s' object does not support slice assignment".formatted(shape.pythonName()),
                assignment.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Slice assignment to %s raises TypeError, removed assignment."
                .formatted(shape.pythonName()));
      }
      var bounds = ConstantBounds.of(assignment.lower(), assignment.upper());
      if (bounds.isEmpty()) {
        return RewriteOutcome.unchanged();
      }
      if (!bounds.get().areIndices()) {
        return RewriteOutcome.replacedBy(
            raisingStatements(
                assignment.evaluationOrder(), SLICE_INDICES_MESSAGE, assignment.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Slice assignment with non-integer bounds raises TypeError, removed assignment.");
      }
      if (assignment.value().typeShape().iterable().equals(Optional.of(false))) {
        return RewriteOutcome.replacedBy(
            raisingStatements(
                assignment.evaluationOrder(),
                "can only assign an iterable",
                assignment.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Slice assignment of non-iterable value raises TypeError, removed assignment.");
      }
      if (!(assignment.subject() instanceof ConstantRef subject)
          || !(assignment.value() instanceof ConstantRef value)) {
        return RewriteOutcome.unchanged();
      }
      var items = ConstantValues.iterate(value.value());
      if (items.isEmpty()) {
        return RewriteOutcome.unchanged();
      }
      var elements = ((PyList) subject.value()).elements();
      var slice = bounds.get().resolve(elements.size());
      var updated = new ArrayList<Object>(elements.subList(0, slice.lower()));
      updated.addAll(items.get());
      updated.addAll(elements.subList(slice.upper(), elements.size()));
      // The updated list is unreachable after the statement, so nothing remains to execute.
      return RewriteOutcome.replacedBy(
          List.of(),
          ChangeKind.CONSTANT_FOLD,
          "Slice assignment to constant list predicted to %s, removed assignment."
              .formatted(new PyList(updated)));
    }

    @Override
    public RewriteOutcome onSliceDelete(SliceDeletion deletion, TraceCollection trace) {
      if (!isMutable()) {
        return RewriteOutcome.replacedBy(
            raisingStatements(
                deletion.evaluationOrder(),
                "'%s' object does not support slice deletion".formatted(shape.pythonName()),
                deletion.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Slice del of %s raises TypeError, removed del.".formatted(shape.pythonName()));
      }
      var bounds = ConstantBounds.of(deletion.lower(), deletion.upper());
      if (bounds.isEmpty()) {
        return RewriteOutcome.unchanged();
      }
      if (!bounds.get().areIndices()) {
        return RewriteOutcome.replacedBy(
            raisingStatements(
                deletion.evaluationOrder(), SLICE_INDICES_MESSAGE, deletion.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Slice del with non-integer bounds raises TypeError, removed del.");
      }
      if (!(deletion.subject() instanceof ConstantRef subject)) {
        return RewriteOutcome.unchanged();
      }
      var elements = ((PyList) subject.value()).elements();
      var slice = bounds.get().resolve(elements.size());
      var remaining = new ArrayList<Object>(elements.subList(0, slice.lower()));
      remaining.addAll(elements.subList(slice.upper(), elements.size()));
      return RewriteOutcome.replacedBy(
          List.of(),
          ChangeKind.CONSTANT_FOLD,
          "Slice del of constant list predicted to %s, removed del."
              .formatted(new PyList(remaining)));
    }

    private static Object sliceOf(Object sequence, ConstantBounds bounds) {
      if (sequence instanceof PyList list) {
        var slice = bounds.resolve(list.elements().size());
        return new PyList(list.elements().subList(slice.lower(), slice.upper()));
      } else if (sequence instanceof PyTuple tuple) {
        var slice = bounds.resolve(tuple.elements().size());
        return new PyTuple(tuple.elements().subList(slice.lower(), slice.upper()));
      } else {
        // str indices count code points, not UTF-16 chars.
        var string = (String) sequence;
        var slice = bounds.resolve(string.codePointCount(0, string.length()));
        int begin = string.offsetByCodePoints(0, slice.lower());
        int end = string.offsetByCodePoints(begin, slice.upper() - slice.lower());
        return string.substring(begin, end);
      }
    }
  }

  /** Values that support no slice operation at all. */
  private static class UnsliceableHandler implements SliceHandler {
    private final Shape shape;

    UnsliceableHandler(Shape shape) {
      this.shape = shape;
    }

    @Override
    public RewriteOutcome onSliceRead(SliceLookup lookup, TraceCollection trace) {
      return RewriteOutcome.replacedBy(
          raisingExpression(
              lookup.evaluationOrder(),
              "'%s' object is not subscriptable".formatted(shape.pythonName()),
              lookup.sourceRef()),
          ChangeKind.NEW_RAISE,
          "Slice lookup on %s raises TypeError.".formatted(shape.pythonName()));
    }

    @Override
    public RewriteOutcome onSliceAssign(SliceAssignment assignment, TraceCollection trace) {
      return RewriteOutcome.replacedBy(
          raisingStatements(
              assignment.evaluationOrder(),
              "'%s' object does not support slice assignment".formatted(shape.pythonName()),
              assignment.sourceRef()),
          ChangeKind.NEW_RAISE,
          "Slice assignment to %s raises TypeError, removed assignment."
              .formatted(shape.pythonName()));
    }

    @Override
    public RewriteOutcome onSliceDelete(SliceDeletion deletion, TraceCollection trace) {
      return RewriteOutcome.replacedBy(
          raisingStatements(
              deletion.evaluationOrder(),
              "'%s' object does not support slice deletion".formatted(shape.pythonName()),
              deletion.sourceRef()),
          ChangeKind.NEW_RAISE,
          "Slice del of %s raises TypeError, removed del.".formatted(shape.pythonName()));
    }
  }
}
