// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static java.util.stream.Collectors.joining;
import static org.slicefold.optimizer.MalformedTreeException.requireChild;
import static org.slicefold.optimizer.Tree.normalizeBound;
import static org.slicefold.optimizer.Tree.slot;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slicefold.optimizer.Tree.ChildSlot;
import org.slicefold.optimizer.Tree.ConstantRef;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.NodeKind;
import org.slicefold.optimizer.Tree.SourceRef;
import org.slicefold.optimizer.Tree.Statement;

/**
 * Slice nodes.
 *
 * <p>Slices are important when working with lists. Tracking them allows more compact code, or
 * predicting results at compile time.
 */
public class SliceNodes {
  private SliceNodes() {}

  private static List<Expression> presentInOrder(
      Expression first, Optional<Expression> lower, Optional<Expression> upper) {
    var result = new ArrayList<Expression>();
    result.add(first);
    lower.ifPresent(result::add);
    upper.ifPresent(result::add);
    return result;
  }

  /** Statement {@code subject[lower:upper] = value}. */
  public record SliceAssignment(
      Expression value,
      Expression subject,
      Optional<Expression> lower,
      Optional<Expression> upper,
      SourceRef sourceRef)
      implements Statement {
    public SliceAssignment {
      requireChild(value, "SLICE_ASSIGNMENT", "value");
      requireChild(subject, "SLICE_ASSIGNMENT", "subject");
      lower = normalizeBound(lower, "SLICE_ASSIGNMENT", "lower");
      upper = normalizeBound(upper, "SLICE_ASSIGNMENT", "upper");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SLICE_ASSIGNMENT;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of(
          slot("value", value),
          slot("subject", subject),
          slot("lower", lower),
          slot("upper", upper));
    }

    /** Present children in the order they are evaluated. */
    public List<Expression> evaluationOrder() {
      var result = new ArrayList<Expression>();
      result.add(value);
      result.addAll(presentInOrder(subject, lower, upper));
      return result;
    }

    @Override
    public RewriteOutcome computeStatement(TraceCollection trace) {
      var order = new EvaluationOrder(trace);

      // No assignment will occur if the assigned value raises.
      var value = order.refine("value", value());
      if (order.raised()) {
        return order.statementRaise(
            "Slice assignment raises exception in assigned value, removed assignment.");
      }

      var subject = order.refine("subject", subject());
      if (order.raised()) {
        return order.statementRaise(
            "Slice assignment raises exception in sliced value, removed assignment.");
      }

      var lower = order.refineOptional("lower", lower());
      if (order.raised()) {
        return order.statementRaise(
            "Slice assignment raises exception in lower slice boundary value, removed"
                + " assignment.");
      }

      var upper = order.refineOptional("upper", upper());
      if (order.raised()) {
        return order.statementRaise(
            "Slice assignment raises exception in upper slice boundary value, removed"
                + " assignment.");
      }

      var refined =
          order.changed() ? new SliceAssignment(value, subject, lower, upper, sourceRef) : this;
      return Tree.unchangedOrRefined(
          SliceHandlers.forShape(subject.typeShape()).onSliceAssign(refined, trace),
          this,
          refined);
    }

    @Override
    public JsonElement astNode() {
      var targets = new JsonArray();
      targets.add(Tree.astSubscript(subject, lower, upper, "Store", sourceRef));
      var node = Tree.astObject("Assign", sourceRef);
      node.add("targets", targets);
      node.add("value", value.astNode());
      return node;
    }

    @Override
    public String toString() {
      return "%s = %s".formatted(Tree.sliceString(subject, lower, upper), value);
    }
  }

  /** Statement {@code del subject[lower:upper]}. */
  public record SliceDeletion(
      Expression subject,
      Optional<Expression> lower,
      Optional<Expression> upper,
      SourceRef sourceRef)
      implements Statement {
    public SliceDeletion {
      requireChild(subject, "SLICE_DELETION", "subject");
      lower = normalizeBound(lower, "SLICE_DELETION", "lower");
      upper = normalizeBound(upper, "SLICE_DELETION", "upper");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SLICE_DELETION;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of(slot("subject", subject), slot("lower", lower), slot("upper", upper));
    }

    public List<Expression> evaluationOrder() {
      return presentInOrder(subject, lower, upper);
    }

    @Override
    public RewriteOutcome computeStatement(TraceCollection trace) {
      var order = new EvaluationOrder(trace);

      var subject = order.refine("subject", subject());
      if (order.raised()) {
        return order.statementRaise("Slice del raises exception in sliced value, removed del.");
      }

      var lower = order.refineOptional("lower", lower());
      if (order.raised()) {
        return order.statementRaise(
            "Slice del raises exception in lower slice boundary value, removed del.");
      }

      var upper = order.refineOptional("upper", upper());
      if (order.raised()) {
        return order.statementRaise(
            "Slice del raises exception in upper slice boundary value, removed del.");
      }

      var refined = order.changed() ? new SliceDeletion(subject, lower, upper, sourceRef) : this;
      return Tree.unchangedOrRefined(
          SliceHandlers.forShape(subject.typeShape()).onSliceDelete(refined, trace),
          this,
          refined);
    }

    @Override
    public JsonElement astNode() {
      var targets = new JsonArray();
      targets.add(Tree.astSubscript(subject, lower, upper, "Del", sourceRef));
      var node = Tree.astObject("Delete", sourceRef);
      node.add("targets", targets);
      return node;
    }

    @Override
    public String toString() {
      return "del " + Tree.sliceString(subject, lower, upper);
    }
  }

  /**
   * Expression {@code subject[lower:upper]} in its two-bound form, kept apart from general
   * subscripts since objects may implement the two-bound protocol separately.
   */
  public record SliceLookup(
      Expression subject,
      Optional<Expression> lower,
      Optional<Expression> upper,
      SourceRef sourceRef)
      implements Expression {
    public SliceLookup {
      requireChild(subject, "SLICE_LOOKUP", "subject");
      lower = normalizeBound(lower, "SLICE_LOOKUP", "lower");
      upper = normalizeBound(upper, "SLICE_LOOKUP", "upper");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SLICE_LOOKUP;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of(slot("subject", subject), slot("lower", lower), slot("upper", upper));
    }

    public List<Expression> evaluationOrder() {
      return presentInOrder(subject, lower, upper);
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      // The subject alone decides what a read does, so there is no short-circuit here.
      var subject = trace.refine(subject());
      var lower = trace.refineOptional(lower());
      var upper = trace.refineOptional(upper());

      var refined =
          subject == subject() && sameBounds(lower, upper)
              ? this
              : new SliceLookup(subject, lower, upper, sourceRef);
      return Tree.unchangedOrRefined(
          SliceHandlers.forShape(subject.typeShape()).onSliceRead(refined, trace), this, refined);
    }

    private boolean sameBounds(Optional<Expression> lower, Optional<Expression> upper) {
      return lower.orElse(null) == lower().orElse(null)
          && upper.orElse(null) == upper().orElse(null);
    }

    @Override
    public Optional<Boolean> isKnownToBeIterable(int count) {
      // TODO: Answer from the shape of the sliced value once lookups track result shapes.
      return Optional.empty();
    }

    @Override
    public JsonElement astNode() {
      return Tree.astSubscript(subject, lower, upper, "Load", sourceRef);
    }

    @Override
    public String toString() {
      return Tree.sliceString(subject, lower, upper);
    }
  }

  /**
   * Creates the node for {@code slice(start, stop[, step])}. A supplied step, even a literal None,
   * selects the three argument form; omitted start or stop become literal None.
   */
  public static BuiltinSlice makeBuiltinSlice(
      Optional<Expression> start,
      Optional<Expression> stop,
      Optional<Expression> step,
      SourceRef sourceRef) {
    var startValue = start.orElseGet(() -> ConstantRef.none(sourceRef));
    var stopValue = stop.orElseGet(() -> ConstantRef.none(sourceRef));
    if (step.isPresent()) {
      return new BuiltinSlice3(startValue, stopValue, step.get(), sourceRef);
    } else {
      return new BuiltinSlice2(startValue, stopValue, sourceRef);
    }
  }

  /** Call of the builtin {@code slice}; the result is always a slice object. */
  public interface BuiltinSlice extends Expression {
    List<Expression> args();

    @Override
    default Shape typeShape() {
      return Shape.SLICE;
    }

    @Override
    default Optional<Boolean> isKnownToBeIterable(int count) {
      // Definitely not iterable at all.
      return Optional.of(false);
    }

    @Override
    default boolean mayRaise(ExceptionCategory category) {
      return args().stream().anyMatch(arg -> arg.mayRaise(category));
    }

    @Override
    default boolean mayHaveSideEffects() {
      return mayRaise(ExceptionCategory.BASE_EXCEPTION);
    }

    @Override
    default JsonElement astNode() {
      return Tree.astCall("slice", Tree.astArray(args()), sourceRef());
    }
  }

  public record BuiltinSlice2(Expression start, Expression stop, SourceRef sourceRef)
      implements BuiltinSlice {
    public BuiltinSlice2 {
      requireChild(start, "BUILTIN_SLICE2", "start");
      requireChild(stop, "BUILTIN_SLICE2", "stop");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BUILTIN_SLICE2;
    }

    @Override
    public List<Expression> args() {
      return List.of(start, stop);
    }

    @Override
    public List<ChildSlot> children() {
      return List.of(slot("start", start), slot("stop", stop));
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      return BuiltinSpec.SLICE.computeBuiltinSpec(
          this, args(), trace, args -> new BuiltinSlice2(args.get(0), args.get(1), sourceRef));
    }

    @Override
    public String toString() {
      return "slice(%s, %s)".formatted(start, stop);
    }
  }

  public record BuiltinSlice3(
      Expression start, Expression stop, Expression step, SourceRef sourceRef)
      implements BuiltinSlice {
    public BuiltinSlice3 {
      requireChild(start, "BUILTIN_SLICE3", "start");
      requireChild(stop, "BUILTIN_SLICE3", "stop");
      requireChild(step, "BUILTIN_SLICE3", "step");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.BUILTIN_SLICE3;
    }

    @Override
    public List<Expression> args() {
      return List.of(start, stop, step);
    }

    @Override
    public List<ChildSlot> children() {
      return List.of(slot("start", start), slot("stop", stop), slot("step", step));
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      return BuiltinSpec.SLICE.computeBuiltinSpec(
          this,
          args(),
          trace,
          args -> new BuiltinSlice3(args.get(0), args.get(1), args.get(2), sourceRef));
    }

    @Override
    public String toString() {
      return args().stream().map(Object::toString).collect(joining(", ", "slice(", ")"));
    }
  }
}
