// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static org.junit.jupiter.api.Assertions.*;
import static org.slicefold.optimizer.Nodes.*;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.slicefold.optimizer.ConstantValues.PyList;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;
import org.slicefold.optimizer.RewriteOutcome.Replacement;
import org.slicefold.optimizer.SliceNodes.SliceAssignment;
import org.slicefold.optimizer.SliceNodes.SliceLookup;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.ExpressionStatement;
import org.slicefold.optimizer.Tree.RaiseStatement;
import org.slicefold.optimizer.Tree.Statement;

public class SliceAssignmentTest {

  private static List<Statement> statements(RewriteOutcome outcome) {
    return ((Replacement.Sequence) outcome.replacement()).statements();
  }

  private static List<Expression> evaluatedForEffect(RewriteOutcome outcome) {
    return statements(outcome).stream()
        .map(s -> ((ExpressionStatement) s).expression())
        .toList();
  }

  @Test
  public void raisingValueRemovesAssignment() {
    var raise = raising(ExceptionCategory.ZERO_DIVISION_ERROR);
    var assignment =
        new SliceAssignment(raise, name("x"), bound(call("f")), bound(call("g")), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    assertEquals(List.of(raise), evaluatedForEffect(outcome));
    assertTrue(outcome.detail().contains("assigned value"), outcome.detail());
  }

  @Test
  public void raisingSubjectKeepsValue() {
    var value = call("v");
    var raise = raising(ExceptionCategory.RUNTIME_ERROR);
    var assignment = new SliceAssignment(value, raise, bound(call("f")), Optional.empty(), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    assertEquals(List.of(value, raise), evaluatedForEffect(outcome));
    assertTrue(outcome.detail().contains("sliced value"), outcome.detail());
  }

  @Test
  public void raisingUpperBoundKeepsEverythingBefore() {
    var value = call("v");
    var subject = name("x");
    var lower = call("f");
    var raise = raising(ExceptionCategory.VALUE_ERROR);
    var assignment = new SliceAssignment(value, subject, bound(lower), bound(raise), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    assertEquals(List.of(value, subject, lower, raise), evaluatedForEffect(outcome));
    assertTrue(outcome.detail().contains("upper slice boundary"), outcome.detail());
  }

  @Test
  public void unboundSubjectBecomesNameError() {
    var value = list(1);
    var assignment =
        new SliceAssignment(value, name("x"), Optional.empty(), Optional.empty(), REF);

    var outcome = assignment.computeStatement(new TraceCollection(Set.of("x")));

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    var effects = evaluatedForEffect(outcome);
    assertEquals(2, effects.size());
    assertSame(value, effects.get(0));
    assertTrue(effects.get(1).willRaise(ExceptionCategory.NAME_ERROR));
  }

  @Test
  public void literalNoneBoundsAreAbsent() {
    var assignment =
        new SliceAssignment(
            list(1), name("x"), bound(constant(null)), bound(constant(null)), REF);
    assertTrue(assignment.lower().isEmpty());
    assertTrue(assignment.upper().isEmpty());
    assertEquals(4, assignment.children().size());
    assertTrue(assignment.children().get(2).node().isEmpty());
  }

  @Test
  public void missingChildIsMalformed() {
    assertThrows(
        MalformedTreeException.class,
        () -> new SliceAssignment(null, name("x"), Optional.empty(), Optional.empty(), REF));
    assertThrows(
        MalformedTreeException.class,
        () -> new SliceAssignment(list(1), null, Optional.empty(), Optional.empty(), REF));
    assertThrows(
        MalformedTreeException.class,
        () -> new SliceAssignment(list(1), name("x"), null, Optional.empty(), REF));
  }

  @Test
  public void assignmentToLiteralListIsFolded() {
    var assignment = new SliceAssignment(list(9), list(1, 2, 3), bound(0), bound(1), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.CONSTANT_FOLD, outcome.changeKind());
    assertEquals(List.of(), statements(outcome));
    assertEquals(
        "Slice assignment to constant list predicted to [9, 2, 3], removed assignment.",
        outcome.detail());
  }

  @Test
  public void assignedStringIsSplitIntoCodePoints() {
    // l[0:0] = "😀"
    var assignment =
        new SliceAssignment(constant("\uD83D\uDE00"), list(1), bound(0), bound(0), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(
        "Slice assignment to constant list predicted to ['\uD83D\uDE00', 1], removed assignment.",
        outcome.detail());
  }

  @Test
  public void assignmentToTupleRaisesTypeError() {
    var value = list(1);
    var subject = tuple(1, 2);
    var assignment = new SliceAssignment(value, subject, Optional.empty(), Optional.empty(), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    var statements = statements(outcome);
    assertEquals(3, statements.size());
    assertEquals(value, ((ExpressionStatement) statements.get(0)).expression());
    assertEquals(subject, ((ExpressionStatement) statements.get(1)).expression());
    var raise = (RaiseStatement) statements.get(2);
    assertEquals(ExceptionCategory.TYPE_ERROR, raise.category());
    assertEquals("'tuple' object does not support slice assignment", raise.message());
  }

  @Test
  public void assignmentOfNonIterableRaisesTypeError() {
    var assignment =
        new SliceAssignment(constant(5), list(1, 2), Optional.empty(), Optional.empty(), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    var statements = statements(outcome);
    var raise = (RaiseStatement) statements.get(statements.size() - 1);
    assertEquals("can only assign an iterable", raise.message());
  }

  @Test
  public void nonIntegerBoundsRaiseTypeError() {
    var assignment =
        new SliceAssignment(list(1), list(1, 2), bound(constant(1.5)), Optional.empty(), REF);

    var outcome = assignment.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    var statements = statements(outcome);
    assertEquals(4, statements.size());
    var raise = (RaiseStatement) statements.get(3);
    assertEquals(SliceHandlers.SLICE_INDICES_MESSAGE, raise.message());
  }

  @Test
  public void unknownSubjectIsUnchangedEveryTime() {
    var assignment = new SliceAssignment(list(1), name("x"), bound(0), bound(call("f")), REF);
    var trace = new TraceCollection();

    assertTrue(assignment.computeStatement(trace).isUnchanged());
    assertTrue(assignment.computeStatement(trace).isUnchanged());
    assertTrue(trace.changes().isEmpty());
  }

  @Test
  public void refinedChildrenRebuildAssignment() {
    var value = new SliceLookup(list(1, 2, 3), bound(0), bound(2), REF);
    var assignment = new SliceAssignment(value, name("x"), Optional.empty(), Optional.empty(), REF);
    var trace = new TraceCollection();

    var outcome = assignment.computeStatement(trace);

    assertEquals(ChangeKind.CHILDREN_REFINED, outcome.changeKind());
    var rebuilt = (SliceAssignment) ((Replacement.Single) outcome.replacement()).node();
    assertEquals(constant(new PyList(List.of(1, 2))), rebuilt.value());
    assertEquals(1, trace.changes().size());
    assertEquals(ChangeKind.CONSTANT_FOLD, trace.changes().get(0).kind());

    assertTrue(rebuilt.computeStatement(new TraceCollection()).isUnchanged());
  }
}
