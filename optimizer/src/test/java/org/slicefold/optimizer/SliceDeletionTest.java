// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static org.junit.jupiter.api.Assertions.*;
import static org.slicefold.optimizer.Nodes.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;
import org.slicefold.optimizer.RewriteOutcome.Replacement;
import org.slicefold.optimizer.SliceNodes.SliceDeletion;
import org.slicefold.optimizer.Tree.ExpressionStatement;
import org.slicefold.optimizer.Tree.RaiseStatement;
import org.slicefold.optimizer.Tree.Statement;

public class SliceDeletionTest {

  private static List<Statement> statements(RewriteOutcome outcome) {
    return ((Replacement.Sequence) outcome.replacement()).statements();
  }

  @Test
  public void raisingSubjectSkipsBounds() {
    var raise = raising(ExceptionCategory.NAME_ERROR);
    var deletion = new SliceDeletion(raise, bound(call("f")), Optional.empty(), REF);

    var outcome = deletion.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    assertEquals(List.of(new ExpressionStatement(raise, REF)), statements(outcome));
    assertEquals("Slice del raises exception in sliced value, removed del.", outcome.detail());
  }

  @Test
  public void raisingUpperBoundKeepsSubjectAndLower() {
    var subject = name("x");
    var lower = call("f");
    var raise = raising(ExceptionCategory.VALUE_ERROR);
    var deletion = new SliceDeletion(subject, bound(lower), bound(raise), REF);

    var outcome = deletion.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    assertEquals(
        List.of(
            new ExpressionStatement(subject, REF),
            new ExpressionStatement(lower, REF),
            new ExpressionStatement(raise, REF)),
        statements(outcome));
  }

  @Test
  public void raisingLowerBoundDropsUpper() {
    var raise = raising(ExceptionCategory.KEY_ERROR);
    var deletion = new SliceDeletion(name("x"), bound(raise), bound(call("g")), REF);

    var outcome = deletion.computeStatement(new TraceCollection());

    assertEquals(2, statements(outcome).size());
    assertTrue(outcome.detail().contains("lower slice boundary"), outcome.detail());
  }

  @Test
  public void deletionFromLiteralListIsFolded() {
    var deletion = new SliceDeletion(list(1, 2, 3, 4), bound(1), bound(-1), REF);

    var outcome = deletion.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.CONSTANT_FOLD, outcome.changeKind());
    assertEquals(List.of(), statements(outcome));
    assertEquals("Slice del of constant list predicted to [1, 4], removed del.", outcome.detail());
  }

  @Test
  public void deletionFromStringRaisesTypeError() {
    var deletion = new SliceDeletion(constant("abc"), Optional.empty(), Optional.empty(), REF);

    var outcome = deletion.computeStatement(new TraceCollection());

    assertEquals(ChangeKind.NEW_RAISE, outcome.changeKind());
    var statements = statements(outcome);
    assertEquals(2, statements.size());
    var raise = (RaiseStatement) statements.get(1);
    assertEquals(ExceptionCategory.TYPE_ERROR, raise.category());
    assertEquals("'str' object does not support slice deletion", raise.message());
  }

  @Test
  public void deletionFromNoneRaisesTypeError() {
    var deletion = new SliceDeletion(constant(null), bound(0), Optional.empty(), REF);

    var outcome = deletion.computeStatement(new TraceCollection());

    var statements = statements(outcome);
    var raise = (RaiseStatement) statements.get(statements.size() - 1);
    assertEquals("'NoneType' object does not support slice deletion", raise.message());
  }

  @Test
  public void unknownSubjectIsUnchangedEveryTime() {
    var deletion = new SliceDeletion(name("x"), bound(call("f")), bound(2), REF);

    assertTrue(deletion.computeStatement(new TraceCollection()).isUnchanged());
    assertTrue(deletion.computeStatement(new TraceCollection()).isUnchanged());
  }

  @Test
  public void missingSubjectIsMalformed() {
    assertThrows(
        MalformedTreeException.class,
        () -> new SliceDeletion(null, Optional.empty(), Optional.empty(), REF));
    assertThrows(
        MalformedTreeException.class,
        () -> new SliceDeletion(name("x"), Optional.empty(), null, REF));
  }

  @Test
  public void toStringShowsSlice() {
    var deletion = new SliceDeletion(name("x"), bound(1), Optional.empty(), REF);
    assertEquals("del x[1:]", deletion.toString());
  }
}
