// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static org.slicefold.optimizer.ExceptionCategory.BASE_EXCEPTION;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.SourceRef;

/**
 * Refines the children of one node in evaluation order and remembers the first child that
 * certainly raises.
 *
 * <p>Children evaluated up to and including the raising one are kept so that a replacement can
 * evaluate them for effect; callers stop refining once {@link #raised()} is true.
 */
final class EvaluationOrder {
  private final TraceCollection trace;
  private final List<Expression> evaluated = new ArrayList<>();
  private boolean changed = false;
  private String raisingSlot = null;

  EvaluationOrder(TraceCollection trace) {
    this.trace = trace;
  }

  Expression refine(String slot, Expression child) {
    checkNotRaised(slot);
    var refined = trace.refine(child);
    record(slot, child, refined);
    return refined;
  }

  Optional<Expression> refineOptional(String slot, Optional<Expression> child) {
    checkNotRaised(slot);
    var refined = trace.refineOptional(child);
    refined.ifPresent(r -> record(slot, child.get(), r));
    return refined;
  }

  private void checkNotRaised(String slot) {
    if (raisingSlot != null) {
      throw new IllegalStateException(
          "Refining '%s' after '%s' is known to raise".formatted(slot, raisingSlot));
    }
  }

  private void record(String slot, Expression original, Expression refined) {
    if (refined != original) {
      changed = true;
    }
    evaluated.add(refined);
    if (refined.willRaise(BASE_EXCEPTION)) {
      raisingSlot = slot;
    }
  }

  boolean raised() {
    return raisingSlot != null;
  }

  boolean changed() {
    return changed;
  }

  String raisingSlot() {
    return raisingSlot;
  }

  List<Expression> evaluated() {
    return List.copyOf(evaluated);
  }

  /** Replaces a statement by evaluating the refined children for effect, raising one last. */
  RewriteOutcome statementRaise(String detail) {
    return RewriteOutcome.replacedBy(
        Tree.statementsForEffect(evaluated), ChangeKind.NEW_RAISE, detail);
  }

  /** Replaces an expression by the refined children, yielding the raising one last. */
  RewriteOutcome expressionRaise(SourceRef sourceRef, String detail) {
    int last = evaluated.size() - 1;
    return RewriteOutcome.replacedBy(
        Tree.withSideEffects(evaluated.subList(0, last), evaluated.get(last), sourceRef),
        ChangeKind.NEW_RAISE,
        detail);
  }
}
