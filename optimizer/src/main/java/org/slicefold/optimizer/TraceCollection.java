// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;
import org.slicefold.optimizer.RewriteOutcome.Replacement;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.SourceRef;
import org.slicefold.optimizer.Tree.Statement;

/**
 * Abstract interpretation context of one optimization pass over one compilation unit.
 *
 * <p>Not thread safe; a pass owns its trace collection exclusively.
 */
public class TraceCollection {
  // Bound on consecutive rewrites of one node within a single refinement.
  private static final int MAX_REWRITES_PER_NODE = 64;

  public record Change(ChangeKind kind, SourceRef sourceRef, String detail) {}

  private final Set<String> unboundVariables;
  private final List<Change> changes = new ArrayList<>();

  public TraceCollection() {
    this(Set.of());
  }

  public TraceCollection(Set<String> unboundVariables) {
    this.unboundVariables = Set.copyOf(unboundVariables);
  }

  /** Optimizes a required child and returns its current best form. */
  public Expression refine(Expression child) {
    if (child == null) {
      throw new MalformedTreeException("Cannot refine an absent required child");
    }
    Expression current = child;
    for (int i = 0; i < MAX_REWRITES_PER_NODE; ++i) {
      var outcome = current.computeExpression(this);
      if (outcome.isUnchanged()) {
        return current;
      }
      if (outcome.replacement() instanceof Replacement.Single single
          && single.node() instanceof Expression expression) {
        onChange(outcome, current.sourceRef());
        current = expression;
      } else {
        throw new IllegalStateException(
            "Rewrite of expression `%s` must produce an expression but got %s"
                .formatted(current, outcome.replacement()));
      }
    }
    throw new IllegalStateException("Rewrites of expression did not stabilize: " + current);
  }

  /** Optimizes an optional child; returns empty when the slot is absent. */
  public Optional<Expression> refineOptional(Optional<Expression> child) {
    return child.map(this::refine);
  }

  /** Optimizes a statement, returning the statements that replace it (possibly none). */
  public List<Statement> refineStatement(Statement statement) {
    Statement current = statement;
    for (int i = 0; i < MAX_REWRITES_PER_NODE; ++i) {
      var outcome = current.computeStatement(this);
      if (outcome.isUnchanged()) {
        return List.of(current);
      }
      onChange(outcome, current.sourceRef());
      if (outcome.replacement() instanceof Replacement.Sequence sequence) {
        return sequence.statements();
      } else if (outcome.replacement() instanceof Replacement.Single single
          && single.node() instanceof Statement replacement) {
        current = replacement;
      } else {
        throw new IllegalStateException(
            "Rewrite of statement `%s` must produce statements but got %s"
                .formatted(current, outcome.replacement()));
      }
    }
    throw new IllegalStateException("Rewrites of statement did not stabilize: " + current);
  }

  private void onChange(RewriteOutcome outcome, SourceRef sourceRef) {
    changes.add(new Change(outcome.changeKind(), sourceRef, outcome.detail()));
    if (Optimizer.debug) {
      Optimizer.logger.log("%s [%s] %s", sourceRef, outcome.changeKind(), outcome.detail());
    }
  }

  public boolean isKnownUnbound(String name) {
    return unboundVariables.contains(name);
  }

  public List<Change> changes() {
    return Collections.unmodifiableList(changes);
  }
}
