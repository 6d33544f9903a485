// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import java.util.List;
import org.slicefold.optimizer.Tree.Node;
import org.slicefold.optimizer.Tree.Statement;

/**
 * Result of one rewrite step: the replacement, the kind of change and a diagnostic for humans.
 *
 * <p>The detail string is informational only; nothing parses it.
 */
public record RewriteOutcome(Replacement replacement, ChangeKind changeKind, String detail) {

  public enum ChangeKind {
    NO_CHANGE,
    NEW_RAISE,
    CONSTANT_FOLD,
    NEW_EXPRESSION,
    NEW_STATEMENTS,
    REMOVED_STATEMENT,
    CHILDREN_REFINED
  }

  public sealed interface Replacement {
    record Unchanged() implements Replacement {}

    record Single(Node node) implements Replacement {}

    /** Statements executed in place of the rewritten statement; empty removes it. */
    record Sequence(List<Statement> statements) implements Replacement {
      public Sequence {
        statements = List.copyOf(statements);
      }
    }
  }

  private static final RewriteOutcome UNCHANGED =
      new RewriteOutcome(new Replacement.Unchanged(), ChangeKind.NO_CHANGE, "");

  public RewriteOutcome {
    if ((replacement instanceof Replacement.Unchanged) != (changeKind == ChangeKind.NO_CHANGE)) {
      throw new IllegalArgumentException(
          "Change kind %s inconsistent with replacement %s".formatted(changeKind, replacement));
    }
  }

  public static RewriteOutcome unchanged() {
    return UNCHANGED;
  }

  public static RewriteOutcome replacedBy(Node node, ChangeKind changeKind, String detail) {
    return new RewriteOutcome(new Replacement.Single(node), changeKind, detail);
  }

  public static RewriteOutcome replacedBy(
      List<Statement> statements, ChangeKind changeKind, String detail) {
    return new RewriteOutcome(new Replacement.Sequence(statements), changeKind, detail);
  }

  public boolean isUnchanged() {
    return replacement instanceof Replacement.Unchanged;
  }

  @Override
  public String toString() {
    if (isUnchanged()) {
      return "unchanged";
    }
    return "%s: %s".formatted(changeKind, detail);
  }
}
