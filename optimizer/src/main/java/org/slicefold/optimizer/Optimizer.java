// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slicefold.optimizer.Tree.Statement;
import org.slicefold.optimizer.Tree.StatementSequence;

/**
 * Fixed point driver: optimizes a module until a full pass over it records no change.
 *
 * <p>Each pass uses a fresh {@link TraceCollection}. Passes run one at a time on the calling
 * thread.
 */
public class Optimizer {
  public static final int DEFAULT_MAX_PASSES = 50;

  public interface DebugLogger {
    /** Formats `message` containing printf-style "%s", "%d", etc with values from `args`. */
    void log(String message, Object... args);
  }

  static DebugLogger logger = (message, args) -> {};

  static boolean debug = false;

  // To enable debug logging to stderr:
  // Optimizer.setDebugLogger((str, args) -> System.err.printf(str + "%n", args));
  public static void setDebugLogger(DebugLogger newLogger) {
    logger = newLogger;
  }

  /** Enables logging of every individual rewrite in addition to per-pass summaries. */
  public static void setVerboseDebugging(boolean enable) {
    debug = enable;
  }

  public record Result(
      StatementSequence module, int passes, List<TraceCollection.Change> changes) {}

  private final int maxPasses;
  private final Set<String> unboundVariables;

  public Optimizer() {
    this(DEFAULT_MAX_PASSES, Set.of());
  }

  /**
   * @param maxPasses passes allowed before giving up on reaching a fixed point
   * @param unboundVariables names known to be unbound whenever they are read
   */
  public Optimizer(int maxPasses, Set<String> unboundVariables) {
    if (maxPasses < 1) {
      throw new IllegalArgumentException("maxPasses must be positive but got " + maxPasses);
    }
    this.maxPasses = maxPasses;
    this.unboundVariables = Set.copyOf(unboundVariables);
  }

  public Result optimize(StatementSequence module) {
    var changes = new ArrayList<TraceCollection.Change>();
    var current = module;
    for (int pass = 1; pass <= maxPasses; ++pass) {
      var trace = new TraceCollection(unboundVariables);
      var statements = trace.refineStatement(current);
      changes.addAll(trace.changes());
      logger.log(
          "Pass %d over %s: %d change(s)",
          pass, module.sourceRef().filename(), trace.changes().size());
      if (trace.changes().isEmpty()) {
        return new Result(current, pass, changes);
      }
      current = asModule(statements, current);
    }
    throw new IllegalStateException(
        "Optimization of %s did not reach a fixed point after %d passes"
            .formatted(module.sourceRef().filename(), maxPasses));
  }

  private static StatementSequence asModule(List<Statement> statements, StatementSequence current) {
    if (statements.size() == 1 && statements.get(0) instanceof StatementSequence sequence) {
      return sequence;
    }
    return new StatementSequence(statements, current.sourceRef());
  }
}
