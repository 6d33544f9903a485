// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static org.slicefold.optimizer.ExceptionCategory.BASE_EXCEPTION;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slicefold.optimizer.ConstantValues.SliceValue;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;
import org.slicefold.optimizer.Tree.ConstantRef;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.RaiseExpression;
import org.slicefold.optimizer.Tree.SourceRef;

/**
 * Declared parameters of a builtin and the evaluator used to predict calls with literal
 * arguments.
 *
 * <p>Evaluators must be total over literal arguments accepted by the declared arity.
 */
public record BuiltinSpec(
    String name,
    List<String> argNames,
    int requiredCount,
    Function<List<Object>, Object> evaluator) {

  public static final BuiltinSpec SLICE =
      new BuiltinSpec("slice", List.of("start", "stop", "step"), 1, BuiltinSpec::evaluateSlice);

  private static Object evaluateSlice(List<Object> args) {
    switch (args.size()) {
      case 1:
        return new SliceValue(null, args.get(0), null);
      case 2:
        return new SliceValue(args.get(0), args.get(1), null);
      default:
        return new SliceValue(args.get(0), args.get(1), args.get(2));
    }
  }

  public boolean acceptsArgCount(int count) {
    return count >= requiredCount && count <= argNames.size();
  }

  /**
   * Returns what a call with {@code args} amounts to when their count doesn't match the declared
   * parameters: the arguments evaluated for effect, then a {@code TypeError}.
   */
  public Optional<Expression> argCountError(List<Expression> args, SourceRef sourceRef) {
    if (acceptsArgCount(args.size())) {
      return Optional.empty();
    }
    var message =
        args.size() < requiredCount
            ? "%s expected at least %d arguments, got %d"
                .formatted(name, requiredCount, args.size())
            : "%s expected at most %d arguments, got %d"
                .formatted(name, argNames.size(), args.size());
    return Optional.of(
        Tree.withSideEffects(
            args,
            new RaiseExpression(ExceptionCategory.TYPE_ERROR, message, sourceRef),
            sourceRef));
  }

  /**
   * Refines the given arguments of a call to this builtin and predicts the call where possible.
   *
   * @param node the call being rewritten
   * @param givenArgs arguments in evaluation order
   * @param rebuild creates the call again from refined arguments
   */
  public RewriteOutcome computeBuiltinSpec(
      Expression node,
      List<Expression> givenArgs,
      TraceCollection trace,
      Function<List<Expression>, Expression> rebuild) {
    var args = new ArrayList<Expression>();
    boolean changed = false;
    for (var given : givenArgs) {
      var refined = trace.refine(given);
      changed |= refined != given;
      args.add(refined);
    }

    var argCountError = argCountError(args, node.sourceRef());
    if (argCountError.isPresent()) {
      return RewriteOutcome.replacedBy(
          argCountError.get(),
          ChangeKind.NEW_RAISE,
          "Call to builtin '%s' with wrong argument count raises TypeError.".formatted(name));
    }

    for (int i = 0; i < args.size(); ++i) {
      if (args.get(i).willRaise(BASE_EXCEPTION)) {
        return RewriteOutcome.replacedBy(
            Tree.withSideEffects(
                List.copyOf(args.subList(0, i)), args.get(i), node.sourceRef()),
            ChangeKind.NEW_RAISE,
            "Call to builtin '%s' raises exception in argument '%s', removed call."
                .formatted(name, argNames.get(i)));
      }
    }

    if (args.stream().allMatch(arg -> arg instanceof ConstantRef)) {
      var values = new ArrayList<Object>();
      for (var arg : args) {
        values.add(((ConstantRef) arg).value());
      }
      var result = evaluator.apply(values);
      return RewriteOutcome.replacedBy(
          new ConstantRef(result, node.sourceRef()),
          ChangeKind.CONSTANT_FOLD,
          "Call to builtin '%s' with constant arguments predicted to %s."
              .formatted(name, ConstantValues.repr(result)));
    }

    if (changed) {
      return RewriteOutcome.replacedBy(
          rebuild.apply(args),
          ChangeKind.CHILDREN_REFINED,
          "Refined arguments of builtin '%s' call.".formatted(name));
    }
    return RewriteOutcome.unchanged();
  }
}
