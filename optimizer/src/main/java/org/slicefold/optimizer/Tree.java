// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static java.util.stream.Collectors.joining;
import static org.slicefold.optimizer.ExceptionCategory.BASE_EXCEPTION;
import static org.slicefold.optimizer.MalformedTreeException.requireChild;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slicefold.optimizer.ConstantValues.PyList;
import org.slicefold.optimizer.ConstantValues.PyTuple;
import org.slicefold.optimizer.ConstantValues.SliceValue;
import org.slicefold.optimizer.RewriteOutcome.ChangeKind;

/** Node substrate of the tree and the general purpose node kinds that slice nodes build on. */
public class Tree {
  private Tree() {}

  public record SourceRef(String filename, int lineno) {
    public static final SourceRef UNKNOWN = new SourceRef("<unknown>", -1);

    @Override
    public String toString() {
      return "%s:%d".formatted(filename, lineno);
    }
  }

  public enum NodeKind {
    SLICE_ASSIGNMENT,
    SLICE_DELETION,
    SLICE_LOOKUP,
    BUILTIN_SLICE2,
    BUILTIN_SLICE3,
    CONSTANT,
    VARIABLE,
    CALL,
    RAISE_EXPRESSION,
    SIDE_EFFECTS,
    EXPRESSION_STATEMENT,
    RAISE_STATEMENT,
    STATEMENT_SEQUENCE
  }

  /** Named child position of a node; {@code node} is empty for an absent optional child. */
  public record ChildSlot(String name, Optional<Node> node) {}

  public interface Node {
    NodeKind kind();

    SourceRef sourceRef();

    /** Child slots in evaluation order. The set of slots never changes after construction. */
    List<ChildSlot> children();

    JsonElement astNode();

    /** Returns true if executing this node certainly raises an exception of the category. */
    default boolean willRaise(ExceptionCategory category) {
      return false;
    }

    default boolean mayRaise(ExceptionCategory category) {
      return true;
    }
  }

  public interface Statement extends Node {
    RewriteOutcome computeStatement(TraceCollection trace);
  }

  public interface Expression extends Node {
    RewriteOutcome computeExpression(TraceCollection trace);

    default boolean mayHaveSideEffects() {
      return mayRaise(BASE_EXCEPTION);
    }

    default Shape typeShape() {
      return Shape.UNKNOWN;
    }

    /** Whether the value is known to be iterable producing exactly {@code count} elements. */
    default Optional<Boolean> isKnownToBeIterable(int count) {
      return typeShape().iterable().filter(iterable -> !iterable);
    }
  }

  static ChildSlot slot(String name, Node node) {
    return new ChildSlot(name, Optional.of(node));
  }

  static ChildSlot slot(String name, Optional<? extends Node> node) {
    return new ChildSlot(name, node.map(Node.class::cast));
  }

  static List<ChildSlot> slots(String name, List<? extends Node> nodes) {
    return IntStream.range(0, nodes.size())
        .mapToObj(i -> slot("%s[%d]".formatted(name, i), nodes.get(i)))
        .toList();
  }

  /** Converts a literal None slice bound to an absent one. */
  static Optional<Expression> normalizeBound(Optional<Expression> bound, String kind, String slot) {
    return requireChild(bound, kind, slot)
        .filter(b -> !(b instanceof ConstantRef constant && constant.value() == null));
  }

  /**
   * Returns true if evaluating the nodes in order certainly raises an exception of the category.
   * Nodes evaluated before the raising one must not raise anything outside the category.
   */
  static boolean willRaiseInOrder(List<? extends Node> nodes, ExceptionCategory category) {
    for (var node : nodes) {
      if (node.willRaise(category)) {
        return true;
      }
      if (category != BASE_EXCEPTION && node.mayRaise(BASE_EXCEPTION)) {
        return false;
      }
    }
    return false;
  }

  static boolean mayRaiseAny(List<? extends Node> nodes, ExceptionCategory category) {
    return nodes.stream().anyMatch(node -> node.mayRaise(category));
  }

  /** Statements that evaluate each expression for its effect only, in order. */
  static List<Statement> statementsForEffect(List<Expression> expressions) {
    return expressions.stream()
        .<Statement>map(e -> new ExpressionStatement(e, e.sourceRef()))
        .toList();
  }

  /** Wraps {@code expression} so that {@code sideEffects} are evaluated first. */
  static Expression withSideEffects(
      List<Expression> sideEffects, Expression expression, SourceRef sourceRef) {
    if (sideEffects.isEmpty()) {
      return expression;
    }
    return new SideEffectsExpression(sideEffects, expression, sourceRef);
  }

  /** Returns {@code outcome} unless unchanged, in which case reports any refined children. */
  static RewriteOutcome unchangedOrRefined(RewriteOutcome outcome, Node original, Node refined) {
    if (!outcome.isUnchanged() || refined == original) {
      return outcome;
    }
    return RewriteOutcome.replacedBy(
        refined, ChangeKind.CHILDREN_REFINED, "Refined children of %s.".formatted(original.kind()));
  }

  static JsonObject astObject(String type, SourceRef sourceRef) {
    var object = new JsonObject();
    object.addProperty("type", type);
    if (sourceRef.lineno() >= 0) {
      object.addProperty("lineno", sourceRef.lineno());
    }
    return object;
  }

  static JsonElement astOptional(Optional<? extends Node> node) {
    return node.<JsonElement>map(Node::astNode).orElse(JsonNull.INSTANCE);
  }

  static JsonArray astArray(List<? extends Node> nodes) {
    var array = new JsonArray();
    nodes.forEach(node -> array.add(node.astNode()));
    return array;
  }

  static JsonObject astName(String id, SourceRef sourceRef) {
    var name = astObject("Name", sourceRef);
    name.addProperty("id", id);
    return name;
  }

  static JsonObject astCall(String function, JsonArray args, SourceRef sourceRef) {
    var call = astObject("Call", sourceRef);
    call.add("func", astName(function, sourceRef));
    call.add("args", args);
    call.add("keywords", new JsonArray());
    return call;
  }

  static JsonObject astSubscript(
      Expression subject,
      Optional<Expression> lower,
      Optional<Expression> upper,
      String context,
      SourceRef sourceRef) {
    var slice = astObject("Slice", sourceRef);
    slice.add("lower", astOptional(lower));
    slice.add("upper", astOptional(upper));
    slice.add("step", JsonNull.INSTANCE);
    var subscript = astObject("Subscript", sourceRef);
    subscript.add("value", subject.astNode());
    subscript.add("slice", slice);
    subscript.add("ctx", astObject(context, SourceRef.UNKNOWN));
    return subscript;
  }

  static String sliceString(
      Expression subject, Optional<Expression> lower, Optional<Expression> upper) {
    return "%s[%s:%s]"
        .formatted(
            subject,
            lower.map(Object::toString).orElse(""),
            upper.map(Object::toString).orElse(""));
  }

  public record ConstantRef(Object value, SourceRef sourceRef) implements Expression {
    public static ConstantRef none(SourceRef sourceRef) {
      return new ConstantRef(null, sourceRef);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CONSTANT;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of();
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      return RewriteOutcome.unchanged();
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return false;
    }

    @Override
    public Shape typeShape() {
      return Shape.of(value);
    }

    @Override
    public Optional<Boolean> isKnownToBeIterable(int count) {
      var elements = ConstantValues.iterate(value);
      if (elements.isPresent()) {
        return Optional.of(elements.get().size() == count);
      }
      return Optional.of(false);
    }

    @Override
    public JsonElement astNode() {
      if (value instanceof PyList list) {
        var node = astObject("List", sourceRef);
        node.add("elts", astArray(constants(list.elements())));
        return node;
      } else if (value instanceof PyTuple tuple) {
        var node = astObject("Tuple", sourceRef);
        node.add("elts", astArray(constants(tuple.elements())));
        return node;
      } else if (value instanceof SliceValue slice) {
        var args = Stream.of(slice.start(), slice.stop(), slice.step());
        return astCall("slice", astArray(constants(args)), sourceRef);
      }
      var node = astObject("Constant", sourceRef);
      node.addProperty("typename", ConstantValues.typeName(value));
      if (value == null) {
        node.add("value", JsonNull.INSTANCE);
      } else if (value instanceof Boolean bool) {
        node.add("value", new JsonPrimitive(bool));
      } else if (value instanceof Number number) {
        node.add("value", new JsonPrimitive(number));
      } else {
        node.add("value", new JsonPrimitive(value.toString()));
      }
      return node;
    }

    private List<ConstantRef> constants(List<Object> values) {
      return constants(values.stream());
    }

    private List<ConstantRef> constants(Stream<Object> values) {
      return values.map(v -> new ConstantRef(v, sourceRef)).toList();
    }

    @Override
    public String toString() {
      return ConstantValues.repr(value);
    }
  }

  public record VariableRef(String name, SourceRef sourceRef) implements Expression {
    public VariableRef {
      requireChild(name, "VARIABLE", "name");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.VARIABLE;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of();
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      if (trace.isKnownUnbound(name)) {
        return RewriteOutcome.replacedBy(
            new RaiseExpression(
                ExceptionCategory.NAME_ERROR,
                "name '%s' is not defined".formatted(name),
                sourceRef),
            ChangeKind.NEW_RAISE,
            "Variable '%s' is known to be unbound, replaced with NameError.".formatted(name));
      }
      return RewriteOutcome.unchanged();
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return ExceptionCategory.NAME_ERROR.isSubcategoryOf(category);
    }

    @Override
    public JsonElement astNode() {
      return astName(name, sourceRef);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** Call of an arbitrary callable whose outcome is unknown at compile time. */
  public record CallExpression(Expression callee, List<Expression> args, SourceRef sourceRef)
      implements Expression {
    public CallExpression {
      requireChild(callee, "CALL", "callee");
      args = List.copyOf(requireChild(args, "CALL", "args"));
    }

    @Override
    public NodeKind kind() {
      return NodeKind.CALL;
    }

    @Override
    public List<ChildSlot> children() {
      var children = new ArrayList<ChildSlot>();
      children.add(slot("callee", callee));
      children.addAll(slots("args", args));
      return children;
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      var order = new EvaluationOrder(trace);
      var callee = order.refine("callee", callee());
      if (order.raised()) {
        return order.expressionRaise(
            sourceRef, "Called expression raises exception, removed call.");
      }
      var args = new ArrayList<Expression>();
      for (int i = 0; i < this.args.size(); ++i) {
        args.add(order.refine("args[%d]".formatted(i), this.args.get(i)));
        if (order.raised()) {
          return order.expressionRaise(
              sourceRef, "Call argument %d raises exception, removed call.".formatted(i));
        }
      }
      if (order.changed()) {
        return Tree.unchangedOrRefined(
            RewriteOutcome.unchanged(), this, new CallExpression(callee, args, sourceRef));
      }
      return RewriteOutcome.unchanged();
    }

    @Override
    public JsonElement astNode() {
      var call = astObject("Call", sourceRef);
      call.add("func", callee.astNode());
      call.add("args", astArray(args));
      call.add("keywords", new JsonArray());
      return call;
    }

    @Override
    public String toString() {
      return "%s(%s)".formatted(callee, args.stream().map(Object::toString).collect(joining(", ")));
    }
  }

  /** Expression that always raises; produced when an operation is proven to fail. */
  public record RaiseExpression(ExceptionCategory category, String message, SourceRef sourceRef)
      implements Expression {
    public RaiseExpression {
      requireChild(category, "RAISE_EXPRESSION", "category");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.RAISE_EXPRESSION;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of();
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      return RewriteOutcome.unchanged();
    }

    @Override
    public boolean willRaise(ExceptionCategory category) {
      return this.category.isSubcategoryOf(category);
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return willRaise(category);
    }

    @Override
    public JsonElement astNode() {
      var node = astObject("RaiseException", sourceRef);
      node.addProperty("exc_type", category.pythonName());
      node.addProperty("message", message);
      return node;
    }

    @Override
    public String toString() {
      return "raise_expr(%s(%s))".formatted(category.pythonName(), ConstantValues.repr(message));
    }
  }

  /** Evaluates {@code sideEffects} in order for their effect, then yields {@code expression}. */
  public record SideEffectsExpression(
      List<Expression> sideEffects, Expression expression, SourceRef sourceRef)
      implements Expression {
    public SideEffectsExpression {
      sideEffects = List.copyOf(requireChild(sideEffects, "SIDE_EFFECTS", "side_effects"));
      if (sideEffects.isEmpty()) {
        throw new MalformedTreeException("SIDE_EFFECTS node requires at least one side effect");
      }
      requireChild(expression, "SIDE_EFFECTS", "expression");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.SIDE_EFFECTS;
    }

    @Override
    public List<ChildSlot> children() {
      var children = new ArrayList<>(slots("side_effects", sideEffects));
      children.add(slot("expression", expression));
      return children;
    }

    @Override
    public RewriteOutcome computeExpression(TraceCollection trace) {
      var order = new EvaluationOrder(trace);
      var kept = new ArrayList<Expression>();
      for (int i = 0; i < sideEffects.size(); ++i) {
        var sideEffect = order.refine("side_effects[%d]".formatted(i), sideEffects.get(i));
        if (order.raised()) {
          return order.expressionRaise(
              sourceRef, "Side effect raises exception, removed following evaluations.");
        }
        if (sideEffect.mayHaveSideEffects()) {
          kept.add(sideEffect);
        }
      }
      var expression = order.refine("expression", expression());
      if (kept.isEmpty()) {
        return RewriteOutcome.replacedBy(
            expression, ChangeKind.NEW_EXPRESSION, "Side effects were removed as unneeded.");
      }
      if (kept.size() < sideEffects.size()) {
        return RewriteOutcome.replacedBy(
            new SideEffectsExpression(kept, expression, sourceRef),
            ChangeKind.NEW_EXPRESSION,
            "Removed side effects free evaluations.");
      }
      if (order.changed()) {
        return Tree.unchangedOrRefined(
            RewriteOutcome.unchanged(),
            this,
            new SideEffectsExpression(kept, expression, sourceRef));
      }
      return RewriteOutcome.unchanged();
    }

    List<Expression> evaluationOrder() {
      var all = new ArrayList<>(sideEffects);
      all.add(expression);
      return all;
    }

    @Override
    public boolean willRaise(ExceptionCategory category) {
      return willRaiseInOrder(evaluationOrder(), category);
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return mayRaiseAny(evaluationOrder(), category);
    }

    @Override
    public Shape typeShape() {
      return expression.typeShape();
    }

    @Override
    public JsonElement astNode() {
      var node = astObject("SideEffects", sourceRef);
      node.add("side_effects", astArray(sideEffects));
      node.add("expression", expression.astNode());
      return node;
    }

    @Override
    public String toString() {
      return evaluationOrder().stream()
          .map(Object::toString)
          .collect(joining(", ", "side_effects(", ")"));
    }
  }

  public record ExpressionStatement(Expression expression, SourceRef sourceRef)
      implements Statement {
    public ExpressionStatement {
      requireChild(expression, "EXPRESSION_STATEMENT", "expression");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.EXPRESSION_STATEMENT;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of(slot("expression", expression));
    }

    @Override
    public RewriteOutcome computeStatement(TraceCollection trace) {
      var expression = trace.refine(expression());
      if (expression instanceof SideEffectsExpression sideEffects) {
        return RewriteOutcome.replacedBy(
            statementsForEffect(sideEffects.evaluationOrder()),
            ChangeKind.NEW_STATEMENTS,
            "Expression statement of side effects expression split into statements.");
      }
      if (!expression.mayHaveSideEffects()) {
        return RewriteOutcome.replacedBy(
            List.of(),
            ChangeKind.REMOVED_STATEMENT,
            "Removed expression statement %s without effect.".formatted(expression));
      }
      return Tree.unchangedOrRefined(
          RewriteOutcome.unchanged(),
          this,
          expression == expression() ? this : new ExpressionStatement(expression, sourceRef));
    }

    @Override
    public boolean willRaise(ExceptionCategory category) {
      return expression.willRaise(category);
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return expression.mayRaise(category);
    }

    @Override
    public JsonElement astNode() {
      var node = astObject("Expr", sourceRef);
      node.add("value", expression.astNode());
      return node;
    }

    @Override
    public String toString() {
      return expression.toString();
    }
  }

  public record RaiseStatement(ExceptionCategory category, String message, SourceRef sourceRef)
      implements Statement {
    public RaiseStatement {
      requireChild(category, "RAISE_STATEMENT", "category");
    }

    @Override
    public NodeKind kind() {
      return NodeKind.RAISE_STATEMENT;
    }

    @Override
    public List<ChildSlot> children() {
      return List.of();
    }

    @Override
    public RewriteOutcome computeStatement(TraceCollection trace) {
      return RewriteOutcome.unchanged();
    }

    @Override
    public boolean willRaise(ExceptionCategory category) {
      return this.category.isSubcategoryOf(category);
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return willRaise(category);
    }

    @Override
    public JsonElement astNode() {
      var args = new JsonArray();
      if (message != null) {
        args.add(new ConstantRef(message, sourceRef).astNode());
      }
      var node = astObject("Raise", sourceRef);
      node.add("exc", astCall(category.pythonName(), args, sourceRef));
      node.add("cause", JsonNull.INSTANCE);
      return node;
    }

    @Override
    public String toString() {
      return message == null
          ? "raise %s".formatted(category.pythonName())
          : "raise %s(%s)".formatted(category.pythonName(), ConstantValues.repr(message));
    }
  }

  public record StatementSequence(List<Statement> statements, SourceRef sourceRef)
      implements Statement {
    public StatementSequence {
      statements = List.copyOf(requireChild(statements, "STATEMENT_SEQUENCE", "statements"));
    }

    @Override
    public NodeKind kind() {
      return NodeKind.STATEMENT_SEQUENCE;
    }

    @Override
    public List<ChildSlot> children() {
      return slots("statements", statements);
    }

    @Override
    public RewriteOutcome computeStatement(TraceCollection trace) {
      var result = new ArrayList<Statement>();
      boolean changed = false;
      for (int i = 0; i < statements.size(); ++i) {
        var statement = statements.get(i);
        var refined = trace.refineStatement(statement);
        if (refined.size() != 1 || refined.get(0) != statement) {
          changed = true;
        }
        for (var s : refined) {
          if (s instanceof StatementSequence nested) {
            result.addAll(nested.statements());
            changed = true;
          } else {
            result.add(s);
          }
        }
        int unreachable = statements.size() - i - 1;
        if (unreachable > 0 && willRaiseInOrder(refined, BASE_EXCEPTION)) {
          return RewriteOutcome.replacedBy(
              new StatementSequence(result, sourceRef),
              ChangeKind.REMOVED_STATEMENT,
              "Removed %d unreachable statement(s) after raise.".formatted(unreachable));
        }
      }
      if (changed) {
        return RewriteOutcome.replacedBy(
            new StatementSequence(result, sourceRef),
            ChangeKind.CHILDREN_REFINED,
            "Refined statements of sequence.");
      }
      return RewriteOutcome.unchanged();
    }

    @Override
    public boolean willRaise(ExceptionCategory category) {
      return willRaiseInOrder(statements, category);
    }

    @Override
    public boolean mayRaise(ExceptionCategory category) {
      return mayRaiseAny(statements, category);
    }

    @Override
    public JsonElement astNode() {
      var node = astObject("Module", sourceRef);
      node.add("body", astArray(statements));
      return node;
    }

    @Override
    public String toString() {
      return statements.stream().map(Object::toString).collect(joining("\n"));
    }
  }
}
