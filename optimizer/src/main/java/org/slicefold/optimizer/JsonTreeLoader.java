// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.StreamSupport;
import org.slicefold.optimizer.ConstantValues.PyList;
import org.slicefold.optimizer.ConstantValues.PyTuple;
import org.slicefold.optimizer.SliceNodes.SliceAssignment;
import org.slicefold.optimizer.SliceNodes.SliceDeletion;
import org.slicefold.optimizer.SliceNodes.SliceLookup;
import org.slicefold.optimizer.Tree.CallExpression;
import org.slicefold.optimizer.Tree.ConstantRef;
import org.slicefold.optimizer.Tree.Expression;
import org.slicefold.optimizer.Tree.ExpressionStatement;
import org.slicefold.optimizer.Tree.RaiseExpression;
import org.slicefold.optimizer.Tree.RaiseStatement;
import org.slicefold.optimizer.Tree.SideEffectsExpression;
import org.slicefold.optimizer.Tree.SourceRef;
import org.slicefold.optimizer.Tree.Statement;
import org.slicefold.optimizer.Tree.StatementSequence;
import org.slicefold.optimizer.Tree.VariableRef;

/** Builds the node tree from a JSON AST in the shape of Python's {@code ast} module. */
public record JsonTreeLoader(String filename) {

  public StatementSequence loadModule(JsonElement element) {
    if (!"Module".equals(getType(element))) {
      throw new TreeLoadException(
          "Expected Module but got " + getType(element), filename, getLineno(element), null);
    }
    return new StatementSequence(parseStatementBlock(getBody(element)), sourceRef(element));
  }

  public List<Statement> parseStatementBlock(JsonArray block) {
    return StreamSupport.stream(block.spliterator(), false).map(this::parseStatement).toList();
  }

  public Statement parseStatement(JsonElement element) {
    try {
      String type = getType(element);
      switch (type) {
        case "Expr":
          return new ExpressionStatement(
              parseExpression(getAttr(element, "value")), sourceRef(element));

        case "Assign":
          {
            var targets = getAttr(element, "targets").getAsJsonArray();
            if (targets.size() != 1) {
              throw new IllegalArgumentException(
                  "Expected exactly one assignment target but got " + targets.size());
            }
            var target = targets.get(0);
            var slice = getSlice(target, "assignment");
            return new SliceAssignment(
                parseExpression(getAttr(element, "value")),
                parseExpression(getAttr(target, "value")),
                parseOptional(getAttr(slice, "lower")),
                parseOptional(getAttr(slice, "upper")),
                sourceRef(element));
          }

        case "Delete":
          {
            var deletions = new ArrayList<Statement>();
            for (var target : getAttr(element, "targets").getAsJsonArray()) {
              var slice = getSlice(target, "deletion");
              deletions.add(
                  new SliceDeletion(
                      parseExpression(getAttr(target, "value")),
                      parseOptional(getAttr(slice, "lower")),
                      parseOptional(getAttr(slice, "upper")),
                      sourceRef(element)));
            }
            return deletions.size() == 1
                ? deletions.get(0)
                : new StatementSequence(deletions, sourceRef(element));
          }

        case "Raise":
          {
            var exception = parseRaisedException(getAttr(element, "exc"));
            return new RaiseStatement(
                exception.category(), exception.message(), sourceRef(element));
          }

        case "Module":
          return loadModule(element);
      }
    } catch (TreeLoadException e) {
      throw e;
    } catch (Exception e) {
      throw new TreeLoadException(
          "Unsupported statement: " + e.getMessage(), filename, getLineno(element), e);
    }
    throw new TreeLoadException(
        "Unknown statement type: " + getType(element), filename, getLineno(element), null);
  }

  public Expression parseExpression(JsonElement element) {
    String type = getType(element);
    switch (type) {
      case "Name":
        return new VariableRef(getAttr(element, "id").getAsString(), sourceRef(element));

      case "Constant":
        return new ConstantRef(parseConstant(element), sourceRef(element));

      case "List":
        return new ConstantRef(new PyList(parseLiteralElements(element)), sourceRef(element));

      case "Tuple":
        return new ConstantRef(new PyTuple(parseLiteralElements(element)), sourceRef(element));

      case "Call":
        {
          var func = getAttr(element, "func");
          var args =
              StreamSupport.stream(getAttr(element, "args").getAsJsonArray().spliterator(), false)
                  .map(this::parseExpression)
                  .toList();
          if ("Name".equals(getType(func)) && "slice".equals(getAttr(func, "id").getAsString())) {
            return parseBuiltinSlice(args, sourceRef(element));
          }
          return new CallExpression(parseExpression(func), args, sourceRef(element));
        }

      case "Subscript":
        {
          var slice = getSlice(element, "lookup");
          return new SliceLookup(
              parseExpression(getAttr(element, "value")),
              parseOptional(getAttr(slice, "lower")),
              parseOptional(getAttr(slice, "upper")),
              sourceRef(element));
        }

      case "RaiseException":
        return new RaiseExpression(
            parseCategory(getAttr(element, "exc_type").getAsString()),
            getAttrOrJavaNull(element, "message") == null
                ? null
                : getAttr(element, "message").getAsString(),
            sourceRef(element));

      case "SideEffects":
        return new SideEffectsExpression(
            StreamSupport.stream(
                    getAttr(element, "side_effects").getAsJsonArray().spliterator(), false)
                .map(this::parseExpression)
                .toList(),
            parseExpression(getAttr(element, "expression")),
            sourceRef(element));
    }
    throw new IllegalArgumentException("Unknown expression type: " + type);
  }

  private Expression parseBuiltinSlice(List<Expression> args, SourceRef sourceRef) {
    switch (args.size()) {
      case 1:
        return SliceNodes.makeBuiltinSlice(
            Optional.empty(), Optional.of(args.get(0)), Optional.empty(), sourceRef);
      case 2:
        return SliceNodes.makeBuiltinSlice(
            Optional.of(args.get(0)), Optional.of(args.get(1)), Optional.empty(), sourceRef);
      case 3:
        return SliceNodes.makeBuiltinSlice(
            Optional.of(args.get(0)),
            Optional.of(args.get(1)),
            Optional.of(args.get(2)),
            sourceRef);
      default:
        return BuiltinSpec.SLICE.argCountError(args, sourceRef).orElseThrow();
    }
  }

  private record RaisedException(ExceptionCategory category, String message) {}

  private RaisedException parseRaisedException(JsonElement exc) {
    if (exc == null || exc.isJsonNull()) {
      throw new IllegalArgumentException("Bare raise is not supported");
    }
    switch (getType(exc)) {
      case "Name":
        return new RaisedException(parseCategory(getAttr(exc, "id").getAsString()), null);

      case "Call":
        {
          var func = getAttr(exc, "func");
          if (!"Name".equals(getType(func))) {
            break;
          }
          var args = getAttr(exc, "args").getAsJsonArray();
          String message = null;
          if (args.size() == 1 && "Constant".equals(getType(args.get(0)))) {
            message = getAttr(args.get(0), "value").getAsString();
          } else if (args.size() != 0) {
            throw new IllegalArgumentException("Raised exception arguments must be one literal");
          }
          return new RaisedException(parseCategory(getAttr(func, "id").getAsString()), message);
        }
    }
    throw new IllegalArgumentException("Raised value must be a builtin exception: " + exc);
  }

  private static ExceptionCategory parseCategory(String name) {
    return ExceptionCategory.forPythonName(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown exception type: " + name));
  }

  private Optional<Expression> parseOptional(JsonElement element) {
    return element == null || element.isJsonNull()
        ? Optional.empty()
        : Optional.of(parseExpression(element));
  }

  private List<Object> parseLiteralElements(JsonElement element) {
    var elements = new ArrayList<Object>();
    for (var elt : getAttr(element, "elts").getAsJsonArray()) {
      var expression = parseExpression(elt);
      if (!(expression instanceof ConstantRef constant)) {
        throw new IllegalArgumentException(
            "Only literal elements are supported in %s but got %s"
                .formatted(getType(element), expression));
      }
      elements.add(constant.value());
    }
    return elements;
  }

  private static Object parseConstant(JsonElement element) {
    var typename = getAttr(element, "typename").getAsString();
    var value = getAttr(element, "value");
    switch (typename) {
      case "bool":
        return value.getAsBoolean();
      case "int":
        return fitIntegralValue(value.getAsNumber());
      case "float":
        return value.getAsNumber().doubleValue();
      case "str":
        return value.getAsString();
      case "NoneType":
        return null;
    }
    throw new IllegalArgumentException(
        String.format("Unsupported primitive type: %s (%s)", value, typename));
  }

  // Python ints are unbounded, so values beyond 64 bits stay BigInteger.
  static Number fitIntegralValue(Number value) {
    var big = value instanceof BigInteger b ? b : new BigInteger(value.toString());
    if (big.bitLength() < Integer.SIZE) {
      return big.intValue();
    } else if (big.bitLength() < Long.SIZE) {
      return big.longValue();
    } else {
      return big;
    }
  }

  private static JsonElement getSlice(JsonElement subscript, String context) {
    if (!"Subscript".equals(getType(subscript))) {
      throw new IllegalArgumentException(
          "Only slice targets are supported in %s but got %s"
              .formatted(context, getType(subscript)));
    }
    var slice = getAttr(subscript, "slice");
    if (!"Slice".equals(getType(slice))) {
      throw new IllegalArgumentException(
          "Only two-bound slices are supported in %s but got %s"
              .formatted(context, getType(slice)));
    }
    var step = getAttr(slice, "step");
    if (step != null && !step.isJsonNull()) {
      throw new IllegalArgumentException("Extended slices with a step are not supported");
    }
    return slice;
  }

  private SourceRef sourceRef(JsonElement element) {
    return new SourceRef(filename, getLineno(element));
  }

  private static int getLineno(JsonElement element) {
    if (element.isJsonObject()) {
      var obj = element.getAsJsonObject();
      final String LINENO = "lineno";
      if (obj.has(LINENO)) {
        return obj.get(LINENO).getAsNumber().intValue();
      }
    }
    return -1;
  }

  private static String getType(JsonElement element) {
    return element.getAsJsonObject().get("type").getAsString();
  }

  private static JsonElement getAttr(JsonElement element, String attr) {
    return element.getAsJsonObject().get(attr);
  }

  private static JsonElement getAttrOrJavaNull(JsonElement element, String attr) {
    var result = element.getAsJsonObject().get(attr);
    return result == null || result.isJsonNull() ? null : result;
  }

  private static JsonArray getBody(JsonElement element) {
    return element.getAsJsonObject().get("body").getAsJsonArray();
  }
}
