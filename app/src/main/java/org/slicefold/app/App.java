// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.app;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slicefold.optimizer.JsonTreeLoader;
import org.slicefold.optimizer.Optimizer;
import org.slicefold.optimizer.TreeLoadException;
import org.slicefold.optimizer.VersionInfo;

public class App {
  public static void main(String[] args) throws Exception {
    if (System.getenv("SLICEFOLD_DEBUG") != null) {
      Optimizer.setDebugLogger((message, params) -> System.err.printf(message + "\n", params));
      Optimizer.setVerboseDebugging(true);
    }

    List<String> argsList = new ArrayList<>(Arrays.asList(args));
    if (argsList.contains("--version")) {
      System.out.println(VersionInfo.load());
      return;
    }

    String stdinString = readInput(System.in);

    try {
      run(argsList, stdinString, new PrintStream(System.out, true, StandardCharsets.UTF_8));
    } catch (TreeLoadException | JsonParseException | IllegalArgumentException e) {
      System.err.println("slicefold: " + e.getMessage());
      System.exit(1);
    }
  }

  /** Options parsed from the command line. */
  record Options(boolean dumpAst, boolean dumpTree, int maxPasses, Set<String> unbound) {
    static Options parse(List<String> args) {
      boolean dumpAst = false;
      boolean dumpTree = false;
      int maxPasses = Optimizer.DEFAULT_MAX_PASSES;
      Set<String> unbound = new HashSet<>();
      for (var arg : args) {
        if (arg.equals("dump-ast")) {
          dumpAst = true;
        } else if (arg.equals("dump-tree")) {
          dumpTree = true;
        } else if (arg.startsWith("--max-passes=")) {
          var value = arg.substring("--max-passes=".length());
          try {
            maxPasses = Integer.parseInt(value);
          } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for --max-passes: " + value, e);
          }
        } else if (arg.startsWith("--unbound=")) {
          Arrays.stream(arg.substring("--unbound=".length()).split(","))
              .map(String::strip)
              .filter(name -> !name.isEmpty())
              .forEach(unbound::add);
        } else {
          throw new IllegalArgumentException("Unrecognized argument: " + arg);
        }
      }
      return new Options(dumpAst, dumpTree, maxPasses, unbound);
    }
  }

  // JSON text is UTF-8 whatever the platform charset.
  static String readInput(InputStream input) {
    return new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))
        .lines()
        .collect(Collectors.joining("\n"));
  }

  static void run(List<String> args, String input, PrintStream out) {
    var options = Options.parse(args);
    JsonElement jsonAst = JsonParser.parseString(input);
    var module = new JsonTreeLoader("<stdin>").loadModule(jsonAst);

    if (!options.dumpTree()) {
      var result = new Optimizer(options.maxPasses(), options.unbound()).optimize(module);
      module = result.module();
    }

    if (options.dumpAst()) {
      Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();
      out.println(gson.toJson(module.astNode()));
    } else {
      out.println(module);
    }
  }
}
