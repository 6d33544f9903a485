// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static java.util.stream.Collectors.joining;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Properties;

/** Build metadata plus the subjects and builtins this build of the optimizer folds. */
public record VersionInfo(
    String slicefoldVersion,
    String buildTimestamp,
    String javaRuntime,
    List<Shape> foldedShapes,
    List<String> foldedBuiltins) {

  private static final String UNKNOWN = "?";

  public static VersionInfo load() throws IOException {
    var properties = new Properties();
    try (InputStream input =
        VersionInfo.class.getClassLoader().getResourceAsStream("build.properties")) {
      if (input != null) {
        properties.load(input);
      }
    }
    return fromProperties(properties);
  }

  static VersionInfo fromProperties(Properties properties) {
    return new VersionInfo(
        properties.getProperty("slicefold.version", UNKNOWN),
        properties.getProperty("build.timestamp", UNKNOWN),
        "%s Java %s"
            .formatted(
                properties.getProperty("java.vendor", UNKNOWN),
                properties.getProperty("java.version", UNKNOWN)),
        SliceHandlers.foldedShapes(),
        List.of(BuiltinSpec.SLICE.name()));
  }

  @Override
  public String toString() {
    return """
        Slicefold %s (%s) [%s]
        Folds slices of: %s
        Folds calls to: %s"""
        .formatted(
            slicefoldVersion,
            buildTimestamp,
            javaRuntime,
            foldedShapes.stream().map(Shape::pythonName).collect(joining(", ")),
            String.join(", ", foldedBuiltins));
  }
}
