// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class VersionInfoTest {
  @Test
  public void loadsFilteredBuildProperties() throws Exception {
    var version = VersionInfo.load();
    assertEquals("0.1.0", version.slicefoldVersion());
    assertTrue(version.toString().startsWith("Slicefold 0.1.0 ("), version.toString());
  }

  @Test
  public void reportsFoldedSubjectsAndBuiltins() {
    var properties = new Properties();
    properties.setProperty("slicefold.version", "1.2.3");
    properties.setProperty("java.vendor", "Acme");
    properties.setProperty("java.version", "17.0.9");

    var version = VersionInfo.fromProperties(properties);

    assertEquals(List.of(Shape.STR, Shape.LIST, Shape.TUPLE), version.foldedShapes());
    assertEquals(
        """
        Slicefold 1.2.3 (?) [Acme Java 17.0.9]
        Folds slices of: str, list, tuple
        Folds calls to: slice""",
        version.toString());
  }
}
