// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

public class TreeLoadException extends RuntimeException {
  public final String filename;
  public final int lineno;

  public TreeLoadException(String message, String filename, int lineno, Throwable cause) {
    super("%s (%s, line %d)".formatted(message, filename, lineno), cause);
    this.filename = filename;
    this.lineno = lineno;
  }
}
