// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import java.util.Arrays;
import java.util.Optional;

/** Category of exception that compiled code may raise at run time. */
public enum ExceptionCategory {
  BASE_EXCEPTION("BaseException", null),
  EXCEPTION("Exception", BASE_EXCEPTION),
  ARITHMETIC_ERROR("ArithmeticError", EXCEPTION),
  ZERO_DIVISION_ERROR("ZeroDivisionError", ARITHMETIC_ERROR),
  LOOKUP_ERROR("LookupError", EXCEPTION),
  INDEX_ERROR("IndexError", LOOKUP_ERROR),
  KEY_ERROR("KeyError", LOOKUP_ERROR),
  NAME_ERROR("NameError", EXCEPTION),
  TYPE_ERROR("TypeError", EXCEPTION),
  VALUE_ERROR("ValueError", EXCEPTION),
  RUNTIME_ERROR("RuntimeError", EXCEPTION);

  private final String pythonName;
  private final ExceptionCategory parent;

  ExceptionCategory(String pythonName, ExceptionCategory parent) {
    this.pythonName = pythonName;
    this.parent = parent;
  }

  public String pythonName() {
    return pythonName;
  }

  /** Returns true if an exception of this category is caught by a handler for {@code other}. */
  public boolean isSubcategoryOf(ExceptionCategory other) {
    for (var category = this; category != null; category = category.parent) {
      if (category == other) {
        return true;
      }
    }
    return false;
  }

  public static Optional<ExceptionCategory> forPythonName(String name) {
    return Arrays.stream(values()).filter(c -> c.pythonName.equals(name)).findFirst();
  }
}
