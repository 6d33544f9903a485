// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

/** Thrown when a node is constructed with children that violate its fixed structure. */
public class MalformedTreeException extends RuntimeException {
  public MalformedTreeException(String message) {
    super(message);
  }

  static <T> T requireChild(T child, String kind, String slot) {
    if (child == null) {
      throw new MalformedTreeException(
          "Required child '%s' of %s node is absent".formatted(slot, kind));
    }
    return child;
  }
}
