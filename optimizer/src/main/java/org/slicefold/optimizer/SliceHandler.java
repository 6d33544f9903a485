// SPDX-FileCopyrightText: © 2025 Greg Christiana <maxuser@pyjinn.org>
// SPDX-License-Identifier: MIT

package org.slicefold.optimizer;

import org.slicefold.optimizer.SliceNodes.SliceAssignment;
import org.slicefold.optimizer.SliceNodes.SliceDeletion;
import org.slicefold.optimizer.SliceNodes.SliceLookup;

/**
 * Shape specific handling of slice operations on a subject.
 *
 * <p>Each hook receives the node with its children already refined and returns the rewrite of
 * that node. The defaults leave the node unchanged.
 */
public interface SliceHandler {
  default RewriteOutcome onSliceAssign(SliceAssignment assignment, TraceCollection trace) {
    return RewriteOutcome.unchanged();
  }

  default RewriteOutcome onSliceDelete(SliceDeletion deletion, TraceCollection trace) {
    return RewriteOutcome.unchanged();
  }

  default RewriteOutcome onSliceRead(SliceLookup lookup, TraceCollection trace) {
    return RewriteOutcome.unchanged();
  }
}
