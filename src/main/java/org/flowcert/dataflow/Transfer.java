/*
 * Copyright 2025 The Flowcert Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.flowcert.dataflow;

import org.flowcert.cfg.BasicBlock;
import org.flowcert.cfg.Edge;
import org.jspecify.annotations.Nullable;

/**
 * A transfer function for a forward dataflow analysis. Implementations must be monotone with
 * respect to their lattice; {@link Solver} relies on this to terminate but does not check it.
 */
@FunctionalInterface
public interface Transfer<S> {

  /**
   * Returns the state on exit from {@code block}, given the (non-bottom) state on entry to it. May
   * return null if the block can never complete.
   */
  @Nullable S apply(BasicBlock block, S in);

  /**
   * Returns the state that flows along {@code edge}, given the exit state of its origin. Analyses
   * that learn something from a branch condition override this; returning null marks the edge as
   * infeasible.
   */
  default @Nullable S refine(BasicBlock origin, Edge edge, S out) {
    return out;
  }
}
