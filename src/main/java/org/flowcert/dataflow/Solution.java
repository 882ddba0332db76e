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
import org.flowcert.cfg.ControlFlowGraph;
import org.jspecify.annotations.Nullable;

/** The fixed point computed by {@link Solver}: an entry and exit state for each block. */
public final class Solution<S> {
  public final ControlFlowGraph cfg;
  private final @Nullable S[] in;
  private final @Nullable S[] out;
  private final int iterations;

  Solution(ControlFlowGraph cfg, @Nullable S[] in, @Nullable S[] out, int iterations) {
    this.cfg = cfg;
    this.in = in;
    this.out = out;
    this.iterations = iterations;
  }

  /** The state on entry to {@code block}; null if the block is dead or was found unreachable. */
  public @Nullable S in(BasicBlock block) {
    return in[block.index];
  }

  /** The state on exit from {@code block}. */
  public @Nullable S out(BasicBlock block) {
    return out[block.index];
  }

  /** The number of passes over the graph, including the final pass that changed nothing. */
  public int iterations() {
    return iterations;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock b : cfg.reversePostorder()) {
      sb.append(b).append(": ").append(in(b)).append(" -> ").append(out(b)).append('\n');
    }
    return sb.toString();
  }
}
