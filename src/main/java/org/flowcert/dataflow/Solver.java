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

import com.google.common.flogger.FluentLogger;
import org.flowcert.cfg.BasicBlock;
import org.flowcert.cfg.ControlFlowGraph;
import org.flowcert.cfg.Edge;
import org.jspecify.annotations.Nullable;

/**
 * A forward dataflow solver. Each pass visits the live blocks in reverse postorder, computing each
 * block's entry state as the join of the (refined) exit states of its predecessors, and passes are
 * repeated until no entry state changes.
 *
 * <p>Every pass but the last raises at least one entry state. With a monotone transfer function,
 * if an entry state can strictly rise at most h times then the number of passes is at most h times
 * the number of live blocks, plus the final, confirming pass. For a map lattice h depends on the
 * number of keys, not just on the height of the values (see {@link ZeroLattice#height}). Dead
 * blocks are never visited and their states remain null.
 *
 * <p>The result is a fixed point: each live block's entry state is the join of its refined
 * predecessor exit states, so solving again from it would change nothing.
 */
public final class Solver<S> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Lattice<S> lattice;
  private final Transfer<S> transfer;

  public Solver(Lattice<S> lattice, Transfer<S> transfer) {
    this.lattice = lattice;
    this.transfer = transfer;
  }

  /** Returns the least fixed point with {@code initialState} on entry to the graph. */
  public Solution<S> solve(ControlFlowGraph cfg, S initialState) {
    int n = cfg.blocks.size();
    @SuppressWarnings("unchecked")
    @Nullable S[] in = (S[]) new Object[n];
    @SuppressWarnings("unchecked")
    @Nullable S[] out = (S[]) new Object[n];
    int iterations = 0;
    boolean changed;
    do {
      changed = false;
      ++iterations;
      for (BasicBlock block : cfg.reversePostorder()) {
        S state = (block.index == 0) ? initialState : null;
        for (Edge edge : cfg.predecessors(block)) {
          S predOut = out[edge.origin];
          if (predOut != null) {
            state = lattice.join(state, transfer.refine(cfg.block(edge.origin), edge, predOut));
          }
        }
        if (iterations == 1 || !lattice.isEquivalent(state, in[block.index])) {
          changed |= !lattice.isEquivalent(state, in[block.index]);
          in[block.index] = state;
          out[block.index] = (state == null) ? null : transfer.apply(block, state);
        }
      }
    } while (changed);
    logger.atFine().log(
        "Solved %d live blocks in %d iterations", cfg.numLiveBlocks(), iterations);
    return new Solution<>(cfg, in, out, iterations);
  }
}
