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

package org.flowcert.cfg;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.flowcert.ast.Stmt;

/**
 * A per-function control-flow graph. Blocks are held in an arena indexed by {@link
 * BasicBlock#index}; block 0 is the entry.
 *
 * <p>Every block is either reachable from the entry or marked {@link BasicBlock#dead}. The exits
 * are the live blocks with no successors (those ending in {@code return}, and the block that falls
 * off the end of the function, if any).
 */
public final class ControlFlowGraph {
  public final ImmutableList<BasicBlock> blocks;
  public final ImmutableList<BasicBlock> exits;

  private final ImmutableListMultimap<Integer, Edge> predecessors;
  private final ImmutableList<BasicBlock> reversePostorder;

  ControlFlowGraph(ImmutableList<BasicBlock> blocks) {
    Preconditions.checkArgument(!blocks.isEmpty());
    this.blocks = blocks;
    this.exits =
        blocks.stream()
            .filter(b -> !b.dead && b.successors.isEmpty())
            .collect(ImmutableList.toImmutableList());
    ImmutableListMultimap.Builder<Integer, Edge> preds = ImmutableListMultimap.builder();
    for (BasicBlock b : blocks) {
      if (!b.dead) {
        b.successors.forEach(e -> preds.put(e.target, e));
      }
    }
    this.predecessors = preds.build();
    this.reversePostorder = computeReversePostorder();
  }

  public BasicBlock entry() {
    return blocks.get(0);
  }

  public BasicBlock block(int index) {
    return blocks.get(index);
  }

  /** Returns the edges into the given block from live blocks. */
  public ImmutableList<Edge> predecessors(BasicBlock block) {
    return predecessors.get(block.index);
  }

  /**
   * Returns the live blocks in reverse postorder, so that (ignoring back edges) every block appears
   * after all of its predecessors.
   */
  public ImmutableList<BasicBlock> reversePostorder() {
    return reversePostorder;
  }

  public int numLiveBlocks() {
    return reversePostorder.size();
  }

  private ImmutableList<BasicBlock> computeReversePostorder() {
    // Iterative DFS; each stack entry is a block and the index of the next successor to visit.
    boolean[] visited = new boolean[blocks.size()];
    List<BasicBlock> postorder = new ArrayList<>(blocks.size());
    Deque<int[]> stack = new ArrayDeque<>();
    visited[0] = true;
    stack.push(new int[] {0, 0});
    while (!stack.isEmpty()) {
      int[] top = stack.peek();
      BasicBlock b = blocks.get(top[0]);
      if (top[1] < b.successors.size()) {
        int next = b.successors.get(top[1]++).target;
        if (!visited[next]) {
          visited[next] = true;
          stack.push(new int[] {next, 0});
        }
      } else {
        stack.pop();
        postorder.add(b);
      }
    }
    return ImmutableList.copyOf(postorder).reverse();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (BasicBlock b : blocks) {
      sb.append(b);
      if (b.index == 0) {
        sb.append(" (entry)");
      }
      if (b.dead) {
        sb.append(" (dead)");
      }
      sb.append(":\n");
      for (Stmt s : b.stmts) {
        sb.append("  ").append(BasicBlock.render(s)).append('\n');
      }
      for (Edge e : b.successors) {
        sb.append("  ").append(e).append('\n');
      }
    }
    return sb.toString();
  }
}
