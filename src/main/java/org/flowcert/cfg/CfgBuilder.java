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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.flowcert.ast.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * Builds a {@link ControlFlowGraph} from a function body.
 *
 * <p>Statements are appended to the current block until a branch or jump ends it. An If ends its
 * header block with a {@link Edge.Kind#TRUE_BRANCH} edge to a new block for the then-branch and a
 * {@link Edge.Kind#FALSE_BRANCH} edge to the else-branch (or, if there is none, to the join
 * block). A Loop gets its own header block with a {@link Edge.Kind#LOOP_BACK} edge from the end
 * of its body. Join blocks and loop exits are only created once something links to them, so an
 * if/else whose branches both return has no join block.
 *
 * <p>Statements that follow a {@code return}, {@code break} or {@code continue} start a new block
 * with no predecessors, which will be marked dead.
 *
 * <p>A CfgBuilder is not reusable; {@link #build} creates a new one for each call.
 */
public final class CfgBuilder {

  /** A block under construction. */
  private static class PendingBlock {
    final int index;
    int loopDepth;
    final List<Stmt> stmts = new ArrayList<>();
    final List<Edge> successors = new ArrayList<>();

    PendingBlock(int index, int loopDepth) {
      this.index = index;
      this.loopDepth = loopDepth;
    }
  }

  /** The jump targets of an enclosing loop. */
  private class LoopTargets {
    final PendingBlock header;
    private @Nullable PendingBlock after;

    LoopTargets(PendingBlock header) {
      this.header = header;
    }

    /** Returns the block following the loop, creating it if necessary. */
    PendingBlock after() {
      if (after == null) {
        after = newBlock(loops.size() - 1);
      }
      return after;
    }
  }

  private final List<PendingBlock> blocks = new ArrayList<>();
  private final Deque<LoopTargets> loops = new ArrayDeque<>();

  /** The block that the next statement will be appended to, or null if it would be unreachable. */
  private @Nullable PendingBlock current;

  private CfgBuilder() {}

  /** Returns the control-flow graph for the given function body. */
  public static ControlFlowGraph build(Stmt.Block body) {
    CfgBuilder builder = new CfgBuilder();
    builder.current = builder.newBlock(0);
    builder.add(body);
    return builder.finish();
  }

  private PendingBlock newBlock(int loopDepth) {
    PendingBlock b = new PendingBlock(blocks.size(), loopDepth);
    blocks.add(b);
    return b;
  }

  private static void link(PendingBlock from, PendingBlock to, Edge.Kind kind) {
    from.successors.add(new Edge(from.index, to.index, kind));
  }

  /** Returns the current block, starting a new (unreachable) one if there is none. */
  private PendingBlock current() {
    if (current == null) {
      current = newBlock(loops.size());
    }
    return current;
  }

  private void add(Stmt stmt) {
    switch (stmt.kind()) {
      case BLOCK -> ((Stmt.Block) stmt).stmts.forEach(this::add);
      case ASSIGN, EXPR, UNSUPPORTED -> current().stmts.add(stmt);
      case RETURN -> {
        current().stmts.add(stmt);
        current = null;
      }
      case BREAK -> {
        PendingBlock b = current();
        b.stmts.add(stmt);
        // A break with no enclosing loop has nowhere to go; it just ends the block.
        if (!loops.isEmpty()) {
          link(b, loops.peek().after(), Edge.Kind.UNCONDITIONAL);
        }
        current = null;
      }
      case CONTINUE -> {
        PendingBlock b = current();
        b.stmts.add(stmt);
        if (!loops.isEmpty()) {
          link(b, loops.peek().header, Edge.Kind.LOOP_BACK);
        }
        current = null;
      }
      case IF -> addIf((Stmt.If) stmt);
      case LOOP -> addLoop((Stmt.Loop) stmt);
    }
  }

  private void addIf(Stmt.If stmt) {
    PendingBlock header = current();
    header.stmts.add(stmt);
    List<PendingBlock> fallThrough = new ArrayList<>(2);
    PendingBlock thenBlock = newBlock(loops.size());
    link(header, thenBlock, Edge.Kind.TRUE_BRANCH);
    current = thenBlock;
    add(stmt.then);
    if (current != null) {
      fallThrough.add(current);
    }
    if (stmt.otherwise != null) {
      PendingBlock elseBlock = newBlock(loops.size());
      link(header, elseBlock, Edge.Kind.FALSE_BRANCH);
      current = elseBlock;
      add(stmt.otherwise);
      if (current != null) {
        fallThrough.add(current);
      }
    }
    if (fallThrough.isEmpty() && stmt.otherwise != null) {
      current = null;
      return;
    }
    PendingBlock join = newBlock(loops.size());
    if (stmt.otherwise == null) {
      link(header, join, Edge.Kind.FALSE_BRANCH);
    }
    fallThrough.forEach(b -> link(b, join, Edge.Kind.UNCONDITIONAL));
    current = join;
  }

  private void addLoop(Stmt.Loop stmt) {
    PendingBlock header;
    // An empty block (other than the entry) can serve as the header.
    if (current != null && current.stmts.isEmpty() && current.index != 0) {
      header = current;
      header.loopDepth = loops.size() + 1;
    } else {
      header = newBlock(loops.size() + 1);
      if (current != null) {
        link(current, header, Edge.Kind.UNCONDITIONAL);
      }
    }
    header.stmts.add(stmt);
    LoopTargets targets = new LoopTargets(header);
    loops.push(targets);
    PendingBlock body = newBlock(loops.size());
    link(header, body, stmt.cond == null ? Edge.Kind.UNCONDITIONAL : Edge.Kind.TRUE_BRANCH);
    current = body;
    add(stmt.body);
    if (current != null) {
      link(current, header, Edge.Kind.LOOP_BACK);
    }
    if (stmt.cond != null) {
      link(header, targets.after(), Edge.Kind.FALSE_BRANCH);
    }
    loops.pop();
    // With no condition and no break, nothing follows the loop.
    current = targets.after;
  }

  private ControlFlowGraph finish() {
    boolean[] reached = new boolean[blocks.size()];
    Deque<PendingBlock> toVisit = new ArrayDeque<>();
    reached[0] = true;
    toVisit.add(blocks.get(0));
    while (!toVisit.isEmpty()) {
      for (Edge e : toVisit.poll().successors) {
        if (!reached[e.target]) {
          reached[e.target] = true;
          toVisit.add(blocks.get(e.target));
        }
      }
    }
    ImmutableList.Builder<BasicBlock> result = ImmutableList.builderWithExpectedSize(blocks.size());
    for (PendingBlock b : blocks) {
      result.add(
          new BasicBlock(
              b.index,
              ImmutableList.copyOf(b.stmts),
              ImmutableList.copyOf(b.successors),
              !reached[b.index],
              b.loopDepth));
    }
    return new ControlFlowGraph(result.build());
  }
}
