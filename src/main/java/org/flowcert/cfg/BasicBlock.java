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
import com.google.common.collect.Iterables;
import org.flowcert.ast.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * A maximal straight-line run of statements. If the block ends in a branch, its last statement is
 * the {@link Stmt.If} or {@link Stmt.Loop} whose condition selects the outgoing edge; only the
 * header part of that statement (initializer and condition) belongs to this block, the branch
 * bodies having their own blocks.
 */
public final class BasicBlock {
  /** This block's position in {@link ControlFlowGraph#blocks}. */
  public final int index;

  public final ImmutableList<Stmt> stmts;

  /** At most two, except when several {@code break}/{@code continue} paths are merged. */
  public final ImmutableList<Edge> successors;

  /**
   * True if this block cannot be reached from the entry block. Dead blocks are kept so that the
   * graph can be rendered, but are skipped by every analysis.
   */
  public final boolean dead;

  /** The number of loops enclosing this block; a loop header counts as inside its own loop. */
  public final int loopDepth;

  BasicBlock(
      int index,
      ImmutableList<Stmt> stmts,
      ImmutableList<Edge> successors,
      boolean dead,
      int loopDepth) {
    this.index = index;
    this.stmts = stmts;
    this.successors = successors;
    this.dead = dead;
    this.loopDepth = loopDepth;
  }

  public boolean isEmpty() {
    return stmts.isEmpty();
  }

  /** Returns the last statement in this block, or null if it is empty. */
  public @Nullable Stmt last() {
    return Iterables.getLast(stmts, null);
  }

  /** Returns the If or Loop statement that this block branches on, or null. */
  public @Nullable Stmt branch() {
    Stmt last = last();
    return (last instanceof Stmt.If || last instanceof Stmt.Loop) ? last : null;
  }

  /** Returns the successor edge of the given kind, or null if there is none. */
  public @Nullable Edge successor(Edge.Kind kind) {
    for (Edge e : successors) {
      if (e.kind == kind) {
        return e;
      }
    }
    return null;
  }

  /** Renders a statement as it appears in this block (only the header of an If or Loop). */
  static String render(Stmt stmt) {
    if (stmt instanceof Stmt.If ifStmt) {
      return "if " + (ifStmt.init == null ? "" : ifStmt.init + "; ") + ifStmt.cond;
    } else if (stmt instanceof Stmt.Loop loop) {
      return (loop.cond == null) ? "for" : "for " + loop.cond;
    }
    return stmt.toString();
  }

  @Override
  public String toString() {
    return "B" + index;
  }
}
