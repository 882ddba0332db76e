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

import static com.google.common.truth.Truth.assertThat;
import static org.flowcert.ast.Expr.BinaryOp.ADD;
import static org.flowcert.ast.Expr.BinaryOp.LT;
import static org.flowcert.ast.Expr.binary;
import static org.flowcert.ast.Expr.intLit;
import static org.flowcert.ast.Expr.var;
import static org.flowcert.ast.Stmt.assign;
import static org.flowcert.ast.Stmt.block;
import static org.flowcert.ast.Stmt.breakStmt;
import static org.flowcert.ast.Stmt.continueStmt;
import static org.flowcert.ast.Stmt.ifElse;
import static org.flowcert.ast.Stmt.ifThen;
import static org.flowcert.ast.Stmt.loop;
import static org.flowcert.ast.Stmt.returnValue;
import static org.flowcert.ast.Stmt.returnVoid;

import com.google.common.collect.ImmutableList;
import org.flowcert.ast.Stmt;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CfgBuilderTest {

  private static ImmutableList<Integer> indices(ImmutableList<BasicBlock> blocks) {
    return blocks.stream().map(b -> b.index).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyBody() {
    ControlFlowGraph cfg = CfgBuilder.build(block());
    assertThat(cfg.blocks).hasSize(1);
    assertThat(cfg.exits).containsExactly(cfg.entry());
    assertThat(cfg.entry().isEmpty()).isTrue();
    assertThat(cfg.toString()).isEqualTo("B0 (entry):\n");
  }

  @Test
  public void ifElseWithReturnsHasNoJoin() {
    ControlFlowGraph cfg =
        CfgBuilder.build(
            block(
                ifElse(
                    var("c"), block(returnValue(intLit(1))), block(returnValue(intLit(2))))));
    assertThat(cfg.blocks).hasSize(3);
    assertThat(indices(cfg.exits)).containsExactly(1, 2);
    BasicBlock entry = cfg.entry();
    assertThat(entry.branch()).isInstanceOf(Stmt.If.class);
    assertThat(entry.successors)
        .containsExactly(
            new Edge(0, 1, Edge.Kind.TRUE_BRANCH), new Edge(0, 2, Edge.Kind.FALSE_BRANCH))
        .inOrder();
  }

  @Test
  public void ifElseWithFallThrough() {
    ControlFlowGraph cfg =
        CfgBuilder.build(
            block(
                ifElse(var("c"), block(returnValue(intLit(1))), block(assign("x", intLit(2)))),
                assign("y", intLit(3))));
    assertThat(cfg.blocks).hasSize(4);
    assertThat(indices(cfg.exits)).containsExactly(1, 3);
    assertThat(cfg.predecessors(cfg.block(3)))
        .containsExactly(new Edge(2, 3, Edge.Kind.UNCONDITIONAL));
    assertThat(cfg.toString())
        .isEqualTo(
            """
            B0 (entry):
              if c
              T: B1
              F: B2
            B1:
              return 1
            B2:
              x = 2
              → B3
            B3:
              y = 3
            """);
  }

  @Test
  public void ifWithoutElseBranchesToJoin() {
    ControlFlowGraph cfg =
        CfgBuilder.build(block(ifThen(var("c"), block(assign("x", intLit(1)))), returnVoid()));
    assertThat(cfg.blocks).hasSize(3);
    assertThat(cfg.entry().successor(Edge.Kind.FALSE_BRANCH).target).isEqualTo(2);
    assertThat(cfg.predecessors(cfg.block(2))).hasSize(2);
    assertThat(indices(cfg.exits)).containsExactly(2);
  }

  @Test
  public void codeAfterReturnIsDead() {
    ControlFlowGraph cfg = CfgBuilder.build(block(returnVoid(), assign("x", intLit(2))));
    assertThat(cfg.blocks).hasSize(2);
    assertThat(cfg.block(1).dead).isTrue();
    assertThat(indices(cfg.exits)).containsExactly(0);
    assertThat(cfg.numLiveBlocks()).isEqualTo(1);
    assertThat(cfg.reversePostorder()).containsExactly(cfg.entry());
  }

  @Test
  public void conditionalLoop() {
    ControlFlowGraph cfg =
        CfgBuilder.build(
            block(
                assign("x", intLit(0)),
                loop(
                    binary(LT, var("x"), intLit(10)),
                    block(assign("x", binary(ADD, var("x"), intLit(1))))),
                returnValue(var("x"))));
    assertThat(cfg.blocks).hasSize(4);
    BasicBlock header = cfg.block(1);
    assertThat(header.branch()).isInstanceOf(Stmt.Loop.class);
    assertThat(header.loopDepth).isEqualTo(1);
    assertThat(cfg.block(2).loopDepth).isEqualTo(1);
    assertThat(cfg.block(3).loopDepth).isEqualTo(0);
    assertThat(header.successors)
        .containsExactly(
            new Edge(1, 2, Edge.Kind.TRUE_BRANCH), new Edge(1, 3, Edge.Kind.FALSE_BRANCH));
    assertThat(cfg.predecessors(header))
        .containsExactly(
            new Edge(0, 1, Edge.Kind.UNCONDITIONAL), new Edge(2, 1, Edge.Kind.LOOP_BACK));
    assertThat(indices(cfg.exits)).containsExactly(3);
  }

  @Test
  public void breakAndContinue() {
    ControlFlowGraph cfg =
        CfgBuilder.build(
            block(
                loop(
                    null,
                    block(
                        ifThen(var("c"), block(breakStmt())),
                        assign("x", intLit(1)),
                        continueStmt()))));
    // B0 entry, B1 header, B2 body, B3 break, B4 after the loop, B5 join
    assertThat(cfg.blocks).hasSize(6);
    assertThat(cfg.block(1).successors).containsExactly(new Edge(1, 2, Edge.Kind.UNCONDITIONAL));
    assertThat(cfg.block(3).successors).containsExactly(new Edge(3, 4, Edge.Kind.UNCONDITIONAL));
    assertThat(cfg.block(5).successors).containsExactly(new Edge(5, 1, Edge.Kind.LOOP_BACK));
    assertThat(indices(cfg.exits)).containsExactly(4);
  }

  @Test
  public void infiniteLoopWithoutBreak() {
    ControlFlowGraph cfg =
        CfgBuilder.build(block(loop(null, block(assign("x", intLit(1)))), returnVoid()));
    assertThat(cfg.exits).isEmpty();
    BasicBlock last = cfg.blocks.get(cfg.blocks.size() - 1);
    assertThat(last.dead).isTrue();
    assertThat(last.last()).isInstanceOf(Stmt.Return.class);
  }

  @Test
  public void breakOutsideLoopEndsBlock() {
    ControlFlowGraph cfg = CfgBuilder.build(block(breakStmt(), assign("x", intLit(1))));
    assertThat(cfg.entry().successors).isEmpty();
    assertThat(cfg.block(1).dead).isTrue();
  }

  @Test
  public void reversePostorderRespectsForwardEdges() {
    ControlFlowGraph cfg =
        CfgBuilder.build(
            block(
                ifElse(var("a"), block(assign("x", intLit(1))), block(assign("x", intLit(2)))),
                loop(var("b"), block(ifThen(var("c"), block(breakStmt())))),
                returnValue(var("x"))));
    ImmutableList<BasicBlock> rpo = cfg.reversePostorder();
    assertThat(rpo.get(0)).isSameInstanceAs(cfg.entry());
    assertThat(rpo).hasSize(cfg.numLiveBlocks());
    for (BasicBlock b : rpo) {
      for (Edge e : b.successors) {
        if (e.kind != Edge.Kind.LOOP_BACK) {
          assertThat(rpo.indexOf(cfg.block(e.target))).isGreaterThan(rpo.indexOf(b));
        }
      }
    }
  }
}
