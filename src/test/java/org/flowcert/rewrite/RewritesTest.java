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

package org.flowcert.rewrite;

import static com.google.common.truth.Truth.assertThat;
import static org.flowcert.ast.Expr.intLit;
import static org.flowcert.ast.Expr.not;
import static org.flowcert.ast.Expr.var;
import static org.flowcert.logic.Fragment.assign;
import static org.flowcert.logic.Fragment.declare;
import static org.flowcert.logic.Fragment.ifElse;
import static org.flowcert.logic.Fragment.ifInit;
import static org.flowcert.logic.Fragment.ifThen;
import static org.flowcert.logic.Fragment.returnValue;
import static org.flowcert.logic.Fragment.seq;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import org.flowcert.logic.Fragment;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RewritesTest {

  private static final Fragment RETURN_1 = returnValue(intLit(1));
  private static final Fragment ASSIGN_X = assign("x", intLit(2));

  @Test
  public void flattenElse() {
    RewriteCandidate candidate =
        Rewrites.flattenElse(ifElse(var("c"), RETURN_1, ASSIGN_X), ImmutableSet.of("c"), true);
    assertThat(candidate.pattern).isEqualTo(RewritePattern.IF_ELSE_FLATTENING);
    assertThat(candidate.rewritten).isEqualTo(seq(ifThen(var("c"), RETURN_1), ASSIGN_X));
    assertThat(candidate.visibleIdentifiers).containsExactly("c");
    assertThat(candidate.inLoop).isTrue();
  }

  @Test
  public void flattenElseKeepsInitializer() {
    Fragment.If original = ifInit(declare("v", var("a")), var("v"), RETURN_1, ASSIGN_X);
    RewriteCandidate candidate = Rewrites.flattenElse(original, ImmutableSet.of(), false);
    assertThat(candidate.rewritten)
        .isEqualTo(seq(ifInit(declare("v", var("a")), var("v"), RETURN_1, null), ASSIGN_X));
  }

  @Test
  public void invertEarlyReturn() {
    RewriteCandidate candidate =
        Rewrites.invertEarlyReturn(ifElse(var("c"), ASSIGN_X, RETURN_1), ImmutableSet.of(), false);
    assertThat(candidate.pattern).isEqualTo(RewritePattern.EARLY_RETURN_NORMALIZATION);
    assertThat(candidate.rewritten).isEqualTo(seq(ifThen(not(var("c")), RETURN_1), ASSIGN_X));

    // An existing negation is removed rather than doubled.
    RewriteCandidate negated =
        Rewrites.invertEarlyReturn(
            ifElse(not(var("c")), ASSIGN_X, RETURN_1), ImmutableSet.of(), false);
    assertThat(negated.rewritten).isEqualTo(seq(ifThen(var("c"), RETURN_1), ASSIGN_X));
  }

  @Test
  public void flattenElseIfChain() {
    Fragment.If chain =
        ifElse(
            var("a"),
            RETURN_1,
            ifElse(var("b"), returnValue(intLit(2)), ifElse(var("c"), RETURN_1, ASSIGN_X)));
    assertThat(Rewrites.chain(chain)).hasSize(3);
    RewriteCandidate candidate = Rewrites.flattenElseIfChain(chain, ImmutableSet.of(), false);
    assertThat(candidate.pattern).isEqualTo(RewritePattern.ELSE_IF_CHAIN_FLATTENING);
    assertThat(candidate.rewritten)
        .isEqualTo(
            seq(
                ifThen(var("a"), RETURN_1),
                ifThen(var("b"), returnValue(intLit(2))),
                ifThen(var("c"), RETURN_1),
                ASSIGN_X));
  }

  @Test
  public void requiresElse() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Rewrites.flattenElse(ifThen(var("c"), RETURN_1), ImmutableSet.of(), false));
  }
}
