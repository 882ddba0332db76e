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

package org.flowcert.logic;

import static com.google.common.truth.Truth.assertThat;
import static org.flowcert.ast.Expr.BinaryOp.ADD;
import static org.flowcert.ast.Expr.BinaryOp.LT;
import static org.flowcert.ast.Expr.BinaryOp.MUL;
import static org.flowcert.ast.Expr.binary;
import static org.flowcert.ast.Expr.boolLit;
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

import org.flowcert.ast.Expr;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NormalizerTest {

  @Test
  public void foldsConstants() {
    assertThat(Normalizer.normalize(binary(ADD, intLit(2), binary(MUL, intLit(3), intLit(4)))))
        .isEqualTo(intLit(14));
    assertThat(Normalizer.normalize(binary(LT, intLit(1), intLit(2)))).isEqualTo(boolLit(true));
    assertThat(Normalizer.normalize(not(boolLit(true)))).isEqualTo(boolLit(false));
    // Division by zero is left alone.
    Expr div = binary(Expr.BinaryOp.DIV, intLit(1), intLit(0));
    assertThat(Normalizer.normalize(div)).isEqualTo(div);
  }

  @Test
  public void removesDoubleNegation() {
    assertThat(Normalizer.normalize(not(not(var("c"))))).isEqualTo(var("c"));
    assertThat(Normalizer.normalize(not(not(not(var("c")))))).isEqualTo(not(var("c")));
  }

  @Test
  public void eliminatesConstantIfs() {
    Fragment then = assign("x", intLit(1));
    Fragment otherwise = returnValue(intLit(2));
    assertThat(Normalizer.normalize(ifElse(binary(LT, intLit(1), intLit(2)), then, otherwise)))
        .isEqualTo(then);
    assertThat(Normalizer.normalize(ifElse(boolLit(false), then, otherwise))).isEqualTo(otherwise);
    assertThat(Normalizer.normalize(ifThen(boolLit(false), then))).isSameInstanceAs(Fragment.NOOP);
  }

  @Test
  public void keepsIfWithInitializer() {
    Fragment f = ifInit(declare("v", intLit(1)), boolLit(true), assign("x", var("v")), null);
    assertThat(Normalizer.normalize(f)).isEqualTo(f);
  }

  @Test
  public void dropsNoops() {
    Fragment f =
        seq(
            assign("x", intLit(1)),
            ifThen(boolLit(false), assign("y", intLit(2))),
            Fragment.call(Expr.call("f")));
    assertThat(Normalizer.normalize(f))
        .isEqualTo(seq(assign("x", intLit(1)), Fragment.call(Expr.call("f"))));
    assertThat(Normalizer.normalize(ifElse(var("c"), assign("x", intLit(1)), Fragment.NOOP)))
        .isEqualTo(ifThen(var("c"), assign("x", intLit(1))));
  }

  @Test
  public void keepsCalls() {
    Fragment f = Fragment.call(Expr.call("f", binary(ADD, intLit(1), intLit(1))));
    assertThat(Normalizer.normalize(f)).isEqualTo(Fragment.call(Expr.call("f", intLit(2))));
  }
}
