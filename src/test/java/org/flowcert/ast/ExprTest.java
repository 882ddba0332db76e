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

package org.flowcert.ast;

import static com.google.common.truth.Truth.assertThat;
import static org.flowcert.ast.Expr.BinaryOp.ADD;
import static org.flowcert.ast.Expr.BinaryOp.AND;
import static org.flowcert.ast.Expr.BinaryOp.DIV;
import static org.flowcert.ast.Expr.binary;
import static org.flowcert.ast.Expr.call;
import static org.flowcert.ast.Expr.intLit;
import static org.flowcert.ast.Expr.not;
import static org.flowcert.ast.Expr.var;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExprTest {

  @Test
  public void structuralEquality() {
    Expr a = binary(ADD, var("x"), intLit(1));
    Expr b = binary(ADD, var("x"), intLit(1));
    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a).isNotEqualTo(binary(ADD, intLit(1), var("x")));
    assertThat(intLit(1)).isNotEqualTo(Expr.strLit("1"));
    assertThat(Expr.boolLit(true)).isSameInstanceAs(Expr.boolLit(true));
  }

  @Test
  public void referencedVars() {
    Expr e = binary(AND, not(var("a")), call("f", var("b"), binary(DIV, var("a"), var("c"))));
    assertThat(e.referencedVars()).containsExactly("a", "b", "c").inOrder();
    assertThat(intLit(3).referencedVars()).isEmpty();
  }

  @Test
  public void hasCall() {
    assertThat(binary(ADD, var("x"), call("f")).hasCall()).isTrue();
    assertThat(not(binary(ADD, var("x"), intLit(2))).hasCall()).isFalse();
  }

  @Test
  public void deeplyNestedExpression() {
    Expr e = var("x");
    for (int i = 0; i < 100_000; i++) {
      e = not(e);
    }
    assertThat(e.hasCall()).isFalse();
    assertThat(e.referencedVars()).containsExactly("x");
  }

  @Test
  public void operatorClassification() {
    assertThat(Expr.BinaryOp.MOD.isArithmetic()).isTrue();
    assertThat(Expr.BinaryOp.EQ.isArithmetic()).isFalse();
    assertThat(Expr.BinaryOp.OR.isShortCircuit()).isTrue();
    assertThat(ADD.isShortCircuit()).isFalse();
  }

  @Test
  public void toStrings() {
    assertThat(binary(DIV, var("a"), intLit(0)).toString()).isEqualTo("(a / 0)");
    assertThat(call("fmt.Println", Expr.strLit("hi"), var("x")).toString())
        .isEqualTo("fmt.Println(\"hi\", x)");
    assertThat(not(var("ok")).toString()).isEqualTo("!ok");
  }
}
