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

package org.flowcert.lint;

import static com.google.common.truth.Truth.assertThat;
import static org.flowcert.ast.Expr.BinaryOp.DIV;
import static org.flowcert.ast.Expr.binary;
import static org.flowcert.ast.Expr.intLit;
import static org.flowcert.ast.Expr.var;
import static org.flowcert.ast.Stmt.assign;
import static org.flowcert.ast.Stmt.block;
import static org.flowcert.ast.Stmt.ifElse;
import static org.flowcert.ast.Stmt.returnValue;

import com.google.common.collect.ImmutableList;
import org.flowcert.ast.Function;
import org.flowcert.ast.Position;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LinterTest {

  /**
   * <pre>
   * func f(a, b) {
   *   if a {
   *     return 1
   *   } else {
   *     x = a / b
   *   }
   *   return x
   * }
   * </pre>
   */
  private static final Function F =
      Function.of(
          "f",
          block(
              ifElse(
                      var("a"),
                      block(returnValue(intLit(1)).withSpan(Position.of(3, 5), Position.of(3, 13))),
                      block(
                          assign("x", binary(DIV, var("a"), var("b")))
                              .withSpan(Position.of(5, 5), Position.of(5, 14))))
                  .withSpan(Position.of(2, 3), Position.of(6, 4)),
              returnValue(var("x")).withSpan(Position.of(7, 3), Position.of(7, 11))),
          "a",
          "b");

  @Test
  public void findingsAreOrderedByPosition() {
    ImmutableList<Finding> findings =
        new Linter(new DivisionByZeroRule(), new UnnecessaryElseRule()).lint(F);
    assertThat(findings).hasSize(2);
    assertThat(findings.get(0).ruleId).isEqualTo(UnnecessaryElseRule.ID);
    assertThat(findings.get(1).ruleId).isEqualTo(DivisionByZeroRule.ID);
    assertThat(findings.get(1).toString())
        .isEqualTo(
            "5:5 WARNING [division-by-zero] possible division by zero in (a / b): divisor may be"
                + " zero (TOP)");
  }

  @Test
  public void suppressedFindingsAreDropped() {
    Linter linter =
        new Linter(
            ImmutableList.of(new DivisionByZeroRule(), new UnnecessaryElseRule()),
            (ruleId, position) -> ruleId.equals(DivisionByZeroRule.ID) && position.line == 5);
    ImmutableList<Finding> findings = linter.lint(F);
    assertThat(findings).hasSize(1);
    assertThat(findings.get(0).ruleId).isEqualTo(UnnecessaryElseRule.ID);
  }

  @Test
  public void noRules() {
    assertThat(new Linter().lint(F)).isEmpty();
  }
}
