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
import static org.flowcert.ast.Expr.BinaryOp.AND;
import static org.flowcert.ast.Expr.BinaryOp.EQ;
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.flowcert.ast.Expr;
import org.flowcert.logic.AnalysisConfig.CallPolicy;
import org.flowcert.logic.AnalysisConfig.ControlFlowMode;
import org.flowcert.logic.Evaluator.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvaluatorTest {

  private final Evaluator evaluator = new Evaluator(AnalysisConfig.DEFAULT);

  private static Fragment call(String function, Expr... args) {
    return Fragment.call(Expr.call(function, args));
  }

  private static void assertUndefined(TerminationResult result, Verdict.Reason reason) {
    assertThat(result).isInstanceOf(TerminationResult.Undefined.class);
    assertThat(((TerminationResult.Undefined) result).reason).isEqualTo(reason);
  }

  @Test
  public void assignmentsContinue() {
    TerminationResult result =
        evaluator.evaluate(
            seq(assign("x", intLit(1)), assign("y", binary(ADD, var("x"), intLit(2)))),
            Environment.EMPTY);
    assertThat(result.kind()).isEqualTo(TerminationResult.Kind.CONTINUE);
    Environment env = ((TerminationResult.Continue) result).env;
    assertThat(env.get("x")).isEqualTo(Value.of(1L));
    assertThat(env.get("y")).isEqualTo(Value.of(3L));
    assertThat(result.terminates()).isFalse();
  }

  @Test
  public void returnEndsSequence() {
    TerminationResult result =
        evaluator.evaluate(seq(returnValue(intLit(1)), assign("x", intLit(2))), Environment.EMPTY);
    assertThat(result.kind()).isEqualTo(TerminationResult.Kind.RETURN);
    assertThat(((TerminationResult.Return) result).value).isEqualTo(Value.of(1L));
    assertThat(result.terminates()).isTrue();
  }

  @Test
  public void inputsAreSymbolic() {
    TerminationResult result =
        evaluator.evaluate(returnValue(binary(ADD, var("a"), intLit(1))), Environment.EMPTY);
    Value value = ((TerminationResult.Return) result).value;
    assertThat(value.isSymbolic()).isTrue();
    assertThat(value.toTerm()).isEqualTo(binary(ADD, var("a"), intLit(1)));
  }

  @Test
  public void symbolicConditionForks() {
    Fragment f = ifElse(var("c"), returnValue(intLit(1)), returnValue(intLit(2)));
    ImmutableList<Path> paths = evaluator.explore(f, Environment.EMPTY);
    assertThat(paths).hasSize(2);
    assertThat(paths.get(0).assumptions).containsExactly(var("c"), true);
    assertThat(paths.get(1).assumptions).containsExactly(var("c"), false);
    assertThat(paths.get(0).isCompatible(paths.get(1))).isFalse();

    assertUndefined(
        evaluator.evaluate(f, Environment.EMPTY), Verdict.Reason.UNDECIDED_CONDITION);
    TerminationResult decided =
        evaluator.evaluate(f, Environment.EMPTY, ImmutableMap.of(var("c"), false));
    assertThat(((TerminationResult.Return) decided).value).isEqualTo(Value.of(2L));
  }

  @Test
  public void negatedConditionsShareAnAssumption() {
    Fragment f =
        seq(
            ifThen(not(var("c")), assign("x", intLit(1))),
            ifThen(var("c"), assign("y", intLit(1))));
    ImmutableList<Path> paths = evaluator.explore(f, Environment.EMPTY);
    assertThat(paths).hasSize(2);
    for (Path p : paths) {
      Environment env = ((TerminationResult.Continue) p.result).env;
      // Exactly one of the two assignments happens on each path.
      assertThat(env.boundNames()).hasSize(1);
    }
  }

  @Test
  public void concreteConditionPicksBranch() {
    Environment env = Environment.of(ImmutableMap.of("x", Value.of(0L)));
    TerminationResult result =
        evaluator.evaluate(
            ifElse(var("x"), returnValue(intLit(1)), returnValue(intLit(2))), env);
    assertThat(((TerminationResult.Return) result).value).isEqualTo(Value.of(2L));
  }

  @Test
  public void initializerScope() {
    Environment env = Environment.of(ImmutableMap.of("x", Value.of(5L)));
    Fragment f =
        ifInit(
            declare("x", intLit(1)),
            binary(EQ, var("x"), intLit(1)),
            assign("y", var("x")),
            null);
    Environment after = ((TerminationResult.Continue) evaluator.evaluate(f, env)).env;
    assertThat(after.get("y")).isEqualTo(Value.of(1L));
    assertThat(after.get("x")).isEqualTo(Value.of(5L));

    Environment fresh = ((TerminationResult.Continue) evaluator.evaluate(f, Environment.EMPTY)).env;
    assertThat(fresh.isBound("x")).isFalse();
    assertThat(fresh.get("y")).isEqualTo(Value.of(1L));
  }

  @Test
  public void branchDeclarationsAreLocal() {
    Environment env = Environment.of(ImmutableMap.of("x", Value.of(5L)));
    Fragment f = ifThen(boolLit(true), seq(declare("x", intLit(1)), assign("y", var("x"))));
    Environment after = ((TerminationResult.Continue) evaluator.evaluate(f, env)).env;
    assertThat(after.get("y")).isEqualTo(Value.of(1L));
    assertThat(after.get("x")).isEqualTo(Value.of(5L));

    // An assignment before the declaration still updates the outer variable.
    Fragment assignsFirst =
        ifElse(
            var("c"),
            seq(assign("x", intLit(7)), declare("x", intLit(1)), assign("x", intLit(3))),
            null);
    ImmutableList<Path> paths = evaluator.explore(assignsFirst, env);
    assertThat(paths).hasSize(2);
    assertThat(((TerminationResult.Continue) paths.get(0).result).env.get("x"))
        .isEqualTo(Value.of(7L));
    assertThat(((TerminationResult.Continue) paths.get(1).result).env.get("x"))
        .isEqualTo(Value.of(5L));
  }

  @Test
  public void topLevelDeclarationIsAnAssignment() {
    TerminationResult result = evaluator.evaluate(declare("x", intLit(1)), Environment.EMPTY);
    assertThat(((TerminationResult.Continue) result).env.get("x")).isEqualTo(Value.of(1L));
  }

  @Test
  public void callsAreRecordedInOrder() {
    TerminationResult result =
        evaluator.evaluate(
            seq(call("f", intLit(1)), assign("x", Expr.call("g")), returnValue(var("x"))),
            Environment.EMPTY);
    assertThat(result.calls)
        .containsExactly(
            new CallRecord("f", ImmutableList.of(Value.of(1L))),
            new CallRecord("g", ImmutableList.of()))
        .inOrder();
    assertThat(((TerminationResult.Return) result).value)
        .isEqualTo(Value.symbolic(var("$g#1")));
  }

  @Test
  public void shortCircuitSkipsCall() {
    TerminationResult result =
        evaluator.evaluate(
            ifThen(binary(AND, boolLit(false), Expr.call("f")), assign("x", intLit(1))),
            Environment.EMPTY);
    assertThat(result.calls).isEmpty();
    assertThat(((TerminationResult.Continue) result).env).isEqualTo(Environment.EMPTY);
  }

  @Test
  public void callAfterSymbolicShortCircuitIsUnsupported() {
    TerminationResult result =
        evaluator.evaluate(
            ifThen(binary(AND, var("c"), Expr.call("f")), assign("x", intLit(1))),
            Environment.EMPTY);
    assertUndefined(result, Verdict.Reason.UNSUPPORTED_CONSTRUCT);
  }

  @Test
  public void loopTransfers() {
    assertUndefined(
        evaluator.evaluate(Fragment.BREAK, Environment.EMPTY),
        Verdict.Reason.MALFORMED_CONTROL_TRANSFER);
    Evaluator inLoop = new Evaluator(AnalysisConfig.DEFAULT.withInLoopContext(true));
    assertThat(inLoop.evaluate(Fragment.BREAK, Environment.EMPTY).kind())
        .isEqualTo(TerminationResult.Kind.BREAK);
    assertThat(inLoop.evaluate(seq(Fragment.CONTINUE, call("f")), Environment.EMPTY).kind())
        .isEqualTo(TerminationResult.Kind.CONTINUE_LOOP);
  }

  @Test
  public void configurationLimits() {
    Evaluator noTermination =
        new Evaluator(
            AnalysisConfig.DEFAULT.withControlFlowMode(ControlFlowMode.NO_TERMINATION));
    assertUndefined(
        noTermination.evaluate(returnValue(intLit(1)), Environment.EMPTY),
        Verdict.Reason.MODE_DISABLED);
    Evaluator noCalls =
        new Evaluator(AnalysisConfig.DEFAULT.withCallPolicy(CallPolicy.DISALLOW_CALLS));
    assertUndefined(
        noCalls.evaluate(call("f"), Environment.EMPTY), Verdict.Reason.CALLS_DISALLOWED);
  }

  @Test
  public void pathLimit() {
    Evaluator limited = new Evaluator(AnalysisConfig.DEFAULT.withMaxPaths(4));
    Fragment f =
        seq(
            ifThen(var("a"), assign("x", intLit(1))),
            ifThen(var("b"), assign("y", intLit(1))),
            ifThen(var("c"), assign("z", intLit(1))));
    assertUndefined(limited.evaluate(f, Environment.EMPTY), Verdict.Reason.PATH_LIMIT);
    assertThat(evaluator.explore(f, Environment.EMPTY)).hasSize(8);
  }
}
