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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TerminationResultTest {

  private static final ImmutableList<CallRecord> ONE_CALL =
      ImmutableList.of(new CallRecord("f", ImmutableList.of(Value.of("a"))));

  @Test
  public void environmentIsNormalized() {
    Environment env = Environment.EMPTY.with("x", Value.input("x"));
    assertThat(env).isSameInstanceAs(Environment.EMPTY);
    Environment bound = Environment.EMPTY.with("x", Value.of(1L));
    assertThat(bound.isBound("x")).isTrue();
    assertThat(bound.with("x", Value.input("x"))).isEqualTo(Environment.EMPTY);
    assertThat(Environment.of(ImmutableMap.of("x", Value.of(1L)))).isEqualTo(bound);
    assertThat(bound.without("x")).isEqualTo(Environment.EMPTY);
  }

  @Test
  public void sameOutcomeIgnoresCalls() {
    TerminationResult a = TerminationResult.returning(Value.of(1L), ImmutableList.of());
    TerminationResult b = TerminationResult.returning(Value.of(1L), ONE_CALL);
    assertThat(a.sameOutcome(b)).isTrue();
    assertThat(a).isNotEqualTo(b);
    assertThat(a.sameOutcome(TerminationResult.returning(null, ImmutableList.of()))).isFalse();
    TerminationResult noCalls = TerminationResult.breaking(ImmutableList.of());
    assertThat(TerminationResult.breaking(ONE_CALL).sameOutcome(noCalls)).isTrue();
    assertThat(a.sameOutcome(TerminationResult.continueWith(Environment.EMPTY, ImmutableList.of())))
        .isFalse();
  }

  @Test
  public void undefinedNeverMatches() {
    TerminationResult u = TerminationResult.undefined(Verdict.Reason.PATH_LIMIT, "");
    assertThat(u.sameOutcome(u)).isFalse();
    assertThat(u.toString()).isEqualTo("Undefined(path limit exceeded)");
  }

  @Test
  public void toStrings() {
    assertThat(TerminationResult.returning(Value.of(1L), ONE_CALL).toString())
        .isEqualTo("Return(1) calls=[f(\"a\")]");
    assertThat(TerminationResult.continuingLoop(ImmutableList.of()).toString())
        .isEqualTo("ContinueLoop");
  }
}
