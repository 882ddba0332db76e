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
import static org.junit.Assert.assertThrows;

import java.util.Properties;
import org.flowcert.logic.AnalysisConfig.CallPolicy;
import org.flowcert.logic.AnalysisConfig.ControlFlowMode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AnalysisConfigTest {

  private static Properties properties(String... keysAndValues) {
    Properties result = new Properties();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      result.setProperty(keysAndValues[i], keysAndValues[i + 1]);
    }
    return result;
  }

  @Test
  public void defaults() {
    AnalysisConfig config = AnalysisConfig.fromProperties(new Properties());
    assertThat(config).isEqualTo(AnalysisConfig.DEFAULT);
    assertThat(config.controlFlowMode).isEqualTo(ControlFlowMode.EARLY_RETURN_AWARE);
    assertThat(config.callPolicy).isEqualTo(CallPolicy.OPAQUE_CALLS);
    assertThat(config.inLoopContext).isFalse();
    assertThat(config.maxPaths).isEqualTo(AnalysisConfig.DEFAULT_MAX_PATHS);
    assertThat(config.enablesRewriteChecks()).isTrue();
  }

  @Test
  public void readsProperties() {
    AnalysisConfig config =
        AnalysisConfig.fromProperties(
            properties(
                AnalysisConfig.CONTROL_FLOW_MODE_PROPERTY, "no_termination",
                AnalysisConfig.CALL_POLICY_PROPERTY, " DISALLOW_CALLS ",
                AnalysisConfig.MAX_PATHS_PROPERTY, "64"));
    assertThat(config.controlFlowMode).isEqualTo(ControlFlowMode.NO_TERMINATION);
    assertThat(config.callPolicy).isEqualTo(CallPolicy.DISALLOW_CALLS);
    assertThat(config.maxPaths).isEqualTo(64);
    assertThat(config.enablesRewriteChecks()).isFalse();
  }

  @Test
  public void badValues() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                AnalysisConfig.fromProperties(
                    properties(AnalysisConfig.CALL_POLICY_PROPERTY, "sometimes")));
    assertThat(e).hasMessageThat().isEqualTo("Bad value \"sometimes\" for CallPolicy");
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisConfig.fromProperties(properties(AnalysisConfig.MAX_PATHS_PROPERTY, "lots")));
    assertThrows(
        IllegalArgumentException.class,
        () -> AnalysisConfig.fromProperties(properties(AnalysisConfig.MAX_PATHS_PROPERTY, "0")));
  }

  @Test
  public void withers() {
    AnalysisConfig config = AnalysisConfig.DEFAULT.withInLoopContext(true);
    assertThat(config).isNotEqualTo(AnalysisConfig.DEFAULT);
    assertThat(config.withInLoopContext(false)).isEqualTo(AnalysisConfig.DEFAULT);
    assertThat(
            AnalysisConfig.DEFAULT.withCallPolicy(CallPolicy.DISALLOW_CALLS).enablesRewriteChecks())
        .isFalse();
  }
}
