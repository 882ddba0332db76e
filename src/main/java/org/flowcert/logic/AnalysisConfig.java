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

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings that determine which constructs the {@link Evaluator} models. Only {@link
 * ControlFlowMode#EARLY_RETURN_AWARE} together with {@link CallPolicy#OPAQUE_CALLS} is strong
 * enough to check rewrites; see {@link #enablesRewriteChecks}.
 */
@Immutable
public final class AnalysisConfig {

  public enum ControlFlowMode {
    /** Fragments may not contain {@code return}, {@code break} or {@code continue}. */
    NO_TERMINATION,
    /** Early termination is modeled by {@link TerminationResult}. */
    EARLY_RETURN_AWARE
  }

  public enum CallPolicy {
    /** Any fragment containing a call is inadmissible. */
    DISALLOW_CALLS,
    /**
     * Calls are unmodeled effects; equivalence additionally requires the same sequence of calls.
     */
    OPAQUE_CALLS
  }

  public static final int DEFAULT_MAX_PATHS = 4096;

  public static final AnalysisConfig DEFAULT =
      new AnalysisConfig(
          ControlFlowMode.EARLY_RETURN_AWARE, CallPolicy.OPAQUE_CALLS, false, DEFAULT_MAX_PATHS);

  public static final String CONTROL_FLOW_MODE_PROPERTY = "flowcert.controlFlowMode";
  public static final String CALL_POLICY_PROPERTY = "flowcert.callPolicy";
  public static final String MAX_PATHS_PROPERTY = "flowcert.maxPaths";

  public final ControlFlowMode controlFlowMode;
  public final CallPolicy callPolicy;

  /** True if the fragments being evaluated are inside a loop, so break and continue are legal. */
  public final boolean inLoopContext;

  /** The maximum number of paths that case splitting may produce for one fragment. */
  public final int maxPaths;

  private AnalysisConfig(
      ControlFlowMode controlFlowMode, CallPolicy callPolicy, boolean inLoopContext, int maxPaths) {
    Preconditions.checkArgument(maxPaths > 0, "maxPaths must be positive (was %s)", maxPaths);
    this.controlFlowMode = Preconditions.checkNotNull(controlFlowMode);
    this.callPolicy = Preconditions.checkNotNull(callPolicy);
    this.inLoopContext = inLoopContext;
    this.maxPaths = maxPaths;
  }

  public AnalysisConfig withControlFlowMode(ControlFlowMode mode) {
    return new AnalysisConfig(mode, callPolicy, inLoopContext, maxPaths);
  }

  public AnalysisConfig withCallPolicy(CallPolicy policy) {
    return new AnalysisConfig(controlFlowMode, policy, inLoopContext, maxPaths);
  }

  public AnalysisConfig withInLoopContext(boolean inLoop) {
    return (inLoop == inLoopContext)
        ? this
        : new AnalysisConfig(controlFlowMode, callPolicy, inLoop, maxPaths);
  }

  public AnalysisConfig withMaxPaths(int maxPaths) {
    return new AnalysisConfig(controlFlowMode, callPolicy, inLoopContext, maxPaths);
  }

  /** True if this configuration models enough to decide whether a rewrite is sound. */
  public boolean enablesRewriteChecks() {
    return controlFlowMode == ControlFlowMode.EARLY_RETURN_AWARE
        && callPolicy == CallPolicy.OPAQUE_CALLS;
  }

  /**
   * Returns {@link #DEFAULT} with any settings found in {@code properties} applied. Enum values
   * are matched ignoring case.
   *
   * @throws IllegalArgumentException if a property has a value that cannot be parsed
   */
  public static AnalysisConfig fromProperties(Properties properties) {
    AnalysisConfig result = DEFAULT;
    String mode = properties.getProperty(CONTROL_FLOW_MODE_PROPERTY);
    if (mode != null) {
      result = result.withControlFlowMode(parseEnum(ControlFlowMode.class, mode));
    }
    String policy = properties.getProperty(CALL_POLICY_PROPERTY);
    if (policy != null) {
      result = result.withCallPolicy(parseEnum(CallPolicy.class, policy));
    }
    String maxPaths = properties.getProperty(MAX_PATHS_PROPERTY);
    if (maxPaths != null) {
      try {
        result = result.withMaxPaths(Integer.parseInt(maxPaths.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Bad value for " + MAX_PATHS_PROPERTY, e);
      }
    }
    return result;
  }

  private static <T extends Enum<T>> T parseEnum(Class<T> type, String s) {
    try {
      return Enum.valueOf(type, Ascii.toUpperCase(s.trim()));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Bad value \"%s\" for %s", s, type.getSimpleName()), e);
    }
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof AnalysisConfig c
        && c.controlFlowMode == controlFlowMode
        && c.callPolicy == callPolicy
        && c.inLoopContext == inLoopContext
        && c.maxPaths == maxPaths;
  }

  @Override
  public int hashCode() {
    return Objects.hash(controlFlowMode, callPolicy, inLoopContext, maxPaths);
  }

  @Override
  public String toString() {
    return String.format(
        "%s/%s%s maxPaths=%s",
        controlFlowMode, callPolicy, inLoopContext ? " (in loop)" : "", maxPaths);
  }
}
