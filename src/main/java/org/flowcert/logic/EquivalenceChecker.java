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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.flowcert.logic.AnalysisConfig.CallPolicy;
import org.flowcert.logic.AnalysisConfig.ControlFlowMode;
import org.flowcert.logic.Evaluator.Path;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether two fragments are observationally equivalent: whether, for every environment,
 * they produce the same {@link TerminationResult} and make the same sequence of calls.
 *
 * <p>Each symbolic condition is treated as an independent boolean. Both fragments are explored
 * with {@link Evaluator#explore}, and every pair of paths whose assumptions are compatible (i.e.
 * every assignment of truth values to the conditions) is compared. Conditions are only
 * identified by their symbolic terms; two conditions that are related arithmetically (e.g. {@code
 * x > 0} and {@code x <= 0}) are still treated as independent, so such rewrites may be reported
 * as Unknown even when they are sound.
 */
public final class EquivalenceChecker {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final AnalysisConfig config;
  private final Evaluator evaluator;

  public EquivalenceChecker(AnalysisConfig config) {
    this.config = config;
    this.evaluator = new Evaluator(config);
  }

  public AnalysisConfig config() {
    return config;
  }

  /** Returns a Verdict on whether {@code original} and {@code rewritten} are equivalent. */
  public Verdict check(Fragment original, Fragment rewritten, Environment env) {
    Verdict verdict = checkAdmissible(original);
    if (verdict == null) {
      verdict = checkAdmissible(rewritten);
    }
    if (verdict == null) {
      verdict = compare(evaluator.explore(original, env), evaluator.explore(rewritten, env));
    }
    logger.atFine().log("%s => %s: %s", original, rewritten, verdict);
    return verdict;
  }

  /** As {@link #check}, but first simplifies both fragments with {@link Normalizer}. */
  public Verdict checkNormalized(Fragment original, Fragment rewritten, Environment env) {
    return check(Normalizer.normalize(original), Normalizer.normalize(rewritten), env);
  }

  /**
   * Returns a Verdict if {@code fragment} contains a construct that the configuration rules out,
   * whether or not it would be reached.
   */
  private @Nullable Verdict checkAdmissible(Fragment fragment) {
    if (!config.inLoopContext && fragment.hasLoopTransfer()) {
      return Verdict.rejected(
          Verdict.Reason.MALFORMED_CONTROL_TRANSFER, "break or continue outside a loop");
    } else if (config.controlFlowMode == ControlFlowMode.NO_TERMINATION
        && fragment.hasTerminator()) {
      return Verdict.unknown(
          Verdict.Reason.MODE_DISABLED, "early termination is not modeled in this mode");
    } else if (config.callPolicy == CallPolicy.DISALLOW_CALLS && fragment.hasCall()) {
      return Verdict.unknown(Verdict.Reason.CALLS_DISALLOWED, "fragment contains a call");
    }
    return null;
  }

  private static Verdict compare(ImmutableList<Path> original, ImmutableList<Path> rewritten) {
    Verdict undefined = firstUndefined(original);
    if (undefined == null) {
      undefined = firstUndefined(rewritten);
    }
    if (undefined != null) {
      return undefined;
    }
    Verdict callMismatch = null;
    // A result mismatch on any pair takes precedence over a call mismatch on an earlier one.
    for (Path a : original) {
      for (Path b : rewritten) {
        if (!a.isCompatible(b)) {
          continue;
        }
        if (!a.result.sameOutcome(b.result)) {
          return Verdict.unknown(
              Verdict.Reason.RESULT_MISMATCH,
              String.format("%s vs %s when %s", a.result, b.result, describe(a, b)));
        } else if (callMismatch == null && !a.result.calls.equals(b.result.calls)) {
          callMismatch =
              Verdict.unknown(
                  Verdict.Reason.CALL_ORDER_VIOLATION,
                  String.format(
                      "calls %s vs %s when %s",
                      a.result.calls,
                      b.result.calls,
                      describe(a, b)));
        }
      }
    }
    return (callMismatch != null) ? callMismatch : Verdict.verified();
  }

  private static @Nullable Verdict firstUndefined(ImmutableList<Path> paths) {
    for (Path p : paths) {
      if (p.result instanceof TerminationResult.Undefined u) {
        return Verdict.forFailure(u.reason, u.detail);
      }
    }
    return null;
  }

  private static String describe(Path a, Path b) {
    if (a.assumptions.isEmpty() && b.assumptions.isEmpty()) {
      return "always";
    }
    StringBuilder sb = new StringBuilder();
    a.assumptions.forEach((k, v) -> sb.append(v ? "" : "!").append(k).append(' '));
    b.assumptions.forEach(
        (k, v) -> {
          if (!a.assumptions.containsKey(k)) {
            sb.append(v ? "" : "!").append(k).append(' ');
          }
        });
    return sb.toString().trim();
  }
}
