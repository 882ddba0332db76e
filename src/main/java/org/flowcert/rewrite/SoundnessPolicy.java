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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.flowcert.logic.AnalysisConfig;
import org.flowcert.logic.Environment;
import org.flowcert.logic.EquivalenceChecker;
import org.flowcert.logic.Fragment;
import org.flowcert.logic.FragmentException;
import org.flowcert.logic.Verdict;
import org.jspecify.annotations.Nullable;

/**
 * Decides whether a {@link RewriteCandidate} may be applied. A candidate is checked in stages, and
 * the first stage that fails determines the verdict:
 *
 * <ol>
 *   <li>the configuration must be able to model rewrites at all;
 *   <li>neither side may contain a {@code break} or {@code continue} outside a loop (this is the
 *       only failure that produces {@link Verdict.Status#REJECTED});
 *   <li>the original must have the shape that the candidate's pattern expects, with the branches
 *       that the pattern requires to terminate doing so;
 *   <li>no if-initializer identifier may be used outside its if, on either side, and the
 *       rewritten side may not move a declaring assignment into a different block;
 *   <li>the two sides must be equivalent according to {@link EquivalenceChecker}.
 * </ol>
 *
 * <p>{@link #check} never throws; every failure is reported as a Verdict.
 */
public final class SoundnessPolicy {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final AnalysisConfig config;

  public SoundnessPolicy(AnalysisConfig config) {
    this.config = config;
  }

  public SoundnessPolicy() {
    this(AnalysisConfig.DEFAULT);
  }

  public Verdict check(RewriteCandidate candidate) {
    Verdict verdict;
    try {
      verdict = checkStages(candidate);
    } catch (FragmentException e) {
      verdict = e.toVerdict();
    } catch (RuntimeException e) {
      // An unexpected failure is reported like any other, as a rewrite that can't be verified.
      logger.atWarning().withCause(e).log("Internal error checking %s", candidate);
      verdict = Verdict.unknown(Verdict.Reason.UNSUPPORTED_CONSTRUCT, "internal error: " + e);
    }
    logger.atFine().log("%s: %s", candidate, verdict);
    return verdict;
  }

  /** Checks each of the given candidates. */
  public BatchReport checkAll(Iterable<RewriteCandidate> candidates) {
    ImmutableList<RewriteCandidate> list = ImmutableList.copyOf(candidates);
    ImmutableList<Verdict> verdicts =
        list.stream().map(this::check).collect(ImmutableList.toImmutableList());
    BatchReport report = new BatchReport(list, verdicts);
    logger.atFine().log("%s", report.summary());
    return report;
  }

  private Verdict checkStages(RewriteCandidate candidate) {
    if (!config.enablesRewriteChecks()) {
      return Verdict.unknown(
          Verdict.Reason.MODE_DISABLED, "rewrite checks are not enabled by " + config);
    }
    if (!candidate.inLoop
        && (candidate.original.hasLoopTransfer() || candidate.rewritten.hasLoopTransfer())) {
      return Verdict.rejected(
          Verdict.Reason.MALFORMED_CONTROL_TRANSFER, "break or continue outside a loop");
    }
    Verdict shape = checkShape(candidate.pattern, candidate.original);
    if (shape != null) {
      return shape;
    }
    for (Fragment side : ImmutableList.of(candidate.original, candidate.rewritten)) {
      String violation = ScopeChecker.findViolation(side, candidate.visibleIdentifiers);
      if (violation != null) {
        return Verdict.unknown(Verdict.Reason.SCOPE_VIOLATION, violation);
      }
    }
    String moved = ScopeChecker.findMovedDeclaration(candidate.original, candidate.rewritten);
    if (moved != null) {
      return Verdict.unknown(Verdict.Reason.SCOPE_VIOLATION, moved);
    }
    EquivalenceChecker checker =
        new EquivalenceChecker(config.withInLoopContext(candidate.inLoop));
    return checker.check(candidate.original, candidate.rewritten, Environment.EMPTY);
  }

  /**
   * Returns a Verdict if {@code original} doesn't meet the preconditions of {@code pattern}, or
   * null if it does.
   */
  private static @Nullable Verdict checkShape(RewritePattern pattern, Fragment original) {
    if (pattern == RewritePattern.CUSTOM) {
      return null;
    }
    if (!(original instanceof Fragment.If ifFragment) || ifFragment.otherwise == null) {
      return Verdict.unknown(
          Verdict.Reason.UNSUPPORTED_CONSTRUCT, pattern + " requires an if with an else");
    }
    return switch (pattern) {
      case IF_ELSE_FLATTENING ->
          ifFragment.then.alwaysTerminates() ? null : nonTerminating("the if branch");
      case EARLY_RETURN_NORMALIZATION ->
          ifFragment.otherwise.alwaysTerminates() ? null : nonTerminating("the else branch");
      case ELSE_IF_CHAIN_FLATTENING -> checkChain(ifFragment);
      case CUSTOM -> null;
    };
  }

  private static @Nullable Verdict checkChain(Fragment.If head) {
    ImmutableList<Fragment.If> links = Rewrites.chain(head);
    for (int i = 0; i < links.size(); i++) {
      if (!links.get(i).then.alwaysTerminates()) {
        return nonTerminating("branch " + (i + 1) + " of the chain");
      }
    }
    Fragment last = links.get(links.size() - 1).otherwise;
    if (last != null && !last.alwaysTerminates()) {
      return nonTerminating("the final else");
    }
    return null;
  }

  private static Verdict nonTerminating(String which) {
    return Verdict.unknown(
        Verdict.Reason.NON_TERMINATING_BRANCH, which + " does not always terminate");
  }
}
