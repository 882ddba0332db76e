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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import org.flowcert.ast.Function;
import org.flowcert.cfg.CfgBuilder;
import org.flowcert.cfg.ControlFlowGraph;

/** Runs a set of rules over functions and collects the findings that are not suppressed. */
public final class Linter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableList<Rule> rules;
  private final SuppressionOracle suppressions;

  public Linter(ImmutableList<Rule> rules, SuppressionOracle suppressions) {
    this.rules = rules;
    this.suppressions = suppressions;
  }

  public Linter(Rule... rules) {
    this(ImmutableList.copyOf(rules), SuppressionOracle.NONE);
  }

  /** Returns the findings for {@code function}, ordered by position. */
  public ImmutableList<Finding> lint(Function function) {
    ControlFlowGraph cfg = CfgBuilder.build(function.body);
    ImmutableList.Builder<Finding> result = ImmutableList.builder();
    int suppressed = 0;
    for (Rule rule : rules) {
      for (Finding finding : rule.check(function, cfg)) {
        if (suppressions.isSuppressed(finding.ruleId, finding.start)) {
          ++suppressed;
        } else {
          result.add(finding);
        }
      }
    }
    ImmutableList<Finding> findings = ImmutableList.sortedCopyOf(Finding.ORDER, result.build());
    logger.atFine().log(
        "%s: %d findings (%d suppressed)", function.name, findings.size(), suppressed);
    return findings;
  }
}
