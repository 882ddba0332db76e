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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Set;
import org.flowcert.ast.Function;
import org.flowcert.ast.Stmt;
import org.flowcert.cfg.BasicBlock;
import org.flowcert.cfg.ControlFlowGraph;
import org.flowcert.logic.Fragment;
import org.flowcert.logic.FragmentException;
import org.flowcert.logic.FragmentTranslator;
import org.flowcert.logic.Verdict;
import org.flowcert.rewrite.RewriteCandidate;
import org.flowcert.rewrite.Rewrites;
import org.flowcert.rewrite.SoundnessPolicy;

/**
 * Reports an {@code else} that follows an if branch that always terminates, since its body could
 * follow the if instead. Each finding carries the flattening rewrite and the {@link
 * SoundnessPolicy}'s verdict on it. An else-if chain is reported once, at its head.
 */
public final class UnnecessaryElseRule implements Rule {
  public static final String ID = "unnecessary-else";

  private final SoundnessPolicy policy;

  public UnnecessaryElseRule(SoundnessPolicy policy) {
    this.policy = policy;
  }

  public UnnecessaryElseRule() {
    this(new SoundnessPolicy());
  }

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ImmutableList<Finding> check(Function function, ControlFlowGraph cfg) {
    // The ifs that are the else of another if; they are covered by the head of their chain.
    Set<Stmt> chained = Sets.newIdentityHashSet();
    for (BasicBlock block : cfg.reversePostorder()) {
      if (block.branch() instanceof Stmt.If ifStmt && ifStmt.otherwise instanceof Stmt.If next) {
        chained.add(next);
      }
    }
    ImmutableSet<String> visible = ImmutableSet.copyOf(function.params);
    ImmutableList.Builder<Finding> findings = ImmutableList.builder();
    for (BasicBlock block : cfg.reversePostorder()) {
      if (block.branch() instanceof Stmt.If ifStmt
          && ifStmt.otherwise != null
          && ifStmt.then.alwaysTerminates()
          && !chained.contains(ifStmt)) {
        findings.add(finding(ifStmt, visible, block.loopDepth > 0));
      }
    }
    return findings.build();
  }

  private Finding finding(Stmt.If ifStmt, ImmutableSet<String> visible, boolean inLoop) {
    Finding.Fix fix = null;
    String message = "unnecessary else: the if branch always terminates";
    try {
      Fragment.If original = FragmentTranslator.translateIf(ifStmt);
      RewriteCandidate candidate =
          (ifStmt.otherwise instanceof Stmt.If && original.alwaysTerminates())
              ? Rewrites.flattenElseIfChain(original, visible, inLoop)
              : Rewrites.flattenElse(original, visible, inLoop);
      Verdict verdict = policy.check(candidate);
      fix = new Finding.Fix(candidate, verdict);
    } catch (FragmentException e) {
      // Still worth reporting; there is just no fix that can be checked.
      message += " (" + e.getMessage() + ")";
    }
    return new Finding(ID, ifStmt.start, ifStmt.end, message, Severity.INFO, fix);
  }
}
