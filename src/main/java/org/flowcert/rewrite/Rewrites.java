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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import org.flowcert.ast.Expr;
import org.flowcert.logic.Fragment;

/** Builds the rewritten form of a fragment for each of the catalogued {@link RewritePattern}s. */
public final class Rewrites {

  private Rewrites() {}

  /** {@code if c {S1} else {S2}} becomes {@code if c {S1}; S2}. */
  public static RewriteCandidate flattenElse(
      Fragment.If original, ImmutableSet<String> visible, boolean inLoop) {
    Preconditions.checkArgument(original.otherwise != null, "no else: %s", original);
    Fragment rewritten =
        Fragment.seq(
            Fragment.ifInit(original.init, original.cond, original.then, null),
            original.otherwise);
    return new RewriteCandidate(
        RewritePattern.IF_ELSE_FLATTENING, original, rewritten, visible, inLoop);
  }

  /** {@code if c {S} else {T}} becomes {@code if !c {T}; S}. */
  public static RewriteCandidate invertEarlyReturn(
      Fragment.If original, ImmutableSet<String> visible, boolean inLoop) {
    Preconditions.checkArgument(original.otherwise != null, "no else: %s", original);
    Fragment rewritten =
        Fragment.seq(
            Fragment.ifInit(original.init, negate(original.cond), original.otherwise, null),
            original.then);
    return new RewriteCandidate(
        RewritePattern.EARLY_RETURN_NORMALIZATION, original, rewritten, visible, inLoop);
  }

  /**
   * {@code if c1 {t1} else if c2 {t2} else {t3}} becomes {@code if c1 {t1}; if c2 {t2}; t3}. Each
   * link in the chain keeps its own initializer.
   */
  public static RewriteCandidate flattenElseIfChain(
      Fragment.If original, ImmutableSet<String> visible, boolean inLoop) {
    ImmutableList<Fragment.If> links = chain(original);
    ImmutableList.Builder<Fragment> flat = ImmutableList.builder();
    for (Fragment.If link : links) {
      flat.add(Fragment.ifInit(link.init, link.cond, link.then, null));
    }
    Fragment last = Iterables.getLast(links).otherwise;
    if (last != null) {
      flat.add(last);
    }
    return new RewriteCandidate(
        RewritePattern.ELSE_IF_CHAIN_FLATTENING,
        original,
        Fragment.seq(flat.build()),
        visible,
        inLoop);
  }

  /** Returns the links of an else-if chain, starting with {@code head}. */
  static ImmutableList<Fragment.If> chain(Fragment.If head) {
    ImmutableList.Builder<Fragment.If> result = ImmutableList.builder();
    Fragment link = head;
    while (link instanceof Fragment.If ifLink) {
      result.add(ifLink);
      link = ifLink.otherwise;
    }
    return result.build();
  }

  private static Expr negate(Expr cond) {
    return (cond instanceof Expr.Unary u && u.op == Expr.UnaryOp.NOT) ? u.operand : Expr.not(cond);
  }
}
