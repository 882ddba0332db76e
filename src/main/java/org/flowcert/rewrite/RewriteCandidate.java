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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.flowcert.logic.Fragment;

/** A proposed rewrite of {@code original} into {@code rewritten}. */
@Immutable
public final class RewriteCandidate {
  public final RewritePattern pattern;
  public final Fragment original;
  public final Fragment rewritten;

  /** The names visible in the scope enclosing the fragment. */
  public final ImmutableSet<String> visibleIdentifiers;

  /** True if the fragment is inside a loop, where {@code break} and {@code continue} are legal. */
  public final boolean inLoop;

  public RewriteCandidate(
      RewritePattern pattern,
      Fragment original,
      Fragment rewritten,
      ImmutableSet<String> visibleIdentifiers,
      boolean inLoop) {
    this.pattern = Preconditions.checkNotNull(pattern);
    this.original = Preconditions.checkNotNull(original);
    this.rewritten = Preconditions.checkNotNull(rewritten);
    this.visibleIdentifiers = Preconditions.checkNotNull(visibleIdentifiers);
    this.inLoop = inLoop;
  }

  public static RewriteCandidate of(RewritePattern pattern, Fragment original, Fragment rewritten) {
    return new RewriteCandidate(pattern, original, rewritten, ImmutableSet.of(), false);
  }

  public RewriteCandidate withVisibleIdentifiers(ImmutableSet<String> names) {
    return new RewriteCandidate(pattern, original, rewritten, names, inLoop);
  }

  public RewriteCandidate withInLoop(boolean inLoop) {
    return new RewriteCandidate(pattern, original, rewritten, visibleIdentifiers, inLoop);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RewriteCandidate c
        && c.pattern == pattern
        && c.original.equals(original)
        && c.rewritten.equals(rewritten)
        && c.visibleIdentifiers.equals(visibleIdentifiers)
        && c.inLoop == inLoop;
  }

  @Override
  public int hashCode() {
    return Objects.hash(pattern, original, rewritten, visibleIdentifiers, inLoop);
  }

  @Override
  public String toString() {
    return pattern + ": " + original + " => " + rewritten;
  }
}
