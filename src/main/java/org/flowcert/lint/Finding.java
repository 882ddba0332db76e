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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Comparator;
import org.flowcert.ast.Position;
import org.flowcert.logic.Verdict;
import org.flowcert.rewrite.RewriteCandidate;
import org.jspecify.annotations.Nullable;

/** An issue reported by a {@link Rule}, optionally with a proposed fix. */
@Immutable
public final class Finding {

  /** Orders findings by position, then by rule. */
  public static final Comparator<Finding> ORDER =
      Comparator.comparing((Finding f) -> f.start)
          .thenComparing(f -> f.end)
          .thenComparing(f -> f.ruleId);

  /**
   * A rewrite that would resolve a finding, and whether it is sound. An external fixer should
   * only apply it without asking if {@link #isAutoApplicable} is true.
   */
  @Immutable
  public static final class Fix {
    public final RewriteCandidate candidate;
    public final Verdict verdict;

    public Fix(RewriteCandidate candidate, Verdict verdict) {
      this.candidate = Preconditions.checkNotNull(candidate);
      this.verdict = Preconditions.checkNotNull(verdict);
    }

    public boolean isAutoApplicable() {
      return verdict.isVerified();
    }

    @Override
    public String toString() {
      return candidate + " (" + verdict + ")";
    }
  }

  public final String ruleId;
  public final Position start;
  public final Position end;
  public final String message;
  public final Severity severity;
  public final @Nullable Fix fix;

  public Finding(
      String ruleId,
      Position start,
      Position end,
      String message,
      Severity severity,
      @Nullable Fix fix) {
    Preconditions.checkArgument(!ruleId.isEmpty());
    this.ruleId = ruleId;
    this.start = Preconditions.checkNotNull(start);
    this.end = Preconditions.checkNotNull(end);
    this.message = Preconditions.checkNotNull(message);
    this.severity = Preconditions.checkNotNull(severity);
    this.fix = fix;
  }

  public Finding(String ruleId, Position start, Position end, String message, Severity severity) {
    this(ruleId, start, end, message, severity, null);
  }

  @Override
  public String toString() {
    return String.format("%s %s [%s] %s", start, severity, ruleId, message);
  }
}
