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
import com.google.errorprone.annotations.Immutable;
import org.flowcert.logic.Verdict;

/** The verdicts for a batch of candidates, in the order the candidates were checked. */
@Immutable
public final class BatchReport {
  public final ImmutableList<RewriteCandidate> candidates;
  public final ImmutableList<Verdict> verdicts;

  public BatchReport(ImmutableList<RewriteCandidate> candidates, ImmutableList<Verdict> verdicts) {
    Preconditions.checkArgument(candidates.size() == verdicts.size());
    this.candidates = candidates;
    this.verdicts = verdicts;
  }

  public int size() {
    return verdicts.size();
  }

  public int count(Verdict.Status status) {
    return (int) verdicts.stream().filter(v -> v.status == status).count();
  }

  public int verified() {
    return count(Verdict.Status.VERIFIED);
  }

  public int unknown() {
    return count(Verdict.Status.UNKNOWN);
  }

  public int rejected() {
    return count(Verdict.Status.REJECTED);
  }

  /** Returns the candidates that may be applied automatically. */
  public ImmutableList<RewriteCandidate> applicable() {
    ImmutableList.Builder<RewriteCandidate> result = ImmutableList.builder();
    for (int i = 0; i < verdicts.size(); i++) {
      if (verdicts.get(i).isVerified()) {
        result.add(candidates.get(i));
      }
    }
    return result.build();
  }

  public String summary() {
    return String.format(
        "Checked %d candidates: %d verified, %d unknown, %d rejected",
        size(), verified(), unknown(), rejected());
  }

  @Override
  public String toString() {
    return summary();
  }
}
