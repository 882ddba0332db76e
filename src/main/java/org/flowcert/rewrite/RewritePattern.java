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

/** The rewrites that {@link SoundnessPolicy} knows the preconditions of. */
public enum RewritePattern {
  /** {@code if c {S1} else {S2}} to {@code if c {S1}; S2}, where S1 always terminates. */
  IF_ELSE_FLATTENING,

  /** {@code if c {S} else {T}} to {@code if !c {T}; S}, where T always terminates. */
  EARLY_RETURN_NORMALIZATION,

  /**
   * {@code if c1 {t1} else if c2 {t2} else {t3}} to {@code if c1 {t1}; if c2 {t2}; t3}, where
   * every branch always terminates.
   */
  ELSE_IF_CHAIN_FLATTENING,

  /** Any other rewrite; only equivalence is checked. */
  CUSTOM
}
