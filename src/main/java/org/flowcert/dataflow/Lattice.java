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

package org.flowcert.dataflow;

import org.jspecify.annotations.Nullable;

/**
 * A join-semilattice of abstract states with finite height. A null state is the bottom element,
 * representing code that cannot be reached; implementations must accept null arguments.
 */
public interface Lattice<S> {

  /** Returns the least upper bound of {@code a} and {@code b}. */
  @Nullable S join(@Nullable S a, @Nullable S b);

  /** Returns true if {@code a} and {@code b} represent the same set of concrete states. */
  boolean isEquivalent(@Nullable S a, @Nullable S b);

  /** Returns true if {@code a} is at or below {@code b}. */
  default boolean isLessOrEqual(@Nullable S a, @Nullable S b) {
    return isEquivalent(join(a, b), b);
  }
}
