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

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/** The lattice of {@link AbstractState}s, ordered pointwise by {@link ValueKind}. */
public final class ZeroLattice implements Lattice<AbstractState> {
  public static final ZeroLattice INSTANCE = new ZeroLattice();

  private ZeroLattice() {}

  /**
   * Returns the number of times a state over {@code numVariables} variables can strictly rise:
   * once from null (unreachable) to some state, then at most twice per variable (from ZERO or
   * NON_ZERO to MAYBE_ZERO, and from there to TOP).
   */
  public static int height(int numVariables) {
    return 1 + (ValueKind.HEIGHT - 2) * numVariables;
  }

  @Override
  public @Nullable AbstractState join(@Nullable AbstractState a, @Nullable AbstractState b) {
    return AbstractState.join(a, b);
  }

  @Override
  public boolean isEquivalent(@Nullable AbstractState a, @Nullable AbstractState b) {
    return Objects.equals(a, b);
  }
}
