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

package org.flowcert.cfg;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * A directed connection between two blocks of a {@link ControlFlowGraph}. Blocks are identified by
 * their index in the graph rather than by reference, so loop back-edges do not create reference
 * cycles.
 */
@Immutable
public final class Edge {

  /** Why control flows along an edge. */
  public enum Kind {
    /** Falls through or jumps unconditionally. */
    UNCONDITIONAL("→"),
    /** Taken when the origin block's condition is true. */
    TRUE_BRANCH("T:"),
    /** Taken when the origin block's condition is false. */
    FALSE_BRANCH("F:"),
    /** Returns to an enclosing loop header (from the end of the body, or a {@code continue}). */
    LOOP_BACK("↺");

    final String label;

    Kind(String label) {
      this.label = label;
    }
  }

  /** The index of the block that control leaves. */
  public final int origin;

  /** The index of the block that control enters. */
  public final int target;

  public final Kind kind;

  public Edge(int origin, int target, Kind kind) {
    Preconditions.checkArgument(origin >= 0 && target >= 0);
    this.origin = origin;
    this.target = target;
    this.kind = Preconditions.checkNotNull(kind);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Edge e && e.origin == origin && e.target == target && e.kind == kind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(origin, target, kind);
  }

  @Override
  public String toString() {
    return kind.label + " B" + target;
  }
}
