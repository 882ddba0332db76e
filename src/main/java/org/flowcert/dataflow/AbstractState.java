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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.Immutable;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An immutable map from variable names to {@link ValueKind}s. Variables that are not in the map
 * are {@link ValueKind#TOP}; TOP is never stored, so two states are equal iff they map every
 * variable to the same kind. Unreachable code is represented by a null state rather than by an
 * AbstractState.
 */
@Immutable
public final class AbstractState {
  public static final AbstractState EMPTY = new AbstractState(ImmutableMap.of());

  private final ImmutableMap<String, ValueKind> kinds;

  private AbstractState(ImmutableMap<String, ValueKind> kinds) {
    this.kinds = kinds;
  }

  /** Returns a state with the given entries; entries mapped to TOP are dropped. */
  public static AbstractState of(Map<String, ValueKind> kinds) {
    ImmutableMap.Builder<String, ValueKind> builder = ImmutableMap.builder();
    kinds.forEach(
        (k, v) -> {
          Preconditions.checkArgument(v != ValueKind.BOTTOM, "%s is BOTTOM", k);
          if (v != ValueKind.TOP) {
            builder.put(k, v);
          }
        });
    return new AbstractState(builder.buildOrThrow());
  }

  public ValueKind get(String name) {
    return kinds.getOrDefault(name, ValueKind.TOP);
  }

  public int size() {
    return kinds.size();
  }

  /**
   * Returns a state that differs from this one only in the kind of {@code name}. Setting a
   * variable to BOTTOM makes the whole state unreachable, so in that case this returns null.
   */
  public @Nullable AbstractState with(String name, ValueKind kind) {
    if (kind == ValueKind.BOTTOM) {
      return null;
    } else if (get(name) == kind) {
      return this;
    }
    ImmutableMap.Builder<String, ValueKind> builder = ImmutableMap.builder();
    kinds.forEach(
        (k, v) -> {
          if (!k.equals(name)) {
            builder.put(k, v);
          }
        });
    if (kind != ValueKind.TOP) {
      builder.put(name, kind);
    }
    return new AbstractState(builder.buildOrThrow());
  }

  /** Returns this state with {@code name} narrowed by {@code constraint}, or null if infeasible. */
  public @Nullable AbstractState refine(String name, ValueKind constraint) {
    return with(name, get(name).meet(constraint));
  }

  /** Joins two states; null (unreachable) is the identity. */
  public static @Nullable AbstractState join(@Nullable AbstractState a, @Nullable AbstractState b) {
    if (a == null) {
      return b;
    } else if (b == null || a.equals(b)) {
      return a;
    }
    // A variable missing from either side is TOP in the result, so only common keys survive.
    ImmutableMap.Builder<String, ValueKind> builder = ImmutableMap.builder();
    for (String name : Sets.intersection(a.kinds.keySet(), b.kinds.keySet())) {
      ValueKind joined = a.get(name).join(b.get(name));
      if (joined != ValueKind.TOP) {
        builder.put(name, joined);
      }
    }
    return new AbstractState(builder.buildOrThrow());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof AbstractState other && other.kinds.equals(kinds);
  }

  @Override
  public int hashCode() {
    return kinds.hashCode();
  }

  @Override
  public String toString() {
    return kinds.toString();
  }
}
