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

package org.flowcert.logic;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.Map;

/**
 * An immutable mapping from variable names to values. A variable with no binding has its input
 * value, {@link Value#input}; bindings to the input value are never stored, so two environments
 * are equal iff {@link #get} returns equal values for every name.
 */
@Immutable
public final class Environment {
  public static final Environment EMPTY = new Environment(ImmutableMap.of());

  private final ImmutableMap<String, Value> bindings;

  private Environment(ImmutableMap<String, Value> bindings) {
    this.bindings = bindings;
  }

  public static Environment of(Map<String, ? extends Value> bindings) {
    Environment result = EMPTY;
    for (Map.Entry<String, ? extends Value> entry : bindings.entrySet()) {
      result = result.with(entry.getKey(), entry.getValue());
    }
    return result;
  }

  public Value get(String name) {
    Value v = bindings.get(name);
    return (v != null) ? v : Value.input(name);
  }

  /** True if {@code name} has been bound to something other than its input value. */
  public boolean isBound(String name) {
    return bindings.containsKey(name);
  }

  public ImmutableSet<String> boundNames() {
    return bindings.keySet();
  }

  /** Returns an environment that differs from this one only in the value of {@code name}. */
  public Environment with(String name, Value value) {
    if (get(name).equals(value)) {
      return this;
    } else if (value.equals(Value.input(name))) {
      return without(name);
    }
    ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
    bindings.forEach(
        (k, v) -> {
          if (!k.equals(name)) {
            builder.put(k, v);
          }
        });
    builder.put(name, value);
    return new Environment(builder.buildOrThrow());
  }

  /** Returns an environment in which {@code name} has its input value. */
  public Environment without(String name) {
    if (!bindings.containsKey(name)) {
      return this;
    }
    ImmutableMap.Builder<String, Value> builder = ImmutableMap.builder();
    bindings.forEach(
        (k, v) -> {
          if (!k.equals(name)) {
            builder.put(k, v);
          }
        });
    return new Environment(builder.buildOrThrow());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Environment env && env.bindings.equals(bindings);
  }

  @Override
  public int hashCode() {
    return bindings.hashCode();
  }

  @Override
  public String toString() {
    return bindings.toString();
  }
}
