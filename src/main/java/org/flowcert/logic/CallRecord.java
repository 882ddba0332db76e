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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.stream.Collectors;

/** One opaque call made during evaluation: the callee and the values of its arguments. */
@Immutable
public final class CallRecord {
  public final String function;
  public final ImmutableList<Value> args;

  public CallRecord(String function, ImmutableList<Value> args) {
    this.function = function;
    this.args = args;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CallRecord c && c.function.equals(function) && c.args.equals(args);
  }

  @Override
  public int hashCode() {
    return function.hashCode() * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    return args.stream()
        .map(String::valueOf)
        .collect(Collectors.joining(", ", function + "(", ")"));
  }
}
