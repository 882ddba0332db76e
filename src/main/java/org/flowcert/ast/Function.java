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

package org.flowcert.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/** A function declaration: the unit that the CFG builder and the lint rules work on. */
@Immutable
public final class Function {
  public final String name;
  public final ImmutableList<String> params;
  public final Stmt.Block body;

  public Function(String name, ImmutableList<String> params, Stmt.Block body) {
    Preconditions.checkArgument(!name.isEmpty());
    this.name = name;
    this.params = params;
    this.body = Preconditions.checkNotNull(body);
  }

  public static Function of(String name, Stmt.Block body, String... params) {
    return new Function(name, ImmutableList.copyOf(params), body);
  }

  @Override
  public String toString() {
    return "func " + name + "(" + String.join(", ", params) + ") " + body;
  }
}
