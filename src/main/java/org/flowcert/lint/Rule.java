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

import com.google.common.collect.ImmutableList;
import org.flowcert.ast.Function;
import org.flowcert.cfg.ControlFlowGraph;

/** A lint check that runs over one function at a time. */
public interface Rule {

  /** A short, stable identifier such as {@code "division-by-zero"}. */
  String id();

  /**
   * Returns the issues found in {@code function}, whose control-flow graph is {@code cfg}.
   * Implementations must not retain state between calls.
   */
  ImmutableList<Finding> check(Function function, ControlFlowGraph cfg);
}
