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

import org.flowcert.ast.Position;

/**
 * Decides whether a finding should be reported, e.g. by looking for a suppression comment that
 * covers its position. Resolving suppressions is the caller's business.
 */
@FunctionalInterface
public interface SuppressionOracle {
  SuppressionOracle NONE = (ruleId, position) -> false;

  boolean isSuppressed(String ruleId, Position position);
}
