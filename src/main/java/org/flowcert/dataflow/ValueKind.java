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

/**
 * What is known about whether an integer value is zero. The ordering is
 *
 * <pre>
 *            TOP
 *             |
 *         MAYBE_ZERO
 *          /      \
 *       ZERO    NON_ZERO
 *          \      /
 *           BOTTOM
 * </pre>
 *
 * <p>BOTTOM describes a value that cannot exist (unreachable code); TOP a value about which nothing
 * is known, not even that it is an integer.
 */
public enum ValueKind {
  BOTTOM,
  ZERO,
  NON_ZERO,
  MAYBE_ZERO,
  TOP;

  /** The number of levels in the ordering, counting BOTTOM. */
  public static final int HEIGHT = 4;

  /** Returns the least upper bound of this and {@code other}. */
  public ValueKind join(ValueKind other) {
    if (this == other || other == BOTTOM) {
      return this;
    } else if (this == BOTTOM) {
      return other;
    } else if (this == TOP || other == TOP) {
      return TOP;
    }
    // Any two distinct elements from {ZERO, NON_ZERO, MAYBE_ZERO}.
    return MAYBE_ZERO;
  }

  /** Returns the greatest lower bound of this and {@code other}. */
  public ValueKind meet(ValueKind other) {
    if (this == other || other == TOP) {
      return this;
    } else if (this == TOP) {
      return other;
    } else if (this == BOTTOM || other == BOTTOM) {
      return BOTTOM;
    } else if (this == MAYBE_ZERO) {
      return other;
    } else if (other == MAYBE_ZERO) {
      return this;
    }
    // ZERO and NON_ZERO
    return BOTTOM;
  }

  public boolean isLessOrEqual(ValueKind other) {
    return join(other) == other;
  }

  /** True if a value of this kind might be zero. */
  public boolean mayBeZero() {
    return this == ZERO || this == MAYBE_ZERO || this == TOP;
  }

  public static ValueKind ofConstant(long value) {
    return (value == 0) ? ZERO : NON_ZERO;
  }
}
