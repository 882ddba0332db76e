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

import org.flowcert.ast.Expr.BinaryOp;
import org.flowcert.ast.Expr.UnaryOp;
import org.jspecify.annotations.Nullable;

/**
 * Constant folding of the operators on concrete values, shared by the {@link Evaluator} and the
 * {@link Normalizer}. Integer arithmetic wraps on overflow.
 */
final class Operations {

  private Operations() {}

  /**
   * Returns the result of applying {@code op} to two concrete values, or null if it cannot be
   * computed (an operand is symbolic, the operand types don't match the operator, or the operation
   * is a division by zero).
   */
  static @Nullable Value fold(BinaryOp op, Value left, Value right) {
    if (left.isSymbolic() || right.isSymbolic()) {
      return null;
    }
    switch (op) {
      case EQ:
        return Value.of(left.equals(right));
      case NEQ:
        return Value.of(!left.equals(right));
      case AND:
      case OR:
        if (left instanceof Value.Bool l && right instanceof Value.Bool r) {
          return Value.of((op == BinaryOp.AND) ? (l.value && r.value) : (l.value || r.value));
        }
        return null;
      case ADD:
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
          return Value.of(l.value + r.value);
        }
        break;
      case LT:
      case LTE:
      case GT:
      case GTE:
        if (left instanceof Value.Str l && right instanceof Value.Str r) {
          return compare(op, l.value.compareTo(r.value));
        }
        break;
      default:
        break;
    }
    if (!(left instanceof Value.Int l && right instanceof Value.Int r)) {
      return null;
    }
    long x = l.value;
    long y = r.value;
    return switch (op) {
      case ADD -> Value.of(x + y);
      case SUB -> Value.of(x - y);
      case MUL -> Value.of(x * y);
      case DIV -> (y == 0) ? null : Value.of(x / y);
      case MOD -> (y == 0) ? null : Value.of(x % y);
      case LT, LTE, GT, GTE -> compare(op, Long.compare(x, y));
      case EQ, NEQ, AND, OR -> throw new AssertionError();
    };
  }

  private static Value compare(BinaryOp op, int cmp) {
    return Value.of(
        switch (op) {
          case LT -> cmp < 0;
          case LTE -> cmp <= 0;
          case GT -> cmp > 0;
          case GTE -> cmp >= 0;
          default -> throw new AssertionError(op);
        });
  }

  /** Returns the result of applying {@code op} to a concrete value, or null. */
  static @Nullable Value fold(UnaryOp op, Value operand) {
    if (op == UnaryOp.NOT && operand instanceof Value.Bool b) {
      return Value.of(!b.value);
    } else if (op == UnaryOp.NEG && operand instanceof Value.Int i) {
      return Value.of(-i.value);
    }
    return null;
  }

  /**
   * Returns the truth value of a concrete condition. Non-boolean values follow the usual
   * conventions (zero, the empty string and nil are false).
   */
  static boolean isTruthy(Value value) {
    if (value instanceof Value.Bool b) {
      return b.value;
    } else if (value instanceof Value.Int i) {
      return i.value != 0;
    } else if (value instanceof Value.Str s) {
      return !s.value.isEmpty();
    }
    assert value instanceof Value.Nil;
    return false;
  }
}
