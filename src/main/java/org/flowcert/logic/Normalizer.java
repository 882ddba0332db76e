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

import org.flowcert.ast.Expr;
import org.flowcert.ast.Expr.UnaryOp;

/**
 * Simplifies fragments without changing their meaning: folds operators applied to literals,
 * removes double negation, replaces an if whose condition is a literal (and which has no
 * initializer) by the branch it selects, and drops no-ops from sequences. Calls are never removed
 * or reordered.
 */
public final class Normalizer {

  private Normalizer() {}

  public static Fragment normalize(Fragment fragment) {
    return switch (fragment.kind()) {
      case ASSIGN -> {
        Fragment.Assign assign = (Fragment.Assign) fragment;
        yield Fragment.assign(assign.name, normalize(assign.value));
      }
      case DECLARE -> {
        Fragment.Declare declare = (Fragment.Declare) fragment;
        yield Fragment.declare(declare.name, normalize(declare.value));
      }
      case SEQ -> {
        Fragment.Seq seq = (Fragment.Seq) fragment;
        Fragment first = normalize(seq.first);
        Fragment second = normalize(seq.second);
        if (first == Fragment.NOOP) {
          yield second;
        } else if (second == Fragment.NOOP) {
          yield first;
        }
        yield Fragment.seq(first, second);
      }
      case IF -> normalizeIf((Fragment.If) fragment);
      case RETURN -> {
        Expr value = ((Fragment.Return) fragment).value;
        yield (value == null) ? fragment : Fragment.returnValue(normalize(value));
      }
      case CALL -> Fragment.call((Expr.Call) normalize(((Fragment.Call) fragment).call));
      case BREAK, CONTINUE, NOOP -> fragment;
    };
  }

  private static Fragment normalizeIf(Fragment.If ifFragment) {
    Fragment init = (ifFragment.init == null) ? null : normalize(ifFragment.init);
    Expr cond = normalize(ifFragment.cond);
    Fragment then = normalize(ifFragment.then);
    Fragment otherwise = (ifFragment.otherwise == null) ? null : normalize(ifFragment.otherwise);
    if (otherwise == Fragment.NOOP) {
      otherwise = null;
    }
    if (init == null && cond instanceof Expr.Literal lit && lit.type == Expr.Literal.Type.BOOL) {
      if ((Boolean) lit.value) {
        return then;
      }
      return (otherwise == null) ? Fragment.NOOP : otherwise;
    }
    return Fragment.ifInit(init, cond, then, otherwise);
  }

  /** Returns a simplified version of {@code expr}. */
  public static Expr normalize(Expr expr) {
    return switch (expr.kind()) {
      case LITERAL, VAR -> expr;
      case UNARY -> {
        Expr.Unary unary = (Expr.Unary) expr;
        Expr operand = normalize(unary.operand);
        if (unary.op == UnaryOp.NOT && operand instanceof Expr.Unary inner) {
          if (inner.op == UnaryOp.NOT) {
            yield inner.operand;
          }
        }
        if (operand instanceof Expr.Literal lit) {
          Value folded = Operations.fold(unary.op, Value.of(lit));
          if (folded != null) {
            yield folded.toTerm();
          }
        }
        yield Expr.unary(unary.op, operand);
      }
      case BINARY -> {
        Expr.Binary binary = (Expr.Binary) expr;
        Expr left = normalize(binary.left);
        Expr right = normalize(binary.right);
        if (left instanceof Expr.Literal l && right instanceof Expr.Literal r) {
          Value folded = Operations.fold(binary.op, Value.of(l), Value.of(r));
          if (folded != null) {
            yield folded.toTerm();
          }
        }
        yield Expr.binary(binary.op, left, right);
      }
      case CALL -> {
        Expr.Call call = (Expr.Call) expr;
        yield Expr.call(
            call.function, call.args.stream().map(Normalizer::normalize).toArray(Expr[]::new));
      }
    };
  }
}
