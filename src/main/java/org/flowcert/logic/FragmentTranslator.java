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
import org.flowcert.ast.Expr;
import org.flowcert.ast.Stmt;

/**
 * Translates statements from the syntax tree into {@link Fragment}s.
 *
 * <p>Loops, expression statements other than calls, and {@link Stmt.Unsupported} placeholders are
 * outside the fragment grammar; translating a statement that contains one throws a
 * FragmentException with reason {@link Verdict.Reason#UNSUPPORTED_CONSTRUCT}.
 */
public final class FragmentTranslator {

  private FragmentTranslator() {}

  public static Fragment translate(Stmt stmt) {
    return switch (stmt.kind()) {
      case BLOCK ->
          Fragment.seq(
              ((Stmt.Block) stmt)
                  .stmts.stream()
                      .map(FragmentTranslator::translate)
                      .collect(ImmutableList.toImmutableList()));
      case ASSIGN -> translateAssign((Stmt.Assign) stmt);
      case EXPR -> {
        Expr expr = ((Stmt.ExprStmt) stmt).expr;
        if (!(expr instanceof Expr.Call call)) {
          throw unsupported(stmt, "expression statement");
        }
        yield Fragment.call(call);
      }
      case IF -> translateIf((Stmt.If) stmt);
      case RETURN -> {
        Expr value = ((Stmt.Return) stmt).value;
        yield (value == null) ? Fragment.returnVoid() : Fragment.returnValue(value);
      }
      case BREAK -> Fragment.BREAK;
      case CONTINUE -> Fragment.CONTINUE;
      case LOOP -> throw unsupported(stmt, "loop");
      case UNSUPPORTED -> throw unsupported(stmt, ((Stmt.Unsupported) stmt).description);
    };
  }

  /** Translates an if statement, including any else-if chain. */
  public static Fragment.If translateIf(Stmt.If stmt) {
    return Fragment.ifInit(
        (stmt.init == null) ? null : translateAssign(stmt.init),
        stmt.cond,
        translate(stmt.then),
        (stmt.otherwise == null) ? null : translate(stmt.otherwise));
  }

  private static Fragment translateAssign(Stmt.Assign assign) {
    return assign.declares
        ? Fragment.declare(assign.name, assign.value)
        : Fragment.assign(assign.name, assign.value);
  }

  private static FragmentException unsupported(Stmt stmt, String what) {
    return new FragmentException(
        Verdict.Reason.UNSUPPORTED_CONSTRUCT, "%s at %s", what, stmt.start);
  }
}
