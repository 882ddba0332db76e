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
import org.flowcert.ast.Expr;
import org.flowcert.ast.Expr.BinaryOp;
import org.flowcert.ast.Function;
import org.flowcert.ast.Stmt;
import org.flowcert.cfg.BasicBlock;
import org.flowcert.cfg.ControlFlowGraph;
import org.flowcert.cfg.Edge;
import org.flowcert.dataflow.AbstractState;
import org.flowcert.dataflow.Solution;
import org.flowcert.dataflow.Solver;
import org.flowcert.dataflow.Transfer;
import org.flowcert.dataflow.ValueKind;
import org.flowcert.dataflow.ZeroLattice;
import org.jspecify.annotations.Nullable;

/**
 * Reports {@code /} and {@code %} whose divisor is zero or might be. Tracks the {@link ValueKind}
 * of each variable through the function with {@link Solver}, narrowing it on branches that compare
 * a variable with zero.
 */
public final class DivisionByZeroRule implements Rule {
  public static final String ID = "division-by-zero";

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ImmutableList<Finding> check(Function function, ControlFlowGraph cfg) {
    Solution<AbstractState> solution =
        new Solver<>(ZeroLattice.INSTANCE, TRANSFER).solve(cfg, AbstractState.EMPTY);
    ImmutableList.Builder<Finding> findings = ImmutableList.builder();
    for (BasicBlock block : cfg.reversePostorder()) {
      AbstractState state = solution.in(block);
      for (Stmt stmt : block.stmts) {
        if (state == null) {
          break;
        }
        if (stmt instanceof Stmt.If ifStmt) {
          // The condition is evaluated after the initializer.
          if (ifStmt.init != null) {
            findDivisions(ifStmt.init.value, state, stmt, findings);
          }
          state = transfer(stmt, state);
          if (state != null) {
            findDivisions(ifStmt.cond, state, stmt, findings);
          }
        } else {
          for (Expr expr : exprs(stmt)) {
            findDivisions(expr, state, stmt, findings);
          }
          state = transfer(stmt, state);
        }
      }
    }
    return findings.build();
  }

  private static final Transfer<AbstractState> TRANSFER =
      new Transfer<>() {
        @Override
        public @Nullable AbstractState apply(BasicBlock block, AbstractState in) {
          AbstractState state = in;
          for (Stmt stmt : block.stmts) {
            state = transfer(stmt, state);
            if (state == null) {
              break;
            }
          }
          return state;
        }

        @Override
        public @Nullable AbstractState refine(BasicBlock origin, Edge edge, AbstractState out) {
          Stmt branch = origin.branch();
          Expr cond =
              (branch instanceof Stmt.If ifStmt)
                  ? ifStmt.cond
                  : (branch instanceof Stmt.Loop loop) ? loop.cond : null;
          return switch (edge.kind) {
            case TRUE_BRANCH -> (cond == null) ? out : refineForCondition(cond, true, out);
            case FALSE_BRANCH -> (cond == null) ? out : refineForCondition(cond, false, out);
            case UNCONDITIONAL, LOOP_BACK -> out;
          };
        }
      };

  /** Returns the expressions evaluated by a statement other than an if. */
  private static ImmutableList<Expr> exprs(Stmt stmt) {
    if (stmt instanceof Stmt.Assign assign) {
      return ImmutableList.of(assign.value);
    } else if (stmt instanceof Stmt.ExprStmt exprStmt) {
      return ImmutableList.of(exprStmt.expr);
    } else if (stmt instanceof Stmt.Return ret && ret.value != null) {
      return ImmutableList.of(ret.value);
    } else if (stmt instanceof Stmt.Loop loop && loop.cond != null) {
      return ImmutableList.of(loop.cond);
    }
    return ImmutableList.of();
  }

  /** Returns the state after {@code stmt}, or null if it can't complete. */
  private static @Nullable AbstractState transfer(Stmt stmt, AbstractState in) {
    if (stmt instanceof Stmt.Assign assign) {
      return in.with(assign.name, kindOf(assign.value, in));
    } else if (stmt instanceof Stmt.If ifStmt && ifStmt.init != null) {
      return in.with(ifStmt.init.name, kindOf(ifStmt.init.value, in));
    }
    return in;
  }

  /** Returns what is known about whether {@code expr} is zero. */
  static ValueKind kindOf(Expr expr, AbstractState state) {
    if (expr instanceof Expr.Literal lit) {
      return (lit.type == Expr.Literal.Type.INT)
          ? ValueKind.ofConstant((Long) lit.value)
          : ValueKind.TOP;
    } else if (expr instanceof Expr.Var v) {
      return state.get(v.name);
    } else if (expr instanceof Expr.Unary u && u.op == Expr.UnaryOp.NEG) {
      return kindOf(u.operand, state);
    } else if (expr instanceof Expr.Binary b && b.op.isArithmetic()) {
      return combine(b.op, kindOf(b.left, state), kindOf(b.right, state));
    }
    return ValueKind.TOP;
  }

  /** Returns the kind of {@code left op right}; monotone in both arguments. */
  private static ValueKind combine(BinaryOp op, ValueKind left, ValueKind right) {
    if (left == ValueKind.BOTTOM || right == ValueKind.BOTTOM) {
      return ValueKind.BOTTOM;
    } else if (left == ValueKind.TOP || right == ValueKind.TOP) {
      return ValueKind.TOP;
    }
    return switch (op) {
      case MUL -> {
        if (left == ValueKind.ZERO || right == ValueKind.ZERO) {
          yield ValueKind.ZERO;
        }
        yield (left == ValueKind.NON_ZERO && right == ValueKind.NON_ZERO)
            ? ValueKind.NON_ZERO
            : ValueKind.MAYBE_ZERO;
      }
      case ADD, SUB -> {
        if (left == ValueKind.ZERO) {
          yield right;
        } else if (right == ValueKind.ZERO) {
          yield left;
        }
        yield ValueKind.MAYBE_ZERO;
      }
      // The result of dividing by something that may be zero is unknown.
      case DIV, MOD -> (right == ValueKind.NON_ZERO) ? ValueKind.MAYBE_ZERO : ValueKind.TOP;
      default -> ValueKind.TOP;
    };
  }

  /**
   * Narrows {@code state} on the edge where {@code cond} is {@code taken}. Only conditions that
   * compare a variable with zero are understood.
   */
  private static @Nullable AbstractState refineForCondition(
      Expr cond, boolean taken, AbstractState state) {
    while (cond instanceof Expr.Unary u && u.op == Expr.UnaryOp.NOT) {
      cond = u.operand;
      taken = !taken;
    }
    if (!(cond instanceof Expr.Binary b)) {
      return state;
    }
    String name;
    BinaryOp op;
    if (b.left instanceof Expr.Var v && isZero(b.right)) {
      name = v.name;
      op = b.op;
    } else if (b.right instanceof Expr.Var v && isZero(b.left)) {
      name = v.name;
      op = flip(b.op);
    } else {
      return state;
    }
    ValueKind constraint =
        switch (op) {
          case EQ -> taken ? ValueKind.ZERO : ValueKind.NON_ZERO;
          case NEQ -> taken ? ValueKind.NON_ZERO : ValueKind.ZERO;
          case GT, LT -> taken ? ValueKind.NON_ZERO : ValueKind.MAYBE_ZERO;
          case GTE, LTE -> taken ? ValueKind.MAYBE_ZERO : ValueKind.NON_ZERO;
          default -> ValueKind.TOP;
        };
    return state.refine(name, constraint);
  }

  private static boolean isZero(Expr expr) {
    if (expr instanceof Expr.Unary u && u.op == Expr.UnaryOp.NEG) {
      return isZero(u.operand);
    }
    return expr instanceof Expr.Literal lit
        && lit.type == Expr.Literal.Type.INT
        && (Long) lit.value == 0;
  }

  /** Returns the operator that gives the same result with the operands swapped. */
  private static BinaryOp flip(BinaryOp op) {
    return switch (op) {
      case LT -> BinaryOp.GT;
      case GT -> BinaryOp.LT;
      case LTE -> BinaryOp.GTE;
      case GTE -> BinaryOp.LTE;
      default -> op;
    };
  }

  private static void findDivisions(
      Expr expr, AbstractState state, Stmt stmt, ImmutableList.Builder<Finding> findings) {
    expr.anyNode(
        e -> {
          if (e instanceof Expr.Binary b && (b.op == BinaryOp.DIV || b.op == BinaryOp.MOD)) {
            ValueKind divisor = kindOf(b.right, state);
            String reason = null;
            Severity severity = null;
            if (divisor == ValueKind.ZERO) {
              reason = "divisor is definitely zero";
              severity = Severity.ERROR;
            } else if (divisor == ValueKind.MAYBE_ZERO || divisor == ValueKind.TOP) {
              reason = "divisor may be zero (" + divisor + ")";
              severity = Severity.WARNING;
            }
            if (reason != null) {
              findings.add(
                  new Finding(
                      ID,
                      stmt.start,
                      stmt.end,
                      "possible division by zero in " + b + ": " + reason,
                      severity));
            }
          }
          return false;
        });
  }
}
