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
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A statement in the restricted grammar, as handed to the core by the syntax tree adapter. Each
 * statement records the positions of its first and last characters; statements built
 * programmatically (e.g. by a rewrite) have {@link Position#NONE}.
 *
 * <p>Statements use identity equality. Code that compares statements semantically should
 * translate them to {@code Fragment}s first.
 */
@Immutable
public abstract sealed class Stmt {

  /** The kinds of Stmt, one for each subclass. */
  public enum Kind {
    BLOCK,
    ASSIGN,
    EXPR,
    IF,
    RETURN,
    BREAK,
    CONTINUE,
    LOOP,
    UNSUPPORTED
  }

  public final Position start;
  public final Position end;

  private Stmt(Position start, Position end) {
    this.start = Preconditions.checkNotNull(start);
    this.end = Preconditions.checkNotNull(end);
  }

  public abstract Kind kind();

  /** Returns a copy of this statement with the given source span. */
  public abstract Stmt withSpan(Position start, Position end);

  /**
   * True if control can never fall off the end of this statement, i.e. every path through it ends
   * in a {@code return}, {@code break} or {@code continue}. Loops are never considered to
   * terminate (a {@code break} inside one only leaves the loop).
   */
  public boolean alwaysTerminates() {
    return false;
  }

  public static Block block(Stmt... stmts) {
    return new Block(ImmutableList.copyOf(stmts), Position.NONE, Position.NONE);
  }

  public static Block block(ImmutableList<Stmt> stmts) {
    return new Block(stmts, Position.NONE, Position.NONE);
  }

  public static Assign assign(String name, Expr value) {
    return new Assign(name, value, false, Position.NONE, Position.NONE);
  }

  /** {@code name := value} */
  public static Assign declare(String name, Expr value) {
    return new Assign(name, value, true, Position.NONE, Position.NONE);
  }

  public static ExprStmt expr(Expr expr) {
    return new ExprStmt(expr, Position.NONE, Position.NONE);
  }

  public static If ifThen(Expr cond, Block then) {
    return new If(null, cond, then, null, Position.NONE, Position.NONE);
  }

  public static If ifElse(Expr cond, Block then, Stmt otherwise) {
    return new If(null, cond, then, otherwise, Position.NONE, Position.NONE);
  }

  public static If ifInit(@Nullable Assign init, Expr cond, Block then, @Nullable Stmt otherwise) {
    return new If(init, cond, then, otherwise, Position.NONE, Position.NONE);
  }

  public static Return returnValue(Expr value) {
    return new Return(value, Position.NONE, Position.NONE);
  }

  public static Return returnVoid() {
    return new Return(null, Position.NONE, Position.NONE);
  }

  public static Break breakStmt() {
    return new Break(Position.NONE, Position.NONE);
  }

  public static Continue continueStmt() {
    return new Continue(Position.NONE, Position.NONE);
  }

  public static Loop loop(@Nullable Expr cond, Block body) {
    return new Loop(cond, body, Position.NONE, Position.NONE);
  }

  public static Unsupported unsupported(String description) {
    return new Unsupported(description, Position.NONE, Position.NONE);
  }

  /** A braced sequence of statements. */
  public static final class Block extends Stmt {
    public final ImmutableList<Stmt> stmts;

    private Block(ImmutableList<Stmt> stmts, Position start, Position end) {
      super(start, end);
      this.stmts = stmts;
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public Block withSpan(Position start, Position end) {
      return new Block(stmts, start, end);
    }

    public boolean isEmpty() {
      return stmts.isEmpty();
    }

    /** A block terminates if any of its statements does; anything after that one is dead. */
    @Override
    public boolean alwaysTerminates() {
      return stmts.stream().anyMatch(Stmt::alwaysTerminates);
    }

    @Override
    public String toString() {
      return stmts.isEmpty()
          ? "{}"
          : stmts.stream().map(String::valueOf).collect(Collectors.joining("; ", "{ ", " }"));
    }
  }

  /** {@code name = value}, or {@code name := value} if {@link #declares} is true. */
  public static final class Assign extends Stmt {
    public final String name;
    public final Expr value;
    public final boolean declares;

    private Assign(String name, Expr value, boolean declares, Position start, Position end) {
      super(start, end);
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
      this.value = Preconditions.checkNotNull(value);
      this.declares = declares;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public Assign withSpan(Position start, Position end) {
      return new Assign(name, value, declares, start, end);
    }

    @Override
    public String toString() {
      return name + (declares ? " := " : " = ") + value;
    }
  }

  /** An expression evaluated for its effect; only calls are meaningful here. */
  public static final class ExprStmt extends Stmt {
    public final Expr expr;

    private ExprStmt(Expr expr, Position start, Position end) {
      super(start, end);
      this.expr = Preconditions.checkNotNull(expr);
    }

    @Override
    public Kind kind() {
      return Kind.EXPR;
    }

    @Override
    public ExprStmt withSpan(Position start, Position end) {
      return new ExprStmt(expr, start, end);
    }

    @Override
    public String toString() {
      return expr.toString();
    }
  }

  /**
   * {@code if init; cond { then } else otherwise}. The initializer is optional, and any name it
   * declares is only in scope within the condition and the two branches. {@link #otherwise} is
   * null, a Block, or another If (an else-if chain).
   */
  public static final class If extends Stmt {
    public final @Nullable Assign init;
    public final Expr cond;
    public final Block then;
    public final @Nullable Stmt otherwise;

    private If(
        @Nullable Assign init,
        Expr cond,
        Block then,
        @Nullable Stmt otherwise,
        Position start,
        Position end) {
      super(start, end);
      Preconditions.checkArgument(
          otherwise == null || otherwise instanceof Block || otherwise instanceof If,
          "else must be a block or an if");
      this.init = init;
      this.cond = Preconditions.checkNotNull(cond);
      this.then = Preconditions.checkNotNull(then);
      this.otherwise = otherwise;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public If withSpan(Position start, Position end) {
      return new If(init, cond, then, otherwise, start, end);
    }

    @Override
    public boolean alwaysTerminates() {
      return otherwise != null && then.alwaysTerminates() && otherwise.alwaysTerminates();
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("if ");
      if (init != null) {
        sb.append(init).append("; ");
      }
      sb.append(cond).append(' ').append(then);
      if (otherwise != null) {
        sb.append(" else ").append(otherwise);
      }
      return sb.toString();
    }
  }

  /** {@code return} with an optional value. */
  public static final class Return extends Stmt {
    public final @Nullable Expr value;

    private Return(@Nullable Expr value, Position start, Position end) {
      super(start, end);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public Return withSpan(Position start, Position end) {
      return new Return(value, start, end);
    }

    @Override
    public boolean alwaysTerminates() {
      return true;
    }

    @Override
    public String toString() {
      return (value == null) ? "return" : "return " + value;
    }
  }

  public static final class Break extends Stmt {
    private Break(Position start, Position end) {
      super(start, end);
    }

    @Override
    public Kind kind() {
      return Kind.BREAK;
    }

    @Override
    public Break withSpan(Position start, Position end) {
      return new Break(start, end);
    }

    @Override
    public boolean alwaysTerminates() {
      return true;
    }

    @Override
    public String toString() {
      return "break";
    }
  }

  public static final class Continue extends Stmt {
    private Continue(Position start, Position end) {
      super(start, end);
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }

    @Override
    public Continue withSpan(Position start, Position end) {
      return new Continue(start, end);
    }

    @Override
    public boolean alwaysTerminates() {
      return true;
    }

    @Override
    public String toString() {
      return "continue";
    }
  }

  /**
   * {@code for cond { body }}; a null condition loops until a {@code break} or {@code return}.
   * Loops are recognized by the CFG builder but are outside the fragment grammar.
   */
  public static final class Loop extends Stmt {
    public final @Nullable Expr cond;
    public final Block body;

    private Loop(@Nullable Expr cond, Block body, Position start, Position end) {
      super(start, end);
      this.cond = cond;
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public Kind kind() {
      return Kind.LOOP;
    }

    @Override
    public Loop withSpan(Position start, Position end) {
      return new Loop(cond, body, start, end);
    }

    @Override
    public String toString() {
      return "for " + (cond == null ? "" : cond + " ") + body;
    }
  }

  /** A placeholder for a construct the adapter could not express in this grammar. */
  public static final class Unsupported extends Stmt {
    public final String description;

    private Unsupported(String description, Position start, Position end) {
      super(start, end);
      this.description = description;
    }

    @Override
    public Kind kind() {
      return Kind.UNSUPPORTED;
    }

    @Override
    public Unsupported withSpan(Position start, Position end) {
      return new Unsupported(description, start, end);
    }

    @Override
    public String toString() {
      return "<" + description + ">";
    }
  }
}
