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
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An expression in the restricted grammar. Expressions carry no source positions, so two
 * expressions are equal iff they are syntactically identical; this is the notion of identity that
 * the equivalence checker uses when it compares conditions across two fragments.
 *
 * <p>Expr is a closed hierarchy; code that needs to handle each kind should switch on {@link
 * #kind} so that the compiler checks that every kind is covered.
 */
@Immutable
public abstract sealed class Expr {

  /** The kinds of Expr, one for each subclass. */
  public enum Kind {
    LITERAL,
    VAR,
    BINARY,
    UNARY,
    CALL
  }

  private Expr() {}

  public abstract Kind kind();

  /** Returns the subexpressions of this expression, in evaluation order. */
  public abstract ImmutableList<Expr> children();

  /** True if evaluating this expression would make at least one call. */
  public boolean hasCall() {
    return anyNode(e -> e.kind() == Kind.CALL);
  }

  /** Returns the names of all variables referenced by this expression. */
  public ImmutableSet<String> referencedVars() {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    anyNode(
        e -> {
          if (e instanceof Var v) {
            builder.add(v.name);
          }
          return false;
        });
    return builder.build();
  }

  /**
   * Returns true if {@code test} returns true for this expression or any of its subexpressions.
   * Walks the tree with an explicit stack, so arbitrarily deep expressions are safe.
   */
  public boolean anyNode(Predicate<Expr> test) {
    Deque<Expr> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Expr e = stack.pop();
      if (test.test(e)) {
        return true;
      }
      e.children().reverse().forEach(stack::push);
    }
    return false;
  }

  public static Literal intLit(long value) {
    return new Literal(Literal.Type.INT, value);
  }

  public static Literal boolLit(boolean value) {
    return value ? Literal.TRUE : Literal.FALSE;
  }

  public static Literal strLit(String value) {
    return new Literal(Literal.Type.STRING, value);
  }

  public static Literal nil() {
    return Literal.NIL;
  }

  public static Var var(String name) {
    return new Var(name);
  }

  public static Binary binary(BinaryOp op, Expr left, Expr right) {
    return new Binary(op, left, right);
  }

  public static Unary unary(UnaryOp op, Expr operand) {
    return new Unary(op, operand);
  }

  public static Unary not(Expr operand) {
    return new Unary(UnaryOp.NOT, operand);
  }

  public static Call call(String function, Expr... args) {
    return new Call(function, ImmutableList.copyOf(args));
  }

  /** The binary operators. */
  public enum BinaryOp {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    AND("&&"),
    OR("||");

    public final String symbol;

    BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    /** True for {@code &&} and {@code ||}, which only evaluate their right operand sometimes. */
    public boolean isShortCircuit() {
      return this == AND || this == OR;
    }

    public boolean isArithmetic() {
      return ordinal() <= MOD.ordinal();
    }
  }

  /** The unary operators. */
  public enum UnaryOp {
    NOT("!"),
    NEG("-");

    public final String symbol;

    UnaryOp(String symbol) {
      this.symbol = symbol;
    }
  }

  /** An int, bool, string, or nil constant. */
  public static final class Literal extends Expr {
    public enum Type {
      INT,
      BOOL,
      STRING,
      NIL
    }

    static final Literal TRUE = new Literal(Type.BOOL, true);
    static final Literal FALSE = new Literal(Type.BOOL, false);
    static final Literal NIL = new Literal(Type.NIL, "nil");

    public final Type type;

    /** A Long, Boolean or String (for NIL, the string "nil"). */
    @SuppressWarnings("Immutable") // always one of the immutable boxed types above
    public final Object value;

    private Literal(Type type, Object value) {
      this.type = type;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Literal lit && lit.type == type && lit.value.equals(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, value);
    }

    @Override
    public String toString() {
      return (type == Type.STRING) ? "\"" + value + "\"" : String.valueOf(value);
    }
  }

  /** A reference to a variable. */
  public static final class Var extends Expr {
    public final String name;

    private Var(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.VAR;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Var v && v.name.equals(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code left op right} */
  public static final class Binary extends Expr {
    public final BinaryOp op;
    public final Expr left;
    public final Expr right;

    private Binary(BinaryOp op, Expr left, Expr right) {
      this.op = Preconditions.checkNotNull(op);
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Binary b && b.op == op && b.left.equals(left) && b.right.equals(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " " + op.symbol + " " + right + ")";
    }
  }

  /** {@code op operand} */
  public static final class Unary extends Expr {
    public final UnaryOp op;
    public final Expr operand;

    private Unary(UnaryOp op, Expr operand) {
      this.op = Preconditions.checkNotNull(op);
      this.operand = Preconditions.checkNotNull(operand);
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public ImmutableList<Expr> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Unary u && u.op == op && u.operand.equals(operand);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, operand);
    }

    @Override
    public String toString() {
      return op.symbol + operand;
    }
  }

  /**
   * A call to a named function. Calls are opaque: their only modeled properties are the function
   * name, the argument values, and where they occur relative to other calls.
   */
  public static final class Call extends Expr {
    /** The callee, possibly qualified ({@code "fmt.Println"}). */
    public final String function;

    public final ImmutableList<Expr> args;

    private Call(String function, ImmutableList<Expr> args) {
      Preconditions.checkArgument(!function.isEmpty());
      this.function = function;
      this.args = args;
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public ImmutableList<Expr> children() {
      return args;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Call c && c.function.equals(function) && c.args.equals(args);
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
}
