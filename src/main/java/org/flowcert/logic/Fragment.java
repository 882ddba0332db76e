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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;
import org.flowcert.ast.Expr;
import org.jspecify.annotations.Nullable;

/**
 * A statement in the small language that the {@link Evaluator} gives meaning to: assignment,
 * sequencing, conditionals with an optional scoped initializer, early termination, and opaque
 * calls. Fragments have structural equality.
 *
 * <p>Fragment is a closed hierarchy; code that handles each kind should switch on {@link #kind}.
 */
@Immutable
public abstract sealed class Fragment {

  public enum Kind {
    ASSIGN,
    DECLARE,
    SEQ,
    IF,
    RETURN,
    BREAK,
    CONTINUE,
    CALL,
    NOOP
  }

  public static final Fragment BREAK = new Break();
  public static final Fragment CONTINUE = new Continue();
  public static final Fragment NOOP = new Noop();

  private Fragment() {}

  public abstract Kind kind();

  /**
   * True if control can never fall off the end of this fragment: every path ends in a {@code
   * return}, {@code break} or {@code continue}.
   */
  public abstract boolean alwaysTerminates();

  /** Calls {@code visitor} with each direct child fragment. */
  abstract void forEachChild(Consumer<Fragment> visitor);

  /** Calls {@code visitor} with each expression that appears directly in this fragment. */
  public abstract void forEachExpr(Consumer<Expr> visitor);

  /** Returns this fragment and all nested fragments, in preorder. */
  public ImmutableList<Fragment> nodes() {
    ImmutableList.Builder<Fragment> result = ImmutableList.builder();
    Deque<Fragment> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Fragment f = stack.pop();
      result.add(f);
      ImmutableList.Builder<Fragment> children = ImmutableList.builder();
      f.forEachChild(children::add);
      children.build().reverse().forEach(stack::push);
    }
    return result.build();
  }

  /** True if this fragment or one of its parts makes a call. */
  public boolean hasCall() {
    for (Fragment f : nodes()) {
      if (f.kind() == Kind.CALL) {
        return true;
      }
      boolean[] found = new boolean[1];
      f.forEachExpr(e -> found[0] |= e.hasCall());
      if (found[0]) {
        return true;
      }
    }
    return false;
  }

  /** True if this fragment contains a {@code break} or {@code continue}. */
  public boolean hasLoopTransfer() {
    return nodes().stream().anyMatch(f -> f == BREAK || f == CONTINUE);
  }

  /** True if this fragment contains a {@code return}, {@code break} or {@code continue}. */
  public boolean hasTerminator() {
    return nodes().stream().anyMatch(f -> f.kind() == Kind.RETURN || f == BREAK || f == CONTINUE);
  }

  public static Assign assign(String name, Expr value) {
    return new Assign(name, value);
  }

  public static Declare declare(String name, Expr value) {
    return new Declare(name, value);
  }

  /** Returns the right-nested sequence of the given fragments; NOOP if there are none. */
  public static Fragment seq(Fragment... fragments) {
    return seq(ImmutableList.copyOf(fragments));
  }

  public static Fragment seq(ImmutableList<Fragment> fragments) {
    if (fragments.isEmpty()) {
      return NOOP;
    }
    Fragment result = fragments.get(fragments.size() - 1);
    for (int i = fragments.size() - 2; i >= 0; i--) {
      result = new Seq(fragments.get(i), result);
    }
    return result;
  }

  public static If ifThen(Expr cond, Fragment then) {
    return new If(null, cond, then, null);
  }

  public static If ifElse(Expr cond, Fragment then, @Nullable Fragment otherwise) {
    return new If(null, cond, then, otherwise);
  }

  public static If ifInit(
      @Nullable Fragment init, Expr cond, Fragment then, @Nullable Fragment otherwise) {
    return new If(init, cond, then, otherwise);
  }

  public static Return returnValue(Expr value) {
    return new Return(value);
  }

  public static Return returnVoid() {
    return new Return(null);
  }

  public static Call call(Expr.Call call) {
    return new Call(call);
  }

  /** Returns the name bound by an Assign or Declare. */
  private static String target(Fragment f) {
    return (f instanceof Assign a) ? a.name : ((Declare) f).name;
  }

  /** {@code name = value} */
  public static final class Assign extends Fragment {
    public final String name;
    public final Expr value;

    private Assign(String name, Expr value) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public boolean alwaysTerminates() {
      return false;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {
      visitor.accept(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Assign a && a.name.equals(name) && a.value.equals(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Kind.ASSIGN, name, value);
    }

    @Override
    public String toString() {
      return name + " = " + value;
    }
  }

  /**
   * {@code name := value}. As an if-initializer this introduces a name that is only in scope
   * within the if; elsewhere it behaves like an assignment.
   */
  public static final class Declare extends Fragment {
    public final String name;
    public final Expr value;

    private Declare(String name, Expr value) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.DECLARE;
    }

    @Override
    public boolean alwaysTerminates() {
      return false;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {
      visitor.accept(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Declare d && d.name.equals(name) && d.value.equals(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Kind.DECLARE, name, value);
    }

    @Override
    public String toString() {
      return name + " := " + value;
    }
  }

  /** {@code first; second} */
  public static final class Seq extends Fragment {
    public final Fragment first;
    public final Fragment second;

    private Seq(Fragment first, Fragment second) {
      this.first = Preconditions.checkNotNull(first);
      this.second = Preconditions.checkNotNull(second);
    }

    @Override
    public Kind kind() {
      return Kind.SEQ;
    }

    @Override
    public boolean alwaysTerminates() {
      return first.alwaysTerminates() || second.alwaysTerminates();
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {
      visitor.accept(first);
      visitor.accept(second);
    }

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {}

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Seq s && s.first.equals(first) && s.second.equals(second);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Kind.SEQ, first, second);
    }

    @Override
    public String toString() {
      return first + "; " + second;
    }
  }

  /**
   * {@code if init; cond { then } else { otherwise }}. The initializer, if present, is an Assign
   * or Declare; a name it declares is in scope only in the condition and the two branches.
   */
  public static final class If extends Fragment {
    public final @Nullable Fragment init;
    public final Expr cond;
    public final Fragment then;
    public final @Nullable Fragment otherwise;

    private If(@Nullable Fragment init, Expr cond, Fragment then, @Nullable Fragment otherwise) {
      Preconditions.checkArgument(
          init == null || init instanceof Assign || init instanceof Declare,
          "Bad initializer: %s",
          init);
      this.init = init;
      this.cond = Preconditions.checkNotNull(cond);
      this.then = Preconditions.checkNotNull(then);
      this.otherwise = otherwise;
    }

    /** Returns the name introduced by the initializer, or null if it doesn't introduce one. */
    public @Nullable String declaredName() {
      return (init instanceof Declare d) ? d.name : null;
    }

    /** Returns the name assigned by the initializer, if any. */
    public @Nullable String initTarget() {
      return (init == null) ? null : target(init);
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public boolean alwaysTerminates() {
      return otherwise != null && then.alwaysTerminates() && otherwise.alwaysTerminates();
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {
      if (init != null) {
        visitor.accept(init);
      }
      visitor.accept(then);
      if (otherwise != null) {
        visitor.accept(otherwise);
      }
    }

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {
      visitor.accept(cond);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof If i
          && Objects.equals(i.init, init)
          && i.cond.equals(cond)
          && i.then.equals(then)
          && Objects.equals(i.otherwise, otherwise);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Kind.IF, init, cond, then, otherwise);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("if ");
      if (init != null) {
        sb.append(init).append("; ");
      }
      sb.append(cond).append(" { ").append(then).append(" }");
      if (otherwise != null) {
        sb.append(" else { ").append(otherwise).append(" }");
      }
      return sb.toString();
    }
  }

  /** {@code return value}, or a bare {@code return} if value is null. */
  public static final class Return extends Fragment {
    public final @Nullable Expr value;

    private Return(@Nullable Expr value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public boolean alwaysTerminates() {
      return true;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {
      if (value != null) {
        visitor.accept(value);
      }
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Return r && Objects.equals(r.value, value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Kind.RETURN, value);
    }

    @Override
    public String toString() {
      return (value == null) ? "return" : "return " + value;
    }
  }

  private static final class Break extends Fragment {
    @Override
    public Kind kind() {
      return Kind.BREAK;
    }

    @Override
    public boolean alwaysTerminates() {
      return true;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {}

    @Override
    public String toString() {
      return "break";
    }
  }

  private static final class Continue extends Fragment {
    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }

    @Override
    public boolean alwaysTerminates() {
      return true;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {}

    @Override
    public String toString() {
      return "continue";
    }
  }

  /** A call statement; its result, if any, is discarded. */
  public static final class Call extends Fragment {
    public final Expr.Call call;

    private Call(Expr.Call call) {
      this.call = Preconditions.checkNotNull(call);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public boolean alwaysTerminates() {
      return false;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {
      visitor.accept(call);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Call c && c.call.equals(call);
    }

    @Override
    public int hashCode() {
      return call.hashCode();
    }

    @Override
    public String toString() {
      return call.toString();
    }
  }

  private static final class Noop extends Fragment {
    @Override
    public Kind kind() {
      return Kind.NOOP;
    }

    @Override
    public boolean alwaysTerminates() {
      return false;
    }

    @Override
    void forEachChild(Consumer<Fragment> visitor) {}

    @Override
    public void forEachExpr(Consumer<Expr> visitor) {}

    @Override
    public String toString() {
      return "{}";
    }
  }
}
