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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.flowcert.ast.Expr;
import org.flowcert.ast.Expr.BinaryOp;
import org.flowcert.ast.Expr.UnaryOp;
import org.flowcert.logic.AnalysisConfig.CallPolicy;
import org.flowcert.logic.AnalysisConfig.ControlFlowMode;
import org.jspecify.annotations.Nullable;

/**
 * Gives meaning to {@link Fragment}s: evaluating a fragment in an {@link Environment} produces a
 * {@link TerminationResult}.
 *
 * <ul>
 *   <li>An assignment continues with the updated environment.
 *   <li>A declaration in a branch of an if is local to that branch: when the branch completes, the
 *       name reverts to the value it had before the declaration. A declaration at the top level of
 *       the fragment belongs to the enclosing scope and behaves like an assignment.
 *   <li>A sequence evaluates its second part only if the first continues; otherwise the first
 *       part's result is the result of the sequence.
 *   <li>An if applies its initializer, evaluates the condition, and evaluates the chosen branch.
 *       A name introduced by the initializer reverts to its previous value afterwards.
 *   <li>{@code return}, {@code break} and {@code continue} produce the corresponding result; the
 *       latter two only inside a loop.
 *   <li>A call is recorded in the result's call list and otherwise has no modeled effect; its
 *       value is a symbolic term identifying the call.
 * </ul>
 *
 * <p>When a condition's value is symbolic the evaluator cannot choose a branch, so it explores
 * both, recording the assumption made on each path. The key of an assumption is the condition's
 * symbolic term with any outer negations removed, so {@code c} and {@code !c} are decided
 * together.
 *
 * <p>Failures (an unmodeled construct, a {@code break} outside a loop, too many paths) make the
 * whole evaluation {@link TerminationResult.Undefined}.
 */
public final class Evaluator {

  /** One path through a fragment: the conditions decided along it and the result. */
  public static final class Path {
    public final ImmutableMap<Expr, Boolean> assumptions;
    public final TerminationResult result;

    public Path(ImmutableMap<Expr, Boolean> assumptions, TerminationResult result) {
      this.assumptions = assumptions;
      this.result = result;
    }

    /** True if there is an assignment of the conditions consistent with both paths. */
    public boolean isCompatible(Path other) {
      for (var entry : assumptions.entrySet()) {
        Boolean b = other.assumptions.get(entry.getKey());
        if (b != null && !b.equals(entry.getValue())) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      return assumptions + ": " + result;
    }
  }

  private final AnalysisConfig config;

  public Evaluator(AnalysisConfig config) {
    this.config = config;
  }

  public AnalysisConfig config() {
    return config;
  }

  /** Returns every path through {@code fragment} when started in {@code env}. */
  public ImmutableList<Path> explore(Fragment fragment, Environment env) {
    return explore(fragment, env, ImmutableMap.of());
  }

  /**
   * Returns every path through {@code fragment} that is consistent with the given assumptions. If
   * evaluation fails the result is a single path with an Undefined result.
   */
  public ImmutableList<Path> explore(
      Fragment fragment, Environment env, ImmutableMap<Expr, Boolean> assumptions) {
    try {
      return ImmutableList.copyOf(
          eval(fragment, new State(env, ImmutableList.of(), assumptions)));
    } catch (FragmentException e) {
      return ImmutableList.of(
          new Path(assumptions, TerminationResult.undefined(e.reason, e.detail)));
    }
  }

  /**
   * Evaluates {@code fragment} in {@code env}, which must determine every condition it tests; if
   * the result depends on a symbolic condition it is Undefined.
   */
  public TerminationResult evaluate(Fragment fragment, Environment env) {
    return evaluate(fragment, env, ImmutableMap.of());
  }

  /**
   * Evaluates {@code fragment} in {@code env}, using {@code assumptions} to decide symbolic
   * conditions (keyed as described above).
   */
  public TerminationResult evaluate(
      Fragment fragment, Environment env, ImmutableMap<Expr, Boolean> assumptions) {
    ImmutableList<Path> paths = explore(fragment, env, assumptions);
    if (paths.size() == 1) {
      return paths.get(0).result;
    }
    ImmutableList<Expr> undecided =
        paths.get(0).assumptions.keySet().stream()
            .filter(k -> !assumptions.containsKey(k))
            .collect(ImmutableList.toImmutableList());
    return TerminationResult.undefined(
        Verdict.Reason.UNDECIDED_CONDITION, "no assumption for " + undecided);
  }

  /** The evaluation state at a statement boundary. */
  private static final class State {
    final Environment env;
    final ImmutableList<CallRecord> calls;
    final ImmutableMap<Expr, Boolean> assumptions;

    State(
        Environment env, ImmutableList<CallRecord> calls, ImmutableMap<Expr, Boolean> assumptions) {
      this.env = env;
      this.calls = calls;
      this.assumptions = assumptions;
    }

    Path path(TerminationResult result) {
      return new Path(assumptions, result);
    }

    Path continuing() {
      return path(TerminationResult.continueWith(env, calls));
    }
  }

  private List<Path> eval(Fragment fragment, State state) {
    return switch (fragment.kind()) {
      case ASSIGN -> {
        Fragment.Assign assign = (Fragment.Assign) fragment;
        yield List.of(assignPath(assign.name, assign.value, state));
      }
      case DECLARE -> {
        Fragment.Declare declare = (Fragment.Declare) fragment;
        yield List.of(assignPath(declare.name, declare.value, state));
      }
      case SEQ -> evalSeq((Fragment.Seq) fragment, state);
      case IF -> evalIf((Fragment.If) fragment, state);
      case RETURN -> {
        checkTerminationModeled("return");
        Expr value = ((Fragment.Return) fragment).value;
        if (value == null) {
          yield List.of(state.path(TerminationResult.returning(null, state.calls)));
        }
        List<CallRecord> calls = new ArrayList<>(state.calls);
        Value v = evalExpr(value, state, calls);
        yield List.of(state.path(TerminationResult.returning(v, ImmutableList.copyOf(calls))));
      }
      case BREAK -> {
        checkLoopTransfer("break");
        yield List.of(state.path(TerminationResult.breaking(state.calls)));
      }
      case CONTINUE -> {
        checkLoopTransfer("continue");
        yield List.of(state.path(TerminationResult.continuingLoop(state.calls)));
      }
      case CALL -> {
        List<CallRecord> calls = new ArrayList<>(state.calls);
        evalExpr(((Fragment.Call) fragment).call, state, calls);
        yield List.of(
            state.path(TerminationResult.continueWith(state.env, ImmutableList.copyOf(calls))));
      }
      case NOOP -> List.of(state.continuing());
    };
  }

  private Path assignPath(String name, Expr value, State state) {
    List<CallRecord> calls = new ArrayList<>(state.calls);
    Value v = evalExpr(value, state, calls);
    return state.path(
        TerminationResult.continueWith(state.env.with(name, v), ImmutableList.copyOf(calls)));
  }

  private List<Path> evalSeq(Fragment.Seq seq, State state) {
    List<Path> result = new ArrayList<>();
    for (Path p : eval(seq.first, state)) {
      if (p.result instanceof TerminationResult.Continue c) {
        result.addAll(eval(seq.second, new State(c.env, c.calls, p.assumptions)));
        checkPathLimit(result);
      } else {
        result.add(p);
      }
    }
    return result;
  }

  private List<Path> evalIf(Fragment.If ifFragment, State state) {
    State inner = state;
    if (ifFragment.init != null) {
      List<Path> initPaths = eval(ifFragment.init, state);
      assert initPaths.size() == 1;
      TerminationResult.Continue c = (TerminationResult.Continue) initPaths.get(0).result;
      inner = new State(c.env, c.calls, state.assumptions);
    }
    List<CallRecord> calls = new ArrayList<>(inner.calls);
    Value cond = evalExpr(ifFragment.cond, inner, calls);
    inner = new State(inner.env, ImmutableList.copyOf(calls), inner.assumptions);
    String scoped = ifFragment.declaredName();
    List<Path> result = new ArrayList<>();
    for (Decision d : decide(cond, inner.assumptions)) {
      State branchState = new State(inner.env, inner.calls, d.assumptions);
      Fragment branch = d.value ? ifFragment.then : ifFragment.otherwise;
      List<Path> paths =
          (branch == null) ? List.of(branchState.continuing()) : evalBlock(branch, branchState);
      for (Path p : paths) {
        if (scoped != null && p.result instanceof TerminationResult.Continue c) {
          // The initializer's name goes out of scope; restore whatever it shadowed.
          Environment restored = c.env.with(scoped, state.env.get(scoped));
          result.add(new Path(p.assumptions, TerminationResult.continueWith(restored, c.calls)));
        } else {
          result.add(p);
        }
      }
      checkPathLimit(result);
    }
    return result;
  }

  /**
   * Evaluates a branch of an if. Each name declared directly in the branch is restored, once the
   * branch completes, to the value it had just before the branch first declared it.
   */
  private List<Path> evalBlock(Fragment block, State state) {
    ImmutableList<Fragment> statements = statements(block);
    if (statements.stream().noneMatch(f -> f.kind() == Fragment.Kind.DECLARE)) {
      return eval(block, state);
    }
    List<Path> result = new ArrayList<>();
    List<BlockState> pending = List.of(new BlockState(state, Environment.EMPTY, ImmutableSet.of()));
    for (Fragment statement : statements) {
      List<BlockState> next = new ArrayList<>();
      for (BlockState b : pending) {
        BlockState before =
            (statement instanceof Fragment.Declare declare) ? b.declaring(declare.name) : b;
        for (Path p : eval(statement, before.state)) {
          if (p.result instanceof TerminationResult.Continue c) {
            next.add(before.continueWith(new State(c.env, c.calls, p.assumptions)));
          } else {
            result.add(p);
          }
        }
        checkPathLimit(result.size() + next.size());
      }
      pending = next;
    }
    for (BlockState b : pending) {
      result.add(b.leave());
    }
    return result;
  }

  /** Splits a fragment into the statements of its top-level sequence. */
  private static ImmutableList<Fragment> statements(Fragment block) {
    ImmutableList.Builder<Fragment> result = ImmutableList.builder();
    Deque<Fragment> stack = new ArrayDeque<>();
    stack.push(block);
    while (!stack.isEmpty()) {
      Fragment f = stack.pop();
      if (f instanceof Fragment.Seq seq) {
        stack.push(seq.second);
        stack.push(seq.first);
      } else {
        result.add(f);
      }
    }
    return result.build();
  }

  /** A path part-way through a branch, and the names the branch has declared so far. */
  private static final class BlockState {
    final State state;

    /** For each declared name, its value when the branch declared it. */
    final Environment shadowed;

    final ImmutableSet<String> declared;

    BlockState(State state, Environment shadowed, ImmutableSet<String> declared) {
      this.state = state;
      this.shadowed = shadowed;
      this.declared = declared;
    }

    BlockState declaring(String name) {
      if (declared.contains(name)) {
        return this;
      }
      return new BlockState(
          state,
          shadowed.with(name, state.env.get(name)),
          ImmutableSet.<String>builder().addAll(declared).add(name).build());
    }

    BlockState continueWith(State next) {
      return new BlockState(next, shadowed, declared);
    }

    Path leave() {
      Environment env = state.env;
      for (String name : declared) {
        env = env.with(name, shadowed.get(name));
      }
      return state.path(TerminationResult.continueWith(env, state.calls));
    }
  }

  /** A way that a condition may go, and the assumptions under which it does. */
  private static final class Decision {
    final boolean value;
    final ImmutableMap<Expr, Boolean> assumptions;

    Decision(boolean value, ImmutableMap<Expr, Boolean> assumptions) {
      this.value = value;
      this.assumptions = assumptions;
    }
  }

  private static List<Decision> decide(Value cond, ImmutableMap<Expr, Boolean> assumptions) {
    if (!(cond instanceof Value.Symbolic sym)) {
      return List.of(new Decision(Operations.isTruthy(cond), assumptions));
    }
    Expr key = sym.term;
    boolean negated = false;
    while (key instanceof Expr.Unary u && u.op == UnaryOp.NOT) {
      key = u.operand;
      negated = !negated;
    }
    Boolean assumed = assumptions.get(key);
    if (assumed != null) {
      return List.of(new Decision(assumed != negated, assumptions));
    }
    return List.of(
        new Decision(!negated, extend(assumptions, key, true)),
        new Decision(negated, extend(assumptions, key, false)));
  }

  private static ImmutableMap<Expr, Boolean> extend(
      ImmutableMap<Expr, Boolean> assumptions, Expr key, boolean value) {
    return ImmutableMap.<Expr, Boolean>builderWithExpectedSize(assumptions.size() + 1)
        .putAll(assumptions)
        .put(key, value)
        .buildOrThrow();
  }

  /** Evaluates an expression, appending any calls it makes to {@code calls}. */
  private Value evalExpr(Expr expr, State state, List<CallRecord> calls) {
    return switch (expr.kind()) {
      case LITERAL -> Value.of((Expr.Literal) expr);
      case VAR -> state.env.get(((Expr.Var) expr).name);
      case UNARY -> {
        Expr.Unary unary = (Expr.Unary) expr;
        Value operand = evalExpr(unary.operand, state, calls);
        Value folded = Operations.fold(unary.op, operand);
        if (folded != null) {
          yield folded;
        } else if (unary.op == UnaryOp.NOT
            && operand.toTerm() instanceof Expr.Unary u
            && u.op == UnaryOp.NOT) {
          yield Value.symbolic(u.operand);
        }
        yield Value.symbolic(Expr.unary(unary.op, operand.toTerm()));
      }
      case BINARY -> {
        Expr.Binary binary = (Expr.Binary) expr;
        Value left = evalExpr(binary.left, state, calls);
        if (binary.op.isShortCircuit()) {
          yield evalShortCircuit(binary, left, state, calls);
        }
        yield binaryResult(binary.op, left, evalExpr(binary.right, state, calls));
      }
      case CALL -> {
        Expr.Call call = (Expr.Call) expr;
        if (config.callPolicy == CallPolicy.DISALLOW_CALLS) {
          throw new FragmentException(Verdict.Reason.CALLS_DISALLOWED, "call to %s", call);
        }
        ImmutableList.Builder<Value> args = ImmutableList.builder();
        for (Expr arg : call.args) {
          args.add(evalExpr(arg, state, calls));
        }
        // Call results are named by their position in the trace, so that the n-th call to f
        // returns the same symbolic value on both sides of a comparison.
        int ordinal = calls.size();
        calls.add(new CallRecord(call.function, args.build()));
        yield Value.symbolic(Expr.var("$" + call.function + "#" + ordinal));
      }
    };
  }

  private Value evalShortCircuit(
      Expr.Binary binary, Value left, State state, List<CallRecord> calls) {
    boolean isAnd = binary.op == BinaryOp.AND;
    if (!left.isSymbolic()) {
      // The right operand is evaluated only if the left doesn't decide the result.
      return (Operations.isTruthy(left) == isAnd)
          ? evalExpr(binary.right, state, calls)
          : Value.of(!isAnd);
    } else if (binary.right.hasCall()) {
      throw new FragmentException(
          Verdict.Reason.UNSUPPORTED_CONSTRUCT,
          "call in %s depends on a symbolic condition",
          binary);
    }
    Value right = evalExpr(binary.right, state, calls);
    return binaryResult(binary.op, left, right);
  }

  private static Value binaryResult(BinaryOp op, Value left, Value right) {
    Value folded = Operations.fold(op, left, right);
    return (folded != null)
        ? folded
        : Value.symbolic(Expr.binary(op, left.toTerm(), right.toTerm()));
  }

  private void checkTerminationModeled(String what) {
    if (config.controlFlowMode == ControlFlowMode.NO_TERMINATION) {
      throw new FragmentException(
          Verdict.Reason.MODE_DISABLED, "%s is not modeled without early termination", what);
    }
  }

  private void checkLoopTransfer(String what) {
    checkTerminationModeled(what);
    if (!config.inLoopContext) {
      throw new FragmentException(
          Verdict.Reason.MALFORMED_CONTROL_TRANSFER, "%s outside a loop", what);
    }
  }

  private void checkPathLimit(List<Path> paths) {
    checkPathLimit(paths.size());
  }

  private void checkPathLimit(int numPaths) {
    if (numPaths > config.maxPaths) {
      throw new FragmentException(
          Verdict.Reason.PATH_LIMIT, "more than %s paths", config.maxPaths);
    }
  }
}
