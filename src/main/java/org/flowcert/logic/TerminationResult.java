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
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The result of evaluating a fragment: whether control fell through (with the resulting
 * environment) or left early, and the opaque calls made along the way.
 *
 * <p>{@link #equals} compares everything including the calls; {@link #sameOutcome} ignores them.
 */
@Immutable
public abstract sealed class TerminationResult {

  public enum Kind {
    /** Control fell off the end of the fragment. */
    CONTINUE,
    RETURN,
    BREAK,
    /** A {@code continue} statement was executed. */
    CONTINUE_LOOP,
    /** The fragment could not be evaluated. */
    UNDEFINED
  }

  public final ImmutableList<CallRecord> calls;

  private TerminationResult(ImmutableList<CallRecord> calls) {
    this.calls = Preconditions.checkNotNull(calls);
  }

  public abstract Kind kind();

  public static Continue continueWith(Environment env, ImmutableList<CallRecord> calls) {
    return new Continue(env, calls);
  }

  public static Return returning(@Nullable Value value, ImmutableList<CallRecord> calls) {
    return new Return(value, calls);
  }

  public static Break breaking(ImmutableList<CallRecord> calls) {
    return new Break(calls);
  }

  public static ContinueLoop continuingLoop(ImmutableList<CallRecord> calls) {
    return new ContinueLoop(calls);
  }

  public static Undefined undefined(Verdict.Reason reason, String detail) {
    return new Undefined(reason, detail);
  }

  /** True unless control fell through. */
  public boolean terminates() {
    return kind() != Kind.CONTINUE;
  }

  /** True if this and {@code other} have the same kind and payload, regardless of their calls. */
  public abstract boolean sameOutcome(TerminationResult other);

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TerminationResult r && sameOutcome(r) && r.calls.equals(calls);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), calls);
  }

  @Override
  public String toString() {
    return calls.isEmpty() ? describe() : describe() + " calls=" + calls;
  }

  abstract String describe();

  public static final class Continue extends TerminationResult {
    public final Environment env;

    private Continue(Environment env, ImmutableList<CallRecord> calls) {
      super(calls);
      this.env = Preconditions.checkNotNull(env);
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }

    @Override
    public boolean sameOutcome(TerminationResult other) {
      return other instanceof Continue c && c.env.equals(env);
    }

    @Override
    String describe() {
      return "Continue(" + env + ")";
    }
  }

  public static final class Return extends TerminationResult {
    /** Null for a {@code return} with no value. */
    public final @Nullable Value value;

    private Return(@Nullable Value value, ImmutableList<CallRecord> calls) {
      super(calls);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public boolean sameOutcome(TerminationResult other) {
      return other instanceof Return r && Objects.equals(r.value, value);
    }

    @Override
    String describe() {
      return (value == null) ? "Return()" : "Return(" + value + ")";
    }
  }

  public static final class Break extends TerminationResult {
    private Break(ImmutableList<CallRecord> calls) {
      super(calls);
    }

    @Override
    public Kind kind() {
      return Kind.BREAK;
    }

    @Override
    public boolean sameOutcome(TerminationResult other) {
      return other instanceof Break;
    }

    @Override
    String describe() {
      return "Break";
    }
  }

  public static final class ContinueLoop extends TerminationResult {
    private ContinueLoop(ImmutableList<CallRecord> calls) {
      super(calls);
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE_LOOP;
    }

    @Override
    public boolean sameOutcome(TerminationResult other) {
      return other instanceof ContinueLoop;
    }

    @Override
    String describe() {
      return "ContinueLoop";
    }
  }

  /**
   * Evaluation failed. An Undefined result never has the same outcome as anything, including
   * another Undefined result.
   */
  public static final class Undefined extends TerminationResult {
    public final Verdict.Reason reason;
    public final String detail;

    private Undefined(Verdict.Reason reason, String detail) {
      super(ImmutableList.of());
      this.reason = Preconditions.checkNotNull(reason);
      this.detail = detail;
    }

    @Override
    public Kind kind() {
      return Kind.UNDEFINED;
    }

    @Override
    public boolean sameOutcome(TerminationResult other) {
      return false;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Undefined u && u.reason == reason && u.detail.equals(detail);
    }

    @Override
    public int hashCode() {
      return reason.hashCode();
    }

    @Override
    String describe() {
      return "Undefined(" + reason.description + (detail.isEmpty() ? "" : ": " + detail) + ")";
    }
  }
}
