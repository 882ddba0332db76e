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
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The outcome of checking a rewrite. A {@link Status#VERIFIED} rewrite may be applied
 * automatically; an {@link Status#UNKNOWN} one may be suggested but not applied; a {@link
 * Status#REJECTED} one is structurally inadmissible.
 */
@Immutable
public final class Verdict {

  public enum Status {
    VERIFIED,
    UNKNOWN,
    REJECTED
  }

  /** Why a rewrite could not be verified. */
  public enum Reason {
    /** A statement or expression outside the modeled grammar. */
    UNSUPPORTED_CONSTRUCT("unsupported construct"),
    /**
     * An identifier introduced by an if-initializer is used outside that if, or a declaration is
     * moved into a different block.
     */
    SCOPE_VIOLATION("scope violation"),
    /** A branch that the rewrite requires to terminate can fall through. */
    NON_TERMINATING_BRANCH("non-terminating branch"),
    /** The two sides make different sequences of opaque calls. */
    CALL_ORDER_VIOLATION("call order violation"),
    /** A {@code break} or {@code continue} with no enclosing loop. */
    MALFORMED_CONTROL_TRANSFER("malformed control transfer"),
    /** Calls are present but the configuration disallows them. */
    CALLS_DISALLOWED("calls disallowed"),
    /** The configured control-flow mode does not model this. */
    MODE_DISABLED("mode disabled"),
    /** The two sides produce different results for some assignment of the conditions. */
    RESULT_MISMATCH("result mismatch"),
    /** Evaluation depends on a condition for which no assumption was supplied. */
    UNDECIDED_CONDITION("undecided condition"),
    /** Case splitting produced more paths than the configured limit. */
    PATH_LIMIT("path limit exceeded");

    public final String description;

    Reason(String description) {
      this.description = description;
    }
  }

  private static final Verdict VERIFIED = new Verdict(Status.VERIFIED, null, "");

  public final Status status;

  /** Null iff the status is VERIFIED. */
  public final @Nullable Reason reason;

  public final String detail;

  private Verdict(Status status, @Nullable Reason reason, String detail) {
    Preconditions.checkArgument((status == Status.VERIFIED) == (reason == null));
    this.status = status;
    this.reason = reason;
    this.detail = Preconditions.checkNotNull(detail);
  }

  public static Verdict verified() {
    return VERIFIED;
  }

  public static Verdict unknown(Reason reason, String detail) {
    return new Verdict(Status.UNKNOWN, reason, detail);
  }

  public static Verdict rejected(Reason reason, String detail) {
    return new Verdict(Status.REJECTED, reason, detail);
  }

  /**
   * Returns the verdict for a failure with the given reason. Only a malformed control transfer
   * makes a rewrite inadmissible; every other failure just means it could not be verified.
   */
  public static Verdict forFailure(Reason reason, String detail) {
    return (reason == Reason.MALFORMED_CONTROL_TRANSFER)
        ? rejected(reason, detail)
        : unknown(reason, detail);
  }

  public boolean isVerified() {
    return status == Status.VERIFIED;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Verdict v
        && v.status == status
        && v.reason == reason
        && v.detail.equals(detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, reason, detail);
  }

  @Override
  public String toString() {
    if (reason == null) {
      return "Verified";
    }
    String name = (status == Status.UNKNOWN) ? "Unknown" : "Rejected";
    return detail.isEmpty()
        ? name + "(" + reason.description + ")"
        : name + "(" + reason.description + ": " + detail + ")";
  }
}
