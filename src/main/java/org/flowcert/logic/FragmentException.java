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

/**
 * Thrown when a fragment cannot be translated, evaluated or compared. The reason determines the
 * {@link Verdict} that the failure maps to; see {@link #toVerdict}.
 */
public class FragmentException extends RuntimeException {
  public final Verdict.Reason reason;
  public final String detail;

  public FragmentException(Verdict.Reason reason, String detail) {
    this.reason = Preconditions.checkNotNull(reason);
    this.detail = detail;
  }

  public FragmentException(Verdict.Reason reason, String fmt, Object... args) {
    this(reason, String.format(fmt, args));
  }

  public Verdict toVerdict() {
    return Verdict.forFailure(reason, detail);
  }

  @Override
  public String getMessage() {
    return detail.isEmpty() ? reason.description : reason.description + ": " + detail;
  }
}
