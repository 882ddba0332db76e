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
import com.google.errorprone.annotations.Immutable;

/**
 * A line and column in the source file that a syntax tree was parsed from. Both are 1-based; the
 * special value {@link #NONE} is used for trees that were constructed rather than parsed.
 */
@Immutable
public final class Position implements Comparable<Position> {
  public static final Position NONE = new Position(0, 0);

  public final int line;
  public final int column;

  private Position(int line, int column) {
    this.line = line;
    this.column = column;
  }

  public static Position of(int line, int column) {
    Preconditions.checkArgument(line > 0 && column > 0, "bad position %s:%s", line, column);
    return new Position(line, column);
  }

  public boolean isKnown() {
    return line > 0;
  }

  @Override
  public int compareTo(Position other) {
    int cmp = Integer.compare(line, other.line);
    return (cmp != 0) ? cmp : Integer.compare(column, other.column);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Position p && p.line == line && p.column == column;
  }

  @Override
  public int hashCode() {
    return line * 31 + column;
  }

  @Override
  public String toString() {
    return isKnown() ? line + ":" + column : "?";
  }
}
