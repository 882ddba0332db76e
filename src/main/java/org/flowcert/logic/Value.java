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
import org.flowcert.ast.Expr;

/**
 * The value of an expression during evaluation: either a concrete int, bool, string or nil, or a
 * {@link Symbolic} value described by a term over the fragment's inputs.
 *
 * <p>Values have structural equality. Two symbolic values are equal only if their terms are
 * identical; they may still be equal at runtime, so callers must not treat inequality of symbolic
 * values as proof of a difference.
 */
@Immutable
public abstract sealed class Value {
  public static final Bool TRUE = new Bool(true);
  public static final Bool FALSE = new Bool(false);
  public static final Nil NIL = new Nil();

  private Value() {}

  public static Int of(long value) {
    return new Int(value);
  }

  public static Bool of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static Str of(String value) {
    return new Str(value);
  }

  /** Returns the value of a literal expression. */
  public static Value of(Expr.Literal literal) {
    return switch (literal.type) {
      case INT -> of((long) (Long) literal.value);
      case BOOL -> of((boolean) (Boolean) literal.value);
      case STRING -> of((String) literal.value);
      case NIL -> NIL;
    };
  }

  /** Returns a symbolic value for the given term. */
  public static Symbolic symbolic(Expr term) {
    return new Symbolic(term);
  }

  /** Returns the symbolic value of an input that the fragment does not assign before reading. */
  public static Symbolic input(String name) {
    return new Symbolic(Expr.var(name));
  }

  public boolean isSymbolic() {
    return this instanceof Symbolic;
  }

  /**
   * Returns an expression that evaluates to this value; for concrete values a literal, for
   * symbolic values their term.
   */
  public abstract Expr toTerm();

  @Override
  public String toString() {
    return toTerm().toString();
  }

  public static final class Int extends Value {
    public final long value;

    private Int(long value) {
      this.value = value;
    }

    @Override
    public Expr toTerm() {
      return Expr.intLit(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Int i && i.value == value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }
  }

  public static final class Bool extends Value {
    public final boolean value;

    private Bool(boolean value) {
      this.value = value;
    }

    @Override
    public Expr toTerm() {
      return Expr.boolLit(value);
    }

    // TRUE and FALSE are the only instances, so identity equality is sufficient.
  }

  public static final class Str extends Value {
    public final String value;

    private Str(String value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public Expr toTerm() {
      return Expr.strLit(value);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Str s && s.value.equals(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }
  }

  public static final class Nil extends Value {
    private Nil() {}

    @Override
    public Expr toTerm() {
      return Expr.nil();
    }
  }

  /**
   * A value that is not known concretely. The term is built from {@link Expr.Var}s naming inputs
   * (and the results of opaque calls), combined with the operators that were applied to them.
   */
  public static final class Symbolic extends Value {
    public final Expr term;

    private Symbolic(Expr term) {
      this.term = Preconditions.checkNotNull(term);
    }

    @Override
    public Expr toTerm() {
      return term;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Symbolic s && s.term.equals(term);
    }

    @Override
    public int hashCode() {
      return term.hashCode() + 17;
    }
  }
}
