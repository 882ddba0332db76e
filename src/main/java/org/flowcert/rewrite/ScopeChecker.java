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

package org.flowcert.rewrite;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.flowcert.ast.Expr;
import org.flowcert.logic.Fragment;
import org.jspecify.annotations.Nullable;

/**
 * Finds scoping problems in a rewrite.
 *
 * <p>{@link #findViolation} finds uses of an if-initializer's identifier outside that if. Such a
 * use either refers to an unrelated variable of the same name or does not compile. Any use of the
 * name outside the if (anywhere in the fragment) counts, even if the name was also declared
 * elsewhere.
 *
 * <p>{@link #findMovedDeclaration} finds declaring assignments that a rewrite moves into a
 * different block, e.g. out of an else and into the enclosing scope, where the declaration would
 * shadow the outer variable for the rest of the scope or not compile at all.
 */
final class ScopeChecker {

  private ScopeChecker() {}

  /** A fragment to be checked and the initializer names in scope at that point. */
  private static final class Item {
    final Fragment fragment;
    final ImmutableSet<String> inScope;

    Item(Fragment fragment, ImmutableSet<String> inScope) {
      this.fragment = fragment;
      this.inScope = inScope;
    }
  }

  /**
   * Returns a description of the first scope violation in {@code fragment}, or null if there is
   * none.
   *
   * @param visible the identifiers visible in the enclosing scope
   */
  static @Nullable String findViolation(Fragment fragment, Set<String> visible) {
    Set<String> initNames = new HashSet<>();
    for (Fragment f : fragment.nodes()) {
      if (f instanceof Fragment.If ifFragment && ifFragment.declaredName() != null) {
        initNames.add(ifFragment.declaredName());
      }
    }
    if (initNames.isEmpty()) {
      return null;
    }
    Deque<Item> stack = new ArrayDeque<>();
    stack.push(new Item(fragment, ImmutableSet.of()));
    while (!stack.isEmpty()) {
      Item item = stack.pop();
      ImmutableSet<String> inScope = item.inScope;
      String violation =
          switch (item.fragment.kind()) {
            case ASSIGN -> {
              Fragment.Assign assign = (Fragment.Assign) item.fragment;
              String escaped = escaped(assign.name, initNames, inScope, visible);
              yield (escaped != null) ? escaped : check(assign.value, initNames, inScope, visible);
            }
            case DECLARE -> {
              Fragment.Declare declare = (Fragment.Declare) item.fragment;
              yield check(declare.value, initNames, inScope, visible);
            }
            case SEQ -> {
              Fragment.Seq seq = (Fragment.Seq) item.fragment;
              stack.push(new Item(seq.second, inScope));
              stack.push(new Item(seq.first, inScope));
              yield null;
            }
            case IF -> {
              Fragment.If ifFragment = (Fragment.If) item.fragment;
              if (ifFragment.init != null) {
                // The initializer itself is evaluated in the enclosing scope.
                stack.push(new Item(ifFragment.init, inScope));
              }
              String declared = ifFragment.declaredName();
              ImmutableSet<String> branchScope =
                  (declared == null || inScope.contains(declared))
                      ? inScope
                      : ImmutableSet.<String>builder().addAll(inScope).add(declared).build();
              if (ifFragment.otherwise != null) {
                stack.push(new Item(ifFragment.otherwise, branchScope));
              }
              stack.push(new Item(ifFragment.then, branchScope));
              yield check(ifFragment.cond, initNames, branchScope, visible);
            }
            case RETURN -> {
              Expr value = ((Fragment.Return) item.fragment).value;
              yield (value == null) ? null : check(value, initNames, inScope, visible);
            }
            case CALL -> check(((Fragment.Call) item.fragment).call, initNames, inScope, visible);
            case BREAK, CONTINUE, NOOP -> null;
          };
      if (violation != null) {
        return violation;
      }
    }
    return null;
  }

  /** A declaring assignment and the depth of the block it's in (0 for the fragment itself). */
  private static final class Declaration {
    final String name;
    final int depth;

    Declaration(String name, int depth) {
      this.name = name;
      this.depth = depth;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Declaration d && d.name.equals(name) && d.depth == depth;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, depth);
    }
  }

  /**
   * Returns a description of a declaring assignment in {@code rewritten} that has no counterpart
   * at the same block depth in {@code original}, or null if there is none. If-initializers are
   * not included (they are checked by {@link #findViolation}), and the links of an else-if chain
   * count as a single level, so flattening a chain doesn't move the declarations in its branches.
   */
  static @Nullable String findMovedDeclaration(Fragment original, Fragment rewritten) {
    ImmutableMultiset<Declaration> before = declarations(original);
    for (Multiset.Entry<Declaration> entry : declarations(rewritten).entrySet()) {
      Declaration d = entry.getElement();
      if (entry.getCount() > before.count(d)) {
        return String.format(
            "the declaration of '%s' is moved to %s",
            d.name,
            (d.depth == 0) ? "the enclosing scope" : "a different block");
      }
    }
    return null;
  }

  private static ImmutableMultiset<Declaration> declarations(Fragment fragment) {
    ImmutableMultiset.Builder<Declaration> result = ImmutableMultiset.builder();
    Deque<Fragment> stack = new ArrayDeque<>();
    Deque<Integer> depths = new ArrayDeque<>();
    stack.push(fragment);
    depths.push(0);
    while (!stack.isEmpty()) {
      Fragment f = stack.pop();
      int depth = depths.pop();
      if (f instanceof Fragment.Declare declare) {
        result.add(new Declaration(declare.name, depth));
      } else if (f instanceof Fragment.Seq seq) {
        stack.push(seq.second);
        depths.push(depth);
        stack.push(seq.first);
        depths.push(depth);
      } else if (f instanceof Fragment.If ifFragment) {
        if (ifFragment.otherwise instanceof Fragment.If) {
          // The next link of an else-if chain.
          stack.push(ifFragment.otherwise);
          depths.push(depth);
        } else if (ifFragment.otherwise != null) {
          stack.push(ifFragment.otherwise);
          depths.push(depth + 1);
        }
        stack.push(ifFragment.then);
        depths.push(depth + 1);
      }
    }
    return result.build();
  }

  private static @Nullable String check(
      Expr expr, Set<String> initNames, Set<String> inScope, Set<String> visible) {
    for (String name : expr.referencedVars()) {
      String escaped = escaped(name, initNames, inScope, visible);
      if (escaped != null) {
        return escaped;
      }
    }
    return null;
  }

  private static @Nullable String escaped(
      String name, Set<String> initNames, Set<String> inScope, Set<String> visible) {
    if (!initNames.contains(name) || inScope.contains(name)) {
      return null;
    } else if (visible.contains(name)) {
      return String.format(
          "'%s' is used outside the if that declares it, where it names a different variable",
          name);
    }
    return String.format("'%s' is used outside the if that declares it", name);
  }
}
