/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.booleq.term;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;
import com.google.common.collect.Iterables;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Factory methods for {@link Term}.
 *
 * <p>Every method returns a normalized term:
 *
 * <ul>
 *   <li>{@code eq(a, a)} is {@link #TRUE};
 *   <li>an "and" or "or" never contains a term of its own kind, because
 *       nested terms are flattened;
 *   <li>"and" drops {@code TRUE} terms and is {@code FALSE} if any term is
 *       {@code FALSE}; "or" drops {@code FALSE} terms and is {@code TRUE} if
 *       any term is {@code TRUE};
 *   <li>an "and" or "or" with one term is that term, and with no terms is
 *       {@code TRUE} ("and") or {@code FALSE} ("or").
 * </ul>
 *
 * <p>Terms are interned, so structurally equal terms are usually the same
 * object; but terms are always compared using {@link Term#equals}.
 */
public class Terms {
  private Terms() {}

  private static final Interner<Term> INTERNER = Interners.newWeakInterner();

  /** The term that is always true. */
  public static final Term TRUE = INTERNER.intern(new Term.Constant(Op.TRUE));

  /** The term that is always false. */
  public static final Term FALSE =
      INTERNER.intern(new Term.Constant(Op.FALSE));

  /**
   * Creates an equality between two labels, or {@link #TRUE} if the labels
   * are the same.
   */
  public static Term eq(String left, String right) {
    requireNonNull(left, "left");
    requireNonNull(right, "right");
    final int c = left.compareTo(right);
    if (c == 0) {
      return TRUE;
    }
    return INTERNER.intern(
        c > 0 ? new Term.Eq(left, right) : new Term.Eq(right, left));
  }

  /** Creates a conjunction. */
  public static Term and(Term... terms) {
    return and(ImmutableList.copyOf(terms));
  }

  /** Creates a conjunction. */
  public static Term and(Iterable<? extends Term> terms) {
    final Set<Term> set = new LinkedHashSet<>();
    for (Term term : terms) {
      switch (term.op) {
        case TRUE:
          // "x & y & TRUE" is equivalent to "x & y"
          break;
        case FALSE:
          return FALSE;
        case AND:
          set.addAll(((Term.And) term).terms);
          break;
        default:
          set.add(term);
      }
    }
    switch (set.size()) {
      case 0:
        return TRUE;
      case 1:
        return Iterables.getOnlyElement(set);
      default:
        return INTERNER.intern(new Term.And(ImmutableSet.copyOf(set)));
    }
  }

  /** Creates a disjunction. */
  public static Term or(Term... terms) {
    return or(ImmutableList.copyOf(terms));
  }

  /** Creates a disjunction. */
  public static Term or(Iterable<? extends Term> terms) {
    final Set<Term> set = new LinkedHashSet<>();
    for (Term term : terms) {
      switch (term.op) {
        case FALSE:
          // "x | y | FALSE" is equivalent to "x | y"
          break;
        case TRUE:
          return TRUE;
        case OR:
          set.addAll(((Term.Or) term).terms);
          break;
        default:
          set.add(term);
      }
    }
    switch (set.size()) {
      case 0:
        return FALSE;
      case 1:
        return Iterables.getOnlyElement(set);
      default:
        return INTERNER.intern(new Term.Or(ImmutableSet.copyOf(set)));
    }
  }

  /** Returns the labels that occur in a term, in order of first occurrence. */
  public static ImmutableSet<String> labels(Term term) {
    final ImmutableSet.Builder<String> labels = ImmutableSet.builder();
    term.accept(
        new TermVisitor<Void>() {
          @Override
          public Void visit(Term.Constant constant) {
            return null;
          }

          @Override
          public Void visit(Term.Eq eq) {
            labels.add(eq.left, eq.right);
            return null;
          }

          @Override
          public Void visit(Term.And and) {
            and.terms.forEach(t -> t.accept(this));
            return null;
          }

          @Override
          public Void visit(Term.Or or) {
            or.terms.forEach(t -> t.accept(this));
            return null;
          }
        });
    return labels.build();
  }
}

// End Terms.java
