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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.booleq.util.Static.candidates;
import static net.hydromatic.booleq.util.Static.sameElements;
import static net.hydromatic.booleq.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Boolean term: a constant, an equality between two labels, a conjunction or
 * a disjunction.
 *
 * <p>Terms are immutable, and are compared by structure. Create them using
 * the factory methods in {@link Terms}; the constructors assume that their
 * arguments are already normalized.
 */
public abstract class Term {
  public final Op op;
  private final int hash;

  Term(Op op, int hash) {
    this.op = requireNonNull(op, "op");
    this.hash = hash;
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder(), 0, 0).toString();
  }

  protected abstract StringBuilder unparse(
      StringBuilder buf, int left, int right);

  /** Accepts a visitor. */
  public abstract <R> R accept(TermVisitor<R> visitor);

  /**
   * Simplifies this term, given the possible values of each variable.
   *
   * <p>A label that has no entry in {@code assignments} is treated as if it
   * has no possible values. Values never have entries, so an equality between
   * a variable and a value is possible if and only if the value is among the
   * variable's candidates.
   *
   * @param assignments Map from variable name to its current candidates
   * @return Simplified term; this term if nothing changed
   */
  public abstract Term simplify(
      Map<String, ? extends Set<String>> assignments);

  /**
   * Finds the variables that this term bounds.
   *
   * <p>A label is bounded by a conjunction if it is bounded by at least one
   * of its terms, and by a disjunction if it is bounded by every one of its
   * terms. For example, given
   *
   * <blockquote><pre>t == v1 | t == v2 &amp; (t == v2 | t == v3)</pre>
   * </blockquote>
   *
   * <p>{@code t} is limited to {@code [v1, v2]}.
   *
   * <p>The bound of a variable may contain the name of another variable, if
   * the two are related by an equality that has not been simplified. Call
   * {@link #simplify} first if you only want values.
   *
   * @return Map from label to the labels it may equal
   */
  public abstract ImmutableMap<String, ImmutableSet<String>> extractPivots();

  /** The constant {@code TRUE} or {@code FALSE}. */
  public static final class Constant extends Term {
    Constant(Op op) {
      super(op, op.ordinal());
      checkArgument(op.isConstant(), "not a constant: %s", op);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Constant && op == ((Constant) obj).op;
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(op.str);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Term simplify(Map<String, ? extends Set<String>> assignments) {
      return this;
    }

    @Override
    public ImmutableMap<String, ImmutableSet<String>> extractPivots() {
      return ImmutableMap.of();
    }
  }

  /**
   * An equality between a variable and a value, or between two variables.
   *
   * <p>Equality is symmetric. The greater of the two labels is always on the
   * left, so {@code eq("a", "b")} and {@code eq("b", "a")} are the same term.
   */
  public static final class Eq extends Term {
    public final String left;
    public final String right;

    Eq(String left, String right) {
      super(Op.EQ, Objects.hash(left, right));
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
      checkArgument(left.compareTo(right) > 0, "not canonical: %s, %s",
          left, right);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Eq
              && left.equals(((Eq) obj).left)
              && right.equals(((Eq) obj).right);
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      return buf.append(this.left).append(op.str).append(this.right);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Returns this equality if it is still possible. Otherwise, computes
     * the labels that both sides could take, and returns a disjunction that
     * makes both sides equal to each of those labels in turn. If there are no
     * such labels, returns {@code FALSE}.
     */
    @Override
    public Term simplify(Map<String, ? extends Set<String>> assignments) {
      if (candidates(assignments, left).contains(right)
          || candidates(assignments, right).contains(left)) {
        return this;
      }
      final Set<String> intersection =
          Sets.intersection(candidates(assignments, left),
              candidates(assignments, right));
      return Terms.or(
          transformEager(intersection,
              i -> Terms.and(Terms.eq(left, i), Terms.eq(i, right))));
    }

    @Override
    public ImmutableMap<String, ImmutableSet<String>> extractPivots() {
      return ImmutableMap.of(left, ImmutableSet.of(right),
          right, ImmutableSet.of(left));
    }
  }

  /** Term that has a set of at least two terms ("and" or "or"). */
  public abstract static class Junction extends Term {
    public final ImmutableSet<Term> terms;

    Junction(Op op, ImmutableSet<Term> terms) {
      super(op, Objects.hash(op.ordinal(), terms));
      this.terms = requireNonNull(terms, "terms");
      checkArgument(terms.size() >= 2, "too few terms: %s", terms);
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj
          || obj instanceof Junction
              && op == ((Junction) obj).op
              && terms.equals(((Junction) obj).terms);
    }

    @Override
    protected StringBuilder unparse(StringBuilder buf, int left, int right) {
      if (left > op.left || right > op.right) {
        return unparse(buf.append('('), 0, 0).append(')');
      }
      final ImmutableList<Term> list = terms.asList();
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          buf.append(op.str);
        }
        list.get(i).unparse(buf,
            i == 0 ? left : op.right,
            i == list.size() - 1 ? right : op.left);
      }
      return buf;
    }

    @Override
    public Term simplify(Map<String, ? extends Set<String>> assignments) {
      final ImmutableList<Term> newTerms =
          transformEager(terms, term -> term.simplify(assignments));
      if (sameElements(terms, newTerms)) {
        return this;
      }
      return copy(newTerms);
    }

    /** Creates a normalized term of the same kind with different terms. */
    protected abstract Term copy(Iterable<Term> terms);
  }

  /** "And" term. */
  public static final class And extends Junction {
    And(ImmutableSet<Term> terms) {
      super(Op.AND, terms);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    protected Term copy(Iterable<Term> terms) {
      return Terms.and(terms);
    }

    /**
     * {@inheritDoc}
     *
     * <p>A label bounded by several terms is bounded by the intersection of
     * their bounds.
     */
    @Override
    public ImmutableMap<String, ImmutableSet<String>> extractPivots() {
      final Map<String, ImmutableSet<String>> pivots = new LinkedHashMap<>();
      for (Term term : terms) {
        term.extractPivots()
            .forEach((name, values) ->
                pivots.merge(name, values,
                    (values0, values1) ->
                        Sets.intersection(values0, values1).immutableCopy()));
      }
      return ImmutableMap.copyOf(pivots);
    }
  }

  /** "Or" term. */
  public static final class Or extends Junction {
    Or(ImmutableSet<Term> terms) {
      super(Op.OR, terms);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    protected Term copy(Iterable<Term> terms) {
      return Terms.or(terms);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Only labels bounded by every term are bounded; the bound is the
     * union of the terms' bounds.
     */
    @Override
    public ImmutableMap<String, ImmutableSet<String>> extractPivots() {
      final ImmutableList<ImmutableMap<String, ImmutableSet<String>>>
          pivotsList = transformEager(terms, Term::extractPivots);

      // Names that appear in every term.
      Set<String> names = pivotsList.get(0).keySet();
      for (ImmutableMap<String, ImmutableSet<String>> p :
          pivotsList.subList(1, pivotsList.size())) {
        names = Sets.intersection(names, p.keySet());
      }

      // For each of those names, collect the possible values.
      final ImmutableMap.Builder<String, ImmutableSet<String>> pivots =
          ImmutableMap.builder();
      for (String name : names) {
        final ImmutableSet.Builder<String> values = ImmutableSet.builder();
        for (ImmutableMap<String, ImmutableSet<String>> p : pivotsList) {
          values.addAll(requireNonNull(p.get(name)));
        }
        pivots.put(name, values.build());
      }
      return pivots.build();
    }
  }
}

// End Term.java
