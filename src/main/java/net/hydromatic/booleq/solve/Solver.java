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
package net.hydromatic.booleq.solve;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.booleq.util.Static.allMatch;
import static net.hydromatic.booleq.util.Static.immutableCopy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.booleq.term.Op;
import net.hydromatic.booleq.term.Term;
import net.hydromatic.booleq.term.Terms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Solver for boolean equations.
 *
 * <p>This solver computes the union of all solutions. That is, rather than
 * assigning exactly one value to each variable, it computes the set of values
 * that each variable has in at least one of the solutions.
 *
 * <p>To accomplish this, it uses the following rewriting rules:
 *
 * <pre>
 *   [1]  (t in X &amp;&amp; ...) || (t in Y &amp;&amp; ...)  --&gt;  t in (X | Y)
 *   [2]  t in X &amp;&amp; t in Y                    --&gt;  t in (X &amp; Y)
 * </pre>
 *
 * <p>Applying these iteratively for each variable in turn (see
 * {@link Term#extractPivots()}) reduces the system to one where we can read
 * off the possible values for each variable.
 *
 * <p>Usage: register variables, values, implications and ground truths, then
 * call {@link #solve()} once. A solver is not thread-safe.
 */
public class Solver {
  private static final Logger LOG = LogManager.getFormatterLogger();

  private final List<String> variables = new ArrayList<>();
  private final List<String> values = new ArrayList<>();
  private final Map<Term, Term> implications = new LinkedHashMap<>();
  private Term groundTruth = Terms.TRUE;

  private final Map<Prop, Object> props;
  private final Tracer tracer;

  /** Candidates after the most recent call to {@link #solve()}. */
  private @Nullable Map<String, Set<String>> assignments;
  private int passCount;

  /** Creates a solver with default properties. */
  public Solver() {
    this(ImmutableMap.of(), null);
  }

  /**
   * Creates a solver.
   *
   * @param props Properties; see {@link Prop}
   * @param tracer Tracer, or null to use the null tracer (or, if the
   *     {@link Prop#TRACE} property is set, the log tracer)
   */
  public Solver(Map<Prop, Object> props, @Nullable Tracer tracer) {
    this.props = ImmutableMap.copyOf(props);
    this.tracer =
        tracer != null
            ? tracer
            : Prop.TRACE.booleanValue(this.props)
                ? Tracers.logTracer()
                : Tracers.nullTracer();
  }

  @Override
  public String toString() {
    final List<String> lines = new ArrayList<>();
    if (!groundTruth.equals(Terms.TRUE)) {
      lines.add("always: " + groundTruth);
    }
    implications.forEach((eq, implication) -> {
      // only print the "interesting" lines
      if (!implication.op.isConstant()) {
        lines.add("if " + eq + " then " + implication);
      }
    });
    return String.join("\n", lines) + "\n";
  }

  /** Registers a variable. Call before calling {@link #solve()}. */
  public void registerVariable(String variable) {
    variables.add(requireNonNull(variable, "variable"));
  }

  /** Registers a value. Call before calling {@link #solve()}. */
  public void registerValue(String value) {
    values.add(requireNonNull(value, "value"));
  }

  /**
   * Registers a ground truth, a term that must always be true. Call before
   * calling {@link #solve()}.
   */
  public void alwaysTrue(Term term) {
    checkArgument(!term.equals(Terms.FALSE), "ground truth is FALSE");
    groundTruth = Terms.and(groundTruth, term);
  }

  /**
   * Registers an implication: if {@code eq} holds, {@code implication} must
   * hold too. Call before calling {@link #solve()}.
   *
   * @param eq Equality between a variable and a value
   * @param implication Term that must hold if {@code eq} holds
   */
  public void implies(Term eq, Term implication) {
    checkArgument(eq.op == Op.EQ, "Illegal equation: %s", eq);
    checkArgument(!implications.containsKey(eq),
        "implication for %s is already registered", eq);
    implications.put(eq, requireNonNull(implication, "implication"));
  }

  /** Returns the conjunction of all registered ground truths. */
  public Term groundTruth() {
    return groundTruth;
  }

  /**
   * Returns the implication registered for an equality, or {@code TRUE} if
   * none is registered.
   */
  public Term implication(Term eq) {
    final Term implication = implications.get(eq);
    return implication == null ? Terms.TRUE : implication;
  }

  /**
   * Returns the number of passes of the fixpoint loop in the most recent call
   * to {@link #solve()}.
   */
  public int passCount() {
    return passCount;
  }

  /**
   * Returns whether the ground truth simplifies to {@code FALSE} given the
   * candidates computed by the most recent call to {@link #solve()}.
   *
   * <p>If so, the system has no solution, even though {@link #solve()} may
   * have returned non-empty candidates.
   *
   * @throws IllegalStateException if {@link #solve()} has not been called
   */
  public boolean isGroundTruthFalse() {
    checkState(assignments != null, "solve() has not been called");
    return groundTruth.simplify(assignments).equals(Terms.FALSE);
  }

  /**
   * Inserts missing implications, so that there is an implication for every
   * (variable, value) combination.
   *
   * <p>Missing implications are typically for combinations not considered by
   * the caller, e.g. auxiliary variables introduced while setting up the main
   * equations.
   */
  private void complete() {
    for (String variable : variables) {
      for (String value : values) {
        final Term eq = Terms.eq(variable, value);
        if (eq.op == Op.EQ) {
          implications.putIfAbsent(eq, Terms.TRUE);
        }
      }
    }
  }

  /**
   * Solves the system of equations.
   *
   * <p>If the system is unsatisfiable, the result does not necessarily say so;
   * call {@link #isGroundTruthFalse()} to find out whether the ground truth
   * has been reduced to {@code FALSE}.
   *
   * @return Map from each variable to the values it may take
   */
  public ImmutableMap<String, ImmutableSet<String>> solve() {
    complete();
    if (LOG.isDebugEnabled()) {
      logUnknownLabels();
    }

    final Map<String, Set<String>> assignments = new LinkedHashMap<>();
    for (String variable : variables) {
      assignments.computeIfAbsent(variable, v -> {
        final Set<String> candidates = new LinkedHashSet<>();
        for (String value : values) {
          if (!implication(Terms.eq(v, value)).equals(Terms.FALSE)) {
            candidates.add(value);
          }
        }
        return candidates;
      });
    }
    tracer.onInitial(immutableCopy(assignments));

    final ImmutableMap<String, ImmutableSet<String>> groundPivots =
        groundTruth.simplify(assignments).extractPivots();
    tracer.onGroundPivots(groundPivots);
    groundPivots.forEach((label, possibleValues) ->
        narrow(assignments, label, possibleValues));

    final int maxPassCount = Prop.MAX_PASS_COUNT.intValue(props);
    passCount = 0;
    boolean changed = true;
    while (changed) {
      if (maxPassCount >= 0 && passCount >= maxPassCount) {
        LOG.warn("stopped after %d passes without reaching a fixpoint",
            passCount);
        break;
      }
      changed = pass(assignments);
      tracer.onPass(++passCount, changed);
    }

    this.assignments = assignments;
    final ImmutableMap<String, ImmutableSet<String>> solution =
        immutableCopy(assignments);
    tracer.onSolution(solution);
    LOG.debug("solved %d variables over %d values in %d passes",
        assignments.size(), values.size(), passCount);
    if (Prop.CHECK_GROUND_TRUTH.booleanValue(props) && isGroundTruthFalse()) {
      LOG.warn("ground truth is unsatisfiable: %s", groundTruth);
    }
    return solution;
  }

  /**
   * Runs one pass of the fixpoint loop over every variable, and returns
   * whether any variable's candidates shrank.
   */
  boolean pass(Map<String, Set<String>> assignments) {
    boolean changed = false;
    for (String variable : variables) {
      final Set<String> candidates = requireNonNull(assignments.get(variable));
      final List<Term> terms = new ArrayList<>();
      for (String value : ImmutableList.copyOf(candidates)) {
        final Term implication = implication(Terms.eq(variable, value));
        if (implication.simplify(assignments).equals(Terms.FALSE)) {
          candidates.remove(value);
          tracer.onRemove(variable, value, implication);
          changed = true;
        }
        terms.add(implication);
      }
      final Term disjunction = Terms.or(terms).simplify(assignments);
      for (Map.Entry<String, ImmutableSet<String>> entry :
          disjunction.extractPivots().entrySet()) {
        changed |= narrow(assignments, entry.getKey(), entry.getValue());
      }
    }
    return changed;
  }

  /**
   * Intersects the candidates of a variable with a set of possible values.
   * Does nothing if {@code label} is not a variable. Returns whether the
   * candidates shrank.
   */
  private boolean narrow(Map<String, Set<String>> assignments, String label,
      Set<String> possibleValues) {
    final Set<String> candidates = assignments.get(label);
    if (candidates == null
        || allMatch(candidates, possibleValues::contains)) {
      return false;
    }
    final ImmutableSet<String> before = ImmutableSet.copyOf(candidates);
    candidates.retainAll(possibleValues);
    tracer.onNarrow(label, before, ImmutableSet.copyOf(candidates));
    return true;
  }

  /** Logs labels that are neither registered variables nor values. */
  private void logUnknownLabels() {
    final Set<String> known = new LinkedHashSet<>(variables);
    known.addAll(values);
    final Set<String> unknown = new LinkedHashSet<>();
    unknown.addAll(Terms.labels(groundTruth));
    implications.values().forEach(t -> unknown.addAll(Terms.labels(t)));
    unknown.removeAll(known);
    for (String label : unknown) {
      LOG.debug("label '%s' is neither a variable nor a value", label);
    }
  }
}

// End Solver.java
