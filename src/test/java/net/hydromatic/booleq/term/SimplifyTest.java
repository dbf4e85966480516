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

import static net.hydromatic.booleq.term.Terms.FALSE;
import static net.hydromatic.booleq.term.Terms.TRUE;
import static net.hydromatic.booleq.term.Terms.and;
import static net.hydromatic.booleq.term.Terms.eq;
import static net.hydromatic.booleq.term.Terms.or;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

/** Tests {@link Term#simplify(Map)}. */
public class SimplifyTest {
  /** Candidates of variables "t", "x" and "y". */
  private final Map<String, Set<String>> assignments =
      ImmutableMap.of("t", ImmutableSet.of("v1", "v2"),
          "x", ImmutableSet.of("1", "2"),
          "y", ImmutableSet.of("2", "3"));

  @Test
  void testConstants() {
    assertThat(TRUE.simplify(assignments), sameInstance(TRUE));
    assertThat(FALSE.simplify(assignments), sameInstance(FALSE));
  }

  /** An equality that is still possible is returned unchanged. */
  @Test
  void testPossibleEq() {
    final Term e = eq("t", "v1");
    assertThat(e.simplify(assignments), sameInstance(e));
  }

  /** An equality between a variable and a value that is no longer among the
   * variable's candidates is false. */
  @Test
  void testImpossibleEq() {
    assertThat(eq("t", "v3").simplify(assignments), is(FALSE));
    assertThat(eq("t", "v1").simplify(ImmutableMap.of()), is(FALSE));
  }

  /** An equality between two variables becomes a disjunction over the values
   * they have in common. */
  @Test
  void testVariableEq() {
    assertThat(eq("x", "y").simplify(assignments),
        is(and(eq("x", "2"), eq("y", "2"))));

    final Map<String, Set<String>> assignments2 =
        ImmutableMap.of("x", ImmutableSet.of("1", "2", "3"),
            "y", ImmutableSet.of("1", "2", "3"));
    final Term term = eq("x", "y").simplify(assignments2);
    assertThat(term,
        is(
            or(and(eq("x", "1"), eq("y", "1")),
                and(eq("x", "2"), eq("y", "2")),
                and(eq("x", "3"), eq("y", "3")))));
  }

  @Test
  void testDisjointVariableEq() {
    assertThat(eq("t", "x").simplify(assignments), is(FALSE));
  }

  /** If one variable is a candidate of the other, the equality is
   * possible. */
  @Test
  void testVariableIsCandidate() {
    final Map<String, Set<String>> assignments2 =
        ImmutableMap.of("x", ImmutableSet.of("y", "1"),
            "y", ImmutableSet.of("2"));
    final Term e = eq("x", "y");
    assertThat(e.simplify(assignments2), sameInstance(e));
  }

  @Test
  void testAnd() {
    assertThat(and(eq("t", "v1"), eq("t", "v3")).simplify(assignments),
        is(FALSE));
    assertThat(and(eq("t", "v1"), or(eq("x", "1"), eq("x", "4")))
            .simplify(assignments),
        is(and(eq("t", "v1"), eq("x", "1"))));
  }

  @Test
  void testOr() {
    assertThat(or(eq("t", "v1"), eq("t", "v3")).simplify(assignments),
        is(eq("t", "v1")));
    assertThat(or(eq("t", "v3"), eq("x", "4")).simplify(assignments),
        is(FALSE));
  }

  @Test
  void testUnchangedJunction() {
    final Term term = or(eq("t", "v1"), and(eq("x", "1"), eq("y", "3")));
    assertThat(term.simplify(assignments), sameInstance(term));
  }

  /** The example from {@link Term#extractPivots()}. */
  @Test
  void testNested() {
    final Term term =
        or(eq("t", "v1"), and(eq("t", "v2"), or(eq("t", "v2"), eq("t", "v3"))));
    assertThat(term.simplify(assignments),
        is(or(eq("t", "v1"), eq("t", "v2"))));
  }
}

// End SimplifyTest.java
