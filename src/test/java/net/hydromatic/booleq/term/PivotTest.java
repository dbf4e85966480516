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
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

/** Tests {@link Term#extractPivots()}. */
public class PivotTest {
  @Test
  void testConstants() {
    assertThat(TRUE.extractPivots(), anEmptyMap());
    assertThat(FALSE.extractPivots(), anEmptyMap());
  }

  @Test
  void testEq() {
    assertThat(eq("a", "b").extractPivots(),
        is(
            ImmutableMap.of("a", ImmutableSet.of("b"),
                "b", ImmutableSet.of("a"))));
  }

  /** In a conjunction, every term's bounds apply. */
  @Test
  void testAnd() {
    assertThat(and(eq("t", "v1"), eq("u", "w1")).extractPivots(),
        is(
            ImmutableMap.of("t", ImmutableSet.of("v1"),
                "v1", ImmutableSet.of("t"),
                "u", ImmutableSet.of("w1"),
                "w1", ImmutableSet.of("u"))));

    // "t" cannot be both "v1" and "v2"
    assertThat(and(eq("t", "v1"), eq("t", "v2")).extractPivots(),
        is(
            ImmutableMap.of("t", ImmutableSet.<String>of(),
                "v1", ImmutableSet.of("t"),
                "v2", ImmutableSet.of("t"))));
  }

  /** In a disjunction, only labels bounded by every term are bounded. */
  @Test
  void testOr() {
    assertThat(or(eq("t", "v1"), eq("t", "v2")).extractPivots(),
        is(ImmutableMap.of("t", ImmutableSet.of("v1", "v2"))));
    assertThat(or(eq("t", "v1"), eq("u", "v1")).extractPivots(),
        is(ImmutableMap.of("v1", ImmutableSet.of("t", "u"))));
    assertThat(or(eq("t", "v1"), eq("u", "w1")).extractPivots(),
        anEmptyMap());
  }

  @Test
  void testNested() {
    final Term term =
        or(eq("t", "v1"), and(eq("t", "v2"), or(eq("t", "v2"), eq("t", "v3"))));
    assertThat(term.extractPivots(),
        is(ImmutableMap.of("t", ImmutableSet.of("v1", "v2"))));
  }

  /** Without simplification, a variable may be bounded by another
   * variable. */
  @Test
  void testVariableCandidate() {
    assertThat(or(eq("x", "y"), eq("x", "a")).extractPivots(),
        is(ImmutableMap.of("x", ImmutableSet.of("y", "a"))));
  }
}

// End PivotTest.java
