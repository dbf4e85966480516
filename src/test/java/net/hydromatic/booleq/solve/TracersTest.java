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

import static net.hydromatic.booleq.term.Terms.FALSE;
import static net.hydromatic.booleq.term.Terms.eq;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

/** Tests {@link Tracers}. */
public class TracersTest {
  /** Solves a problem using a print tracer, and returns what it printed. */
  private static String trace(Consumer<Solver> setup) {
    final StringWriter sw = new StringWriter();
    final Solver solver =
        new Solver(ImmutableMap.of(),
            Tracers.printTracer(new PrintWriter(sw)));
    setup.accept(solver);
    solver.solve();
    return sw.toString().replace(System.lineSeparator(), "\n");
  }

  @Test
  void testPrintTracerRemove() {
    final String s =
        trace(solver -> {
          solver.registerVariable("x");
          solver.registerVariable("y");
          solver.registerValue("a");
          solver.registerValue("b");
          solver.registerValue("c");
          solver.implies(eq("x", "a"), eq("y", "c"));
          solver.implies(eq("y", "c"), FALSE);
        });
    final String expected = "initial {x=[a, b, c], y=[a, b]}\n"
        + "ground {}\n"
        + "remove x a; y == c\n"
        + "pass 1 changed\n"
        + "pass 2\n"
        + "solution {x=[b, c], y=[a, b]}\n";
    assertThat(s, is(expected));
  }

  @Test
  void testPrintTracerNarrow() {
    final String s =
        trace(solver -> {
          solver.registerVariable("x");
          solver.registerVariable("y");
          solver.registerValue("a");
          solver.registerValue("b");
          solver.implies(eq("x", "a"), eq("y", "b"));
          solver.implies(eq("x", "b"), eq("y", "b"));
        });
    final String expected = "initial {x=[a, b], y=[a, b]}\n"
        + "ground {}\n"
        + "narrow y [a, b] -> [b]\n"
        + "pass 1 changed\n"
        + "pass 2\n"
        + "solution {x=[a, b], y=[b]}\n";
    assertThat(s, is(expected));
  }

  /** A configurable tracer calls only the handlers that have been set. */
  @Test
  void testConfigurableTracer() {
    final List<String> list = new ArrayList<>();
    final Tracer tracer =
        Tracers.nullTracer()
            .withPassHandler((pass, changed) -> list.add(pass + ":" + changed));
    final Solver solver = new Solver(ImmutableMap.of(), tracer);
    solver.registerVariable("x");
    solver.registerValue("a");
    solver.registerValue("b");
    solver.implies(eq("x", "a"), FALSE);
    assertThat(solver.solve().get("x").asList(), is(List.of("b")));
    assertThat(list, is(List.of("1:false")));
  }

  /** The null tracer ignores every event. */
  @Test
  void testNullTracer() {
    final Tracer tracer = Tracers.nullTracer();
    tracer.onPass(1, true);
    tracer.onRemove("x", "a", FALSE);
    tracer.onInitial(ImmutableMap.of());
    assertThat(Tracers.nullTracer(), is(tracer));
  }
}

// End TracersTest.java
