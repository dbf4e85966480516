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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.booleq.util.Static.str;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.booleq.term.Term;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Implementations of {@link Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static ConfigurableTracer nullTracer() {
    return ConfigurableTracerImpl.INITIAL;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static ConfigurableTracer printTracer(PrintWriter w) {
    final PrintTracer p = new PrintTracer(w);
    return ConfigurableTracerImpl.INITIAL
        .withInitialHandler(p::onInitial)
        .withGroundPivotsHandler(p::onGroundPivots)
        .withRemoveHandler(p::onRemove)
        .withNarrowHandler(p::onNarrow)
        .withPassHandler(p::onPass)
        .withSolutionHandler(p::onSolution);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static ConfigurableTracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /**
   * Returns a tracer that writes debugging messages to the log, at TRACE
   * level.
   */
  public static ConfigurableTracer logTracer() {
    final LogTracer t = new LogTracer(LogManager.getFormatterLogger());
    return ConfigurableTracerImpl.INITIAL
        .withInitialHandler(t::onInitial)
        .withGroundPivotsHandler(t::onGroundPivots)
        .withRemoveHandler(t::onRemove)
        .withNarrowHandler(t::onNarrow)
        .withPassHandler(t::onPass)
        .withSolutionHandler(t::onSolution);
  }

  /**
   * Implementation of {@link Tracer} that writes to a given {@link
   * PrintWriter}.
   */
  private static class PrintTracer implements Tracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(str(b));
      w.flush();
    }

    public void onInitial(Map<String, ? extends Set<String>> assignments) {
      b.append("initial ").append(assignments);
      flush();
    }

    public void onGroundPivots(Map<String, ? extends Set<String>> pivots) {
      b.append("ground ").append(pivots);
      flush();
    }

    public void onRemove(String variable, String value, Term implication) {
      b.append("remove ")
          .append(variable)
          .append(' ')
          .append(value)
          .append("; ")
          .append(implication);
      flush();
    }

    public void onNarrow(String variable, Set<String> before,
        Set<String> after) {
      b.append("narrow ")
          .append(variable)
          .append(' ')
          .append(before)
          .append(" -> ")
          .append(after);
      flush();
    }

    public void onPass(int pass, boolean changed) {
      b.append("pass ").append(pass).append(changed ? " changed" : "");
      flush();
    }

    public void onSolution(Map<String, ? extends Set<String>> assignments) {
      b.append("solution ").append(assignments);
      flush();
    }
  }

  /** Implementation of {@link Tracer} that writes to a logger. */
  private static class LogTracer implements Tracer {
    private final Logger log;

    LogTracer(Logger log) {
      this.log = requireNonNull(log);
    }

    public void onInitial(Map<String, ? extends Set<String>> assignments) {
      log.trace("initial %s", assignments);
    }

    public void onGroundPivots(Map<String, ? extends Set<String>> pivots) {
      log.trace("ground %s", pivots);
    }

    public void onRemove(String variable, String value, Term implication) {
      log.trace("remove %s %s; %s", variable, value, implication);
    }

    public void onNarrow(String variable, Set<String> before,
        Set<String> after) {
      log.trace("narrow %s %s -> %s", variable, before, after);
    }

    public void onPass(int pass, boolean changed) {
      log.trace("pass %d%s", pass, changed ? " changed" : "");
    }

    public void onSolution(Map<String, ? extends Set<String>> assignments) {
      log.trace("solution %s", assignments);
    }
  }

  /** Tracer that allows each of its methods to be modified using a handler. */
  public interface ConfigurableTracer extends Tracer {
    /** Sets handler for {@link #onInitial(Map)}. */
    ConfigurableTracer withInitialHandler(
        Consumer<Map<String, ? extends Set<String>>> handler);
    /** Sets handler for {@link #onGroundPivots(Map)}. */
    ConfigurableTracer withGroundPivotsHandler(
        Consumer<Map<String, ? extends Set<String>>> handler);
    /** Sets handler for {@link #onRemove(String, String, Term)}. */
    ConfigurableTracer withRemoveHandler(
        TriConsumer<String, String, Term> handler);
    /** Sets handler for {@link #onNarrow(String, Set, Set)}. */
    ConfigurableTracer withNarrowHandler(
        TriConsumer<String, Set<String>, Set<String>> handler);
    /** Sets handler for {@link #onPass(int, boolean)}. */
    ConfigurableTracer withPassHandler(BiConsumer<Integer, Boolean> handler);
    /** Sets handler for {@link #onSolution(Map)}. */
    ConfigurableTracer withSolutionHandler(
        Consumer<Map<String, ? extends Set<String>>> handler);
  }

  /**
   * Consumer that accepts three arguments.
   *
   * @param <T> First argument type
   * @param <U> Second argument type
   * @param <V> Third argument type
   */
  @FunctionalInterface
  public interface TriConsumer<T, U, V> {
    void accept(T t, U u, V v);
  }

  /**
   * Implementation of {@link ConfigurableTracer} that has a field for each
   * handler.
   */
  private static class ConfigurableTracerImpl implements ConfigurableTracer {
    static final ConfigurableTracerImpl INITIAL =
        new ConfigurableTracerImpl(
            assignments -> {},
            pivots -> {},
            (variable, value, implication) -> {},
            (variable, before, after) -> {},
            (pass, changed) -> {},
            assignments -> {});

    private final Consumer<Map<String, ? extends Set<String>>> initialHandler;
    private final Consumer<Map<String, ? extends Set<String>>>
        groundPivotsHandler;
    private final TriConsumer<String, String, Term> removeHandler;
    private final TriConsumer<String, Set<String>, Set<String>> narrowHandler;
    private final BiConsumer<Integer, Boolean> passHandler;
    private final Consumer<Map<String, ? extends Set<String>>> solutionHandler;

    private ConfigurableTracerImpl(
        Consumer<Map<String, ? extends Set<String>>> initialHandler,
        Consumer<Map<String, ? extends Set<String>>> groundPivotsHandler,
        TriConsumer<String, String, Term> removeHandler,
        TriConsumer<String, Set<String>, Set<String>> narrowHandler,
        BiConsumer<Integer, Boolean> passHandler,
        Consumer<Map<String, ? extends Set<String>>> solutionHandler) {
      this.initialHandler = requireNonNull(initialHandler);
      this.groundPivotsHandler = requireNonNull(groundPivotsHandler);
      this.removeHandler = requireNonNull(removeHandler);
      this.narrowHandler = requireNonNull(narrowHandler);
      this.passHandler = requireNonNull(passHandler);
      this.solutionHandler = requireNonNull(solutionHandler);
    }

    @Override
    public ConfigurableTracer withInitialHandler(
        Consumer<Map<String, ? extends Set<String>>> initialHandler) {
      return new ConfigurableTracerImpl(
          initialHandler,
          groundPivotsHandler,
          removeHandler,
          narrowHandler,
          passHandler,
          solutionHandler);
    }

    @Override
    public ConfigurableTracer withGroundPivotsHandler(
        Consumer<Map<String, ? extends Set<String>>> groundPivotsHandler) {
      return new ConfigurableTracerImpl(
          initialHandler,
          groundPivotsHandler,
          removeHandler,
          narrowHandler,
          passHandler,
          solutionHandler);
    }

    @Override
    public ConfigurableTracer withRemoveHandler(
        TriConsumer<String, String, Term> removeHandler) {
      return new ConfigurableTracerImpl(
          initialHandler,
          groundPivotsHandler,
          removeHandler,
          narrowHandler,
          passHandler,
          solutionHandler);
    }

    @Override
    public ConfigurableTracer withNarrowHandler(
        TriConsumer<String, Set<String>, Set<String>> narrowHandler) {
      return new ConfigurableTracerImpl(
          initialHandler,
          groundPivotsHandler,
          removeHandler,
          narrowHandler,
          passHandler,
          solutionHandler);
    }

    @Override
    public ConfigurableTracer withPassHandler(
        BiConsumer<Integer, Boolean> passHandler) {
      return new ConfigurableTracerImpl(
          initialHandler,
          groundPivotsHandler,
          removeHandler,
          narrowHandler,
          passHandler,
          solutionHandler);
    }

    @Override
    public ConfigurableTracer withSolutionHandler(
        Consumer<Map<String, ? extends Set<String>>> solutionHandler) {
      return new ConfigurableTracerImpl(
          initialHandler,
          groundPivotsHandler,
          removeHandler,
          narrowHandler,
          passHandler,
          solutionHandler);
    }

    @Override
    public void onInitial(Map<String, ? extends Set<String>> assignments) {
      initialHandler.accept(assignments);
    }

    @Override
    public void onGroundPivots(Map<String, ? extends Set<String>> pivots) {
      groundPivotsHandler.accept(pivots);
    }

    @Override
    public void onRemove(String variable, String value, Term implication) {
      removeHandler.accept(variable, value, implication);
    }

    @Override
    public void onNarrow(String variable, Set<String> before,
        Set<String> after) {
      narrowHandler.accept(variable, before, after);
    }

    @Override
    public void onPass(int pass, boolean changed) {
      passHandler.accept(pass, changed);
    }

    @Override
    public void onSolution(Map<String, ? extends Set<String>> assignments) {
      solutionHandler.accept(assignments);
    }
  }
}

// End Tracers.java
