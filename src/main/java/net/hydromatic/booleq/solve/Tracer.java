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

import java.util.Map;
import java.util.Set;
import net.hydromatic.booleq.term.Term;

/**
 * Called on various events while a {@link Solver} is solving.
 *
 * <p>Maps and sets passed to a tracer are snapshots; the tracer may keep them.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called with the candidates of each variable before any narrowing. */
  void onInitial(Map<String, ? extends Set<String>> assignments);

  /** Called with the pivots of the simplified ground truth. */
  void onGroundPivots(Map<String, ? extends Set<String>> pivots);

  /**
   * Called when a value is removed from a variable's candidates because its
   * implication simplified to {@code FALSE}.
   */
  void onRemove(String variable, String value, Term implication);

  /** Called when a pivot shrinks a variable's candidates. */
  void onNarrow(String variable, Set<String> before, Set<String> after);

  /** Called at the end of each pass of the fixpoint loop. */
  void onPass(int pass, boolean changed);

  /** Called with the final candidates of each variable. */
  void onSolution(Map<String, ? extends Set<String>> assignments);
}

// End Tracer.java
