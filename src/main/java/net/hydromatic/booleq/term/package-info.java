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

/**
 * Boolean terms over equalities between labels.
 *
 * <p>A term is {@code TRUE}, {@code FALSE}, an equality between two labels,
 * or a conjunction or disjunction of terms. Terms are immutable and are
 * created in canonical form by the factory methods in
 * {@link net.hydromatic.booleq.term.Terms}.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.booleq.term.Term} - A term. Can simplify itself
 *       given the candidate values of variables, and can extract the bounds
 *       it places on labels.
 *   <li>{@link net.hydromatic.booleq.term.Terms} - Factory methods.
 *   <li>{@link net.hydromatic.booleq.term.Op} - Kind of term, and its
 *       precedence when unparsed.
 * </ul>
 */
package net.hydromatic.booleq.term;

// End package-info.java
