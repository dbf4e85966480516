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

/**
 * Visitor for terms.
 *
 * <p>There is one method per kind of term; adding a kind of term breaks every
 * visitor until it handles the new kind.
 *
 * @param <R> return type
 * @see Term#accept(TermVisitor)
 */
public interface TermVisitor<R> {
  R visit(Term.Constant constant);

  R visit(Term.Eq eq);

  R visit(Term.And and);

  R visit(Term.Or or);
}

// End TermVisitor.java
