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
package net.hydromatic.booleq.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns whether a predicate is true for all elements of a collection. */
  public static <E> boolean allMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Returns whether two collections have the same size and, position by
   * position, the same (identical) elements.
   */
  public static <E> boolean sameElements(
      Collection<? extends E> c0, Collection<? extends E> c1) {
    if (c0.size() != c1.size()) {
      return false;
    }
    final Iterator<? extends E> i0 = c0.iterator();
    final Iterator<? extends E> i1 = c1.iterator();
    while (i0.hasNext()) {
      if (i0.next() != i1.next()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the set of candidates of a label in an assignment, or the empty
   * set if the label has no entry.
   */
  public static Set<String> candidates(
      Map<String, ? extends Set<String>> assignments, String label) {
    final Set<String> set = assignments.get(label);
    return set == null ? ImmutableSet.of() : set;
  }

  /**
   * Copies a map of sets into an immutable map of immutable sets, preserving
   * the order of keys and of elements.
   */
  public static ImmutableMap<String, ImmutableSet<String>> immutableCopy(
      Map<String, ? extends Set<String>> map) {
    final ImmutableMap.Builder<String, ImmutableSet<String>> b =
        ImmutableMap.builderWithExpectedSize(map.size());
    map.forEach((k, v) -> b.put(k, ImmutableSet.copyOf(v)));
    return b.build();
  }

  /**
   * Returns the contents of a StringBuilder and clears it for the next use.
   */
  public static String str(StringBuilder b) {
    String s = b.toString();
    b.setLength(0);
    return s;
  }
}

// End Static.java
