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
 * Operator (or kind of term), with its left and right precedence and print
 * name.
 */
public enum Op {
  TRUE(0, 0, "TRUE"),
  FALSE(0, 0, "FALSE"),
  EQ(5, 5, " == "),
  AND(3, 4, " & "),
  OR(1, 2, " | ");

  final int left;
  final int right;
  final String str;

  Op(int left, int right, String str) {
    this.left = left;
    this.right = right;
    this.str = str;
  }

  /** Returns whether this is {@link #TRUE} or {@link #FALSE}. */
  public boolean isConstant() {
    return this == TRUE || this == FALSE;
  }
}

// End Op.java
