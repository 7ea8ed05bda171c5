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
package net.hydromatic.planar.ast;

/** Sub-types of {@link DiagramNode}. */
public enum Op {
  // expressions
  TENSOR(true),
  SCALAR(true),
  CONJ(true),
  TIMES(" * ", 7),
  PLUS(" + ", 6),
  MINUS(" - ", 6),
  SUM(" + ", 6),

  // statements
  DEFINITION(" := ", 3),
  ASSIGNMENT(" = ", 3),
  BLOCK,
  OPAQUE_BLOCK,
  ANNOTATED_BLOCK,

  // statements that only passes create
  BINDING(" = ", 3),
  ARITY_CHECK,
  BRAIDING_DEFINITION(" = ", 3),
  EXPORT(" = ", 3);

  /** Padded name, e.g. " * ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is the op of a statement that assigns a tensor. */
  public boolean isAssignment() {
    return this == DEFINITION || this == ASSIGNMENT;
  }
}

// End Op.java
