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
package net.hydromatic.planar.compile;

import static java.util.Objects.requireNonNull;

import java.util.List;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.DiagramNode;
import net.hydromatic.planar.ast.Pos;
import net.hydromatic.planar.ast.TensorRef;
import net.hydromatic.planar.util.PlanarException;

/**
 * An error occurred during compilation.
 *
 * <p>Every error aborts the compilation of the whole program; the diagram
 * must be corrected at the source.
 */
public class CompileException extends RuntimeException
    implements PlanarException {
  public final Kind kind;
  /** Text of the node that caused the error. */
  public final String offending;
  private final Pos pos;

  public CompileException(Kind kind, String message, String offending,
      Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.offending = requireNonNull(offending);
    this.pos = requireNonNull(pos);
  }

  private CompileException(Kind kind, String message, DiagramNode node) {
    this(kind, message, node.toString(), node.pos);
  }

  /** Creates an exception for a tensor whose number of legs differs from
   * the number that the diagram uses. */
  public static CompileException arityMismatch(Diagram.ArityCheck check,
      int numOut, int numIn) {
    return new CompileException(Kind.ARITY_MISMATCH,
        "incorrect number of input-output indices: ("
            + check.numOut + ", " + check.numIn + ") instead of ("
            + numOut + ", " + numIn + ") for " + check.objectName + ".",
        check);
  }

  /** Creates an exception for an assignment to the braiding. */
  public static CompileException reservedName(DiagramNode node) {
    return new CompileException(Kind.RESERVED_NAME,
        "The name " + TensorRef.BRAIDING_NAME + " is reserved for the "
            + "braiding, and should not be assigned to.",
        node);
  }

  /** Creates an exception for a braiding that does not have two left and
   * two right indices. */
  public static CompileException braidingArity(Diagram.TensorTerm term) {
    return new CompileException(Kind.RESERVED_NAME,
        "The name " + TensorRef.BRAIDING_NAME + " is reserved for the "
            + "braiding, and should have two input and two output indices: "
            + term,
        term);
  }

  /** Creates an exception for braiding strands whose space cannot be
   * derived from any neighboring tensor. */
  public static CompileException unresolvedBraiding(List<?> unresolved,
      DiagramNode node) {
    return new CompileException(Kind.UNRESOLVED_BRAIDING,
        "cannot determine the spaces of indices " + unresolved
            + " for the braiding tensors in " + node,
        node);
  }

  /** Creates an exception for an expression that cannot be drawn in the
   * plane with its legs in the required order. */
  public static CompileException notPlanar(DiagramNode node) {
    return new CompileException(Kind.NOT_PLANAR,
        "not a planar diagram expression: " + node, node);
  }

  /** Creates an exception for a braiding that cannot be removed without
   * changing the value of the expression. */
  public static CompileException unsafeRemoval(DiagramNode node,
      String reason) {
    return new CompileException(Kind.UNSAFE_REMOVAL,
        "unable to remove braiding tensor " + node + ": " + reason, node);
  }

  /** Creates an exception for an expression of a shape the compiler does
   * not know. */
  public static CompileException unknownExpression(DiagramNode node) {
    return new CompileException(Kind.UNKNOWN_EXPRESSION,
        "unknown tensor expression: " + node, node);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }

  /** Kind of compilation error. */
  public enum Kind {
    /** Declared leg counts disagree with the object's actual leg counts. */
    ARITY_MISMATCH,
    /** The braiding name is assigned to, or used with the wrong legs. */
    RESERVED_NAME,
    /** A braiding leg has no derivable space. */
    UNRESOLVED_BRAIDING,
    /** No admissible index order matches the required order. */
    NOT_PLANAR,
    /** A braiding's legs are not mutually transposed. */
    UNSAFE_REMOVAL,
    /** A node is not a scalar, tensor, product or sum. */
    UNKNOWN_EXPRESSION
  }
}

// End CompileException.java
