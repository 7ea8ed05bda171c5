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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

/** Builds diagram nodes. */
public enum DiagramBuilder {
  /**
   * The singleton instance of the diagram builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  diagram;

  /**
   * Creates a list of indices.
   *
   * <p>A name that consists of digits becomes a positional index; any other
   * name becomes a symbolic index.
   */
  public ImmutableList<Index> indices(String... names) {
    return indices(Arrays.asList(names));
  }

  /** Creates a list of indices from a list of names. */
  public ImmutableList<Index> indices(List<String> names) {
    final ImmutableList.Builder<Index> b = ImmutableList.builder();
    for (String name : names) {
      b.add(index(name));
    }
    return b.build();
  }

  /** Creates an index from a name; digits make a positional index. */
  public Index index(String name) {
    checkArgument(!name.isEmpty(), "empty index");
    if (name.chars().allMatch(Character::isDigit)) {
      return Index.of(Integer.parseInt(name));
    }
    return Index.of(name);
  }

  public Diagram.TensorTerm tensor(Pos pos, TensorRef ref, boolean adjoint,
      List<Index> left, List<Index> right) {
    return new Diagram.TensorTerm(pos, ref, adjoint, ImmutableList.copyOf(left),
        ImmutableList.copyOf(right));
  }

  public Diagram.TensorTerm tensor(TensorRef ref, boolean adjoint,
      List<Index> left, List<Index> right) {
    return tensor(Pos.ZERO, ref, adjoint, left, right);
  }

  /** Creates a reference to a named tensor, "{@code A[a b; c]}". */
  public Diagram.TensorTerm tensor(String name, List<Index> left,
      List<Index> right) {
    return tensor(Pos.ZERO, TensorRef.named(name), false, left, right);
  }

  /** Creates a reference to the adjoint of a named tensor,
   * "{@code A'[c; a b]}". */
  public Diagram.TensorTerm adjoint(String name, List<Index> left,
      List<Index> right) {
    return tensor(Pos.ZERO, TensorRef.named(name), true, left, right);
  }

  public Diagram.Scalar scalar(Pos pos, String text) {
    return new Diagram.Scalar(pos, text);
  }

  public Diagram.Scalar scalar(String text) {
    return scalar(Pos.ZERO, text);
  }

  public Diagram.Conj conj(Pos pos, Diagram.Exp exp) {
    return new Diagram.Conj(pos, exp);
  }

  public Diagram.Conj conj(Diagram.Exp exp) {
    return conj(Pos.ZERO, exp);
  }

  public Diagram.Product times(Pos pos, Diagram.Exp a0, Diagram.Exp a1) {
    return new Diagram.Product(pos, a0, a1);
  }

  public Diagram.Product times(Diagram.Exp a0, Diagram.Exp a1) {
    return times(Pos.ZERO, a0, a1);
  }

  /**
   * Creates a left-deep product of one or more expressions;
   * {@code times(a, b, c)} is {@code (a * b) * c}.
   */
  public Diagram.Exp times(Diagram.Exp a0, Diagram.Exp... args) {
    Diagram.Exp e = a0;
    for (Diagram.Exp arg : args) {
      e = times(Pos.sum(ImmutableList.of(e, arg)), e, arg);
    }
    return e;
  }

  public Diagram.Sum sum(Pos pos, List<Diagram.Exp> args, List<Op> signs) {
    return new Diagram.Sum(pos, ImmutableList.copyOf(args),
        ImmutableList.copyOf(signs));
  }

  public Diagram.Sum plus(Diagram.Exp a0, Diagram.Exp a1) {
    return sum(Pos.ZERO, ImmutableList.of(a0, a1),
        ImmutableList.of(Op.PLUS, Op.PLUS));
  }

  public Diagram.Sum minus(Diagram.Exp a0, Diagram.Exp a1) {
    return sum(Pos.ZERO, ImmutableList.of(a0, a1),
        ImmutableList.of(Op.PLUS, Op.MINUS));
  }

  public Diagram.Sum negate(Diagram.Exp a0) {
    return sum(Pos.ZERO, ImmutableList.of(a0), ImmutableList.of(Op.MINUS));
  }

  public Diagram.Assignment assignment(Pos pos, Op op, Diagram.Exp lhs,
      Diagram.Exp rhs) {
    return new Diagram.Assignment(pos, op, lhs, rhs);
  }

  /** Creates a definition, "{@code lhs := rhs}". */
  public Diagram.Assignment define(Diagram.Exp lhs, Diagram.Exp rhs) {
    return assignment(Pos.ZERO, Op.DEFINITION, lhs, rhs);
  }

  /** Creates an assignment to an existing object, "{@code lhs = rhs}". */
  public Diagram.Assignment assign(Diagram.Exp lhs, Diagram.Exp rhs) {
    return assignment(Pos.ZERO, Op.ASSIGNMENT, lhs, rhs);
  }

  public Diagram.Block block(Pos pos, List<? extends Diagram.Stmt> stmts) {
    return new Diagram.Block(pos, ImmutableList.copyOf(stmts));
  }

  public Diagram.Block block(Diagram.Stmt... stmts) {
    return block(Pos.ZERO, Arrays.asList(stmts));
  }

  public Diagram.OpaqueBlock opaqueBlock(Pos pos, String header,
      Diagram.Block body) {
    return new Diagram.OpaqueBlock(pos, header, body);
  }

  public Diagram.AnnotatedBlock annotatedBlock(Pos pos, Diagram.Block body) {
    return new Diagram.AnnotatedBlock(pos, body);
  }

  public Diagram.Binding binding(TensorRef local, TensorRef object) {
    return new Diagram.Binding(Pos.ZERO, local, object);
  }

  public Diagram.ArityCheck arityCheck(Pos pos, TensorRef local,
      String objectName, int numOut, int numIn) {
    return new Diagram.ArityCheck(pos, local, objectName, numOut, numIn);
  }

  public Diagram.BraidingDefinition braidingDefinition(Pos pos,
      TensorRef local, SpaceRef space1, SpaceRef space2) {
    return new Diagram.BraidingDefinition(pos, local, space1, space2);
  }

  public Diagram.Export export(TensorRef object, TensorRef local) {
    return new Diagram.Export(Pos.ZERO, object, local);
  }
}

// End DiagramBuilder.java
