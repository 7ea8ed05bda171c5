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

import java.util.ArrayList;
import java.util.List;

/**
 * Visits and transforms diagram trees.
 *
 * <p>Every method returns a node of the same kind, or a node that may stand
 * in the same place; the default implementations rebuild a node only if one
 * of its children changed.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends DiagramNode> List<E> visitList(List<E> nodes) {
    final List<E> list = new ArrayList<>();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list;
  }

  // expressions

  protected Diagram.Exp visit(Diagram.TensorTerm tensorTerm) {
    return tensorTerm; // leaf
  }

  protected Diagram.Exp visit(Diagram.Scalar scalar) {
    return scalar; // leaf
  }

  protected Diagram.Exp visit(Diagram.Conj conj) {
    return conj.copy(conj.exp.accept(this));
  }

  protected Diagram.Exp visit(Diagram.Product product) {
    return product.copy(product.a0.accept(this), product.a1.accept(this));
  }

  protected Diagram.Exp visit(Diagram.Sum sum) {
    return sum.copy(visitList(sum.args));
  }

  // statements

  protected Diagram.Stmt visit(Diagram.Assignment assignment) {
    return assignment.copy(assignment.lhs.accept(this),
        assignment.rhs.accept(this));
  }

  protected Diagram.Block visit(Diagram.Block block) {
    return block.copy(visitList(block.stmts));
  }

  protected Diagram.Stmt visit(Diagram.OpaqueBlock opaqueBlock) {
    return opaqueBlock.copy(opaqueBlock.body.accept(this));
  }

  protected Diagram.Stmt visit(Diagram.AnnotatedBlock annotatedBlock) {
    return annotatedBlock; // not rewritten
  }

  protected Diagram.Stmt visit(Diagram.Binding binding) {
    return binding; // leaf
  }

  protected Diagram.Stmt visit(Diagram.ArityCheck arityCheck) {
    return arityCheck; // leaf
  }

  protected Diagram.Stmt visit(
      Diagram.BraidingDefinition braidingDefinition) {
    return braidingDefinition; // leaf
  }

  protected Diagram.Stmt visit(Diagram.Export export) {
    return export; // leaf
  }
}

// End Shuttle.java
