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

/** Visits diagram trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends DiagramNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Diagram.TensorTerm tensorTerm) {}

  protected void visit(Diagram.Scalar scalar) {}

  protected void visit(Diagram.Conj conj) {
    conj.exp.accept(this);
  }

  protected void visit(Diagram.Product product) {
    product.a0.accept(this);
    product.a1.accept(this);
  }

  protected void visit(Diagram.Sum sum) {
    sum.args.forEach(this::accept);
  }

  // statements

  protected void visit(Diagram.Assignment assignment) {
    assignment.lhs.accept(this);
    assignment.rhs.accept(this);
  }

  protected void visit(Diagram.Block block) {
    block.stmts.forEach(this::accept);
  }

  protected void visit(Diagram.OpaqueBlock opaqueBlock) {
    opaqueBlock.body.accept(this);
  }

  protected void visit(Diagram.AnnotatedBlock annotatedBlock) {}

  protected void visit(Diagram.Binding binding) {}

  protected void visit(Diagram.ArityCheck arityCheck) {}

  protected void visit(Diagram.BraidingDefinition braidingDefinition) {}

  protected void visit(Diagram.Export export) {}
}

// End Visitor.java
