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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Op;
import net.hydromatic.planar.ast.TensorRef;
import net.hydromatic.planar.ast.Visitor;
import net.hydromatic.planar.eval.Prop;

/**
 * Result of compiling a diagram program: the statements to run, in order,
 * and the locals that they use.
 *
 * <p>The block starts with a {@link Diagram.Binding} for each object that
 * exists before the plan runs and the arity checks, continues with the
 * lowered program (in which the definitions of braidings and temporaries
 * precede the statements that use them), and ends with a
 * {@link Diagram.Export} for each object that the plan defines.
 */
public class ContractionPlan {
  public final Diagram.Block block;
  public final Locals locals;
  public final Prop.Mode mode;

  ContractionPlan(Diagram.Block block, Locals locals, Prop.Mode mode) {
    this.block = requireNonNull(block);
    this.locals = requireNonNull(locals);
    this.mode = requireNonNull(mode);
  }

  /** Returns the definitions of temporaries, in the order they run,
   * including those inside nested blocks. */
  public List<Diagram.Assignment> temporaries() {
    final ImmutableList.Builder<Diagram.Assignment> b =
        ImmutableList.builder();
    block.accept(
        new Visitor() {
          @Override protected void visit(Diagram.Assignment assignment) {
            if (isTemporary(assignment)) {
              b.add(assignment);
            }
          }
        });
    return b.build();
  }

  /** Returns the top-level statements of the lowered program other than
   * the definitions of temporaries and braidings. */
  public List<Diagram.Stmt> finals() {
    final ImmutableList.Builder<Diagram.Stmt> b = ImmutableList.builder();
    for (Diagram.Stmt stmt : block.stmts) {
      switch (stmt.op) {
        case BINDING:
        case ARITY_CHECK:
        case BRAIDING_DEFINITION:
        case EXPORT:
          break;
        default:
          if (!isTemporary(stmt)) {
            b.add(stmt);
          }
      }
    }
    return b.build();
  }

  private boolean isTemporary(Diagram.Stmt stmt) {
    if (stmt.op != Op.DEFINITION) {
      return false;
    }
    final Diagram.Exp lhs = ((Diagram.Assignment) stmt).lhs;
    if (!(lhs instanceof Diagram.TensorTerm)) {
      return false;
    }
    final TensorRef ref = ((Diagram.TensorTerm) lhs).ref;
    return ref.kind == TensorRef.Kind.LOCAL
        && locals.get(ref).kind == Locals.Kind.TEMPORARY;
  }

  @Override
  public String toString() {
    return block.toString();
  }
}

// End ContractionPlan.java
