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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.planar.ast.Diagram;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Removes braiding terms whose legs are transposed, and which are therefore
 * the identity once their indices have been identified.
 *
 * <p>A braiding {@code τ[a b; b a]} is removable; {@code τ[a b; a b]} is not,
 * and neither is a braiding that is a term of a sum, because removing it
 * would change the value of the expression.
 */
public abstract class BraidingPurger {
  private BraidingPurger() {}

  /** Removes the braidings from a statement.
   *
   * @throws CompileException if a braiding cannot be removed */
  public static Diagram.Stmt purge(Diagram.Stmt stmt) {
    switch (stmt.op) {
      case DEFINITION:
      case ASSIGNMENT:
        final Diagram.Assignment assignment = (Diagram.Assignment) stmt;
        final Diagram.Exp rhs = purgeExp(assignment.rhs);
        if (rhs == null) {
          throw CompileException.unsafeRemoval(assignment,
              "no right-hand side remains");
        }
        return assignment.copy(assignment.lhs, rhs);

      case BLOCK:
        final Diagram.Block block = (Diagram.Block) stmt;
        final List<Diagram.Stmt> stmts = new ArrayList<>();
        block.stmts.forEach(s -> stmts.add(purge(s)));
        return block.copy(stmts);

      case OPAQUE_BLOCK:
        final Diagram.OpaqueBlock opaqueBlock = (Diagram.OpaqueBlock) stmt;
        return opaqueBlock.copy((Diagram.Block) purge(opaqueBlock.body));

      case TENSOR:
      case SCALAR:
      case CONJ:
      case TIMES:
      case SUM:
        final Diagram.Exp exp = purgeExp((Diagram.Exp) stmt);
        if (exp == null) {
          throw CompileException.unsafeRemoval(stmt, "nothing remains");
        }
        return exp;

      default:
        return stmt;
    }
  }

  /** Removes the braidings from an expression; returns null if nothing
   * remains. */
  private static Diagram.@Nullable Exp purgeExp(Diagram.Exp exp) {
    switch (exp.op) {
      case TENSOR:
        final Diagram.TensorTerm term = (Diagram.TensorTerm) exp;
        if (!term.ref.isBraiding()) {
          return term;
        }
        if (term.left.size() != 2 || term.right.size() != 2) {
          throw CompileException.braidingArity(term);
        }
        if (!term.left.get(0).equals(term.right.get(1))
            || !term.left.get(1).equals(term.right.get(0))) {
          throw CompileException.unsafeRemoval(term,
              "legs are not transposed");
        }
        return null;

      case SCALAR:
        return exp;

      case CONJ:
        final Diagram.Conj conj = (Diagram.Conj) exp;
        final Diagram.Exp e = purgeExp(conj.exp);
        return e == null ? null : conj.copy(e);

      case TIMES:
        final Diagram.Product product = (Diagram.Product) exp;
        final Diagram.Exp a0 = purgeExp(product.a0);
        final Diagram.Exp a1 = purgeExp(product.a1);
        if (a0 == null) {
          return a1;
        }
        if (a1 == null) {
          return a0;
        }
        return product.copy(a0, a1);

      case SUM:
        final Diagram.Sum sum = (Diagram.Sum) exp;
        final List<Diagram.Exp> args = new ArrayList<>();
        for (Diagram.Exp arg : sum.args) {
          final Diagram.Exp a = purgeExp(arg);
          if (a == null) {
            throw CompileException.unsafeRemoval(arg,
                "braiding is a term of a sum");
          }
          args.add(a);
        }
        return sum.copy(args);

      default:
        throw CompileException.unknownExpression(exp);
    }
  }
}

// End BraidingPurger.java
