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
import static net.hydromatic.planar.ast.DiagramBuilder.diagram;
import static net.hydromatic.planar.util.Static.concat;
import static net.hydromatic.planar.util.Static.reverse;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Index;
import net.hydromatic.planar.ast.TensorRef;

/**
 * Decomposes tensor expressions into binary contractions whose results
 * are planar.
 *
 * <p>Each product of more than two tensors is split into steps; each step
 * contracts two general tensors (tensor terms, possibly scaled) into a
 * temporary whose legs are in an order that the rest of the expression can
 * contract without crossings. The definitions of the temporaries precede
 * the statement that uses them.
 *
 * <p>For example,
 *
 * <pre>{@code
 * D[a; d] := A[a; b] * B[b; c] * C[c; d]
 * }</pre>
 *
 * <p>becomes
 *
 * <pre>{@code
 * tmp#4[a; c] := A#0[a; b] * B#1[b; c]
 * D#3[a; d] := tmp#4[a; c] * C#2[c; d]
 * }</pre>
 */
public class ContractionDecomposer {
  private final Locals locals;

  private ContractionDecomposer(Locals locals) {
    this.locals = requireNonNull(locals);
  }

  /**
   * Decomposes the contractions in a program.
   *
   * @param block Program whose objects are bound and whose braidings are
   *   resolved
   * @param locals Arena in which to allocate temporaries
   * @throws CompileException if an expression is not planar, or has a shape
   *   that cannot be decomposed
   */
  public static Diagram.Block decompose(Diagram.Block block, Locals locals) {
    return new ContractionDecomposer(locals).decomposeBlock(block);
  }

  private Diagram.Block decomposeBlock(Diagram.Block block) {
    final List<Diagram.Stmt> stmts = new ArrayList<>();
    for (Diagram.Stmt stmt : block.stmts) {
      decomposeStmt(stmt, stmts);
    }
    return block.copy(stmts);
  }

  /** Decomposes a statement, adding the definitions of its temporaries and
   * the rewritten statement to a list. */
  private void decomposeStmt(Diagram.Stmt stmt, List<Diagram.Stmt> stmts) {
    switch (stmt.op) {
      case BLOCK:
        stmts.add(decomposeBlock((Diagram.Block) stmt));
        return;

      case OPAQUE_BLOCK:
        final Diagram.OpaqueBlock opaqueBlock = (Diagram.OpaqueBlock) stmt;
        stmts.add(opaqueBlock.copy(decomposeBlock(opaqueBlock.body)));
        return;

      case DEFINITION:
      case ASSIGNMENT:
        final Diagram.Assignment assignment = (Diagram.Assignment) stmt;
        if (TensorExps.isScalar(assignment.rhs)) {
          stmts.add(stmt);
          return;
        }
        final Target target;
        if (assignment.lhs instanceof Diagram.TensorTerm) {
          final Diagram.TensorTerm lhs = (Diagram.TensorTerm) assignment.lhs;
          target = Target.fixed(lhs.left, lhs.right);
        } else {
          target = Target.fixed(ImmutableList.of(), ImmutableList.of());
        }
        final Diagram.Exp rhs = extract(assignment.rhs, target, stmts);
        stmts.add(assignment.copy(assignment.lhs, rhs));
        return;

      case TENSOR:
      case CONJ:
      case TIMES:
      case SUM:
        final Diagram.Exp exp = (Diagram.Exp) stmt;
        if (TensorExps.isScalar(exp)) {
          stmts.add(stmt);
          return;
        }
        stmts.add(
            extract(exp,
                Target.suggested(ImmutableList.of(), ImmutableList.of()),
                stmts));
        return;

      default:
        stmts.add(stmt);
    }
  }

  /**
   * Lowers an expression into binary contractions.
   *
   * @param exp Expression
   * @param target Order of the legs that the result must have, or, for a
   *   sub-expression, an order that it would preferably have
   * @param pre List to which to add the definitions of temporaries
   * @return Lowered expression; a scalar, a general tensor, a product of two
   *   general tensors, or a sum of such
   */
  private Diagram.Exp extract(Diagram.Exp exp, Target target,
      List<Diagram.Stmt> pre) {
    if (TensorExps.isScalar(exp)) {
      return exp;
    }
    if (TensorExps.isGeneralTensor(exp)) {
      if (!target.fixed && TensorExps.hasTraceIndices(exp)) {
        return materialize(exp, target.left, target.right, pre);
      }
      return exp;
    }
    switch (exp.op) {
      case TIMES:
        return extractProduct((Diagram.Product) exp, target, pre);

      case SUM:
        final Diagram.Sum sum = (Diagram.Sum) exp;
        final List<Diagram.Exp> args = new ArrayList<>();
        for (Diagram.Exp arg : sum.args) {
          args.add(extract(arg, target, pre));
        }
        final Diagram.Exp lowered = sum.copy(args);
        if (!target.fixed && !TensorExps.isGeneralTensor(lowered)) {
          // an operand of a contraction must be a general tensor
          return materialize(lowered, target.left, target.right, pre);
        }
        return lowered;

      default:
        throw CompileException.unknownExpression(exp);
    }
  }

  private Diagram.Exp extractProduct(Diagram.Product product, Target target,
      List<Diagram.Stmt> pre) {
    final List<Index> order = target.order();

    // find the first split of the open legs that matches the target
    PlanarOrders.Complement match = null;
    search:
    for (List<Index> order1 : PlanarOrders.possibleOrders(product.a0)) {
      for (List<Index> order2 : PlanarOrders.possibleOrders(product.a1)) {
        for (PlanarOrders.Complement c
            : PlanarOrders.complements(order1, order2)) {
          if (PlanarOrders.isCyclicPermutation(c.openOrder(), order)) {
            match = c;
            break search;
          }
        }
      }
    }
    if (match == null) {
      throw CompileException.notPlanar(product);
    }

    // if the legs of the second operand come first in the target, the
    // second operand becomes the first
    final PlanarOrders.Complement split;
    final Diagram.Exp first;
    final Diagram.Exp second;
    if (target.left.containsAll(match.open2)
        && target.right.containsAll(match.open1)) {
      split = match.swap();
      first = product.a1;
      second = product.a0;
    } else {
      split = match;
      first = product.a0;
      second = product.a1;
    }
    Diagram.Exp a1 =
        extract(first,
            Target.suggested(split.open1, reverse(split.contracted1)), pre);
    Diagram.Exp a2 =
        extract(second,
            Target.suggested(split.contracted2, reverse(split.open2)), pre);
    List<Index> open1 = split.open1;
    List<Index> open2 = split.open2;

    if (TensorExps.isScalar(a1) || TensorExps.isScalar(a2)) {
      final Diagram.Exp scaled = diagram.times(product.pos, a1, a2);
      return target.fixed
          ? scaled
          : materialize(scaled, open1, reverse(open2), pre);
    }

    // the target of each operand was a suggestion; the lowered operands
    // have their actual orders
    final Diagram.TensorTerm t1 = TensorExps.generalTensor(a1);
    final Diagram.TensorTerm t2 = TensorExps.generalTensor(a2);
    if (t1.right.containsAll(open1) && t2.left.containsAll(open2)) {
      final Diagram.Exp a = a1;
      a1 = a2;
      a2 = a;
      final List<Index> o = open1;
      open1 = open2;
      open2 = o;
    }

    if (target.fixed && order.equals(concat(open1, open2))) {
      return diagram.times(product.pos, a1, a2);
    } else if (target.fixed && order.equals(concat(open2, open1))) {
      return diagram.times(product.pos, a2, a1);
    }
    return materialize(diagram.times(product.pos, a1, a2), open1,
        reverse(open2), pre);
  }

  /** Defines a temporary with given legs, and returns a reference to it. */
  private Diagram.TensorTerm materialize(Diagram.Exp exp, List<Index> left,
      List<Index> right, List<Diagram.Stmt> pre) {
    final TensorRef ref = locals.temporary();
    final Diagram.TensorTerm term =
        diagram.tensor(exp.pos, ref, false, left, right);
    pre.add(diagram.define(term, exp));
    return term;
  }

  /** Order of legs that an expression should have. */
  static class Target {
    final List<Index> left;
    final List<Index> right;
    /** Whether the order is required (the left-hand side of an assignment)
     * rather than suggested (a temporary that is yet to be defined). */
    final boolean fixed;

    private Target(List<Index> left, List<Index> right, boolean fixed) {
      this.left = ImmutableList.copyOf(left);
      this.right = ImmutableList.copyOf(right);
      this.fixed = fixed;
    }

    static Target fixed(List<Index> left, List<Index> right) {
      return new Target(left, right, true);
    }

    static Target suggested(List<Index> left, List<Index> right) {
      return new Target(left, right, false);
    }

    /** Returns the cyclic order of the legs. */
    List<Index> order() {
      return concat(left, reverse(right));
    }

    @Override
    public String toString() {
      return (fixed ? "fixed" : "suggested") + "(" + left + ", " + right + ")";
    }
  }
}

// End ContractionDecomposer.java
