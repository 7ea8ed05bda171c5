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

import static net.hydromatic.planar.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.DiagramNode;
import net.hydromatic.planar.ast.Index;
import net.hydromatic.planar.ast.Shuttle;
import net.hydromatic.planar.ast.Visitor;

/** Predicates and rewrites on tensor expressions. */
public abstract class TensorExps {
  private TensorExps() {}

  /** Returns whether an expression contains no tensors. */
  public static boolean isScalar(Diagram.Exp exp) {
    switch (exp.op) {
      case SCALAR:
        return true;
      case CONJ:
        return isScalar(((Diagram.Conj) exp).exp);
      case TIMES:
        final Diagram.Product product = (Diagram.Product) exp;
        return isScalar(product.a0) && isScalar(product.a1);
      case SUM:
        return ((Diagram.Sum) exp).args.stream()
            .allMatch(TensorExps::isScalar);
      default:
        return false;
    }
  }

  /**
   * Returns whether an expression is a single tensor term, possibly with
   * scalar factors and a sign.
   *
   * <p>For example, {@code A[a; b]}, {@code 2 * A[a; b]} and
   * {@code -α * A'[b; a]} are general tensors; {@code A[a; c] * B[c; b]} is
   * not.
   */
  public static boolean isGeneralTensor(Diagram.Exp exp) {
    switch (exp.op) {
      case TENSOR:
        return true;
      case TIMES:
        final Diagram.Product product = (Diagram.Product) exp;
        return isScalar(product.a0) && isGeneralTensor(product.a1)
            || isGeneralTensor(product.a0) && isScalar(product.a1);
      case SUM:
        final Diagram.Sum sum = (Diagram.Sum) exp;
        return sum.args.size() == 1 && isGeneralTensor(sum.args.get(0));
      default:
        return false;
    }
  }

  /** Returns the tensor term inside a general tensor. */
  public static Diagram.TensorTerm generalTensor(Diagram.Exp exp) {
    switch (exp.op) {
      case TENSOR:
        return (Diagram.TensorTerm) exp;
      case TIMES:
        final Diagram.Product product = (Diagram.Product) exp;
        return isScalar(product.a0)
            ? generalTensor(product.a1)
            : generalTensor(product.a0);
      case SUM:
        return generalTensor(((Diagram.Sum) exp).args.get(0));
      default:
        throw CompileException.unknownExpression(exp);
    }
  }

  /** Returns whether a general tensor has an index that occurs twice, that
   * is, a leg that is traced. */
  public static boolean hasTraceIndices(Diagram.Exp exp) {
    final Diagram.TensorTerm term = generalTensor(exp);
    final Set<Index> set = new HashSet<>();
    for (Index index : term.indices()) {
      if (!set.add(index)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the tensor terms in a node, in order of occurrence. */
  public static List<Diagram.TensorTerm> tensors(DiagramNode node) {
    final ImmutableList.Builder<Diagram.TensorTerm> b =
        ImmutableList.builder();
    node.accept(
        new Visitor() {
          @Override
          protected void visit(Diagram.TensorTerm tensorTerm) {
            b.add(tensorTerm);
          }
        });
    return b.build();
  }

  /** Replaces each tensor term in an expression. */
  public static Diagram.Exp replaceTensors(Diagram.Exp exp,
      Function<Diagram.TensorTerm, Diagram.Exp> fn) {
    return exp.accept(new TensorReplacer(fn));
  }

  /** Replaces each tensor term in a statement, including the left-hand side
   * of an assignment. */
  public static Diagram.Stmt replaceTensors(Diagram.Stmt stmt,
      Function<Diagram.TensorTerm, Diagram.Exp> fn) {
    return stmt.accept(new TensorReplacer(fn));
  }

  /** Replaces each index in a statement. */
  public static Diagram.Stmt replaceIndices(Diagram.Stmt stmt,
      UnaryOperator<Index> fn) {
    return replaceTensors(stmt, term ->
        term.copy(term.ref, term.adjoint, transformEager(term.left, fn),
            transformEager(term.right, fn)));
  }

  /** Shuttle that replaces tensor terms. */
  private static class TensorReplacer extends Shuttle {
    private final Function<Diagram.TensorTerm, Diagram.Exp> fn;

    TensorReplacer(Function<Diagram.TensorTerm, Diagram.Exp> fn) {
      this.fn = fn;
    }

    @Override
    protected Diagram.Exp visit(Diagram.TensorTerm tensorTerm) {
      return fn.apply(tensorTerm);
    }
  }
}

// End TensorExps.java
