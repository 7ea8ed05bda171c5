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

import static net.hydromatic.planar.ast.DiagramBuilder.diagram;

import com.google.common.collect.ImmutableList;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Shuttle;

/**
 * Rewrites explicit conjugation into adjoint tensor references.
 *
 * <p>{@code conj(A[a; b])} becomes {@code A'[b; a]}, and
 * {@code conj(A'[a; b])} becomes {@code A[b; a]}. Conjugation distributes
 * over products and sums, so {@code conj(A[a; c] * B[c; b])} becomes
 * {@code A'[c; a] * B'[b; c]}. Conjugation of a scalar remains.
 *
 * <p>Afterwards every tensor term has one canonical shape, and the only
 * {@link Diagram.Conj} nodes left wrap scalars. Applying the normalizer
 * twice gives the same tree as applying it once.
 */
public class AdjointNormalizer extends Shuttle {
  private static final AdjointNormalizer INSTANCE = new AdjointNormalizer();

  private AdjointNormalizer() {}

  /** Normalizes a statement. */
  public static Diagram.Stmt normalize(Diagram.Stmt stmt) {
    return stmt.accept(INSTANCE);
  }

  /** Normalizes a block. */
  public static Diagram.Block normalize(Diagram.Block block) {
    return block.accept(INSTANCE);
  }

  /** Normalizes an expression. */
  public static Diagram.Exp normalize(Diagram.Exp exp) {
    return exp.accept(INSTANCE);
  }

  @Override
  protected Diagram.Exp visit(Diagram.Conj conj) {
    return conjugate(conj.exp.accept(this));
  }

  /** Returns the conjugate of an expression that is already normalized. */
  private static Diagram.Exp conjugate(Diagram.Exp exp) {
    switch (exp.op) {
      case TENSOR:
        final Diagram.TensorTerm term = (Diagram.TensorTerm) exp;
        return diagram.tensor(term.pos, term.ref, !term.adjoint, term.right,
            term.left);
      case CONJ:
        return ((Diagram.Conj) exp).exp;
      case TIMES:
        final Diagram.Product product = (Diagram.Product) exp;
        return diagram.times(product.pos, conjugate(product.a0),
            conjugate(product.a1));
      case SUM:
        final Diagram.Sum sum = (Diagram.Sum) exp;
        final ImmutableList.Builder<Diagram.Exp> args = ImmutableList.builder();
        sum.args.forEach(arg -> args.add(conjugate(arg)));
        return diagram.sum(sum.pos, args.build(), sum.signs);
      case SCALAR:
        return diagram.conj(exp.pos, exp);
      default:
        throw CompileException.unknownExpression(exp);
    }
  }
}

// End AdjointNormalizer.java
