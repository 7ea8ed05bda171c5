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

import static net.hydromatic.planar.ast.DiagramBuilder.diagram;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

import org.junit.jupiter.api.Test;

/** Tests for {@link Diagram} and {@link DiagramBuilder}. */
public class DiagramTest {
  private final Diagram.TensorTerm a =
      diagram.tensor("A", diagram.indices("a"), diagram.indices("c"));
  private final Diagram.TensorTerm b =
      diagram.tensor("B", diagram.indices("c"), diagram.indices("b"));
  private final Diagram.TensorTerm c =
      diagram.tensor("C", diagram.indices("a"), diagram.indices("b"));

  @Test void testIndices() {
    assertThat(diagram.indices("a", "10", "b2"), hasToString("[a, 10, b2]"));
    assertThat(diagram.index("10").isPositional(), is(true));
    assertThat(diagram.index("b2").isPositional(), is(false));
    assertThat(Index.of(3).compareTo(Index.of("a")) < 0, is(true));
  }

  @Test void testTensorTerm() {
    final Diagram.TensorTerm t =
        diagram.tensor("A", diagram.indices("a", "b"),
            diagram.indices("c", "d"));
    assertThat(t, hasToString("A[a, b; c, d]"));
    assertThat(t.indices(), hasToString("[a, b, c, d]"));
    assertThat(t.planarOrder(), hasToString("[a, b, d, c]"));
    assertThat(
        diagram.adjoint("A", diagram.indices(), diagram.indices("a")),
        hasToString("A'[; a]"));
    assertThat(t.copy(t.ref, t.adjoint, t.left, t.right), sameInstance(t));
  }

  /** Products and sums print with as few parentheses as possible. */
  @Test void testUnparse() {
    assertThat(diagram.times(a, b, diagram.scalar("2")),
        hasToString("A[a; c] * B[c; b] * 2"));
    assertThat(diagram.times(a, diagram.times(b, c)),
        hasToString("A[a; c] * (B[c; b] * C[a; b])"));
    assertThat(diagram.times(diagram.plus(a, c), b),
        hasToString("(A[a; c] + C[a; b]) * B[c; b]"));
    assertThat(diagram.minus(c, diagram.times(a, b)),
        hasToString("C[a; b] - A[a; c] * B[c; b]"));
    assertThat(diagram.minus(c, diagram.minus(a, b)),
        hasToString("C[a; b] - (A[a; c] - B[c; b])"));
    assertThat(diagram.negate(diagram.plus(a, b)),
        hasToString("-(A[a; c] + B[c; b])"));
    assertThat(diagram.conj(diagram.times(a, b)),
        hasToString("conj(A[a; c] * B[c; b])"));
  }

  @Test void testStatements() {
    final Diagram.Assignment define =
        diagram.define(c, diagram.times(a, b));
    assertThat(define, hasToString("C[a; b] := A[a; c] * B[c; b]"));
    assertThat(define.isDefinition(), is(true));
    final Diagram.Assignment assign = diagram.assign(c, c);
    assertThat(assign, hasToString("C[a; b] = C[a; b]"));
    assertThat(assign.isDefinition(), is(false));

    final TensorRef local = TensorRef.local(0, "C");
    assertThat(diagram.binding(local, TensorRef.named("C")),
        hasToString("C#0 = C"));
    assertThat(diagram.export(TensorRef.named("C"), local),
        hasToString("C = C#0"));
    assertThat(diagram.arityCheck(Pos.ZERO, local, "C", 1, 2),
        hasToString("check C#0 (1, 2)"));
    assertThat(
        diagram.braidingDefinition(Pos.ZERO, TensorRef.local(1, "τ"),
            SpaceRef.of(local, false, 1, false),
            SpaceRef.of(local, true, 0, true)),
        hasToString("τ#1 = braiding(space(C#0, 1), space(C#0', 0)')"));

    final Diagram.Block block = diagram.block(define, assign);
    assertThat(block,
        hasToString("C[a; b] := A[a; c] * B[c; b]\nC[a; b] = C[a; b]"));
    assertThat(
        diagram.opaqueBlock(Pos.ZERO, "while converged", block),
        hasToString("while converged {\n"
            + "  C[a; b] := A[a; c] * B[c; b]\n"
            + "  C[a; b] = C[a; b]\n"
            + "}"));
  }

  /** Nodes are equal if their contents are equal, whatever their
   * positions. */
  @Test void testEquals() {
    final Pos pos = new Pos("x", 1, 1, 1, 8);
    final Diagram.TensorTerm a2 =
        diagram.tensor(pos, TensorRef.named("A"), false, a.left, a.right);
    assertThat(a2, is(a));
    assertThat(a2.hashCode(), is(a.hashCode()));
    assertThat(diagram.times(a2, b), is(diagram.times(a, b)));
    assertThat(diagram.times(b, a), not(diagram.times(a, b)));
    assertThat(diagram.adjoint("A", a.left, a.right), not(a));
  }

  @Test void testPos() {
    final Pos p1 = new Pos("", 1, 3, 1, 8);
    final Pos p2 = new Pos("", 2, 1, 2, 5);
    assertThat(p1, hasToString("1.3-1.8"));
    assertThat(p1.plus(p2), hasToString("1.3-2.5"));
    assertThat(p2.plus(p1), hasToString("1.3-2.5"));
    assertThat(p1.plus(Pos.ZERO), sameInstance(p1));
    assertThat(new Pos("f", 1, 3, 1, 4), hasToString("f:1.3"));
  }
}

// End DiagramTest.java
