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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;

import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.parse.DiagramParserImpl;
import org.junit.jupiter.api.Test;

/** Tests for {@link AdjointNormalizer}. */
public class AdjointNormalizerTest {
  private static Diagram.Block parse(String s) {
    return DiagramParserImpl.create(s).program();
  }

  @Test void testConjugateTensor() {
    final Diagram.Exp e = diagram.conj(
        diagram.tensor("A", diagram.indices("a", "b"), diagram.indices("c")));
    assertThat(e, hasToString("conj(A[a, b; c])"));
    assertThat(AdjointNormalizer.normalize(e), hasToString("A'[c; a, b]"));
  }

  @Test void testConjugateAdjoint() {
    final Diagram.Exp e = diagram.conj(
        diagram.adjoint("A", diagram.indices("c"), diagram.indices("a", "b")));
    assertThat(AdjointNormalizer.normalize(e), hasToString("A[a, b; c]"));
  }

  /** Conjugation distributes over products and sums; a scalar stays
   * conjugated. */
  @Test void testDistribute() {
    final Diagram.Block block =
        parse("C[a; b] := conj(A[b; c] * B'[a; c]) + conj(conj(D[a; b]))\n"
            + "E[a; b] := conj(2) * A[a; b]");
    assertThat(AdjointNormalizer.normalize(block),
        hasToString("C[a; b] := A'[c; b] * B[c; a] + D[a; b]\n"
            + "E[a; b] := conj(2) * A[a; b]"));
  }

  @Test void testIdempotent() {
    final String[] programs = {
        "C[a; b] := conj(A[b; c] * B'[a; c]) + conj(conj(D[a; b]))",
        "C[a; b] := conj(A[b; c]) * B[c; b]",
        "s := conj(conj(2) * A'[a; b] * B[b; a])",
        "for i in 1:3 {\n  C[a; b] = conj(C[b; a])\n}",
    };
    for (String program : programs) {
      final Diagram.Block once = AdjointNormalizer.normalize(parse(program));
      final Diagram.Block twice = AdjointNormalizer.normalize(once);
      assertThat(program, twice, is(once));
      assertThat(program, twice.toString(), is(once.toString()));
    }
  }

  /** A tree without conjugation is returned as is. */
  @Test void testUnchanged() {
    final Diagram.Block block = parse("C[a; b] := A[a; c] * B[c; b]");
    assertThat(AdjointNormalizer.normalize(block), sameInstance(block));
  }

  /** A block that is not rewritten keeps its conjugations. */
  @Test void testAnnotatedBlock() {
    final Diagram.Block block = parse("notensor {\n  C[a] = conj(A[a])\n}");
    assertThat(AdjointNormalizer.normalize(block), sameInstance(block));
  }
}

// End AdjointNormalizerTest.java
