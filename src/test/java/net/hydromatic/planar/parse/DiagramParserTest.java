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
package net.hydromatic.planar.parse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Op;
import net.hydromatic.planar.ast.TensorRef;
import org.junit.jupiter.api.Test;

/** Tests for {@link DiagramParserImpl}. */
public class DiagramParserTest {
  private static Diagram.Exp exp(String s) {
    return DiagramParserImpl.create(s).expression();
  }

  private static Diagram.Block program(String s) {
    return DiagramParserImpl.create(s).program();
  }

  /** Checks that an expression unparses to a given string. */
  private static void assertParseSame(String s, String expected) {
    assertThat(exp(s), hasToString(expected));
  }

  private static void assertParseSame(String s) {
    assertParseSame(s, s);
  }

  @Test void testTensor() {
    assertParseSame("A[a, b; c]");
    assertParseSame("A[a b; c]", "A[a, b; c]");
    assertParseSame("A[a, b]");
    assertParseSame("A[; a]");
    assertParseSame("A[]");
    assertParseSame("A'[c; a, b]");
    assertParseSame("A[1, 2; 3]");

    final Diagram.TensorTerm t = (Diagram.TensorTerm) exp("A'[c; a b]");
    assertThat(t.adjoint, is(true));
    assertThat(t.left, hasToString("[c]"));
    assertThat(t.right, hasToString("[a, b]"));
    assertThat(t.ref.kind, is(TensorRef.Kind.NAME));
    assertThat(((Diagram.TensorTerm) exp("A[1; x]")).left.get(0)
        .isPositional(), is(true));
  }

  @Test void testBraiding() {
    assertParseSame("τ[a, b; c, d]");
    assertParseSame("tau[a, b; c, d]", "τ[a, b; c, d]");
    assertThat(((Diagram.TensorTerm) exp("tau'[a, b; c, d]")).ref.isBraiding(),
        is(true));
  }

  @Test void testArithmetic() {
    assertParseSame("A[a; c] * B[c; b]");
    assertParseSame("2 * A[a; b] - B[a; b]");
    assertParseSame("-A[a; b]");
    assertParseSame("-A[a; b] + B[a; b]");
    assertParseSame("(A[a; c] + B[a; c]) * C[c; b]");
    assertParseSame("A[a; c] * (B[c; d] * C[d; b])");
    assertParseSame("((A[a; c]))", "A[a; c]");
    assertParseSame("conj(A[a; b] * x)");
    assertParseSame("1.5e-3 * alpha * A[a; b]");
    assertThat(exp("-A[a; b]").op, is(Op.SUM));
    assertThat(exp("x").op, is(Op.SCALAR));
    assertThat(((Diagram.Scalar) exp("x")).isLiteral(), is(false));
    assertThat(((Diagram.Scalar) exp("2")).isLiteral(), is(true));
  }

  /** Inside brackets and parentheses, a newline is white space. */
  @Test void testNewlineInBrackets() {
    assertParseSame("A[a,\n  b; c] * (B[c; d]\n + C[c; d])",
        "A[a, b; c] * (B[c; d] + C[c; d])");
  }

  @Test void testProgram() {
    final String s = "C[a; b] := A[a; b]; D[a; b] = C[a; b]\n"
        + "\n"
        + "# a comment\n"
        + "notensor { x = 1 }\n"
        + "for i in 1:3 {\n"
        + "  E[a; b] = 2 * E[a; b]  # doubles\n"
        + "}\n";
    final Diagram.Block block = program(s);
    assertThat(block.stmts, hasSize(4));
    assertThat(block,
        hasToString("C[a; b] := A[a; b]\n"
            + "D[a; b] = C[a; b]\n"
            + "notensor {\n"
            + "  x = 1\n"
            + "}\n"
            + "for i in 1:3 {\n"
            + "  E[a; b] = 2 * E[a; b]\n"
            + "}"));
    assertThat(block.stmts.get(0).op, is(Op.DEFINITION));
    assertThat(block.stmts.get(1).op, is(Op.ASSIGNMENT));
    assertThat(block.stmts.get(2).op, is(Op.ANNOTATED_BLOCK));
    assertThat(block.stmts.get(3).op, is(Op.OPAQUE_BLOCK));
    assertThat(((Diagram.OpaqueBlock) block.stmts.get(3)).header,
        is("for i in 1:3"));
  }

  @Test void testEmptyProgram() {
    assertThat(program("").stmts, hasSize(0));
    assertThat(program("\n# nothing\n;\n").stmts, hasSize(0));
  }

  @Test void testExpressionStatement() {
    final Diagram.Block block = program("A[a; b] * B[b; a]");
    assertThat(block.stmts.get(0).op, is(Op.TIMES));
  }

  @Test void testPos() {
    final Diagram.Block block = program("C[a; b] := A[a; b]\n  x := 2");
    assertThat(block.stmts.get(0).pos, hasToString("1.1-1.19"));
    assertThat(block.stmts.get(1).pos, hasToString("2.3-2.9"));
    assertThat(
        DiagramParserImpl.create("A[a; b]", "foo.planar").expression().pos,
        hasToString("foo.planar:1.1-1.8"));
  }

  @Test void testErrors() {
    DiagramParseException e =
        assertThrows(DiagramParseException.class, () -> exp("A[a; b) + C"));
    assertThat(e.getMessage(), is("unexpected ')'"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("1.7 Error: unexpected ')'"));

    e = assertThrows(DiagramParseException.class, () -> exp("A[a; b] +"));
    assertThat(e.getMessage(), is("unexpected end of input"));

    e = assertThrows(DiagramParseException.class, () ->
        program("2 := A[a; b]"));
    assertThat(e.getMessage(), is("invalid left-hand side: 2"));

    e = assertThrows(DiagramParseException.class, () ->
        program("A[a; b] * B[b; c] := C[a; c]"));
    assertThat(e.getMessage(),
        is("invalid left-hand side: A[a; b] * B[b; c]"));

    e = assertThrows(DiagramParseException.class, () -> program("τ := 1"));
    assertThat(e.getMessage(), is("unexpected ':='"));

    e = assertThrows(DiagramParseException.class, () ->
        program("C[a] := A[a] B[b]"));
    assertThat(e.getMessage(), is("expected end of statement"));

    e = assertThrows(DiagramParseException.class, () ->
        program("notensor { x = 1"));
    assertThat(e.getMessage(), is("unexpected end of input"));

    e = assertThrows(DiagramParseException.class, () -> exp("A[a] @ B[b]"));
    assertThat(e.getMessage(), is("unexpected '@'"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("1.6 Error: unexpected '@'"));
    assertThat(e.getCause(), instanceOf(ParseException.class));
  }
}

// End DiagramParserTest.java
