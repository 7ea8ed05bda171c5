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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.parse.DiagramParserImpl;
import org.junit.jupiter.api.Test;

/** Tests for {@link BraidingResolver} and {@link BraidingPurger}. */
public class BraidingResolverTest {
  /** Parses and binds a program. */
  private static Diagram.Block bind(String program, Locals locals) {
    final Diagram.Block block = DiagramParserImpl.create(program).program();
    return ObjectBinder.bind(AdjointNormalizer.normalize(block), locals,
        false).body;
  }

  private static Diagram.Block construct(String program) {
    final Locals locals = new Locals();
    return BraidingResolver.construct(bind(program, locals), locals);
  }

  private static Diagram.Block remove(String program) {
    return BraidingResolver.remove(bind(program, new Locals()));
  }

  @Test void testStrands() {
    final Diagram.TensorTerm term =
        (Diagram.TensorTerm) DiagramParserImpl.create("τ[a, b; c, d]")
            .expression();
    assertThat(BraidingResolver.Strand.of(term),
        hasToString("[(c, b), (d, a)]"));
    final Diagram.TensorTerm adjoint =
        (Diagram.TensorTerm) DiagramParserImpl.create("τ'[a, b; c, d]")
            .expression();
    assertThat(BraidingResolver.Strand.of(adjoint),
        hasToString("[(d, a), (c, b)]"));
  }

  @Test void testConstruct() {
    assertThat(construct("C[b, a] := τ[b, a; x, y] * A[x, y]"),
        hasToString("τ#2 = braiding(space(A#0, 0), space(A#0, 1))\n"
            + "C#1[b, a] := τ#2[b, a; x, y] * A#0[x, y]"));
  }

  /** A strand whose incoming end is open takes the dual of the space of the
   * leg at its outgoing end. */
  @Test void testConstructFromOutgoing() {
    assertThat(construct("C[x, y] := A[b, a] * τ[b, a; x, y]"),
        hasToString("τ#2 = braiding(space(A#0, 1)', space(A#0, 0)')\n"
            + "C#1[x, y] := A#0[b, a] * τ#2[b, a; x, y]"));
  }

  /** The target of an assignment is a neighbor, seen as its adjoint. */
  @Test void testConstructFromTarget() {
    assertThat(construct("C[b, a; x, y] = τ[b, a; x, y]"),
        hasToString("τ#1 = braiding(space(C#0', 0), space(C#0', 1))\n"
            + "C#0[b, a; x, y] = τ#1[b, a; x, y]"));
  }

  /** A strand between two braidings takes its space from the braiding at
   * its other end. */
  @Test void testConstructChain() {
    assertThat(
        construct("C[a, b] := τ[a, b; x, y] * τ[x, y; u, v] * A[u, v]"),
        hasToString("τ#2 = braiding(space(A#0, 1), space(A#0, 0))\n"
            + "τ#3 = braiding(space(A#0, 0), space(A#0, 1))\n"
            + "C#1[a, b] := τ#2[a, b; x, y] * τ#3[x, y; u, v] * A#0[u, v]"));
  }

  /** Equal placeholders share one braiding. */
  @Test void testConstructShared() {
    assertThat(
        construct("C[b, a] := τ[b, a; x, y] * A[x, y]"
            + " + τ[b, a; x, y] * B[x, y]"),
        hasToString("τ#3 = braiding(space(A#0, 0), space(A#0, 1))\n"
            + "C#2[b, a] := τ#3[b, a; x, y] * A#0[x, y]"
            + " + τ#3[b, a; x, y] * B#1[x, y]"));
  }

  @Test void testUnresolved() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            construct("τ[a, b; c, d]"));
    assertThat(e.kind, is(CompileException.Kind.UNRESOLVED_BRAIDING));
    assertThat(e.getMessage(),
        is("cannot determine the spaces of indices [(c, b), (d, a)] for the "
            + "braiding tensors in τ[a, b; c, d]"));
  }

  @Test void testBraidingArity() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            construct("C[a] := τ[a; b] * A[b]"));
    assertThat(e.kind, is(CompileException.Kind.RESERVED_NAME));
  }

  @Test void testRemoveFree() {
    assertThat(remove("C[1, 2] := τ[1, 2; 3, 4] * A[3, 4]"),
        hasToString("C#1[1, 2] := A#0[2, 1]"));
  }

  @Test void testRemovePositional() {
    assertThat(remove("s := τ[1, 2; 3, 4] * A[3, 4] * B[1, 2]"),
        hasToString("s := A#0[3, 4] * B#1[4, 3]"));
  }

  @Test void testRemoveIncoming() {
    assertThat(remove("s := τ[a, b; c, d] * A[c, d] * B[a, b]"),
        hasToString("s := A#0[c, d] * B#1[d, c]"));
  }

  @Test void testRemoveChain() {
    assertThat(
        remove("s := τ[a, b; c, d] * τ[c, d; e, f] * A[e, f] * B[a, b]"),
        hasToString("s := A#0[e, f] * B#1[e, f]"));
  }

  @Test void testRemoveNothing() {
    final Diagram.Block block = bind("C[a, b] := A[a, c] * B[c, b]",
        new Locals());
    assertThat(BraidingResolver.remove(block), sameInstance(block));
  }

  @Test void testRemoveFromSum() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            remove("C[a, b] := A[a, b] + τ[a, b; b, a]"));
    assertThat(e.kind, is(CompileException.Kind.UNSAFE_REMOVAL));
  }

  @Test void testRemoveEverything() {
    final CompileException e =
        assertThrows(CompileException.class, () ->
            remove("s := τ[a, b; a, b]"));
    assertThat(e.kind, is(CompileException.Kind.UNSAFE_REMOVAL));
    assertThat(e.getMessage(),
        is("unable to remove braiding tensor s := τ[a, a; a, a]: "
            + "no right-hand side remains"));
  }

  @Test void testPurge() {
    final Diagram.Stmt stmt =
        DiagramParserImpl.create("C[b, a] := τ[b, a; a, b] * A[a, b]")
            .program().stmts.get(0);
    assertThat(BraidingPurger.purge(stmt),
        hasToString("C[b, a] := A[a, b]"));

    final Diagram.Stmt bad =
        DiagramParserImpl.create("C[a, b] := τ[a, b; a, b] * A[a, b]")
            .program().stmts.get(0);
    final CompileException e =
        assertThrows(CompileException.class, () ->
            BraidingPurger.purge(bad));
    assertThat(e.getMessage(),
        is("unable to remove braiding tensor τ[a, b; a, b]: "
            + "legs are not transposed"));
  }
}

// End BraidingResolverTest.java
