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
package net.hydromatic.planar.eval;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.planar.compile.CompileException;
import net.hydromatic.planar.compile.ContractionPlan;
import net.hydromatic.planar.compile.PlanarCompiler;
import net.hydromatic.planar.compile.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link PlanExecutor}, running plans against
 * {@link SpaceBackend}. */
public class PlanExecutorTest {
  private static final Space V = NamedSpace.of("V");
  private static final Space W = NamedSpace.of("W");
  private static final Space X = NamedSpace.of("X");
  private static final Space Y = NamedSpace.of("Y");

  private final PlanExecutor<SpaceTensor> executor =
      new PlanExecutor<>(SpaceBackend.INSTANCE);

  private static ContractionPlan plan(String program, Prop.Mode mode) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.MODE.set(map, mode);
    return new PlanarCompiler(map, Tracers.empty()).compile(program);
  }

  private static SpaceTensor tensor(Space... codomain) {
    return SpaceTensor.of(ImmutableList.copyOf(codomain), ImmutableList.of());
  }

  /** Runs a program in a given mode, and returns the objects afterwards. */
  private Map<String, SpaceTensor> run(String program, Prop.Mode mode,
      Map<String, SpaceTensor> objects) {
    final Map<String, SpaceTensor> map = new HashMap<>(objects);
    executor.execute(plan(program, mode), map, new HashMap<>());
    return map;
  }

  @Test void testContraction() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", tensor(V, W));
    objects.put("B", tensor(W.dual(), X));
    executor.execute(plan("E[a, b] := A[a, c] * B[c, b]", Prop.Mode.PLANAR),
        objects, new HashMap<>());
    assertThat(objects.get("E"), is(tensor(V, X)));
    assertThat(objects.get("E"), hasToString("[V, X] ← []"));
  }

  @Test void testArityMismatch() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A",
        SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(W, X)));
    objects.put("B", tensor(W.dual(), X));
    final ContractionPlan plan =
        plan("E[a, b] := A[a, c] * B[c, b]", Prop.Mode.PLANAR);
    final CompileException e =
        assertThrows(CompileException.class, () ->
            executor.execute(plan, objects, new HashMap<>()));
    assertThat(e.kind, is(CompileException.Kind.ARITY_MISMATCH));
    assertThat(e.getMessage(),
        is("incorrect number of input-output indices: (2, 0) instead of "
            + "(1, 2) for A."));
    assertThat(objects.containsKey("E"), is(false));
  }

  @Test void testUnknownObject() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", tensor(V, W));
    final ContractionPlan plan =
        plan("E[a, b] := A[a, c] * B[c, b]", Prop.Mode.PLANAR);
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            executor.execute(plan, objects, new HashMap<>()));
    assertThat(e.getMessage(), is("unknown object B"));
  }

  /** Legs that are contracted must have dual spaces. */
  @Test void testSpaceMismatch() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", tensor(V, W));
    objects.put("B", tensor(W, X));
    final ContractionPlan plan =
        plan("E[a, b] := A[a, c] * B[c, b]", Prop.Mode.PLANAR);
    assertThrows(IllegalArgumentException.class, () ->
        executor.execute(plan, objects, new HashMap<>()));
  }

  @Test void testTemporaries() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(W)));
    objects.put("B", SpaceTensor.of(ImmutableList.of(W), ImmutableList.of(X)));
    objects.put("C", SpaceTensor.of(ImmutableList.of(X), ImmutableList.of(Y)));
    executor.execute(
        plan("D[a; d] := A[a; b] * B[b; c] * C[c; d]", Prop.Mode.PLANAR),
        objects, new HashMap<>());
    assertThat(objects.get("D"), hasToString("[V] ← [Y]"));
  }

  /** A full contraction gives a tensor with no legs. */
  @Test void testFullContraction() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(W)));
    objects.put("B", SpaceTensor.of(ImmutableList.of(W), ImmutableList.of(V)));
    executor.execute(plan("s := A[a; b] * B[b; a]", Prop.Mode.PLANAR),
        objects, new HashMap<>());
    assertThat(objects.get("s"), hasToString("[] ← []"));
  }

  @Test void testTrace() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A",
        SpaceTensor.of(ImmutableList.of(V, W), ImmutableList.of(W)));
    executor.execute(plan("C[a] := A[a, b; b]", Prop.Mode.PLANAR), objects,
        new HashMap<>());
    assertThat(objects.get("C"), is(tensor(V)));
  }

  @Test void testScalars() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(W)));
    final Map<String, Number> scalars = new HashMap<>();
    final ContractionPlan plan =
        plan("C[a; b] := alpha * 2 * A[a; b] - A[a; b]\n"
            + "s := 2 * 3", Prop.Mode.PLANAR);
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () ->
            executor.execute(plan, objects, scalars));
    assertThat(e.getMessage(), is("unknown scalar alpha"));

    scalars.put("alpha", 0.5);
    executor.execute(plan, objects, scalars);
    assertThat(objects.get("C"), is(objects.get("A")));
    assertThat(scalars.get("s"), is(6d));
  }

  /** Crossing two strands and then contracting gives a tensor whose legs
   * are swapped; in symmetric mode, where the braiding is removed, the
   * result has the same spaces. */
  @Test void testBraiding() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", tensor(V, W));
    final String program = "C[b, a] := τ[b, a; x, y] * A[x, y]";
    assertThat(run(program, Prop.Mode.PLANAR, objects).get("C"),
        is(tensor(W, V)));
    assertThat(run(program, Prop.Mode.SYMMETRIC, objects).get("C"),
        is(tensor(W, V)));
  }

  /** Crossing twice leaves the legs in their original order. */
  @Test void testDoubleBraiding() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", tensor(V, W));
    final String program =
        "C[a, b] := τ[a, b; x, y] * τ[x, y; u, v] * A[u, v]";
    assertThat(run(program, Prop.Mode.PLANAR, objects).get("C"),
        is(tensor(V, W)));
    assertThat(run(program, Prop.Mode.SYMMETRIC, objects).get("C"),
        is(tensor(V, W)));
  }

  /** Assigning to an existing object replaces it. */
  @Test void testAssignment() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(V)));
    objects.put("B", SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(V)));
    executor.execute(plan("B[a; b] = A[a; c] * B[c; b]", Prop.Mode.PLANAR),
        objects, new HashMap<>());
    assertThat(objects.get("B"), hasToString("[V] ← [V]"));
  }

  @Test void testOpaqueBlock() {
    final Map<String, SpaceTensor> objects = new HashMap<>();
    objects.put("A", SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(V)));
    final ContractionPlan plan =
        plan("for i in 1:3 {\n  A[a; b] = A[a; c] * A[c; b]\n}",
            Prop.Mode.PLANAR);
    assertThrows(UnsupportedOperationException.class, () ->
        executor.execute(plan, objects, new HashMap<>()));
  }
}

// End PlanExecutorTest.java
