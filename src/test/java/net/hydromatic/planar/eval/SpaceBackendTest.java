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
import org.junit.jupiter.api.Test;

/** Tests for {@link SpaceBackend}. */
public class SpaceBackendTest {
  private static final Space V = NamedSpace.of("V");
  private static final Space W = NamedSpace.of("W");
  private static final Space X = NamedSpace.of("X");
  private static final SpaceBackend BACKEND = SpaceBackend.INSTANCE;

  @Test void testDual() {
    assertThat(V.dual(), hasToString("V'"));
    assertThat(V.dual().dual(), is(V));
  }

  @Test void testBraiding() {
    final SpaceTensor t = BACKEND.braiding(V, W);
    assertThat(t, hasToString("[W, V] ← [V, W]"));
    assertThat(BACKEND.numOut(t), is(2));
    assertThat(BACKEND.numIn(t), is(2));
    assertThat(BACKEND.space(t, 0), is(W));
    assertThat(BACKEND.space(t, 2), is(V.dual()));
  }

  @Test void testAdjoint() {
    final SpaceTensor t =
        SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(W, X));
    assertThat(BACKEND.adjoint(t), hasToString("[W, X] ← [V]"));
    assertThat(BACKEND.adjoint(BACKEND.adjoint(t)), is(t));
  }

  @Test void testContract() {
    final SpaceTensor a =
        SpaceTensor.of(ImmutableList.of(V), ImmutableList.of(W));
    final SpaceTensor b =
        SpaceTensor.of(ImmutableList.of(W), ImmutableList.of(X));
    assertThat(BACKEND.contract(a, new int[] {1}, b, new int[] {0}, 1),
        hasToString("[V] ← [X]"));
    assertThat(BACKEND.contract(a, new int[] {1}, b, new int[] {0}, 0),
        hasToString("[] ← [V', X]"));
    assertThrows(IllegalArgumentException.class, () ->
        BACKEND.contract(a, new int[] {0}, b, new int[] {0}, 1));
  }

  @Test void testPermute() {
    final SpaceTensor t =
        SpaceTensor.of(ImmutableList.of(V, W), ImmutableList.of(X));
    assertThat(BACKEND.permute(t, new int[] {2, 0, 1}, 1),
        hasToString("[X'] ← [V', W']"));
    assertThrows(IllegalArgumentException.class, () ->
        BACKEND.permute(t, new int[] {0, 0, 1}, 1));
  }

  @Test void testTrace() {
    final SpaceTensor t =
        SpaceTensor.of(ImmutableList.of(V, W), ImmutableList.of(V));
    assertThat(BACKEND.trace(t, new int[] {0}, new int[] {2}),
        hasToString("[W] ← []"));
    assertThrows(IllegalArgumentException.class, () ->
        BACKEND.trace(t, new int[] {1}, new int[] {2}));
  }

  @Test void testAdd() {
    final SpaceTensor t =
        SpaceTensor.of(ImmutableList.of(V), ImmutableList.of());
    assertThat(BACKEND.add(t, t), is(t));
    assertThat(BACKEND.scale(t, 2), is(t));
    assertThrows(IllegalArgumentException.class, () ->
        BACKEND.add(t,
            SpaceTensor.of(ImmutableList.of(W), ImmutableList.of())));
  }
}

// End SpaceBackendTest.java
