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
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("mode"), is(Prop.MODE));
    assertThat(Prop.lookup("MODE"), is(Prop.MODE));
    assertThat(Prop.lookup("arityChecks"), is(Prop.ARITY_CHECKS));
    final RuntimeException e =
        assertThrows(RuntimeException.class, () -> Prop.lookup("colour"));
    assertThat(e.getMessage(), is("property colour not found"));
  }

  @Test void testByCamelName() {
    assertThat(Prop.BY_CAMEL_NAME,
        hasToString("[ARITY_CHECKS, CHECK_PLANARITY, DECOMPOSE, MODE]"));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.ARITY_CHECKS.booleanValue(map), is(true));
    assertThat(Prop.CHECK_PLANARITY.booleanValue(map), is(true));
    assertThat(Prop.DECOMPOSE.booleanValue(map), is(true));
    assertThat(Prop.MODE.enumValue(map, Prop.Mode.class),
        is(Prop.Mode.PLANAR));
    assertThat(Prop.MODE.get(map), is(Prop.Mode.PLANAR));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.MODE.setLenient(map, "symmetric");
    assertThat(Prop.MODE.enumValue(map, Prop.Mode.class),
        is(Prop.Mode.SYMMETRIC));
    Prop.DECOMPOSE.setLenient(map, "false");
    assertThat(Prop.DECOMPOSE.booleanValue(map), is(false));

    final RuntimeException e =
        assertThrows(RuntimeException.class, () ->
            Prop.MODE.setLenient(map, "spherical"));
    assertThat(e.getMessage(),
        is("value must be one of: 'PLANAR', 'SYMMETRIC'"));

    assertThat(Prop.MODE.remove(map), is(Prop.Mode.SYMMETRIC));
    assertThat(Prop.MODE.remove(map), nullValue());
  }

  @Test void testSetWrongType() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThrows(RuntimeException.class, () -> Prop.DECOMPOSE.set(map, 1));
    assertThrows(RuntimeException.class, () -> Prop.MODE.set(map, null));
    assertThrows(IllegalArgumentException.class, () ->
        Prop.MODE.booleanValue(map));
  }
}

// End PropTest.java
