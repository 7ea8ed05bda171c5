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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Tensor that has legs but no entries; it knows only the spaces of its
 * codomain and domain.
 *
 * <p>For example, {@code [V, W] ← [U]} is a map from {@code U} to the
 * tensor product of {@code V} and {@code W}; its legs have spaces
 * {@code V, W, U'}.
 */
public final class SpaceTensor {
  public final ImmutableList<Space> codomain;
  public final ImmutableList<Space> domain;

  private SpaceTensor(ImmutableList<Space> codomain,
      ImmutableList<Space> domain) {
    this.codomain = requireNonNull(codomain);
    this.domain = requireNonNull(domain);
  }

  /** Creates a SpaceTensor. */
  public static SpaceTensor of(List<? extends Space> codomain,
      List<? extends Space> domain) {
    return new SpaceTensor(ImmutableList.copyOf(codomain),
        ImmutableList.copyOf(domain));
  }

  /** Creates a SpaceTensor from the spaces of its legs, the first
   * {@code numOut} of which are output legs. */
  static SpaceTensor ofLegs(List<Space> legs, int numOut) {
    final ImmutableList.Builder<Space> domain = ImmutableList.builder();
    legs.subList(numOut, legs.size()).forEach(s -> domain.add(s.dual()));
    return new SpaceTensor(ImmutableList.copyOf(legs.subList(0, numOut)),
        domain.build());
  }

  /** Returns the spaces of the legs; output legs, then input legs
   * dualized. */
  public List<Space> legs() {
    final ImmutableList.Builder<Space> b = ImmutableList.builder();
    b.addAll(codomain);
    domain.forEach(s -> b.add(s.dual()));
    return b.build();
  }

  @Override
  public int hashCode() {
    return Objects.hash(codomain, domain);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SpaceTensor
            && codomain.equals(((SpaceTensor) o).codomain)
            && domain.equals(((SpaceTensor) o).domain);
  }

  @Override
  public String toString() {
    return codomain + " ← " + domain;
  }
}

// End SpaceTensor.java
