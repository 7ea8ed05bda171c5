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

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Expression for the vector space of one leg of an object, as written in a
 * plan: "{@code space(A#0, 1)}", optionally of the adjoint,
 * "{@code space(A#0', 1)}", optionally dualized, "{@code space(A#0, 1)'}".
 *
 * <p>Legs are numbered from 0, left legs first. The space of a right leg is
 * the dual of the space in the object's domain, so that two legs that are
 * contracted always have mutually dual spaces.
 */
public final class SpaceRef {
  public final TensorRef object;
  public final boolean adjoint;
  public final int position;
  public final boolean dual;

  private SpaceRef(TensorRef object, boolean adjoint, int position,
      boolean dual) {
    this.object = requireNonNull(object);
    this.adjoint = adjoint;
    this.position = position;
    this.dual = dual;
  }

  /** Creates a SpaceRef. */
  public static SpaceRef of(TensorRef object, boolean adjoint, int position,
      boolean dual) {
    if (position < 0) {
      throw new IllegalArgumentException("negative position " + position);
    }
    return new SpaceRef(object, adjoint, position, dual);
  }

  /** Returns the dual of this space. */
  public SpaceRef dual() {
    return new SpaceRef(object, adjoint, position, !dual);
  }

  @Override
  public int hashCode() {
    return Objects.hash(object, adjoint, position, dual);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof SpaceRef
            && object.equals(((SpaceRef) o).object)
            && adjoint == ((SpaceRef) o).adjoint
            && position == ((SpaceRef) o).position
            && dual == ((SpaceRef) o).dual;
  }

  @Override
  public String toString() {
    return "space(" + object + (adjoint ? "'" : "") + ", " + position + ")"
        + (dual ? "'" : "");
  }
}

// End SpaceRef.java
