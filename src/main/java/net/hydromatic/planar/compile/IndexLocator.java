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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Optional;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Index;
import net.hydromatic.planar.ast.SpaceRef;

/** Finds the tensor term and leg that carry an index. */
public abstract class IndexLocator {
  private IndexLocator() {}

  /**
   * Returns the first term in a list that carries an index, and the position
   * of the leg. Left legs are searched first; right legs are numbered after
   * the left legs.
   *
   * <p>Returns empty if no term carries the index; the index is then
   * external, or not placed yet.
   */
  public static Optional<Location> locate(Index index,
      List<Diagram.TensorTerm> terms) {
    for (Diagram.TensorTerm term : terms) {
      int pos = term.left.indexOf(index);
      if (pos >= 0) {
        return Optional.of(new Location(term, pos));
      }
      pos = term.right.indexOf(index);
      if (pos >= 0) {
        return Optional.of(new Location(term, term.left.size() + pos));
      }
    }
    return Optional.empty();
  }

  /** Leg of a tensor term. */
  public static class Location {
    public final Diagram.TensorTerm term;
    public final int position;

    Location(Diagram.TensorTerm term, int position) {
      this.term = requireNonNull(term);
      this.position = position;
    }

    /** Returns an expression for the space of this leg. */
    public SpaceRef space(boolean dual) {
      return SpaceRef.of(term.ref, term.adjoint, position, dual);
    }

    @Override
    public String toString() {
      return "(" + term + ", " + position + ")";
    }
  }
}

// End IndexLocator.java
