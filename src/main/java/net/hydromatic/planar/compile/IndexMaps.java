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

import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.planar.ast.Index;

/**
 * Operations on maps that identify indices with one another.
 *
 * <p>Maps are immutable; each operation returns a new map.
 */
public abstract class IndexMaps {
  private IndexMaps() {}

  /** Returns the image of an index; an index not in the map maps to
   * itself. */
  public static Index apply(Map<Index, Index> map, Index index) {
    return map.getOrDefault(index, index);
  }

  /**
   * Returns a map in which two indices are identified, both mapping to a
   * common representative.
   *
   * <p>If one of the indices is free, it is the representative; free
   * indices must survive. Otherwise, if both indices are positional, the
   * larger is the representative; otherwise the first is.
   */
  public static ImmutableMap<Index, Index> identify(Map<Index, Index> map,
      Index a, Index b, Collection<Index> free) {
    final Index representative;
    if (free.contains(a)) {
      representative = a;
    } else if (free.contains(b)) {
      representative = b;
    } else if (a.isPositional() && b.isPositional()) {
      representative = a.ordinal >= b.ordinal ? a : b;
    } else {
      representative = a;
    }
    return with(with(map, a, representative), b, representative);
  }

  /** Returns a map with one entry added or replaced. */
  public static ImmutableMap<Index, Index> with(Map<Index, Index> map,
      Index key, Index value) {
    final ImmutableMap.Builder<Index, Index> b = ImmutableMap.builder();
    map.forEach((k, v) -> {
      if (!k.equals(key)) {
        b.put(k, v);
      }
    });
    b.put(key, value);
    return b.build();
  }

  /**
   * Returns the transitive closure of a map; if {@code a → b} and
   * {@code b → c}, then {@code a → c}. An index that maps to itself ends a
   * chain.
   *
   * <p>A map built by {@link #identify} from representatives (that is,
   * indices already passed through {@link #apply}) has no cycles: each call
   * points both indices at a representative that maps to itself. So a cycle
   * is an internal error, not a property of the diagram, and is not
   * reported as a {@link CompileException}.
   *
   * @throws IllegalArgumentException if following the map from some index
   *   never reaches an index that maps to itself
   */
  public static ImmutableMap<Index, Index> close(Map<Index, Index> map) {
    final ImmutableMap.Builder<Index, Index> b = ImmutableMap.builder();
    for (Index key : map.keySet()) {
      final Set<Index> seen = new HashSet<>();
      Index v = key;
      for (;;) {
        final Index w = map.get(v);
        if (w == null || w.equals(v)) {
          break;
        }
        if (!seen.add(v)) {
          throw new IllegalArgumentException("index map has a cycle through "
              + key + ": " + map);
        }
        v = w;
      }
      b.put(key, v);
    }
    return b.build();
  }
}

// End IndexMaps.java
