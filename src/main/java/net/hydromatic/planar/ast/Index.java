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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Leg label of a tensor term.
 *
 * <p>An index is either symbolic (it has a {@link #name}) or positional (it
 * has an {@link #ordinal}, and its name is null). Within one expression, an
 * index that occurs twice is contracted; an index that occurs once is free.
 */
public final class Index implements Comparable<Index> {
  public final @Nullable String name;
  public final int ordinal;

  private Index(@Nullable String name, int ordinal) {
    this.name = name;
    this.ordinal = ordinal;
  }

  /** Creates a symbolic index. */
  public static Index of(String name) {
    return new Index(requireNonNull(name), -1);
  }

  /** Creates a positional index. */
  public static Index of(int ordinal) {
    if (ordinal < 0) {
      throw new IllegalArgumentException("negative ordinal " + ordinal);
    }
    return new Index(null, ordinal);
  }

  /** Returns whether this index is positional. */
  public boolean isPositional() {
    return name == null;
  }

  @Override
  public int hashCode() {
    return name != null ? name.hashCode() : ordinal;
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Index
            && ordinal == ((Index) o).ordinal
            && Objects.equals(name, ((Index) o).name);
  }

  /** Positional indices sort before symbolic indices. */
  @Override
  public int compareTo(Index o) {
    if (name == null) {
      return o.name == null ? Integer.compare(ordinal, o.ordinal) : -1;
    }
    return o.name == null ? 1 : name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name != null ? name : Integer.toString(ordinal);
  }
}

// End Index.java
