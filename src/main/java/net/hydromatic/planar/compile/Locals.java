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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.planar.ast.TensorRef;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Arena of the local objects of one plan.
 *
 * <p>Each object that a plan binds, each braiding that it constructs, and
 * each temporary that it computes is a {@link Local} with a small integer
 * handle. Handles are allocated in the order that the compiler meets the
 * objects, so compiling the same program twice gives the same plan.
 */
public class Locals {
  private final List<Local> locals = new ArrayList<>();
  private final Map<String, Local> objects = new HashMap<>();

  /**
   * Returns the local bound to a named object, creating it if this is the
   * first time the name is seen.
   */
  public TensorRef bind(String name) {
    checkArgument(!name.equals(TensorRef.BRAIDING_NAME),
        "cannot bind braiding");
    final Local local =
        objects.computeIfAbsent(name, n -> add(Kind.OBJECT, n));
    return local.ref();
  }

  /** Allocates a local for a braiding tensor. */
  public TensorRef braiding() {
    return add(Kind.BRAIDING, TensorRef.BRAIDING_NAME).ref();
  }

  /** Allocates a local for a temporary. */
  public TensorRef temporary() {
    return add(Kind.TEMPORARY, "tmp").ref();
  }

  /** Returns the local bound to a named object, or null. */
  public @Nullable TensorRef lookup(String name) {
    final Local local = objects.get(name);
    return local == null ? null : local.ref();
  }

  /** Returns the local with a given handle. */
  public Local get(TensorRef ref) {
    checkArgument(ref.kind == TensorRef.Kind.LOCAL, "not a local: %s", ref);
    return locals.get(ref.handle);
  }

  /** Returns the locals of a given kind, in order of handle. */
  public List<Local> locals(Kind kind) {
    final ImmutableList.Builder<Local> b = ImmutableList.builder();
    for (Local local : locals) {
      if (local.kind == kind) {
        b.add(local);
      }
    }
    return b.build();
  }

  /** Returns the number of locals. */
  public int size() {
    return locals.size();
  }

  private Local add(Kind kind, String name) {
    final Local local = new Local(locals.size(), kind, name);
    locals.add(local);
    return local;
  }

  /** Entry in the arena. */
  public static class Local {
    public final int handle;
    public final Kind kind;
    /** Name of the bound object, or a display hint. */
    public final String name;

    Local(int handle, Kind kind, String name) {
      this.handle = handle;
      this.kind = requireNonNull(kind);
      this.name = requireNonNull(name);
    }

    /** Returns a reference to this local. */
    public TensorRef ref() {
      return TensorRef.local(handle, name);
    }

    @Override
    public String toString() {
      return ref() + ":" + kind;
    }
  }

  /** Kind of local. */
  public enum Kind {
    /** Object that a surface name refers to. */
    OBJECT,
    /** Braiding tensor constructed by the plan. */
    BRAIDING,
    /** Result of one binary contraction. */
    TEMPORARY
  }
}

// End Locals.java
