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

/**
 * Identity of the object that a tensor term refers to.
 *
 * <p>A reference is either the name of an object in the surface program, or
 * a handle into the {@link net.hydromatic.planar.compile.Locals} arena of the
 * plan being compiled. A local reference carries a hint (usually the name of
 * the object it is bound to) that is only used for display.
 */
public final class TensorRef {
  /** Reserved name of the braiding (crossing) tensor. */
  public static final String BRAIDING_NAME = "τ";

  /** The braiding placeholder. */
  public static final TensorRef BRAIDING = new TensorRef(Kind.NAME,
      BRAIDING_NAME, -1);

  public final Kind kind;
  public final String name;
  public final int handle;

  private TensorRef(Kind kind, String name, int handle) {
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
    this.handle = handle;
  }

  /** Creates a reference to a named object. */
  public static TensorRef named(String name) {
    return name.equals(BRAIDING_NAME) ? BRAIDING
        : new TensorRef(Kind.NAME, name, -1);
  }

  /** Creates a reference to a local. */
  public static TensorRef local(int handle, String hint) {
    if (handle < 0) {
      throw new IllegalArgumentException("negative handle " + handle);
    }
    return new TensorRef(Kind.LOCAL, hint, handle);
  }

  /** Returns whether this is the braiding placeholder. */
  public boolean isBraiding() {
    return kind == Kind.NAME && name.equals(BRAIDING_NAME);
  }

  @Override
  public int hashCode() {
    return kind == Kind.LOCAL ? handle : name.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof TensorRef)) {
      return false;
    }
    final TensorRef that = (TensorRef) o;
    return kind == that.kind
        && (kind == Kind.LOCAL ? handle == that.handle
            : name.equals(that.name));
  }

  @Override
  public String toString() {
    return kind == Kind.LOCAL ? name + "#" + handle : name;
  }

  /** Kind of reference. */
  public enum Kind {
    /** Object named in the surface program. */
    NAME,
    /** Entry in the locals arena of a plan. */
    LOCAL
  }
}

// End TensorRef.java
