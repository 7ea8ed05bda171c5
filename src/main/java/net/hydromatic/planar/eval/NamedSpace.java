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

import java.util.Objects;

/** Space that is identified by name, such as {@code V} or its dual
 * {@code V'}. */
public final class NamedSpace implements Space {
  public final String name;
  public final boolean dual;

  private NamedSpace(String name, boolean dual) {
    this.name = requireNonNull(name);
    this.dual = dual;
  }

  /** Creates a space. */
  public static NamedSpace of(String name) {
    return new NamedSpace(name, false);
  }

  @Override
  public NamedSpace dual() {
    return new NamedSpace(name, !dual);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dual);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof NamedSpace
            && name.equals(((NamedSpace) o).name)
            && dual == ((NamedSpace) o).dual;
  }

  @Override
  public String toString() {
    return dual ? name + "'" : name;
  }
}

// End NamedSpace.java
