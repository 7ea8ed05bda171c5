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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * Backend that computes the spaces of the result of each operation, and
 * checks that contracted legs have dual spaces, but computes no entries.
 *
 * <p>Running a plan against this backend checks that the plan is
 * executable, and predicts the spaces of the objects it produces.
 */
public enum SpaceBackend implements TensorBackend<SpaceTensor> {
  INSTANCE;

  @Override public int numOut(SpaceTensor t) {
    return t.codomain.size();
  }

  @Override public int numIn(SpaceTensor t) {
    return t.domain.size();
  }

  @Override public Space space(SpaceTensor t, int leg) {
    final List<Space> legs = t.legs();
    checkElementIndex(leg, legs.size(), "leg");
    return legs.get(leg);
  }

  @Override public SpaceTensor adjoint(SpaceTensor t) {
    return SpaceTensor.of(t.domain, t.codomain);
  }

  @Override public SpaceTensor braiding(Space s1, Space s2) {
    return SpaceTensor.of(ImmutableList.of(s2, s1), ImmutableList.of(s1, s2));
  }

  @Override public SpaceTensor contract(SpaceTensor a, int[] ca,
      SpaceTensor b, int[] cb, int numOut) {
    checkArgument(ca.length == cb.length,
        "contracting %s legs with %s legs", ca.length, cb.length);
    final List<Space> legsA = a.legs();
    final List<Space> legsB = b.legs();
    for (int k = 0; k < ca.length; k++) {
      checkElementIndex(ca[k], legsA.size(), "leg");
      checkElementIndex(cb[k], legsB.size(), "leg");
      final Space sa = legsA.get(ca[k]);
      final Space sb = legsB.get(cb[k]);
      if (!sa.equals(sb.dual())) {
        throw new IllegalArgumentException("cannot contract leg " + ca[k]
            + " of " + a + " with leg " + cb[k] + " of " + b + ": " + sa
            + " is not dual to " + sb);
      }
    }
    final List<Space> legs = new ArrayList<>();
    legs.addAll(openLegs(legsA, ca));
    legs.addAll(openLegs(legsB, cb));
    checkElementIndex(numOut, legs.size() + 1, "numOut");
    return SpaceTensor.ofLegs(legs, numOut);
  }

  @Override public SpaceTensor permute(SpaceTensor t, int[] perm,
      int numOut) {
    final List<Space> legs = t.legs();
    checkArgument(perm.length == legs.size(),
        "permutation %s has wrong size for %s", Arrays.toString(perm), t);
    final BitSet seen = new BitSet();
    final List<Space> permuted = new ArrayList<>();
    for (int p : perm) {
      checkElementIndex(p, legs.size(), "leg");
      checkArgument(!seen.get(p), "not a permutation: %s",
          Arrays.toString(perm));
      seen.set(p);
      permuted.add(legs.get(p));
    }
    checkElementIndex(numOut, legs.size() + 1, "numOut");
    return SpaceTensor.ofLegs(permuted, numOut);
  }

  @Override public SpaceTensor trace(SpaceTensor t, int[] legs1,
      int[] legs2) {
    checkArgument(legs1.length == legs2.length);
    final List<Space> legs = t.legs();
    final BitSet traced = new BitSet();
    for (int k = 0; k < legs1.length; k++) {
      final Space s1 = legs.get(legs1[k]);
      final Space s2 = legs.get(legs2[k]);
      if (!s1.equals(s2.dual())) {
        throw new IllegalArgumentException("cannot trace leg " + legs1[k]
            + " of " + t + " with leg " + legs2[k] + ": " + s1
            + " is not dual to " + s2);
      }
      traced.set(legs1[k]);
      traced.set(legs2[k]);
    }
    final List<Space> remaining = new ArrayList<>();
    int numOut = 0;
    for (int leg = 0; leg < legs.size(); leg++) {
      if (!traced.get(leg)) {
        remaining.add(legs.get(leg));
        if (leg < t.codomain.size()) {
          ++numOut;
        }
      }
    }
    return SpaceTensor.ofLegs(remaining, numOut);
  }

  @Override public SpaceTensor add(SpaceTensor a, SpaceTensor b) {
    checkArgument(a.equals(b), "cannot add %s to %s", b, a);
    return a;
  }

  @Override public SpaceTensor scale(SpaceTensor t, Number factor) {
    return t;
  }

  private static List<Space> openLegs(List<Space> legs, int[] contracted) {
    final BitSet set = new BitSet();
    for (int leg : contracted) {
      set.set(leg);
    }
    final List<Space> open = new ArrayList<>();
    for (int leg = 0; leg < legs.size(); leg++) {
      if (!set.get(leg)) {
        open.add(legs.get(leg));
      }
    }
    return open;
  }
}

// End SpaceBackend.java
