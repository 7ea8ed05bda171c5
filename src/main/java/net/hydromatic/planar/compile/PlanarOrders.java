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
import static net.hydromatic.planar.util.Static.concat;
import static net.hydromatic.planar.util.Static.reverse;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Index;

/**
 * Enumerates the orders in which the open legs of an expression can be
 * drawn around it, in the plane, without crossings.
 *
 * <p>An order is a cyclic sequence of indices: the left indices of a tensor
 * term followed by its right indices reversed. Two orders are equivalent if
 * one is a rotation of the other.
 */
public abstract class PlanarOrders {
  private PlanarOrders() {}

  /**
   * Returns the admissible planar orders of the open legs of an expression.
   *
   * <p>An empty result means that the expression is not planar. A scalar
   * expression has one admissible order, the empty order.
   */
  public static List<List<Index>> possibleOrders(Diagram.Exp exp) {
    if (TensorExps.isScalar(exp)) {
      return ImmutableList.of(ImmutableList.of());
    }
    if (TensorExps.isGeneralTensor(exp)) {
      final List<Index> order =
          removePlanarTraces(TensorExps.generalTensor(exp).planarOrder());
      return new HashSet<>(order).size() == order.size()
          ? ImmutableList.of(order)
          : ImmutableList.of();
    }
    switch (exp.op) {
      case TIMES:
        final Diagram.Product product = (Diagram.Product) exp;
        final List<List<Index>> orders1 = possibleOrders(product.a0);
        final List<List<Index>> orders2 = possibleOrders(product.a1);
        final ImmutableList.Builder<List<Index>> b = ImmutableList.builder();
        for (List<Index> order1 : orders1) {
          for (List<Index> order2 : orders2) {
            for (Complement c : complements(order1, order2)) {
              b.add(c.openOrder());
            }
          }
        }
        return b.build();

      case SUM:
        final Diagram.Sum sum = (Diagram.Sum) exp;
        final List<List<Index>> orders = new ArrayList<>();
        orders.addAll(possibleOrders(sum.args.get(0)));
        for (Diagram.Exp arg : sum.args.subList(1, sum.args.size())) {
          final List<List<Index>> argOrders = possibleOrders(arg);
          orders.removeIf(order ->
              argOrders.stream()
                  .noneMatch(argOrder -> isCyclicPermutation(argOrder, order)));
          if (orders.isEmpty()) {
            break;
          }
        }
        return ImmutableList.copyOf(orders);

      default:
        return ImmutableList.of();
    }
  }

  /**
   * Removes traced pairs of legs that are adjacent in a cyclic order,
   * repeatedly, so that nested traces are removed from the inside out.
   *
   * <p>For example, {@code [a, b, b, c, a, d]} becomes {@code [a, c, a, d]};
   * the pair {@code a} is not adjacent and stays, which makes the order
   * non-planar.
   */
  static List<Index> removePlanarTraces(List<Index> order) {
    final List<Index> list = new ArrayList<>(order);
    boolean removing = true;
    while (removing) {
      removing = false;
      int i = 0;
      while (i < list.size() && list.size() > 1) {
        final int j = (i + 1) % list.size();
        if (list.get(i).equals(list.get(j))) {
          list.remove(i);
          list.remove(i % list.size());
          removing = true;
        } else {
          ++i;
        }
      }
    }
    return ImmutableList.copyOf(list);
  }

  /**
   * Returns the ways of contracting two operands with given cyclic orders
   * so that the result is planar.
   *
   * <p>The indices that the operands share must form one contiguous segment
   * in each order, traversed in opposite directions. If they share no
   * indices, any rotation of either operand is admissible.
   */
  public static List<Complement> complements(List<Index> order1,
      List<Index> order2) {
    if (order1.isEmpty() || order2.isEmpty()) {
      return ImmutableList.of(
          new Complement(order1, order2, ImmutableList.of(),
              ImmutableList.of()));
    }
    final boolean[] shared1 = new boolean[order1.size()];
    final boolean[] shared2 = new boolean[order2.size()];
    int sharedCount = 0;
    for (int i = 0; i < order1.size(); i++) {
      shared1[i] = order2.contains(order1.get(i));
      if (shared1[i]) {
        ++sharedCount;
      }
    }
    for (int i = 0; i < order2.size(); i++) {
      shared2[i] = order1.contains(order2.get(i));
    }
    if (sharedCount == 0) {
      // disconnected; can be made planar in various ways
      final ImmutableList.Builder<Complement> b = ImmutableList.builder();
      for (int i = 0; i < order1.size(); i++) {
        for (int j = 0; j < order2.size(); j++) {
          b.add(
              new Complement(rotate(order1, i), rotate(order2, j),
                  ImmutableList.of(), ImmutableList.of()));
        }
      }
      return b.build();
    }
    final int start1 = segmentStart(shared1);
    final int start2 = segmentStart(shared2);
    if (start1 < 0 || start2 < 0) {
      return ImmutableList.of();
    }
    final int k = sharedCount;

    // rotate operand 1 so that the segment is at the end, and operand 2 so
    // that it is at the start
    final List<Index> rotated1 = rotate(order1, start1 + k);
    final List<Index> rotated2 = rotate(order2, start2);
    final List<Index> open1 = rotated1.subList(0, order1.size() - k);
    List<Index> contracted1 = rotated1.subList(order1.size() - k,
        order1.size());
    List<Index> contracted2 = rotated2.subList(0, k);
    final List<Index> open2 = rotated2.subList(k, order2.size());

    // if one operand is contracted completely, its segment has no fixed
    // start; align it with the other operand
    if (open1.isEmpty()) {
      final List<Index> aligned = reverse(contracted2);
      if (!isCyclicPermutation(aligned, order1)) {
        return ImmutableList.of();
      }
      contracted1 = aligned;
    } else if (open2.isEmpty()) {
      final List<Index> aligned = reverse(contracted1);
      if (!isCyclicPermutation(aligned, order2)) {
        return ImmutableList.of();
      }
      contracted2 = aligned;
    } else if (!contracted2.equals(reverse(contracted1))) {
      return ImmutableList.of();
    }
    return ImmutableList.of(
        new Complement(open1, open2, contracted1, contracted2));
  }

  /** Returns the position where the only run of {@code true} values in a
   * cyclic array starts; 0 if all are true; -1 if there are several runs. */
  private static int segmentStart(boolean[] flags) {
    int start = -1;
    int runs = 0;
    for (int i = 0; i < flags.length; i++) {
      final int prev = (i + flags.length - 1) % flags.length;
      if (flags[i] && !flags[prev]) {
        start = i;
        ++runs;
      }
    }
    if (runs == 0) {
      // either all true, or all false; callers only ask if some are true
      return 0;
    }
    return runs == 1 ? start : -1;
  }

  /** Returns whether {@code a} is a rotation of {@code b}. Reversal is not
   * a rotation. */
  public static boolean isCyclicPermutation(List<Index> a, List<Index> b) {
    if (a.size() != b.size()) {
      return false;
    }
    if (a.isEmpty()) {
      return true;
    }
    for (int offset = 0; offset < b.size(); offset++) {
      if (a.get(0).equals(b.get(offset))
          && rotate(b, offset).equals(a)) {
        return true;
      }
    }
    return false;
  }

  /** Returns a list rotated so that element {@code shift} comes first. */
  static <E> List<E> rotate(List<E> list, int shift) {
    if (list.isEmpty()) {
      return ImmutableList.of();
    }
    final int n = list.size();
    final int s = Math.floorMod(shift, n);
    return ImmutableList.<E>builder()
        .addAll(list.subList(s, n))
        .addAll(list.subList(0, s))
        .build();
  }

  /**
   * Split of two operand orders into the legs that stay open and the legs
   * that connect the operands.
   *
   * <p>The order of operand 1 is a rotation of {@code open1 ++ contracted1},
   * the order of operand 2 is a rotation of {@code contracted2 ++ open2},
   * {@code contracted2} is {@code contracted1} reversed, and the order of the
   * product is {@code open1 ++ open2}.
   */
  public static class Complement {
    public final List<Index> open1;
    public final List<Index> open2;
    public final List<Index> contracted1;
    public final List<Index> contracted2;

    Complement(List<Index> open1, List<Index> open2,
        List<Index> contracted1, List<Index> contracted2) {
      this.open1 = ImmutableList.copyOf(requireNonNull(open1));
      this.open2 = ImmutableList.copyOf(requireNonNull(open2));
      this.contracted1 = ImmutableList.copyOf(requireNonNull(contracted1));
      this.contracted2 = ImmutableList.copyOf(requireNonNull(contracted2));
    }

    /** Returns the order of the open legs of the product. */
    public List<Index> openOrder() {
      return concat(open1, open2);
    }

    /** Returns a complement with the operands swapped. */
    Complement swap() {
      return new Complement(open2, open1, contracted2, contracted1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(open1, open2, contracted1, contracted2);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Complement
              && open1.equals(((Complement) o).open1)
              && open2.equals(((Complement) o).open2)
              && contracted1.equals(((Complement) o).contracted1)
              && contracted2.equals(((Complement) o).contracted2);
    }

    @Override
    public String toString() {
      return "{open1=" + open1 + ", open2=" + open2 + ", contracted1="
          + contracted1 + ", contracted2=" + contracted2 + "}";
    }
  }
}

// End PlanarOrders.java
