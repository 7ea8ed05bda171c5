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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Index;

/**
 * Checks that each assignment in a program can be drawn in the plane.
 *
 * <p>An assignment is planar if its right-hand side has an admissible order
 * of open legs (see {@link PlanarOrders#possibleOrders}) that is a rotation
 * of the order of the left-hand side. Annotated blocks are not checked.
 */
public abstract class PlanarityChecker {
  private PlanarityChecker() {}

  /** Checks a statement, and returns it unchanged.
   *
   * @throws CompileException if an assignment is not planar */
  public static <S extends Diagram.Stmt> S check(S stmt) {
    switch (stmt.op) {
      case DEFINITION:
      case ASSIGNMENT:
        checkAssignment((Diagram.Assignment) stmt);
        break;

      case BLOCK:
        ((Diagram.Block) stmt).stmts.forEach(PlanarityChecker::check);
        break;

      case OPAQUE_BLOCK:
        check(((Diagram.OpaqueBlock) stmt).body);
        break;

      default:
        break;
    }
    return stmt;
  }

  private static void checkAssignment(Diagram.Assignment assignment) {
    if (TensorExps.isScalar(assignment.rhs)) {
      return;
    }
    final List<Index> target;
    if (assignment.lhs instanceof Diagram.TensorTerm) {
      final List<List<Index>> orders =
          PlanarOrders.possibleOrders(assignment.lhs);
      if (orders.size() != 1) {
        throw CompileException.notPlanar(assignment.lhs);
      }
      target = orders.get(0);
    } else {
      target = ImmutableList.of();
    }
    final List<List<Index>> orders =
        PlanarOrders.possibleOrders(assignment.rhs);
    if (orders.isEmpty()) {
      throw CompileException.notPlanar(assignment.rhs);
    }
    if (orders.stream()
        .noneMatch(order -> PlanarOrders.isCyclicPermutation(order, target))) {
      throw CompileException.notPlanar(assignment);
    }
  }
}

// End PlanarityChecker.java
