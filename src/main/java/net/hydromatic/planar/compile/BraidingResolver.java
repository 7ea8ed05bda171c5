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
import static net.hydromatic.planar.ast.DiagramBuilder.diagram;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Index;
import net.hydromatic.planar.ast.SpaceRef;
import net.hydromatic.planar.ast.TensorRef;

/**
 * Resolves braiding placeholders, {@code τ[..]}.
 *
 * <p>The four legs of a braiding form two strands. For
 * {@code τ[i2b, i1b; i1a, i2a]}, strand 1 enters at {@code i1a} and leaves
 * at {@code i1b}, and strand 2 enters at {@code i2a} and leaves at
 * {@code i2b}; for the adjoint, {@code τ'[i1b, i2b; i2a, i1a]}.
 *
 * <p>{@link #construct} replaces each placeholder with a braiding object
 * whose spaces it derives from the neighboring tensors;
 * {@link #remove} removes each placeholder by identifying the two ends of
 * each strand, which is valid only if the braiding is symmetric.
 */
public class BraidingResolver {
  private final Locals locals;

  private BraidingResolver(Locals locals) {
    this.locals = requireNonNull(locals);
  }

  /**
   * Constructs the braidings of a program.
   *
   * <p>Each statement that uses braidings is preceded by one
   * {@link Diagram.BraidingDefinition} for each distinct placeholder term,
   * and the placeholder is replaced by a reference to the new local.
   *
   * @throws CompileException if the space of a strand cannot be derived
   */
  public static Diagram.Block construct(Diagram.Block block, Locals locals) {
    return new BraidingResolver(locals).constructBlock(block);
  }

  /**
   * Removes the braidings of a program.
   *
   * @throws CompileException if a braiding cannot be removed without
   *   changing the value of the statement
   */
  public static Diagram.Block remove(Diagram.Block block) {
    final List<Diagram.Stmt> stmts = new ArrayList<>();
    for (Diagram.Stmt stmt : block.stmts) {
      stmts.add(removeStmt(stmt));
    }
    return block.copy(stmts);
  }

  private Diagram.Block constructBlock(Diagram.Block block) {
    final List<Diagram.Stmt> stmts = new ArrayList<>();
    for (Diagram.Stmt stmt : block.stmts) {
      constructStmt(stmt, stmts);
    }
    return block.copy(stmts);
  }

  /** Constructs the braidings in a statement, adding it and the definitions
   * of its braidings to a list. */
  private void constructStmt(Diagram.Stmt stmt, List<Diagram.Stmt> stmts) {
    final List<Diagram.TensorTerm> neighbors = new ArrayList<>();
    switch (stmt.op) {
      case BLOCK:
        stmts.add(constructBlock((Diagram.Block) stmt));
        return;

      case OPAQUE_BLOCK:
        final Diagram.OpaqueBlock opaqueBlock = (Diagram.OpaqueBlock) stmt;
        stmts.add(opaqueBlock.copy(constructBlock(opaqueBlock.body)));
        return;

      case DEFINITION:
      case ASSIGNMENT:
        final Diagram.Assignment assignment = (Diagram.Assignment) stmt;
        if (TensorExps.isScalar(assignment.rhs)) {
          stmts.add(stmt);
          return;
        }
        neighbors.addAll(TensorExps.tensors(assignment.rhs));
        if (!assignment.isDefinition()
            && assignment.lhs instanceof Diagram.TensorTerm) {
          // the target, seen from the right-hand side, is its adjoint
          final Diagram.TensorTerm lhs = (Diagram.TensorTerm) assignment.lhs;
          neighbors.add(
              diagram.tensor(lhs.pos, lhs.ref, !lhs.adjoint, lhs.right,
                  lhs.left));
        }
        break;

      case TENSOR:
      case CONJ:
      case TIMES:
      case SUM:
        neighbors.addAll(TensorExps.tensors(stmt));
        break;

      default:
        stmts.add(stmt);
        return;
    }

    // separate the placeholders from their neighbors; equal placeholder
    // terms share one braiding
    final Map<Diagram.TensorTerm, TensorRef> braidings = new LinkedHashMap<>();
    for (Iterator<Diagram.TensorTerm> i = neighbors.iterator(); i.hasNext();) {
      final Diagram.TensorTerm term = i.next();
      if (term.ref.isBraiding()) {
        braidings.put(term, TensorRef.BRAIDING);
        i.remove();
      }
    }
    if (braidings.isEmpty()) {
      stmts.add(stmt);
      return;
    }

    final Map<Index, SpaceRef> spaces = new HashMap<>();
    final List<Strand> unresolved = new ArrayList<>();
    for (Diagram.TensorTerm term : braidings.keySet()) {
      for (Strand strand : Strand.of(term)) {
        final Optional<IndexLocator.Location> in =
            IndexLocator.locate(strand.in, neighbors);
        final Optional<IndexLocator.Location> out =
            IndexLocator.locate(strand.out, neighbors);
        if (in.isPresent()) {
          strand.resolve(spaces, in.get().space(false));
        } else if (out.isPresent()) {
          strand.resolve(spaces, out.get().space(true));
        } else {
          unresolved.add(strand);
        }
      }
    }

    // strands that connect braidings to each other take the space of the
    // braiding at their other end
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Iterator<Strand> i = unresolved.iterator(); i.hasNext();) {
        final Strand strand = i.next();
        final SpaceRef space = spaces.containsKey(strand.in)
            ? spaces.get(strand.in)
            : spaces.get(strand.out);
        if (space != null) {
          strand.resolve(spaces, space);
          i.remove();
          changed = true;
        }
      }
    }
    if (!unresolved.isEmpty()) {
      throw CompileException.unresolvedBraiding(unresolved, stmt);
    }

    for (Map.Entry<Diagram.TensorTerm, TensorRef> e : braidings.entrySet()) {
      final Diagram.TensorTerm term = e.getKey();
      final List<Strand> strands = Strand.of(term);
      final TensorRef local = locals.braiding();
      e.setValue(local);
      stmts.add(
          diagram.braidingDefinition(term.pos, local,
              requireNonNull(spaces.get(strands.get(0).out)),
              requireNonNull(spaces.get(strands.get(1).out))));
    }
    stmts.add(
        TensorExps.replaceTensors(stmt, term -> {
          final TensorRef local = braidings.get(term);
          return local == null
              ? term
              : term.copy(local, term.adjoint, term.left, term.right);
        }));
  }

  /** Removes the braidings in a statement. */
  private static Diagram.Stmt removeStmt(Diagram.Stmt stmt) {
    final List<Index> free;
    final Diagram.Exp exp;
    switch (stmt.op) {
      case BLOCK:
        return remove((Diagram.Block) stmt);

      case OPAQUE_BLOCK:
        final Diagram.OpaqueBlock opaqueBlock = (Diagram.OpaqueBlock) stmt;
        return opaqueBlock.copy(remove(opaqueBlock.body));

      case DEFINITION:
      case ASSIGNMENT:
        final Diagram.Assignment assignment = (Diagram.Assignment) stmt;
        if (TensorExps.isScalar(assignment.rhs)) {
          return stmt;
        }
        free = assignment.lhs instanceof Diagram.TensorTerm
            ? ((Diagram.TensorTerm) assignment.lhs).indices()
            : ImmutableList.of();
        exp = assignment.rhs;
        break;

      case TENSOR:
      case CONJ:
      case TIMES:
      case SUM:
        free = ImmutableList.of();
        exp = (Diagram.Exp) stmt;
        break;

      default:
        return stmt;
    }

    ImmutableMap<Index, Index> map = ImmutableMap.of();
    for (Diagram.TensorTerm term : TensorExps.tensors(exp)) {
      if (!term.ref.isBraiding()) {
        continue;
      }
      for (Strand strand : Strand.of(term)) {
        map = IndexMaps.identify(map, IndexMaps.apply(map, strand.in),
            IndexMaps.apply(map, strand.out), free);
      }
    }
    if (map.isEmpty()) {
      return stmt;
    }
    final ImmutableMap<Index, Index> closed = IndexMaps.close(map);
    return BraidingPurger.purge(
        TensorExps.replaceIndices(stmt, i -> IndexMaps.apply(closed, i)));
  }

  /** Strand of a braiding, from the index where it enters to the index
   * where it leaves. */
  static class Strand {
    final Index in;
    final Index out;

    Strand(Index in, Index out) {
      this.in = requireNonNull(in);
      this.out = requireNonNull(out);
    }

    /** Returns the two strands of a braiding term.
     *
     * @throws CompileException if the term does not have two left and two
     *   right indices */
    static List<Strand> of(Diagram.TensorTerm term) {
      if (term.left.size() != 2 || term.right.size() != 2) {
        throw CompileException.braidingArity(term);
      }
      if (term.adjoint) {
        return ImmutableList.of(
            new Strand(term.right.get(1), term.left.get(0)),
            new Strand(term.right.get(0), term.left.get(1)));
      } else {
        return ImmutableList.of(
            new Strand(term.right.get(0), term.left.get(1)),
            new Strand(term.right.get(1), term.left.get(0)));
      }
    }

    /** Records the space of both ends of this strand. */
    void resolve(Map<Index, SpaceRef> spaces, SpaceRef space) {
      spaces.put(in, space);
      spaces.put(out, space);
    }

    @Override
    public int hashCode() {
      return Objects.hash(in, out);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Strand
              && in.equals(((Strand) o).in)
              && out.equals(((Strand) o).out);
    }

    @Override
    public String toString() {
      return "(" + in + ", " + out + ")";
    }
  }
}

// End BraidingResolver.java
