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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.TensorRef;
import net.hydromatic.planar.ast.Visitor;

/**
 * Binds the tensor objects of a program to locals.
 *
 * <p>A reference and its adjoint are the same object. Objects that the
 * program defines ({@code C[..] := ...}) are new; all others, including
 * objects that the program assigns to ({@code C[..] = ...}), exist before
 * the plan runs. Each existing object gets a {@link Diagram.Binding} and an
 * {@link Diagram.ArityCheck} for each distinct way the program uses it. Each
 * new object, and each existing object that the program assigns to, gets a
 * {@link Diagram.Export}. The braiding is not an object.
 */
public class ObjectBinder {
  private final Locals locals;
  private final boolean arityChecks;
  private final Set<String> existing = new LinkedHashSet<>();
  private final Set<String> created = new LinkedHashSet<>();
  private final Set<String> assigned = new LinkedHashSet<>();
  private final Set<Diagram.ArityCheck> checks = new LinkedHashSet<>();

  private ObjectBinder(Locals locals, boolean arityChecks) {
    this.locals = requireNonNull(locals);
    this.arityChecks = arityChecks;
  }

  /**
   * Binds the objects of a program.
   *
   * @param block Program, already normalized
   * @param locals Arena in which to allocate locals
   * @param arityChecks Whether to generate arity checks
   * @throws CompileException if the program assigns to the braiding
   */
  public static Result bind(Diagram.Block block, Locals locals,
      boolean arityChecks) {
    final ObjectBinder binder = new ObjectBinder(locals, arityChecks);
    binder.collect(block);
    // existing objects get the lowest handles
    binder.existing.forEach(locals::bind);
    binder.created.forEach(locals::bind);
    final Diagram.Block body =
        (Diagram.Block) TensorExps.replaceTensors(block, binder::rebind);

    final ImmutableList.Builder<Diagram.Binding> bindings =
        ImmutableList.builder();
    for (String name : binder.existing) {
      bindings.add(
          diagram.binding(requireNonNull(locals.lookup(name)),
              TensorRef.named(name)));
    }
    final ImmutableList.Builder<Diagram.Export> exports =
        ImmutableList.builder();
    for (String name : Iterables.concat(binder.created, binder.assigned)) {
      exports.add(
          diagram.export(TensorRef.named(name),
              requireNonNull(locals.lookup(name))));
    }
    final ImmutableSet<String> objects = ImmutableSet.<String>builder()
        .addAll(binder.existing).addAll(binder.created).build();
    return new Result(objects, bindings.build(),
        ImmutableList.copyOf(binder.checks), body, exports.build());
  }

  /** Finds the existing and the new objects. */
  private void collect(Diagram.Block block) {
    final Set<String> inputs = new LinkedHashSet<>();
    block.accept(
        new Visitor() {
          @Override
          protected void visit(Diagram.Assignment assignment) {
            if (assignment.lhs instanceof Diagram.TensorTerm) {
              final TensorRef ref = ((Diagram.TensorTerm) assignment.lhs).ref;
              if (ref.isBraiding()) {
                throw CompileException.reservedName(assignment);
              }
              if (ref.kind == TensorRef.Kind.NAME) {
                if (assignment.isDefinition()) {
                  created.add(ref.name);
                } else {
                  assigned.add(ref.name);
                }
              }
            }
            assignment.rhs.accept(this);
          }

          @Override
          protected void visit(Diagram.TensorTerm tensorTerm) {
            final TensorRef ref = tensorTerm.ref;
            if (ref.kind == TensorRef.Kind.NAME && !ref.isBraiding()) {
              inputs.add(ref.name);
            }
          }
        });
    existing.addAll(inputs);
    existing.addAll(assigned);
    existing.removeAll(created);
    assigned.removeAll(created);
  }

  /** Replaces a reference to a named object with its local. */
  private Diagram.Exp rebind(Diagram.TensorTerm term) {
    if (term.ref.kind != TensorRef.Kind.NAME || term.ref.isBraiding()) {
      return term;
    }
    final TensorRef local = requireNonNull(locals.lookup(term.ref.name));
    if (arityChecks && existing.contains(term.ref.name)) {
      // the legs of an adjoint reference are those of the object, swapped
      final int numOut = term.adjoint ? term.right.size() : term.left.size();
      final int numIn = term.adjoint ? term.left.size() : term.right.size();
      checks.add(
          diagram.arityCheck(term.pos, local, term.ref.name, numOut, numIn));
    }
    return term.copy(local, term.adjoint, term.left, term.right);
  }

  /** Checks that an object has the number of legs that an arity check
   * expects.
   *
   * @throws CompileException if the numbers differ */
  public static void checkArity(Diagram.ArityCheck check, int numOut,
      int numIn) {
    if (numOut != check.numOut || numIn != check.numIn) {
      throw CompileException.arityMismatch(check, numOut, numIn);
    }
  }

  /** Result of binding a program. */
  public static class Result {
    /** Names of all objects, existing and new. */
    public final ImmutableSet<String> objects;
    public final List<Diagram.Binding> bindings;
    public final List<Diagram.ArityCheck> checks;
    /** The program, with each reference to an object replaced by a
     * reference to its local. */
    public final Diagram.Block body;
    public final List<Diagram.Export> exports;

    Result(ImmutableSet<String> objects, List<Diagram.Binding> bindings,
        List<Diagram.ArityCheck> checks, Diagram.Block body,
        List<Diagram.Export> exports) {
      this.objects = objects;
      this.bindings = ImmutableList.copyOf(bindings);
      this.checks = ImmutableList.copyOf(checks);
      this.body = body;
      this.exports = ImmutableList.copyOf(exports);
    }
  }
}

// End ObjectBinder.java
