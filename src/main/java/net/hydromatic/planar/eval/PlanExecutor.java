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
import static net.hydromatic.planar.util.Static.concat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.ast.Index;
import net.hydromatic.planar.ast.Op;
import net.hydromatic.planar.ast.SpaceRef;
import net.hydromatic.planar.ast.TensorRef;
import net.hydromatic.planar.compile.ContractionPlan;
import net.hydromatic.planar.compile.ObjectBinder;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs the statements of a {@link ContractionPlan}, in order, against a
 * {@link TensorBackend}.
 *
 * <p>Objects are read from, and written to, a map keyed by name; scalar
 * variables are read from, and written to, another map. Scalars are real
 * numbers, so conjugation of a scalar does nothing.
 *
 * <p>Each product is evaluated by contracting the legs that its operands
 * share; the result of an assignment is permuted into the order of the
 * left-hand side.
 *
 * @param <T> Tensor type
 */
public class PlanExecutor<T> {
  private final TensorBackend<T> backend;

  /** Creates a PlanExecutor. */
  public PlanExecutor(TensorBackend<T> backend) {
    this.backend = requireNonNull(backend);
  }

  /**
   * Runs a plan.
   *
   * @param plan Plan
   * @param objects Objects, by name; objects that the plan defines or
   *   assigns are added or replaced
   * @param scalars Scalar variables, by name; scalars that the plan
   *   assigns are added or replaced
   *
   * @throws net.hydromatic.planar.compile.CompileException if an object
   *   does not have the number of legs that the plan expects
   * @throws IllegalArgumentException if an object or scalar is missing, or
   *   if the backend cannot perform an operation
   */
  public void execute(ContractionPlan plan, Map<String, T> objects,
      Map<String, Number> scalars) {
    new Run(objects, scalars).block(plan.block);
  }

  /** State of one execution. */
  private class Run {
    final Map<String, T> objects;
    final Map<String, Number> scalars;
    final Map<TensorRef, T> values = new HashMap<>();

    Run(Map<String, T> objects, Map<String, Number> scalars) {
      this.objects = requireNonNull(objects);
      this.scalars = requireNonNull(scalars);
    }

    void block(Diagram.Block block) {
      block.stmts.forEach(this::stmt);
    }

    void stmt(Diagram.Stmt stmt) {
      switch (stmt.op) {
        case BINDING:
          final Diagram.Binding binding = (Diagram.Binding) stmt;
          final T t = objects.get(binding.object.name);
          if (t == null) {
            throw new IllegalArgumentException("unknown object "
                + binding.object);
          }
          values.put(binding.local, t);
          return;

        case ARITY_CHECK:
          final Diagram.ArityCheck check = (Diagram.ArityCheck) stmt;
          final T checked = value(check.local);
          ObjectBinder.checkArity(check, backend.numOut(checked),
              backend.numIn(checked));
          return;

        case BRAIDING_DEFINITION:
          final Diagram.BraidingDefinition def =
              (Diagram.BraidingDefinition) stmt;
          values.put(def.local,
              backend.braiding(space(def.space1), space(def.space2)));
          return;

        case EXPORT:
          final Diagram.Export export = (Diagram.Export) stmt;
          objects.put(export.object.name, value(export.local));
          return;

        case DEFINITION:
        case ASSIGNMENT:
          assign((Diagram.Assignment) stmt);
          return;

        case BLOCK:
          block((Diagram.Block) stmt);
          return;

        case TENSOR:
        case SCALAR:
        case CONJ:
        case TIMES:
        case SUM:
          eval((Diagram.Exp) stmt);
          return;

        default:
          throw new UnsupportedOperationException("cannot execute " + stmt);
      }
    }

    void assign(Diagram.Assignment assignment) {
      final Value<T> v = eval(assignment.rhs);
      if (assignment.lhs.op == Op.SCALAR) {
        final String name = ((Diagram.Scalar) assignment.lhs).text;
        if (v.scalar != null) {
          scalars.put(name, v.scalar);
        } else {
          objects.put(name, arrange(v, ImmutableList.of(), ImmutableList.of()));
        }
        return;
      }
      final Diagram.TensorTerm lhs = (Diagram.TensorTerm) assignment.lhs;
      final T t = arrange(v, lhs.left, lhs.right);
      values.put(lhs.ref, lhs.adjoint ? backend.adjoint(t) : t);
    }

    T value(TensorRef ref) {
      final T t = values.get(ref);
      if (t == null) {
        throw new IllegalArgumentException("no value for " + ref);
      }
      return t;
    }

    Space space(SpaceRef ref) {
      T t = value(ref.object);
      if (ref.adjoint) {
        t = backend.adjoint(t);
      }
      final Space space = backend.space(t, ref.position);
      return ref.dual ? space.dual() : space;
    }

    /** Permutes a value so that its legs are in a given order. */
    T arrange(Value<T> v, List<Index> left, List<Index> right) {
      if (v.tensor == null) {
        throw new IllegalArgumentException("cannot assign scalar to tensor");
      }
      final List<Index> target = concat(left, right);
      if (target.size() != v.labels.size()) {
        throw new IllegalArgumentException("legs " + v.labels
            + " do not match " + target);
      }
      final int[] perm = new int[target.size()];
      for (int k = 0; k < perm.length; k++) {
        perm[k] = v.labels.indexOf(target.get(k));
        if (perm[k] < 0) {
          throw new IllegalArgumentException("legs " + v.labels
              + " do not match " + target);
        }
      }
      return backend.permute(v.tensor, perm, left.size());
    }

    Value<T> eval(Diagram.Exp exp) {
      switch (exp.op) {
        case SCALAR:
          final Diagram.Scalar scalar = (Diagram.Scalar) exp;
          if (scalar.isLiteral()) {
            return Value.scalar(Double.parseDouble(scalar.text));
          }
          final Number n = scalars.get(scalar.text);
          if (n == null) {
            throw new IllegalArgumentException("unknown scalar " + scalar);
          }
          return Value.scalar(n);

        case CONJ:
          final Value<T> v = eval(((Diagram.Conj) exp).exp);
          if (v.scalar == null) {
            throw new IllegalArgumentException("cannot conjugate " + exp);
          }
          return v;

        case TENSOR:
          return tensor((Diagram.TensorTerm) exp);

        case TIMES:
          final Diagram.Product product = (Diagram.Product) exp;
          return times(eval(product.a0), eval(product.a1));

        case SUM:
          final Diagram.Sum sum = (Diagram.Sum) exp;
          Value<T> total = null;
          for (int k = 0; k < sum.args.size(); k++) {
            Value<T> arg = eval(sum.args.get(k));
            if (sum.signs.get(k) == Op.MINUS) {
              arg = times(Value.scalar(-1), arg);
            }
            total = total == null ? arg : plus(total, arg);
          }
          return requireNonNull(total);

        default:
          throw new UnsupportedOperationException("cannot evaluate " + exp);
      }
    }

    /** Evaluates a tensor term, tracing any legs whose index occurs
     * twice. */
    Value<T> tensor(Diagram.TensorTerm term) {
      T t = value(term.ref);
      if (term.adjoint) {
        t = backend.adjoint(t);
      }
      final List<Index> indices = term.indices();
      if (indices.size() != backend.numOut(t) + backend.numIn(t)) {
        throw new IllegalArgumentException("object " + term.ref + " has "
            + (backend.numOut(t) + backend.numIn(t)) + " legs; " + term
            + " uses " + indices.size());
      }
      final List<Integer> legs1 = new ArrayList<>();
      final List<Integer> legs2 = new ArrayList<>();
      final List<Index> labels = new ArrayList<>();
      for (int k = 0; k < indices.size(); k++) {
        final int first = indices.indexOf(indices.get(k));
        if (first < k) {
          legs1.add(first);
          legs2.add(k);
        }
      }
      if (legs1.isEmpty()) {
        return Value.tensor(t, indices);
      }
      for (int k = 0; k < indices.size(); k++) {
        if (!legs1.contains(k) && !legs2.contains(k)) {
          labels.add(indices.get(k));
        }
      }
      return Value.tensor(backend.trace(t, toArray(legs1), toArray(legs2)),
          labels);
    }

    Value<T> times(Value<T> v0, Value<T> v1) {
      if (v0.scalar != null && v1.scalar != null) {
        return Value.scalar(
            v0.scalar.doubleValue() * v1.scalar.doubleValue());
      }
      if (v0.scalar != null) {
        return Value.tensor(backend.scale(requireNonNull(v1.tensor), v0.scalar),
            v1.labels);
      }
      if (v1.scalar != null) {
        return Value.tensor(backend.scale(requireNonNull(v0.tensor), v1.scalar),
            v0.labels);
      }
      final List<Integer> ca = new ArrayList<>();
      final List<Integer> cb = new ArrayList<>();
      final List<Index> labels = new ArrayList<>();
      for (int k = 0; k < v0.labels.size(); k++) {
        final int j = v1.labels.indexOf(v0.labels.get(k));
        if (j >= 0) {
          ca.add(k);
          cb.add(j);
        } else {
          labels.add(v0.labels.get(k));
        }
      }
      final int numOut = labels.size();
      for (Index index : v1.labels) {
        if (!v0.labels.contains(index)) {
          labels.add(index);
        }
      }
      return Value.tensor(
          backend.contract(requireNonNull(v0.tensor), toArray(ca),
              requireNonNull(v1.tensor), toArray(cb), numOut),
          labels);
    }

    Value<T> plus(Value<T> v0, Value<T> v1) {
      if (v0.scalar != null && v1.scalar != null) {
        return Value.scalar(
            v0.scalar.doubleValue() + v1.scalar.doubleValue());
      }
      if (v0.tensor == null || v1.tensor == null) {
        throw new IllegalArgumentException("cannot add scalar and tensor");
      }
      final int numOut = backend.numOut(v0.tensor);
      final T t1 = arrange(v1, v0.labels.subList(0, numOut),
          v0.labels.subList(numOut, v0.labels.size()));
      return Value.tensor(backend.add(v0.tensor, t1), v0.labels);
    }
  }

  private static int[] toArray(List<Integer> list) {
    return list.stream().mapToInt(Integer::intValue).toArray();
  }

  /** Value of an expression; a scalar, or a tensor whose legs are labeled
   * with indices. */
  private static class Value<T> {
    final @Nullable Number scalar;
    final @Nullable T tensor;
    final List<Index> labels;

    private Value(@Nullable Number scalar, @Nullable T tensor,
        List<Index> labels) {
      this.scalar = scalar;
      this.tensor = tensor;
      this.labels = ImmutableList.copyOf(labels);
    }

    static <T> Value<T> scalar(Number n) {
      return new Value<>(n, null, ImmutableList.of());
    }

    static <T> Value<T> tensor(T t, List<Index> labels) {
      return new Value<>(null, t, labels);
    }
  }
}

// End PlanExecutor.java
