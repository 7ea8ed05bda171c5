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
import java.util.Map;
import net.hydromatic.planar.ast.Diagram;
import net.hydromatic.planar.eval.Prop;
import net.hydromatic.planar.parse.DiagramParserImpl;

/**
 * Compiles diagram programs into contraction plans.
 *
 * <p>The passes run in order: {@link AdjointNormalizer},
 * {@link ObjectBinder}, {@link BraidingResolver} (constructing braidings in
 * {@link Prop.Mode#PLANAR} mode, removing them in
 * {@link Prop.Mode#SYMMETRIC} mode), and, in planar mode only,
 * {@link PlanarityChecker} and {@link ContractionDecomposer}.
 *
 * <p>A compiler holds no state between calls; each call allocates its own
 * {@link Locals}.
 */
public class PlanarCompiler {
  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;

  /** Creates a PlanarCompiler. */
  public PlanarCompiler(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a PlanarCompiler with default properties and no tracing. */
  public PlanarCompiler() {
    this(ImmutableMap.of(), Tracers.empty());
  }

  /** Parses and compiles a program. */
  public ContractionPlan compile(String program) {
    return compile(DiagramParserImpl.create(program).program());
  }

  /**
   * Compiles a statement or block.
   *
   * @throws CompileException if the program is invalid; the exception is
   *   first passed to the tracer
   */
  public ContractionPlan compile(Diagram.Stmt stmt) {
    final Diagram.Block program = stmt instanceof Diagram.Block
        ? (Diagram.Block) stmt
        : diagram.block(stmt.pos, ImmutableList.of(stmt));
    try {
      return compileBlock(program);
    } catch (CompileException e) {
      tracer.handleCompileException(e);
      throw e;
    }
  }

  private ContractionPlan compileBlock(Diagram.Block program) {
    final Prop.Mode mode = Prop.MODE.enumValue(map, Prop.Mode.class);

    final Diagram.Block normalized = AdjointNormalizer.normalize(program);
    tracer.onNormalized(normalized);

    final Locals locals = new Locals();
    final ObjectBinder.Result bound =
        ObjectBinder.bind(normalized, locals,
            Prop.ARITY_CHECKS.booleanValue(map));
    tracer.onBound(bound.body);

    Diagram.Block body;
    switch (mode) {
      case PLANAR:
        body = BraidingResolver.construct(bound.body, locals);
        tracer.onBraidings(body);
        if (Prop.CHECK_PLANARITY.booleanValue(map)) {
          PlanarityChecker.check(body);
        }
        if (Prop.DECOMPOSE.booleanValue(map)) {
          body = ContractionDecomposer.decompose(body, locals);
        }
        break;

      case SYMMETRIC:
        body = BraidingResolver.remove(bound.body);
        tracer.onBraidings(body);
        break;

      default:
        throw new AssertionError("unknown mode " + mode);
    }

    final Diagram.Block block =
        diagram.block(program.pos,
            ImmutableList.<Diagram.Stmt>builder()
                .addAll(bound.bindings)
                .addAll(bound.checks)
                .addAll(body.stmts)
                .addAll(bound.exports)
                .build());
    final ContractionPlan plan = new ContractionPlan(block, locals, mode);
    tracer.onPlan(plan);
    return plan;
  }
}

// End PlanarCompiler.java
