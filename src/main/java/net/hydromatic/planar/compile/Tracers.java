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

import java.util.function.Consumer;
import net.hydromatic.planar.ast.Diagram;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the normalized
   * program, then calls the underlying tracer. */
  public static Tracer withOnNormalized(Tracer tracer,
      Consumer<Diagram.Block> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onNormalized(Diagram.Block block) {
        consumer.accept(block);
        super.onNormalized(block);
      }
    };
  }

  /** Returns a tracer that performs the given action on the bound
   * program, then calls the underlying tracer. */
  public static Tracer withOnBound(Tracer tracer,
      Consumer<Diagram.Block> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onBound(Diagram.Block block) {
        consumer.accept(block);
        super.onBound(block);
      }
    };
  }

  public static Tracer withOnBraidings(Tracer tracer,
      Consumer<Diagram.Block> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onBraidings(Diagram.Block block) {
        consumer.accept(block);
        super.onBraidings(block);
      }
    };
  }

  /** Returns a tracer that performs the given action on a plan,
   * then calls the underlying tracer. */
  public static Tracer withOnPlan(Tracer tracer,
      Consumer<ContractionPlan> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPlan(ContractionPlan plan) {
        consumer.accept(plan);
        super.onPlan(plan);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(
          @Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onNormalized(Diagram.Block block) {
    }

    @Override public void onBound(Diagram.Block block) {
    }

    @Override public void onBraidings(Diagram.Block block) {
    }

    @Override public void onPlan(ContractionPlan plan) {
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onNormalized(Diagram.Block block) {
      tracer.onNormalized(block);
    }

    @Override public void onBound(Diagram.Block block) {
      tracer.onBound(block);
    }

    @Override public void onBraidings(Diagram.Block block) {
      tracer.onBraidings(block);
    }

    @Override public void onPlan(ContractionPlan plan) {
      tracer.onPlan(plan);
    }

    @Override public boolean handleCompileException(
        @Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
