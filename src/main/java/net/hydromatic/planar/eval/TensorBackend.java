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

/**
 * Operations on tensors that a {@link PlanExecutor} needs.
 *
 * <p>A tensor has {@link #numOut} output (codomain) legs followed by
 * {@link #numIn} input (domain) legs; legs are numbered from 0 in that
 * order. The space of an input leg is reported dualized, so that two legs
 * can be contracted if and only if their spaces are dual.
 *
 * @param <T> Tensor type
 */
public interface TensorBackend<T> {
  /** Returns the number of output legs of a tensor. */
  int numOut(T t);

  /** Returns the number of input legs of a tensor. */
  int numIn(T t);

  /** Returns the space of a leg of a tensor. */
  Space space(T t, int leg);

  /** Returns the adjoint of a tensor; its output legs are the input legs
   * of {@code t}, and vice versa. */
  T adjoint(T t);

  /** Returns the braiding of two spaces; its output legs have spaces
   * {@code (s2, s1)} and its input legs {@code (s1, s2)}. */
  T braiding(Space s1, Space s2);

  /**
   * Contracts two tensors.
   *
   * <p>Leg {@code ca[k]} of {@code a} is contracted with leg {@code cb[k]} of
   * {@code b}. The legs of the result are the other legs of {@code a}, in
   * order, followed by the other legs of {@code b}; the first
   * {@code numOut} are output legs.
   *
   * @throws IllegalArgumentException if the spaces of two contracted legs
   *   are not dual
   */
  T contract(T a, int[] ca, T b, int[] cb, int numOut);

  /** Returns a tensor whose leg {@code k} is leg {@code perm[k]} of
   * {@code t}; the first {@code numOut} are output legs. */
  T permute(T t, int[] perm, int numOut);

  /** Traces leg {@code legs1[k]} of a tensor with leg {@code legs2[k]};
   * the remaining legs keep their order. */
  T trace(T t, int[] legs1, int[] legs2);

  /** Adds two tensors whose legs have the same spaces. */
  T add(T a, T b);

  /** Multiplies a tensor by a scalar. */
  T scale(T t, Number factor);
}

// End TensorBackend.java
