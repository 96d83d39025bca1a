/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.retrotrace.tree;

import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.TraceCollection;

/** A node that is evaluated for its value. */
public abstract class Expression extends Node {

  Expression(SourcePosition position) {
    super(position);
  }

  /**
   * Optimizes this expression against the trace state of {@code collection}. Should only be called
   * by {@link TraceCollection#onExpression}. The result's node is never null.
   */
  public abstract ComputeResult<Expression> computeExpression(TraceCollection collection);

  /** Returns true unless evaluating this expression certainly has no observable effect. */
  public abstract boolean mayHaveSideEffects();

  /**
   * Returns TRUE or FALSE if this expression's truth value is known at compile time, otherwise
   * null.
   */
  public @Nullable Boolean truthValue() {
    return null;
  }

  @Override
  public final boolean mayBreak() {
    return false;
  }

  @Override
  public final boolean mayContinue() {
    return false;
  }

  @Override
  public final boolean mayReturn() {
    return false;
  }
}
