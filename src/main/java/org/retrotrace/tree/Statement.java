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

import org.retrotrace.collect.TraceCollection;

/** A node that is executed for its effect. */
public abstract class Statement extends Node {

  Statement(SourcePosition position) {
    super(position);
  }

  /**
   * Optimizes this statement against the trace state of {@code collection}, recording any writes,
   * deletes and exits it performs. Should only be called by {@link TraceCollection#onStatement}.
   */
  public abstract ComputeResult<Statement> computeStatement(TraceCollection collection);

  /**
   * Returns true if control never falls through to the statement that follows this one (it always
   * breaks, continues, returns, or runs forever).
   */
  public boolean isAborting() {
    return false;
  }
}
