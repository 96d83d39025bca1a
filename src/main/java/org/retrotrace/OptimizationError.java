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

package org.retrotrace;

import org.retrotrace.tree.SourcePosition;

/**
 * Thrown when optimizing a statement fails. This always indicates a defect in the optimizer rather
 * than in the program being compiled, and abandons optimization of the whole compilation unit.
 */
public class OptimizationError extends RuntimeException {
  /** The position of the innermost statement whose optimization failed. */
  public final SourcePosition position;

  public OptimizationError(RuntimeException cause, SourcePosition position) {
    super(cause);
    this.position = position;
  }

  @Override
  public String getMessage() {
    return String.format("Problem with statement at %s: %s", position, getCause().getMessage());
  }
}
