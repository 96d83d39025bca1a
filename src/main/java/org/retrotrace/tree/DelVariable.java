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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.TraceCollection;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;

/**
 * Unbinds a variable. A tolerant delete (as generated for compiler temporaries) does nothing if the
 * variable is not bound; otherwise deleting an unbound variable raises an error at runtime.
 */
public class DelVariable extends Statement {
  private final Variable target;
  private final boolean tolerant;

  /** The trace that was active before the delete, as of the most recent pass. */
  private @Nullable Trace previousTrace;

  public DelVariable(SourcePosition position, Variable target, boolean tolerant) {
    super(position);
    this.target = target;
    this.tolerant = tolerant;
  }

  @Override
  public Kind kind() {
    return Kind.DEL_VARIABLE;
  }

  public Variable target() {
    return target;
  }

  public boolean isTolerant() {
    return tolerant;
  }

  public @Nullable Trace previousTrace() {
    return previousTrace;
  }

  /**
   * Returns true if the most recent pass proved that this (intolerant) delete will find the
   * variable unbound. Reporting that is left to later stages.
   */
  public boolean isKnownToRaise() {
    return !tolerant && previousTrace != null && previousTrace.mustNotHaveValue();
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    previousTrace = collection.onVariableDeleted(this);
    if (tolerant && previousTrace.mustNotHaveValue()) {
      return ComputeResult.removed(
          ChangeTag.NEW_STATEMENTS,
          String.format("Removed tolerant 'del' of variable '%s' that is not assigned.", target));
    }
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return "del " + target;
  }
}
