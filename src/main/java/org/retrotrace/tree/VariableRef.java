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

/** Reads the current value of a variable. */
public class VariableRef extends Expression {
  private final Variable variable;

  /** The trace this reference read in the most recent pass, or null if not yet computed. */
  private @Nullable Trace trace;

  public VariableRef(SourcePosition position, Variable variable) {
    super(position);
    this.variable = variable;
  }

  @Override
  public Kind kind() {
    return Kind.VARIABLE_REF;
  }

  public Variable variable() {
    return variable;
  }

  public @Nullable Trace trace() {
    return trace;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  /** Reading an unbound variable raises, so only a reference known to be bound is pure. */
  @Override
  public boolean mayHaveSideEffects() {
    return trace == null || !trace.mustHaveValue();
  }

  @Override
  public ComputeResult<Expression> computeExpression(TraceCollection collection) {
    trace = collection.currentTrace(variable);
    if (collection.state().options().propagateConstants
        && !collection.removesKnowledge()
        && trace instanceof Trace.Assign assign
        && assign.assignNode().source() instanceof Constant constant) {
      return ComputeResult.replaced(
          new Constant(position, constant.value()),
          ChangeTag.NEW_CONSTANTS,
          String.format("Replaced read of variable '%s' with constant %s.", variable, constant));
    }
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return variable.name;
  }
}
