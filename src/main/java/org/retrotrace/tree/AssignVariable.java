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

/** Binds a variable to the value of an expression. */
public class AssignVariable extends Statement {
  private final Variable target;
  private Expression source;

  /** The trace created for this assignment by the most recent pass, or null if not yet computed. */
  private Trace.@Nullable Assign trace;

  public AssignVariable(SourcePosition position, Variable target, Expression source) {
    super(position);
    this.target = target;
    this.source = source;
  }

  @Override
  public Kind kind() {
    return Kind.ASSIGN_VARIABLE;
  }

  public Variable target() {
    return target;
  }

  public Expression source() {
    return source;
  }

  public Trace.@Nullable Assign trace() {
    return trace;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of(source);
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    // The source is evaluated before the variable is bound.
    source = collection.onExpression(source);
    trace = collection.onVariableAssigned(this);
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return target + " = " + source;
  }
}
