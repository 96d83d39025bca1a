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
import org.retrotrace.collect.TraceCollection;
import org.retrotrace.trace.Variable;

/** Releases the value of a variable when its scope is exited. */
public class ReleaseVariable extends Statement {
  private final Variable variable;

  public ReleaseVariable(SourcePosition position, Variable variable) {
    super(position);
    this.variable = variable;
  }

  @Override
  public Kind kind() {
    return Kind.RELEASE_VARIABLE;
  }

  public Variable variable() {
    return variable;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    if (collection.currentTrace(variable).mustNotHaveValue()) {
      return ComputeResult.removed(
          ChangeTag.NEW_STATEMENTS,
          String.format("Uninitialized variable '%s' is not released.", variable));
    }
    collection.onVariableReleased(variable);
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return "release " + variable;
  }
}
