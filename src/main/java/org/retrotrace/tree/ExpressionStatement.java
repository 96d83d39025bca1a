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

/** Evaluates an expression and discards its value. */
public class ExpressionStatement extends Statement {
  private Expression expression;

  public ExpressionStatement(SourcePosition position, Expression expression) {
    super(position);
    this.expression = expression;
  }

  @Override
  public Kind kind() {
    return Kind.EXPRESSION_ONLY;
  }

  public Expression expression() {
    return expression;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of(expression);
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    expression = collection.onExpression(expression);
    if (!expression.mayHaveSideEffects()) {
      return ComputeResult.removed(
          ChangeTag.NEW_STATEMENTS, "Removed expression statement without effect.");
    }
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return expression.toString();
  }
}
