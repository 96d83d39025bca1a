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
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.retrotrace.collect.TraceCollection;

/**
 * Calls a function that the optimizer knows nothing about. A call may read or rebind any variable
 * visible to code outside the current flow, and may retain any value passed to it.
 *
 * <p>A dynamic call is one that can inspect or modify the caller's locals by name (e.g. {@code
 * locals()} or {@code exec}); after one, nothing is known about any variable.
 */
public class Call extends Expression {
  private final String callee;
  private final List<Expression> arguments;
  private final boolean dynamic;

  public Call(SourcePosition position, String callee, List<Expression> arguments, boolean dynamic) {
    super(position);
    this.callee = callee;
    this.arguments = new ArrayList<>(arguments);
    this.dynamic = dynamic;
  }

  public Call(SourcePosition position, String callee, List<Expression> arguments) {
    this(position, callee, arguments, false);
  }

  @Override
  public Kind kind() {
    return Kind.CALL;
  }

  public String callee() {
    return callee;
  }

  public ImmutableList<Expression> arguments() {
    return ImmutableList.copyOf(arguments);
  }

  public boolean isDynamic() {
    return dynamic;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.copyOf(arguments);
  }

  @Override
  public boolean mayHaveSideEffects() {
    return true;
  }

  @Override
  public ComputeResult<Expression> computeExpression(TraceCollection collection) {
    arguments.replaceAll(collection::onExpression);
    for (Expression argument : arguments) {
      if (argument instanceof VariableRef ref) {
        collection.onVariableContentEscapes(ref.variable());
      }
    }
    if (dynamic) {
      collection.assumeUnclearLocals();
      collection.removeAllKnowledge();
    } else {
      collection.escapeAllActiveVariables();
    }
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return arguments.stream()
        .map(Expression::toString)
        .collect(Collectors.joining(", ", callee + "(", ")"));
  }
}
