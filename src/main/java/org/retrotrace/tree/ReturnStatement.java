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

/** Returns from the enclosing function, optionally with a value. */
public class ReturnStatement extends Statement {
  private @Nullable Expression value;

  public ReturnStatement(SourcePosition position, @Nullable Expression value) {
    super(position);
    this.value = value;
  }

  @Override
  public Kind kind() {
    return Kind.RETURN;
  }

  public @Nullable Expression value() {
    return value;
  }

  @Override
  public ImmutableList<Node> children() {
    return (value == null) ? ImmutableList.of() : ImmutableList.of(value);
  }

  @Override
  public boolean isAborting() {
    return true;
  }

  @Override
  public boolean mayReturn() {
    return true;
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    if (value != null) {
      value = collection.onExpression(value);
    }
    collection.onReturn();
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return (value == null) ? "return" : "return " + value;
  }
}
