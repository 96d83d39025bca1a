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

/** Exits the innermost enclosing loop. */
public class BreakLoop extends Statement {

  public BreakLoop(SourcePosition position) {
    super(position);
  }

  @Override
  public Kind kind() {
    return Kind.BREAK_LOOP;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public boolean isAborting() {
    return true;
  }

  @Override
  public boolean mayBreak() {
    return true;
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    collection.onBreak();
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return "break";
  }
}
