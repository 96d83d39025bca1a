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

/** Starts the next iteration of the innermost enclosing loop. */
public class ContinueLoop extends Statement {

  public ContinueLoop(SourcePosition position) {
    super(position);
  }

  @Override
  public Kind kind() {
    return Kind.CONTINUE_LOOP;
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
  public boolean mayContinue() {
    return true;
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    collection.onContinue();
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return "continue";
  }
}
