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
import org.retrotrace.collect.AbortTracking;
import org.retrotrace.collect.ExitKind;
import org.retrotrace.collect.TraceCollection;

/**
 * A loop that repeats its body unconditionally. Other looping constructs are lowered to this one
 * before optimization, so the only ways out of a LoopStatement are a break, a return, or an
 * exception; a loop whose body cannot break never falls through to the following statement.
 */
public class LoopStatement extends Statement {
  private @Nullable StatementSequence body;

  public LoopStatement(SourcePosition position, @Nullable StatementSequence body) {
    super(position);
    this.body = body;
  }

  @Override
  public Kind kind() {
    return Kind.LOOP;
  }

  public @Nullable StatementSequence body() {
    return body;
  }

  @Override
  public ImmutableList<Node> children() {
    return (body == null) ? ImmutableList.of() : ImmutableList.of(body);
  }

  @Override
  public boolean isAborting() {
    return body == null || !body.mayBreak();
  }

  /** Breaks and continues in the body apply to this loop, never to an enclosing one. */
  @Override
  public boolean mayBreak() {
    return false;
  }

  @Override
  public boolean mayContinue() {
    return false;
  }

  @Override
  public boolean mayReturn() {
    return body != null && body.mayReturn();
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection outerCollection) {
    TraceCollection collection = outerCollection.branch("loop");
    ImmutableList<TraceCollection> breakCollections;
    try (AbortTracking tracking = collection.withAbortTracking(true, true, false)) {
      if (body != null) {
        // Anything written in the body may have been written by a previous iteration.
        collection.degradePartiallyFromCode(body);
        body = body.computeStatementsSequence(collection);
      }
      breakCollections = tracking.collections(ExitKind.BREAK);
    }

    // Falling off the end of the body continues the loop anyway.
    if (body != null && body.last().kind() == Kind.CONTINUE_LOOP) {
      Statement last = body.last();
      if (body.size() == 1) {
        body = null;
      } else {
        body.removeLast();
      }
      outerCollection.signalChange(
          ChangeTag.NEW_STATEMENTS,
          last.position,
          "Removed useless terminal 'continue' as last statement of loop.");
    }

    // Breaks are the only way to reach the statement after the loop.
    if (!breakCollections.isEmpty()) {
      outerCollection.mergeNBranches(breakCollections);
    }

    // Only a body consisting of just a break is handled; removing a leading break from a longer
    // body would require numbering the loop's exits.
    if (body != null && body.size() == 1 && body.last().kind() == Kind.BREAK_LOOP) {
      return ComputeResult.removed(
          ChangeTag.NEW_STATEMENTS, "Removed useless loop with immediate 'break' statement.");
    }
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return "loop " + body;
  }
}
