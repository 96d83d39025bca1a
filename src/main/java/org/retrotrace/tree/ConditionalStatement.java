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
import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.TraceCollection;

/** Executes one of two optional branches, depending on the truth value of a condition. */
public class ConditionalStatement extends Statement {
  private Expression condition;
  private @Nullable StatementSequence yesBranch;
  private @Nullable StatementSequence noBranch;

  public ConditionalStatement(
      SourcePosition position,
      Expression condition,
      @Nullable StatementSequence yesBranch,
      @Nullable StatementSequence noBranch) {
    super(position);
    this.condition = condition;
    this.yesBranch = yesBranch;
    this.noBranch = noBranch;
  }

  @Override
  public Kind kind() {
    return Kind.CONDITIONAL;
  }

  public Expression condition() {
    return condition;
  }

  public @Nullable StatementSequence yesBranch() {
    return yesBranch;
  }

  public @Nullable StatementSequence noBranch() {
    return noBranch;
  }

  @Override
  public ImmutableList<Node> children() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    builder.add(condition);
    if (yesBranch != null) {
      builder.add(yesBranch);
    }
    if (noBranch != null) {
      builder.add(noBranch);
    }
    return builder.build();
  }

  @Override
  public boolean isAborting() {
    return yesBranch != null && noBranch != null && yesBranch.isAborting() && noBranch.isAborting();
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    condition = collection.onExpression(condition);
    Boolean truthValue = condition.truthValue();

    // A branch that is known not to be taken is not computed, and a branch that aborts doesn't
    // reach the join, so neither contributes to the merge.
    TraceCollection yesCollection = null;
    if (yesBranch != null && !Boolean.FALSE.equals(truthValue)) {
      yesCollection = collection.branch("conditional yes branch");
      yesBranch = yesCollection.computeBranch(yesBranch);
      if (yesBranch != null && yesBranch.isAborting()) {
        yesCollection = null;
      }
    }
    TraceCollection noCollection = null;
    if (noBranch != null && !Boolean.TRUE.equals(truthValue)) {
      noCollection = collection.branch("conditional no branch");
      noBranch = noCollection.computeBranch(noBranch);
      if (noBranch != null && noBranch.isAborting()) {
        noCollection = null;
      }
    }
    if (truthValue == null) {
      collection.mergeTwoBranches(yesCollection, noCollection);
    } else {
      // Only the taken branch reaches the join.
      TraceCollection taken = truthValue ? yesCollection : noCollection;
      if (taken != null) {
        collection.mergeNBranches(ImmutableList.of(taken));
      }
    }

    if (yesBranch == null && noBranch == null) {
      return ComputeResult.replaced(
          new ExpressionStatement(condition.position, condition),
          ChangeTag.NEW_STATEMENTS,
          "Removed conditional statement without effect.");
    }
    if (truthValue != null) {
      StatementSequence chosen = truthValue ? yesBranch : noBranch;
      List<Statement> replacement = new ArrayList<>();
      if (condition.mayHaveSideEffects()) {
        replacement.add(new ExpressionStatement(condition.position, condition));
      }
      if (chosen != null) {
        replacement.addAll(chosen.statements());
      }
      String message =
          String.format("Condition for branch was predicted to be always %s.", truthValue);
      if (replacement.isEmpty()) {
        return ComputeResult.removed(ChangeTag.NEW_STATEMENTS, message);
      }
      return ComputeResult.replaced(
          new StatementSequence(position, replacement), ChangeTag.NEW_STATEMENTS, message);
    }
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    return "if " + condition + " " + yesBranch + " else " + noBranch;
  }
}
