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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.TraceCollection;

/**
 * A non-empty sequence of statements, executed in order. Statement sequences are the bodies of
 * modules, functions, loops, and conditional branches; an optional body is represented by null
 * rather than by an empty sequence.
 */
public class StatementSequence extends Statement {
  private final List<Statement> statements;

  public StatementSequence(SourcePosition position, List<Statement> statements) {
    super(position);
    Preconditions.checkArgument(!statements.isEmpty(), "empty statement sequence");
    this.statements = new ArrayList<>(statements);
  }

  /** Returns a sequence of the given statements, positioned at the first of them. */
  public static StatementSequence of(Statement first, Statement... rest) {
    List<Statement> statements = new ArrayList<>();
    statements.add(first);
    statements.addAll(Arrays.asList(rest));
    return new StatementSequence(first.position, statements);
  }

  @Override
  public Kind kind() {
    return Kind.STATEMENT_SEQUENCE;
  }

  public ImmutableList<Statement> statements() {
    return ImmutableList.copyOf(statements);
  }

  public int size() {
    return statements.size();
  }

  public Statement last() {
    return statements.get(statements.size() - 1);
  }

  /** Removes the last statement; the sequence must have at least two. */
  void removeLast() {
    Preconditions.checkState(statements.size() > 1);
    statements.remove(statements.size() - 1);
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.copyOf(statements);
  }

  @Override
  public boolean isAborting() {
    return last().isAborting();
  }

  @Override
  public ComputeResult<Statement> computeStatement(TraceCollection collection) {
    StatementSequence result = computeStatementsSequence(collection);
    if (result == null) {
      return ComputeResult.removed(ChangeTag.NEW_STATEMENTS, "Removed empty statement sequence.");
    }
    return ComputeResult.unchanged(result);
  }

  /**
   * Optimizes each statement in order using {@code collection}. Removed statements are dropped,
   * sequences returned in place of a statement are spliced in, and statements following one that
   * aborts are removed as unreachable.
   *
   * @return this sequence, updated in place, or null if no statements remain
   */
  public @Nullable StatementSequence computeStatementsSequence(TraceCollection collection) {
    List<Statement> newStatements = new ArrayList<>();
    boolean changed = false;
    for (int i = 0; i < statements.size(); i++) {
      Statement statement = statements.get(i);
      Statement newStatement = collection.onStatement(statement);
      if (newStatement == null) {
        changed = true;
        continue;
      }
      if (newStatement instanceof StatementSequence nested) {
        newStatements.addAll(nested.statements);
        changed = true;
      } else {
        newStatements.add(newStatement);
        changed |= (newStatement != statement);
      }
      if (i != statements.size() - 1 && newStatement.isAborting()) {
        collection.signalChange(
            ChangeTag.NEW_STATEMENTS, statements.get(i + 1).position, "Removed dead statements.");
        changed = true;
        break;
      }
    }
    if (!changed) {
      return this;
    } else if (newStatements.isEmpty()) {
      return null;
    }
    statements.clear();
    statements.addAll(newStatements);
    return this;
  }

  @Override
  public String toString() {
    return statements.toString();
  }
}
