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

/**
 * The base class of all tree nodes. The set of node kinds is closed; each concrete node reports
 * its {@link Kind}, and capability checks switch over it exhaustively.
 *
 * <p>Nodes have no parent pointers. A node that is rewritten during optimization is replaced by
 * whichever node holds it in a child slot; nodes never replace themselves.
 */
public abstract class Node {

  /** Identifies the concrete class of a Node. */
  public enum Kind {
    STATEMENT_SEQUENCE,
    ASSIGN_VARIABLE,
    DEL_VARIABLE,
    RELEASE_VARIABLE,
    EXPRESSION_ONLY,
    CONDITIONAL,
    LOOP,
    BREAK_LOOP,
    CONTINUE_LOOP,
    RETURN,
    VARIABLE_REF,
    CONSTANT,
    BINARY_OPERATION,
    CALL;

    /** True for kinds that are subclasses of {@link Statement}. */
    public boolean isStatement() {
      return switch (this) {
        case STATEMENT_SEQUENCE,
            ASSIGN_VARIABLE,
            DEL_VARIABLE,
            RELEASE_VARIABLE,
            EXPRESSION_ONLY,
            CONDITIONAL,
            LOOP,
            BREAK_LOOP,
            CONTINUE_LOOP,
            RETURN -> true;
        case VARIABLE_REF, CONSTANT, BINARY_OPERATION, CALL -> false;
      };
    }
  }

  public final SourcePosition position;

  Node(SourcePosition position) {
    this.position = position;
  }

  public abstract Kind kind();

  public final boolean isStatement() {
    return kind().isStatement();
  }

  public final boolean isExpression() {
    return !kind().isStatement();
  }

  /** Returns the current children of this node in evaluation order, omitting absent children. */
  public abstract ImmutableList<Node> children();

  /** Returns true if executing this node may break out of the innermost enclosing loop. */
  public boolean mayBreak() {
    return children().stream().anyMatch(Node::mayBreak);
  }

  /** Returns true if executing this node may continue the innermost enclosing loop. */
  public boolean mayContinue() {
    return children().stream().anyMatch(Node::mayContinue);
  }

  /** Returns true if executing this node may return from the enclosing function. */
  public boolean mayReturn() {
    return children().stream().anyMatch(Node::mayReturn);
  }
}
