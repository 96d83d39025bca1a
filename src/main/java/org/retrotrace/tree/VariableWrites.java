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

import com.google.common.collect.ImmutableSet;
import org.retrotrace.trace.Variable;

/** Finds the variables that a subtree may write. */
public final class VariableWrites {

  private VariableWrites() {}

  /**
   * Returns the variables that are assigned or deleted anywhere in {@code node}, in the order
   * their first write appears.
   */
  public static ImmutableSet<Variable> of(Node node) {
    ImmutableSet.Builder<Variable> builder = ImmutableSet.builder();
    collect(node, builder);
    return builder.build();
  }

  private static void collect(Node node, ImmutableSet.Builder<Variable> builder) {
    switch (node.kind()) {
      case ASSIGN_VARIABLE -> builder.add(((AssignVariable) node).target());
      case DEL_VARIABLE -> builder.add(((DelVariable) node).target());
      case STATEMENT_SEQUENCE,
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
          CALL -> {}
    }
    for (Node child : node.children()) {
      collect(child, builder);
    }
  }
}
