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

/**
 * Classifies the rewrites reported through {@link ChangeNotifier}. The driver uses these to decide
 * whether another optimization pass may find more to do.
 */
public enum ChangeTag {
  /** Statements were removed, replaced, or restructured. */
  NEW_STATEMENTS("new_statements"),
  /** An expression was replaced by a simpler one. */
  NEW_EXPRESSION("new_expression"),
  /** A value became a compile-time constant. */
  NEW_CONSTANTS("new_constants");

  /** The name used for this tag in logs. */
  public final String tagName;

  ChangeTag(String tagName) {
    this.tagName = tagName;
  }

  @Override
  public String toString() {
    return tagName;
  }
}
