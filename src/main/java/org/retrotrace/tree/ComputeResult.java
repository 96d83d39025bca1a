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
import org.jspecify.annotations.Nullable;

/**
 * The result of asking a node to compute itself against the current trace state: the node that
 * should take its place (possibly the node itself, or null if a statement should be removed), and,
 * if anything changed, a tag and a human-readable reason.
 */
public final class ComputeResult<T extends Node> {
  private final @Nullable T node;
  private final @Nullable ChangeTag tag;
  private final @Nullable String message;

  private ComputeResult(@Nullable T node, @Nullable ChangeTag tag, @Nullable String message) {
    Preconditions.checkArgument((tag == null) == (message == null));
    this.node = node;
    this.tag = tag;
    this.message = message;
  }

  /** Returns a result indicating that {@code node} should be kept as is. */
  public static <T extends Node> ComputeResult<T> unchanged(T node) {
    return new ComputeResult<>(node, null, null);
  }

  /** Returns a result indicating that the computed node should be replaced by {@code node}. */
  public static <T extends Node> ComputeResult<T> replaced(
      T node, ChangeTag tag, String message) {
    return new ComputeResult<>(node, tag, message);
  }

  /** Returns a result indicating that the computed statement should be removed. */
  public static <T extends Statement> ComputeResult<T> removed(ChangeTag tag, String message) {
    return new ComputeResult<>(null, tag, message);
  }

  /** The replacement node, or null if the node should be removed. */
  public @Nullable T node() {
    return node;
  }

  /** Non-null if and only if this result reports a change. */
  public @Nullable ChangeTag tag() {
    return tag;
  }

  public @Nullable String message() {
    return message;
  }

  @Override
  public String toString() {
    return (tag == null) ? "unchanged" : tag + ": " + message;
  }
}
