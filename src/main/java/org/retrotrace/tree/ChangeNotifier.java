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
 * Receives a notification for every rewrite made while optimizing a tree. Exactly one notification
 * is sent per replaced or removed node.
 */
public interface ChangeNotifier {
  /** A ChangeNotifier that ignores all notifications. */
  ChangeNotifier IGNORE = (tag, position, message) -> {};

  void signalChange(ChangeTag tag, SourcePosition position, String message);
}
