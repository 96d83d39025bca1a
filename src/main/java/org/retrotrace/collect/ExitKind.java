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

package org.retrotrace.collect;

/** The kinds of early exit that an {@link AbortTracking} scope can collect. */
public enum ExitKind {
  BREAK("loop break"),
  CONTINUE("loop continue"),
  RETURN("return");

  /** The name given to the collections that snapshot the state at an exit of this kind. */
  final String collectionName;

  ExitKind(String collectionName) {
    this.collectionName = collectionName;
  }
}
