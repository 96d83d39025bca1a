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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * An AbortTracking scope routes early exits of the requested kinds to fresh registries for as long
 * as it is open. Opening one saves the registries that were active before (possibly none) and
 * closing it restores them, so the exits of an inner loop or function never leak into an outer
 * one's registries.
 *
 * <p>Scopes must be closed in the reverse of the order in which they were opened; use
 * try-with-resources:
 *
 * <pre>
 *   try (AbortTracking tracking = collection.withAbortTracking(true, true, false)) {
 *     ...
 *     breaks = tracking.collections(ExitKind.BREAK);
 *   }
 * </pre>
 */
public final class AbortTracking implements AutoCloseable {
  private final AnalysisState state;

  /** The registries that were active when this scope was opened; values may be null. */
  private final Map<ExitKind, List<TraceCollection>> saved = new EnumMap<>(ExitKind.class);

  /** The registries installed by this scope. */
  private final Map<ExitKind, List<TraceCollection>> installed = new EnumMap<>(ExitKind.class);

  /** The nesting depth of this scope, starting at one for the outermost. */
  private final int depth;

  private boolean closed;

  AbortTracking(AnalysisState state, EnumSet<ExitKind> kinds) {
    this.state = state;
    for (ExitKind kind : kinds) {
      saved.put(kind, state.exitCollections(kind));
      List<TraceCollection> registry = new ArrayList<>();
      installed.put(kind, registry);
      state.setExitCollections(kind, registry);
    }
    depth = state.pushAbortTracking();
  }

  /** Returns true if this scope collects exits of the given kind. */
  public boolean tracks(ExitKind kind) {
    return installed.containsKey(kind);
  }

  /**
   * Returns the snapshots collected by this scope for the given kind of exit, in the order the
   * exits were encountered. May be called before or after the scope is closed.
   */
  public ImmutableList<TraceCollection> collections(ExitKind kind) {
    Preconditions.checkArgument(tracks(kind), "%s exits are not tracked by this scope", kind);
    return ImmutableList.copyOf(installed.get(kind));
  }

  /**
   * Restores the registries that were active when this scope was opened. They are restored even if
   * this scope is closed out of order, which is then reported with an IllegalStateException.
   */
  @Override
  public void close() {
    Preconditions.checkState(!closed, "abort tracking scope closed twice");
    saved.forEach(state::setExitCollections);
    state.popAbortTracking(depth);
    closed = true;
  }
}
