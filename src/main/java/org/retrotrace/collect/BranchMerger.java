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
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;

/**
 * Computes the active versions at a control-flow join from the active versions of each incoming
 * path. Use {@link #start}, then {@link #add} once for each incoming collection, then {@link
 * #finish}.
 *
 * <p>For each variable that is active on at least one path, the result is
 *
 * <ul>
 *   <li>the version it has on every path, if all paths agree (a path on which the variable is not
 *       active contributes version zero, its entry state); or
 *   <li>a newly allocated version with a {@link Trace.Merge} of the distinct versions seen.
 * </ul>
 *
 * The result does not depend on the order in which the paths are added.
 */
final class BranchMerger {
  private TraceCollection target;

  /** The distinct versions of each variable seen so far, in the order they were seen. */
  private final Map<Variable, Set<Integer>> versions = new LinkedHashMap<>();

  /** How many of the added collections each variable was active in. */
  private final Multiset<Variable> presence = HashMultiset.create();

  /** The collections that have been added. */
  private final List<TraceCollection> inputs = new ArrayList<>();

  /** Begins a merge whose result will become the active versions of {@code target}. */
  void start(TraceCollection target) {
    Preconditions.checkState(this.target == null, "merge already in progress");
    this.target = target;
  }

  /** Adds the active versions of one incoming path. */
  void add(TraceCollection collection) {
    Preconditions.checkState(target != null);
    Preconditions.checkArgument(
        collection.state() == target.state(), "cannot merge collections of different scopes");
    collection
        .activeMap()
        .forEach(
            (variable, version) -> {
              versions.computeIfAbsent(variable, k -> new LinkedHashSet<>()).add(version);
              presence.add(variable);
            });
    inputs.add(collection);
  }

  /**
   * Installs the merged versions in the target, creating merge traces where needed, and marks the
   * inputs (other than the target itself) as consumed.
   */
  void finish() {
    Preconditions.checkState(inputs.size() >= 2, "a merge needs at least two collections");
    AnalysisState state = target.state();
    Map<Variable, Integer> merged = new LinkedHashMap<>();
    versions.forEach(
        (variable, seen) -> {
          if (presence.count(variable) < inputs.size()) {
            // Inactive on some path, which means it is still in its entry state there.
            seen.add(0);
          }
          if (seen.size() == 1) {
            merged.put(variable, seen.iterator().next());
          } else {
            ImmutableSet<Trace> predecessors =
                seen.stream()
                    .map(version -> state.getTrace(variable, version))
                    .collect(ImmutableSet.toImmutableSet());
            int version = variable.allocateNextVersion();
            state.addTrace(new Trace.Merge(variable, version, predecessors));
            merged.put(variable, version);
          }
        });
    for (TraceCollection input : inputs) {
      if (input != target) {
        input.consume();
      }
    }
    target.replaceActiveMap(merged);
    target = null;
    versions.clear();
    presence.clear();
    inputs.clear();
  }
}
