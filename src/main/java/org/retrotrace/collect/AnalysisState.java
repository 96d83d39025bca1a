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
import com.google.common.collect.Table;
import com.google.common.collect.Tables;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.retrotrace.OptimizerOptions;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;
import org.retrotrace.tree.ChangeNotifier;
import org.retrotrace.tree.ChangeTag;
import org.retrotrace.tree.SourcePosition;

/**
 * The state shared by a root {@link TraceCollection} (for a module or function body) and all the
 * branch collections forked from it during one optimization pass:
 *
 * <ul>
 *   <li>the trace table, mapping each (variable, version) pair to its Trace;
 *   <li>the currently active break, continue, and return registries (see {@link AbortTracking});
 *   <li>the {@link ChangeNotifier} that receives rewrite notifications; and
 *   <li>the {@link OptimizerOptions} in effect.
 * </ul>
 *
 * The trace table only grows: once added, a trace is never removed or replaced.
 */
public class AnalysisState {
  /**
   * Rows (variables) are kept in the order they were first seen, columns (versions) in ascending
   * order.
   */
  private final Table<Variable, Integer, Trace> traces =
      Tables.newCustomTable(new LinkedHashMap<>(), TreeMap::new);

  private final Map<ExitKind, List<TraceCollection>> exitCollections =
      new EnumMap<>(ExitKind.class);

  /** The number of currently open AbortTracking scopes. */
  private int abortDepth;

  /**
   * Set if the scope contains dynamic-name operations, which means that local variables may be read
   * or written without a corresponding node in the tree.
   */
  private boolean unclearLocals;

  final OptimizerOptions options;
  private final ChangeNotifier notifier;

  public AnalysisState(OptimizerOptions options, ChangeNotifier notifier) {
    this.options = options;
    this.notifier = notifier;
  }

  public OptimizerOptions options() {
    return options;
  }

  public boolean hasTrace(Variable variable, int version) {
    return traces.contains(variable, version);
  }

  /**
   * Returns the trace for the given version of {@code variable}.
   *
   * @throws IllegalStateException if there is no such trace
   */
  public Trace getTrace(Variable variable, int version) {
    Trace result = traces.get(variable, version);
    Preconditions.checkState(result != null, "No trace for %s#%s", variable, version);
    return result;
  }

  /** Returns all traces for {@code variable}, in order of increasing version. */
  public ImmutableList<Trace> getTraces(Variable variable) {
    return ImmutableList.copyOf(traces.row(variable).values());
  }

  /** Returns all traces, grouped by variable and ordered by version within each variable. */
  public ImmutableList<Trace> getAllTraces() {
    return traces.rowMap().values().stream()
        .flatMap(row -> row.values().stream())
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the number of traces in the table. */
  public int size() {
    return traces.size();
  }

  /**
   * Adds a trace to the table.
   *
   * @throws IllegalStateException if there is already a trace for the same variable and version
   */
  public void addTrace(Trace trace) {
    Trace prev = traces.get(trace.variable, trace.version);
    Preconditions.checkState(prev == null, "Duplicate trace for %s: %s", trace.key(), prev);
    traces.put(trace.variable, trace.version, trace);
  }

  void assumeUnclearLocals() {
    unclearLocals = true;
  }

  public boolean hasUnclearLocals() {
    return unclearLocals;
  }

  void signalChange(ChangeTag tag, SourcePosition position, String message) {
    notifier.signalChange(tag, position, message);
  }

  /** Returns the active registry for the given kind of exit, or null if there is none. */
  @Nullable List<TraceCollection> exitCollections(ExitKind kind) {
    return exitCollections.get(kind);
  }

  void setExitCollections(ExitKind kind, @Nullable List<TraceCollection> registry) {
    if (registry == null) {
      exitCollections.remove(kind);
    } else {
      exitCollections.put(kind, registry);
    }
  }

  /** Called when an AbortTracking scope is opened; returns its depth. */
  int pushAbortTracking() {
    return ++abortDepth;
  }

  /** Called when the AbortTracking scope with the given depth is closed. */
  void popAbortTracking(int depth) {
    Preconditions.checkState(
        depth == abortDepth,
        "abort tracking scope at depth %s closed while depth %s is open",
        depth,
        abortDepth);
    --abortDepth;
  }

  /** Returns a listing of every trace in the table, one per line. */
  public String dumpTraces() {
    return getAllTraces().stream().map(Trace::dump).collect(Collectors.joining("\n"));
  }
}
