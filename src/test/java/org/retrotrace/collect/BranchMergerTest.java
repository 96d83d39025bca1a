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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.retrotrace.TestTrees.assign;
import static org.retrotrace.TestTrees.del;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.retrotrace.OptimizerOptions;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;
import org.retrotrace.tree.ChangeNotifier;

@RunWith(JUnit4.class)
public class BranchMergerTest {
  Variable x = new Variable("x", Variable.Kind.LOCAL);
  final Variable y = new Variable("y", Variable.Kind.LOCAL);
  final Variable p = new Variable("p", Variable.Kind.PARAMETER);

  TraceCollection root = newRoot();

  static TraceCollection newRoot() {
    return TraceCollection.forFunction(
        "f", new AnalysisState(OptimizerOptions.defaults(), ChangeNotifier.IGNORE));
  }

  @Test
  public void identicalStatesAddNoTraces() {
    root.onStatement(assign(x, 1));
    root.currentVersion(p);
    TraceCollection a = root.branch("a");
    TraceCollection b = root.branch("b");
    int size = root.state().size();
    root.mergeNBranches(ImmutableList.of(a, b));
    assertThat(root.state().size()).isEqualTo(size);
    assertThat(root.currentVersion(x)).isEqualTo(1);
    assertThat(root.currentVersion(p)).isEqualTo(0);
    assertThat(a.isConsumed()).isTrue();
    assertThat(b.isConsumed()).isTrue();
  }

  @Test
  public void divergentStatesAreMerged() {
    root.currentVersion(p);
    TraceCollection a = root.branch("a");
    TraceCollection b = root.branch("b");
    a.onStatement(assign(x, 1));
    b.onStatement(assign(x, 2));
    root.mergeTwoBranches(a, b);
    Trace merged = root.currentTrace(x);
    assertThat(merged.isMerge()).isTrue();
    assertThat(merged.version).isEqualTo(3);
    assertThat(((Trace.Merge) merged).predecessorVersions()).containsExactly(1, 2);
    assertThat(merged.mustHaveValue()).isTrue();
    assertThat(root.currentVersion(p)).isEqualTo(0);
  }

  /**
   * Merges three paths (one that assigns x, one that deletes it, one that leaves it alone) in the
   * given order, and returns the resulting trace for x.
   */
  private Trace mergeThreePaths(int... order) {
    x = new Variable("x", Variable.Kind.LOCAL);
    root = newRoot();
    root.currentVersion(x);
    TraceCollection assigned = root.branch("assigned");
    TraceCollection deleted = root.branch("deleted");
    TraceCollection untouched = root.branch("untouched");
    assigned.onStatement(assign(x, 1));
    deleted.onStatement(del(x));
    ImmutableList<TraceCollection> paths = ImmutableList.of(assigned, deleted, untouched);
    ImmutableList.Builder<TraceCollection> ordered = ImmutableList.builder();
    for (int i : order) {
      ordered.add(paths.get(i));
    }
    root.mergeNBranches(ordered.build());
    return root.currentTrace(x);
  }

  @Test
  public void mergeIsOrderIndependent() {
    Trace forward = mergeThreePaths(0, 1, 2);
    Trace backward = mergeThreePaths(2, 1, 0);
    Trace shuffled = mergeThreePaths(1, 2, 0);
    for (Trace trace : ImmutableList.of(forward, backward, shuffled)) {
      assertThat(trace.isMerge()).isTrue();
      assertThat(trace.version).isEqualTo(3);
      assertThat(((Trace.Merge) trace).predecessorVersions()).containsExactly(0, 1, 2);
      assertThat(trace.mustHaveValue()).isFalse();
      assertThat(trace.mustNotHaveValue()).isFalse();
    }
  }

  @Test
  public void variableInactiveOnOnePathMergesWithEntryState() {
    root.currentVersion(p);
    TraceCollection a = root.branch("a");
    TraceCollection b = root.branch("b");
    a.onStatement(assign(y, 1));
    root.mergeNBranches(ImmutableList.of(a, b));
    Trace merged = root.currentTrace(y);
    assertThat(merged.isMerge()).isTrue();
    assertThat(((Trace.Merge) merged).predecessorVersions()).containsExactly(0, 1);
    assertThat(merged.mustHaveValue()).isFalse();
  }

  @Test
  public void oneSidedMergeUsesCurrentState() {
    root.currentVersion(x);
    TraceCollection a = root.branch("a");
    a.onStatement(assign(x, 1));
    root.mergeTwoBranches(a, null);
    Trace oneSided = root.currentTrace(x);

    x = new Variable("x", Variable.Kind.LOCAL);
    root = newRoot();
    root.currentVersion(x);
    TraceCollection b = root.branch("b");
    b.onStatement(assign(x, 1));
    root.mergeNBranches(ImmutableList.of(root, b));
    Trace withSelf = root.currentTrace(x);

    assertThat(oneSided.toString()).isEqualTo(withSelf.toString());
    assertThat(((Trace.Merge) oneSided).predecessorVersions()).containsExactly(0, 1);
    assertThat(root.isConsumed()).isFalse();
    assertThat(b.isConsumed()).isTrue();
  }

  @Test
  public void mergeWithNoBranchesIsNoOp() {
    root.onStatement(assign(x, 1));
    root.mergeTwoBranches(null, null);
    assertThat(root.currentVersion(x)).isEqualTo(1);
    assertThrows(IllegalArgumentException.class, () -> root.mergeNBranches(ImmutableList.of()));
  }

  @Test
  public void singleInputIsCopied() {
    root.currentVersion(x);
    TraceCollection a = root.branch("a");
    a.onStatement(assign(x, 1));
    int size = root.state().size();
    root.mergeNBranches(ImmutableList.of(a));
    assertThat(root.currentVersion(x)).isEqualTo(1);
    assertThat(root.state().size()).isEqualTo(size);
    assertThat(a.isConsumed()).isTrue();
  }

  @Test
  public void mergerNeedsTwoInputs() {
    BranchMerger merger = new BranchMerger();
    merger.start(root);
    merger.add(root.branch("a"));
    assertThrows(IllegalStateException.class, merger::finish);
  }

  @Test
  public void collectionsOfDifferentScopesCannotBeMerged() {
    TraceCollection other = newRoot();
    BranchMerger merger = new BranchMerger();
    merger.start(root);
    assertThrows(IllegalArgumentException.class, () -> merger.add(other));
  }
}
