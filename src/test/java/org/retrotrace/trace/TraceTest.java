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

package org.retrotrace.trace;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.retrotrace.TestTrees.assign;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TraceTest {
  final Variable x = new Variable("x", Variable.Kind.LOCAL);
  final Variable y = new Variable("y", Variable.Kind.LOCAL);

  @Test
  public void entryTraces() {
    Trace uninit = new Trace.Uninit(x, 0, null);
    assertThat(uninit.mustNotHaveValue()).isTrue();
    assertThat(uninit.mustHaveValue()).isFalse();
    assertThat(uninit.previous()).isNull();
    assertThat(uninit.toString()).isEqualTo("x#0 uninit");

    Trace init = new Trace.Init(x, 0);
    assertThat(init.mustHaveValue()).isTrue();
    assertThat(init.isInit()).isTrue();

    Trace unknown = new Trace.Unknown(x, 0, null);
    assertThat(unknown.mustHaveValue()).isFalse();
    assertThat(unknown.mustNotHaveValue()).isFalse();
  }

  @Test
  public void assignRecordsPrevious() {
    Trace entry = new Trace.Uninit(x, 0, null);
    Trace.Assign assign = new Trace.Assign(x, 1, assign(x, 1), entry);
    assertThat(assign.previous()).isSameInstanceAs(entry);
    assertThat(assign.mustHaveValue()).isTrue();
    assertThat(assign.toString()).isEqualTo("x#1 assign (after x#0)");
  }

  @Test
  public void assignPreviousMustBeSameVariable() {
    Trace other = new Trace.Uninit(y, 0, null);
    assertThrows(
        IllegalArgumentException.class, () -> new Trace.Assign(x, 1, assign(x, 1), other));
  }

  @Test
  public void mergeCombinesPredecessors() {
    Trace init = new Trace.Init(x, 0);
    Trace.Assign assign = new Trace.Assign(x, 1, assign(x, 1), init);
    Trace.Merge bound = new Trace.Merge(x, 2, ImmutableSet.of(assign, init));
    assertThat(bound.mustHaveValue()).isTrue();
    assertThat(bound.predecessorVersions()).containsExactly(0, 1);
    assertThat(bound.previous()).isNull();
    assertThat(bound.toString()).isEqualTo("x#2 merge of {x#0, x#1}");

    Trace deleted = new Trace.Uninit(x, 3, assign);
    Trace.Merge maybeBound = new Trace.Merge(x, 4, ImmutableSet.of(deleted, assign));
    assertThat(maybeBound.mustHaveValue()).isFalse();
    assertThat(maybeBound.mustNotHaveValue()).isFalse();
  }

  @Test
  public void mergeNeedsTwoPredecessors() {
    Trace init = new Trace.Init(x, 0);
    assertThrows(
        IllegalArgumentException.class, () -> new Trace.Merge(x, 1, ImmutableSet.of(init)));
  }

  @Test
  public void annotations() {
    Trace trace = new Trace.Uninit(x, 0, null);
    assertThat(trace.dump()).isEqualTo("x#0 uninit");
    trace.addUsage();
    trace.addUsage();
    trace.addRelease();
    trace.markEscaped();
    assertThat(trace.usageCount()).isEqualTo(2);
    assertThat(trace.isReleased()).isTrue();
    assertThat(trace.hasEscaped()).isTrue();
    assertThat(trace.dump()).isEqualTo("x#0 uninit usages=2 released escaped");
  }

  @Test
  public void negativeVersionRejected() {
    assertThrows(IllegalArgumentException.class, () -> new Trace.Init(x, -1));
  }
}
