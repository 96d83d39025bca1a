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

import static com.google.common.truth.Truth.assertThat;
import static org.retrotrace.TestTrees.assign;
import static org.retrotrace.TestTrees.breakLoop;
import static org.retrotrace.TestTrees.call;
import static org.retrotrace.TestTrees.continueLoop;
import static org.retrotrace.TestTrees.loop;
import static org.retrotrace.TestTrees.pos;
import static org.retrotrace.TestTrees.ref;
import static org.retrotrace.TestTrees.seq;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.retrotrace.OptimizerOptions;
import org.retrotrace.RecordingNotifier;
import org.retrotrace.collect.AnalysisState;
import org.retrotrace.collect.TraceCollection;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;

@RunWith(JUnit4.class)
public class LoopStatementTest {
  final RecordingNotifier notifier = new RecordingNotifier();
  final TraceCollection root =
      TraceCollection.forFunction(
          "f", new AnalysisState(OptimizerOptions.defaults(), notifier));
  final Variable x = new Variable("x", Variable.Kind.LOCAL);
  final Variable p = new Variable("p", Variable.Kind.PARAMETER);

  /** Returns {@code if p: break}. */
  ConditionalStatement breakIfP() {
    return new ConditionalStatement(pos(), ref(p), seq(breakLoop()), null);
  }

  @Test
  public void terminalContinueRemoved() {
    ExpressionStatement body = call();
    ContinueLoop tail = continueLoop();
    LoopStatement loop = loop(body, tail);
    assertThat(root.onStatement(loop)).isSameInstanceAs(loop);
    assertThat(loop.body().statements()).containsExactly(body);
    assertThat(notifier.changes()).hasSize(1);
    assertThat(notifier.changes().get(0).tag).isEqualTo(ChangeTag.NEW_STATEMENTS);
    assertThat(notifier.changes().get(0).position).isEqualTo(tail.position);
    assertThat(notifier.messages())
        .containsExactly("Removed useless terminal 'continue' as last statement of loop.");
  }

  @Test
  public void loopOfOnlyContinueKeepsNoBody() {
    LoopStatement loop = loop(continueLoop());
    assertThat(root.onStatement(loop)).isSameInstanceAs(loop);
    assertThat(loop.body()).isNull();
    assertThat(loop.isAborting()).isTrue();
    assertThat(loop.mayReturn()).isFalse();
    assertThat(notifier.count()).isEqualTo(1);
  }

  @Test
  public void immediateBreakRemovesLoop() {
    root.onStatement(assign(x, 1));
    assertThat(root.onStatement(loop(breakLoop()))).isNull();
    assertThat(notifier.messages())
        .containsExactly("Removed useless loop with immediate 'break' statement.");
    // Nothing is written in the loop, so the break carries out the state from before it.
    assertThat(root.currentTrace(x).isAssign()).isTrue();
  }

  @Test
  public void breaksAreMergedAfterLoop() {
    // x = 0; loop: (if p: break); x = 1; (if p: break)
    root.onStatement(assign(x, 0));
    int before = root.currentVersion(x);
    LoopStatement loop = loop(breakIfP(), assign(x, 1), breakIfP());
    assertThat(root.onStatement(loop)).isSameInstanceAs(loop);

    Trace after = root.currentTrace(x);
    assertThat(after.isMerge()).isTrue();
    Trace.Merge merge = (Trace.Merge) after;
    assertThat(merge.predecessors()).hasSize(2);
    Trace degraded = merge.predecessors().stream().filter(Trace::isUnknown).findFirst().get();
    Trace assigned = merge.predecessors().stream().filter(Trace::isAssign).findFirst().get();
    // The first break sees the loop-carried value, which may be the one from before the loop.
    assertThat(degraded.previous().version).isEqualTo(before);
    assertThat(assigned.previous()).isSameInstanceAs(degraded);
    assertThat(root.currentVersion(p)).isEqualTo(0);
    assertThat(loop.isAborting()).isFalse();
    assertThat(notifier.count()).isEqualTo(0);
  }

  @Test
  public void singleBreakCarriesItsState() {
    LoopStatement loop = loop(assign(x, 1), breakLoop());
    assertThat(root.onStatement(loop)).isSameInstanceAs(loop);
    Trace after = root.currentTrace(x);
    assertThat(after.isAssign()).isTrue();
    assertThat(after.previous().isUnknown()).isTrue();
  }

  @Test
  public void loopWithoutBreakIsAborting() {
    LoopStatement loop = loop(call(), assign(x, 1));
    StatementSequence body = seq(loop, assign(x, 2));
    assertThat(body.computeStatementsSequence(root).statements()).containsExactly(loop);
    assertThat(notifier.messages()).containsExactly("Removed dead statements.");
  }

  @Test
  public void exitFlags() {
    LoopStatement loop = loop(breakIfP(), new ReturnStatement(pos(), null));
    assertThat(loop.isAborting()).isFalse();
    assertThat(loop.mayBreak()).isFalse();
    assertThat(loop.mayContinue()).isFalse();
    assertThat(loop.mayReturn()).isTrue();

    LoopStatement forever = loop(call());
    assertThat(forever.isAborting()).isTrue();
    assertThat(forever.mayReturn()).isFalse();
  }

  @Test
  public void innerBreaksStayInInnerLoop() {
    // loop: (loop: (if p: break); f()); break
    LoopStatement inner = loop(breakIfP(), call());
    LoopStatement outer = loop(inner, breakLoop());
    assertThat(root.onStatement(outer)).isSameInstanceAs(outer);
    assertThat(inner.isAborting()).isFalse();
    assertThat(outer.body().size()).isEqualTo(2);
  }

  @Test
  public void returnInLoopReachesFunctionExit() {
    // loop: (if p: x = 1; return); f()
    ConditionalStatement returnIfP =
        new ConditionalStatement(
            pos(), ref(p), seq(assign(x, 1), new ReturnStatement(pos(), null)), null);
    root.computeFunctionBody(seq(loop(returnIfP, call())));
    assertThat(root.currentTrace(x).isAssign()).isTrue();
  }
}
