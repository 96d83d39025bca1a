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

package org.retrotrace;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.retrotrace.TestTrees.assign;
import static org.retrotrace.TestTrees.breakLoop;
import static org.retrotrace.TestTrees.call;
import static org.retrotrace.TestTrees.constant;
import static org.retrotrace.TestTrees.continueLoop;
import static org.retrotrace.TestTrees.loop;
import static org.retrotrace.TestTrees.pos;
import static org.retrotrace.TestTrees.ref;
import static org.retrotrace.TestTrees.seq;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.retrotrace.trace.Trace;
import org.retrotrace.trace.Variable;
import org.retrotrace.tree.ConditionalStatement;
import org.retrotrace.tree.ExpressionStatement;
import org.retrotrace.tree.ReturnStatement;
import org.retrotrace.tree.StatementSequence;

@RunWith(JUnit4.class)
public class OptimizationPassTest {
  final Variable x = new Variable("x", Variable.Kind.LOCAL);
  final Variable p = new Variable("p", Variable.Kind.PARAMETER);

  @Test
  public void passesReachFixedPoint() {
    // x = 1; x; loop: f(); continue
    StatementSequence body =
        seq(
            assign(x, 1),
            new ExpressionStatement(pos(), ref(x)),
            loop(call(), continueLoop()));
    OptimizationPass pass = new OptimizationPass();

    OptimizationPass.Result first = pass.run(body);
    // The read of x becomes a constant, which makes its statement useless; the continue is
    // removed from the loop.
    assertThat(first.changeCount()).isEqualTo(3);
    assertThat(first.body().size()).isEqualTo(2);

    OptimizationPass.Result second = pass.run(first.body());
    assertThat(second.changeCount()).isEqualTo(0);
    assertThat(second.body()).isSameInstanceAs(first.body());
  }

  @Test
  public void everythingRemoved() {
    OptimizationPass.Result result =
        new OptimizationPass().run(seq(new ExpressionStatement(pos(), constant(1))));
    assertThat(result.body()).isNull();
    assertThat(result.changeCount()).isEqualTo(1);
  }

  @Test
  public void functionExitState() {
    // if p: return
    // x = 1
    StatementSequence body =
        seq(
            new ConditionalStatement(pos(), ref(p), seq(new ReturnStatement(pos(), null)), null),
            assign(x, 1));
    OptimizationPass.Result result = new OptimizationPass().runFunction("f", body);
    assertThat(result.changeCount()).isEqualTo(0);
    assertThat(result.collection().name()).isEqualTo("function f");
    Trace exit = result.collection().currentTrace(x);
    assertThat(exit.isMerge()).isTrue();
    assertThat(((Trace.Merge) exit).predecessorVersions()).containsExactly(0, 1);
  }

  @Test
  public void traceDumpsCanBeEnabled() {
    OptimizerOptions options = OptimizerOptions.builder().setLogTraceDumps(true).build();
    OptimizationPass.Result result =
        new OptimizationPass(options).run(seq(assign(x, 1), call(ref(x))));
    assertThat(result.changeCount()).isEqualTo(1);
  }

  @Test
  public void failureAbandonsPass() {
    OptimizationPass pass = new OptimizationPass();
    OptimizationError e =
        assertThrows(OptimizationError.class, () -> pass.run(seq(call(), breakLoop())));
    assertThat(e).hasMessageThat().contains("loop break outside of an enclosing loop");
  }
}
