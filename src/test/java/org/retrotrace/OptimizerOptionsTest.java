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

import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptimizerOptionsTest {

  @Test
  public void defaultsFromResource() {
    OptimizerOptions options = OptimizerOptions.defaults();
    assertThat(options.escapeAllLocals).isFalse();
    assertThat(options.propagateConstants).isTrue();
    assertThat(options.logTraceDumps).isFalse();
    assertThat(OptimizerOptions.defaults()).isSameInstanceAs(options);
  }

  @Test
  public void propertiesOverrideDefaults() {
    Properties properties = new Properties();
    properties.setProperty(OptimizerOptions.ESCAPE_ALL_LOCALS, " TRUE ");
    properties.setProperty(OptimizerOptions.PROPAGATE_CONSTANTS, "false");
    properties.setProperty("retrotrace.unrelated", "whatever");
    OptimizerOptions options = OptimizerOptions.fromProperties(properties);
    assertThat(options.escapeAllLocals).isTrue();
    assertThat(options.propagateConstants).isFalse();
    assertThat(options.logTraceDumps).isFalse();
  }

  @Test
  public void invalidValueRejected() {
    Properties properties = new Properties();
    properties.setProperty(OptimizerOptions.LOG_TRACE_DUMPS, "yes");
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> OptimizerOptions.fromProperties(properties));
    assertThat(e).hasMessageThat().contains(OptimizerOptions.LOG_TRACE_DUMPS);
  }

  @Test
  public void toBuilderCopiesSettings() {
    OptimizerOptions options =
        OptimizerOptions.builder().setEscapeAllLocals(true).setLogTraceDumps(true).build();
    OptimizerOptions copy = options.toBuilder().setPropagateConstants(false).build();
    assertThat(copy.escapeAllLocals).isTrue();
    assertThat(copy.logTraceDumps).isTrue();
    assertThat(copy.propagateConstants).isFalse();
    assertThat(options.propagateConstants).isTrue();
  }
}
