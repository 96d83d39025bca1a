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

import com.google.common.base.Ascii;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings that control how conservatively the optimizer treats variables. Instances are immutable;
 * use {@link #builder} or {@link #fromProperties} to create them.
 *
 * <p>Defaults are read from the classpath resource {@code retrotrace.properties} if it exists.
 */
public final class OptimizerOptions {
  /**
   * If true, an escape event (e.g. a call) makes every active variable unknown; if false, only
   * module variables and variables shared with a nested closure.
   */
  public static final String ESCAPE_ALL_LOCALS = "retrotrace.escape-all-locals";

  /** If true, references to a variable last assigned a constant are replaced by that constant. */
  public static final String PROPAGATE_CONSTANTS = "retrotrace.propagate-constants";

  /** If true, the trace table and active map are logged at TRACE level after each pass. */
  public static final String LOG_TRACE_DUMPS = "retrotrace.log-trace-dumps";

  private static final String DEFAULTS_RESOURCE = "/retrotrace.properties";

  public final boolean escapeAllLocals;
  public final boolean propagateConstants;
  public final boolean logTraceDumps;

  private OptimizerOptions(Builder builder) {
    this.escapeAllLocals = builder.escapeAllLocals;
    this.propagateConstants = builder.propagateConstants;
    this.logTraceDumps = builder.logTraceDumps;
  }

  /** Returns the options specified by {@code retrotrace.properties}. */
  public static OptimizerOptions defaults() {
    return DefaultsHolder.DEFAULTS;
  }

  /** Returns a Builder initialized from {@link #defaults}. */
  public static Builder builder() {
    return defaults().toBuilder();
  }

  /**
   * Returns options with each key present in {@code properties} overriding the corresponding
   * default.
   *
   * @throws IllegalArgumentException if a value is not a valid boolean
   */
  public static OptimizerOptions fromProperties(Properties properties) {
    return builder().setFrom(properties).build();
  }

  public Builder toBuilder() {
    Builder result = new Builder();
    result.escapeAllLocals = escapeAllLocals;
    result.propagateConstants = propagateConstants;
    result.logTraceDumps = logTraceDumps;
    return result;
  }

  @Override
  public String toString() {
    return String.format(
        "%s=%s, %s=%s, %s=%s",
        ESCAPE_ALL_LOCALS,
        escapeAllLocals,
        PROPAGATE_CONSTANTS,
        propagateConstants,
        LOG_TRACE_DUMPS,
        logTraceDumps);
  }

  /** A mutable builder for OptimizerOptions. */
  public static final class Builder {
    private boolean escapeAllLocals = false;
    private boolean propagateConstants = true;
    private boolean logTraceDumps = false;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setEscapeAllLocals(boolean escapeAllLocals) {
      this.escapeAllLocals = escapeAllLocals;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPropagateConstants(boolean propagateConstants) {
      this.propagateConstants = propagateConstants;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLogTraceDumps(boolean logTraceDumps) {
      this.logTraceDumps = logTraceDumps;
      return this;
    }

    /** Overrides each setting whose key is present in {@code properties}. */
    @CanIgnoreReturnValue
    public Builder setFrom(Properties properties) {
      String value = properties.getProperty(ESCAPE_ALL_LOCALS);
      if (value != null) {
        escapeAllLocals = parseBoolean(ESCAPE_ALL_LOCALS, value);
      }
      value = properties.getProperty(PROPAGATE_CONSTANTS);
      if (value != null) {
        propagateConstants = parseBoolean(PROPAGATE_CONSTANTS, value);
      }
      value = properties.getProperty(LOG_TRACE_DUMPS);
      if (value != null) {
        logTraceDumps = parseBoolean(LOG_TRACE_DUMPS, value);
      }
      return this;
    }

    public OptimizerOptions build() {
      return new OptimizerOptions(this);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    String normalized = Ascii.toLowerCase(value.trim());
    if (normalized.equals("true")) {
      return true;
    } else if (normalized.equals("false")) {
      return false;
    }
    throw new IllegalArgumentException(
        String.format("Invalid value for %s: \"%s\" (expected true or false)", key, value));
  }

  /** Loads the defaults on first use. */
  private static class DefaultsHolder {
    static final OptimizerOptions DEFAULTS = load();

    private static OptimizerOptions load() {
      Properties properties = new Properties();
      try (InputStream in = OptimizerOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
        if (in != null) {
          properties.load(in);
        }
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
      }
      return new Builder().setFrom(properties).build();
    }
  }
}
