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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.TraceCollection;

/**
 * A literal value. The supported values are Long, Boolean, String, and null (the "none" value).
 */
public class Constant extends Expression {
  private final @Nullable Object value;

  public Constant(SourcePosition position, @Nullable Object value) {
    super(position);
    Preconditions.checkArgument(
        value == null
            || value instanceof Long
            || value instanceof Boolean
            || value instanceof String,
        "unsupported constant %s",
        value);
    this.value = value;
  }

  public static Constant of(SourcePosition position, long value) {
    return new Constant(position, value);
  }

  @Override
  public Kind kind() {
    return Kind.CONSTANT;
  }

  public @Nullable Object value() {
    return value;
  }

  /** Returns true if this constant is a Long. */
  public boolean isInteger() {
    return value instanceof Long;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public boolean mayHaveSideEffects() {
    return false;
  }

  @Override
  public Boolean truthValue() {
    if (value == null) {
      return false;
    } else if (value instanceof Boolean b) {
      return b.booleanValue();
    } else if (value instanceof Long n) {
      return n != 0;
    } else {
      return !((String) value).isEmpty();
    }
  }

  /** Returns true if {@code other} is a Constant with an equal value. */
  public boolean sameValue(Constant other) {
    return Objects.equals(value, other.value);
  }

  @Override
  public ComputeResult<Expression> computeExpression(TraceCollection collection) {
    return ComputeResult.unchanged(this);
  }

  @Override
  public String toString() {
    if (value == null) {
      return "None";
    } else if (value instanceof String s) {
      return "\"" + s + "\"";
    }
    return value.toString();
  }
}
