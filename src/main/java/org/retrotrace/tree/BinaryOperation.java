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

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;
import org.retrotrace.collect.TraceCollection;

/**
 * Applies a binary operator to two operands. If both operands compute to constants the operation
 * is folded, provided the result is representable.
 */
public class BinaryOperation extends Expression {

  /** The supported operators. */
  public enum Operator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    LT("<"),
    EQ("==");

    public final String symbol;

    Operator(String symbol) {
      this.symbol = symbol;
    }

    /** True if this operator is only defined on integers; equality is defined on all values. */
    boolean isArithmetic() {
      return this != EQ;
    }
  }

  private static final BigInteger MIN_LONG = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger MAX_LONG = BigInteger.valueOf(Long.MAX_VALUE);

  private final Operator operator;
  private Expression left;
  private Expression right;

  public BinaryOperation(
      SourcePosition position, Operator operator, Expression left, Expression right) {
    super(position);
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  @Override
  public Kind kind() {
    return Kind.BINARY_OPERATION;
  }

  public Operator operator() {
    return operator;
  }

  public Expression left() {
    return left;
  }

  public Expression right() {
    return right;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of(left, right);
  }

  /**
   * Only an operation that can be folded is known not to raise; comparisons and arithmetic on
   * operands of the wrong type raise at run time, as does overflow.
   */
  @Override
  public boolean mayHaveSideEffects() {
    if (left instanceof Constant l && right instanceof Constant r) {
      return fold(l, r) == null;
    }
    return operator.isArithmetic() || left.mayHaveSideEffects() || right.mayHaveSideEffects();
  }

  @Override
  public ComputeResult<Expression> computeExpression(TraceCollection collection) {
    left = collection.onExpression(left);
    right = collection.onExpression(right);
    if (left instanceof Constant l && right instanceof Constant r) {
      Constant folded = fold(l, r);
      if (folded != null) {
        return ComputeResult.replaced(
            folded,
            ChangeTag.NEW_CONSTANTS,
            String.format("Folded %s to constant %s.", this, folded));
      }
    }
    return ComputeResult.unchanged(this);
  }

  /** Returns the constant result of this operation, or null if it can't be computed here. */
  private @Nullable Constant fold(Constant l, Constant r) {
    if (operator == Operator.EQ) {
      return new Constant(position, l.sameValue(r));
    }
    if (!(l.isInteger() && r.isInteger())) {
      return null;
    }
    long x = (Long) l.value();
    long y = (Long) r.value();
    if (operator == Operator.LT) {
      return new Constant(position, x < y);
    }
    BigInteger a = BigInteger.valueOf(x);
    BigInteger b = BigInteger.valueOf(y);
    BigInteger result =
        switch (operator) {
          case ADD -> a.add(b);
          case SUB -> a.subtract(b);
          case MUL -> a.multiply(b);
          case LT, EQ -> throw new AssertionError(operator);
        };
    // Leave overflowing operations to be computed (and reported) at run time.
    if (result.compareTo(MIN_LONG) < 0 || result.compareTo(MAX_LONG) > 0) {
      return null;
    }
    return Constant.of(position, result.longValueExact());
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.symbol + " " + right + ")";
  }
}
