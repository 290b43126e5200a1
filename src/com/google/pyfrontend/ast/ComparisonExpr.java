/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.pyfrontend.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A comparison chain such as {@code a < b <= c}; there is one operator between each operand. */
public final class ComparisonExpr extends Expression {

  private final ImmutableList<String> operators;
  private final ImmutableList<Expression> operands;

  public ComparisonExpr(List<String> operators, List<Expression> operands) {
    checkArgument(
        !operators.isEmpty() && operators.size() == operands.size() - 1,
        "%s operators for %s operands",
        operators.size(),
        operands.size());
    this.operators = ImmutableList.copyOf(operators);
    this.operands = ImmutableList.copyOf(operands);
  }

  public ImmutableList<String> getOperators() {
    return operators;
  }

  public ImmutableList<Expression> getOperands() {
    return operands;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitComparisonExpr(this);
  }
}
