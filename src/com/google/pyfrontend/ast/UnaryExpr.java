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

import static com.google.common.base.Preconditions.checkNotNull;

/** {@code -x}, {@code +x}, {@code ~x} or {@code not x}. */
public final class UnaryExpr extends Expression {

  private final String op;
  private final Expression expr;

  public UnaryExpr(String op, Expression expr) {
    this.op = checkNotNull(op);
    this.expr = checkNotNull(expr);
  }

  public String getOp() {
    return op;
  }

  public Expression getExpr() {
    return expr;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitUnaryExpr(this);
  }
}
