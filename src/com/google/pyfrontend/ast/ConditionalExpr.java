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

/** {@code ifExpr if cond else elseExpr}. */
public final class ConditionalExpr extends Expression {

  private final Expression cond;
  private final Expression ifExpr;
  private final Expression elseExpr;

  public ConditionalExpr(Expression cond, Expression ifExpr, Expression elseExpr) {
    this.cond = checkNotNull(cond);
    this.ifExpr = checkNotNull(ifExpr);
    this.elseExpr = checkNotNull(elseExpr);
  }

  public Expression getCond() {
    return cond;
  }

  public Expression getIfExpr() {
    return ifExpr;
  }

  public Expression getElseExpr() {
    return elseExpr;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitConditionalExpr(this);
  }
}
