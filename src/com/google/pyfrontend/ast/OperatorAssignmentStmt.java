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

/** Augmented assignment such as {@code x += 1}; the operator is stored without the '='. */
public final class OperatorAssignmentStmt extends Statement {

  private final String op;
  private final Expression lvalue;
  private final Expression rvalue;

  public OperatorAssignmentStmt(String op, Expression lvalue, Expression rvalue) {
    this.op = checkNotNull(op);
    this.lvalue = checkNotNull(lvalue);
    this.rvalue = checkNotNull(rvalue);
  }

  public String getOp() {
    return op;
  }

  public Expression getLvalue() {
    return lvalue;
  }

  public Expression getRvalue() {
    return rvalue;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitOperatorAssignmentStmt(this);
  }
}
