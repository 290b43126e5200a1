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
import org.jspecify.annotations.Nullable;

/** An if statement. Conditions and bodies are parallel; elif chains nest in the else body. */
public final class IfStmt extends Statement {

  private final ImmutableList<Expression> expr;
  private final ImmutableList<Block> body;
  private final @Nullable Block elseBody;

  public IfStmt(List<Expression> expr, List<Block> body, @Nullable Block elseBody) {
    checkArgument(expr.size() == body.size(), "conditions and bodies differ in length");
    this.expr = ImmutableList.copyOf(expr);
    this.body = ImmutableList.copyOf(body);
    this.elseBody = elseBody;
  }

  public ImmutableList<Expression> getExpr() {
    return expr;
  }

  public ImmutableList<Block> getBody() {
    return body;
  }

  public @Nullable Block getElseBody() {
    return elseBody;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitIfStmt(this);
  }
}
