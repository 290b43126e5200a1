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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A lambda. Its body is a block holding exactly one return statement. */
public final class LambdaExpr extends Expression implements FuncItem {

  private final ImmutableList<Argument> arguments;
  private final Block body;

  public LambdaExpr(List<Argument> arguments, Block body) {
    checkArgument(
        body.getBody().size() == 1 && body.getBody().get(0) instanceof ReturnStmt,
        "lambda body must be a single return");
    this.arguments = ImmutableList.copyOf(arguments);
    this.body = checkNotNull(body);
  }

  @Override
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  @Override
  public Block getBody() {
    return body;
  }

  /** The expression the lambda evaluates to. */
  public Expression getExpr() {
    return checkNotNull(((ReturnStmt) body.getBody().get(0)).getExpr());
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitLambdaExpr(this);
  }
}
