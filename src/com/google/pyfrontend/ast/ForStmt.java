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

import com.google.pyfrontend.types.Type;
import org.jspecify.annotations.Nullable;

/**
 * {@code for index in expr: body else: elseBody}. The async form shares this node with {@link
 * #isAsync()} set.
 */
public final class ForStmt extends Statement {

  private final Expression index;
  private final Expression expr;
  private final Block body;
  private final @Nullable Block elseBody;
  private final @Nullable Type indexType;
  private boolean isAsync;

  public ForStmt(
      Expression index,
      Expression expr,
      Block body,
      @Nullable Block elseBody,
      @Nullable Type indexType) {
    this.index = checkNotNull(index);
    this.expr = checkNotNull(expr);
    this.body = checkNotNull(body);
    this.elseBody = elseBody;
    this.indexType = indexType;
  }

  public Expression getIndex() {
    return index;
  }

  public Expression getExpr() {
    return expr;
  }

  public Block getBody() {
    return body;
  }

  public @Nullable Block getElseBody() {
    return elseBody;
  }

  /** The type declared by a type comment on the {@code for} line. */
  public @Nullable Type getIndexType() {
    return indexType;
  }

  public boolean isAsync() {
    return isAsync;
  }

  public void setAsync(boolean isAsync) {
    this.isAsync = isAsync;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitForStmt(this);
  }
}
