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
import com.google.pyfrontend.types.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * {@code with a as x, b: body}. Context expressions and targets are parallel; a target is null
 * when the item has no {@code as} clause.
 */
public final class WithStmt extends Statement {

  private final ImmutableList<Expression> expr;
  private final List<@Nullable Expression> target;
  private final Block body;
  private final @Nullable Type targetType;
  private boolean isAsync;

  public WithStmt(
      List<Expression> expr,
      List<@Nullable Expression> target,
      Block body,
      @Nullable Type targetType) {
    checkArgument(expr.size() == target.size(), "context expressions and targets differ");
    this.expr = ImmutableList.copyOf(expr);
    this.target = Collections.unmodifiableList(new ArrayList<>(target));
    this.body = checkNotNull(body);
    this.targetType = targetType;
  }

  public ImmutableList<Expression> getExpr() {
    return expr;
  }

  public List<@Nullable Expression> getTarget() {
    return target;
  }

  public Block getBody() {
    return body;
  }

  public @Nullable Type getTargetType() {
    return targetType;
  }

  public boolean isAsync() {
    return isAsync;
  }

  public void setAsync(boolean isAsync) {
    this.isAsync = isAsync;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitWithStmt(this);
  }
}
