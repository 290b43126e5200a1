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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A try statement. Each handler is described by three parallel entries: the bound name (null
 * without {@code as}), the exception type expression (null for a bare {@code except:}) and the
 * handler body.
 */
public final class TryStmt extends Statement {

  private final Block body;
  private final List<@Nullable NameExpr> vars;
  private final List<@Nullable Expression> types;
  private final ImmutableList<Block> handlers;
  private final @Nullable Block elseBody;
  private final @Nullable Block finallyBody;

  public TryStmt(
      Block body,
      List<@Nullable NameExpr> vars,
      List<@Nullable Expression> types,
      List<Block> handlers,
      @Nullable Block elseBody,
      @Nullable Block finallyBody) {
    checkArgument(
        vars.size() == types.size() && types.size() == handlers.size(),
        "handler lists differ in length");
    this.body = checkNotNull(body);
    this.vars = Collections.unmodifiableList(new ArrayList<>(vars));
    this.types = Collections.unmodifiableList(new ArrayList<>(types));
    this.handlers = ImmutableList.copyOf(handlers);
    this.elseBody = elseBody;
    this.finallyBody = finallyBody;
  }

  public Block getBody() {
    return body;
  }

  public List<@Nullable NameExpr> getVars() {
    return vars;
  }

  public List<@Nullable Expression> getTypes() {
    return types;
  }

  public ImmutableList<Block> getHandlers() {
    return handlers;
  }

  public @Nullable Block getElseBody() {
    return elseBody;
  }

  public @Nullable Block getFinallyBody() {
    return finallyBody;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitTryStmt(this);
  }
}
