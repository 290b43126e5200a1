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
 * A call. Arguments are flattened into three parallel lists: the value, how it is passed (one of
 * {@link ArgKind#POSITIONAL}, {@link ArgKind#STAR}, {@link ArgKind#NAMED}, {@link ArgKind#STAR2})
 * and, for named arguments only, the keyword.
 */
public final class CallExpr extends Expression {

  private final Expression callee;
  private final ImmutableList<Expression> args;
  private final ImmutableList<ArgKind> argKinds;
  private final List<@Nullable String> argNames;

  public CallExpr(
      Expression callee,
      List<Expression> args,
      List<ArgKind> argKinds,
      List<@Nullable String> argNames) {
    checkArgument(
        args.size() == argKinds.size() && argKinds.size() == argNames.size(),
        "call argument lists differ in length");
    this.callee = checkNotNull(callee);
    this.args = ImmutableList.copyOf(args);
    this.argKinds = ImmutableList.copyOf(argKinds);
    this.argNames = Collections.unmodifiableList(new ArrayList<>(argNames));
  }

  public Expression getCallee() {
    return callee;
  }

  public ImmutableList<Expression> getArgs() {
    return args;
  }

  public ImmutableList<ArgKind> getArgKinds() {
    return argKinds;
  }

  public List<@Nullable String> getArgNames() {
    return argNames;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitCallExpr(this);
  }
}
