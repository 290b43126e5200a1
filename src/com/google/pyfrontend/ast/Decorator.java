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

/**
 * A function together with its decorator expressions, outermost first. {@link #getVar()} is the
 * name the decorated value ends up bound to.
 */
public final class Decorator extends Statement implements OverloadPart {

  private final FuncDef func;
  private final ImmutableList<Expression> decorators;
  private final Var var;

  public Decorator(FuncDef func, List<Expression> decorators, Var var) {
    checkArgument(!decorators.isEmpty(), "decorator without decorator expressions");
    this.func = checkNotNull(func);
    this.decorators = ImmutableList.copyOf(decorators);
    this.var = checkNotNull(var);
  }

  @Override
  public String getName() {
    return func.getName();
  }

  public FuncDef getFunc() {
    return func;
  }

  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public Var getVar() {
    return var;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitDecorator(this);
  }
}
