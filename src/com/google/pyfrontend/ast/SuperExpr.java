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

/** {@code super(...).name}, kept apart from plain member access. */
public final class SuperExpr extends Expression {

  private final String name;
  private final CallExpr call;

  public SuperExpr(String name, CallExpr call) {
    this.name = checkNotNull(name);
    this.call = checkNotNull(call);
  }

  public String getName() {
    return name;
  }

  /** The {@code super(...)} call itself. */
  public CallExpr getCall() {
    return call;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitSuperExpr(this);
  }
}
