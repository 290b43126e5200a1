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

/**
 * An expression known only by its type. Used as the right-hand side of an annotated assignment
 * that has no value, such as {@code x: int}.
 */
public final class TempNode extends Expression {

  private final Type type;
  private final boolean noRhs;

  public TempNode(Type type, boolean noRhs) {
    this.type = checkNotNull(type);
    this.noRhs = noRhs;
  }

  public Type getType() {
    return type;
  }

  public boolean hasNoRhs() {
    return noRhs;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitTempNode(this);
  }
}
