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

import org.jspecify.annotations.Nullable;

/** {@code begin:end:stride} inside a subscript; every part is optional. */
public final class SliceExpr extends Expression {

  private final @Nullable Expression beginIndex;
  private final @Nullable Expression endIndex;
  private final @Nullable Expression stride;

  public SliceExpr(
      @Nullable Expression beginIndex, @Nullable Expression endIndex, @Nullable Expression stride) {
    this.beginIndex = beginIndex;
    this.endIndex = endIndex;
    this.stride = stride;
  }

  public @Nullable Expression getBeginIndex() {
    return beginIndex;
  }

  public @Nullable Expression getEndIndex() {
    return endIndex;
  }

  public @Nullable Expression getStride() {
    return stride;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitSliceExpr(this);
  }
}
