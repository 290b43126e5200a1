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

/**
 * A bytes literal. The value is the escaped source form without the {@code b'...'} wrapper, so
 * {@code b'a\n'} is stored as the four characters {@code a\n}.
 */
public final class BytesExpr extends Expression {

  private final String value;

  public BytesExpr(String value) {
    this.value = checkNotNull(value);
  }

  public String getValue() {
    return value;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitBytesExpr(this);
  }
}
