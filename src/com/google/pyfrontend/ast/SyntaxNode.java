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

/**
 * Base class for every semantic tree element that carries a source position.
 *
 * <p>Lines are one-indexed and columns zero-indexed, matching the raw tree they were converted
 * from. A value of -1 means unknown.
 */
public abstract class SyntaxNode {

  private int line = -1;
  private int column = -1;

  public final int getLine() {
    return line;
  }

  public final int getColumn() {
    return column;
  }

  /** Sets the line, leaving the column unchanged. */
  public void setLine(int line) {
    this.line = line;
  }

  public final void setLine(int line, int column) {
    setLine(line);
    this.column = column;
  }

  /** Copies the position of another node. */
  public final void setLine(SyntaxNode other) {
    setLine(other.line, other.column);
  }
}
