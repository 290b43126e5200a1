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

package com.google.pyfrontend.types;

/**
 * Base class of the unanalyzed type values produced while converting annotations and type
 * comments. These are purely syntactic: names are not resolved and no type checking is implied.
 */
public abstract class Type {

  private int line;
  private int column;

  protected Type(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** One-indexed line of the annotation or comment this type came from, or -1. */
  public final int getLine() {
    return line;
  }

  /** Zero-indexed column, or -1 when only the line is known. */
  public final int getColumn() {
    return column;
  }

  public final void setLine(int line) {
    this.line = line;
  }

  public final void setColumn(int column) {
    this.column = column;
  }

  /** Renders the type the way diagnostics and tree dumps show it. */
  @Override
  public abstract String toString();
}
