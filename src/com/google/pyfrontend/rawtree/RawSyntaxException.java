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

package com.google.pyfrontend.rawtree;

/**
 * Signals that source text, or a type comment, is not grammatical. Thrown by the upstream parser
 * and by {@link FragmentParser}.
 */
public class RawSyntaxException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int lineno;
  private final int offset;

  /**
   * @param message the parser's description, such as "invalid syntax"
   * @param lineno one-indexed line of the failure
   * @param offset one-indexed column of the failure, or -1
   */
  public RawSyntaxException(String message, int lineno, int offset) {
    super(message);
    this.lineno = lineno;
    this.offset = offset;
  }

  public int getLineno() {
    return lineno;
  }

  public int getOffset() {
    return offset;
  }
}
