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

package com.google.pyfrontend.convert;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.pyfrontend.ast.SyntaxNode;
import com.google.pyfrontend.rawtree.RawNode;

/** Copies source positions from raw nodes onto the semantic nodes made from them. */
final class SourcePositions {

  private SourcePositions() {}

  @CanIgnoreReturnValue
  static <T extends SyntaxNode> T tag(T node, RawNode raw) {
    node.setLine(raw.getLineno(), raw.getCharno());
    return node;
  }

  @CanIgnoreReturnValue
  static <T extends SyntaxNode> T tag(T node, SyntaxNode other) {
    node.setLine(other);
    return node;
  }
}
