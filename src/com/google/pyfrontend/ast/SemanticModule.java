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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The converted form of one source file.
 *
 * <p>{@link #getImports()} lists every import statement of the file, wherever it is nested. The
 * path and the stub flag are stamped on by the parser after a successful conversion.
 */
public final class SemanticModule extends SyntaxNode {

  private final ImmutableList<Statement> defs;
  private final ImmutableList<ImportBase> imports;
  private final ImmutableSet<Integer> ignoredLines;
  private @Nullable String path;
  private boolean isStub;

  public SemanticModule(
      List<? extends Statement> defs,
      List<? extends ImportBase> imports,
      Set<Integer> ignoredLines) {
    this.defs = ImmutableList.copyOf(defs);
    this.imports = ImmutableList.copyOf(imports);
    this.ignoredLines = ImmutableSet.copyOf(ignoredLines);
    setLine(1);
  }

  /** An empty module, as produced when the source could not be parsed at all. */
  public static SemanticModule empty() {
    return new SemanticModule(ImmutableList.of(), ImmutableList.of(), ImmutableSet.of());
  }

  public ImmutableList<Statement> getDefs() {
    return defs;
  }

  public ImmutableList<ImportBase> getImports() {
    return imports;
  }

  /** Lines carrying a {@code # type: ignore} marker; diagnostics on them are suppressed. */
  public ImmutableSet<Integer> getIgnoredLines() {
    return ignoredLines;
  }

  public @Nullable String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public boolean isStub() {
    return isStub;
  }

  public void setStub(boolean isStub) {
    this.isStub = isStub;
  }
}
