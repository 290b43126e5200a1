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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** {@code from ..id import a as b}; {@code relative} counts the leading dots. */
public final class ImportFrom extends ImportBase {

  private final String id;
  private final int relative;
  private final ImmutableList<ImportedName> names;

  public ImportFrom(String id, int relative, List<ImportedName> names) {
    this.id = checkNotNull(id);
    this.relative = relative;
    this.names = ImmutableList.copyOf(names);
  }

  public String getId() {
    return id;
  }

  public int getRelative() {
    return relative;
  }

  public ImmutableList<ImportedName> getNames() {
    return names;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitImportFrom(this);
  }
}
