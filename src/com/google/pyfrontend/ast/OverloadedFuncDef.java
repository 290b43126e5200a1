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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Two or more consecutive definitions of the same name, in source order. */
public final class OverloadedFuncDef extends Statement {

  private final ImmutableList<OverloadPart> items;

  public OverloadedFuncDef(List<OverloadPart> items) {
    checkArgument(items.size() >= 2, "an overload group needs at least two items");
    this.items = ImmutableList.copyOf(items);
    setLine(items.get(0).getLine());
  }

  public ImmutableList<OverloadPart> getItems() {
    return items;
  }

  public String getName() {
    return items.get(0).getName();
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitOverloadedFuncDef(this);
  }
}
