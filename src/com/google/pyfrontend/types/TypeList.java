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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A bracketed list of types. Only meaningful as an argument list shorthand, as in the first
 * argument of {@code Callable[[int, str], None]}.
 */
public final class TypeList extends Type {

  private final ImmutableList<Type> items;

  public TypeList(List<? extends Type> items, int line) {
    super(line, -1);
    this.items = ImmutableList.copyOf(items);
  }

  public ImmutableList<Type> getItems() {
    return items;
  }

  @Override
  public String toString() {
    return "<TypeList " + Joiner.on(", ").join(items) + ">";
  }
}
