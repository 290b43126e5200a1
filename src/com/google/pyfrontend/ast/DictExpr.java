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
import org.jspecify.annotations.Nullable;

/** A dict display. An item with a null key is a {@code **mapping} expansion. */
public final class DictExpr extends Expression {

  /** One {@code key: value} entry. */
  public record Item(@Nullable Expression key, Expression value) {
    public Item {
      checkNotNull(value, "value");
    }
  }

  private final ImmutableList<Item> items;

  public DictExpr(List<Item> items) {
    this.items = ImmutableList.copyOf(items);
  }

  public ImmutableList<Item> getItems() {
    return items;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitDictExpr(this);
  }
}
