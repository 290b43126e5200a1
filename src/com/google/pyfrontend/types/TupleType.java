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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A fixed-length tuple of types, as written with a bare comma list in a type comment. */
public final class TupleType extends Type {

  private final ImmutableList<Type> items;
  private final Type fallback;
  private final boolean implicit;

  public TupleType(List<? extends Type> items, Type fallback, boolean implicit, int line) {
    super(line, -1);
    this.items = ImmutableList.copyOf(items);
    this.fallback = checkNotNull(fallback);
    this.implicit = implicit;
  }

  public ImmutableList<Type> getItems() {
    return items;
  }

  /** The instance type backing this tuple; an {@link UnresolvedInstance} until analysis. */
  public Type getFallback() {
    return fallback;
  }

  /** True when written without a {@code Tuple[...]} wrapper. */
  public boolean isImplicit() {
    return implicit;
  }

  @Override
  public String toString() {
    return "Tuple[" + Joiner.on(", ").join(items) + "]";
  }
}
