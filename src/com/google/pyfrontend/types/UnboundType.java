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

/**
 * A type referenced by name, possibly dotted, with optional generic arguments. The name is
 * resolved by semantic analysis, not here.
 *
 * <p>{@code Tuple[()]} yields a type named {@code Tuple} with no arguments and {@link
 * #hasEmptyTupleIndex()} set, which is how it is told apart from a bare {@code Tuple}.
 */
public final class UnboundType extends Type {

  private final String name;
  private final ImmutableList<Type> args;
  private final boolean emptyTupleIndex;
  private boolean optional;

  public UnboundType(String name, int line) {
    this(name, ImmutableList.of(), false, line);
  }

  public UnboundType(String name, List<? extends Type> args, boolean emptyTupleIndex, int line) {
    super(line, -1);
    this.name = checkNotNull(name);
    this.args = ImmutableList.copyOf(args);
    this.emptyTupleIndex = emptyTupleIndex;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Type> getArgs() {
    return args;
  }

  public boolean hasEmptyTupleIndex() {
    return emptyTupleIndex;
  }

  /** Whether the type should be widened to include {@code None}, see implicit optional. */
  public boolean isOptional() {
    return optional;
  }

  public void setOptional(boolean optional) {
    this.optional = optional;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name).append('?');
    if (!args.isEmpty()) {
      sb.append('[');
      Joiner.on(", ").appendTo(sb, args);
      sb.append(']');
    }
    return sb.toString();
  }
}
