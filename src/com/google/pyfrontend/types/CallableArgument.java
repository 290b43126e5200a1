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

import org.jspecify.annotations.Nullable;

/**
 * An argument constructor literal such as {@code Arg(int, 'x')} found inside a bracketed type
 * list. The constructor name is kept verbatim so analysis can decide which kind it denotes.
 */
public final class CallableArgument extends Type {

  private final Type type;
  private final @Nullable String name;
  private final String constructor;

  public CallableArgument(
      Type type, @Nullable String name, String constructor, int line, int column) {
    super(line, column);
    this.type = checkNotNull(type);
    this.name = name;
    this.constructor = checkNotNull(constructor);
  }

  public Type getType() {
    return type;
  }

  public @Nullable String getName() {
    return name;
  }

  public String getConstructor() {
    return constructor;
  }

  @Override
  public String toString() {
    return constructor + "(" + type + (name != null ? ", " + name : "") + ")";
  }
}
