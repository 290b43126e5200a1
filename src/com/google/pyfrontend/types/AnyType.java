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

/** The fully dynamic type. */
public final class AnyType extends Type {

  private final TypeOfAny typeOfAny;

  public AnyType(TypeOfAny typeOfAny) {
    this(typeOfAny, -1, -1);
  }

  public AnyType(TypeOfAny typeOfAny, int line, int column) {
    super(line, column);
    this.typeOfAny = checkNotNull(typeOfAny);
  }

  public TypeOfAny getTypeOfAny() {
    return typeOfAny;
  }

  public boolean isFromError() {
    return typeOfAny == TypeOfAny.FROM_ERROR;
  }

  @Override
  public String toString() {
    return "Any";
  }
}
