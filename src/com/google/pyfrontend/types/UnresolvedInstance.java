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

/**
 * Stands in for the instance type that backs tuples and callables. The class it refers to only
 * exists after semantic analysis, which must replace every occurrence.
 */
public final class UnresolvedInstance extends Type {

  /** The shared placeholder used by the converter. */
  public static final UnresolvedInstance MISSING_FALLBACK = new UnresolvedInstance();

  private UnresolvedInstance() {
    super(-1, -1);
  }

  @Override
  public String toString() {
    return "<unresolved fallback>";
  }
}
