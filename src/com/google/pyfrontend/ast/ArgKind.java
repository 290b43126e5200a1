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

/**
 * How an argument binds. Declaration order is the only legal order within one signature.
 */
public enum ArgKind {
  /** Positional argument without a default. */
  POSITIONAL,
  /** Positional argument with a default. */
  OPTIONAL,
  /** {@code *args}. */
  STAR,
  /** Keyword-only argument without a default; also any {@code name=value} call argument. */
  NAMED,
  /** Keyword-only argument with a default. */
  NAMED_OPTIONAL,
  /** {@code **kwargs}. */
  STAR2;

  public boolean isOptional() {
    return this == OPTIONAL || this == NAMED_OPTIONAL;
  }

  public boolean isNamedOnly() {
    return this == NAMED || this == NAMED_OPTIONAL;
  }

  public boolean isStar() {
    return this == STAR || this == STAR2;
  }
}
