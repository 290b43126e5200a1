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

package com.google.pyfrontend.rawtree;

/** Operator nodes attached to operator-bearing raw nodes. */
public enum Operator {
  // Binary, also used by augmented assignment
  ADD,
  SUB,
  MULT,
  MAT_MULT,
  DIV,
  MOD,
  POW,
  LSHIFT,
  RSHIFT,
  BIT_OR,
  BIT_XOR,
  BIT_AND,
  FLOOR_DIV,

  // Boolean
  AND,
  OR,

  // Unary
  INVERT,
  NOT,
  UADD,
  USUB,

  // Comparison
  EQ,
  NOT_EQ,
  LT,
  LT_E,
  GT,
  GT_E,
  IS,
  IS_NOT,
  IN,
  NOT_IN,
}
