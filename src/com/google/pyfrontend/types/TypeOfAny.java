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

/** Why a type became {@link AnyType}. Downstream checks treat the flavors differently. */
public enum TypeOfAny {
  /** No annotation or type comment was given. */
  UNANNOTATED,
  /** Required by a special form, such as an implicit receiver or an annotation without value. */
  SPECIAL_FORM,
  /** Produced while recovering from a malformed type expression. */
  FROM_ERROR,
}
