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

import com.google.pyfrontend.types.Type;
import org.jspecify.annotations.Nullable;

/** A declared parameter of a function or lambda. */
public final class Argument extends SyntaxNode {

  private final Var variable;
  private final @Nullable Type typeAnnotation;
  private final @Nullable Expression initializer;
  private final ArgKind kind;

  public Argument(
      Var variable, @Nullable Type typeAnnotation, @Nullable Expression initializer, ArgKind kind) {
    this.variable = checkNotNull(variable);
    this.typeAnnotation = typeAnnotation;
    this.initializer = initializer;
    this.kind = checkNotNull(kind);
  }

  public Var getVariable() {
    return variable;
  }

  /** The inline annotation or per-argument type comment, null when absent or not checked. */
  public @Nullable Type getTypeAnnotation() {
    return typeAnnotation;
  }

  /** The default value expression. */
  public @Nullable Expression getInitializer() {
    return initializer;
  }

  public ArgKind getKind() {
    return kind;
  }
}
