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

/**
 * One {@code [async] for target in iterable if cond...} clause of a comprehension.
 *
 * @param target the loop variable expression
 * @param iterable the expression iterated over
 * @param conditions the {@code if} filters, in source order
 * @param isAsync whether the clause is {@code async for}
 */
public record Comprehension(
    Expression target, Expression iterable, ImmutableList<Expression> conditions, boolean isAsync) {
  public Comprehension {
    checkNotNull(target, "target");
    checkNotNull(iterable, "iterable");
    checkNotNull(conditions, "conditions");
  }
}
