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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** {@code (elt for x in xs if c)}; also the core of list and set comprehensions. */
public final class GeneratorExpr extends Expression {

  private final Expression leftExpr;
  private final ImmutableList<Comprehension> clauses;

  public GeneratorExpr(Expression leftExpr, List<Comprehension> clauses) {
    checkArgument(!clauses.isEmpty(), "comprehension without a for clause");
    this.leftExpr = checkNotNull(leftExpr);
    this.clauses = ImmutableList.copyOf(clauses);
  }

  public Expression getLeftExpr() {
    return leftExpr;
  }

  public ImmutableList<Comprehension> getClauses() {
    return clauses;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitGeneratorExpr(this);
  }
}
