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

public final class DictionaryComprehension extends Expression {

  private final Expression key;
  private final Expression value;
  private final ImmutableList<Comprehension> clauses;

  public DictionaryComprehension(Expression key, Expression value, List<Comprehension> clauses) {
    checkArgument(!clauses.isEmpty(), "comprehension without a for clause");
    this.key = checkNotNull(key);
    this.value = checkNotNull(value);
    this.clauses = ImmutableList.copyOf(clauses);
  }

  public Expression getKey() {
    return key;
  }

  public Expression getValue() {
    return value;
  }

  public ImmutableList<Comprehension> getClauses() {
    return clauses;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitDictionaryComprehension(this);
  }
}
