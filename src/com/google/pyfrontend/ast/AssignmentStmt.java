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
import com.google.pyfrontend.types.Type;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * {@code a = b = value}, optionally typed. The type comes either from a trailing type comment or,
 * for {@code x: T = value}, from the annotation; the latter is flagged as new syntax.
 */
public final class AssignmentStmt extends Statement {

  private final ImmutableList<Expression> lvalues;
  private final Expression rvalue;
  private final @Nullable Type type;
  private final boolean newSyntax;

  public AssignmentStmt(
      List<? extends Expression> lvalues,
      Expression rvalue,
      @Nullable Type type,
      boolean newSyntax) {
    checkArgument(!lvalues.isEmpty(), "assignment without target");
    this.lvalues = ImmutableList.copyOf(lvalues);
    this.rvalue = checkNotNull(rvalue);
    this.type = type;
    this.newSyntax = newSyntax;
  }

  public ImmutableList<Expression> getLvalues() {
    return lvalues;
  }

  public Expression getRvalue() {
    return rvalue;
  }

  public @Nullable Type getType() {
    return type;
  }

  public boolean isNewSyntax() {
    return newSyntax;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitAssignmentStmt(this);
  }
}
