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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.ast.ArgKind;
import com.google.pyfrontend.ast.FuncDef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The signature of a function as declared by its annotations or its type comment.
 *
 * <p>The three argument lists are parallel. Names may be null where the signature hides them,
 * see {@code ArgumentNames}.
 */
public final class CallableType extends Type {

  private final ImmutableList<Type> argTypes;
  private final ImmutableList<ArgKind> argKinds;
  private final List<@Nullable String> argNames;
  private final Type returnType;
  private final Type fallback;
  private @Nullable FuncDef definition;

  public CallableType(
      List<? extends Type> argTypes,
      List<ArgKind> argKinds,
      List<@Nullable String> argNames,
      Type returnType,
      Type fallback) {
    super(-1, -1);
    checkArgument(
        argTypes.size() == argKinds.size() && argKinds.size() == argNames.size(),
        "mismatched signature lists: %s types, %s kinds, %s names",
        argTypes.size(),
        argKinds.size(),
        argNames.size());
    this.argTypes = ImmutableList.copyOf(argTypes);
    this.argKinds = ImmutableList.copyOf(argKinds);
    this.argNames = Collections.unmodifiableList(new ArrayList<>(argNames));
    this.returnType = checkNotNull(returnType);
    this.fallback = checkNotNull(fallback);
  }

  public ImmutableList<Type> getArgTypes() {
    return argTypes;
  }

  public ImmutableList<ArgKind> getArgKinds() {
    return argKinds;
  }

  public List<@Nullable String> getArgNames() {
    return argNames;
  }

  public Type getReturnType() {
    return returnType;
  }

  public Type getFallback() {
    return fallback;
  }

  /** The function this signature was declared on; set once the definition exists. */
  public @Nullable FuncDef getDefinition() {
    return definition;
  }

  public void setDefinition(FuncDef definition) {
    this.definition = checkNotNull(definition);
  }

  /** Returns an equal signature that shares no mutable state with this one. */
  public CallableType copy() {
    CallableType copy = new CallableType(argTypes, argKinds, argNames, returnType, fallback);
    copy.setLine(getLine());
    copy.setColumn(getColumn());
    copy.definition = definition;
    return copy;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    boolean bareAsterisk = false;
    for (int i = 0; i < argTypes.size(); i++) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      ArgKind kind = argKinds.get(i);
      if (kind.isNamedOnly() && !bareAsterisk) {
        sb.append("*, ");
        bareAsterisk = true;
      }
      if (kind == ArgKind.STAR) {
        sb.append('*');
        bareAsterisk = true;
      } else if (kind == ArgKind.STAR2) {
        sb.append("**");
      }
      String name = argNames.get(i);
      if (name != null) {
        sb.append(name).append(": ");
      }
      sb.append(argTypes.get(i));
      if (kind.isOptional()) {
        sb.append(" =");
      }
    }
    return "def (" + sb + ") -> " + returnType;
  }
}
