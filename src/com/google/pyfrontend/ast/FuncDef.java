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
import com.google.pyfrontend.types.CallableType;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A {@code def} or {@code async def}. The signature is null when the function declares no types
 * at all, or when its declared types could not be reconciled with its parameters.
 */
public final class FuncDef extends Statement implements FuncItem, OverloadPart {

  private final String name;
  private final ImmutableList<Argument> arguments;
  private final Block body;
  private final @Nullable CallableType type;
  private @Nullable CallableType unanalyzedType;
  private boolean isCoroutine;
  private boolean isDecorated;

  public FuncDef(
      String name, List<Argument> arguments, Block body, @Nullable CallableType type) {
    this.name = checkNotNull(name);
    this.arguments = ImmutableList.copyOf(arguments);
    this.body = checkNotNull(body);
    this.type = type;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  @Override
  public Block getBody() {
    return body;
  }

  public @Nullable CallableType getType() {
    return type;
  }

  /** A private copy of the declared signature, untouched by later rewrites of {@link #getType}. */
  public @Nullable CallableType getUnanalyzedType() {
    return unanalyzedType;
  }

  public void setUnanalyzedType(CallableType unanalyzedType) {
    this.unanalyzedType = unanalyzedType;
  }

  public boolean isCoroutine() {
    return isCoroutine;
  }

  public void setCoroutine(boolean isCoroutine) {
    this.isCoroutine = isCoroutine;
  }

  public boolean isDecorated() {
    return isDecorated;
  }

  public void setDecorated(boolean isDecorated) {
    this.isDecorated = isDecorated;
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitFuncDef(this);
  }
}
