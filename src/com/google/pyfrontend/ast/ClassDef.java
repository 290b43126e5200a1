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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A class definition. Named keywords are kept in source order, metaclass included. */
public final class ClassDef extends Statement {

  private final String name;
  private final Block defs;
  private final ImmutableList<Expression> baseTypeExprs;
  private final ImmutableMap<String, Expression> keywords;
  private ImmutableList<Expression> decorators = ImmutableList.of();

  public ClassDef(
      String name,
      Block defs,
      List<Expression> baseTypeExprs,
      Map<String, Expression> keywords) {
    this.name = checkNotNull(name);
    this.defs = checkNotNull(defs);
    this.baseTypeExprs = ImmutableList.copyOf(baseTypeExprs);
    this.keywords = ImmutableMap.copyOf(keywords);
  }

  public String getName() {
    return name;
  }

  public Block getDefs() {
    return defs;
  }

  public ImmutableList<Expression> getBaseTypeExprs() {
    return baseTypeExprs;
  }

  public ImmutableMap<String, Expression> getKeywords() {
    return keywords;
  }

  public @Nullable Expression getMetaclass() {
    return keywords.get("metaclass");
  }

  public ImmutableList<Expression> getDecorators() {
    return decorators;
  }

  public void setDecorators(List<Expression> decorators) {
    this.decorators = ImmutableList.copyOf(decorators);
  }

  @Override
  public <T> T accept(NodeVisitor<T> visitor) {
    return visitor.visitClassDef(this);
  }
}
