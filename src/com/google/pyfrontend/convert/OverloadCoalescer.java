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

package com.google.pyfrontend.convert;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.ast.Decorator;
import com.google.pyfrontend.ast.FuncDef;
import com.google.pyfrontend.ast.OverloadPart;
import com.google.pyfrontend.ast.OverloadedFuncDef;
import com.google.pyfrontend.ast.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups runs of same-named definitions into {@link OverloadedFuncDef}s.
 *
 * <p>A run starts at a decorated function and continues through every directly following
 * decorated or bare function of the same name. A run of one is left as it was.
 */
final class OverloadCoalescer {

  private OverloadCoalescer() {}

  static ImmutableList<Statement> coalesce(List<? extends Statement> stmts) {
    ImmutableList.Builder<Statement> ret = ImmutableList.builder();
    List<OverloadPart> currentOverload = new ArrayList<>();
    String currentOverloadName = null;
    for (Statement stmt : stmts) {
      if (currentOverloadName != null
          && (stmt instanceof Decorator || stmt instanceof FuncDef)
          && ((OverloadPart) stmt).getName().equals(currentOverloadName)) {
        currentOverload.add((OverloadPart) stmt);
        continue;
      }
      flush(currentOverload, ret);
      if (stmt instanceof Decorator) {
        currentOverload = new ArrayList<>();
        currentOverload.add((Decorator) stmt);
        currentOverloadName = ((Decorator) stmt).getName();
      } else {
        currentOverload = new ArrayList<>();
        currentOverloadName = null;
        ret.add(stmt);
      }
    }
    flush(currentOverload, ret);
    return ret.build();
  }

  private static void flush(List<OverloadPart> run, ImmutableList.Builder<Statement> out) {
    if (run.size() == 1) {
      out.add((Statement) run.get(0));
    } else if (run.size() > 1) {
      out.add(new OverloadedFuncDef(run));
    }
  }
}
