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

import com.google.pyfrontend.types.EllipsisType;
import com.google.pyfrontend.types.Type;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rules shared by every place a declared type can come from two sources: an inline annotation
 * and a type comment.
 */
final class TypeSignatures {

  /** Which declaration a function or argument takes its type from. */
  enum Source {
    NONE,
    INLINE,
    COMMENT
  }

  /**
   * @param source where the type comes from
   * @param duplicate whether both declarations were present, which is an error
   */
  record Reconciliation(Source source, boolean duplicate) {}

  private TypeSignatures() {}

  /** The inline annotation always wins. Declaring both is reported but not fatal. */
  static Reconciliation reconcile(boolean hasInline, boolean hasComment) {
    if (hasInline) {
      return new Reconciliation(Source.INLINE, hasComment);
    }
    return new Reconciliation(hasComment ? Source.COMMENT : Source.NONE, false);
  }

  /**
   * Checks the argument types of a signature against the number of declared parameters.
   *
   * @return the problem to report, or null when a signature can be built
   */
  static @Nullable DiagnosticType checkArity(List<@Nullable Type> argTypes, int declaredCount) {
    if (argTypes.size() != 1) {
      for (Type t : argTypes) {
        if (t instanceof EllipsisType) {
          return ConverterDiagnostics.ELLIPSIS_WITH_OTHER_TYPES;
        }
      }
    }
    if (argTypes.size() > declaredCount) {
      return ConverterDiagnostics.TOO_MANY_ARGUMENTS;
    } else if (argTypes.size() < declaredCount) {
      return ConverterDiagnostics.TOO_FEW_ARGUMENTS;
    }
    return null;
  }
}
