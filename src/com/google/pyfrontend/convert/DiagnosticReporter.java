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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** Stamps diagnostics with the file being converted and hands them to the sink. */
final class DiagnosticReporter {

  private final @Nullable String sourceName;
  private final ErrorManager errorManager;

  DiagnosticReporter(@Nullable String sourceName, ErrorManager errorManager) {
    this.sourceName = sourceName;
    this.errorManager = checkNotNull(errorManager);
  }

  /** Reports a diagnostic at its type's level; conversion continues either way. */
  void report(int line, int column, DiagnosticType type, String... arguments) {
    errorManager.report(PyError.make(sourceName, line, column, type, arguments));
  }
}
