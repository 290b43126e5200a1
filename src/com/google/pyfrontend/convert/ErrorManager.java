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

/**
 * The diagnostics sink of a conversion. Reporting never interrupts the conversion; it only
 * records.
 */
public interface ErrorManager {

  /** Records a diagnostic. */
  void report(PyError error);

  /** Writes out whatever report this manager produces. */
  void generateReport();

  /** Gets the number of blocking diagnostics. */
  int getErrorCount();

  /** Gets the number of notes. */
  int getNoteCount();

  /** Gets all blocking diagnostics. */
  ImmutableList<PyError> getErrors();

  /** Gets all notes. */
  ImmutableList<PyError> getNotes();

  default boolean hasErrors() {
    return getErrorCount() > 0;
  }
}
