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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An error manager that logs diagnostics using a logger in addition to collecting them in memory.
 * Errors are logged at the SEVERE level and notes at the INFO level.
 */
public class LoggerErrorManager extends SortingErrorManager {
  private final Logger logger;

  public LoggerErrorManager(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void generateReport() {
    for (PyError error : getSortedDiagnostics()) {
      switch (error.level()) {
        case ERROR:
          logger.severe(error.format());
          break;
        case NOTE:
          logger.info(error.format());
          break;
      }
    }
    printSummary();
    super.generateReport();
  }

  private void printSummary() {
    Level level = getErrorCount() == 0 ? Level.INFO : Level.WARNING;
    if (getErrorCount() + getNoteCount() > 0) {
      logger.log(
          level, "{0} error(s), {1} note(s)", new Object[] {getErrorCount(), getNoteCount()});
    }
  }
}
