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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic emitted while converting one file.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source, or null when converting without a file.
 * @param lineno One-indexed line number of the error location, or -1.
 * @param charno Zero-indexed column of the error location, or -1 for the whole line.
 * @param level Whether the diagnostic is blocking or a note.
 */
public record PyError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    CheckLevel level)
    implements Serializable {
  public PyError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(level, "level");
  }

  /**
   * Creates a PyError at a given source location, at the default level of its type.
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static PyError make(
      @Nullable String sourceName,
      int lineno,
      int charno,
      DiagnosticType type,
      String... arguments) {
    return new PyError(type, type.format(arguments), sourceName, lineno, charno, type.level);
  }

  public boolean isBlocking() {
    return level.isBlocking();
  }

  /** Formats the diagnostic as {@code file:line:column: error: description}. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    if (sourceName != null) {
      sb.append(sourceName).append(':');
    }
    if (lineno >= 0) {
      sb.append(lineno).append(':');
      if (charno >= 0) {
        sb.append(charno).append(':');
      }
    }
    if (sb.length() > 0) {
      sb.append(' ');
    }
    sb.append(isBlocking() ? "error" : "note").append(": ").append(description);
    return sb.toString();
  }
}
