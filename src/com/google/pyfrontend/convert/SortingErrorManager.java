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
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.Set;
import java.util.TreeSet;

/**
 * An error manager that sorts every diagnostic reported to it, and has customizable output
 * through the {@link ErrorReportGenerator} interface. Identical diagnostics are reported once.
 */
public class SortingErrorManager implements ErrorManager {

  private final TreeSet<PyError> messages = new TreeSet<>(new PyErrorComparator());
  private int errorCount = 0;
  private int noteCount = 0;

  private final ImmutableSet<ErrorReportGenerator> errorReportGenerators;

  public SortingErrorManager() {
    this(ImmutableSet.of());
  }

  public SortingErrorManager(Set<ErrorReportGenerator> errorReportGenerators) {
    this.errorReportGenerators = ImmutableSet.copyOf(errorReportGenerators);
  }

  @Override
  public void report(PyError error) {
    if (messages.add(error)) {
      if (error.isBlocking()) {
        errorCount++;
      } else {
        noteCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getNoteCount() {
    return noteCount;
  }

  @Override
  public ImmutableList<PyError> getErrors() {
    return filter(CheckLevel.ERROR);
  }

  @Override
  public ImmutableList<PyError> getNotes() {
    return filter(CheckLevel.NOTE);
  }

  /** Every diagnostic, errors and notes interleaved, in sorted order. */
  public ImmutableList<PyError> getSortedDiagnostics() {
    return ImmutableList.copyOf(messages);
  }

  private ImmutableList<PyError> filter(CheckLevel level) {
    ImmutableList.Builder<PyError> errors = ImmutableList.builder();
    for (PyError e : messages) {
      if (e.level() == level) {
        errors.add(e);
      }
    }
    return errors.build();
  }

  @Override
  public void generateReport() {
    for (ErrorReportGenerator generator : errorReportGenerators) {
      generator.generateReport(this);
    }
  }

  /** Strategy for customizing the output format of the error report */
  public interface ErrorReportGenerator {
    void generateReport(SortingErrorManager manager);
  }

  /**
   * Orders diagnostics by the quintuple (file name, line number, character number, {@link
   * CheckLevel}, description), so a note follows the error it belongs to.
   *
   * <p>Note: this comparator imposes orderings that are inconsistent with {@link
   * PyError#equals(Object)}.
   */
  static final class PyErrorComparator implements Comparator<PyError> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(PyError p1, PyError p2) {
      // sourceName comparison
      String source1 = p1.sourceName();
      String source2 = p2.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }
      // lineno comparison
      int lineno1 = p1.lineno();
      int lineno2 = p2.lineno();
      if (lineno1 != lineno2) {
        return Integer.compare(lineno1, lineno2);
      }
      // charno comparison
      int charno1 = p1.charno();
      int charno2 = p2.charno();
      if (charno1 != charno2) {
        return Integer.compare(charno1, charno2);
      }
      // level
      if (p1.level() != p2.level()) {
        return p1.level().compareTo(p2.level());
      }
      // description
      return p1.description().compareTo(p2.description());
    }
  }
}
