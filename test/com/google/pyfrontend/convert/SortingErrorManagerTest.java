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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableSet;
import com.google.pyfrontend.convert.SortingErrorManager.PyErrorComparator;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link SortingErrorManager}. */
@RunWith(JUnit4.class)
public final class SortingErrorManagerTest {
  private static final String NULL_SOURCE = null;

  private final PyErrorComparator comparator = new PyErrorComparator();

  private static final DiagnosticType FOO_TYPE = DiagnosticType.error("TEST_FOO", "Foo");

  private static final DiagnosticType JOO_TYPE = DiagnosticType.error("TEST_JOO", "Joo");

  private static final DiagnosticType FOO_NOTE = DiagnosticType.note("TEST_FOO_NOTE", "Foo");

  @Test
  public void testOrderingSourceName1() {
    assertSmaller(
        PyError.make(NULL_SOURCE, -1, -1, FOO_TYPE), PyError.make("a", -1, -1, FOO_TYPE));
  }

  @Test
  public void testOrderingSourceName2() {
    assertSmaller(PyError.make("a", -1, -1, FOO_TYPE), PyError.make("b", -1, -1, FOO_TYPE));
  }

  @Test
  public void testOrderingLineno() {
    assertSmaller(
        PyError.make(NULL_SOURCE, -1, -1, FOO_TYPE), PyError.make(NULL_SOURCE, 2, -1, FOO_TYPE));
    assertSmaller(
        PyError.make(NULL_SOURCE, 8, -1, FOO_TYPE), PyError.make(NULL_SOURCE, 56, -1, FOO_TYPE));
  }

  @Test
  public void testOrderingCharno() {
    assertSmaller(
        PyError.make(NULL_SOURCE, 5, -1, FOO_TYPE), PyError.make(NULL_SOURCE, 5, 2, FOO_TYPE));
    // The column preempts the level.
    assertSmaller(
        PyError.make(NULL_SOURCE, 8, 5, FOO_NOTE), PyError.make(NULL_SOURCE, 8, 7, FOO_TYPE));
  }

  @Test
  public void testOrderingCheckLevel() {
    assertSmaller(
        PyError.make(NULL_SOURCE, 3, 0, FOO_TYPE), PyError.make(NULL_SOURCE, 3, 0, FOO_NOTE));
  }

  @Test
  public void testOrderingDescription() {
    assertSmaller(
        PyError.make(NULL_SOURCE, -1, -1, FOO_TYPE), PyError.make(NULL_SOURCE, -1, -1, JOO_TYPE));
  }

  @Test
  public void testDeduplicatedErrors() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(PyError.make("a.py", 1, 0, FOO_TYPE));
    manager.report(PyError.make("a.py", 1, 0, FOO_TYPE));
    assertThat(manager.getErrorCount()).isEqualTo(1);
    assertThat(manager.getSortedDiagnostics()).hasSize(1);
  }

  @Test
  public void testErrorsAndNotesAreCountedSeparately() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(PyError.make("a.py", 4, 0, FOO_NOTE));
    manager.report(PyError.make("a.py", 4, 0, FOO_TYPE));
    manager.report(PyError.make("a.py", 1, 0, JOO_TYPE));

    assertThat(manager.hasErrors()).isTrue();
    assertThat(manager.getErrorCount()).isEqualTo(2);
    assertThat(manager.getNoteCount()).isEqualTo(1);
    assertThat(manager.getErrors()).hasSize(2);
    assertThat(manager.getNotes()).containsExactly(PyError.make("a.py", 4, 0, FOO_NOTE));

    List<DiagnosticType> order = new ArrayList<>();
    for (PyError e : manager.getSortedDiagnostics()) {
      order.add(e.type());
    }
    assertThat(order).containsExactly(JOO_TYPE, FOO_TYPE, FOO_NOTE).inOrder();
  }

  @Test
  public void testNotesAloneAreNotErrors() {
    SortingErrorManager manager = new SortingErrorManager();
    manager.report(PyError.make("a.py", 4, 0, FOO_NOTE));
    assertThat(manager.hasErrors()).isFalse();
  }

  @Test
  public void testReportGeneratorsRun() {
    List<Integer> seen = new ArrayList<>();
    SortingErrorManager manager =
        new SortingErrorManager(ImmutableSet.of(m -> seen.add(m.getErrorCount())));
    manager.report(PyError.make("a.py", 4, 0, FOO_TYPE));
    manager.generateReport();
    assertThat(seen).containsExactly(1);
  }

  private void assertSmaller(PyError p1, PyError p2) {
    int p1p2 = comparator.compare(p1, p2);
    assertWithMessage(Integer.toString(p1p2)).that(p1p2 < 0).isTrue();
    int p2p1 = comparator.compare(p2, p1);
    assertWithMessage(Integer.toString(p2p1)).that(p2p1 > 0).isTrue();
  }
}
