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

import com.google.pyfrontend.ast.Expression;
import com.google.pyfrontend.ast.ExpressionStmt;
import com.google.pyfrontend.ast.SemanticModule;
import com.google.pyfrontend.ast.Statement;
import com.google.pyfrontend.rawtree.RawIR;
import com.google.pyfrontend.rawtree.RawNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;

/** Base class for tests that convert raw trees built with {@link RawIR}. */
public abstract class ConverterTestCase {

  protected static final String FILE_NAME = "test.py";

  protected SortingErrorManager errorManager;
  protected ParserOptions options;

  @Before
  public void setUp() throws Exception {
    errorManager = new SortingErrorManager();
    options = new ParserOptions();
  }

  /** Converts a module made of the given raw statements. */
  protected SemanticModule convert(RawNode... statements) {
    return PyParser.convert(RawIR.module(statements), FILE_NAME, errorManager, options);
  }

  /** Converts a single raw statement and returns the one statement it became. */
  protected Statement convertStatement(RawNode statement) {
    SemanticModule module = convert(statement);
    assertThat(module.getDefs()).hasSize(1);
    return module.getDefs().get(0);
  }

  /** Converts a raw expression by wrapping it in an expression statement. */
  protected Expression convertExpression(RawNode expression) {
    Statement statement = convertStatement(RawIR.exprStatement(expression));
    assertThat(statement).isInstanceOf(ExpressionStmt.class);
    return ((ExpressionStmt) statement).getExpr();
  }

  protected void assertNoDiagnostics() {
    assertWithMessage("Unexpected diagnostics: %s", errorManager.getSortedDiagnostics())
        .that(errorManager.getSortedDiagnostics())
        .isEmpty();
  }

  /** Asserts the exact diagnostics reported so far, in sorted order. */
  protected void assertDiagnostics(DiagnosticType... expected) {
    List<DiagnosticType> actual = new ArrayList<>();
    for (PyError e : errorManager.getSortedDiagnostics()) {
      actual.add(e.type());
    }
    assertWithMessage("Diagnostics: %s", errorManager.getSortedDiagnostics())
        .that(actual)
        .containsExactlyElementsIn(expected)
        .inOrder();
  }

  protected PyError onlyDiagnostic() {
    assertThat(errorManager.getSortedDiagnostics()).hasSize(1);
    return errorManager.getSortedDiagnostics().get(0);
  }
}
