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
import static com.google.pyfrontend.rawtree.RawIR.arguments;
import static com.google.pyfrontend.rawtree.RawIR.functionDef;
import static com.google.pyfrontend.rawtree.RawIR.list;
import static com.google.pyfrontend.rawtree.RawIR.pass;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.ast.FuncDef;
import com.google.pyfrontend.ast.SemanticModule;
import com.google.pyfrontend.rawtree.RawIR;
import com.google.pyfrontend.rawtree.RawParser;
import com.google.pyfrontend.rawtree.RawSyntaxException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link PyParser}. */
@RunWith(JUnit4.class)
public final class PyParserTest {

  private SortingErrorManager errorManager;
  private ParserOptions options;
  private final List<Integer> featureVersions = new ArrayList<>();

  @Before
  public void setUp() {
    errorManager = new SortingErrorManager();
    options = new ParserOptions();
  }

  /** An upstream parser that always produces a module with a single function. */
  private final RawParser oneFunction =
      (source, fileName, featureVersion) -> {
        featureVersions.add(featureVersion);
        return RawIR.module(functionDef("f", arguments(), list(pass())));
      };

  private final RawParser failing =
      (source, fileName, featureVersion) -> {
        throw new RawSyntaxException("invalid syntax", 3, 5);
      };

  @Test
  public void testParse() {
    SemanticModule module =
        PyParser.parse("def f(): pass", "m.py", oneFunction, errorManager, options);
    assertThat(module.getDefs()).hasSize(1);
    assertThat(((FuncDef) module.getDefs().get(0)).getName()).isEqualTo("f");
    assertThat(module.getPath()).isEqualTo("m.py");
    assertThat(module.isStub()).isFalse();
    assertThat(errorManager.getSortedDiagnostics()).isEmpty();
    assertThat(featureVersions).containsExactly(ParserOptions.DEFAULT_PYTHON3_MINOR_VERSION);
  }

  @Test
  public void testFeatureVersionFollowsOptions() {
    options.setPythonVersion(3, 8);
    PyParser.parse("", "m.py", oneFunction, errorManager, options);
    assertThat(featureVersions).containsExactly(8);
  }

  @Test
  public void testStubIsParsedWithDefaultGrammar() {
    options.setPythonVersion(2, 7);
    SemanticModule module = PyParser.parse("", "m.pyi", oneFunction, errorManager, options);
    assertThat(module.isStub()).isTrue();
    assertThat(featureVersions).containsExactly(ParserOptions.DEFAULT_PYTHON3_MINOR_VERSION);
  }

  @Test
  public void testPython2SourceIsRejected() {
    options.setPythonVersion(2, 7);
    assertThrows(
        IllegalStateException.class,
        () -> PyParser.parse("", "m.py", oneFunction, errorManager, options));
  }

  @Test
  public void testUpstreamSyntaxErrorGivesEmptyModule() {
    SemanticModule module = PyParser.parse("def", "m.py", failing, errorManager, options);
    assertThat(module.getDefs()).isEmpty();
    assertThat(module.getImports()).isEmpty();
    assertThat(module.getPath()).isNull();

    PyError error = errorManager.getSortedDiagnostics().get(0);
    assertThat(error.type()).isEqualTo(ConverterDiagnostics.SYNTAX_ERROR);
    assertThat(error.description()).isEqualTo("invalid syntax");
    assertThat(error.sourceName()).isEqualTo("m.py");
    assertThat(error.lineno()).isEqualTo(3);
    assertThat(error.charno()).isEqualTo(5);
  }

  @Test
  public void testThrowsWithoutErrorManager() {
    ParseFailedException e =
        assertThrows(
            ParseFailedException.class,
            () -> PyParser.parse("def", "m.py", failing, null, options));
    assertThat(e.getErrors()).hasSize(1);
    assertThat(e.getErrors().get(0).lineno()).isEqualTo(3);
  }

  @Test
  public void testNoThrowWithoutErrorManagerOnSuccess() {
    SemanticModule module = PyParser.parse("", "m.py", oneFunction, null, options);
    assertThat(module.getDefs()).hasSize(1);
  }

  @Test
  public void testConversionErrorsThrowWithoutErrorManager() {
    assertThrows(
        ParseFailedException.class,
        () ->
            PyParser.convert(
                RawIR.module(
                    functionDef("f", arguments(), list(pass()))
                        .setTypeComment("(int) -> str")),
                "m.py",
                null,
                options));
  }

  @Test
  public void testIgnoredLines() {
    SemanticModule module =
        PyParser.convert(
            RawIR.module(list(pass(), pass()), ImmutableList.of(2, 5)),
            "m.py",
            errorManager,
            options);
    assertThat(module.getIgnoredLines()).containsExactly(2, 5).inOrder();
  }

  @Test
  public void testIsStubFile() {
    assertThat(PyParser.isStubFile("a/b.pyi")).isTrue();
    assertThat(PyParser.isStubFile("a/b.py")).isFalse();
  }
}
