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

import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link JsonErrorReportGenerator}. */
@RunWith(JUnit4.class)
public final class JsonErrorReportGeneratorTest {

  @Test
  public void testReport() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8);
    SortingErrorManager manager =
        new SortingErrorManager(ImmutableSet.of(new JsonErrorReportGenerator(stream)));
    manager.report(PyError.make("m.py", 3, 7, ConverterDiagnostics.DUPLICATE_ARGUMENT, "x"));
    manager.report(PyError.make("m.py", 3, 7, ConverterDiagnostics.WRAP_ARGUMENT_TYPES));
    manager.generateReport();

    JsonArray report =
        JsonParser.parseString(out.toString(StandardCharsets.UTF_8)).getAsJsonArray();
    assertThat(report.size()).isEqualTo(3);

    JsonObject error = report.get(0).getAsJsonObject();
    assertThat(error.get("level").getAsString()).isEqualTo("error");
    assertThat(error.get("key").getAsString()).isEqualTo("PY_DUPLICATE_ARGUMENT");
    assertThat(error.get("description").getAsString())
        .isEqualTo("Duplicate argument \"x\" in function definition");
    assertThat(error.get("source").getAsString()).isEqualTo("m.py");
    assertThat(error.get("line").getAsInt()).isEqualTo(3);
    assertThat(error.get("column").getAsInt()).isEqualTo(7);

    assertThat(report.get(1).getAsJsonObject().get("level").getAsString()).isEqualTo("note");

    JsonObject summary = report.get(2).getAsJsonObject();
    assertThat(summary.get("level").getAsString()).isEqualTo("info");
    assertThat(summary.get("description").getAsString()).isEqualTo("1 error(s), 1 note(s)");
  }

  @Test
  public void testNullSourceIsWrittenAsNull() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    SortingErrorManager manager =
        new SortingErrorManager(
            ImmutableSet.of(
                new JsonErrorReportGenerator(
                    new PrintStream(out, true, StandardCharsets.UTF_8))));
    manager.report(PyError.make(null, -1, -1, ConverterDiagnostics.SYNTAX_ERROR, "bad"));
    manager.generateReport();

    JsonObject error =
        JsonParser.parseString(out.toString(StandardCharsets.UTF_8))
            .getAsJsonArray()
            .get(0)
            .getAsJsonObject();
    assertThat(error.get("source").isJsonNull()).isTrue();
    assertThat(error.get("description").getAsString()).isEqualTo("bad");
  }
}
