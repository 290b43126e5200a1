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

import com.google.gson.stream.JsonWriter;
import com.google.pyfrontend.convert.SortingErrorManager.ErrorReportGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * An error report generator that prints diagnostics to the print stream as an array of JSON
 * objects, followed by a summary object.
 */
public class JsonErrorReportGenerator implements ErrorReportGenerator {
  private final PrintStream stream;

  /**
   * @param stream the stream on which the diagnostics should be printed. This class does not
   *     close the stream
   */
  public JsonErrorReportGenerator(PrintStream stream) {
    this.stream = stream;
  }

  @Override
  public void generateReport(SortingErrorManager manager) {
    ByteArrayOutputStream bufferedStream = new ByteArrayOutputStream();
    try (JsonWriter jsonWriter =
        new JsonWriter(new OutputStreamWriter(bufferedStream, StandardCharsets.UTF_8))) {
      jsonWriter.beginArray();
      for (PyError message : manager.getSortedDiagnostics()) {
        jsonWriter.beginObject();
        jsonWriter.name("level").value(message.isBlocking() ? "error" : "note");
        jsonWriter.name("description").value(message.description());
        jsonWriter.name("key").value(message.type().key);
        jsonWriter.name("source").value(message.sourceName());
        jsonWriter.name("line").value(message.lineno());
        jsonWriter.name("column").value(message.charno());
        jsonWriter.endObject();
      }

      jsonWriter.beginObject();
      jsonWriter.name("level").value("info");
      jsonWriter
          .name("description")
          .value(manager.getErrorCount() + " error(s), " + manager.getNoteCount() + " note(s)");
      jsonWriter.endObject();

      jsonWriter.endArray();
      jsonWriter.flush();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    stream.append(bufferedStream.toString(StandardCharsets.UTF_8));
  }
}
