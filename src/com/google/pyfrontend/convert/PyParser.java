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
import static com.google.common.base.Preconditions.checkState;

import com.google.pyfrontend.ast.SemanticModule;
import com.google.pyfrontend.rawtree.RawNode;
import com.google.pyfrontend.rawtree.RawParser;
import com.google.pyfrontend.rawtree.RawSyntaxException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Entry point: parses one source file with an upstream {@link RawParser} and converts the result
 * into a {@link SemanticModule}.
 *
 * <p>Diagnostics go to the supplied {@link ErrorManager}. Without one, they are collected
 * internally and a {@link ParseFailedException} is thrown after the run if any is blocking.
 */
public final class PyParser {

  private static final Logger logger = Logger.getLogger(PyParser.class.getName());

  private PyParser() {}

  /**
   * Parses and converts a source file.
   *
   * @param fileName the file name; a {@code .pyi} suffix marks a stub
   * @param errorManager where to report diagnostics, or null to throw on blocking ones
   * @throws ParseFailedException if {@code errorManager} is null and a blocking error was found
   */
  public static SemanticModule parse(
      String source,
      String fileName,
      RawParser rawParser,
      @Nullable ErrorManager errorManager,
      ParserOptions options) {
    checkNotNull(source);
    int featureVersion = featureVersion(fileName, options);
    logger.log(Level.FINE, "Parsing {0} with feature version {1}",
        new Object[] {fileName, featureVersion});
    return run(
        fileName,
        errorManager,
        options,
        () -> rawParser.parseModule(source, fileName, featureVersion));
  }

  /**
   * Converts a raw tree that was already parsed.
   *
   * @throws ParseFailedException if {@code errorManager} is null and a blocking error was found
   */
  public static SemanticModule convert(
      RawNode root, String fileName, @Nullable ErrorManager errorManager, ParserOptions options) {
    checkNotNull(root);
    return run(fileName, errorManager, options, () -> root);
  }

  /** Whether a file is an interface stub. */
  public static boolean isStubFile(String fileName) {
    return fileName.endsWith(".pyi");
  }

  /** The Python 3 minor version whose grammar a file is parsed with. */
  static int featureVersion(String fileName, ParserOptions options) {
    if (isStubFile(fileName)) {
      return ParserOptions.DEFAULT_PYTHON3_MINOR_VERSION;
    }
    checkState(
        options.getPythonMajorVersion() >= 3,
        "Python %s source must be parsed with a Python 3 grammar",
        options.getPythonMajorVersion());
    return options.getPythonMinorVersion();
  }

  private interface RawTreeSupplier {
    RawNode get();
  }

  private static SemanticModule run(
      String fileName,
      @Nullable ErrorManager errorManager,
      ParserOptions options,
      RawTreeSupplier rawTree) {
    ErrorManager errors = errorManager != null ? errorManager : new SortingErrorManager();
    DiagnosticReporter reporter = new DiagnosticReporter(fileName, errors);
    boolean isStub = isStubFile(fileName);
    logger.log(Level.FINE, "Converting {0} (stub: {1})", new Object[] {fileName, isStub});

    SemanticModule tree;
    try {
      tree = new AstConverter(options, reporter).convertModule(rawTree.get());
      tree.setPath(fileName);
      tree.setStub(isStub);
    } catch (RawSyntaxException e) {
      logger.log(Level.FINE, "Upstream parse of " + fileName + " failed", e);
      reporter.report(
          e.getLineno(), e.getOffset(), ConverterDiagnostics.SYNTAX_ERROR, e.getMessage());
      tree = SemanticModule.empty();
    }

    if (errorManager == null && errors.hasErrors()) {
      throw new ParseFailedException(errors.getErrors());
    }
    return tree;
  }
}
