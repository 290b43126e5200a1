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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.ast.Argument;
import com.google.pyfrontend.ast.Block;
import com.google.pyfrontend.ast.Expression;
import com.google.pyfrontend.ast.ImportBase;
import com.google.pyfrontend.ast.SemanticModule;
import com.google.pyfrontend.ast.Statement;
import com.google.pyfrontend.rawtree.RawNode;
import com.google.pyfrontend.rawtree.Token;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Converts one raw module into a {@link SemanticModule}.
 *
 * <p>An instance converts a single module and is not reusable. It owns the only state that spans
 * statements: the imports seen so far and the depth of class bodies being converted. Statements,
 * expressions and parameter lists are delegated to their own converters, which call back here to
 * recurse.
 */
final class AstConverter {

  private final ParserOptions options;
  private final DiagnosticReporter reporter;
  private final StatementConverter statements;
  private final ExpressionConverter expressions;
  private final ArgumentBinder arguments;

  private final List<ImportBase> imports = new ArrayList<>();
  private int classNesting = 0;

  AstConverter(ParserOptions options, DiagnosticReporter reporter) {
    this.options = options;
    this.reporter = reporter;
    this.statements = new StatementConverter(this);
    this.expressions = new ExpressionConverter(this);
    this.arguments = new ArgumentBinder(this);
  }

  SemanticModule convertModule(RawNode root) {
    checkArgument(root.getToken() == Token.MODULE, "not a module: %s", root);
    ImmutableList<Statement> body =
        OverloadCoalescer.coalesce(convertStatements(root.getFirstChild()));
    Set<Integer> ignoredLines = new LinkedHashSet<>();
    for (RawNode typeIgnore : root.getSecondChild().children()) {
      ignoredLines.add(typeIgnore.getLineno());
    }
    return SourcePositions.tag(new SemanticModule(body, imports, ignoredLines), root);
  }

  ParserOptions getOptions() {
    return options;
  }

  DiagnosticReporter getReporter() {
    return reporter;
  }

  void report(int line, int column, DiagnosticType type, String... arguments) {
    reporter.report(line, column, type, arguments);
  }

  TypeConverter typeConverter(int line) {
    return new TypeConverter(reporter, line);
  }

  // Cross-statement state

  void addImport(ImportBase importNode) {
    imports.add(importNode);
  }

  void enterClass() {
    classNesting++;
  }

  void exitClass() {
    checkState(classNesting > 0);
    classNesting--;
  }

  boolean inClass() {
    return classNesting > 0;
  }

  // Recursion entry points

  Statement convertStatement(RawNode n) {
    return statements.convert(n);
  }

  List<Statement> convertStatements(RawNode list) {
    checkState(list.isList(), list);
    List<Statement> res = new ArrayList<>(list.getChildCount());
    for (RawNode n : list.children()) {
      res.add(convertStatement(n));
    }
    return res;
  }

  Expression convertExpression(RawNode n) {
    return expressions.convert(n);
  }

  /** Converts an optional child, where EMPTY means absent. */
  @Nullable Expression convertOptionalExpression(RawNode n) {
    return n.isEmpty() ? null : convertExpression(n);
  }

  List<Expression> convertExpressions(List<RawNode> nodes) {
    List<Expression> res = new ArrayList<>(nodes.size());
    for (RawNode n : nodes) {
      res.add(convertExpression(n));
    }
    return res;
  }

  List<Argument> transformArgs(RawNode args, boolean noTypeCheck) {
    return arguments.bind(args, noTypeCheck);
  }

  /** A block for a suite that may be absent, such as an {@code else}; null when it is. */
  @Nullable Block asBlock(RawNode stmts, int lineno) {
    checkState(stmts.isList(), stmts);
    return stmts.hasChildren() ? asRequiredBlock(stmts, lineno) : null;
  }

  /** A block for a suite the grammar requires, such as a function body. */
  Block asRequiredBlock(RawNode stmts, int lineno) {
    checkState(stmts.isList() && stmts.hasChildren(), "empty mandatory block: %s", stmts);
    Block b = new Block(OverloadCoalescer.coalesce(convertStatements(stmts)));
    b.setLine(lineno);
    return b;
  }
}
