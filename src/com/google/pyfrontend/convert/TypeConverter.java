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
import com.google.pyfrontend.rawtree.FragmentParser;
import com.google.pyfrontend.rawtree.RawNode;
import com.google.pyfrontend.rawtree.RawSyntaxException;
import com.google.pyfrontend.rawtree.Token;
import com.google.pyfrontend.types.AnyType;
import com.google.pyfrontend.types.CallableArgument;
import com.google.pyfrontend.types.EllipsisType;
import com.google.pyfrontend.types.TupleType;
import com.google.pyfrontend.types.Type;
import com.google.pyfrontend.types.TypeList;
import com.google.pyfrontend.types.TypeOfAny;
import com.google.pyfrontend.types.UnboundType;
import com.google.pyfrontend.types.UnresolvedInstance;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Evaluates a raw expression written as a type, either an inline annotation or the parsed text of
 * a type comment.
 *
 * <p>Every type produced carries the line the converter was created for, since fragments parsed
 * from comments have no line of their own. The syntactic parent of each node is passed down
 * explicitly: argument constructors and type lists are legal only under specific parents.
 */
final class TypeConverter {

  private static final Logger logger = Logger.getLogger(TypeConverter.class.getName());

  private final @Nullable DiagnosticReporter reporter;
  private final int line;

  /**
   * @param reporter where to report problems, or null to drop them
   * @param line the line every produced type is attributed to
   */
  TypeConverter(@Nullable DiagnosticReporter reporter, int line) {
    this.reporter = reporter;
    this.line = line;
  }

  /**
   * Parses and evaluates the text of a type comment.
   *
   * @return the type, or null when the text is not an expression; that case is reported at
   *     {@code line}
   * @throws RawSyntaxException if the text is not an expression and there is no reporter
   */
  static @Nullable Type parseTypeComment(
      String typeComment, int line, @Nullable DiagnosticReporter reporter) {
    RawNode expression;
    try {
      expression = FragmentParser.parseExpression(typeComment);
    } catch (RawSyntaxException e) {
      if (reporter == null) {
        throw e;
      }
      logger.log(Level.FINE, "Unparsable type comment: " + typeComment, e);
      reporter.report(line, e.getOffset(), ConverterDiagnostics.TYPE_COMMENT_SYNTAX_ERROR);
      return null;
    }
    return new TypeConverter(reporter, line).convert(expression);
  }

  Type convert(RawNode n) {
    return convert(n, null);
  }

  ImmutableList<Type> convertAll(List<RawNode> nodes, @Nullable RawNode parent) {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    for (RawNode n : nodes) {
      types.add(convert(n, parent));
    }
    return types.build();
  }

  private Type convert(RawNode n, @Nullable RawNode parent) {
    switch (n.getToken()) {
      case NAME:
        return new UnboundType(n.getString(), line);
      case NAME_CONSTANT:
        return new UnboundType(n.getString(), line);
      case STR:
        {
          Type t = parseTypeComment(n.getString().strip(), line, reporter);
          return t != null ? t : fromError();
        }
      case SUBSCRIPT:
        return convertSubscript(n);
      case TUPLE_LIT:
        return new TupleType(
            convertAll(n.children(), n), UnresolvedInstance.MISSING_FALLBACK, true, line);
      case ATTRIBUTE:
        {
          Type beforeDot = convert(n.getFirstChild(), n);
          if (beforeDot instanceof UnboundType && ((UnboundType) beforeDot).getArgs().isEmpty()) {
            return new UnboundType(((UnboundType) beforeDot).getName() + "." + n.getString(), line);
          }
          return invalid(n);
        }
      case ELLIPSIS:
        return new EllipsisType(line);
      case LIST_LIT:
        if (parent == null || parent.getToken() != Token.SUBSCRIPT) {
          return invalid(n);
        }
        return new TypeList(convertAll(n.children(), n), line);
      case CALL:
        return convertArgumentConstructor(n, parent);
      default:
        return invalid(n);
    }
  }

  /** {@code X[a]} and {@code X[a, b]}; a tuple index supplies several arguments. */
  private Type convertSubscript(RawNode n) {
    RawNode slice = n.getSecondChild();
    if (slice.getToken() != Token.INDEX) {
      fail(n.getCharno(), ConverterDiagnostics.TYPE_COMMENT_SYNTAX_ERROR);
      return fromError();
    }

    RawNode index = slice.getFirstChild();
    boolean emptyTupleIndex = false;
    ImmutableList<Type> params;
    if (index.getToken() == Token.TUPLE_LIT) {
      params = convertAll(index.children(), n);
      emptyTupleIndex = !index.hasChildren();
    } else {
      params = ImmutableList.of(convert(index, n));
    }

    Type value = convert(n.getFirstChild(), n);
    if (value instanceof UnboundType && ((UnboundType) value).getArgs().isEmpty()) {
      return new UnboundType(((UnboundType) value).getName(), params, emptyTupleIndex, line);
    }
    return invalid(n);
  }

  /**
   * An argument constructor such as {@code Arg(int, 'x')} or {@code DefaultArg(type=int)}. Only
   * legal as an element of a bracketed argument list.
   */
  private Type convertArgumentConstructor(RawNode e, @Nullable RawNode parent) {
    RawNode f = e.getFirstChild();
    String constructor = stringifyName(f);

    if (parent == null || parent.getToken() != Token.LIST_LIT) {
      fail(e.getCharno(), ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
      if (constructor != null) {
        fail(e.getCharno(), ConverterDiagnostics.USE_SUBSCRIPT, constructor);
      }
      return fromError();
    }
    if (constructor == null) {
      fail(e.getCharno(), ConverterDiagnostics.ARG_CONSTRUCTOR_NAME_EXPECTED);
      constructor = "";
    }

    String name = null;
    AnyType defaultType = new AnyType(TypeOfAny.SPECIAL_FORM, line, -1);
    Type typ = defaultType;
    List<RawNode> args = e.getSecondChild().children();
    for (int i = 0; i < args.size(); i++) {
      RawNode arg = args.get(i);
      if (i == 0) {
        typ = convert(arg, e);
      } else if (i == 1) {
        name = extractArgumentName(arg);
      } else {
        fail(arg.getCharno(), ConverterDiagnostics.ARG_CONSTRUCTOR_TOO_MANY_ARGUMENTS);
      }
    }
    for (RawNode k : e.getLastChild().children()) {
      RawNode value = k.getFirstChild();
      String keyword = k.getString();
      if ("name".equals(keyword)) {
        if (name != null) {
          fail(
              f.getCharno(),
              ConverterDiagnostics.ARG_CONSTRUCTOR_MULTIPLE_VALUES,
              constructor,
              "name");
        }
        name = extractArgumentName(value);
      } else if ("type".equals(keyword)) {
        if (typ != defaultType) {
          fail(
              f.getCharno(),
              ConverterDiagnostics.ARG_CONSTRUCTOR_MULTIPLE_VALUES,
              constructor,
              "type");
        }
        typ = convert(value, e);
      } else {
        fail(
            value.getCharno(),
            ConverterDiagnostics.ARG_CONSTRUCTOR_UNEXPECTED_ARGUMENT,
            String.valueOf(keyword));
      }
    }
    return new CallableArgument(typ, name, constructor, line, e.getCharno());
  }

  private @Nullable String extractArgumentName(RawNode n) {
    if (n.getToken() == Token.STR) {
      return n.getString().strip();
    } else if (n.isNameConstant("None")) {
      return null;
    }
    fail(0, ConverterDiagnostics.ARG_NAME_NOT_A_STRING, n.getToken().getAstName());
    return null;
  }

  /** {@code a.b.c} for a chain of names, null for anything else. */
  static @Nullable String stringifyName(RawNode n) {
    if (n.isName()) {
      return n.getString();
    } else if (n.isAttribute()) {
      String sv = stringifyName(n.getFirstChild());
      if (sv != null) {
        return sv + "." + n.getString();
      }
    }
    return null;
  }

  private Type invalid(RawNode n) {
    fail(n.getCharno(), ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
    return fromError();
  }

  private AnyType fromError() {
    return new AnyType(TypeOfAny.FROM_ERROR, line, -1);
  }

  private void fail(int column, DiagnosticType type, String... arguments) {
    if (reporter != null) {
      reporter.report(line, column, type, arguments);
    }
  }
}
