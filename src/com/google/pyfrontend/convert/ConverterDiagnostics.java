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

/** Every diagnostic the conversion layer can emit. */
public final class ConverterDiagnostics {

  // Upstream failures

  /** The raw parser rejected the file; the argument is its message. */
  public static final DiagnosticType SYNTAX_ERROR = DiagnosticType.error("PY_SYNTAX_ERROR", "{0}");

  public static final DiagnosticType TYPE_COMMENT_SYNTAX_ERROR =
      DiagnosticType.error("PY_TYPE_COMMENT_SYNTAX_ERROR", "syntax error in type comment");

  public static final DiagnosticType FUNCTION_TYPE_COMMENT_SYNTAX_ERROR =
      DiagnosticType.error(
          "PY_FUNCTION_TYPE_COMMENT_SYNTAX_ERROR", "syntax error in type comment ''{0}''");

  public static final DiagnosticType WRAP_ARGUMENT_TYPES =
      DiagnosticType.note(
          "PY_WRAP_ARGUMENT_TYPES", "Suggestion: wrap argument types in parentheses");

  // Signatures

  public static final DiagnosticType DUPLICATE_TYPE_SIGNATURES =
      DiagnosticType.error(
          "PY_DUPLICATE_TYPE_SIGNATURES", "Function has duplicate type signatures");

  public static final DiagnosticType ELLIPSIS_WITH_OTHER_TYPES =
      DiagnosticType.error(
          "PY_ELLIPSIS_WITH_OTHER_TYPES",
          "Ellipses cannot accompany other argument types in function type signature.");

  public static final DiagnosticType TOO_MANY_ARGUMENTS =
      DiagnosticType.error("PY_TOO_MANY_ARGUMENTS", "Type signature has too many arguments");

  public static final DiagnosticType TOO_FEW_ARGUMENTS =
      DiagnosticType.error("PY_TOO_FEW_ARGUMENTS", "Type signature has too few arguments");

  // Argument names

  public static final DiagnosticType DUPLICATE_ARGUMENT =
      DiagnosticType.error(
          "PY_DUPLICATE_ARGUMENT", "Duplicate argument \"{0}\" in function definition");

  public static final DiagnosticType INVALID_ARGUMENT_NAME =
      DiagnosticType.error("PY_INVALID_ARGUMENT_NAME", "Invalid argument name \"{0}\"");

  // Type expressions

  public static final DiagnosticType INVALID_TYPE_EXPRESSION =
      DiagnosticType.error("PY_INVALID_TYPE_EXPRESSION", "invalid type comment or annotation");

  public static final DiagnosticType USE_SUBSCRIPT =
      DiagnosticType.note("PY_USE_SUBSCRIPT", "Suggestion: use {0}[...] instead of {0}(...)");

  public static final DiagnosticType ARG_CONSTRUCTOR_NAME_EXPECTED =
      DiagnosticType.error("PY_ARG_CONSTRUCTOR_NAME_EXPECTED", "Expected arg constructor name");

  public static final DiagnosticType ARG_CONSTRUCTOR_TOO_MANY_ARGUMENTS =
      DiagnosticType.error(
          "PY_ARG_CONSTRUCTOR_TOO_MANY_ARGUMENTS", "Too many arguments for argument constructor");

  public static final DiagnosticType ARG_CONSTRUCTOR_MULTIPLE_VALUES =
      DiagnosticType.error(
          "PY_ARG_CONSTRUCTOR_MULTIPLE_VALUES",
          "\"{0}\" gets multiple values for keyword argument \"{1}\"");

  public static final DiagnosticType ARG_CONSTRUCTOR_UNEXPECTED_ARGUMENT =
      DiagnosticType.error(
          "PY_ARG_CONSTRUCTOR_UNEXPECTED_ARGUMENT",
          "Unexpected argument \"{0}\" for argument constructor");

  public static final DiagnosticType ARG_NAME_NOT_A_STRING =
      DiagnosticType.error(
          "PY_ARG_NAME_NOT_A_STRING", "Expected string literal for argument name, got {0}");

  private ConverterDiagnostics() {}
}
