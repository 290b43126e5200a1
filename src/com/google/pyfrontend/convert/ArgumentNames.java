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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.pyfrontend.rawtree.RawNode;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Rules on parameter names: validity, and which names signatures hide. */
final class ArgumentNames {

  private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

  private static final ImmutableSet<String> NON_BINARY_MAGIC_METHODS =
      ImmutableSet.of(
          "__abs__", "__call__", "__complex__", "__contains__", "__del__", "__delattr__",
          "__delitem__", "__enter__", "__exit__", "__float__", "__getattr__", "__getattribute__",
          "__getitem__", "__hex__", "__init__", "__init_subclass__", "__int__", "__invert__",
          "__iter__", "__len__", "__long__", "__neg__", "__new__", "__nonzero__", "__oct__",
          "__pos__", "__repr__", "__reversed__", "__setattr__", "__setitem__", "__str__",
          "__unicode__");

  private static final ImmutableSet<String> BINARY_MAGIC_METHODS =
      ImmutableSet.of(
          "__add__", "__and__", "__cmp__", "__divmod__", "__div__", "__eq__", "__floordiv__",
          "__ge__", "__gt__", "__iadd__", "__iand__", "__idiv__", "__ifloordiv__", "__ilshift__",
          "__imatmul__", "__imod__", "__imul__", "__ior__", "__ipow__", "__irshift__", "__isub__",
          "__itruediv__", "__ixor__", "__le__", "__lshift__", "__lt__", "__matmul__", "__mod__",
          "__mul__", "__ne__", "__or__", "__pow__", "__radd__", "__rand__", "__rdiv__",
          "__rfloordiv__", "__rlshift__", "__rmatmul__", "__rmod__", "__rmul__", "__ror__",
          "__rpow__", "__rrshift__", "__rshift__", "__rsub__", "__rtruediv__", "__rxor__",
          "__sub__", "__truediv__", "__xor__");

  private static final ImmutableSet<String> MAGIC_METHODS_ALLOWING_KWARGS =
      ImmutableSet.of("__init__", "__init_subclass__", "__new__", "__call__", "__setattr__");

  /** Magic methods that are only ever called with positional arguments. */
  static final ImmutableSet<String> MAGIC_METHODS_POS_ARGS_ONLY =
      Sets.difference(
              Sets.union(NON_BINARY_MAGIC_METHODS, BINARY_MAGIC_METHODS),
              MAGIC_METHODS_ALLOWING_KWARGS)
          .immutableCopy();

  private ArgumentNames() {}

  /** Whether every parameter name of the function is hidden from its signature. */
  static boolean specialFunctionElideNames(String functionName) {
    return MAGIC_METHODS_POS_ARGS_ONLY.contains(functionName);
  }

  /** Whether one parameter name is hidden: {@code __x} is private, {@code __x__} is not. */
  static boolean argumentElideName(@Nullable String name) {
    return name != null && name.startsWith("__") && !name.endsWith("__");
  }

  static boolean isValidIdentifier(String name) {
    return IDENTIFIER.matcher(name).matches();
  }

  /**
   * Reports invalid names and the first repeated name among the parameters of one function.
   *
   * @param args the ARG nodes, in binding order
   */
  static void checkArgNames(List<RawNode> args, DiagnosticReporter reporter) {
    Set<String> seenNames = new HashSet<>();
    for (RawNode arg : args) {
      String name = arg.getString();
      if (name == null) {
        continue;
      }
      if (!isValidIdentifier(name)) {
        reporter.report(
            arg.getLineno(), arg.getCharno(), ConverterDiagnostics.INVALID_ARGUMENT_NAME, name);
      }
      if (!seenNames.add(name)) {
        reporter.report(
            arg.getLineno(), arg.getCharno(), ConverterDiagnostics.DUPLICATE_ARGUMENT, name);
        break;
      }
    }
  }
}
