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

import static com.google.common.base.Preconditions.checkState;

import com.google.pyfrontend.ast.ArgKind;
import com.google.pyfrontend.ast.Argument;
import com.google.pyfrontend.ast.Expression;
import com.google.pyfrontend.ast.Var;
import com.google.pyfrontend.rawtree.RawNode;
import com.google.pyfrontend.rawtree.Token;
import com.google.pyfrontend.types.Type;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Turns a raw parameter structure into the ordered {@link Argument}s of a function or lambda.
 *
 * <p>Kinds follow declaration order: required positionals, positionals with defaults, the star
 * parameter, keyword-only parameters, and the double-star parameter.
 */
final class ArgumentBinder {

  private final AstConverter converter;

  ArgumentBinder(AstConverter converter) {
    this.converter = converter;
  }

  /**
   * @param args an ARGUMENTS node
   * @param noTypeCheck whether the function is exempt from type checking, in which case no
   *     argument gets a type
   */
  List<Argument> bind(RawNode args, boolean noTypeCheck) {
    checkState(args.getToken() == Token.ARGUMENTS, args);
    List<RawNode> positional = args.getChildAtIndex(0).children();
    List<RawNode> defaults = args.getChildAtIndex(1).children();
    RawNode vararg = args.getChildAtIndex(2);
    List<RawNode> kwonlyargs = args.getChildAtIndex(3).children();
    List<RawNode> kwDefaults = args.getChildAtIndex(4).children();
    RawNode kwarg = args.getChildAtIndex(5);

    List<Argument> newArgs = new ArrayList<>();
    List<RawNode> names = new ArrayList<>();
    int numNoDefaults = positional.size() - defaults.size();
    // positional arguments without defaults
    for (int i = 0; i < numNoDefaults; i++) {
      newArgs.add(makeArgument(positional.get(i), null, ArgKind.POSITIONAL, noTypeCheck));
      names.add(positional.get(i));
    }

    // positional arguments with defaults
    for (int i = numNoDefaults; i < positional.size(); i++) {
      RawNode d = defaults.get(i - numNoDefaults);
      newArgs.add(makeArgument(positional.get(i), d, ArgKind.OPTIONAL, noTypeCheck));
      names.add(positional.get(i));
    }

    // *arg
    if (!vararg.isEmpty()) {
      newArgs.add(makeArgument(vararg, null, ArgKind.STAR, noTypeCheck));
      names.add(vararg);
    }

    // keyword-only arguments, each with an optional default
    for (int i = 0; i < kwonlyargs.size(); i++) {
      RawNode d = kwDefaults.get(i);
      ArgKind kind = d.isEmpty() ? ArgKind.NAMED : ArgKind.NAMED_OPTIONAL;
      newArgs.add(makeArgument(kwonlyargs.get(i), d.isEmpty() ? null : d, kind, noTypeCheck));
      names.add(kwonlyargs.get(i));
    }

    // **kwarg
    if (!kwarg.isEmpty()) {
      newArgs.add(makeArgument(kwarg, null, ArgKind.STAR2, noTypeCheck));
      names.add(kwarg);
    }

    ArgumentNames.checkArgNames(names, converter.getReporter());
    return newArgs;
  }

  private Argument makeArgument(
      RawNode arg, @Nullable RawNode defaultValue, ArgKind kind, boolean noTypeCheck) {
    Type argType = null;
    if (!noTypeCheck) {
      RawNode annotation = arg.getFirstChild();
      String typeComment = arg.getTypeComment();
      TypeSignatures.Reconciliation choice =
          TypeSignatures.reconcile(!annotation.isEmpty(), typeComment != null);
      if (choice.duplicate()) {
        converter.report(
            arg.getLineno(), arg.getCharno(), ConverterDiagnostics.DUPLICATE_TYPE_SIGNATURES);
      }
      switch (choice.source()) {
        case INLINE:
          argType = converter.typeConverter(arg.getLineno()).convert(annotation);
          break;
        case COMMENT:
          argType =
              TypeConverter.parseTypeComment(
                  typeComment, arg.getLineno(), converter.getReporter());
          break;
        case NONE:
          break;
      }
    }
    Expression initializer =
        defaultValue == null ? null : converter.convertExpression(defaultValue);
    Var var = SourcePositions.tag(new Var(arg.getString()), arg);
    return SourcePositions.tag(new Argument(var, argType, initializer, kind), arg);
  }
}
