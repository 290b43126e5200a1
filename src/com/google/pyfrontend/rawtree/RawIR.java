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

package com.google.pyfrontend.rawtree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.math.BigInteger;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A raw tree construction helper. Every factory checks the shape of its children, so trees built
 * here always follow the layouts documented on {@link Token}.
 */
public final class RawIR {

  private static final Set<Token> STATEMENTS =
      Sets.immutableEnumSet(
          EnumSet.range(Token.FUNCTION_DEF, Token.CONTINUE));

  private static final Set<Token> EXPRESSIONS =
      Sets.immutableEnumSet(
          EnumSet.range(Token.BOOL_OP, Token.TUPLE_LIT));

  private RawIR() {}

  public static boolean mayBeStatement(RawNode n) {
    return STATEMENTS.contains(n.getToken())
        && n.getToken() != Token.WITH_ITEM
        && n.getToken() != Token.EXCEPT_HANDLER
        && n.getToken() != Token.ALIAS;
  }

  public static boolean mayBeExpression(RawNode n) {
    return EXPRESSIONS.contains(n.getToken())
        && n.getToken() != Token.COMPREHENSION
        && n.getToken() != Token.KEYWORD;
  }

  // Structure

  public static RawNode empty() {
    return new RawNode(Token.EMPTY);
  }

  public static RawNode list(RawNode... items) {
    return list(ImmutableList.copyOf(items));
  }

  public static RawNode list(List<RawNode> items) {
    RawNode list = new RawNode(Token.LIST);
    for (RawNode item : items) {
      list.addChildToBack(item);
    }
    return list;
  }

  public static RawNode module(RawNode... body) {
    return module(list(body), ImmutableList.of());
  }

  public static RawNode module(RawNode body, List<Integer> typeIgnoreLines) {
    checkStatements(body);
    RawNode ignores = list();
    for (int line : typeIgnoreLines) {
      ignores.addChildToBack(new RawNode(Token.TYPE_IGNORE).setLinenoCharno(line, 0));
    }
    return new RawNode(Token.MODULE, body, ignores).setLinenoCharno(1, 0);
  }

  // Functions and classes

  public static RawNode functionDef(String name, RawNode arguments, RawNode body) {
    return functionDef(name, arguments, body, list(), null);
  }

  public static RawNode functionDef(
      String name,
      RawNode arguments,
      RawNode body,
      RawNode decorators,
      @Nullable RawNode returns) {
    return function(Token.FUNCTION_DEF, name, arguments, body, decorators, returns);
  }

  public static RawNode asyncFunctionDef(
      String name,
      RawNode arguments,
      RawNode body,
      RawNode decorators,
      @Nullable RawNode returns) {
    return function(Token.ASYNC_FUNCTION_DEF, name, arguments, body, decorators, returns);
  }

  private static RawNode function(
      Token token,
      String name,
      RawNode arguments,
      RawNode body,
      RawNode decorators,
      @Nullable RawNode returns) {
    checkState(arguments.getToken() == Token.ARGUMENTS, arguments);
    checkStatements(body);
    checkExpressions(decorators);
    RawNode n = RawNode.newString(token, name);
    n.addChildToBack(arguments);
    n.addChildToBack(body);
    n.addChildToBack(decorators);
    n.addChildToBack(optionalExpression(returns));
    return n;
  }

  /** Parameters {@code (a, b)} without defaults, annotations or star arguments. */
  public static RawNode arguments(RawNode... args) {
    return arguments(list(args), list(), null, list(), list(), null);
  }

  /**
   * The full parameter structure.
   *
   * @param defaults defaults of the last {@code defaults.size()} positional parameters
   * @param kwDefaults one entry per keyword-only parameter, EMPTY where there is no default
   */
  public static RawNode arguments(
      RawNode args,
      RawNode defaults,
      @Nullable RawNode vararg,
      RawNode kwonlyargs,
      RawNode kwDefaults,
      @Nullable RawNode kwarg) {
    checkArgs(args);
    checkExpressions(defaults);
    checkArgument(defaults.getChildCount() <= args.getChildCount(), "more defaults than args");
    checkArgs(kwonlyargs);
    checkState(kwDefaults.isList(), kwDefaults);
    checkArgument(
        kwDefaults.getChildCount() == kwonlyargs.getChildCount(),
        "one keyword default slot per keyword-only argument");
    for (RawNode d : kwDefaults.children()) {
      checkState(d.isEmpty() || mayBeExpression(d), d);
    }
    return new RawNode(
        Token.ARGUMENTS,
        args,
        defaults,
        optionalArg(vararg),
        kwonlyargs,
        kwDefaults,
        optionalArg(kwarg));
  }

  public static RawNode arg(String name) {
    return arg(name, null);
  }

  public static RawNode arg(String name, @Nullable RawNode annotation) {
    RawNode n = RawNode.newString(Token.ARG, name);
    n.addChildToBack(optionalExpression(annotation));
    return n;
  }

  public static RawNode classDef(String name, RawNode bases, RawNode keywords, RawNode body) {
    return classDef(name, bases, keywords, body, list());
  }

  public static RawNode classDef(
      String name, RawNode bases, RawNode keywords, RawNode body, RawNode decorators) {
    checkExpressions(bases);
    checkState(keywords.isList(), keywords);
    for (RawNode k : keywords.children()) {
      checkState(k.getToken() == Token.KEYWORD, k);
    }
    checkStatements(body);
    checkExpressions(decorators);
    RawNode n = RawNode.newString(Token.CLASS_DEF, name);
    n.addChildToBack(bases);
    n.addChildToBack(keywords);
    n.addChildToBack(body);
    n.addChildToBack(decorators);
    return n;
  }

  // Simple statements

  public static RawNode returnNode() {
    return returnNode(null);
  }

  public static RawNode returnNode(@Nullable RawNode value) {
    return new RawNode(Token.RETURN, optionalExpression(value));
  }

  public static RawNode delete(RawNode... targets) {
    checkArgument(targets.length > 0, "del without targets");
    for (RawNode t : targets) {
      checkExpression(t);
    }
    return new RawNode(Token.DELETE, targets);
  }

  public static RawNode assign(RawNode target, RawNode value) {
    return multiAssign(list(target), value);
  }

  /** {@code a = b = value}; the targets are a LIST. */
  public static RawNode multiAssign(RawNode targets, RawNode value) {
    checkExpressions(targets);
    checkArgument(targets.hasChildren(), "assignment without targets");
    checkExpression(value);
    return new RawNode(Token.ASSIGN, targets, value);
  }

  public static RawNode annAssign(RawNode target, RawNode annotation, @Nullable RawNode value) {
    checkExpression(target);
    checkExpression(annotation);
    return new RawNode(Token.ANN_ASSIGN, target, annotation, optionalExpression(value));
  }

  public static RawNode augAssign(Operator op, RawNode target, RawNode value) {
    checkExpression(target);
    checkExpression(value);
    return new RawNode(Token.AUG_ASSIGN, target, value).putProp(RawNode.Prop.OPERATOR, op);
  }

  public static RawNode raise(@Nullable RawNode exc, @Nullable RawNode cause) {
    return new RawNode(Token.RAISE, optionalExpression(exc), optionalExpression(cause));
  }

  public static RawNode assertNode(RawNode test, @Nullable RawNode msg) {
    checkExpression(test);
    return new RawNode(Token.ASSERT, test, optionalExpression(msg));
  }

  public static RawNode importNode(RawNode... aliases) {
    for (RawNode a : aliases) {
      checkState(a.getToken() == Token.ALIAS, a);
    }
    return new RawNode(Token.IMPORT, aliases);
  }

  public static RawNode importFrom(@Nullable String module, int level, RawNode... aliases) {
    checkArgument(level >= 0, level);
    RawNode n = RawNode.newString(Token.IMPORT_FROM, module);
    n.putProp(RawNode.Prop.LEVEL, level);
    for (RawNode a : aliases) {
      checkState(a.getToken() == Token.ALIAS, a);
      n.addChildToBack(a);
    }
    return n;
  }

  public static RawNode alias(String name, @Nullable String asName) {
    return RawNode.newString(Token.ALIAS, name).putProp(RawNode.Prop.AS_NAME, asName);
  }

  public static RawNode global(String... names) {
    return nameDeclaration(Token.GLOBAL, names);
  }

  public static RawNode nonlocal(String... names) {
    return nameDeclaration(Token.NONLOCAL, names);
  }

  private static RawNode nameDeclaration(Token token, String... names) {
    RawNode n = new RawNode(token);
    for (String name : names) {
      n.addChildToBack(name(name));
    }
    return n;
  }

  public static RawNode exprStatement(RawNode value) {
    checkExpression(value);
    return new RawNode(Token.EXPR, value);
  }

  public static RawNode pass() {
    return new RawNode(Token.PASS);
  }

  public static RawNode breakNode() {
    return new RawNode(Token.BREAK);
  }

  public static RawNode continueNode() {
    return new RawNode(Token.CONTINUE);
  }

  // Compound statements

  public static RawNode forNode(RawNode target, RawNode iter, RawNode body, RawNode orelse) {
    return loop(Token.FOR, target, iter, body, orelse);
  }

  public static RawNode asyncFor(RawNode target, RawNode iter, RawNode body, RawNode orelse) {
    return loop(Token.ASYNC_FOR, target, iter, body, orelse);
  }

  private static RawNode loop(
      Token token, RawNode target, RawNode iter, RawNode body, RawNode orelse) {
    checkExpression(target);
    checkExpression(iter);
    checkStatements(body);
    checkStatements(orelse);
    return new RawNode(token, target, iter, body, orelse);
  }

  public static RawNode whileNode(RawNode test, RawNode body, RawNode orelse) {
    checkExpression(test);
    checkStatements(body);
    checkStatements(orelse);
    return new RawNode(Token.WHILE, test, body, orelse);
  }

  public static RawNode ifNode(RawNode test, RawNode body, RawNode orelse) {
    checkExpression(test);
    checkStatements(body);
    checkStatements(orelse);
    return new RawNode(Token.IF, test, body, orelse);
  }

  public static RawNode with(RawNode items, RawNode body) {
    return withStatement(Token.WITH, items, body);
  }

  public static RawNode asyncWith(RawNode items, RawNode body) {
    return withStatement(Token.ASYNC_WITH, items, body);
  }

  private static RawNode withStatement(Token token, RawNode items, RawNode body) {
    checkState(items.isList() && items.hasChildren(), items);
    for (RawNode item : items.children()) {
      checkState(item.getToken() == Token.WITH_ITEM, item);
    }
    checkStatements(body);
    return new RawNode(token, items, body);
  }

  public static RawNode withItem(RawNode contextExpr, @Nullable RawNode optionalVars) {
    checkExpression(contextExpr);
    return new RawNode(Token.WITH_ITEM, contextExpr, optionalExpression(optionalVars));
  }

  public static RawNode tryNode(RawNode body, RawNode handlers, RawNode orelse, RawNode finalbody) {
    checkStatements(body);
    checkState(handlers.isList(), handlers);
    for (RawNode h : handlers.children()) {
      checkState(h.getToken() == Token.EXCEPT_HANDLER, h);
    }
    checkStatements(orelse);
    checkStatements(finalbody);
    return new RawNode(Token.TRY, body, handlers, orelse, finalbody);
  }

  public static RawNode exceptHandler(
      @Nullable RawNode type, @Nullable String name, RawNode body) {
    checkStatements(body);
    RawNode n = RawNode.newString(Token.EXCEPT_HANDLER, name);
    n.addChildToBack(optionalExpression(type));
    n.addChildToBack(body);
    return n;
  }

  // Expressions

  public static RawNode boolOp(Operator op, RawNode... values) {
    checkArgument(op == Operator.AND || op == Operator.OR, op);
    checkArgument(values.length >= 2, "boolean operation needs two operands");
    return operation(Token.BOOL_OP, op, values);
  }

  public static RawNode binOp(Operator op, RawNode left, RawNode right) {
    return operation(Token.BIN_OP, op, left, right);
  }

  public static RawNode unaryOp(Operator op, RawNode operand) {
    return operation(Token.UNARY_OP, op, operand);
  }

  private static RawNode operation(Token token, Operator op, RawNode... operands) {
    for (RawNode operand : operands) {
      checkExpression(operand);
    }
    return new RawNode(token, operands).putProp(RawNode.Prop.OPERATOR, op);
  }

  public static RawNode lambda(RawNode arguments, RawNode body) {
    checkState(arguments.getToken() == Token.ARGUMENTS, arguments);
    checkExpression(body);
    return new RawNode(Token.LAMBDA, arguments, body);
  }

  public static RawNode ifExp(RawNode test, RawNode body, RawNode orelse) {
    checkExpression(test);
    checkExpression(body);
    checkExpression(orelse);
    return new RawNode(Token.IF_EXP, test, body, orelse);
  }

  /** A dict display; an EMPTY key denotes a {@code **mapping} entry. */
  public static RawNode dict(RawNode keys, RawNode values) {
    checkState(keys.isList(), keys);
    for (RawNode k : keys.children()) {
      checkState(k.isEmpty() || mayBeExpression(k), k);
    }
    checkExpressions(values);
    checkArgument(keys.getChildCount() == values.getChildCount(), "keys and values differ");
    return new RawNode(Token.DICT_LIT, keys, values);
  }

  public static RawNode set(RawNode... elements) {
    return sequence(Token.SET_LIT, elements);
  }

  public static RawNode listLit(RawNode... elements) {
    return sequence(Token.LIST_LIT, elements);
  }

  public static RawNode tupleLit(RawNode... elements) {
    return sequence(Token.TUPLE_LIT, elements);
  }

  private static RawNode sequence(Token token, RawNode... elements) {
    for (RawNode e : elements) {
      checkExpression(e);
    }
    return new RawNode(token, elements);
  }

  public static RawNode listComp(RawNode element, RawNode... generators) {
    return comprehensionExpr(Token.LIST_COMP, element, generators);
  }

  public static RawNode setComp(RawNode element, RawNode... generators) {
    return comprehensionExpr(Token.SET_COMP, element, generators);
  }

  public static RawNode generatorExp(RawNode element, RawNode... generators) {
    return comprehensionExpr(Token.GENERATOR_EXP, element, generators);
  }

  private static RawNode comprehensionExpr(Token token, RawNode element, RawNode... generators) {
    checkExpression(element);
    RawNode n = new RawNode(token, element);
    addGenerators(n, generators);
    return n;
  }

  public static RawNode dictComp(RawNode key, RawNode value, RawNode... generators) {
    checkExpression(key);
    checkExpression(value);
    RawNode n = new RawNode(Token.DICT_COMP, key, value);
    addGenerators(n, generators);
    return n;
  }

  private static void addGenerators(RawNode n, RawNode... generators) {
    checkArgument(generators.length > 0, "comprehension without a for clause");
    for (RawNode g : generators) {
      checkState(g.getToken() == Token.COMPREHENSION, g);
      n.addChildToBack(g);
    }
  }

  public static RawNode comprehension(
      RawNode target, RawNode iter, RawNode ifs, boolean isAsync) {
    checkExpression(target);
    checkExpression(iter);
    checkExpressions(ifs);
    return new RawNode(Token.COMPREHENSION, target, iter, ifs)
        .putProp(RawNode.Prop.IS_ASYNC, isAsync);
  }

  public static RawNode await(RawNode value) {
    checkExpression(value);
    return new RawNode(Token.AWAIT, value);
  }

  public static RawNode yield(@Nullable RawNode value) {
    return new RawNode(Token.YIELD, optionalExpression(value));
  }

  public static RawNode yieldFrom(RawNode value) {
    checkExpression(value);
    return new RawNode(Token.YIELD_FROM, value);
  }

  public static RawNode compare(RawNode left, List<Operator> ops, RawNode... comparators) {
    checkArgument(!ops.isEmpty() && ops.size() == comparators.length, "one operator per operand");
    checkExpression(left);
    RawNode n = new RawNode(Token.COMPARE, left);
    for (RawNode c : comparators) {
      checkExpression(c);
      n.addChildToBack(c);
    }
    return n.putProp(RawNode.Prop.COMPARE_OPS, ImmutableList.copyOf(ops));
  }

  /** A call with positional arguments only. */
  public static RawNode call(RawNode func, RawNode... args) {
    return call(func, list(args), list());
  }

  public static RawNode call(RawNode func, RawNode args, RawNode keywords) {
    checkExpression(func);
    checkExpressions(args);
    checkState(keywords.isList(), keywords);
    for (RawNode k : keywords.children()) {
      checkState(k.getToken() == Token.KEYWORD, k);
    }
    return new RawNode(Token.CALL, func, args, keywords);
  }

  /** A keyword argument; a null name denotes {@code **mapping}. */
  public static RawNode keyword(@Nullable String arg, RawNode value) {
    checkExpression(value);
    RawNode n = RawNode.newString(Token.KEYWORD, arg);
    n.addChildToBack(value);
    return n;
  }

  public static RawNode num(long value) {
    return num(BigInteger.valueOf(value));
  }

  public static RawNode num(BigInteger value) {
    return new RawNode(Token.NUM).putProp(RawNode.Prop.NUMBER, value);
  }

  public static RawNode num(double value) {
    return new RawNode(Token.NUM).putProp(RawNode.Prop.NUMBER, value);
  }

  /** An imaginary literal such as {@code 2j}. */
  public static RawNode imaginary(double value) {
    return num(value).putProp(RawNode.Prop.IMAGINARY, true);
  }

  public static RawNode str(String value) {
    return RawNode.newString(Token.STR, value);
  }

  public static RawNode bytes(byte[] value) {
    return new RawNode(Token.BYTES).putProp(RawNode.Prop.BYTES_VALUE, value.clone());
  }

  public static RawNode joinedStr(RawNode... values) {
    for (RawNode v : values) {
      checkState(v.getToken() == Token.STR || v.getToken() == Token.FORMATTED_VALUE, v);
    }
    return new RawNode(Token.JOINED_STR, values);
  }

  /**
   * @param conversion the conversion character such as {@code 'r'}, or -1 for none
   */
  public static RawNode formattedValue(
      RawNode value, int conversion, @Nullable RawNode formatSpec) {
    checkExpression(value);
    return new RawNode(Token.FORMATTED_VALUE, value, optionalExpression(formatSpec))
        .putProp(RawNode.Prop.CONVERSION, conversion);
  }

  public static RawNode nameConstant(String value) {
    checkArgument(
        value.equals("None") || value.equals("True") || value.equals("False"), value);
    return RawNode.newString(Token.NAME_CONSTANT, value);
  }

  public static RawNode none() {
    return nameConstant("None");
  }

  public static RawNode ellipsis() {
    return new RawNode(Token.ELLIPSIS);
  }

  public static RawNode attribute(RawNode value, String attr) {
    checkExpression(value);
    RawNode n = RawNode.newString(Token.ATTRIBUTE, attr);
    n.addChildToBack(value);
    return n;
  }

  /** {@code value[index]} with a plain index. */
  public static RawNode subscript(RawNode value, RawNode index) {
    return subscriptSlice(value, index(index));
  }

  /** {@code value[slice]} where the slice is an INDEX, SLICE or EXT_SLICE node. */
  public static RawNode subscriptSlice(RawNode value, RawNode slice) {
    checkExpression(value);
    checkSlice(slice);
    return new RawNode(Token.SUBSCRIPT, value, slice);
  }

  public static RawNode index(RawNode value) {
    checkExpression(value);
    return new RawNode(Token.INDEX, value);
  }

  public static RawNode slice(
      @Nullable RawNode lower, @Nullable RawNode upper, @Nullable RawNode step) {
    return new RawNode(
        Token.SLICE,
        optionalExpression(lower),
        optionalExpression(upper),
        optionalExpression(step));
  }

  public static RawNode extSlice(RawNode... dims) {
    checkArgument(dims.length > 0, "extended slice without dimensions");
    for (RawNode d : dims) {
      checkState(d.getToken() == Token.INDEX || d.getToken() == Token.SLICE, d);
    }
    return new RawNode(Token.EXT_SLICE, dims);
  }

  public static RawNode starred(RawNode value) {
    checkExpression(value);
    return new RawNode(Token.STARRED, value);
  }

  public static RawNode name(String id) {
    return RawNode.newString(Token.NAME, id);
  }

  public static RawNode functionType(RawNode argTypes, RawNode returns) {
    checkExpressions(argTypes);
    checkExpression(returns);
    return new RawNode(Token.FUNCTION_TYPE, argTypes, returns);
  }

  // Shape checks

  private static RawNode optionalExpression(@Nullable RawNode n) {
    if (n == null) {
      return empty();
    }
    checkState(n.isEmpty() || mayBeExpression(n), "not an expression: %s", n);
    return n;
  }

  private static RawNode optionalArg(@Nullable RawNode n) {
    if (n == null) {
      return empty();
    }
    checkState(n.isEmpty() || n.getToken() == Token.ARG, n);
    return n;
  }

  private static void checkExpression(RawNode n) {
    checkState(mayBeExpression(n), "not an expression: %s", n);
  }

  private static void checkExpressions(RawNode list) {
    checkState(list.isList(), "not a list: %s", list);
    for (RawNode n : list.children()) {
      checkExpression(n);
    }
  }

  private static void checkStatements(RawNode list) {
    checkState(list.isList(), "not a list: %s", list);
    for (RawNode n : list.children()) {
      checkState(mayBeStatement(n), "not a statement: %s", n);
    }
  }

  private static void checkArgs(RawNode list) {
    checkState(list.isList(), "not a list: %s", list);
    for (RawNode n : list.children()) {
      checkState(n.getToken() == Token.ARG, n);
    }
  }

  private static void checkSlice(RawNode n) {
    Token t = n.getToken();
    checkState(t == Token.INDEX || t == Token.SLICE || t == Token.EXT_SLICE, n);
  }
}
