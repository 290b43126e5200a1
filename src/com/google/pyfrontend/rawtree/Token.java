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

/**
 * The shapes of the raw syntax tree delivered by the upstream parser.
 *
 * <p>The comment after each constant gives its children in order. {@code ?} marks a child that is
 * {@link #EMPTY} when absent, and {@code LIST} a child holding a sequence. Payloads stored on the
 * node itself are named in braces; see {@link RawNode.Prop}.
 */
public enum Token {
  // Structure
  MODULE("Module"), // LIST body, LIST of TYPE_IGNORE
  TYPE_IGNORE("TypeIgnore"), // leaf, positioned on the ignored line
  LIST("list"), // any number of children
  EMPTY("<empty>"), // leaf

  // Statements
  FUNCTION_DEF("FunctionDef"), // {string name, TYPE_COMMENT} ARGUMENTS, LIST body,
  // LIST decorators, returns?
  ASYNC_FUNCTION_DEF("AsyncFunctionDef"), // same as FUNCTION_DEF
  CLASS_DEF("ClassDef"), // {string name} LIST bases, LIST of KEYWORD, LIST body, LIST decorators
  RETURN("Return"), // value?
  DELETE("Delete"), // targets
  ASSIGN("Assign"), // {TYPE_COMMENT} LIST targets, value
  ANN_ASSIGN("AnnAssign"), // target, annotation, value?
  AUG_ASSIGN("AugAssign"), // {OPERATOR} target, value
  FOR("For"), // {TYPE_COMMENT} target, iter, LIST body, LIST orelse
  ASYNC_FOR("AsyncFor"), // same as FOR
  WHILE("While"), // test, LIST body, LIST orelse
  IF("If"), // test, LIST body, LIST orelse
  WITH("With"), // {TYPE_COMMENT} LIST of WITH_ITEM, LIST body
  ASYNC_WITH("AsyncWith"), // same as WITH
  WITH_ITEM("withitem"), // context expression, optional vars?
  RAISE("Raise"), // exc?, cause?
  TRY("Try"), // LIST body, LIST of EXCEPT_HANDLER, LIST orelse, LIST finalbody
  EXCEPT_HANDLER("ExceptHandler"), // {string name, may be null} type?, LIST body
  ASSERT("Assert"), // test, msg?
  IMPORT("Import"), // ALIAS children
  IMPORT_FROM("ImportFrom"), // {string module, may be null; LEVEL} ALIAS children
  ALIAS("alias"), // {string name, AS_NAME} leaf
  GLOBAL("Global"), // NAME children
  NONLOCAL("Nonlocal"), // NAME children
  EXPR("Expr"), // value
  PASS("Pass"),
  BREAK("Break"),
  CONTINUE("Continue"),

  // Expressions
  BOOL_OP("BoolOp"), // {OPERATOR} two or more values
  BIN_OP("BinOp"), // {OPERATOR} left, right
  UNARY_OP("UnaryOp"), // {OPERATOR} operand
  LAMBDA("Lambda"), // ARGUMENTS, body expression
  IF_EXP("IfExp"), // test, body, orelse
  DICT_LIT("Dict"), // LIST keys (EMPTY for a ** entry), LIST values
  SET_LIT("Set"), // elements
  LIST_COMP("ListComp"), // element, COMPREHENSION children
  SET_COMP("SetComp"), // element, COMPREHENSION children
  GENERATOR_EXP("GeneratorExp"), // element, COMPREHENSION children
  DICT_COMP("DictComp"), // key, value, COMPREHENSION children
  COMPREHENSION("comprehension"), // {IS_ASYNC} target, iter, LIST ifs
  AWAIT("Await"), // value
  YIELD("Yield"), // value?
  YIELD_FROM("YieldFrom"), // value
  COMPARE("Compare"), // {COMPARE_OPS} left, comparators
  CALL("Call"), // func, LIST args, LIST of KEYWORD
  KEYWORD("keyword"), // {string arg, null for **} value
  NUM("Num"), // {NUMBER, IMAGINARY} leaf
  STR("Str"), // {string} leaf
  BYTES("Bytes"), // {BYTES_VALUE} leaf
  JOINED_STR("JoinedStr"), // STR and FORMATTED_VALUE children
  FORMATTED_VALUE("FormattedValue"), // {CONVERSION} value, format spec?
  NAME_CONSTANT("NameConstant"), // {string: None, True or False} leaf
  ELLIPSIS("Ellipsis"), // leaf
  ATTRIBUTE("Attribute"), // {string attr, CONTEXT} value
  SUBSCRIPT("Subscript"), // {CONTEXT} value, INDEX or SLICE or EXT_SLICE
  STARRED("Starred"), // {CONTEXT} value
  NAME("Name"), // {string id, CONTEXT} leaf
  LIST_LIT("List"), // {CONTEXT} elements
  TUPLE_LIT("Tuple"), // {CONTEXT} elements

  // Subscript parts
  INDEX("Index"), // value
  SLICE("Slice"), // lower?, upper?, step?
  EXT_SLICE("ExtSlice"), // INDEX or SLICE children

  // Parameters
  ARGUMENTS("arguments"), // LIST args, LIST defaults, vararg?, LIST kwonlyargs,
  // LIST kw_defaults (EMPTY where absent), kwarg?
  ARG("arg"), // {string name, TYPE_COMMENT} annotation?

  // Type comment of a whole function: "(argtypes) -> returns"
  FUNCTION_TYPE("FunctionType"); // LIST argtypes, returns

  private final String astName;

  Token(String astName) {
    this.astName = astName;
  }

  /** The node name used in messages, e.g. {@code Num} or {@code Attribute}. */
  public String getAstName() {
    return astName;
  }
}
