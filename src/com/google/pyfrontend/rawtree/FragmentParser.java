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

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.rawtree.FragmentScanner.Kind;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Parses the text of a type comment, or of a quoted annotation, into a raw tree.
 *
 * <p>Two entry points mirror the two forms a type comment can take: {@link #parseExpression} for
 * a single type such as {@code List[int]}, and {@link #parseFunctionType} for a function
 * signature such as {@code (int, str) -> bool}. All nodes are positioned on line 1 with a
 * zero-based column into the fragment.
 */
public final class FragmentParser {

  private final FragmentScanner ts;

  // The looked-ahead token, or null once it has been consumed.
  private @Nullable Kind currentToken;

  private FragmentParser(String source) {
    this.ts = new FragmentScanner(source);
  }

  /**
   * Parses one expression. A top-level comma-separated list becomes a {@link Token#TUPLE_LIT}.
   *
   * @throws RawSyntaxException if the text is not a single expression
   */
  public static RawNode parseExpression(String source) {
    FragmentParser parser = new FragmentParser(source);
    RawNode result = parser.testList();
    parser.mustMatchToken(Kind.EOF);
    return result;
  }

  /**
   * Parses a function signature {@code (argtypes) -> returns} into a {@link
   * Token#FUNCTION_TYPE} node. Star prefixes on argument types are accepted and dropped.
   *
   * @throws RawSyntaxException if the text is not a signature
   */
  public static RawNode parseFunctionType(String source) {
    FragmentParser parser = new FragmentParser(source);
    RawNode result = parser.functionType();
    parser.mustMatchToken(Kind.EOF);
    return result;
  }

  private Kind peekToken() {
    if (currentToken == null) {
      currentToken = ts.getToken();
    }
    return currentToken;
  }

  private void consumeToken() {
    currentToken = null;
  }

  private boolean matchToken(Kind toMatch) {
    if (peekToken() != toMatch) {
      return false;
    }
    consumeToken();
    return true;
  }

  private void mustMatchToken(Kind toMatch) {
    if (!matchToken(toMatch)) {
      throw reportError();
    }
  }

  private boolean peekKeyword(String keyword) {
    return peekToken() == Kind.NAME && ts.getString().equals(keyword);
  }

  private boolean matchKeyword(String keyword) {
    if (!peekKeyword(keyword)) {
      return false;
    }
    consumeToken();
    return true;
  }

  /** An error at the looked-ahead token. */
  private RawSyntaxException reportError() {
    peekToken();
    return FragmentScanner.syntaxError(ts.getCharno());
  }

  private RawNode functionType() {
    mustMatchToken(Kind.LP);
    List<RawNode> argTypes = new ArrayList<>();
    boolean sawStar2 = false;
    while (peekToken() != Kind.RP) {
      if (sawStar2) {
        throw reportError();
      }
      if (matchToken(Kind.STAR2)) {
        sawStar2 = true;
      } else {
        matchToken(Kind.STAR);
      }
      argTypes.add(test());
      if (!matchToken(Kind.COMMA)) {
        break;
      }
    }
    mustMatchToken(Kind.RP);
    mustMatchToken(Kind.ARROW);
    RawNode returns = test();
    RawNode position = argTypes.isEmpty() ? returns : argTypes.get(0);
    return RawIR.functionType(RawIR.list(argTypes), returns).srcref(position);
  }

  private RawNode testList() {
    RawNode first = test();
    if (peekToken() != Kind.COMMA) {
      return first;
    }
    List<RawNode> items = new ArrayList<>();
    items.add(first);
    while (matchToken(Kind.COMMA)) {
      if (!startsExpression()) {
        break;
      }
      items.add(test());
    }
    return RawIR.tupleLit(items.toArray(new RawNode[0])).srcref(first);
  }

  private boolean startsExpression() {
    switch (peekToken()) {
      case NAME:
        String word = ts.getString();
        return !FragmentScanner.KEYWORDS.contains(word)
            || word.equals("None")
            || word.equals("True")
            || word.equals("False")
            || word.equals("not");
      case NUMBER:
      case STRING:
      case LP:
      case LB:
      case ELLIPSIS:
      case PLUS:
      case MINUS:
      case TILDE:
        return true;
      default:
        return false;
    }
  }

  private RawNode test() {
    RawNode body = orTest();
    if (matchKeyword("if")) {
      RawNode condition = orTest();
      if (!matchKeyword("else")) {
        throw reportError();
      }
      RawNode orelse = test();
      return RawIR.ifExp(condition, body, orelse).srcref(body);
    }
    return body;
  }

  private RawNode orTest() {
    return boolTest(Operator.OR, "or");
  }

  private RawNode boolTest(Operator op, String keyword) {
    RawNode first = op == Operator.OR ? boolTest(Operator.AND, "and") : notTest();
    if (!peekKeyword(keyword)) {
      return first;
    }
    List<RawNode> values = new ArrayList<>();
    values.add(first);
    while (matchKeyword(keyword)) {
      values.add(op == Operator.OR ? boolTest(Operator.AND, "and") : notTest());
    }
    return RawIR.boolOp(op, values.toArray(new RawNode[0])).srcref(first);
  }

  private RawNode notTest() {
    if (matchKeyword("not")) {
      int charno = ts.getCharno();
      return RawIR.unaryOp(Operator.NOT, notTest()).setLinenoCharno(1, charno);
    }
    return comparison();
  }

  private RawNode comparison() {
    RawNode left = expr();
    ImmutableList.Builder<Operator> ops = ImmutableList.builder();
    List<RawNode> comparators = new ArrayList<>();
    while (true) {
      Operator op = comparisonOperator();
      if (op == null) {
        break;
      }
      ops.add(op);
      comparators.add(expr());
    }
    if (comparators.isEmpty()) {
      return left;
    }
    return RawIR.compare(left, ops.build(), comparators.toArray(new RawNode[0])).srcref(left);
  }

  private @Nullable Operator comparisonOperator() {
    switch (peekToken()) {
      case LT:
        consumeToken();
        return Operator.LT;
      case LE:
        consumeToken();
        return Operator.LT_E;
      case GT:
        consumeToken();
        return Operator.GT;
      case GE:
        consumeToken();
        return Operator.GT_E;
      case EQ:
        consumeToken();
        return Operator.EQ;
      case NE:
        consumeToken();
        return Operator.NOT_EQ;
      case NAME:
        if (matchKeyword("in")) {
          return Operator.IN;
        }
        if (matchKeyword("is")) {
          return matchKeyword("not") ? Operator.IS_NOT : Operator.IS;
        }
        if (matchKeyword("not")) {
          if (!matchKeyword("in")) {
            throw reportError();
          }
          return Operator.NOT_IN;
        }
        return null;
      default:
        return null;
    }
  }

  private RawNode expr() {
    RawNode pn = xorExpr();
    while (matchToken(Kind.BITOR)) {
      pn = RawIR.binOp(Operator.BIT_OR, pn, xorExpr()).srcref(pn);
    }
    return pn;
  }

  private RawNode xorExpr() {
    RawNode pn = andExpr();
    while (matchToken(Kind.BITXOR)) {
      pn = RawIR.binOp(Operator.BIT_XOR, pn, andExpr()).srcref(pn);
    }
    return pn;
  }

  private RawNode andExpr() {
    RawNode pn = shiftExpr();
    while (matchToken(Kind.BITAND)) {
      pn = RawIR.binOp(Operator.BIT_AND, pn, shiftExpr()).srcref(pn);
    }
    return pn;
  }

  private RawNode shiftExpr() {
    RawNode pn = arithExpr();
    while (true) {
      Operator op;
      if (matchToken(Kind.LSHIFT)) {
        op = Operator.LSHIFT;
      } else if (matchToken(Kind.RSHIFT)) {
        op = Operator.RSHIFT;
      } else {
        return pn;
      }
      pn = RawIR.binOp(op, pn, arithExpr()).srcref(pn);
    }
  }

  private RawNode arithExpr() {
    RawNode pn = term();
    while (true) {
      Operator op;
      if (matchToken(Kind.PLUS)) {
        op = Operator.ADD;
      } else if (matchToken(Kind.MINUS)) {
        op = Operator.SUB;
      } else {
        return pn;
      }
      pn = RawIR.binOp(op, pn, term()).srcref(pn);
    }
  }

  private RawNode term() {
    RawNode pn = factor();
    while (true) {
      Operator op;
      switch (peekToken()) {
        case STAR:
          op = Operator.MULT;
          break;
        case AT:
          op = Operator.MAT_MULT;
          break;
        case SLASH:
          op = Operator.DIV;
          break;
        case SLASH2:
          op = Operator.FLOOR_DIV;
          break;
        case PERCENT:
          op = Operator.MOD;
          break;
        default:
          return pn;
      }
      consumeToken();
      pn = RawIR.binOp(op, pn, factor()).srcref(pn);
    }
  }

  private RawNode factor() {
    Operator op;
    switch (peekToken()) {
      case PLUS:
        op = Operator.UADD;
        break;
      case MINUS:
        op = Operator.USUB;
        break;
      case TILDE:
        op = Operator.INVERT;
        break;
      default:
        return power();
    }
    consumeToken();
    int charno = ts.getCharno();
    return RawIR.unaryOp(op, factor()).setLinenoCharno(1, charno);
  }

  private RawNode power() {
    RawNode pn = atomExpr();
    if (matchToken(Kind.STAR2)) {
      pn = RawIR.binOp(Operator.POW, pn, factor()).srcref(pn);
    }
    return pn;
  }

  private RawNode atomExpr() {
    RawNode pn = atom();
    while (true) {
      switch (peekToken()) {
        case DOT:
          consumeToken();
          if (peekToken() != Kind.NAME || FragmentScanner.KEYWORDS.contains(ts.getString())) {
            throw reportError();
          }
          String attr = ts.getString();
          consumeToken();
          pn = RawIR.attribute(pn, attr).srcref(pn);
          break;
        case LP:
          consumeToken();
          pn = argumentList(pn);
          break;
        case LB:
          consumeToken();
          pn = RawIR.subscriptSlice(pn, subscriptList()).srcref(pn);
          mustMatchToken(Kind.RB);
          break;
        default:
          return pn;
      }
    }
  }

  /** The arguments of a call whose opening parenthesis has been consumed. */
  private RawNode argumentList(RawNode func) {
    List<RawNode> args = new ArrayList<>();
    List<RawNode> keywords = new ArrayList<>();
    while (peekToken() != Kind.RP) {
      if (matchToken(Kind.STAR)) {
        int charno = ts.getCharno();
        args.add(RawIR.starred(test()).setLinenoCharno(1, charno));
      } else if (matchToken(Kind.STAR2)) {
        int charno = ts.getCharno();
        keywords.add(RawIR.keyword(null, test()).setLinenoCharno(1, charno));
      } else {
        RawNode arg = test();
        if (matchToken(Kind.ASSIGN)) {
          if (!arg.isName()) {
            throw FragmentScanner.syntaxError(arg.getCharno());
          }
          keywords.add(RawIR.keyword(arg.getString(), test()).srcref(arg));
        } else if (!keywords.isEmpty()) {
          // Positional argument after a keyword argument.
          throw FragmentScanner.syntaxError(arg.getCharno());
        } else {
          args.add(arg);
        }
      }
      if (!matchToken(Kind.COMMA)) {
        break;
      }
    }
    mustMatchToken(Kind.RP);
    return RawIR.call(func, RawIR.list(args), RawIR.list(keywords)).srcref(func);
  }

  /** The slice of a subscript whose opening bracket has been consumed. */
  private RawNode subscriptList() {
    List<RawNode> dims = new ArrayList<>();
    boolean trailingComma = false;
    do {
      if (peekToken() == Kind.RB) {
        break;
      }
      dims.add(subscript());
      trailingComma = false;
      if (peekToken() == Kind.COMMA) {
        trailingComma = true;
      }
    } while (matchToken(Kind.COMMA));
    if (dims.isEmpty()) {
      throw reportError();
    }
    if (dims.size() == 1 && !trailingComma) {
      return dims.get(0);
    }
    boolean allIndexes = true;
    for (RawNode dim : dims) {
      allIndexes &= dim.getToken() == Token.INDEX;
    }
    if (!allIndexes) {
      return RawIR.extSlice(dims.toArray(new RawNode[0])).srcref(dims.get(0));
    }
    RawNode[] values = new RawNode[dims.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = dims.get(i).getFirstChild();
    }
    RawNode tuple = RawIR.tupleLit(values).srcref(values[0]);
    return RawIR.index(tuple).srcref(tuple);
  }

  private RawNode subscript() {
    RawNode lower = null;
    if (peekToken() != Kind.COLON) {
      lower = test();
      if (peekToken() != Kind.COLON) {
        return RawIR.index(lower).srcref(lower);
      }
    }
    mustMatchToken(Kind.COLON);
    int charno = lower != null ? lower.getCharno() : ts.getCharno();
    RawNode upper = startsExpression() ? test() : null;
    RawNode step = null;
    if (matchToken(Kind.COLON) && startsExpression()) {
      step = test();
    }
    return RawIR.slice(lower, upper, step).setLinenoCharno(1, charno);
  }

  private RawNode atom() {
    Kind tt = peekToken();
    int charno = ts.getCharno();
    switch (tt) {
      case NAME:
        {
          String name = ts.getString();
          consumeToken();
          if (name.equals("None") || name.equals("True") || name.equals("False")) {
            return RawIR.nameConstant(name).setLinenoCharno(1, charno);
          }
          if (FragmentScanner.KEYWORDS.contains(name)) {
            throw FragmentScanner.syntaxError(charno);
          }
          return RawIR.name(name).setLinenoCharno(1, charno);
        }
      case NUMBER:
        {
          Number value = ts.getNumber();
          boolean imaginary = ts.isImaginary();
          consumeToken();
          RawNode n;
          if (imaginary) {
            n = RawIR.imaginary(value.doubleValue());
          } else if (value instanceof BigInteger) {
            n = RawIR.num((BigInteger) value);
          } else {
            n = RawIR.num(value.doubleValue());
          }
          return n.setLinenoCharno(1, charno);
        }
      case STRING:
        return strings(charno);
      case ELLIPSIS:
        consumeToken();
        return RawIR.ellipsis().setLinenoCharno(1, charno);
      case LP:
        {
          consumeToken();
          if (matchToken(Kind.RP)) {
            return RawIR.tupleLit().setLinenoCharno(1, charno);
          }
          RawNode inner = testList();
          mustMatchToken(Kind.RP);
          if (inner.getToken() == Token.TUPLE_LIT) {
            inner.setLinenoCharno(1, charno);
          }
          return inner;
        }
      case LB:
        {
          consumeToken();
          List<RawNode> items = new ArrayList<>();
          while (peekToken() != Kind.RB) {
            items.add(test());
            if (!matchToken(Kind.COMMA)) {
              break;
            }
          }
          mustMatchToken(Kind.RB);
          return RawIR.listLit(items.toArray(new RawNode[0])).setLinenoCharno(1, charno);
        }
      default:
        throw reportError();
    }
  }

  /** One or more adjacent string literals, concatenated. */
  private RawNode strings(int charno) {
    StringBuilder sb = new StringBuilder();
    boolean isBytes = ts.isBytes();
    while (peekToken() == Kind.STRING) {
      if (ts.isBytes() != isBytes) {
        throw reportError();
      }
      sb.append(ts.getString());
      consumeToken();
    }
    RawNode n =
        isBytes
            ? RawIR.bytes(sb.toString().getBytes(StandardCharsets.ISO_8859_1))
            : RawIR.str(sb.toString());
    return n.setLinenoCharno(1, charno);
  }
}
