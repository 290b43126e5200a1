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
import com.google.pyfrontend.ast.ArgKind;
import com.google.pyfrontend.ast.AwaitExpr;
import com.google.pyfrontend.ast.Block;
import com.google.pyfrontend.ast.BytesExpr;
import com.google.pyfrontend.ast.CallExpr;
import com.google.pyfrontend.ast.ComparisonExpr;
import com.google.pyfrontend.ast.ComplexExpr;
import com.google.pyfrontend.ast.Comprehension;
import com.google.pyfrontend.ast.ConditionalExpr;
import com.google.pyfrontend.ast.DictExpr;
import com.google.pyfrontend.ast.DictionaryComprehension;
import com.google.pyfrontend.ast.EllipsisExpr;
import com.google.pyfrontend.ast.Expression;
import com.google.pyfrontend.ast.FloatExpr;
import com.google.pyfrontend.ast.GeneratorExpr;
import com.google.pyfrontend.ast.IndexExpr;
import com.google.pyfrontend.ast.IntExpr;
import com.google.pyfrontend.ast.LambdaExpr;
import com.google.pyfrontend.ast.ListComprehension;
import com.google.pyfrontend.ast.ListExpr;
import com.google.pyfrontend.ast.MemberExpr;
import com.google.pyfrontend.ast.NameExpr;
import com.google.pyfrontend.ast.OpExpr;
import com.google.pyfrontend.ast.ReturnStmt;
import com.google.pyfrontend.ast.SetComprehension;
import com.google.pyfrontend.ast.SetExpr;
import com.google.pyfrontend.ast.SliceExpr;
import com.google.pyfrontend.ast.StarExpr;
import com.google.pyfrontend.ast.StrExpr;
import com.google.pyfrontend.ast.SuperExpr;
import com.google.pyfrontend.ast.TupleExpr;
import com.google.pyfrontend.ast.UnaryExpr;
import com.google.pyfrontend.ast.YieldExpr;
import com.google.pyfrontend.ast.YieldFromExpr;
import com.google.pyfrontend.rawtree.ExprContext;
import com.google.pyfrontend.rawtree.Operator;
import com.google.pyfrontend.rawtree.RawNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Converts raw expressions. Every semantic expression is positioned at its raw node. */
final class ExpressionConverter {

  private final AstConverter converter;

  ExpressionConverter(AstConverter converter) {
    this.converter = converter;
  }

  Expression convert(RawNode n) {
    return SourcePositions.tag(convertUntagged(n), n);
  }

  private Expression convertUntagged(RawNode n) {
    switch (n.getToken()) {
      case BOOL_OP:
        return group(Operators.symbol(n.getOperator()), convertAll(n.children()), n);
      case BIN_OP:
        return new OpExpr(
            Operators.symbol(n.getOperator()),
            convert(n.getFirstChild()),
            convert(n.getSecondChild()));
      case UNARY_OP:
        return new UnaryExpr(Operators.symbol(n.getOperator()), convert(n.getFirstChild()));
      case LAMBDA:
        return convertLambda(n);
      case IF_EXP:
        return new ConditionalExpr(
            convert(n.getFirstChild()), convert(n.getSecondChild()), convert(n.getChildAtIndex(2)));
      case DICT_LIT:
        return convertDict(n);
      case SET_LIT:
        return new SetExpr(convertAll(n.children()));
      case LIST_COMP:
        return new ListComprehension(generator(n));
      case SET_COMP:
        return new SetComprehension(generator(n));
      case GENERATOR_EXP:
        return generatorExpr(n);
      case DICT_COMP:
        return new DictionaryComprehension(
            convert(n.getFirstChild()), convert(n.getSecondChild()), clauses(n.childrenFrom(2)));
      case AWAIT:
        return new AwaitExpr(convert(n.getFirstChild()));
      case YIELD:
        return new YieldExpr(converter.convertOptionalExpression(n.getFirstChild()));
      case YIELD_FROM:
        return new YieldFromExpr(convert(n.getFirstChild()));
      case COMPARE:
        return convertCompare(n);
      case CALL:
        return convertCall(n);
      case NUM:
        return convertNum(n);
      case STR:
        return new StrExpr(n.getString());
      case JOINED_STR:
        return convertJoinedStr(n);
      case FORMATTED_VALUE:
        return convertFormattedValue(n);
      case BYTES:
        return new BytesExpr(bytesToHumanReadableRepr(n.getBytes()));
      case NAME_CONSTANT:
        return new NameExpr(n.getString());
      case ELLIPSIS:
        return new EllipsisExpr();
      case ATTRIBUTE:
        return convertAttribute(n);
      case SUBSCRIPT:
        return new IndexExpr(convert(n.getFirstChild()), convertSlice(n.getSecondChild()));
      case STARRED:
        return new StarExpr(convert(n.getFirstChild()));
      case NAME:
        return new NameExpr(n.getString());
      case LIST_LIT:
        // [x, y] = z assigns exactly like (x, y) = z.
        if (n.getContext() == ExprContext.STORE) {
          return new TupleExpr(convertAll(n.children()));
        }
        return new ListExpr(convertAll(n.children()));
      case TUPLE_LIT:
        return new TupleExpr(convertAll(n.children()));
      default:
        throw new IllegalStateException("Unexpected expression: " + n);
    }
  }

  private List<Expression> convertAll(List<RawNode> nodes) {
    return converter.convertExpressions(nodes);
  }

  /** Folds {@code a and b and c} into {@code a and (b and c)}. */
  private static OpExpr group(String op, List<Expression> vals, RawNode n) {
    if (vals.size() == 2) {
      return new OpExpr(op, vals.get(0), vals.get(1));
    }
    OpExpr rest = SourcePositions.tag(group(op, vals.subList(1, vals.size()), n), n);
    return new OpExpr(op, vals.get(0), rest);
  }

  private LambdaExpr convertLambda(RawNode n) {
    ReturnStmt body = SourcePositions.tag(new ReturnStmt(convert(n.getSecondChild())), n);
    Block block = new Block(ImmutableList.of(body));
    block.setLine(n.getLineno());
    return new LambdaExpr(converter.transformArgs(n.getFirstChild(), false), block);
  }

  private DictExpr convertDict(RawNode n) {
    List<RawNode> keys = n.getFirstChild().children();
    List<RawNode> values = n.getSecondChild().children();
    List<DictExpr.Item> items = new ArrayList<>(keys.size());
    for (int i = 0; i < keys.size(); i++) {
      items.add(
          new DictExpr.Item(
              converter.convertOptionalExpression(keys.get(i)), convert(values.get(i))));
    }
    return new DictExpr(items);
  }

  // Comprehensions

  private GeneratorExpr generatorExpr(RawNode n) {
    return new GeneratorExpr(convert(n.getFirstChild()), clauses(n.childrenFrom(1)));
  }

  /** The generator inside a list or set comprehension, positioned like the comprehension. */
  private GeneratorExpr generator(RawNode n) {
    return SourcePositions.tag(generatorExpr(n), n);
  }

  private ImmutableList<Comprehension> clauses(List<RawNode> generators) {
    ImmutableList.Builder<Comprehension> clauses = ImmutableList.builder();
    for (RawNode g : generators) {
      clauses.add(
          new Comprehension(
              convert(g.getFirstChild()),
              convert(g.getSecondChild()),
              ImmutableList.copyOf(convertAll(g.getChildAtIndex(2).children())),
              g.getBooleanProp(RawNode.Prop.IS_ASYNC)));
    }
    return clauses.build();
  }

  private ComparisonExpr convertCompare(RawNode n) {
    List<String> operators = new ArrayList<>();
    for (Operator op : n.getCompareOps()) {
      operators.add(Operators.symbol(op));
    }
    return new ComparisonExpr(operators, convertAll(n.children()));
  }

  /** Flattens positional, star, keyword and double-star arguments, in that order. */
  private CallExpr convertCall(RawNode n) {
    List<Expression> args = new ArrayList<>();
    List<ArgKind> kinds = new ArrayList<>();
    List<@Nullable String> names = new ArrayList<>();
    for (RawNode a : n.getSecondChild().children()) {
      if (a.isStarred()) {
        args.add(convert(a.getFirstChild()));
        kinds.add(ArgKind.STAR);
      } else {
        args.add(convert(a));
        kinds.add(ArgKind.POSITIONAL);
      }
      names.add(null);
    }
    for (RawNode k : n.getChildAtIndex(2).children()) {
      args.add(convert(k.getFirstChild()));
      kinds.add(k.getString() == null ? ArgKind.STAR2 : ArgKind.NAMED);
      names.add(k.getString());
    }
    return new CallExpr(convert(n.getFirstChild()), args, kinds, names);
  }

  private static Expression convertNum(RawNode n) {
    Number value = n.getNumber();
    if (n.getBooleanProp(RawNode.Prop.IMAGINARY)) {
      return new ComplexExpr(0, value.doubleValue());
    } else if (value instanceof BigInteger) {
      return new IntExpr((BigInteger) value);
    }
    return new FloatExpr(value.doubleValue());
  }

  // Strings

  /** {@code f'x{y}'} becomes {@code ''.join(['x', '{}'.format(y)])}. */
  private CallExpr convertJoinedStr(RawNode n) {
    StrExpr emptyString = SourcePositions.tag(new StrExpr(""), n);
    ListExpr strsToJoin =
        SourcePositions.tag(new ListExpr(convertAll(n.children())), emptyString);
    MemberExpr joinMethod =
        SourcePositions.tag(new MemberExpr(emptyString, "join"), emptyString);
    return new CallExpr(
        joinMethod,
        ImmutableList.of(strsToJoin),
        ImmutableList.of(ArgKind.POSITIONAL),
        nullName());
  }

  /**
   * {@code {x!r:>10}} becomes {@code '{}'.format(x)}. Conversion flags and format specs are
   * dropped.
   */
  private CallExpr convertFormattedValue(RawNode n) {
    Expression value = SourcePositions.tag(convert(n.getFirstChild()), n);
    StrExpr formatString = SourcePositions.tag(new StrExpr("{}"), n);
    MemberExpr formatMethod =
        SourcePositions.tag(new MemberExpr(formatString, "format"), formatString);
    return new CallExpr(
        formatMethod, ImmutableList.of(value), ImmutableList.of(ArgKind.POSITIONAL), nullName());
  }

  private static List<@Nullable String> nullName() {
    List<@Nullable String> names = new ArrayList<>(1);
    names.add(null);
    return names;
  }

  /**
   * Renders bytes the way a bytes literal prints, without the {@code b'...'} wrapper. Double
   * quotes are used when the value contains a single quote and no double quote.
   */
  static String bytesToHumanReadableRepr(byte[] bytes) {
    boolean hasSingle = false;
    boolean hasDouble = false;
    for (byte b : bytes) {
      hasSingle |= b == '\'';
      hasDouble |= b == '"';
    }
    char quote = hasSingle && !hasDouble ? '"' : '\'';
    StringBuilder sb = new StringBuilder();
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c == quote || c == '\\') {
        sb.append('\\').append((char) c);
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c < ' ' || c >= 0x7f) {
        sb.append(String.format("\\x%02x", c));
      } else {
        sb.append((char) c);
      }
    }
    return sb.toString();
  }

  // Member access

  private Expression convertAttribute(RawNode n) {
    RawNode value = n.getFirstChild();
    if (value.isCall()
        && value.getFirstChild().isName()
        && "super".equals(value.getFirstChild().getString())) {
      return new SuperExpr(n.getString(), (CallExpr) convert(value));
    }
    return new MemberExpr(convert(value), n.getString());
  }

  private Expression convertSlice(RawNode slice) {
    switch (slice.getToken()) {
      case INDEX:
        return convert(slice.getFirstChild());
      case SLICE:
        return SourcePositions.tag(
            new SliceExpr(
                converter.convertOptionalExpression(slice.getFirstChild()),
                converter.convertOptionalExpression(slice.getSecondChild()),
                converter.convertOptionalExpression(slice.getChildAtIndex(2))),
            slice);
      case EXT_SLICE:
        List<Expression> dims = new ArrayList<>();
        for (RawNode dim : slice.children()) {
          dims.add(convertSlice(dim));
        }
        return SourcePositions.tag(new TupleExpr(dims), slice);
      default:
        throw new IllegalStateException("Unexpected subscript: " + slice);
    }
  }
}
