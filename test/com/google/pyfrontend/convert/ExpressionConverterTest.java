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

import static com.google.common.truth.Truth.assertThat;
import static com.google.pyfrontend.rawtree.RawIR.call;
import static com.google.pyfrontend.rawtree.RawIR.keyword;
import static com.google.pyfrontend.rawtree.RawIR.list;
import static com.google.pyfrontend.rawtree.RawIR.name;
import static com.google.pyfrontend.rawtree.RawIR.num;
import static com.google.pyfrontend.rawtree.RawIR.str;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.ast.ArgKind;
import com.google.pyfrontend.ast.AssignmentStmt;
import com.google.pyfrontend.ast.BytesExpr;
import com.google.pyfrontend.ast.CallExpr;
import com.google.pyfrontend.ast.ComparisonExpr;
import com.google.pyfrontend.ast.ComplexExpr;
import com.google.pyfrontend.ast.Comprehension;
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
import com.google.pyfrontend.ast.SliceExpr;
import com.google.pyfrontend.ast.StarExpr;
import com.google.pyfrontend.ast.StrExpr;
import com.google.pyfrontend.ast.SuperExpr;
import com.google.pyfrontend.ast.TupleExpr;
import com.google.pyfrontend.ast.UnaryExpr;
import com.google.pyfrontend.ast.YieldExpr;
import com.google.pyfrontend.rawtree.ExprContext;
import com.google.pyfrontend.rawtree.Operator;
import com.google.pyfrontend.rawtree.RawIR;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ExpressionConverter}. */
@RunWith(JUnit4.class)
public final class ExpressionConverterTest extends ConverterTestCase {

  // Operators

  @Test
  public void testBooleanOperationFoldsToTheRight() {
    OpExpr e =
        (OpExpr)
            convertExpression(
                RawIR.boolOp(Operator.AND, name("a"), name("b"), name("c")).setLinenoCharno(2, 4));
    assertThat(e.getOp()).isEqualTo("and");
    assertThat(((NameExpr) e.getLeft()).getName()).isEqualTo("a");
    OpExpr rest = (OpExpr) e.getRight();
    assertThat(rest.getOp()).isEqualTo("and");
    assertThat(((NameExpr) rest.getLeft()).getName()).isEqualTo("b");
    assertThat(((NameExpr) rest.getRight()).getName()).isEqualTo("c");
    assertThat(rest.getLine()).isEqualTo(2);
    assertThat(rest.getColumn()).isEqualTo(4);
  }

  @Test
  public void testTwoOperandBooleanOperation() {
    OpExpr e = (OpExpr) convertExpression(RawIR.boolOp(Operator.OR, name("a"), name("b")));
    assertThat(e.getOp()).isEqualTo("or");
    assertThat(e.getRight()).isInstanceOf(NameExpr.class);
  }

  @Test
  public void testBinaryOperators() {
    assertThat(binaryOp(Operator.MAT_MULT)).isEqualTo("@");
    assertThat(binaryOp(Operator.POW)).isEqualTo("**");
    assertThat(binaryOp(Operator.FLOOR_DIV)).isEqualTo("//");
    assertThat(binaryOp(Operator.BIT_XOR)).isEqualTo("^");
  }

  private String binaryOp(Operator op) {
    return ((OpExpr) convertExpression(RawIR.binOp(op, name("a"), name("b")))).getOp();
  }

  @Test
  public void testUnaryOperators() {
    UnaryExpr not = (UnaryExpr) convertExpression(RawIR.unaryOp(Operator.NOT, name("a")));
    assertThat(not.getOp()).isEqualTo("not");
    UnaryExpr invert = (UnaryExpr) convertExpression(RawIR.unaryOp(Operator.INVERT, name("a")));
    assertThat(invert.getOp()).isEqualTo("~");
    UnaryExpr minus = (UnaryExpr) convertExpression(RawIR.unaryOp(Operator.USUB, name("a")));
    assertThat(minus.getOp()).isEqualTo("-");
  }

  @Test
  public void testChainedComparison() {
    ComparisonExpr e =
        (ComparisonExpr)
            convertExpression(
                RawIR.compare(
                    name("a"),
                    ImmutableList.of(Operator.LT, Operator.IS_NOT, Operator.NOT_IN),
                    name("b"),
                    name("c"),
                    name("d")));
    assertThat(e.getOperators()).containsExactly("<", "is not", "not in").inOrder();
    assertThat(e.getOperands()).hasSize(4);
  }

  // Calls

  @Test
  public void testCallArgumentsAreFlattened() {
    CallExpr e =
        (CallExpr)
            convertExpression(
                call(
                    name("f"),
                    list(name("a"), RawIR.starred(name("rest"))),
                    list(keyword("k", num(1)), keyword(null, name("kw")))));
    assertThat(((NameExpr) e.getCallee()).getName()).isEqualTo("f");
    assertThat(e.getArgKinds())
        .containsExactly(ArgKind.POSITIONAL, ArgKind.STAR, ArgKind.NAMED, ArgKind.STAR2)
        .inOrder();
    assertThat(e.getArgNames()).containsExactly(null, null, "k", null).inOrder();
    assertThat(((NameExpr) e.getArgs().get(1)).getName()).isEqualTo("rest");
    assertThat(((NameExpr) e.getArgs().get(3)).getName()).isEqualTo("kw");
  }

  @Test
  public void testSuperCall() {
    SuperExpr e =
        (SuperExpr) convertExpression(RawIR.attribute(call(name("super")), "__init__"));
    assertThat(e.getName()).isEqualTo("__init__");
    assertThat(e.getCall().getArgs()).isEmpty();
  }

  @Test
  public void testAttributeOfOtherCall() {
    MemberExpr e = (MemberExpr) convertExpression(RawIR.attribute(call(name("get")), "x"));
    assertThat(e.getName()).isEqualTo("x");
    assertThat(e.getExpr()).isInstanceOf(CallExpr.class);
  }

  // Literals

  @Test
  public void testNumbers() {
    IntExpr i = (IntExpr) convertExpression(num(new BigInteger("123456789012345678901234567890")));
    assertThat(i.getValue()).isEqualTo(new BigInteger("123456789012345678901234567890"));
    FloatExpr f = (FloatExpr) convertExpression(num(1.5));
    assertThat(f.getValue()).isEqualTo(1.5);
    ComplexExpr c = (ComplexExpr) convertExpression(RawIR.imaginary(2.0));
    assertThat(c.getReal()).isEqualTo(0.0);
    assertThat(c.getImag()).isEqualTo(2.0);
  }

  @Test
  public void testNameConstantBecomesName() {
    NameExpr e = (NameExpr) convertExpression(RawIR.nameConstant("True"));
    assertThat(e.getName()).isEqualTo("True");
  }

  @Test
  public void testEllipsis() {
    assertThat(convertExpression(RawIR.ellipsis())).isInstanceOf(EllipsisExpr.class);
  }

  @Test
  public void testBytes() {
    BytesExpr e =
        (BytesExpr) convertExpression(RawIR.bytes("a\n\u0000".getBytes(StandardCharsets.UTF_8)));
    assertThat(e.getValue()).isEqualTo("a\\n\\x00");
  }

  @Test
  public void testBytesRepr() {
    assertThat(ExpressionConverter.bytesToHumanReadableRepr(bytes("it's"))).isEqualTo("it's");
    assertThat(ExpressionConverter.bytesToHumanReadableRepr(bytes("'\""))).isEqualTo("\\'\"");
    assertThat(ExpressionConverter.bytesToHumanReadableRepr(bytes("a\\b\t")))
        .isEqualTo("a\\\\b\\t");
    assertThat(ExpressionConverter.bytesToHumanReadableRepr(new byte[] {(byte) 0xff, 0x7f}))
        .isEqualTo("\\xff\\x7f");
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.US_ASCII);
  }

  @Test
  public void testDictWithMappingUnpacking() {
    DictExpr e =
        (DictExpr)
            convertExpression(
                RawIR.dict(list(str("a"), RawIR.empty()), list(num(1), name("other"))));
    assertThat(e.getItems()).hasSize(2);
    assertThat(((StrExpr) e.getItems().get(0).key()).getValue()).isEqualTo("a");
    assertThat(e.getItems().get(1).key()).isNull();
    assertThat(((NameExpr) e.getItems().get(1).value()).getName()).isEqualTo("other");
  }

  @Test
  public void testStoreListIsATuple() {
    AssignmentStmt s =
        (AssignmentStmt)
            convertStatement(
                RawIR.assign(
                    RawIR.listLit(name("a"), name("b")).setContext(ExprContext.STORE),
                    RawIR.listLit(num(1), num(2))));
    assertThat(s.getLvalues().get(0)).isInstanceOf(TupleExpr.class);
    assertThat(s.getRvalue()).isInstanceOf(ListExpr.class);
  }

  // Formatted strings

  @Test
  public void testFormattedString() {
    CallExpr join =
        (CallExpr)
            convertExpression(
                RawIR.joinedStr(str("x="), RawIR.formattedValue(name("x"), -1, null))
                    .setLinenoCharno(5, 2));
    MemberExpr joinMethod = (MemberExpr) join.getCallee();
    assertThat(joinMethod.getName()).isEqualTo("join");
    assertThat(((StrExpr) joinMethod.getExpr()).getValue()).isEmpty();
    assertThat(joinMethod.getLine()).isEqualTo(5);

    ListExpr parts = (ListExpr) join.getArgs().get(0);
    assertThat(((StrExpr) parts.getItems().get(0)).getValue()).isEqualTo("x=");
    CallExpr format = (CallExpr) parts.getItems().get(1);
    MemberExpr formatMethod = (MemberExpr) format.getCallee();
    assertThat(formatMethod.getName()).isEqualTo("format");
    assertThat(((StrExpr) formatMethod.getExpr()).getValue()).isEqualTo("{}");
    assertThat(((NameExpr) format.getArgs().get(0)).getName()).isEqualTo("x");
  }

  @Test
  public void testFormattedValueDropsConversionAndFormatSpec() {
    CallExpr format =
        (CallExpr) convertExpression(RawIR.formattedValue(name("x"), 'r', str(">10")));
    MemberExpr formatMethod = (MemberExpr) format.getCallee();
    assertThat(((StrExpr) formatMethod.getExpr()).getValue()).isEqualTo("{}");
    assertThat(format.getArgs()).hasSize(1);
    assertThat(((NameExpr) format.getArgs().get(0)).getName()).isEqualTo("x");
  }

  // Subscripts

  @Test
  public void testIndex() {
    IndexExpr e = (IndexExpr) convertExpression(RawIR.subscript(name("a"), num(0)));
    assertThat(e.getIndex()).isInstanceOf(IntExpr.class);
  }

  @Test
  public void testSlice() {
    IndexExpr e =
        (IndexExpr)
            convertExpression(
                RawIR.subscriptSlice(
                    name("a"), RawIR.slice(num(1), null, num(2)).setLinenoCharno(1, 2)));
    SliceExpr slice = (SliceExpr) e.getIndex();
    assertThat(slice.getBeginIndex()).isNotNull();
    assertThat(slice.getEndIndex()).isNull();
    assertThat(slice.getStride()).isNotNull();
    assertThat(slice.getColumn()).isEqualTo(2);
  }

  @Test
  public void testExtendedSlice() {
    IndexExpr e =
        (IndexExpr)
            convertExpression(
                RawIR.subscriptSlice(
                    name("a"),
                    RawIR.extSlice(RawIR.slice(null, null, null), RawIR.index(num(0)))));
    TupleExpr dims = (TupleExpr) e.getIndex();
    assertThat(dims.getItems().get(0)).isInstanceOf(SliceExpr.class);
    assertThat(dims.getItems().get(1)).isInstanceOf(IntExpr.class);
  }

  // Comprehensions and lambdas

  @Test
  public void testListComprehension() {
    ListComprehension e =
        (ListComprehension)
            convertExpression(
                RawIR.listComp(
                        name("x"),
                        RawIR.comprehension(name("x"), name("xs"), list(name("x")), false))
                    .setLinenoCharno(3, 1));
    GeneratorExpr generator = e.getGenerator();
    assertThat(generator.getLine()).isEqualTo(3);
    assertThat(generator.getColumn()).isEqualTo(1);
    Comprehension clause = generator.getClauses().get(0);
    assertThat(clause.conditions()).hasSize(1);
    assertThat(clause.isAsync()).isFalse();
  }

  @Test
  public void testDictComprehensionWithAsyncClauses() {
    DictionaryComprehension e =
        (DictionaryComprehension)
            convertExpression(
                RawIR.dictComp(
                    name("k"),
                    name("v"),
                    RawIR.comprehension(name("k"), name("ks"), list(), true),
                    RawIR.comprehension(name("v"), name("vs"), list(), false)));
    assertThat(e.getClauses()).hasSize(2);
    assertThat(e.getClauses().get(0).isAsync()).isTrue();
  }

  @Test
  public void testLambda() {
    LambdaExpr e =
        (LambdaExpr)
            convertExpression(
                RawIR.lambda(RawIR.arguments(RawIR.arg("x")), name("x")).setLinenoCharno(4, 6));
    assertThat(e.getArguments()).hasSize(1);
    assertThat(e.getBody().getLine()).isEqualTo(4);
    ReturnStmt ret = (ReturnStmt) e.getBody().getBody().get(0);
    assertThat(ret.getLine()).isEqualTo(4);
    assertThat(ret.getColumn()).isEqualTo(6);
  }

  @Test
  public void testYieldAndStar() {
    assertThat(((YieldExpr) convertExpression(RawIR.yield(null))).getExpr()).isNull();
    StarExpr star = (StarExpr) convertExpression(RawIR.starred(name("a")));
    assertThat(star.getExpr()).isInstanceOf(NameExpr.class);
  }

  // Positions

  @Test
  public void testPositionsAreCopied() {
    Expression e = convertExpression(name("x").setLinenoCharno(9, 13));
    assertThat(e.getLine()).isEqualTo(9);
    assertThat(e.getColumn()).isEqualTo(13);
  }
}
