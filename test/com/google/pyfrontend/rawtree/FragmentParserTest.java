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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FragmentParser}. */
@RunWith(JUnit4.class)
public final class FragmentParserTest {

  @Test
  public void testName() {
    RawNode n = FragmentParser.parseExpression("  int");
    assertThat(n.getToken()).isEqualTo(Token.NAME);
    assertThat(n.getString()).isEqualTo("int");
    assertThat(n.getLineno()).isEqualTo(1);
    assertThat(n.getCharno()).isEqualTo(2);
  }

  @Test
  public void testGenericType() {
    RawNode n = FragmentParser.parseExpression("Dict[str, List[int]]");
    assertThat(n.getToken()).isEqualTo(Token.SUBSCRIPT);
    assertThat(n.getFirstChild().getString()).isEqualTo("Dict");
    RawNode index = n.getSecondChild();
    assertThat(index.getToken()).isEqualTo(Token.INDEX);
    RawNode params = index.getFirstChild();
    assertThat(params.getToken()).isEqualTo(Token.TUPLE_LIT);
    assertThat(params.getChildCount()).isEqualTo(2);
    assertThat(params.getSecondChild().getToken()).isEqualTo(Token.SUBSCRIPT);
  }

  @Test
  public void testEmptyTupleIndex() {
    RawNode n = FragmentParser.parseExpression("Tuple[()]");
    RawNode tuple = n.getSecondChild().getFirstChild();
    assertThat(tuple.getToken()).isEqualTo(Token.TUPLE_LIT);
    assertThat(tuple.hasChildren()).isFalse();
  }

  @Test
  public void testTrailingCommaMakesTupleIndex() {
    RawNode n = FragmentParser.parseExpression("Tuple[int,]");
    RawNode tuple = n.getSecondChild().getFirstChild();
    assertThat(tuple.getToken()).isEqualTo(Token.TUPLE_LIT);
    assertThat(tuple.getChildCount()).isEqualTo(1);
  }

  @Test
  public void testSlices() {
    RawNode simple = FragmentParser.parseExpression("a[1:2]").getSecondChild();
    assertThat(simple.getToken()).isEqualTo(Token.SLICE);
    assertThat(simple.getChildAtIndex(2).isEmpty()).isTrue();

    RawNode ext = FragmentParser.parseExpression("a[:, 0]").getSecondChild();
    assertThat(ext.getToken()).isEqualTo(Token.EXT_SLICE);
    assertThat(ext.getFirstChild().getToken()).isEqualTo(Token.SLICE);
    assertThat(ext.getSecondChild().getToken()).isEqualTo(Token.INDEX);
  }

  @Test
  public void testImplicitTuple() {
    RawNode n = FragmentParser.parseExpression("int, str");
    assertThat(n.getToken()).isEqualTo(Token.TUPLE_LIT);
    assertThat(n.getChildCount()).isEqualTo(2);
  }

  @Test
  public void testDottedName() {
    RawNode n = FragmentParser.parseExpression("typing.List");
    assertThat(n.getToken()).isEqualTo(Token.ATTRIBUTE);
    assertThat(n.getString()).isEqualTo("List");
    assertThat(n.getFirstChild().getString()).isEqualTo("typing");
  }

  @Test
  public void testStringsAreConcatenated() {
    RawNode n = FragmentParser.parseExpression("'List' \"[int]\"");
    assertThat(n.getToken()).isEqualTo(Token.STR);
    assertThat(n.getString()).isEqualTo("List[int]");
  }

  @Test
  public void testBytes() {
    RawNode n = FragmentParser.parseExpression("b'ab'");
    assertThat(n.getToken()).isEqualTo(Token.BYTES);
    assertThat(n.getBytes()).isEqualTo(new byte[] {'a', 'b'});
  }

  @Test
  public void testNumbers() {
    assertThat(FragmentParser.parseExpression("42").getNumber()).isEqualTo(BigInteger.valueOf(42));
    RawNode imaginary = FragmentParser.parseExpression("2j");
    assertThat(imaginary.getBooleanProp(RawNode.Prop.IMAGINARY)).isTrue();
  }

  @Test
  public void testConstantsAndEllipsis() {
    assertThat(FragmentParser.parseExpression("None").isNameConstant("None")).isTrue();
    assertThat(FragmentParser.parseExpression("...").getToken()).isEqualTo(Token.ELLIPSIS);
  }

  @Test
  public void testCallWithKeywords() {
    RawNode n = FragmentParser.parseExpression("Arg(int, name='x', **kw)");
    assertThat(n.getToken()).isEqualTo(Token.CALL);
    assertThat(n.getSecondChild().getChildCount()).isEqualTo(1);
    RawNode keywords = n.getChildAtIndex(2);
    assertThat(keywords.getChildCount()).isEqualTo(2);
    assertThat(keywords.getFirstChild().getString()).isEqualTo("name");
    assertThat(keywords.getSecondChild().getString()).isNull();
  }

  @Test
  public void testOperators() {
    RawNode n = FragmentParser.parseExpression("a | b + c * d");
    assertThat(n.getToken()).isEqualTo(Token.BIN_OP);
    assertThat(n.getOperator()).isEqualTo(Operator.BIT_OR);
    RawNode sum = n.getSecondChild();
    assertThat(sum.getOperator()).isEqualTo(Operator.ADD);
    assertThat(sum.getSecondChild().getOperator()).isEqualTo(Operator.MULT);
  }

  @Test
  public void testBooleanAndComparison() {
    RawNode n = FragmentParser.parseExpression("a or not b and c is not d");
    assertThat(n.getToken()).isEqualTo(Token.BOOL_OP);
    assertThat(n.getOperator()).isEqualTo(Operator.OR);
    RawNode and = n.getSecondChild();
    assertThat(and.getOperator()).isEqualTo(Operator.AND);
    assertThat(and.getFirstChild().getOperator()).isEqualTo(Operator.NOT);
    assertThat(and.getSecondChild().getCompareOps()).containsExactly(Operator.IS_NOT);
  }

  @Test
  public void testFunctionType() {
    RawNode n = FragmentParser.parseFunctionType("(int, str) -> bool");
    assertThat(n.getToken()).isEqualTo(Token.FUNCTION_TYPE);
    assertThat(n.getFirstChild().getChildCount()).isEqualTo(2);
    assertThat(n.getSecondChild().getString()).isEqualTo("bool");
    assertThat(n.getCharno()).isEqualTo(1);
  }

  @Test
  public void testFunctionTypeWithoutArguments() {
    RawNode n = FragmentParser.parseFunctionType("() -> None");
    assertThat(n.getFirstChild().hasChildren()).isFalse();
    assertThat(n.getCharno()).isEqualTo(6);
  }

  @Test
  public void testFunctionTypeStarsAreDropped() {
    RawNode n = FragmentParser.parseFunctionType("(int, *str, **bool) -> None");
    RawNode argTypes = n.getFirstChild();
    assertThat(argTypes.getChildCount()).isEqualTo(3);
    assertThat(argTypes.getSecondChild().getToken()).isEqualTo(Token.NAME);
    assertThat(argTypes.getSecondChild().getString()).isEqualTo("str");
    assertThat(argTypes.getChildAtIndex(2).getString()).isEqualTo("bool");
  }

  @Test
  public void testTrailingCommentIsSkipped() {
    RawNode n = FragmentParser.parseExpression("List[int]  # noqa");
    assertThat(n.getToken()).isEqualTo(Token.SUBSCRIPT);
    assertThat(n.getFirstChild().getString()).isEqualTo("List");
  }

  @Test
  public void testFunctionTypeWithTrailingComment() {
    RawNode n = FragmentParser.parseFunctionType("(int) -> str  # why # and more");
    assertThat(n.getFirstChild().getChildCount()).isEqualTo(1);
    assertThat(n.getSecondChild().getString()).isEqualTo("str");
  }

  @Test
  public void testHashInsideStringIsNotAComment() {
    RawNode n = FragmentParser.parseExpression("'a#b'");
    assertThat(n.getString()).isEqualTo("a#b");
  }

  @Test
  public void testCommentOnlyIsAnError() {
    assertThrows(RawSyntaxException.class, () -> FragmentParser.parseExpression("# int"));
  }

  @Test
  public void testDoubleStarMustBeLast() {
    assertThrows(
        RawSyntaxException.class, () -> FragmentParser.parseFunctionType("(**a, b) -> None"));
  }

  @Test
  public void testFunctionTypeNeedsParentheses() {
    RawSyntaxException e =
        assertThrows(
            RawSyntaxException.class, () -> FragmentParser.parseFunctionType("int -> str"));
    assertThat(e.getLineno()).isEqualTo(1);
    assertThat(e.getOffset()).isEqualTo(1);
  }

  @Test
  public void testTrailingTokensAreAnError() {
    RawSyntaxException e =
        assertThrows(RawSyntaxException.class, () -> FragmentParser.parseExpression("int int"));
    assertThat(e.getOffset()).isEqualTo(5);
  }

  @Test
  public void testUnclosedSubscript() {
    assertThrows(RawSyntaxException.class, () -> FragmentParser.parseExpression("List["));
  }

  @Test
  public void testKeywordIsNotAName() {
    assertThrows(RawSyntaxException.class, () -> FragmentParser.parseExpression("lambda"));
  }

  @Test
  public void testUnknownCharacter() {
    RawSyntaxException e =
        assertThrows(RawSyntaxException.class, () -> FragmentParser.parseExpression("a $ b"));
    assertThat(e.getOffset()).isEqualTo(3);
  }
}
