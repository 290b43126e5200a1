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
import static org.junit.Assert.assertThrows;

import com.google.pyfrontend.rawtree.FragmentParser;
import com.google.pyfrontend.rawtree.RawSyntaxException;
import com.google.pyfrontend.types.AnyType;
import com.google.pyfrontend.types.CallableArgument;
import com.google.pyfrontend.types.EllipsisType;
import com.google.pyfrontend.types.TupleType;
import com.google.pyfrontend.types.Type;
import com.google.pyfrontend.types.TypeList;
import com.google.pyfrontend.types.UnboundType;
import com.google.pyfrontend.types.UnresolvedInstance;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TypeConverter}. */
@RunWith(JUnit4.class)
public final class TypeConverterTest extends ConverterTestCase {

  private static final int LINE = 12;

  private DiagnosticReporter reporter;

  @Override
  @Before
  public void setUp() throws Exception {
    super.setUp();
    reporter = new DiagnosticReporter(FILE_NAME, errorManager);
  }

  private Type parse(String typeComment) {
    return TypeConverter.parseTypeComment(typeComment, LINE, reporter);
  }

  private Type parseValid(String typeComment) {
    Type type = parse(typeComment);
    assertNoDiagnostics();
    return type;
  }

  @Test
  public void testName() {
    UnboundType t = (UnboundType) parseValid("int");
    assertThat(t.getName()).isEqualTo("int");
    assertThat(t.getArgs()).isEmpty();
    assertThat(t.getLine()).isEqualTo(LINE);
  }

  @Test
  public void testNoneIsAName() {
    assertThat(((UnboundType) parseValid("None")).getName()).isEqualTo("None");
  }

  @Test
  public void testGenericArgument() {
    UnboundType t = (UnboundType) parseValid("List[int]");
    assertThat(t.getName()).isEqualTo("List");
    assertThat(t.getArgs()).hasSize(1);
    assertThat(((UnboundType) t.getArgs().get(0)).getName()).isEqualTo("int");
    assertThat(t.hasEmptyTupleIndex()).isFalse();
  }

  @Test
  public void testSeveralGenericArguments() {
    assertThat(parseValid("Dict[str, List[int]]").toString()).isEqualTo("Dict?[str?, List?[int?]]");
  }

  @Test
  public void testEmptyTupleIndex() {
    UnboundType t = (UnboundType) parseValid("Tuple[()]");
    assertThat(t.getName()).isEqualTo("Tuple");
    assertThat(t.getArgs()).isEmpty();
    assertThat(t.hasEmptyTupleIndex()).isTrue();
  }

  @Test
  public void testEllipsis() {
    assertThat(parseValid("...")).isInstanceOf(EllipsisType.class);
  }

  @Test
  public void testImplicitTuple() {
    TupleType t = (TupleType) parseValid("int, str");
    assertThat(t.getItems()).hasSize(2);
    assertThat(t.isImplicit()).isTrue();
    assertThat(t.getFallback()).isSameInstanceAs(UnresolvedInstance.MISSING_FALLBACK);
  }

  @Test
  public void testDottedName() {
    assertThat(((UnboundType) parseValid("typing.List")).getName()).isEqualTo("typing.List");
    assertThat(parseValid("a.b.C[int]").toString()).isEqualTo("a.b.C?[int?]");
  }

  @Test
  public void testQuotedForwardReference() {
    assertThat(parseValid("' List[int] '").toString()).isEqualTo("List?[int?]");
  }

  @Test
  public void testTypeListInCallable() {
    UnboundType t = (UnboundType) parseValid("Callable[[int, str], None]");
    TypeList argList = (TypeList) t.getArgs().get(0);
    assertThat(argList.getItems()).hasSize(2);
  }

  @Test
  public void testArgumentConstructor() {
    UnboundType t = (UnboundType) parseValid("Callable[[Arg(int, 'x')], int]");
    TypeList argList = (TypeList) t.getArgs().get(0);
    CallableArgument a = (CallableArgument) argList.getItems().get(0);
    assertThat(a.getConstructor()).isEqualTo("Arg");
    assertThat(a.getName()).isEqualTo("x");
    assertThat(((UnboundType) a.getType()).getName()).isEqualTo("int");
  }

  @Test
  public void testArgumentConstructorKeywords() {
    UnboundType t = (UnboundType) parseValid("Callable[[DefaultArg(type=int, name='y')], int]");
    CallableArgument a = (CallableArgument) ((TypeList) t.getArgs().get(0)).getItems().get(0);
    assertThat(a.getConstructor()).isEqualTo("DefaultArg");
    assertThat(a.getName()).isEqualTo("y");
    assertThat(a.getType().toString()).isEqualTo("int?");
  }

  @Test
  public void testArgumentConstructorWithoutName() {
    UnboundType t = (UnboundType) parseValid("Callable[[Arg(int, None), VarArg()], int]");
    TypeList argList = (TypeList) t.getArgs().get(0);
    assertThat(((CallableArgument) argList.getItems().get(0)).getName()).isNull();
    CallableArgument varArg = (CallableArgument) argList.getItems().get(1);
    assertThat(varArg.getType()).isInstanceOf(AnyType.class);
  }

  @Test
  public void testArgumentConstructorTooManyArguments() {
    parse("Callable[[Arg(int, 'x', 'y')], int]");
    assertDiagnostics(ConverterDiagnostics.ARG_CONSTRUCTOR_TOO_MANY_ARGUMENTS);
  }

  @Test
  public void testEachExtraConstructorArgumentIsReported() {
    parse("Callable[[Arg(int, 'x', 'y', 'z')], int]");
    assertDiagnostics(
        ConverterDiagnostics.ARG_CONSTRUCTOR_TOO_MANY_ARGUMENTS,
        ConverterDiagnostics.ARG_CONSTRUCTOR_TOO_MANY_ARGUMENTS);
    List<PyError> errors = errorManager.getSortedDiagnostics();
    assertThat(errors.get(0).lineno()).isEqualTo(LINE);
    assertThat(errors.get(0).charno()).isEqualTo(24);
    assertThat(errors.get(1).charno()).isEqualTo(29);
  }

  @Test
  public void testArgumentConstructorMultipleValues() {
    parse("Callable[[Arg(int, 'x', name='y')], int]");
    PyError error = onlyDiagnostic();
    assertThat(error.type()).isEqualTo(ConverterDiagnostics.ARG_CONSTRUCTOR_MULTIPLE_VALUES);
    assertThat(error.description())
        .isEqualTo("\"Arg\" gets multiple values for keyword argument \"name\"");
  }

  @Test
  public void testArgumentConstructorUnexpectedKeyword() {
    parse("Callable[[Arg(int, foo=1)], int]");
    PyError error = onlyDiagnostic();
    assertThat(error.description())
        .isEqualTo("Unexpected argument \"foo\" for argument constructor");
  }

  @Test
  public void testArgumentNameMustBeAString() {
    parse("Callable[[Arg(int, 1)], int]");
    PyError error = onlyDiagnostic();
    assertThat(error.description())
        .isEqualTo("Expected string literal for argument name, got Num");
  }

  @Test
  public void testArgumentConstructorOutsideList() {
    Type t = parse("Arg(int, 'x')");
    assertThat(((AnyType) t).isFromError()).isTrue();
    assertDiagnostics(
        ConverterDiagnostics.INVALID_TYPE_EXPRESSION, ConverterDiagnostics.USE_SUBSCRIPT);
    assertThat(errorManager.getNotes().get(0).description())
        .isEqualTo("Suggestion: use Arg[...] instead of Arg(...)");
  }

  @Test
  public void testListOutsideSubscript() {
    Type t = parse("[int]");
    assertThat(((AnyType) t).isFromError()).isTrue();
    assertDiagnostics(ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
  }

  @Test
  public void testUnsupportedExpression() {
    parse("x + y");
    PyError error = onlyDiagnostic();
    assertThat(error.type()).isEqualTo(ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
    assertThat(error.lineno()).isEqualTo(LINE);
  }

  @Test
  public void testInvalidSiblingDoesNotStopEvaluation() {
    UnboundType t = (UnboundType) parse("Dict[1, str]");
    assertDiagnostics(ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
    assertThat(((AnyType) t.getArgs().get(0)).isFromError()).isTrue();
    assertThat(t.getArgs().get(1).toString()).isEqualTo("str?");
  }

  @Test
  public void testSubscriptOfGenericIsInvalid() {
    parse("List[int][str]");
    assertDiagnostics(ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
  }

  @Test
  public void testAttributeOfGenericIsInvalid() {
    parse("List[int].x");
    assertDiagnostics(ConverterDiagnostics.INVALID_TYPE_EXPRESSION);
  }

  @Test
  public void testSliceIsASyntaxError() {
    parse("List[1:2]");
    assertDiagnostics(ConverterDiagnostics.TYPE_COMMENT_SYNTAX_ERROR);
  }

  @Test
  public void testUnparsableComment() {
    assertThat(parse("List[")).isNull();
    PyError error = onlyDiagnostic();
    assertThat(error.type()).isEqualTo(ConverterDiagnostics.TYPE_COMMENT_SYNTAX_ERROR);
    assertThat(error.lineno()).isEqualTo(LINE);
    assertThat(error.sourceName()).isEqualTo(FILE_NAME);
  }

  @Test
  public void testUnparsableCommentWithoutReporterThrows() {
    assertThrows(
        RawSyntaxException.class, () -> TypeConverter.parseTypeComment("List[", LINE, null));
  }

  @Test
  public void testStringifyName() {
    assertThat(TypeConverter.stringifyName(FragmentParser.parseExpression("a.b.c")))
        .isEqualTo("a.b.c");
    assertThat(TypeConverter.stringifyName(FragmentParser.parseExpression("a().b"))).isNull();
  }
}
