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

package com.google.pyfrontend.ast;

import static com.google.common.truth.Truth.assertThat;
import static com.google.pyfrontend.rawtree.RawIR.arg;
import static com.google.pyfrontend.rawtree.RawIR.list;
import static com.google.pyfrontend.rawtree.RawIR.name;
import static com.google.pyfrontend.rawtree.RawIR.num;
import static com.google.pyfrontend.rawtree.RawIR.pass;

import com.google.common.collect.ImmutableList;
import com.google.pyfrontend.convert.ParserOptions;
import com.google.pyfrontend.convert.PyParser;
import com.google.pyfrontend.convert.SortingErrorManager;
import com.google.pyfrontend.rawtree.RawIR;
import com.google.pyfrontend.rawtree.RawNode;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AstPrinter}. */
@RunWith(JUnit4.class)
public final class AstPrinterTest {

  private static SemanticModule convert(RawNode... statements) {
    SortingErrorManager errorManager = new SortingErrorManager();
    SemanticModule module =
        PyParser.convert(RawIR.module(statements), "m.py", errorManager, new ParserOptions());
    assertThat(errorManager.getSortedDiagnostics()).isEmpty();
    return module;
  }

  @Test
  public void testFunction() {
    RawNode def =
        RawIR.functionDef(
                "f",
                RawIR.arguments(
                    list(arg("x"), arg("y")), list(num(1)), arg("rest"), list(), list(), null),
                list(pass().setLinenoCharno(2, 2)))
            .setLinenoCharno(1, 0);
    SemanticModule module = convert(def);
    assertThat(AstPrinter.print(module.getDefs().get(0)))
        .isEqualTo(
            """
            FuncDef:1(
              f
              Args(
                Var(x)
                Var(y))
              default(
                Var(y)
                IntExpr(1))
              VarArg(
                Var(rest))
              Block:1(
                PassStmt:2()))""");
  }

  @Test
  public void testAnnotatedFunctionPrintsItsSignature() {
    RawNode def =
        RawIR.functionDef(
                "g",
                RawIR.arguments(arg("x", name("int"))),
                list(pass().setLinenoCharno(1, 20)),
                list(),
                name("str"))
            .setLinenoCharno(1, 0);
    assertThat(AstPrinter.print(convert(def).getDefs().get(0)))
        .isEqualTo(
            """
            FuncDef:1(
              g
              Args(
                Var(x))
              def (x: int?) -> str?
              Block:1(
                PassStmt:1()))""");
  }

  @Test
  public void testModule() {
    SemanticModule module =
        PyParser.convert(
            RawIR.module(
                list(RawIR.importFrom(null, 1, RawIR.alias("a", "b")).setLinenoCharno(1, 0)),
                ImmutableList.of(1)),
            "m.pyi",
            new SortingErrorManager(),
            new ParserOptions());
    assertThat(AstPrinter.print(module))
        .isEqualTo(
            """
            SemanticModule:1(
              m.pyi
              ImportFrom:1(
                .
                [a : b])
              IsStub
              IgnoredLines(1))""");
  }

  @Test
  public void testCall() {
    RawNode call =
        RawIR.call(
                name("f"),
                list(name("a"), RawIR.starred(name("b"))),
                list(RawIR.keyword("k", name("c"))))
            .setLinenoCharno(3, 0);
    Statement statement = convert(RawIR.exprStatement(call).setLinenoCharno(3, 0)).getDefs().get(0);
    assertThat(AstPrinter.print(statement))
        .isEqualTo(
            """
            ExpressionStmt:3(
              CallExpr:3(
                NameExpr(f)
                Args(
                  NameExpr(a))
                VarArg(
                  NameExpr(b))
                KwArgs(
                  k
                  NameExpr(c))))""");
  }

  @Test
  public void testExpressionBuiltByHand() {
    Expression e = new OpExpr("+", new NameExpr("a"), new IntExpr(BigInteger.ONE));
    e.setLine(4, 0);
    assertThat(AstPrinter.print(e))
        .isEqualTo(
            """
            OpExpr:4(
              +
              NameExpr(a)
              IntExpr(1))""");
  }
}
