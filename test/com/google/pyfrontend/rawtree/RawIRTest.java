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
import static com.google.pyfrontend.rawtree.RawIR.list;
import static com.google.pyfrontend.rawtree.RawIR.name;
import static com.google.pyfrontend.rawtree.RawIR.num;
import static com.google.pyfrontend.rawtree.RawIR.pass;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RawIR}. */
@RunWith(JUnit4.class)
public final class RawIRTest {

  @Test
  public void testModule() {
    RawNode module = RawIR.module(list(pass()), ImmutableList.of(3, 7));
    assertThat(module.getToken()).isEqualTo(Token.MODULE);
    assertThat(module.getLineno()).isEqualTo(1);
    assertThat(module.getFirstChild().getChildCount()).isEqualTo(1);
    RawNode ignores = module.getSecondChild();
    assertThat(ignores.getChildCount()).isEqualTo(2);
    assertThat(ignores.getSecondChild().getToken()).isEqualTo(Token.TYPE_IGNORE);
    assertThat(ignores.getSecondChild().getLineno()).isEqualTo(7);
  }

  @Test
  public void testAssignWrapsTheTargetInAList() {
    RawNode n = RawIR.assign(name("x"), num(1));
    assertThat(n.getFirstChild().isList()).isTrue();
    assertThat(n.getFirstChild().getFirstChild().isName()).isTrue();
  }

  @Test
  public void testOptionalChildrenAreEmpty() {
    RawNode n = RawIR.raise(null, null);
    assertThat(n.getChildCount()).isEqualTo(2);
    assertThat(n.getFirstChild().isEmpty()).isTrue();
  }

  @Test
  public void testStatementShapes() {
    assertThrows(
        IllegalStateException.class,
        () -> RawIR.functionDef("f", RawIR.arguments(), list(name("x"))));
    assertThrows(IllegalStateException.class, () -> RawIR.assign(pass(), num(1)));
    assertThrows(IllegalArgumentException.class, () -> RawIR.delete());
    assertThrows(IllegalArgumentException.class, () -> RawIR.multiAssign(list(), num(1)));
    assertThrows(
        IllegalArgumentException.class, () -> RawIR.importFrom("m", -1, RawIR.alias("x", null)));
  }

  @Test
  public void testExpressionShapes() {
    assertThrows(IllegalArgumentException.class, () -> RawIR.boolOp(Operator.AND, name("a")));
    assertThrows(
        IllegalArgumentException.class, () -> RawIR.boolOp(Operator.ADD, name("a"), name("b")));
    assertThrows(IllegalArgumentException.class, () -> RawIR.dict(list(name("a")), list()));
    assertThrows(IllegalArgumentException.class, () -> RawIR.nameConstant("null"));
    assertThrows(
        IllegalArgumentException.class,
        () -> RawIR.compare(name("a"), ImmutableList.of(Operator.LT), name("b"), name("c")));
    assertThrows(IllegalArgumentException.class, () -> RawIR.listComp(name("x")));
    assertThrows(
        IllegalStateException.class, () -> RawIR.call(name("f"), list(), list(name("k"))));
    assertThrows(IllegalStateException.class, () -> RawIR.joinedStr(name("x")));
  }

  @Test
  public void testDictAllowsMappingUnpacking() {
    RawNode n = RawIR.dict(list(RawIR.empty()), list(name("m")));
    assertThat(n.getFirstChild().getFirstChild().isEmpty()).isTrue();
  }

  @Test
  public void testImaginary() {
    RawNode n = RawIR.imaginary(1.5);
    assertThat(n.getNumber()).isEqualTo(1.5);
    assertThat(n.getBooleanProp(RawNode.Prop.IMAGINARY)).isTrue();
  }

  @Test
  public void testBytesAreCopied() {
    byte[] value = {1, 2};
    RawNode n = RawIR.bytes(value);
    value[0] = 9;
    assertThat(n.getBytes()[0]).isEqualTo((byte) 1);
  }
}
