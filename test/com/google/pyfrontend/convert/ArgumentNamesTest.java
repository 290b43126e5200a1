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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ArgumentNames}. */
@RunWith(JUnit4.class)
public final class ArgumentNamesTest {

  @Test
  public void testPositionalOnlyMagicMethods() {
    assertThat(ArgumentNames.specialFunctionElideNames("__add__")).isTrue();
    assertThat(ArgumentNames.specialFunctionElideNames("__getitem__")).isTrue();
    assertThat(ArgumentNames.specialFunctionElideNames("__rxor__")).isTrue();
  }

  @Test
  public void testMagicMethodsTakingKeywordsKeepNames() {
    assertThat(ArgumentNames.specialFunctionElideNames("__init__")).isFalse();
    assertThat(ArgumentNames.specialFunctionElideNames("__new__")).isFalse();
    assertThat(ArgumentNames.specialFunctionElideNames("__call__")).isFalse();
    assertThat(ArgumentNames.specialFunctionElideNames("__setattr__")).isFalse();
    assertThat(ArgumentNames.specialFunctionElideNames("__init_subclass__")).isFalse();
  }

  @Test
  public void testOrdinaryFunctionsKeepNames() {
    assertThat(ArgumentNames.specialFunctionElideNames("add")).isFalse();
    assertThat(ArgumentNames.specialFunctionElideNames("__custom__")).isFalse();
  }

  @Test
  public void testPrivateArgumentNames() {
    assertThat(ArgumentNames.argumentElideName("__x")).isTrue();
    assertThat(ArgumentNames.argumentElideName("__x__")).isFalse();
    assertThat(ArgumentNames.argumentElideName("_x")).isFalse();
    assertThat(ArgumentNames.argumentElideName(null)).isFalse();
  }

  @Test
  public void testIdentifiers() {
    assertThat(ArgumentNames.isValidIdentifier("x1")).isTrue();
    assertThat(ArgumentNames.isValidIdentifier("_")).isTrue();
    assertThat(ArgumentNames.isValidIdentifier("été")).isTrue();
    assertThat(ArgumentNames.isValidIdentifier("1x")).isFalse();
    assertThat(ArgumentNames.isValidIdentifier("a-b")).isFalse();
    assertThat(ArgumentNames.isValidIdentifier("")).isFalse();
  }
}
