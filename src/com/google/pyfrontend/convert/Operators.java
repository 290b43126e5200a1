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

import com.google.pyfrontend.rawtree.Operator;

/** Source spellings of raw operators, as stored on semantic operator nodes. */
final class Operators {

  private Operators() {}

  static String symbol(Operator op) {
    switch (op) {
      case ADD:
      case UADD:
        return "+";
      case SUB:
      case USUB:
        return "-";
      case MULT:
        return "*";
      case MAT_MULT:
        return "@";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case POW:
        return "**";
      case LSHIFT:
        return "<<";
      case RSHIFT:
        return ">>";
      case BIT_OR:
        return "|";
      case BIT_XOR:
        return "^";
      case BIT_AND:
        return "&";
      case FLOOR_DIV:
        return "//";
      case AND:
        return "and";
      case OR:
        return "or";
      case INVERT:
        return "~";
      case NOT:
        return "not";
      case EQ:
        return "==";
      case NOT_EQ:
        return "!=";
      case LT:
        return "<";
      case LT_E:
        return "<=";
      case GT:
        return ">";
      case GT_E:
        return ">=";
      case IS:
        return "is";
      case IS_NOT:
        return "is not";
      case IN:
        return "in";
      case NOT_IN:
        return "not in";
    }
    throw new AssertionError(op);
  }
}
