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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import org.jspecify.annotations.Nullable;

/**
 * Splits a single-line fragment, such as the text of a type comment, into tokens for {@link
 * FragmentParser}. Only the lexical subset needed for expressions is recognized.
 */
final class FragmentScanner {

  enum Kind {
    NAME,
    NUMBER,
    STRING,
    LP,
    RP,
    LB,
    RB,
    LC,
    RC,
    COMMA,
    COLON,
    DOT,
    ELLIPSIS,
    ARROW,
    ASSIGN,
    STAR,
    STAR2,
    SLASH,
    SLASH2,
    PERCENT,
    AT,
    PLUS,
    MINUS,
    TILDE,
    BITOR,
    BITXOR,
    BITAND,
    LSHIFT,
    RSHIFT,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    EOF
  }

  /** Words that can never be a name. */
  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield");

  private final String source;
  private int cursor = 0;

  // Attributes of the last token returned by getToken().
  private int charno = -1;
  private @Nullable String string;
  private @Nullable Number number;
  private boolean imaginary;
  private boolean bytes;

  FragmentScanner(String source) {
    this.source = source;
  }

  /** Zero-based offset of the last token. */
  int getCharno() {
    return charno;
  }

  /** The identifier of a NAME token, or the decoded value of a STRING token. */
  String getString() {
    checkState(string != null, "no string token");
    return string;
  }

  Number getNumber() {
    checkState(number != null, "no number token");
    return number;
  }

  boolean isImaginary() {
    return imaginary;
  }

  /** Whether the last STRING token was a bytes literal. */
  boolean isBytes() {
    return bytes;
  }

  Kind getToken() {
    skipWhitespace();
    charno = cursor;
    string = null;
    number = null;
    imaginary = false;
    bytes = false;
    if (cursor >= source.length()) {
      return Kind.EOF;
    }

    char c = source.charAt(cursor);
    if (isStringStart()) {
      return scanString();
    }
    if (isNameStart(c)) {
      int start = cursor;
      while (cursor < source.length() && isNamePart(source.charAt(cursor))) {
        cursor++;
      }
      string = source.substring(start, cursor);
      return Kind.NAME;
    }
    if (isDigit(c) || (c == '.' && cursor + 1 < source.length()
        && isDigit(source.charAt(cursor + 1)))) {
      return scanNumber();
    }

    cursor++;
    switch (c) {
      case '(':
        return Kind.LP;
      case ')':
        return Kind.RP;
      case '[':
        return Kind.LB;
      case ']':
        return Kind.RB;
      case '{':
        return Kind.LC;
      case '}':
        return Kind.RC;
      case ',':
        return Kind.COMMA;
      case ':':
        return Kind.COLON;
      case '~':
        return Kind.TILDE;
      case '+':
        return Kind.PLUS;
      case '%':
        return Kind.PERCENT;
      case '@':
        return Kind.AT;
      case '|':
        return Kind.BITOR;
      case '^':
        return Kind.BITXOR;
      case '&':
        return Kind.BITAND;
      case '.':
        if (source.startsWith("..", cursor)) {
          cursor += 2;
          return Kind.ELLIPSIS;
        }
        return Kind.DOT;
      case '-':
        return matchChar('>') ? Kind.ARROW : Kind.MINUS;
      case '*':
        return matchChar('*') ? Kind.STAR2 : Kind.STAR;
      case '/':
        return matchChar('/') ? Kind.SLASH2 : Kind.SLASH;
      case '=':
        return matchChar('=') ? Kind.EQ : Kind.ASSIGN;
      case '!':
        if (matchChar('=')) {
          return Kind.NE;
        }
        break;
      case '<':
        if (matchChar('<')) {
          return Kind.LSHIFT;
        }
        return matchChar('=') ? Kind.LE : Kind.LT;
      case '>':
        if (matchChar('>')) {
          return Kind.RSHIFT;
        }
        return matchChar('=') ? Kind.GE : Kind.GT;
      default:
        break;
    }
    throw syntaxError(charno);
  }

  private boolean matchChar(char expected) {
    if (cursor < source.length() && source.charAt(cursor) == expected) {
      cursor++;
      return true;
    }
    return false;
  }

  private void skipWhitespace() {
    while (cursor < source.length()) {
      char c = source.charAt(cursor);
      if (c == ' ' || c == '\t' || c == '\f' || c == '\n' || c == '\r') {
        cursor++;
      } else if (c == '\\' && cursor + 1 < source.length()
          && source.charAt(cursor + 1) == '\n') {
        cursor += 2;
      } else if (c == '#') {
        // A trailing comment runs to the end of the line.
        while (cursor < source.length() && source.charAt(cursor) != '\n') {
          cursor++;
        }
      } else {
        return;
      }
    }
  }

  private boolean isStringStart() {
    int i = cursor;
    while (i < source.length() && i - cursor < 2 && isStringPrefix(source.charAt(i))) {
      i++;
    }
    return i < source.length() && (source.charAt(i) == '\'' || source.charAt(i) == '"');
  }

  private static boolean isStringPrefix(char c) {
    switch (Character.toLowerCase(c)) {
      case 'b':
      case 'r':
      case 'u':
      case 'f':
        return true;
      default:
        return false;
    }
  }

  private Kind scanString() {
    boolean raw = false;
    boolean isBytes = false;
    boolean unicode = false;
    while (source.charAt(cursor) != '\'' && source.charAt(cursor) != '"') {
      switch (Character.toLowerCase(source.charAt(cursor))) {
        case 'b':
          isBytes = true;
          break;
        case 'r':
          raw = true;
          break;
        case 'u':
          unicode = true;
          break;
        default:
          // Formatted strings are not expressions a type can be written with.
          throw syntaxError(charno);
      }
      cursor++;
    }
    if ((isBytes && unicode) || (raw && unicode)) {
      throw syntaxError(charno);
    }

    char quote = source.charAt(cursor);
    boolean triple = source.startsWith("" + quote + quote + quote, cursor);
    cursor += triple ? 3 : 1;
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (cursor >= source.length()) {
        throw syntaxError(charno);
      }
      char c = source.charAt(cursor);
      if (c == quote) {
        if (!triple) {
          cursor++;
          break;
        }
        if (source.startsWith("" + quote + quote + quote, cursor)) {
          cursor += 3;
          break;
        }
      }
      if (c == '\n' && !triple) {
        throw syntaxError(charno);
      }
      if (c == '\\' && cursor + 1 < source.length()) {
        if (raw) {
          sb.append(c).append(source.charAt(cursor + 1));
          cursor += 2;
        } else {
          cursor = readEscape(sb, isBytes);
        }
        continue;
      }
      if (isBytes && c > 0x7f) {
        throw syntaxError(charno);
      }
      sb.append(c);
      cursor++;
    }
    string = sb.toString();
    bytes = isBytes;
    return Kind.STRING;
  }

  /** Appends the escape at the cursor and returns the offset after it. */
  private int readEscape(StringBuilder sb, boolean isBytes) {
    int i = cursor + 1;
    char c = source.charAt(i);
    switch (c) {
      case '\n':
        return i + 1;
      case '\\':
      case '\'':
      case '"':
        sb.append(c);
        return i + 1;
      case 'n':
        sb.append('\n');
        return i + 1;
      case 't':
        sb.append('\t');
        return i + 1;
      case 'r':
        sb.append('\r');
        return i + 1;
      case 'a':
        sb.append('\u0007');
        return i + 1;
      case 'b':
        sb.append('\b');
        return i + 1;
      case 'f':
        sb.append('\f');
        return i + 1;
      case 'v':
        sb.append('\u000b');
        return i + 1;
      case 'x':
        return readHex(sb, i + 1, 2);
      case 'u':
        if (!isBytes) {
          return readHex(sb, i + 1, 4);
        }
        break;
      case 'U':
        if (!isBytes) {
          return readHex(sb, i + 1, 8);
        }
        break;
      default:
        if (c >= '0' && c <= '7') {
          int end = i;
          int value = 0;
          while (end < source.length() && end < i + 3
              && source.charAt(end) >= '0' && source.charAt(end) <= '7') {
            value = value * 8 + (source.charAt(end) - '0');
            end++;
          }
          sb.append((char) value);
          return end;
        }
        break;
    }
    // Unrecognized escapes are kept as written.
    sb.append('\\').append(c);
    return i + 1;
  }

  private int readHex(StringBuilder sb, int start, int digits) {
    int end = start + digits;
    if (end > source.length()) {
      throw syntaxError(charno);
    }
    int codePoint;
    try {
      codePoint = Integer.parseInt(source.substring(start, end), 16);
    } catch (NumberFormatException e) {
      throw syntaxError(charno);
    }
    if (!Character.isValidCodePoint(codePoint)) {
      throw syntaxError(charno);
    }
    sb.appendCodePoint(codePoint);
    return end;
  }

  private Kind scanNumber() {
    int start = cursor;
    if (source.charAt(cursor) == '0' && cursor + 1 < source.length()) {
      int radix;
      switch (Character.toLowerCase(source.charAt(cursor + 1))) {
        case 'x':
          radix = 16;
          break;
        case 'o':
          radix = 8;
          break;
        case 'b':
          radix = 2;
          break;
        default:
          radix = 10;
          break;
      }
      if (radix != 10) {
        cursor += 2;
        int digitsStart = cursor;
        while (cursor < source.length()
            && (Character.digit(source.charAt(cursor), radix) >= 0
                || source.charAt(cursor) == '_')) {
          cursor++;
        }
        String digits = source.substring(digitsStart, cursor).replace("_", "");
        if (digits.isEmpty()) {
          throw syntaxError(start);
        }
        number = new BigInteger(digits, radix);
        return Kind.NUMBER;
      }
    }

    boolean isFloat = false;
    skipDigits();
    if (cursor < source.length() && source.charAt(cursor) == '.') {
      isFloat = true;
      cursor++;
      skipDigits();
    }
    if (cursor < source.length() && Character.toLowerCase(source.charAt(cursor)) == 'e') {
      int mark = cursor;
      cursor++;
      if (cursor < source.length()
          && (source.charAt(cursor) == '+' || source.charAt(cursor) == '-')) {
        cursor++;
      }
      if (cursor < source.length() && isDigit(source.charAt(cursor))) {
        isFloat = true;
        skipDigits();
      } else {
        cursor = mark;
      }
    }
    String text = source.substring(start, cursor).replace("_", "");
    if (cursor < source.length() && Character.toLowerCase(source.charAt(cursor)) == 'j') {
      cursor++;
      imaginary = true;
      number = Double.parseDouble(text);
    } else if (isFloat) {
      number = Double.parseDouble(text);
    } else {
      number = new BigInteger(text);
    }
    if (cursor < source.length() && isNameStart(source.charAt(cursor))) {
      throw syntaxError(cursor);
    }
    return Kind.NUMBER;
  }

  private void skipDigits() {
    while (cursor < source.length()
        && (isDigit(source.charAt(cursor)) || source.charAt(cursor) == '_')) {
      cursor++;
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isNameStart(char c) {
    return c == '_' || Character.isLetter(c);
  }

  static boolean isNamePart(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  /** A syntax error at the given zero-based offset. */
  static RawSyntaxException syntaxError(int offset) {
    return new RawSyntaxException("invalid syntax", 1, offset + 1);
  }
}
