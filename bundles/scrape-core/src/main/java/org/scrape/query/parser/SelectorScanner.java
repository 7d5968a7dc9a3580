/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.scrape.query.parser;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Splits a CSS selector into tokens. It reads the selector code point by code point and creates a
 * token for every logical unit, resolving CSS escapes in identifiers and strings on the way.
 * </p>
 * <p>
 * The scanner never fails: input it can't make sense of becomes an {@link TokenType#INVALID} token
 * carrying the reason, which the parser turns into an error.
 * </p>
 */
public final class SelectorScanner {

  /** Replacement for invalid code points. */
  private static final int REPLACEMENT_CHARACTER = 0xFFFD;

  /** The selector to scan. */
  private final String selector;

  /** The current position of the cursor in the selector. */
  private int pos;

  /** Start position of the last token. */
  private int lastPos;

  /**
   * Constructor.
   *
   * @param selector the selector to scan
   */
  public SelectorScanner(final String selector) {
    this.selector = requireNonNull(selector);
  }

  /**
   * Reads the next token.
   *
   * @return the token, {@link TokenType#END} once the selector is exhausted
   */
  public SelectorToken nextToken() {
    lastPos = pos;
    final int c = codePoint(pos);
    if (c == -1) {
      return token(TokenType.END, "");
    }
    if (isWhitespace(c)) {
      while (isWhitespace(codePoint(pos))) {
        pos++;
      }
      return token(TokenType.SPACE, "");
    }

    switch (c) {
      case '"', '\'' -> {
        return scanString(c);
      }
      case '#' -> {
        pos++;
        if (isNameChar(codePoint(pos)) || isValidEscape(pos)) {
          final TokenType type = startsIdentifier(pos) ? TokenType.HASH : TokenType.UNRESTRICTED_HASH;
          return token(type, scanName());
        }
        return token(TokenType.INVALID, "expected a name after '#'");
      }
      case '.' -> {
        return single(TokenType.DOT);
      }
      case ',' -> {
        return single(TokenType.COMMA);
      }
      case '>' -> {
        return single(TokenType.GT);
      }
      case '+' -> {
        return single(TokenType.PLUS);
      }
      case '[' -> {
        return single(TokenType.LBRACKET);
      }
      case ']' -> {
        return single(TokenType.RBRACKET);
      }
      case '(' -> {
        return single(TokenType.LPAREN);
      }
      case ')' -> {
        return single(TokenType.RPAREN);
      }
      case '=' -> {
        return single(TokenType.EQ);
      }
      case ':' -> {
        return codePoint(pos + 1) == ':' ? pair(TokenType.DOUBLE_COLON) : single(TokenType.COLON);
      }
      case '*' -> {
        return codePoint(pos + 1) == '=' ? pair(TokenType.SUBSTRING_MATCH) : single(TokenType.STAR);
      }
      case '~' -> {
        return codePoint(pos + 1) == '=' ? pair(TokenType.INCLUDES) : single(TokenType.TILDE);
      }
      case '|' -> {
        return codePoint(pos + 1) == '=' ? pair(TokenType.DASH_MATCH) : single(TokenType.PIPE);
      }
      case '^' -> {
        return codePoint(pos + 1) == '=' ? pair(TokenType.PREFIX_MATCH) : invalidCharacter(c);
      }
      case '$' -> {
        return codePoint(pos + 1) == '=' ? pair(TokenType.SUFFIX_MATCH) : invalidCharacter(c);
      }
      default -> {
        if (startsIdentifier(pos)) {
          final String name = scanName();
          if (codePoint(pos) == '(') {
            pos++;
            return token(TokenType.FUNCTION, name);
          }
          return token(TokenType.IDENT, name);
        }
        if (c >= '0' && c <= '9') {
          while (isDigit(codePoint(pos))) {
            pos++;
          }
          return token(TokenType.NUMBER, selector.substring(lastPos, pos));
        }
        return invalidCharacter(c);
      }
    }
  }

  /**
   * Reads the raw text of a function argument up to, but not including, the closing parenthesis
   * which balances the already consumed opening one. The next token is that parenthesis.
   *
   * @return the raw argument text
   */
  public String scanRawArgument() {
    final int start = pos;
    int depth = 0;
    for (int c = codePoint(pos); c != -1; c = codePoint(pos)) {
      if (c == ')') {
        if (depth == 0) {
          break;
        }
        depth--;
      } else if (c == '(') {
        depth++;
      }
      pos += Character.charCount(c);
    }
    return selector.substring(start, pos);
  }

  /**
   * Get the current position of the cursor.
   *
   * @return the offset of the next character to scan
   */
  public int getPosition() {
    return pos;
  }

  /**
   * Get the start position of the last token.
   *
   * @return the offset
   */
  public int getLastPosition() {
    return lastPos;
  }

  private SelectorToken single(final TokenType type) {
    pos++;
    return token(type, "");
  }

  private SelectorToken pair(final TokenType type) {
    pos += 2;
    return token(type, "");
  }

  private SelectorToken invalidCharacter(final int c) {
    pos += Character.charCount(c);
    return token(TokenType.INVALID, "unexpected character '" + new String(Character.toChars(c)) + "'");
  }

  private SelectorToken token(final TokenType type, final String content) {
    return new SelectorToken(type, content, lastPos, pos);
  }

  private SelectorToken scanString(final int quote) {
    pos++;
    final StringBuilder value = new StringBuilder();
    while (true) {
      final int c = codePoint(pos);
      if (c == -1 || c == '\n' || c == '\r' || c == '\f') {
        return token(TokenType.INVALID, "unterminated string");
      }
      if (c == quote) {
        pos++;
        return token(TokenType.STRING, value.toString());
      }
      if (c == '\\') {
        final int next = codePoint(pos + 1);
        if (next == -1) {
          pos++;
        } else if (next == '\n' || next == '\f') {
          pos += 2;
        } else if (next == '\r') {
          pos += codePoint(pos + 2) == '\n' ? 3 : 2;
        } else {
          value.appendCodePoint(consumeEscape());
        }
      } else {
        value.appendCodePoint(c);
        pos += Character.charCount(c);
      }
    }
  }

  private String scanName() {
    final StringBuilder name = new StringBuilder();
    while (true) {
      final int c = codePoint(pos);
      if (isNameChar(c)) {
        name.appendCodePoint(c);
        pos += Character.charCount(c);
      } else if (isValidEscape(pos)) {
        name.appendCodePoint(consumeEscape());
      } else {
        return name.toString();
      }
    }
  }

  /**
   * Consume an escape sequence, the cursor is on the backslash.
   *
   * @return the escaped code point
   */
  private int consumeEscape() {
    pos++;
    final int c = codePoint(pos);
    if (c == -1) {
      return REPLACEMENT_CHARACTER;
    }
    if (isHexDigit(c)) {
      int value = 0;
      int digits = 0;
      while (digits < 6 && isHexDigit(codePoint(pos))) {
        value = value * 16 + Character.digit(codePoint(pos), 16);
        pos++;
        digits++;
      }
      final int next = codePoint(pos);
      if (next == '\r' && codePoint(pos + 1) == '\n') {
        pos += 2;
      } else if (isWhitespace(next)) {
        pos++;
      }
      if (value == 0 || value > Character.MAX_CODE_POINT || (value >= 0xD800 && value <= 0xDFFF)) {
        return REPLACEMENT_CHARACTER;
      }
      return value;
    }
    pos += Character.charCount(c);
    return c;
  }

  private boolean startsIdentifier(final int offset) {
    final int c = codePoint(offset);
    if (c == '-') {
      final int next = codePoint(offset + 1);
      return isNameStart(next) || next == '-' || isValidEscape(offset + 1);
    }
    return isNameStart(c) || isValidEscape(offset);
  }

  private boolean isValidEscape(final int offset) {
    if (codePoint(offset) != '\\') {
      return false;
    }
    final int next = codePoint(offset + 1);
    return next != -1 && next != '\n' && next != '\r' && next != '\f';
  }

  private int codePoint(final int offset) {
    return offset < selector.length() ? selector.codePointAt(offset) : -1;
  }

  private static boolean isNameStart(final int c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 0x80;
  }

  private static boolean isNameChar(final int c) {
    return isNameStart(c) || isDigit(c) || c == '-';
  }

  private static boolean isDigit(final int c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isHexDigit(final int c) {
    return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
  }

  private static boolean isWhitespace(final int c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
  }
}
