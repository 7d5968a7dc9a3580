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

package org.scrape.query.selector;

/**
 * Serializes identifiers and strings back to CSS.
 */
final class Identifiers {

  private Identifiers() {
    throw new AssertionError("May never be instantiated!");
  }

  static void appendIdentifier(final String value, final StringBuilder css) {
    if (value.equals("-")) {
      css.append("\\-");
      return;
    }
    for (int i = 0; i < value.length(); ) {
      final int c = value.codePointAt(i);
      // A digit may neither start the identifier nor follow a leading hyphen.
      final boolean leadingDigit = c >= '0' && c <= '9' && (i == 0 || (i == 1 && value.charAt(0) == '-'));
      final boolean plain = c >= 0x80 || c == '_' || c == '-' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
          || (c >= '0' && c <= '9' && !leadingDigit);
      if (plain) {
        css.appendCodePoint(c);
      } else if (c < 0x20 || c == 0x7F || leadingDigit) {
        css.append('\\').append(Integer.toHexString(c)).append(' ');
      } else {
        css.append('\\').appendCodePoint(c);
      }
      i += Character.charCount(c);
    }
  }

  static void appendString(final String value, final StringBuilder css) {
    css.append('"');
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == '"' || c == '\\') {
        css.append('\\').append(c);
      } else if (c == '\n') {
        css.append("\\a ");
      } else {
        css.append(c);
      }
    }
    css.append('"');
  }
}
