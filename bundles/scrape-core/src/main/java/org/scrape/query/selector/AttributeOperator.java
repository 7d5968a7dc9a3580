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

import org.scrape.utils.HtmlToken;

/**
 * Operators of attribute selectors.
 */
public enum AttributeOperator {

  /** {@code [attr]}. */
  EXISTS("") {
    @Override
    boolean test(final String actual, final String expected) {
      return true;
    }
  },

  /** {@code [attr=value]}. */
  EQUALS("=") {
    @Override
    boolean test(final String actual, final String expected) {
      return actual.equals(expected);
    }
  },

  /** {@code [attr~=value]}: one of the whitespace separated words equals the value. */
  INCLUDES("~=") {
    @Override
    boolean test(final String actual, final String expected) {
      if (expected.isEmpty() || containsWhitespace(expected)) {
        return false;
      }
      for (final String token : HtmlToken.splitTokens(actual)) {
        if (token.equals(expected)) {
          return true;
        }
      }
      return false;
    }
  },

  /** {@code [attr|=value]}: the value itself or the value followed by a hyphen. */
  DASH_MATCH("|=") {
    @Override
    boolean test(final String actual, final String expected) {
      return actual.equals(expected)
          || (actual.startsWith(expected) && actual.length() > expected.length()
              && actual.charAt(expected.length()) == '-');
    }
  },

  /** {@code [attr^=value]}. */
  PREFIX("^=") {
    @Override
    boolean test(final String actual, final String expected) {
      return !expected.isEmpty() && actual.startsWith(expected);
    }
  },

  /** {@code [attr$=value]}. */
  SUFFIX("$=") {
    @Override
    boolean test(final String actual, final String expected) {
      return !expected.isEmpty() && actual.endsWith(expected);
    }
  },

  /** {@code [attr*=value]}. */
  SUBSTRING("*=") {
    @Override
    boolean test(final String actual, final String expected) {
      return !expected.isEmpty() && actual.contains(expected);
    }
  };

  /** The operator as written in CSS. */
  private final String symbol;

  AttributeOperator(final String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Compare an attribute value with the expected value. Both are already case folded if
   * necessary.
   *
   * @param actual the attribute value
   * @param expected the value of the selector
   * @return {@code true} on a match
   */
  abstract boolean test(String actual, String expected);

  private static boolean containsWhitespace(final String value) {
    for (int i = 0; i < value.length(); i++) {
      if (HtmlToken.isWhitespace(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
