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

package org.scrape.utils;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;

import static java.util.Objects.requireNonNull;

/**
 * Utility methods for HTML tokens: escaping and the element categories the serializer cares
 * about.
 */
public final class HtmlToken {

  /** Elements which never have an end tag. */
  private static final ImmutableSet<String> VOID_ELEMENTS =
      ImmutableSet.of("area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param",
          "source", "track", "wbr");

  /** Elements whose text content is written verbatim. */
  private static final ImmutableSet<String> RAW_TEXT_ELEMENTS =
      ImmutableSet.of("script", "style", "xmp", "iframe", "noembed", "noframes", "plaintext");

  /** ASCII whitespace as defined by HTML. */
  private static final CharMatcher HTML_WHITESPACE = CharMatcher.anyOf(" \t\n\f\r");

  /** Splits whitespace separated token lists such as the class attribute. */
  private static final Splitter TOKEN_SPLITTER = Splitter.on(HTML_WHITESPACE).omitEmptyStrings();

  private HtmlToken() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Determines if an element is a void element.
   *
   * @param name lower case element name
   * @return {@code true} if the element has no end tag
   */
  public static boolean isVoidElement(final String name) {
    return VOID_ELEMENTS.contains(name);
  }

  /**
   * Determines if the text children of an element are serialized without escaping.
   *
   * @param name lower case element name
   * @return {@code true} if it is a raw text element
   */
  public static boolean isRawTextElement(final String name) {
    return RAW_TEXT_ELEMENTS.contains(name);
  }

  /**
   * Determines if a character is HTML whitespace.
   *
   * @param c the character
   * @return {@code true} for space, tab, line feed, form feed and carriage return
   */
  public static boolean isWhitespace(final char c) {
    return HTML_WHITESPACE.matches(c);
  }

  /**
   * Determines if a string consists of HTML whitespace only.
   *
   * @param value the string
   * @return {@code true} if empty or whitespace only
   */
  public static boolean isBlank(final CharSequence value) {
    return HTML_WHITESPACE.matchesAllOf(value);
  }

  /**
   * Split a whitespace separated token list.
   *
   * @param value the attribute value
   * @return the tokens, never empty strings
   */
  public static Iterable<String> splitTokens(final CharSequence value) {
    return TOKEN_SPLITTER.split(requireNonNull(value));
  }

  /**
   * Escape characters not allowed in attribute values.
   *
   * @param value the string value to escape
   * @param escape the builder to append to
   * @throws NullPointerException if {@code value} or {@code escape} is {@code null}
   */
  public static void escapeAttribute(final String value, final StringBuilder escape) {
    requireNonNull(value);
    requireNonNull(escape);
    for (int i = 0, length = value.length(); i < length; i++) {
      final char c = value.charAt(i);
      switch (c) {
        case '&' -> escape.append("&amp;");
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        case '"' -> escape.append("&quot;");
        default -> escape.append(c);
      }
    }
  }

  /**
   * Escape characters not allowed in text content.
   *
   * @param value the string value to escape
   * @param escape the builder to append to
   * @throws NullPointerException if {@code value} or {@code escape} is {@code null}
   */
  public static void escapeContent(final String value, final StringBuilder escape) {
    requireNonNull(value);
    requireNonNull(escape);
    for (int i = 0, length = value.length(); i < length; i++) {
      final char c = value.charAt(i);
      switch (c) {
        case '&' -> escape.append("&amp;");
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        default -> escape.append(c);
      }
    }
  }

  /**
   * Escape characters not allowed in attribute values.
   *
   * @param value the string value to escape
   * @return escaped value
   */
  public static String escapeAttribute(final String value) {
    final StringBuilder escape = new StringBuilder(value.length() + 8);
    escapeAttribute(value, escape);
    return escape.toString();
  }

  /**
   * Escape characters not allowed in text content.
   *
   * @param value the string value to escape
   * @return escaped value
   */
  public static String escapeContent(final String value) {
    final StringBuilder escape = new StringBuilder(value.length() + 8);
    escapeContent(value, escape);
    return escape.toString();
  }
}
