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

package org.scrape.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.scrape.DocumentTestHelper;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.node.Document;
import org.scrape.settings.Fixed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SelectorMatcherTest {

  private Document document;

  private SelectorMatcher matcher;

  @BeforeEach
  public void setUp() {
    document = DocumentTestHelper.createTestDocument();
    matcher = new SelectorMatcher(document);
  }

  private List<Integer> matching(final String selector) throws InvalidSelectorException {
    final CompiledSelector compiled = CompiledSelector.compile(selector);
    final List<Integer> keys = new ArrayList<>();
    for (int key = 0; key < document.size(); key++) {
      if (matcher.matches(key, compiled)) {
        keys.add(key);
      }
    }
    return keys;
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
      "p                      | 6 11",
      "P                      | 6 11",
      "*                      | 0 1 2 4 5 6 8 11 13 15 16 18",
      "#main > p              | 6 11",
      "div p b                | 8",
      "html > p               | ''",
      ".wide                  | 5 13",
      ".container.wide        | 5",
      "p + p                  | 11",
      "p + span               | 13",
      "span + p               | ''",
      "p ~ span               | 13",
      "head + body            | 4",
      "li:first-child         | 16",
      "li:last-child          | 18",
      "b:only-child           | 8",
      "title:only-of-type     | 2",
      "p:first-of-type        | 6",
      "p:last-of-type         | 11",
      ":root                  | 0",
      ":scope > body          | 4",
      "li:nth-child(2)        | 18",
      "li:nth-child(n-2147483647) | 16 18",
      "li:nth-child(-n+2147483647) | 16 18",
      "li:nth-child(2147483647n-2147483646) | 16",
      "li:nth-last-child(2)   | 16",
      "div > :nth-child(odd)  | 6 13",
      "p:not(.intro)          | 11",
      ":not(html, head, body, div, p, li, ul) | 2 8 13",
      ":is(b, span)           | 8 13",
      ":where(ul) li          | 16 18",
      "div:has(> span.wide)   | 5",
      "body:has(b)            | 4",
      "p:has(+ p)             | 6",
      "p:has(~ span)          | 6 11",
      "ul:has(> p)            | ''",
      "[class~=wide]          | 5 13",
      "[class^=cont]          | 5",
      "[id$=ain]              | 5",
      "[class*=ide]           | 5 13",
      "[ID=MAIN i]            | 5",
      "[id=MAIN]              | ''",
      "'[class|=container]'   | ''",
      "[class]                | 5 6 13",
      "p::before              | ''",
      "li, p                  | 6 11 16 18"})
  public void testMatches(final String selector, final String expected) throws InvalidSelectorException {
    final List<Integer> keys = new ArrayList<>();
    if (!expected.isEmpty()) {
      for (final String key : expected.split(" ")) {
        keys.add(Integer.valueOf(key));
      }
    }
    assertEquals(keys, matching(selector), selector);
  }

  @Test
  public void testTextAndCommentNeverMatch() throws InvalidSelectorException {
    final CompiledSelector universal = CompiledSelector.compile("*");
    assertFalse(matcher.matches(3, universal));
    assertFalse(matcher.matches(DocumentTestHelper.COMMENT, universal));
  }

  @Test
  public void testScope() throws InvalidSelectorException {
    final SelectorMatcher scoped = new SelectorMatcher(document, DocumentTestHelper.DIV);
    final CompiledSelector selector = CompiledSelector.compile(":scope > p");
    assertTrue(scoped.matches(DocumentTestHelper.INTRO, selector));
    assertFalse(matcher.matches(DocumentTestHelper.INTRO, selector));
  }

  @Test
  public void testEmpty() throws InvalidSelectorException {
    final var empty = document.createElement("td");
    document.appendChild(document.nodeId(DocumentTestHelper.BODY), empty);
    final var comment = document.createElement("td");
    document.appendChild(document.nodeId(DocumentTestHelper.BODY), comment);
    document.appendChild(comment, document.createComment("only a comment"));
    final CompiledSelector selector = CompiledSelector.compile("td:empty");
    assertTrue(matcher.matches(empty.index(), selector));
    assertTrue(matcher.matches(comment.index(), selector));
    assertFalse(matcher.matches(DocumentTestHelper.SECOND, selector));
  }

  @Test
  public void testNavigationHelpers() {
    final int nullKey = Fixed.NULL_NODE_KEY.getStandardProperty();
    assertEquals(DocumentTestHelper.DIV, matcher.parentElement(DocumentTestHelper.SPAN));
    assertEquals(nullKey, matcher.parentElement(DocumentTestHelper.HTML));
    assertEquals(DocumentTestHelper.SECOND, matcher.previousElementSibling(DocumentTestHelper.SPAN, false));
    assertEquals(nullKey, matcher.previousElementSibling(DocumentTestHelper.SPAN, true));
    assertEquals(DocumentTestHelper.SECOND, matcher.nextElementSibling(DocumentTestHelper.INTRO, true));
    assertEquals(Arrays.asList(1, 2, 3),
        Arrays.asList(matcher.elementPosition(DocumentTestHelper.INTRO, false, false),
            matcher.elementPosition(DocumentTestHelper.SECOND, false, false),
            matcher.elementPosition(DocumentTestHelper.SPAN, false, false)));
    assertEquals(1, matcher.elementPosition(DocumentTestHelper.SPAN, false, true));
  }
}
