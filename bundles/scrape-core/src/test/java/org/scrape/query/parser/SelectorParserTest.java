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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.query.selector.AttributeOperator;
import org.scrape.query.selector.AttributeSelector;
import org.scrape.query.selector.Combinator;
import org.scrape.query.selector.ComplexSelector;
import org.scrape.query.selector.HasSelector;
import org.scrape.query.selector.IdSelector;
import org.scrape.query.selector.LogicalSelector;
import org.scrape.query.selector.NthSelector;
import org.scrape.query.selector.SelectorList;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SelectorParserTest {

  private static SelectorList parse(final String selector) throws InvalidSelectorException {
    return new SelectorParser(selector).parse();
  }

  @Test
  public void testCompoundSelector() throws InvalidSelectorException {
    final SelectorList list = parse("div#main.a.b[data-x]");
    assertEquals(1, list.getSelectors().size());
    assertEquals(5, list.getSelectors().get(0).getSubject().getSelectors().size());
    assertEquals("div#main.a.b[data-x]", list.toString());
  }

  @Test
  public void testEscapedId() throws InvalidSelectorException {
    final SelectorList list = parse("#\\31 23");
    final IdSelector id = (IdSelector) list.getSelectors().get(0).getSubject().getSelectors().get(0);
    assertEquals("123", id.getId());
    assertEquals("#\\31 23", list.toString());
    assertEquals("#-\\31 a", parse("#-\\31 a").toString());
    assertEquals("-1a", ((IdSelector) parse("#-\\31 a").getSelectors().get(0).getSubject().getSelectors().get(0)).getId());
  }

  @Test
  public void testCombinators() throws InvalidSelectorException {
    final ComplexSelector selector = parse("a  b>c + d~e").getSelectors().get(0);
    assertEquals(5, selector.getCompounds().size());
    assertEquals(List.of(Combinator.DESCENDANT, Combinator.CHILD, Combinator.ADJACENT_SIBLING,
        Combinator.GENERAL_SIBLING), selector.getCombinators());
    assertEquals("a b > c + d ~ e", selector.toString());
  }

  @Test
  public void testSelectorList() throws InvalidSelectorException {
    final SelectorList list = parse(" h1 , h2,h3 ");
    assertEquals(3, list.getSelectors().size());
    assertEquals("h1, h2, h3", list.toString());
  }

  @Test
  public void testAttributeSelectors() throws InvalidSelectorException {
    final AttributeSelector selector =
        (AttributeSelector) parse("[ Lang |= 'en' i ]").getSelectors().get(0).getSubject().getSelectors().get(0);
    assertEquals("lang", selector.getName());
    assertEquals(AttributeOperator.DASH_MATCH, selector.getOperator());
    assertEquals("en", selector.getValue());
    assertTrue(selector.isIgnoreCase());
    assertEquals("[lang|=\"en\" i]", parse("[lang|=en i]").toString());
    assertEquals("[data-n=\"42\"]", parse("[data-n=42]").toString());
  }

  @Test
  public void testNth() throws InvalidSelectorException {
    assertNth(":nth-child(odd)", 2, 1);
    assertNth(":nth-child(even)", 2, 0);
    assertNth(":nth-child(3)", 0, 3);
    assertNth(":nth-child( -n + 3 )", -1, 3);
    assertNth(":nth-last-child(2n-1)", 2, -1);
    assertNth(":nth-of-type(n)", 1, 0);
  }

  private static void assertNth(final String selector, final int a, final int b) throws InvalidSelectorException {
    final NthSelector nth =
        (NthSelector) parse(selector).getSelectors().get(0).getSubject().getSelectors().get(0);
    assertEquals(a, nth.getA(), selector);
    assertEquals(b, nth.getB(), selector);
  }

  @Test
  public void testLogicalAndHas() throws InvalidSelectorException {
    final var not = parse("p:not(.a, #b)").getSelectors().get(0).getSubject().getSelectors().get(1);
    assertInstanceOf(LogicalSelector.class, not);
    assertEquals(2, ((LogicalSelector) not).getArguments().getSelectors().size());

    final var has = parse("div:has(> p, + span)").getSelectors().get(0).getSubject().getSelectors().get(1);
    assertInstanceOf(HasSelector.class, has);
    assertEquals("div:has(> p, + span)", parse("div:has(> p, + span)").toString());
  }

  @Test
  public void testPseudoElements() throws InvalidSelectorException {
    assertEquals("p::before", parse("p::before").toString());
    assertEquals("p::after", parse("p:after").toString());
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "div[[[", ":::", ":invalid-pseudo", "div >", "> div", "a,", ",a", "a,,b",
      "[", "[a", "[a=]", "[a=b", "[a=b x]", "div)", "(", "#1a", "#", ".", ".1", "p::nope", "p::before.a",
      "a|b", "[ns|a]", ":nth-child(x)", ":nth-child(99999999999)", ":not()", ":has()", ":is(p", "p:unknown(1)",
      "'a'", "a!", "*div", "div#", ":not(p", "p $ a"})
  public void testInvalid(final String selector) {
    assertThrows(InvalidSelectorException.class, () -> parse(selector));
  }

  @Test
  public void testErrorPositions() {
    final InvalidSelectorException empty = assertThrows(InvalidSelectorException.class, () -> parse(""));
    assertEquals("empty selector", empty.getReason());

    final InvalidSelectorException pseudo = assertThrows(InvalidSelectorException.class, () -> parse("p:bogus"));
    assertEquals("unsupported pseudo-class ':bogus'", pseudo.getReason());
    assertEquals(1, pseudo.getLine());
    assertEquals(3, pseudo.getColumn());
    assertEquals("invalid selector at line 1, column 3: unsupported pseudo-class ':bogus'", pseudo.getMessage());

    final InvalidSelectorException dangling = assertThrows(InvalidSelectorException.class, () -> parse("a >\n"));
    assertEquals(2, dangling.getLine());
    assertEquals(1, dangling.getColumn());
  }

  @Test
  public void testNestingLimit() {
    final StringBuilder selector = new StringBuilder();
    for (int i = 0; i < 100; i++) {
      selector.append(":not(");
    }
    selector.append('p');
    for (int i = 0; i < 100; i++) {
      selector.append(')');
    }
    assertThrows(InvalidSelectorException.class, () -> parse(selector.toString()));
  }
}
