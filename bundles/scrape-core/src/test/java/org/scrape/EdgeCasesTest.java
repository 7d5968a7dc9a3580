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

package org.scrape;

import org.junit.jupiter.api.Test;
import org.scrape.exception.HtmlParseException;
import org.scrape.exception.InvalidSelectorException;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class EdgeCasesTest {

  @Test
  public void testDeeplyQualifiedSelector() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<div class=\"wrapper\"><main><section id=\"content\"><article class=\"post\">"
        + "<header><h1 class=\"title\">Deep Title</h1></header></article></section></main></div>");
    assertEquals(List.of("Deep Title"),
        soup.selectText("div.wrapper > main > section#content > article.post > header > h1.title"));
  }

  @Test
  public void testAdjacentSibling() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<div><p>First</p><p>Second</p><span>Adjacent</span><p>Third</p></div>");
    assertEquals(List.of("Adjacent"), soup.selectText("p + span"));
    assertEquals(List.of("Adjacent"), soup.selectText("p ~ span"));
    assertEquals(List.of("Second", "Third"), soup.selectText("p ~ p"));
    assertEquals(List.of("Third"), soup.selectText("span + p"));
  }

  @Test
  public void testUnicode() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<p class=\"日本\">こんにちは 🌍</p><p id=\"café\">x</p>");
    assertEquals(List.of("こんにちは 🌍"), soup.selectText(".日本"));
    assertEquals(List.of("x"), soup.selectText("#café"));
  }

  @Test
  public void testEntities() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<p title=\"a &quot;b&quot;\">1 &lt; 2 &amp;&amp; 3 &gt; 2</p>");
    final Tag paragraph = soup.find("p").orElseThrow();
    assertEquals("1 < 2 && 3 > 2", paragraph.text());
    assertEquals(Optional.of("a \"b\""), paragraph.get("title"));
    assertEquals("<p title=\"a &quot;b&quot;\">1 &lt; 2 &amp;&amp; 3 &gt; 2</p>", paragraph.outerHtml());
  }

  @Test
  public void testQuotedAttributeValues() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<a href=\"/a b\">1</a><a href='/c'>2</a>");
    assertEquals(List.of("1"), soup.selectText("a[href=\"/a b\"]"));
    assertEquals(List.of("2"), soup.selectText("a[href='/c']"));
  }

  @Test
  public void testCaseInsensitiveNames() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<DIV Class=\"Box\">x</DIV>");
    assertEquals(1, soup.findAll("DIV").size());
    assertEquals(1, soup.findAll("div.Box").size());
    assertTrue(soup.findAll("div.box").isEmpty());
  }

  @Test
  public void testMalformedHtmlIsRecovered() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<div><p>unclosed<div>x</span>");
    assertEquals(2, soup.findAll("div").size());
    assertEquals(List.of("unclosed"), soup.selectText("p"));
  }

  @Test
  public void testEmptyElementsAndRepeatedClasses() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<p class=\"a a\"></p><p class=\"a\">text</p>");
    assertEquals(1, soup.findAll("p:empty").size());
    assertEquals(2, soup.findAll(".a").size());
  }

  @Test
  public void testOuterHtmlRoundTrip() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<div id=\"x\" class=\"a b\" data-v=\"&lt;1&gt;\"><p>one <i>two</i></p><br>"
        + "<img src=\"a.png\" alt=\"&quot;q&quot;\"><span>t &amp; u</span></div>");
    final Tag original = soup.find("#x").orElseThrow();
    final Tag reparsed = Soup.parse(original.outerHtml()).find("#x").orElseThrow();
    assertEquals(original.attrs(), reparsed.attrs());
    assertEquals(original.text(), reparsed.text());
    assertEquals(original.outerHtml(), reparsed.outerHtml());
    assertEquals(original.descendants().transform(Tag::name).toList(),
        reparsed.descendants().transform(Tag::name).toList());
  }

  @Test
  public void testRawText() throws HtmlParseException, InvalidSelectorException {
    final Soup soup = Soup.parse("<style>p > a { color: red }</style><script>if (a < b) {}</script>");
    assertEquals(List.of("p > a { color: red }"), soup.selectText("style"));
    assertEquals("<script>if (a < b) {}</script>", soup.find("script").orElseThrow().outerHtml());
  }
}
