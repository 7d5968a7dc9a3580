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
import org.junit.jupiter.params.provider.ValueSource;
import org.scrape.DocumentTestHelper;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.node.Document;
import org.scrape.node.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class QueryEngineTest {

  private Document document;

  private QueryEngine engine;

  @BeforeEach
  public void setUp() {
    document = DocumentTestHelper.createTestDocument();
    engine = new QueryEngine(document);
  }

  private List<NodeId> ids(final int... keys) {
    final List<NodeId> ids = new ArrayList<>();
    for (final int key : keys) {
      ids.add(document.nodeId(key));
    }
    return ids;
  }

  @Test
  public void testSelect() throws InvalidSelectorException {
    assertEquals(ids(DocumentTestHelper.INTRO, DocumentTestHelper.SECOND), engine.select("p"));
    assertEquals(ids(DocumentTestHelper.INTRO, DocumentTestHelper.SECOND), engine.findAll("#main > p"));
    assertEquals(ids(DocumentTestHelper.BOLD), engine.select("div p b"));
    assertEquals(ids(DocumentTestHelper.DIV, DocumentTestHelper.SPAN), engine.select(".wide"));
    assertEquals(ids(DocumentTestHelper.HTML), engine.select(":root"));
    assertEquals(ids(DocumentTestHelper.BODY), engine.select(":scope > body"));
    assertEquals(ids(DocumentTestHelper.BOLD, DocumentTestHelper.SPAN), engine.select(":is(b, span)"));
    assertEquals(ids(), engine.select("#missing"));
    assertEquals(ids(), engine.select("p::before"));
  }

  @Test
  public void testSelectorListIsInDocumentOrderWithoutDuplicates() throws InvalidSelectorException {
    assertEquals(ids(DocumentTestHelper.DIV, DocumentTestHelper.INTRO, DocumentTestHelper.SECOND,
        DocumentTestHelper.SPAN), engine.select("span, p, #main, .wide"));
  }

  @Test
  public void testFind() throws InvalidSelectorException {
    assertEquals(Optional.of(document.nodeId(DocumentTestHelper.FIRST_LI)), engine.find("li"));
    assertEquals(Optional.of(document.nodeId(DocumentTestHelper.SECOND_LI)), engine.find("li:last-child"));
    assertEquals(Optional.empty(), engine.find("table"));
  }

  @Test
  public void testInvalidSelector() {
    assertThrows(InvalidSelectorException.class, () -> engine.select("div["));
    assertThrows(InvalidSelectorException.class, () -> engine.find(""));
  }

  @Test
  public void testWithin() throws InvalidSelectorException {
    final NodeId div = document.nodeId(DocumentTestHelper.DIV);
    assertEquals(ids(DocumentTestHelper.INTRO, DocumentTestHelper.SECOND), engine.findAllWithin(div, "p"));
    assertEquals(ids(DocumentTestHelper.INTRO, DocumentTestHelper.SECOND), engine.findAllWithin(div, "div p"));
    assertEquals(ids(DocumentTestHelper.INTRO, DocumentTestHelper.SECOND), engine.findAllWithin(div, ":scope > p"));
    assertEquals(ids(), engine.findAllWithin(div, "div"));
    assertEquals(ids(), engine.findAllWithin(div, "li"));
    assertEquals(ids(), engine.findAllWithin(document.nodeId(DocumentTestHelper.BODY), ":scope > p"));
    assertEquals(ids(DocumentTestHelper.FIRST_LI, DocumentTestHelper.SECOND_LI),
        engine.findAllWithin(document.nodeId(DocumentTestHelper.UL), "li"));
    assertEquals(Optional.of(document.nodeId(DocumentTestHelper.BOLD)), engine.findWithin(div, "b"));
  }

  @Test
  public void testWithinRejectsNonElementScope() {
    assertThrows(IllegalArgumentException.class,
        () -> engine.findAllWithin(document.nodeId(DocumentTestHelper.COMMENT), "p"));
  }

  @Test
  public void testWithinDetachedScope() throws InvalidSelectorException {
    final NodeId detached = document.createElement("section");
    final NodeId paragraph = document.createElement("p");
    document.appendChild(detached, paragraph);
    assertEquals(List.of(paragraph), engine.findAllWithin(detached, "p"));
    assertEquals(List.of(paragraph), engine.findAllWithin(detached, "section > p"));
    assertEquals(ids(DocumentTestHelper.INTRO, DocumentTestHelper.SECOND), engine.select("p"));
  }

  @ParameterizedTest
  @ValueSource(strings = { "#main", "div#main p", ".wide", "span.wide", "p", "li:nth-child(2)", "#main > .intro b",
      "ul li:first-child", "#nothing", ".intro ~ p", "[class]", "*", "p, li", "body :not(p)" })
  public void testIndexedEqualsBruteForce(final String source) throws InvalidSelectorException {
    final CompiledSelector selector = CompiledSelector.compile(source);
    final SelectorMatcher matcher = new SelectorMatcher(document);
    final List<NodeId> expected = new ArrayList<>();
    for (int key = 0; key < document.size(); key++) {
      if (matcher.matches(key, selector)) {
        expected.add(document.nodeId(key));
      }
    }
    assertEquals(expected, engine.selectCompiled(selector));
  }

  @Test
  public void testDocumentWithoutRoot() throws InvalidSelectorException {
    final Document empty = new Document();
    final QueryEngine emptyEngine = new QueryEngine(empty);
    assertTrue(emptyEngine.select("*").isEmpty());
    assertEquals(Optional.empty(), emptyEngine.find("p"));
  }

  @Test
  public void testSelectTextAndAttributes() throws InvalidSelectorException {
    final NodeId body = document.nodeId(DocumentTestHelper.BODY);
    assertEquals(List.of("Hello World", "Second"), engine.selectTextWithin(body, CompiledSelector.compile("p")));
    assertEquals(List.of("one", "two"), engine.selectTextWithin(body, CompiledSelector.compile("li")));
    assertEquals(List.of(Optional.of("intro"), Optional.empty()),
        engine.selectAttrWithin(body, CompiledSelector.compile("p"), "class"));
    assertEquals(List.of(Optional.of("main")), engine.selectAttrWithin(body, CompiledSelector.compile("div"), "ID"));
  }
}
