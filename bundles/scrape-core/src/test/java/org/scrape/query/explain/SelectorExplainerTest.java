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

package org.scrape.query.explain;

import org.junit.jupiter.api.Test;
import org.scrape.DocumentTestHelper;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.query.CompiledSelector;
import org.scrape.query.Specificity;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SelectorExplainerTest {

  private final SelectorExplainer explainer = new SelectorExplainer();

  @Test
  public void testUniversal() throws InvalidSelectorException {
    final SelectorExplanation explanation = explainer.explain("*");
    assertEquals("All elements", explanation.getDescription());
    assertEquals(List.of(OptimizationHint.avoidUniversalSelector()), explanation.getHints());
    assertEquals(new Specificity(0, 0, 0), explanation.getSpecificity());
    assertEquals(OptionalInt.empty(), explanation.getEstimatedMatches());
  }

  @Test
  public void testId() throws InvalidSelectorException {
    final SelectorExplanation explanation = explainer.explain("#main");
    assertEquals("Element with ID 'main'", explanation.getDescription());
    assertEquals(List.of(OptimizationHint.optimal()), explanation.getHints());
    assertEquals(List.of("ID selector - uses fast indexed lookup"), explanation.getPerformanceNotes());
    assertEquals(new Specificity(1, 0, 0), explanation.getSpecificity());
  }

  @Test
  public void testIdAttribute() throws InvalidSelectorException {
    final SelectorExplanation explanation = explainer.explain("[id=\"main\"]");
    assertTrue(explanation.hasHint(OptimizationHint.Kind.USE_ID_SELECTOR));
    final OptimizationHint hint = explanation.getHints().get(0);
    assertEquals(Optional.of("#main"), hint.getSuggested());
    assertTrue(hint.getCurrent().isPresent());
    assertTrue(hint.getMessage().startsWith("Use ID selector '#main' instead of"));
    assertFalse(explainer.explain("[id=main i]").hasHint(OptimizationHint.Kind.USE_ID_SELECTOR));
    assertFalse(explainer.explain("[id^=main]").hasHint(OptimizationHint.Kind.USE_ID_SELECTOR));
  }

  @Test
  public void testIdAttributeWithDigitSuggestsEscapedId() throws InvalidSelectorException {
    final OptimizationHint hint = explainer.explain("[id=\"123\"]").getHints().get(0);
    assertEquals(OptimizationHint.Kind.USE_ID_SELECTOR, hint.getKind());
    assertEquals(Optional.of("#\\31 23"), hint.getSuggested());
    final CompiledSelector suggested = CompiledSelector.compile(hint.getSuggested().orElseThrow());
    assertEquals(new Specificity(1, 0, 0), suggested.getSpecificity());
  }

  @Test
  public void testDeepChain() throws InvalidSelectorException {
    final SelectorExplanation explanation = explainer.explain("div p span a");
    assertTrue(explanation.hasHint(OptimizationHint.Kind.TOO_BROAD));
    assertTrue(explanation.hasHint(OptimizationHint.Kind.CACHE_SELECTOR));
    assertTrue(explanation.getPerformanceNotes().contains("Deep descendant chain (4 levels) - consider simplifying"));
    assertTrue(explanation.getHints().contains(OptimizationHint.preferChildCombinator("div p")));
    assertEquals("Elements matching a descendant selector", explanation.getDescription());
    assertFalse(explainer.explain("div p span").hasHint(OptimizationHint.Kind.TOO_BROAD));
  }

  @Test
  public void testChildCombinatorHasNoDescendantHint() throws InvalidSelectorException {
    final SelectorExplanation explanation = explainer.explain("div > p");
    assertEquals("Elements matching a child selector", explanation.getDescription());
    assertTrue(explanation.getHints().isEmpty());
    assertFalse(explainer.explain("div > p span").hasHint(OptimizationHint.Kind.PREFER_CHILD_COMBINATOR));
  }

  @Test
  public void testCacheHint() throws InvalidSelectorException {
    assertFalse(explainer.explain("div p").hasHint(OptimizationHint.Kind.CACHE_SELECTOR));
    assertTrue(explainer.explain("ul > li + li").hasHint(OptimizationHint.Kind.CACHE_SELECTOR));
    assertTrue(explainer.explain("[data-a-very-long-attribute-name=value]")
                        .hasHint(OptimizationHint.Kind.CACHE_SELECTOR));
  }

  @Test
  public void testDescriptions() throws InvalidSelectorException {
    assertEquals("Elements with class 'intro'", explainer.explain(".intro").getDescription());
    assertEquals("Elements with classes 'a', 'b'", explainer.explain(".a.b").getDescription());
    assertEquals("<p> elements", explainer.explain("p").getDescription());
    assertEquals("Elements matching any of 2 selectors", explainer.explain("p, li").getDescription());
    assertEquals("Elements matching an adjacent sibling selector", explainer.explain("h1 + p").getDescription());
    assertEquals("Elements matching a general sibling selector", explainer.explain("h1 ~ p").getDescription());
    assertEquals("Elements matching 'p.intro'", explainer.explain("p.intro").getDescription());
  }

  @Test
  public void testConfiguration() throws InvalidSelectorException {
    final SelectorExplainer strict = new SelectorExplainer(
        ExplainConfiguration.newBuilder().deepChainThreshold(1).cacheCompoundThreshold(10).build());
    final SelectorExplanation explanation = strict.explain("div > p");
    assertTrue(explanation.hasHint(OptimizationHint.Kind.TOO_BROAD));
    assertFalse(explanation.hasHint(OptimizationHint.Kind.CACHE_SELECTOR));
  }

  @Test
  public void testMatchCountAndFormat() throws InvalidSelectorException {
    final SelectorExplanation explanation =
        explainer.explain(CompiledSelector.compile("p"), DocumentTestHelper.createTestDocument());
    assertEquals(OptionalInt.of(2), explanation.getEstimatedMatches());
    assertEquals("Selector: p\n"
        + "Specificity: (0, 0, 1)\n"
        + "Description: <p> elements\n"
        + "Estimated matches: 2\n"
        + "Performance notes:\n"
        + "  - Type selector - uses the tag index\n", explanation.format());
  }

  @Test
  public void testInvalid() {
    assertThrows(InvalidSelectorException.class, () -> explainer.explain("div >"));
  }
}
