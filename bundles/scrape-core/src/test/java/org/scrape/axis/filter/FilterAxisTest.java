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

package org.scrape.axis.filter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.scrape.DocumentTestHelper;
import org.scrape.axis.AxisTestHelper;
import org.scrape.axis.ChildAxis;
import org.scrape.axis.DescendantAxis;
import org.scrape.axis.IncludeSelf;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.node.Document;
import org.scrape.query.CompiledSelector;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class FilterAxisTest {

  private Document document;

  @BeforeEach
  public void setUp() {
    document = DocumentTestHelper.createTestDocument();
  }

  @Test
  public void testElementFilter() {
    AxisTestHelper.testAxis(
        () -> new FilterAxis(new ChildAxis(document, DocumentTestHelper.DIV), NodeKindFilter.elements(document)),
        new int[] {6, 11, 13});
  }

  @Test
  public void testTextFilter() {
    AxisTestHelper.testAxis(
        () -> new FilterAxis(new DescendantAxis(document, DocumentTestHelper.DIV), NodeKindFilter.texts(document)),
        new int[] {7, 9, 12, 14});
  }

  @Test
  public void testSelectorFilter() throws InvalidSelectorException {
    final CompiledSelector selector = CompiledSelector.compile("p, li");
    AxisTestHelper.testAxis(
        () -> new FilterAxis(new DescendantAxis(document, DocumentTestHelper.HTML, IncludeSelf.YES),
                             NodeKindFilter.elements(document), new SelectorFilter(document, selector)),
        new int[] {6, 11, 16, 18});
  }

  @Test
  public void testFilterAsPredicate() {
    final NodeKindFilter filter = NodeKindFilter.elements(document);
    assertTrue(filter.apply(DocumentTestHelper.DIV));
    assertFalse(filter.apply(DocumentTestHelper.COMMENT));
  }

  @Test
  public void testFilterOfOtherDocumentFails() {
    final Document other = DocumentTestHelper.createTestDocument();
    assertThrows(IllegalArgumentException.class,
        () -> new FilterAxis(new ChildAxis(document, DocumentTestHelper.DIV), NodeKindFilter.elements(other)));
  }
}
