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

package org.scrape.index;

import com.google.common.collect.ImmutableMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.scrape.DocumentTestHelper;
import org.scrape.node.Document;
import org.scrape.node.NodeId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class DocumentIndexTest {

  private Document document;

  private DocumentIndex index;

  @BeforeEach
  public void setUp() {
    document = DocumentTestHelper.createTestDocument();
    index = DocumentIndex.build(document);
  }

  @Test
  public void testIdIndex() {
    assertEquals(IntArrayList.of(DocumentTestHelper.DIV), index.getElementsById("main"));
    assertTrue(index.getElementsById("missing").isEmpty());
  }

  @Test
  public void testClassIndexInDocumentOrder() {
    assertEquals(IntArrayList.of(DocumentTestHelper.DIV, DocumentTestHelper.SPAN), index.getElementsByClass("wide"));
    assertEquals(IntArrayList.of(DocumentTestHelper.INTRO), index.get(IndexType.CLASS, "intro"));
  }

  @Test
  public void testTagIndex() {
    assertEquals(IntArrayList.of(DocumentTestHelper.FIRST_LI, DocumentTestHelper.SECOND_LI),
        index.getElementsByTag("li"));
    assertEquals(IntArrayList.of(DocumentTestHelper.HTML), index.get(IndexType.TAG, "html"));
  }

  @Test
  public void testPostingsAreUnmodifiable() {
    assertThrows(UnsupportedOperationException.class, () -> index.getElementsByTag("li").add(1));
  }

  @Test
  public void testDetachedElementsAreNotIndexed() {
    document.createElement("li", ImmutableMap.of("id", "loose"));
    final DocumentIndex rebuilt = DocumentIndex.build(document);
    assertEquals(2, rebuilt.getElementsByTag("li").size());
    assertTrue(rebuilt.getElementsById("loose").isEmpty());
  }

  @Test
  public void testDuplicateClassIndexedOnce() {
    final Document duplicate = new Document();
    final NodeId root = duplicate.createElement("div", ImmutableMap.of("class", "a a  b"));
    duplicate.setRoot(root);
    final DocumentIndex built = DocumentIndex.build(duplicate);
    assertEquals(IntArrayList.of(0), built.getElementsByClass("a"));
    assertEquals(IntArrayList.of(0), built.getElementsByClass("b"));
  }
}
