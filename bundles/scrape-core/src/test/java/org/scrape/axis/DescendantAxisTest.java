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

package org.scrape.axis;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.scrape.DocumentTestHelper;
import org.scrape.api.Axis;
import org.scrape.node.Document;
import org.scrape.node.NodeId;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class DescendantAxisTest {

  private Document document;

  @BeforeEach
  public void setUp() {
    document = DocumentTestHelper.createTestDocument();
  }

  @Test
  public void testIterateWhole() {
    AxisTestHelper.testAxis(() -> new DescendantAxis(document, DocumentTestHelper.HTML),
        new int[] {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19});
  }

  @Test
  public void testIterateWholeIncludingSelf() {
    AxisTestHelper.testAxis(() -> new DescendantAxis(document, DocumentTestHelper.HTML, IncludeSelf.YES),
        new int[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16, 17, 18, 19});
  }

  @Test
  public void testSubtreeDoesNotLeaveStart() {
    AxisTestHelper.testAxis(() -> new DescendantAxis(document, DocumentTestHelper.INTRO), new int[] {7, 8, 9});
    AxisTestHelper.testAxis(() -> new DescendantAxis(document, DocumentTestHelper.HEAD, IncludeSelf.YES),
        new int[] {1, 2, 3});
  }

  @Test
  public void testLeaf() {
    AxisTestHelper.testAxis(() -> new DescendantAxis(document, 9), new int[] {});
    AxisTestHelper.testAxis(() -> new DescendantAxis(document, 9, IncludeSelf.YES), new int[] {9});
  }

  @Test
  public void testResetToOtherNode() {
    final Axis axis = new DescendantAxis(document, DocumentTestHelper.HTML);
    axis.reset(DocumentTestHelper.UL);
    AxisTestHelper.testAxisConventions(axis, new int[] {16, 17, 18, 19});
  }

  @Test
  public void testDeepTreeDoesNotOverflowTheStack() {
    final Document deep = new Document();
    NodeId parent = deep.createElement("div");
    deep.setRoot(parent);
    for (int i = 0; i < 10_000; i++) {
      final NodeId child = deep.createElement("div");
      deep.appendChild(parent, child);
      parent = child;
    }
    int count = 0;
    final Axis axis = new DescendantAxis(deep, 0);
    while (axis.hasNext()) {
      axis.nextInt();
      count++;
    }
    assertEquals(10_000, count);
  }
}
