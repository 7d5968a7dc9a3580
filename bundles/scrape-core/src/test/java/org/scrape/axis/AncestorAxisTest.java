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
import org.scrape.node.Document;

public final class AncestorAxisTest {

  private Document document;

  @BeforeEach
  public void setUp() {
    document = DocumentTestHelper.createTestDocument();
  }

  @Test
  public void testAncestors() {
    AxisTestHelper.testAxis(() -> new AncestorAxis(document, 9), new int[] {8, 6, 5, 4, 0});
    AxisTestHelper.testAxis(() -> new AncestorAxis(document, DocumentTestHelper.BOLD, IncludeSelf.YES),
        new int[] {8, 6, 5, 4, 0});
  }

  @Test
  public void testRoot() {
    AxisTestHelper.testAxis(() -> new AncestorAxis(document, DocumentTestHelper.HTML), new int[] {});
    AxisTestHelper.testAxis(() -> new AncestorAxis(document, DocumentTestHelper.HTML, IncludeSelf.YES),
        new int[] {0});
  }

  @Test
  public void testParent() {
    AxisTestHelper.testAxis(() -> new ParentAxis(document, DocumentTestHelper.SPAN), new int[] {5});
    AxisTestHelper.testAxis(() -> new ParentAxis(document, DocumentTestHelper.HTML), new int[] {});
  }
}
