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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class SourcePositionTest {

  @Test
  public void testOffsets() {
    final String source = "ab\ncd\r\nef\rg";
    assertEquals(new SourcePosition(1, 1, 0), SourcePosition.of(source, 0));
    assertEquals(new SourcePosition(1, 3, 2), SourcePosition.of(source, 2));
    assertEquals(new SourcePosition(2, 1, 3), SourcePosition.of(source, 3));
    assertEquals(new SourcePosition(3, 1, 7), SourcePosition.of(source, 7));
    assertEquals(new SourcePosition(4, 1, 10), SourcePosition.of(source, 10));
    assertEquals(new SourcePosition(4, 2, 11), SourcePosition.of(source, source.length()));
  }

  @Test
  public void testInvalid() {
    assertThrows(IndexOutOfBoundsException.class, () -> SourcePosition.of("abc", 4));
    assertThrows(IllegalArgumentException.class, () -> new SourcePosition(0, 1, 0));
  }

  @Test
  public void testSpan() {
    final SourceSpan span = SourceSpan.of("x\ny z", 2, 5);
    assertEquals(2, span.line());
    assertEquals(1, span.column());
    assertEquals(new SourcePosition(2, 4, 5), span.end());
    assertEquals("line 2, column 1", span.toString());
    assertThrows(IllegalArgumentException.class, () -> SourceSpan.of("abc", 2, 1));
  }
}
