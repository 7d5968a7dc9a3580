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

import org.junit.jupiter.api.Test;
import org.scrape.exception.InvalidSelectorException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class CompiledSelectorTest {

  /** Characters random selectors are made of, biased towards selector syntax. */
  private static final String ALPHABET = "abcdiv#.*[]()=~|^$\"':,>+ -_0123456789nth\\é\n\t!@{}";

  @Test
  public void testSourceAndEquality() throws InvalidSelectorException {
    final CompiledSelector selector = CompiledSelector.compile("ul > li.item");
    assertEquals("ul > li.item", selector.getSource());
    assertEquals("ul > li.item", selector.toString());
    assertEquals(CompiledSelector.compile("ul > li.item"), selector);
    assertEquals(CompiledSelector.compile("ul > li.item").hashCode(), selector.hashCode());
    assertNotEquals(CompiledSelector.compile("ul>li.item"), selector);
  }

  @Test
  public void testInvalidSelector() {
    final InvalidSelectorException e =
        assertThrows(InvalidSelectorException.class, () -> CompiledSelector.compile("div[[["));
    assertEquals(1, e.getLine());
  }

  @Test
  public void testRandomInputNeverFailsUnexpectedly() {
    final Random random = new Random(4711);
    for (int i = 0; i < 20_000; i++) {
      final int length = random.nextInt(24);
      final StringBuilder selector = new StringBuilder(length);
      for (int j = 0; j < length; j++) {
        if (random.nextInt(50) == 0) {
          selector.appendCodePoint(random.nextInt(0x10FFFF));
        } else {
          selector.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
      }
      try {
        CompiledSelector.compile(selector.toString());
      } catch (final InvalidSelectorException e) {
        // Rejected inputs are fine, any other exception fails the test.
        assertTrue(e.getMessage().startsWith("invalid selector"));
      }
    }
  }
}
