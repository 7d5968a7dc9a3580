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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SpecificityTest {

  private static Specificity of(final String selector) throws InvalidSelectorException {
    return CompiledSelector.compile(selector).getSpecificity();
  }

  @Test
  public void testOrdering() {
    final Specificity ids = new Specificity(1, 0, 0);
    final Specificity classes = new Specificity(0, 100, 0);
    final Specificity elements = new Specificity(0, 0, 100);
    assertTrue(ids.compareTo(classes) > 0);
    assertTrue(classes.compareTo(elements) > 0);
    assertTrue(ids.compareTo(elements) > 0);
    assertTrue(ids.value() > classes.value());
    assertTrue(classes.value() > elements.value());
    assertEquals(0, new Specificity(0, 1, 2).compareTo(new Specificity(0, 1, 2)));
  }

  @Test
  public void testCounting() throws InvalidSelectorException {
    assertEquals(new Specificity(1, 1, 1), of("#id .class tag"));
    assertEquals(new Specificity(0, 0, 0), of("*"));
    assertEquals(new Specificity(0, 0, 0), of("* > *"));
    assertEquals(new Specificity(0, 1, 1), of("a:not(.b .c)"));
    assertEquals(new Specificity(0, 1, 2), of("li:nth-child(2)::before"));
    assertEquals(new Specificity(0, 2, 0), of("[x]:has(p)"));
    assertEquals(new Specificity(0, 3, 1), of("a[href^=http].external:first-child"));
  }

  @Test
  public void testListIsSummed() throws InvalidSelectorException {
    assertEquals(new Specificity(1, 0, 1), of("h1, #a"));
    assertEquals(new Specificity(1, 2, 2), of("h1.a, #b.c p"));
  }

  @Test
  public void testNegativeCountsFail() {
    assertThrows(IllegalArgumentException.class, () -> new Specificity(-1, 0, 0));
  }

  @Test
  public void testToString() {
    assertEquals("(1, 2, 3)", new Specificity(1, 2, 3).toString());
  }
}
