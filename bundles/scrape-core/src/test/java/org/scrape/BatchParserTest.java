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
import org.scrape.api.HtmlParser;
import org.scrape.exception.HtmlParseException;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.exception.ParseError;
import org.scrape.node.Document;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class BatchParserTest {

  @Test
  public void testKeepsInputOrder() throws InterruptedException, HtmlParseException, InvalidSelectorException {
    final List<String> inputs = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      inputs.add("<p>" + i + "</p>");
    }
    final List<BatchResult> results = BatchParser.newBuilder().threads(4).build().parse(inputs);
    assertEquals(50, results.size());
    for (int i = 0; i < 50; i++) {
      final BatchResult result = results.get(i);
      assertEquals(i, result.getIndex());
      assertTrue(result.isSuccess());
      assertEquals(List.of(String.valueOf(i)), result.getOrThrow().selectText("p"));
    }
  }

  @Test
  public void testFailuresAreIsolated() throws InterruptedException {
    final BatchParser parser =
        BatchParser.newBuilder().threads(2).config(SoupConfig.newBuilder().strictMode(true).build()).build();
    final List<BatchResult> results =
        parser.parse(List.of("<!DOCTYPE html><html><head></head><body><p>ok</p></body></html>", "",
            "<div></span></div>"));

    assertTrue(results.get(0).isSuccess());
    assertTrue(results.get(0).getSoup().isPresent());
    assertFalse(results.get(0).getError().isPresent());

    assertFalse(results.get(1).isSuccess());
    assertEquals(ParseError.EMPTY_INPUT, results.get(1).getError().orElseThrow().getError());
    assertFalse(results.get(1).getSoup().isPresent());

    final HtmlParseException e = assertThrows(HtmlParseException.class, () -> results.get(2).getOrThrow());
    assertEquals(ParseError.MALFORMED_HTML, e.getError());
  }

  @Test
  public void testEmptyBatch() throws InterruptedException {
    assertTrue(BatchParser.newBuilder().build().parse(List.of()).isEmpty());
  }

  @Test
  public void testInvalidThreads() {
    assertThrows(IllegalArgumentException.class, () -> BatchParser.newBuilder().threads(0));
  }

  @Test
  public void testUncheckedFailuresPropagate() {
    final HtmlParser failing = new HtmlParser() {
      @Override
      public Document parse(final String html, final SoupConfig config) {
        throw new IllegalStateException("boom");
      }

      @Override
      public Document parseFragment(final String html, final String context, final SoupConfig config) {
        throw new IllegalStateException("boom");
      }
    };
    final BatchParser parser = BatchParser.newBuilder().parser(failing).build();
    final IllegalStateException e = assertThrows(IllegalStateException.class, () -> parser.parse(List.of("<p>")));
    assertEquals("boom", e.getMessage());
  }
}
