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

import com.google.common.collect.ImmutableMap;
import org.scrape.node.Document;
import org.scrape.node.NodeId;

/**
 * Builds the test document used throughout the tests. Node keys are fixed:
 *
 * <pre>
 *  0 &lt;html&gt;
 *  1   &lt;head&gt;
 *  2     &lt;title&gt;
 *  3       "Test"
 *  4   &lt;body&gt;
 *  5     &lt;div id="main" class="container wide"&gt;
 *  6       &lt;p class="intro"&gt;
 *  7         "Hello "
 *  8         &lt;b&gt;
 *  9           "World"
 * 10       &lt;!--note--&gt;
 * 11       &lt;p&gt;
 * 12         "Second"
 * 13       &lt;span class="wide"&gt;
 * 14         "x"
 * 15     &lt;ul&gt;
 * 16       &lt;li&gt;
 * 17         "one"
 * 18       &lt;li&gt;
 * 19         "two"
 * </pre>
 */
public final class DocumentTestHelper {

  public static final int HTML = 0;
  public static final int HEAD = 1;
  public static final int TITLE = 2;
  public static final int BODY = 4;
  public static final int DIV = 5;
  public static final int INTRO = 6;
  public static final int BOLD = 8;
  public static final int COMMENT = 10;
  public static final int SECOND = 11;
  public static final int SPAN = 13;
  public static final int UL = 15;
  public static final int FIRST_LI = 16;
  public static final int SECOND_LI = 18;

  /** Number of nodes of the test document. */
  public static final int SIZE = 20;

  private DocumentTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Create the test document.
   *
   * @return the document
   */
  public static Document createTestDocument() {
    final Document document = new Document();
    final NodeId html = document.createElement("html");
    document.setRoot(html);
    final NodeId head = append(document, html, document.createElement("head"));
    final NodeId title = append(document, head, document.createElement("title"));
    append(document, title, document.createText("Test"));
    final NodeId body = append(document, html, document.createElement("body"));
    final NodeId div = append(document, body,
        document.createElement("div", ImmutableMap.of("id", "main", "class", "container wide")));
    final NodeId intro = append(document, div, document.createElement("p", ImmutableMap.of("class", "intro")));
    append(document, intro, document.createText("Hello "));
    final NodeId bold = append(document, intro, document.createElement("b"));
    append(document, bold, document.createText("World"));
    append(document, div, document.createComment("note"));
    final NodeId second = append(document, div, document.createElement("p"));
    append(document, second, document.createText("Second"));
    final NodeId span = append(document, div, document.createElement("span", ImmutableMap.of("class", "wide")));
    append(document, span, document.createText("x"));
    final NodeId ul = append(document, body, document.createElement("ul"));
    final NodeId first = append(document, ul, document.createElement("li"));
    append(document, first, document.createText("one"));
    final NodeId secondLi = append(document, ul, document.createElement("li"));
    append(document, secondLi, document.createText("two"));
    return document;
  }

  /**
   * Wrap the test document into a soup.
   *
   * @return the soup
   */
  public static Soup createTestSoup() {
    return Soup.of(createTestDocument());
  }

  private static NodeId append(final Document document, final NodeId parent, final NodeId child) {
    document.appendChild(parent, child);
    return child;
  }
}
