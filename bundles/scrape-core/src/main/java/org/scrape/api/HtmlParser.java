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

package org.scrape.api;

import org.scrape.SoupConfig;
import org.scrape.exception.HtmlParseException;
import org.scrape.node.Document;

/**
 * Turns markup into a {@link Document}. Implementations must be stateless or thread-safe, a single
 * instance is shared by concurrent batch parses.
 */
public interface HtmlParser {

  /**
   * Parse a whole document.
   *
   * @param html the markup
   * @param config the settings
   * @return the document, without a root if lenient parsing found nothing
   * @throws HtmlParseException if the input can't be parsed with the given settings
   */
  Document parse(String html, SoupConfig config) throws HtmlParseException;

  /**
   * Parse a fragment as the content of a context element. The resulting top-level nodes become
   * children of a synthetic {@code html} root.
   *
   * @param html the markup
   * @param context name of the context element, for instance {@code body} or {@code tr}
   * @param config the settings
   * @return the document
   * @throws HtmlParseException if the input can't be parsed with the given settings
   */
  Document parseFragment(String html, String context, SoupConfig config) throws HtmlParseException;
}
