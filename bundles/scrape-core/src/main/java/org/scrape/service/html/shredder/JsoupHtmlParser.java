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

package org.scrape.service.html.shredder;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.ParseErrorList;
import org.jsoup.parser.Parser;
import org.scrape.SoupConfig;
import org.scrape.api.HtmlParser;
import org.scrape.exception.HtmlParseException;
import org.scrape.node.Document;
import org.scrape.node.NodeId;
import org.scrape.utils.HtmlToken;
import org.scrape.utils.LogWrapper;
import org.scrape.utils.SourcePosition;
import org.scrape.utils.SourceSpan;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link HtmlParser} building the tree with jsoup's HTML5 tree builder and copying it into the
 * arena with an {@link HtmlShredder}.
 *
 * <p>
 * In strict mode jsoup's error tracking is switched on and the first error it reports fails the
 * parse. Leniently, whatever jsoup recovers is kept, and blank input gives an empty document.
 * </p>
 */
public final class JsoupHtmlParser implements HtmlParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(JsoupHtmlParser.class));

  /** Number of errors jsoup records in strict mode. */
  private static final int MAX_TRACKED_ERRORS = 16;

  /** Name of the root element. */
  private static final String ROOT = "html";

  /** Shared instance, the parser has no state. */
  public static final JsoupHtmlParser INSTANCE = new JsoupHtmlParser();

  @Override
  public Document parse(final String html, final SoupConfig config) throws HtmlParseException {
    requireNonNull(html);
    requireNonNull(config);
    if (HtmlToken.isBlank(html)) {
      return blank(config);
    }

    final Parser parser = newParser(config);
    final org.jsoup.nodes.Document parsed;
    try {
      parsed = Jsoup.parse(html, "", parser);
    } catch (final RuntimeException e) {
      throw HtmlParseException.internalError(String.valueOf(e.getMessage()), e);
    }
    checkErrors(html, parser, config);

    final Document document = new Document();
    final Element root = rootOf(parsed);
    if (root != null) {
      newShredder(document, config).shredRoot(root);
    }
    return document;
  }

  @Override
  public Document parseFragment(final String html, final String context, final SoupConfig config)
      throws HtmlParseException {
    requireNonNull(html);
    requireNonNull(context);
    requireNonNull(config);
    if (HtmlToken.isBlank(html) && config.isStrictMode()) {
      throw HtmlParseException.emptyInput();
    }

    final Parser parser = newParser(config);
    final List<org.jsoup.nodes.Node> nodes;
    try {
      nodes = parser.parseFragmentInput(html, new Element(context), "");
    } catch (final RuntimeException e) {
      throw HtmlParseException.internalError(String.valueOf(e.getMessage()), e);
    }
    checkErrors(html, parser, config);

    final Document document = new Document();
    final NodeId root = document.createElement(ROOT);
    document.setRoot(root);
    newShredder(document, config).shredChildren(root, 1, nodes);
    return document;
  }

  private static Document blank(final SoupConfig config) throws HtmlParseException {
    if (config.isStrictMode()) {
      throw HtmlParseException.emptyInput();
    }
    LOGWRAPPER.debug("Blank input, returning an empty document");
    return new Document();
  }

  private static Parser newParser(final SoupConfig config) {
    return Parser.htmlParser()
                 .setTrackPosition(true)
                 .setTrackErrors(config.isStrictMode() ? MAX_TRACKED_ERRORS : 0);
  }

  private static HtmlShredder newShredder(final Document document, final SoupConfig config) {
    return new HtmlShredder.Builder(document).maxDepth(config.getMaxDepth())
                                             .includeComments(config.isIncludeComments())
                                             .preserveWhitespace(config.isPreserveWhitespace())
                                             .build();
  }

  private static void checkErrors(final String html, final Parser parser, final SoupConfig config)
      throws HtmlParseException {
    if (!config.isStrictMode()) {
      return;
    }
    final ParseErrorList errors = parser.getErrors();
    if (!errors.isEmpty()) {
      final ParseError first = errors.get(0);
      LOGWRAPPER.warn("Rejecting malformed HTML, {} error(s), first: {}", errors.size(), first);
      final int offset = Math.max(0, Math.min(first.getPosition(), html.length()));
      throw HtmlParseException.malformedHtml(first.getErrorMessage(), SourceSpan.at(SourcePosition.of(html, offset)));
    }
  }

  private static @Nullable Element rootOf(final org.jsoup.nodes.Document parsed) {
    for (final Element child : parsed.children()) {
      if (ROOT.equals(child.normalName())) {
        return child;
      }
    }
    return null;
  }
}
