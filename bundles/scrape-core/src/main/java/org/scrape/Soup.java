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

import com.google.common.base.MoreObjects;
import it.unimi.dsi.fastutil.ints.IntList;
import org.scrape.exception.HtmlParseException;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.node.Document;
import org.scrape.node.NodeId;
import org.scrape.query.CompiledSelector;
import org.scrape.query.QueryEngine;
import org.scrape.query.explain.SelectorExplainer;
import org.scrape.query.explain.SelectorExplanation;
import org.scrape.service.html.serialize.HtmlSerializer;
import org.scrape.service.html.shredder.JsoupHtmlParser;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Handle of a parsed document. Entry point for parsing, querying and serializing.
 * </p>
 *
 * <pre>
 * final Soup soup = Soup.parse(html);
 * for (final Tag link : soup.select("a[href]")) {
 *   System.out.println(link.get("href").orElse(""));
 * }
 * </pre>
 *
 * <p>
 * A soup only reads its document once parsed and may be shared between threads.
 * </p>
 */
public final class Soup {

  /** Byte order mark. */
  private static final char BOM = '\uFEFF';

  /** The document. */
  private final Document document;

  /** Query engine bound to the document. */
  private final QueryEngine engine;

  /** Serializer bound to the document. */
  private final HtmlSerializer serializer;

  private Soup(final Document document) {
    this.document = requireNonNull(document);
    this.engine = new QueryEngine(document);
    this.serializer = new HtmlSerializer(document);
  }

  /**
   * Parse a document with the default settings.
   *
   * @param html the markup
   * @return the soup
   * @throws HtmlParseException if parsing fails
   */
  public static Soup parse(final String html) throws HtmlParseException {
    return parse(html, SoupConfig.defaults());
  }

  /**
   * Parse a document.
   *
   * @param html the markup
   * @param config the settings
   * @return the soup
   * @throws HtmlParseException if parsing fails
   */
  public static Soup parse(final String html, final SoupConfig config) throws HtmlParseException {
    return new Soup(JsoupHtmlParser.INSTANCE.parse(html, config));
  }

  /**
   * Parse a fragment in a {@code body} context.
   *
   * @param html the markup
   * @return the soup, its root is a synthetic {@code html} element
   * @throws HtmlParseException if parsing fails
   */
  public static Soup parseFragment(final String html) throws HtmlParseException {
    return parseFragment(html, "body");
  }

  public static Soup parseFragment(final String html, final String context) throws HtmlParseException {
    return parseFragment(html, context, SoupConfig.defaults());
  }

  public static Soup parseFragment(final String html, final String context, final SoupConfig config)
      throws HtmlParseException {
    return new Soup(JsoupHtmlParser.INSTANCE.parseFragment(html, context, config));
  }

  /**
   * Parse a UTF-8 encoded file with the default settings.
   *
   * @param path the file
   * @return the soup
   * @throws IOException if the file can't be read
   * @throws HtmlParseException if the file isn't valid UTF-8 or parsing fails
   */
  public static Soup fromFile(final Path path) throws IOException, HtmlParseException {
    return fromFile(path, SoupConfig.defaults());
  }

  /**
   * Parse a UTF-8 encoded file.
   *
   * @param path the file
   * @param config the settings
   * @return the soup
   * @throws IOException if the file can't be read
   * @throws HtmlParseException if the file isn't valid UTF-8 or parsing fails
   */
  public static Soup fromFile(final Path path, final SoupConfig config) throws IOException, HtmlParseException {
    final byte[] bytes = Files.readAllBytes(requireNonNull(path));
    String html;
    try {
      html = StandardCharsets.UTF_8.newDecoder()
                                   .onMalformedInput(CodingErrorAction.REPORT)
                                   .onUnmappableCharacter(CodingErrorAction.REPORT)
                                   .decode(ByteBuffer.wrap(bytes))
                                   .toString();
    } catch (final CharacterCodingException e) {
      throw HtmlParseException.encodingError(path + " is not valid UTF-8", e);
    }
    if (!html.isEmpty() && html.charAt(0) == BOM) {
      html = html.substring(1);
    }
    return parse(html, config);
  }

  /**
   * Wrap a document built by other means.
   *
   * @param document the document
   * @return the soup
   */
  public static Soup of(final Document document) {
    return new Soup(document);
  }

  public Document document() {
    return document;
  }

  QueryEngine engine() {
    return engine;
  }

  HtmlSerializer serializer() {
    return serializer;
  }

  Tag tag(final NodeId id) {
    return new Tag(this, id.index());
  }

  /**
   * Get the root element.
   *
   * @return the root, empty for an empty document
   */
  public Optional<Tag> root() {
    return document.root().map(this::tag);
  }

  /**
   * Number of nodes in the arena.
   *
   * @return the number of nodes
   */
  public int length() {
    return document.size();
  }

  public boolean isEmpty() {
    return document.isEmpty();
  }

  /**
   * Text of the first {@code title} element.
   *
   * @return the title, if there is one
   */
  public Optional<String> title() {
    final IntList titles = document.getIndex().getElementsByTag("title");
    return titles.isEmpty() ? Optional.empty() : Optional.of(serializer.text(titles.getInt(0)));
  }

  /**
   * Text of the whole document.
   *
   * @return the text, empty for an empty document
   */
  public String text() {
    final int rootKey = document.getRootKey();
    return document.isElement(rootKey) ? serializer.text(rootKey) : "";
  }

  /**
   * Serialize the whole document.
   *
   * @return the HTML of the root element, empty for an empty document
   */
  public String toHtml() {
    final int rootKey = document.getRootKey();
    return document.isElement(rootKey) ? serializer.outerHtml(rootKey) : "";
  }

  /**
   * First element matching a selector.
   *
   * @param selector the selector
   * @return the first match in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public Optional<Tag> find(final String selector) throws InvalidSelectorException {
    return engine.find(selector).map(this::tag);
  }

  /**
   * All elements matching a selector.
   *
   * @param selector the selector
   * @return the matches in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<Tag> findAll(final String selector) throws InvalidSelectorException {
    return tags(engine.findAll(selector));
  }

  /**
   * Same as {@link #findAll(String)}.
   *
   * @param selector the selector
   * @return the matches in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<Tag> select(final String selector) throws InvalidSelectorException {
    return findAll(selector);
  }

  public Optional<Tag> findCompiled(final CompiledSelector selector) {
    return engine.findCompiled(selector).map(this::tag);
  }

  public List<Tag> selectCompiled(final CompiledSelector selector) {
    return tags(engine.selectCompiled(selector));
  }

  /**
   * Text of every element matching a selector.
   *
   * @param selector the selector
   * @return the texts in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<String> selectText(final String selector) throws InvalidSelectorException {
    final List<NodeId> matches = engine.findAll(selector);
    final List<String> texts = new ArrayList<>(matches.size());
    for (final NodeId match : matches) {
      texts.add(serializer.text(match.index()));
    }
    return texts;
  }

  /**
   * An attribute of every element matching a selector.
   *
   * @param selector the selector
   * @param attribute the attribute name
   * @return one value per match in document order, empty where a match lacks the attribute
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<Optional<String>> selectAttr(final String selector, final String attribute)
      throws InvalidSelectorException {
    requireNonNull(attribute);
    final List<Tag> matches = findAll(selector);
    final List<Optional<String>> values = new ArrayList<>(matches.size());
    for (final Tag match : matches) {
      values.add(match.get(attribute));
    }
    return values;
  }

  /**
   * Explain a selector and count its matches in this document.
   *
   * @param selector the selector
   * @return the explanation
   * @throws InvalidSelectorException if the selector is invalid
   */
  public SelectorExplanation explain(final String selector) throws InvalidSelectorException {
    return new SelectorExplainer().explain(CompiledSelector.compile(selector), document);
  }

  List<Tag> tags(final List<NodeId> ids) {
    final List<Tag> tags = new ArrayList<>(ids.size());
    for (final NodeId id : ids) {
      tags.add(tag(id));
    }
    return tags;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("document", document).toString();
  }
}
