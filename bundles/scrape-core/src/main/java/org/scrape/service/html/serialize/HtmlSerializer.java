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

package org.scrape.service.html.serialize;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.axis.ChildAxis;
import org.scrape.axis.DescendantAxis;
import org.scrape.axis.IncludeSelf;
import org.scrape.axis.filter.FilterAxis;
import org.scrape.axis.filter.NodeKindFilter;
import org.scrape.node.CommentNode;
import org.scrape.node.Document;
import org.scrape.node.ElementNode;
import org.scrape.node.Node;
import org.scrape.node.TextNode;
import org.scrape.settings.CharsForSerializing;
import org.scrape.settings.Fixed;
import org.scrape.utils.HtmlToken;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Serializes subtrees of a {@link Document} to HTML or plain text.
 * </p>
 *
 * <p>
 * The subtree is walked with a {@link DescendantAxis}; end tags of elements with children are
 * kept on a stack and emitted as soon as the traversal leaves the element, so deep trees don't
 * recurse. Attribute values are escaped for {@code & < > "}, text for {@code & < >}. Text inside
 * {@code script}, {@code style} and the other raw text elements is written as is, void elements
 * get no end tag.
 * </p>
 */
public final class HtmlSerializer {

  /** Null key. */
  private static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The document. */
  private final Document document;

  /**
   * Constructor.
   *
   * @param document the document to serialize from
   */
  public HtmlSerializer(final Document document) {
    this.document = requireNonNull(document);
  }

  /**
   * Serialize a node including its own tag.
   *
   * @param nodeKey the node
   * @return the HTML
   */
  public String outerHtml(final @NonNegative int nodeKey) {
    final StringBuilder out = new StringBuilder();
    outerHtmlInto(nodeKey, out);
    return out.toString();
  }

  /**
   * Serialize a node including its own tag into a buffer.
   *
   * @param nodeKey the node
   * @param out the buffer to append to
   */
  public void outerHtmlInto(final @NonNegative int nodeKey, final StringBuilder out) {
    requireNonNull(out);
    final IntArrayList stack = new IntArrayList();
    final var axis = new DescendantAxis(document, nodeKey, IncludeSelf.YES);
    while (axis.hasNext()) {
      final int key = axis.nextInt();
      final Node node = document.getNode(key);

      // Close all elements the traversal has left.
      while (!stack.isEmpty() && stack.topInt() != node.getParentKey()) {
        emitEndTag(document.getElement(stack.popInt()), out);
      }

      emitNode(node, out);

      if (node instanceof final ElementNode element) {
        if (element.hasFirstChild()) {
          stack.push(key);
        } else {
          emitEndTag(element, out);
        }
      }
    }

    // Finally emit all pending end tags.
    while (!stack.isEmpty()) {
      emitEndTag(document.getElement(stack.popInt()), out);
    }
  }

  /**
   * Serialize the children of a node.
   *
   * @param nodeKey the node
   * @return the HTML
   */
  public String innerHtml(final @NonNegative int nodeKey) {
    final StringBuilder out = new StringBuilder();
    innerHtmlInto(nodeKey, out);
    return out.toString();
  }

  /**
   * Serialize the children of a node into a buffer.
   *
   * @param nodeKey the node
   * @param out the buffer to append to
   */
  public void innerHtmlInto(final @NonNegative int nodeKey, final StringBuilder out) {
    requireNonNull(out);
    final var axis = new ChildAxis(document, nodeKey);
    while (axis.hasNext()) {
      outerHtmlInto(axis.nextInt(), out);
    }
  }

  /**
   * Concatenate the content of all text nodes of a subtree in document order, unescaped.
   *
   * @param nodeKey the subtree root
   * @return the text
   */
  public String text(final @NonNegative int nodeKey) {
    final StringBuilder out = new StringBuilder();
    textInto(nodeKey, out);
    return out.toString();
  }

  /**
   * Concatenate the content of all text nodes of a subtree into a buffer.
   *
   * @param nodeKey the subtree root
   * @param out the buffer to append to
   */
  public void textInto(final @NonNegative int nodeKey, final StringBuilder out) {
    requireNonNull(out);
    final var axis = new FilterAxis(new DescendantAxis(document, nodeKey, IncludeSelf.YES),
                                    NodeKindFilter.texts(document));
    while (axis.hasNext()) {
      out.append(((TextNode) document.getNode(axis.nextInt())).getContent());
    }
  }

  private void emitNode(final Node node, final StringBuilder out) {
    switch (node.getKind()) {
      case ELEMENT -> {
        final ElementNode element = (ElementNode) node;
        out.append(CharsForSerializing.OPEN.getChars()).append(element.getName());
        for (final Map.Entry<String, String> attribute : element.getAttributes().entrySet()) {
          out.append(CharsForSerializing.SPACE.getChars()).append(attribute.getKey());
          out.append(CharsForSerializing.EQUAL_QUOTE.getChars());
          HtmlToken.escapeAttribute(attribute.getValue(), out);
          out.append(CharsForSerializing.QUOTE.getChars());
        }
        out.append(CharsForSerializing.CLOSE.getChars());
      }
      case TEXT -> {
        final String content = ((TextNode) node).getContent();
        if (isInRawTextElement(node)) {
          out.append(content);
        } else {
          HtmlToken.escapeContent(content, out);
        }
      }
      case COMMENT -> out.append(CharsForSerializing.OPEN_COMMENT.getChars())
                         .append(((CommentNode) node).getContent())
                         .append(CharsForSerializing.CLOSE_COMMENT.getChars());
      default -> throw new AssertionError();
    }
  }

  private static void emitEndTag(final ElementNode element, final StringBuilder out) {
    if (!HtmlToken.isVoidElement(element.getLocalName())) {
      out.append(CharsForSerializing.OPEN_SLASH.getChars())
         .append(element.getName())
         .append(CharsForSerializing.CLOSE.getChars());
    }
  }

  private boolean isInRawTextElement(final Node node) {
    final int parentKey = node.getParentKey();
    return parentKey != NULL_KEY && document.isElement(parentKey)
        && HtmlToken.isRawTextElement(document.getElement(parentKey).getLocalName());
  }
}
