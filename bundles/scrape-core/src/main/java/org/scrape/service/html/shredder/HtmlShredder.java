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

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Range;
import org.jsoup.nodes.TextNode;
import org.scrape.exception.HtmlParseException;
import org.scrape.node.Document;
import org.scrape.node.NodeId;
import org.scrape.settings.Fixed;
import org.scrape.utils.HtmlToken;
import org.scrape.utils.LogWrapper;
import org.scrape.utils.SourcePosition;
import org.scrape.utils.SourceSpan;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Copies a tree built by jsoup into a {@link Document} arena. The tree is walked iteratively in
 * preorder, so node keys follow document order and deep trees don't exhaust the stack.
 * </p>
 *
 * <p>
 * Comments and whitespace-only text nodes are dropped unless configured otherwise, doctypes and
 * other node types without a counterpart in the arena are skipped. Script and style data becomes
 * text.
 * </p>
 */
public final class HtmlShredder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(HtmlShredder.class));

  /** Null key. */
  private static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The arena to fill. */
  private final Document document;

  /** Maximum element depth. */
  private final int maxDepth;

  /** Determines if comments should be included. */
  private final boolean includeComments;

  /** Determines if whitespace-only text should be included. */
  private final boolean preserveWhitespace;

  /** Number of nodes dropped so far. */
  private int dropped;

  /** A jsoup node waiting to be copied. */
  private record Frame(org.jsoup.nodes.Node node, int parentKey, int depth) {
  }

  /**
   * Builder to build an {@link HtmlShredder} instance.
   */
  public static final class Builder {

    /** The arena to fill. */
    private final Document document;

    /** Maximum element depth. */
    private int maxDepth = Fixed.DEFAULT_MAX_DEPTH.getStandardProperty();

    /** Determines if comments should be included. */
    private boolean includeComments;

    /** Determines if whitespace-only text should be included. */
    private boolean preserveWhitespace;

    /**
     * Constructor.
     *
     * @param document the arena to fill
     */
    public Builder(final Document document) {
      this.document = requireNonNull(document);
    }

    /**
     * Maximum element depth, the root has depth 1 (default: 512).
     *
     * @param maxDepth the depth
     * @return this builder instance
     */
    public Builder maxDepth(final @NonNegative int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be > 0!");
      this.maxDepth = maxDepth;
      return this;
    }

    /**
     * Include comments or not (default: no).
     *
     * @param include include comments
     * @return this builder instance
     */
    public Builder includeComments(final boolean include) {
      includeComments = include;
      return this;
    }

    /**
     * Include whitespace-only text nodes or not (default: no).
     *
     * @param preserve include whitespace-only text
     * @return this builder instance
     */
    public Builder preserveWhitespace(final boolean preserve) {
      preserveWhitespace = preserve;
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link HtmlShredder} instance
     */
    public HtmlShredder build() {
      return new HtmlShredder(this);
    }
  }

  /**
   * Private constructor.
   *
   * @param builder builder reference
   */
  private HtmlShredder(final Builder builder) {
    document = builder.document;
    maxDepth = builder.maxDepth;
    includeComments = builder.includeComments;
    preserveWhitespace = builder.preserveWhitespace;
  }

  /**
   * Copy an element and its subtree and make it the root of the arena.
   *
   * @param root the root element, usually {@code html}
   * @return id of the root in the arena
   * @throws HtmlParseException if the tree is nested deeper than allowed
   */
  public NodeId shredRoot(final Element root) throws HtmlParseException {
    requireNonNull(root);
    final long start = System.nanoTime();
    final int sizeBefore = document.size();
    final int rootKey = copy(List.of(root), NULL_KEY, 0);
    final NodeId rootId = document.nodeId(rootKey);
    document.setRoot(rootId);
    LOGWRAPPER.debug("Shredded {} nodes ({} dropped) in {} µs", document.size() - sizeBefore, dropped,
        (System.nanoTime() - start) / 1_000);
    return rootId;
  }

  /**
   * Copy a sequence of sibling nodes and their subtrees as the last children of an element.
   *
   * @param parent the parent element in the arena
   * @param parentDepth depth of the parent, the root has depth 1
   * @param nodes the nodes to copy
   * @throws HtmlParseException if the tree is nested deeper than allowed
   */
  public void shredChildren(final NodeId parent, final @NonNegative int parentDepth,
      final List<org.jsoup.nodes.Node> nodes) throws HtmlParseException {
    requireNonNull(parent);
    requireNonNull(nodes);
    final long start = System.nanoTime();
    final int sizeBefore = document.size();
    copy(nodes, parent.index(), parentDepth);
    LOGWRAPPER.debug("Shredded {} nodes ({} dropped) in {} µs", document.size() - sizeBefore, dropped,
        (System.nanoTime() - start) / 1_000);
  }

  /**
   * Copy subtrees in preorder.
   *
   * @return key of the first node copied, or {@code NULL_KEY}
   */
  private int copy(final List<org.jsoup.nodes.Node> nodes, final int parentKey, final int parentDepth)
      throws HtmlParseException {
    final Deque<Frame> stack = new ArrayDeque<>();
    for (int i = nodes.size() - 1; i >= 0; i--) {
      stack.push(new Frame(nodes.get(i), parentKey, parentDepth + 1));
    }

    int firstKey = NULL_KEY;
    while (!stack.isEmpty()) {
      final Frame frame = stack.pop();
      final NodeId id = create(frame);
      if (id == null) {
        dropped++;
        continue;
      }
      if (firstKey == NULL_KEY) {
        firstKey = id.index();
      }
      if (frame.parentKey() != NULL_KEY) {
        document.appendChild(document.nodeId(frame.parentKey()), id);
      }
      final org.jsoup.nodes.Node node = frame.node();
      if (node instanceof Element) {
        for (int i = node.childNodeSize() - 1; i >= 0; i--) {
          stack.push(new Frame(node.childNode(i), id.index(), frame.depth() + 1));
        }
      }
    }
    return firstKey;
  }

  /**
   * Create the arena counterpart of a jsoup node.
   *
   * @return the new node, or {@code null} if the node is dropped
   */
  private @Nullable NodeId create(final Frame frame) throws HtmlParseException {
    final org.jsoup.nodes.Node node = frame.node();
    if (node instanceof final Element element) {
      if (frame.depth() > maxDepth) {
        LOGWRAPPER.debug("<{}> at depth {} exceeds the maximum of {}", element.tagName(), frame.depth(), maxDepth);
        throw HtmlParseException.maxDepthExceeded(maxDepth, spanOf(element.sourceRange()));
      }
      final Map<String, String> attributes = new LinkedHashMap<>();
      for (final Attribute attribute : element.attributes()) {
        attributes.putIfAbsent(attribute.getKey(), attribute.getValue());
      }
      return document.createElement(element.tagName(), attributes);
    } else if (node instanceof final TextNode text) {
      final String content = text.getWholeText();
      return preserveWhitespace || !HtmlToken.isBlank(content) ? document.createText(content) : null;
    } else if (node instanceof final DataNode data) {
      return document.createText(data.getWholeData());
    } else if (node instanceof final Comment comment) {
      return includeComments ? document.createComment(comment.getData()) : null;
    }
    return null;
  }

  /**
   * Convert a jsoup source range.
   *
   * @return the span, or {@code null} if positions weren't tracked
   */
  static @Nullable SourceSpan spanOf(final Range range) {
    if (!range.isTracked()) {
      return null;
    }
    final Range.Position start = range.start();
    final Range.Position end = range.end();
    final SourcePosition startPosition = new SourcePosition(start.lineNumber(), start.columnNumber(), start.pos());
    final SourcePosition endPosition = new SourcePosition(end.lineNumber(), end.columnNumber(), end.pos());
    return startPosition.offset() <= endPosition.offset()
        ? new SourceSpan(startPosition, endPosition)
        : SourceSpan.at(startPosition);
  }
}
