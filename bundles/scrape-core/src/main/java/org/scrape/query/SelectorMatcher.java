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

import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.axis.DescendantAxis;
import org.scrape.axis.FollowingSiblingAxis;
import org.scrape.axis.IncludeSelf;
import org.scrape.axis.filter.FilterAxis;
import org.scrape.axis.filter.NodeKindFilter;
import org.scrape.node.Document;
import org.scrape.node.ElementNode;
import org.scrape.node.Node;
import org.scrape.query.selector.Combinator;
import org.scrape.query.selector.ComplexSelector;
import org.scrape.query.selector.RelativeSelector;
import org.scrape.query.selector.SelectorList;
import org.scrape.settings.Fixed;

import static java.util.Objects.requireNonNull;

/**
 * Matches selectors against elements of one document. Complex selectors are evaluated right to
 * left: the rightmost compound is tested against the candidate, then the combinators walk the
 * ancestor and preceding sibling chains, backtracking where a descendant or general sibling
 * combinator leaves several choices.
 *
 * <p>
 * A matcher only reads the document. It is cheap to create and not meant to be shared between
 * threads.
 * </p>
 */
public final class SelectorMatcher {

  /** Null key. */
  private static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The document. */
  private final Document document;

  /** Element {@code :scope} refers to. */
  private final int scopeKey;

  /**
   * Create a matcher for whole-document queries, {@code :scope} is the root.
   *
   * @param document the document
   */
  public SelectorMatcher(final Document document) {
    this(document, document.getRootKey());
  }

  /**
   * Create a matcher.
   *
   * @param document the document
   * @param scopeKey element {@code :scope} refers to
   */
  public SelectorMatcher(final Document document, final int scopeKey) {
    this.document = requireNonNull(document);
    this.scopeKey = scopeKey;
  }

  public Document getDocument() {
    return document;
  }

  public int getScopeKey() {
    return scopeKey;
  }

  /**
   * Determines if a node matches a compiled selector.
   *
   * @param nodeKey the node key
   * @param selector the selector
   * @return {@code true} if the node is an element matching any member of the selector list
   */
  public boolean matches(final int nodeKey, final CompiledSelector selector) {
    return matches(nodeKey, selector.getSelectorList());
  }

  /**
   * Determines if a node matches any member of a selector list.
   *
   * @param nodeKey the node key
   * @param selectors the selector list
   * @return {@code true} if the node is an element matching any member
   */
  public boolean matches(final int nodeKey, final SelectorList selectors) {
    if (!document.isElement(nodeKey)) {
      return false;
    }
    for (final ComplexSelector selector : selectors.getSelectors()) {
      if (matchesFrom(selector, selector.getCompounds().size() - 1, nodeKey, NULL_KEY, null)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Determines if a relative selector finds an element, starting from an anchor element. This is
   * the test behind {@code :has()}.
   *
   * @param anchorKey the anchor element
   * @param relative the relative selector
   * @return {@code true} if some element is related to the anchor as the selector demands
   */
  public boolean matchesRelative(final int anchorKey, final RelativeSelector relative) {
    final Combinator combinator = relative.getCombinator();
    final ComplexSelector selector = relative.getSelector();
    final int subject = selector.getCompounds().size() - 1;

    if (combinator == Combinator.DESCENDANT || combinator == Combinator.CHILD) {
      final var axis = new FilterAxis(new DescendantAxis(document, anchorKey), NodeKindFilter.elements(document));
      while (axis.hasNext()) {
        if (matchesFrom(selector, subject, axis.nextInt(), anchorKey, combinator)) {
          return true;
        }
      }
      return false;
    }

    final var siblings = new FilterAxis(new FollowingSiblingAxis(document, anchorKey),
                                        NodeKindFilter.elements(document));
    while (siblings.hasNext()) {
      final var axis = new FilterAxis(new DescendantAxis(document, siblings.nextInt(), IncludeSelf.YES),
                                      NodeKindFilter.elements(document));
      while (axis.hasNext()) {
        if (matchesFrom(selector, subject, axis.nextInt(), anchorKey, combinator)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Match the compound at {@code index} against a node and everything left of it against the
   * node's ancestors and siblings.
   *
   * @param selector the complex selector
   * @param index index of the compound to test
   * @param nodeKey the element to test
   * @param anchorKey anchor of a relative selector, or {@code NULL_KEY}
   * @param anchorCombinator relation of the leftmost compound to the anchor, {@code null} if
   *        there is no anchor
   * @return {@code true} on a match
   */
  private boolean matchesFrom(final ComplexSelector selector, final @NonNegative int index, final int nodeKey,
      final int anchorKey, final @Nullable Combinator anchorCombinator) {
    if (!selector.getCompounds().get(index).matches(this, nodeKey)) {
      return false;
    }
    if (index == 0) {
      return anchorCombinator == null || isRelated(anchorKey, nodeKey, anchorCombinator);
    }

    switch (selector.getCombinators().get(index - 1)) {
      case CHILD -> {
        final int parentKey = parentElement(nodeKey);
        return parentKey != NULL_KEY && matchesFrom(selector, index - 1, parentKey, anchorKey, anchorCombinator);
      }
      case DESCENDANT -> {
        for (int key = parentElement(nodeKey); key != NULL_KEY; key = parentElement(key)) {
          if (matchesFrom(selector, index - 1, key, anchorKey, anchorCombinator)) {
            return true;
          }
        }
        return false;
      }
      case ADJACENT_SIBLING -> {
        final int siblingKey = previousElementSibling(nodeKey, false);
        return siblingKey != NULL_KEY && matchesFrom(selector, index - 1, siblingKey, anchorKey, anchorCombinator);
      }
      case GENERAL_SIBLING -> {
        for (int key = previousElementSibling(nodeKey, false); key != NULL_KEY;
            key = previousElementSibling(key, false)) {
          if (matchesFrom(selector, index - 1, key, anchorKey, anchorCombinator)) {
            return true;
          }
        }
        return false;
      }
      default -> throw new AssertionError();
    }
  }

  private boolean isRelated(final int anchorKey, final int nodeKey, final Combinator combinator) {
    switch (combinator) {
      case CHILD:
        return parentElement(nodeKey) == anchorKey;
      case DESCENDANT:
        for (int key = parentElement(nodeKey); key != NULL_KEY; key = parentElement(key)) {
          if (key == anchorKey) {
            return true;
          }
        }
        return false;
      case ADJACENT_SIBLING:
        return previousElementSibling(nodeKey, false) == anchorKey;
      case GENERAL_SIBLING:
        for (int key = previousElementSibling(nodeKey, false); key != NULL_KEY;
            key = previousElementSibling(key, false)) {
          if (key == anchorKey) {
            return true;
          }
        }
        return false;
      default:
        throw new AssertionError();
    }
  }

  /**
   * Get the parent of a node if it is an element.
   *
   * @param nodeKey the node key
   * @return the parent key or {@code NULL_NODE_KEY}
   */
  public int parentElement(final int nodeKey) {
    final int parentKey = document.getNode(nodeKey).getParentKey();
    return parentKey != NULL_KEY && document.isElement(parentKey) ? parentKey : NULL_KEY;
  }

  /**
   * Get the nearest preceding element sibling.
   *
   * @param nodeKey the node key
   * @param sameName only consider elements with the same name
   * @return the sibling key or {@code NULL_NODE_KEY}
   */
  public int previousElementSibling(final int nodeKey, final boolean sameName) {
    final String name = sameName ? document.getElement(nodeKey).getLocalName() : null;
    Node node = document.getNode(nodeKey);
    while (node.hasLeftSibling()) {
      node = document.getNode(node.getLeftSiblingKey());
      if (node instanceof final ElementNode element && (name == null || element.getLocalName().equals(name))) {
        return node.getNodeKey();
      }
    }
    return NULL_KEY;
  }

  /**
   * Get the nearest following element sibling.
   *
   * @param nodeKey the node key
   * @param sameName only consider elements with the same name
   * @return the sibling key or {@code NULL_NODE_KEY}
   */
  public int nextElementSibling(final int nodeKey, final boolean sameName) {
    final String name = sameName ? document.getElement(nodeKey).getLocalName() : null;
    Node node = document.getNode(nodeKey);
    while (node.hasRightSibling()) {
      node = document.getNode(node.getRightSiblingKey());
      if (node instanceof final ElementNode element && (name == null || element.getLocalName().equals(name))) {
        return node.getNodeKey();
      }
    }
    return NULL_KEY;
  }

  /**
   * Get the 1-based position of an element among its element siblings.
   *
   * @param nodeKey key of an element
   * @param sameName only count elements with the same name
   * @param fromEnd count from the last sibling
   * @return the position
   */
  public int elementPosition(final int nodeKey, final boolean sameName, final boolean fromEnd) {
    int position = 1;
    for (int key = step(nodeKey, sameName, fromEnd); key != NULL_KEY; key = step(key, sameName, fromEnd)) {
      position++;
    }
    return position;
  }

  private int step(final int nodeKey, final boolean sameName, final boolean forward) {
    return forward ? nextElementSibling(nodeKey, sameName) : previousElementSibling(nodeKey, sameName);
  }
}
