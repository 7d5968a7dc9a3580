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

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.scrape.api.Axis;
import org.scrape.axis.AncestorAxis;
import org.scrape.axis.ChildAxis;
import org.scrape.axis.DescendantAxis;
import org.scrape.axis.FollowingSiblingAxis;
import org.scrape.axis.ParentAxis;
import org.scrape.axis.PrecedingSiblingAxis;
import org.scrape.axis.filter.FilterAxis;
import org.scrape.axis.filter.NodeKindFilter;
import org.scrape.exception.AttributeNotFoundException;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.node.Document;
import org.scrape.node.ElementNode;
import org.scrape.node.NodeId;
import org.scrape.node.TextNode;
import org.scrape.query.CompiledSelector;
import org.scrape.query.SelectorMatcher;
import org.scrape.utils.HtmlToken;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Handle of an element: the {@link Soup} it belongs to plus the element's node key. Handles are
 * cheap, equal if they denote the same element of the same document, and hold no state of their
 * own.
 * </p>
 *
 * <p>
 * Navigation only sees elements, text and comments are skipped. Sequences are lazy, every call of
 * {@code iterator()} walks the tree anew.
 * </p>
 */
public final class Tag {

  /** The soup. */
  private final Soup soup;

  /** Key of the element. */
  private final int nodeKey;

  Tag(final Soup soup, final int nodeKey) {
    this.soup = requireNonNull(soup);
    this.nodeKey = nodeKey;
    soup.document().getElement(nodeKey);
  }

  private Document document() {
    return soup.document();
  }

  private ElementNode element() {
    return document().getElement(nodeKey);
  }

  public NodeId nodeId() {
    return document().nodeId(nodeKey);
  }

  /**
   * Name of the element as parsed.
   *
   * @return the name
   */
  public String name() {
    return element().getName();
  }

  /**
   * Get an attribute, names are matched case-insensitively.
   *
   * @param attribute the attribute name
   * @return the value, empty if the element has no such attribute
   */
  public Optional<String> get(final String attribute) {
    return Optional.ofNullable(element().getAttributeIgnoreCase(requireNonNull(attribute)));
  }

  /**
   * Get an attribute which must exist.
   *
   * @param attribute the attribute name
   * @return the value
   * @throws AttributeNotFoundException if the element has no such attribute
   */
  public String getOrThrow(final String attribute) throws AttributeNotFoundException {
    final String value = element().getAttributeIgnoreCase(requireNonNull(attribute));
    if (value == null) {
      throw new AttributeNotFoundException(attribute);
    }
    return value;
  }

  public boolean hasAttr(final String attribute) {
    return element().getAttributeIgnoreCase(requireNonNull(attribute)) != null;
  }

  /**
   * All attributes in source order.
   *
   * @return the attributes
   */
  public ImmutableMap<String, String> attrs() {
    return element().getAttributes();
  }

  /**
   * Determines if the {@code class} attribute lists a class.
   *
   * @param className the class, case-sensitive
   * @return {@code true} if the class is present
   */
  public boolean hasClass(final String className) {
    requireNonNull(className);
    return classes().contains(className);
  }

  /**
   * Classes of the element in attribute order.
   *
   * @return the classes, empty if there's no {@code class} attribute
   */
  public ImmutableList<String> classes() {
    final String value = element().getAttributeIgnoreCase("class");
    return value == null ? ImmutableList.of() : ImmutableList.copyOf(HtmlToken.splitTokens(value));
  }

  public String text() {
    return soup.serializer().text(nodeKey);
  }

  public void textInto(final StringBuilder out) {
    soup.serializer().textInto(nodeKey, out);
  }

  public String innerHtml() {
    return soup.serializer().innerHtml(nodeKey);
  }

  public void innerHtmlInto(final StringBuilder out) {
    soup.serializer().innerHtmlInto(nodeKey, out);
  }

  public String outerHtml() {
    return soup.serializer().outerHtml(nodeKey);
  }

  public void outerHtmlInto(final StringBuilder out) {
    soup.serializer().outerHtmlInto(nodeKey, out);
  }

  /**
   * Raw content of the direct text children.
   *
   * @return the contents in document order
   */
  public List<String> textNodes() {
    final List<String> texts = new ArrayList<>();
    final var axis = new FilterAxis(new ChildAxis(document(), nodeKey), NodeKindFilter.texts(document()));
    while (axis.hasNext()) {
      texts.add(((TextNode) document().getNode(axis.nextInt())).getContent());
    }
    return texts;
  }

  // Navigation.

  /**
   * Get the parent element.
   *
   * @return the parent, empty for the root
   */
  public Optional<Tag> parent() {
    return elements(key -> new ParentAxis(document(), key)).first().toJavaUtil();
  }

  public FluentIterable<Tag> children() {
    return elements(key -> new ChildAxis(document(), key));
  }

  /**
   * Get the nearest following element sibling.
   *
   * @return the sibling, if any
   */
  public Optional<Tag> nextSibling() {
    return nextSiblings().first().toJavaUtil();
  }

  /**
   * Get the nearest preceding element sibling.
   *
   * @return the sibling, if any
   */
  public Optional<Tag> prevSibling() {
    return prevSiblings().first().toJavaUtil();
  }

  public FluentIterable<Tag> nextSiblings() {
    return elements(key -> new FollowingSiblingAxis(document(), key));
  }

  /**
   * All preceding element siblings, nearest first.
   *
   * @return the siblings
   */
  public FluentIterable<Tag> prevSiblings() {
    return elements(key -> new PrecedingSiblingAxis(document(), key));
  }

  /**
   * All other element children of the parent, in document order.
   *
   * @return the siblings
   */
  public FluentIterable<Tag> siblings() {
    final FluentIterable<Tag> preceding = FluentIterable.from(new Iterable<Tag>() {
      @Override
      public Iterator<Tag> iterator() {
        return Lists.reverse(prevSiblings().toList()).iterator();
      }
    });
    return FluentIterable.concat(preceding, nextSiblings());
  }

  /**
   * All ancestor elements, nearest first.
   *
   * @return the ancestors
   */
  public FluentIterable<Tag> ancestors() {
    return elements(key -> new AncestorAxis(document(), key));
  }

  /**
   * Same as {@link #ancestors()}.
   *
   * @return the ancestors
   */
  public FluentIterable<Tag> parents() {
    return ancestors();
  }

  /**
   * All descendant elements in preorder.
   *
   * @return the descendants
   */
  public FluentIterable<Tag> descendants() {
    return elements(key -> new DescendantAxis(document(), key));
  }

  /**
   * Nearest ancestor matching a selector, never the element itself.
   *
   * @param selector the selector
   * @return the ancestor, if any
   * @throws InvalidSelectorException if the selector is invalid
   */
  public Optional<Tag> closest(final String selector) throws InvalidSelectorException {
    return closestCompiled(CompiledSelector.compile(selector));
  }

  public Optional<Tag> closestCompiled(final CompiledSelector selector) {
    requireNonNull(selector);
    final SelectorMatcher matcher = new SelectorMatcher(document());
    return ancestors().firstMatch(ancestor -> matcher.matches(ancestor.nodeKey, selector)).toJavaUtil();
  }

  // Queries against the descendants.

  public Optional<Tag> find(final String selector) throws InvalidSelectorException {
    return findCompiled(CompiledSelector.compile(selector));
  }

  public List<Tag> findAll(final String selector) throws InvalidSelectorException {
    return selectCompiled(CompiledSelector.compile(selector));
  }

  public List<Tag> select(final String selector) throws InvalidSelectorException {
    return findAll(selector);
  }

  public Optional<Tag> findCompiled(final CompiledSelector selector) {
    return soup.engine().findWithinCompiled(nodeId(), selector).map(soup::tag);
  }

  public List<Tag> selectCompiled(final CompiledSelector selector) {
    return soup.tags(soup.engine().selectWithinCompiled(nodeId(), selector));
  }

  /**
   * Text of every descendant matching a selector.
   *
   * @param selector the selector
   * @return the texts in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<String> selectText(final String selector) throws InvalidSelectorException {
    return soup.engine().selectTextWithin(nodeId(), CompiledSelector.compile(selector));
  }

  /**
   * An attribute of every descendant matching a selector.
   *
   * @param selector the selector
   * @param attribute the attribute name
   * @return one value per match, empty where a match lacks the attribute
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<Optional<String>> selectAttr(final String selector, final String attribute)
      throws InvalidSelectorException {
    return soup.engine().selectAttrWithin(nodeId(), CompiledSelector.compile(selector), attribute);
  }

  /**
   * Lazy sequence of the elements an axis starting at this element yields.
   */
  private FluentIterable<Tag> elements(final IntFunction<Axis> axisFactory) {
    return new FluentIterable<Tag>() {
      @Override
      public Iterator<Tag> iterator() {
        final Axis axis = new FilterAxis(axisFactory.apply(nodeKey), NodeKindFilter.elements(document()));
        return new AbstractIterator<Tag>() {
          @Override
          protected Tag computeNext() {
            return axis.hasNext() ? new Tag(soup, axis.nextInt()) : endOfData();
          }
        };
      }
    };
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof final Tag other && other.soup.document() == soup.document() && other.nodeKey == nodeKey;
  }

  @Override
  public int hashCode() {
    return 31 * System.identityHashCode(soup.document()) + nodeKey;
  }

  @Override
  public String toString() {
    return "<" + name() + "> #" + nodeKey;
  }
}
