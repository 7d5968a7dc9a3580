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

package org.scrape.node;

import com.google.common.base.MoreObjects;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.index.DocumentIndex;
import org.scrape.settings.Fixed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * The document arena: an append-only list of {@link Node}s addressed by their index, plus an
 * optional root element.
 *
 * <p>
 * Nodes are never removed or moved, so a {@link NodeId} stays valid for the lifetime of the
 * document. A document is built by a single thread (usually the HTML parser) and is read-only
 * afterwards, at which point it may be shared between threads without synchronization.
 * </p>
 */
public final class Document {

  /** Null key. */
  private static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The arena. */
  private final List<Node> nodes;

  /** Key of the root element. */
  private int rootKey = NULL_KEY;

  /** Lazily built id, class and tag indexes, reset on every structural change. */
  private volatile Supplier<DocumentIndex> index = newIndexSupplier();

  /**
   * Create an empty document.
   */
  public Document() {
    this(Fixed.INITIAL_ARENA_CAPACITY.getStandardProperty());
  }

  /**
   * Create an empty document.
   *
   * @param initialCapacity expected number of nodes
   */
  public Document(final @NonNegative int initialCapacity) {
    checkArgument(initialCapacity >= 0, "initialCapacity must be >= 0!");
    nodes = new ArrayList<>(initialCapacity);
  }

  private Supplier<DocumentIndex> newIndexSupplier() {
    return Suppliers.memoize(() -> DocumentIndex.build(this));
  }

  /**
   * Create an element without attributes.
   *
   * @param name the element name
   * @return the id of the new, unattached node
   */
  public NodeId createElement(final String name) {
    return createElement(name, ImmutableMap.of());
  }

  /**
   * Create an element.
   *
   * @param name the element name
   * @param attributes the attributes, iteration order is kept
   * @return the id of the new, unattached node
   */
  public NodeId createElement(final String name, final Map<String, String> attributes) {
    requireNonNull(name);
    requireNonNull(attributes);
    checkArgument(!name.isEmpty(), "name must not be empty!");
    final int key = nodes.size();
    nodes.add(new ElementNode(key, name, attributes));
    return NodeId.of(key);
  }

  /**
   * Create a text node.
   *
   * @param content the unescaped content
   * @return the id of the new, unattached node
   */
  public NodeId createText(final String content) {
    final int key = nodes.size();
    nodes.add(new TextNode(key, content));
    return NodeId.of(key);
  }

  /**
   * Create a comment node.
   *
   * @param content the comment content
   * @return the id of the new, unattached node
   */
  public NodeId createComment(final String content) {
    final int key = nodes.size();
    nodes.add(new CommentNode(key, content));
    return NodeId.of(key);
  }

  /**
   * Append a node as the last child of an element, linking it to the previous last child.
   *
   * @param parent the element to append to
   * @param child an unattached node which is neither the root nor an ancestor of {@code parent}
   * @throws IllegalArgumentException if one of the ids doesn't belong to this document or the
   *         structural constraints are violated
   */
  public void appendChild(final NodeId parent, final NodeId child) {
    final Node parentNode = getNode(requireNonNull(parent).index());
    final Node childNode = getNode(requireNonNull(child).index());
    checkArgument(parentNode.mayHaveChildren(), "Only elements may have children: %s", parent);
    checkArgument(!childNode.hasParent(), "Node %s already has a parent!", child);
    checkArgument(child.index() != rootKey, "The root can't be appended to another node!");
    for (int key = parent.index(); key != NULL_KEY; key = nodes.get(key).getParentKey()) {
      checkArgument(key != child.index(), "Appending %s to %s would create a cycle!", child, parent);
    }

    final int lastChildKey = parentNode.getLastChildKey();
    if (lastChildKey != NULL_KEY) {
      nodes.get(lastChildKey).setRightSiblingKey(child.index());
      childNode.setLeftSiblingKey(lastChildKey);
    }
    childNode.setParentKey(parent.index());
    parentNode.addChildKey(child.index());
    index = newIndexSupplier();
  }

  /**
   * Set the root node. A document has at most one root, setting it twice is an error unless the
   * same node is passed again.
   *
   * @param root an element without parent
   * @throws IllegalStateException if a different root has been set before
   */
  public void setRoot(final NodeId root) {
    final Node rootNode = getNode(requireNonNull(root).index());
    checkArgument(rootNode.isElement(), "The root must be an element!");
    checkArgument(!rootNode.hasParent(), "The root must not have a parent!");
    checkState(rootKey == NULL_KEY || rootKey == root.index(), "The document already has a root!");
    rootKey = root.index();
    index = newIndexSupplier();
  }

  /**
   * Get the root element.
   *
   * @return the root, if set
   */
  public Optional<NodeId> root() {
    return rootKey == NULL_KEY ? Optional.empty() : Optional.of(NodeId.of(rootKey));
  }

  /**
   * Get the key of the root element.
   *
   * @return the key or {@link Fixed#NULL_NODE_KEY}
   */
  public int getRootKey() {
    return rootKey;
  }

  /**
   * Look up a node.
   *
   * @param id the node id
   * @return the node, or empty if the id doesn't belong to this arena
   */
  public Optional<Node> get(final NodeId id) {
    final int key = requireNonNull(id).index();
    return key < nodes.size() ? Optional.of(nodes.get(key)) : Optional.empty();
  }

  /**
   * Get a node by key.
   *
   * @param nodeKey the key
   * @return the node
   * @throws IndexOutOfBoundsException if there's no node with this key
   */
  public Node getNode(final int nodeKey) {
    checkElementIndex(nodeKey, nodes.size(), "nodeKey");
    return nodes.get(nodeKey);
  }

  /**
   * Get an element by key.
   *
   * @param nodeKey the key
   * @return the element
   * @throws IllegalArgumentException if the node isn't an element
   */
  public ElementNode getElement(final int nodeKey) {
    final Node node = getNode(nodeKey);
    checkArgument(node instanceof ElementNode, "Node %s is no element!", nodeKey);
    return (ElementNode) node;
  }

  /**
   * Determines if a key denotes an element.
   *
   * @param nodeKey the key
   * @return {@code true} if it's a valid key of an element
   */
  public boolean isElement(final int nodeKey) {
    return nodeKey >= 0 && nodeKey < nodes.size() && nodes.get(nodeKey).isElement();
  }

  /**
   * Get the id of a node key of this arena.
   *
   * @param nodeKey the key
   * @return the id
   * @throws IndexOutOfBoundsException if there's no node with this key
   */
  public NodeId nodeId(final int nodeKey) {
    checkElementIndex(nodeKey, nodes.size(), "nodeKey");
    return NodeId.of(nodeKey);
  }

  /**
   * Number of nodes in the arena, attached or not.
   *
   * @return the number of nodes
   */
  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  /**
   * All nodes in creation order.
   *
   * @return unmodifiable view of the arena
   */
  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  /**
   * Get the id, class and tag indexes of the tree below the root. They are built on first use.
   *
   * @return the indexes
   */
  public DocumentIndex getIndex() {
    return index.get();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("size", nodes.size()).add("rootKey", rootKey).toString();
  }
}
