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
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.settings.Fixed;

/**
 * A node of the document arena. Structural links are stored as node keys, that is indexes into the
 * arena, with {@link Fixed#NULL_NODE_KEY} denoting a missing link. Links are only ever set by
 * {@link Document#appendChild(NodeId, NodeId)}.
 */
public abstract class Node {

  /** Null key. */
  static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** Key of this node. */
  private final int nodeKey;

  /** Key of the parent node. */
  private int parentKey = NULL_KEY;

  /** Key of the left sibling. */
  private int leftSiblingKey = NULL_KEY;

  /** Key of the right sibling. */
  private int rightSiblingKey = NULL_KEY;

  /** Keys of the children, {@code null} for nodes which can't have children. */
  private final @Nullable IntArrayList childKeys;

  Node(final @NonNegative int nodeKey, final boolean mayHaveChildren) {
    this.nodeKey = nodeKey;
    this.childKeys = mayHaveChildren ? new IntArrayList(2) : null;
  }

  /**
   * Get the kind of the node.
   *
   * @return the kind
   */
  public abstract NodeKind getKind();

  public final int getNodeKey() {
    return nodeKey;
  }

  public final int getParentKey() {
    return parentKey;
  }

  public final boolean hasParent() {
    return parentKey != NULL_KEY;
  }

  public final int getLeftSiblingKey() {
    return leftSiblingKey;
  }

  public final boolean hasLeftSibling() {
    return leftSiblingKey != NULL_KEY;
  }

  public final int getRightSiblingKey() {
    return rightSiblingKey;
  }

  public final boolean hasRightSibling() {
    return rightSiblingKey != NULL_KEY;
  }

  /**
   * Get the key of the first child.
   *
   * @return the key or {@link Fixed#NULL_NODE_KEY}
   */
  public final int getFirstChildKey() {
    return childKeys == null || childKeys.isEmpty() ? NULL_KEY : childKeys.getInt(0);
  }

  /**
   * Get the key of the last child.
   *
   * @return the key or {@link Fixed#NULL_NODE_KEY}
   */
  public final int getLastChildKey() {
    return childKeys == null || childKeys.isEmpty() ? NULL_KEY : childKeys.getInt(childKeys.size() - 1);
  }

  public final boolean hasFirstChild() {
    return childKeys != null && !childKeys.isEmpty();
  }

  public final int getChildCount() {
    return childKeys == null ? 0 : childKeys.size();
  }

  /**
   * Get the keys of all children in document order.
   *
   * @return unmodifiable view of the child keys
   */
  public final IntList getChildKeys() {
    return childKeys == null ? IntLists.emptyList() : IntLists.unmodifiable(childKeys);
  }

  /**
   * Determines if children may be appended to this node.
   *
   * @return {@code true} for elements
   */
  public final boolean mayHaveChildren() {
    return childKeys != null;
  }

  public final boolean isElement() {
    return getKind() == NodeKind.ELEMENT;
  }

  public final boolean isText() {
    return getKind() == NodeKind.TEXT;
  }

  public final boolean isComment() {
    return getKind() == NodeKind.COMMENT;
  }

  void setParentKey(final int parentKey) {
    this.parentKey = parentKey;
  }

  void setLeftSiblingKey(final int leftSiblingKey) {
    this.leftSiblingKey = leftSiblingKey;
  }

  void setRightSiblingKey(final int rightSiblingKey) {
    this.rightSiblingKey = rightSiblingKey;
  }

  void addChildKey(final int childKey) {
    assert childKeys != null;
    childKeys.add(childKey);
  }

  MoreObjects.ToStringHelper toStringHelper() {
    return MoreObjects.toStringHelper(this)
                      .add("nodeKey", nodeKey)
                      .add("parentKey", parentKey)
                      .add("leftSiblingKey", leftSiblingKey)
                      .add("rightSiblingKey", rightSiblingKey)
                      .add("childCount", getChildCount());
  }

  @Override
  public String toString() {
    return toStringHelper().toString();
  }
}
