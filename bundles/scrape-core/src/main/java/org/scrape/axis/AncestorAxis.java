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

package org.scrape.axis;

import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.node.Document;
import org.scrape.node.Node;

/**
 * <p>
 * Iterate over all ancestors of the start node, nearest first, up to the root. The walk follows
 * parent links in a loop, so it doesn't depend on the depth of the tree.
 * </p>
 */
public final class AncestorAxis extends AbstractAxis {

  /** First call. */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param document the document
   * @param startKey key of the start node
   */
  public AncestorAxis(final Document document, final @NonNegative int startKey) {
    super(document, startKey);
  }

  /**
   * Constructor initializing internal state.
   *
   * @param document the document
   * @param startKey key of the start node
   * @param includeSelf determines if current node is included or not
   */
  public AncestorAxis(final Document document, final @NonNegative int startKey, final IncludeSelf includeSelf) {
    super(document, startKey, includeSelf);
  }

  @Override
  public void reset(final @NonNegative int nodeKey) {
    super.reset(nodeKey);
    first = true;
  }

  @Override
  protected int nextKey() {
    if (first) {
      first = false;
      if (includeSelf() == IncludeSelf.YES) {
        return getCurrentKey();
      }
    }
    final Node node = document.getNode(getCurrentKey());
    if (node.hasParent()) {
      return node.getParentKey();
    }
    return done();
  }
}
