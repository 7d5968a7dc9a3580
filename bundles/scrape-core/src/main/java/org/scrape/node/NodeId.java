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

import org.checkerframework.checker.index.qual.NonNegative;

/**
 * Opaque handle of a node in a {@link Document}. Handles are only handed out by the document which
 * created the node, they are never reused and stay valid for the lifetime of the document.
 */
public final class NodeId implements Comparable<NodeId> {

  /** Index into the arena. */
  private final int index;

  private NodeId(final @NonNegative int index) {
    this.index = index;
  }

  static NodeId of(final @NonNegative int index) {
    return new NodeId(index);
  }

  /**
   * Get the index of the node in its arena. Indexes of nodes created by the HTML parser follow
   * document order.
   *
   * @return the index
   */
  public int index() {
    return index;
  }

  @Override
  public int compareTo(final NodeId other) {
    return Integer.compare(index, other.index);
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof final NodeId other && other.index == index;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(index);
  }

  @Override
  public String toString() {
    return "NodeId(" + index + ")";
  }
}
