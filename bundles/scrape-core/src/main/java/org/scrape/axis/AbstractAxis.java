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

import com.google.common.base.MoreObjects;
import it.unimi.dsi.fastutil.ints.IntIterator;
import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.api.Axis;
import org.scrape.node.Document;
import org.scrape.settings.Fixed;

import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Provide standard Java iterator capability compatible with the enhanced for loop.
 * </p>
 * <p>
 * Override the "template method" {@code nextKey()} to implement an axis. Return {@code done()} if
 * the axis has no more "elements". Implementations compute the next key from
 * {@link #getCurrentKey()}, the key returned last (or the start key before the first step), and
 * hold any further traversal state in their own fields.
 * </p>
 */
public abstract class AbstractAxis implements Axis {

  /** Document the axis runs on. */
  protected final Document document;

  /** Key of next node. */
  private int nextNodeKey;

  /** Key of the node returned last, or the start key. */
  private int currentNodeKey;

  /** Key of node where axis started. */
  private int startNodeKey;

  /** Include self? */
  private final IncludeSelf includeSelf;

  /** Current state. */
  private State state = State.NOT_READY;

  /** State of the iterator. */
  private enum State {
    /** We have computed the next element and haven't returned it yet. */
    READY,

    /** We haven't yet computed or have already returned the element. */
    NOT_READY,

    /** We have reached the end of the data and are finished. */
    DONE,

    /** We've suffered an exception and are kaput. */
    FAILED,
  }

  /**
   * Bind axis step to a document.
   *
   * @param document the document
   * @param startKey key of the start node
   * @throws NullPointerException if {@code document} is {@code null}
   * @throws IndexOutOfBoundsException if {@code startKey} is no node of the document
   */
  public AbstractAxis(final Document document, final @NonNegative int startKey) {
    this(document, startKey, IncludeSelf.NO);
  }

  /**
   * Bind axis step to a document.
   *
   * @param document the document
   * @param startKey key of the start node
   * @param includeSelf determines if self is included
   * @throws NullPointerException if {@code document} or {@code includeSelf} is {@code null}
   * @throws IndexOutOfBoundsException if {@code startKey} is no node of the document
   */
  public AbstractAxis(final Document document, final @NonNegative int startKey, final IncludeSelf includeSelf) {
    this.document = requireNonNull(document);
    this.includeSelf = requireNonNull(includeSelf);
    document.getNode(startKey);
    reset(startKey);
  }

  @Override
  public final IntIterator iterator() {
    return this;
  }

  /**
   * Signals that axis traversal is done, that is {@code hasNext()} must return false. Is callable
   * from subclasses which implement {@link #nextKey()}.
   *
   * @return null node key to indicate that the traversal is done
   */
  protected int done() {
    return Fixed.NULL_NODE_KEY.getStandardProperty();
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * <strong>Implementors must implement {@code nextKey()} instead which is a template method called
   * from this {@code hasNext()} method.</strong>
   * </p>
   */
  @Override
  public final boolean hasNext() {
    checkState(state != State.FAILED);
    switch (state) {
      case DONE:
        return false;
      case READY:
        return true;
      case FAILED:
      case NOT_READY:
      default:
    }
    return tryToComputeNext();
  }

  /**
   * Try to compute the next node key.
   *
   * @return {@code true} if next node key exists, {@code false} otherwise
   */
  private boolean tryToComputeNext() {
    state = State.FAILED; // temporary pessimism
    nextNodeKey = nextKey();
    if (nextNodeKey == Fixed.NULL_NODE_KEY.getStandardProperty()) {
      state = State.DONE;
      return false;
    }
    state = State.READY;
    return true;
  }

  /**
   * Returns the next node key. <strong>Note:</strong> the implementation must either call
   * {@link #done()} when there are no elements left in the iteration or return
   * {@code Fixed.NULL_NODE_KEY}.
   *
   * <p>
   * Once the implementation either invokes {@link #done()} or throws an exception,
   * {@code nextKey()} is guaranteed to never be called again. Any further attempt to use the
   * iterator after an exception results in an {@link IllegalStateException}.
   * </p>
   *
   * <p>
   * The implementation of this method may not invoke the {@code hasNext}, {@code next}, or
   * {@link #peek()} methods on this instance.
   * </p>
   *
   * @return the next node key
   */
  protected abstract int nextKey();

  @Override
  public final int nextInt() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    state = State.NOT_READY;
    currentNodeKey = nextNodeKey;
    return nextNodeKey;
  }

  /**
   * Remove is not supported.
   */
  @Override
  public final void remove() {
    throw new UnsupportedOperationException();
  }

  /**
   * Resetting the nodekey of this axis to a given nodekey. Subclasses which keep their own
   * traversal state must override this method and call it.
   *
   * @param nodeKey the nodekey where the reset should occur to
   */
  @Override
  public void reset(final @NonNegative int nodeKey) {
    startNodeKey = nodeKey;
    currentNodeKey = nodeKey;
    nextNodeKey = nodeKey;
    state = State.NOT_READY;
  }

  /**
   * Get the key returned last, or the start key if nothing has been returned yet.
   *
   * @return the current key
   */
  protected final int getCurrentKey() {
    return currentNodeKey;
  }

  @Override
  public final int peek() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    return nextNodeKey;
  }

  @Override
  public final int getStartKey() {
    return startNodeKey;
  }

  @Override
  public final IncludeSelf includeSelf() {
    return includeSelf;
  }

  @Override
  public final Document getDocument() {
    return document;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("startKey", startNodeKey)
                      .add("currentKey", currentNodeKey)
                      .add("includeSelf", includeSelf)
                      .toString();
  }
}
