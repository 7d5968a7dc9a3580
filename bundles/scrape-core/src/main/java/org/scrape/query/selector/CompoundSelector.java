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

package org.scrape.query.selector;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.query.SelectorMatcher;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A sequence of simple selectors without combinator in between, like {@code div.item[data-id]}.
 */
public final class CompoundSelector {

  /** The simple selectors, type or universal selector first. */
  private final ImmutableList<SimpleSelector> selectors;

  public CompoundSelector(final List<SimpleSelector> selectors) {
    this.selectors = ImmutableList.copyOf(selectors);
    checkArgument(!this.selectors.isEmpty(), "A compound selector must not be empty!");
  }

  public ImmutableList<SimpleSelector> getSelectors() {
    return selectors;
  }

  /**
   * Test an element against all simple selectors.
   *
   * @param matcher the matcher of the running query
   * @param nodeKey key of an element node
   * @return {@code true} if all tests pass
   */
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    for (final SimpleSelector selector : selectors) {
      if (!selector.matches(matcher, nodeKey)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Find the first simple selector of a given class.
   *
   * @param type the selector class
   * @param <T> the selector type
   * @return the selector or {@code null}
   */
  public <T extends SimpleSelector> @Nullable T find(final Class<T> type) {
    for (final SimpleSelector selector : selectors) {
      if (type.isInstance(selector)) {
        return type.cast(selector);
      }
    }
    return null;
  }

  public void accept(final SelectorVisitor visitor) {
    for (final SimpleSelector selector : selectors) {
      selector.accept(visitor);
    }
  }

  void appendTo(final StringBuilder css) {
    for (final SimpleSelector selector : selectors) {
      selector.appendTo(css);
    }
  }

  @Override
  public String toString() {
    final StringBuilder css = new StringBuilder();
    appendTo(css);
    return css.toString();
  }
}
