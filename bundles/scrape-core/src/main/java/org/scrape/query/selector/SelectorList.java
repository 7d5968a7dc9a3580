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

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Comma separated complex selectors. An element matches the list if it matches any member.
 */
public final class SelectorList {

  /** The members. */
  private final ImmutableList<ComplexSelector> selectors;

  public SelectorList(final List<ComplexSelector> selectors) {
    this.selectors = ImmutableList.copyOf(selectors);
    checkArgument(!this.selectors.isEmpty(), "A selector list must not be empty!");
  }

  public ImmutableList<ComplexSelector> getSelectors() {
    return selectors;
  }

  /**
   * Visit the simple selectors of all members.
   *
   * @param visitor the visitor
   */
  public void accept(final SelectorVisitor visitor) {
    for (final ComplexSelector selector : selectors) {
      selector.accept(visitor);
    }
  }

  void appendTo(final StringBuilder css) {
    for (int i = 0; i < selectors.size(); i++) {
      if (i > 0) {
        css.append(", ");
      }
      selectors.get(i).appendTo(css);
    }
  }

  @Override
  public String toString() {
    final StringBuilder css = new StringBuilder();
    appendTo(css);
    return css.toString();
  }
}
