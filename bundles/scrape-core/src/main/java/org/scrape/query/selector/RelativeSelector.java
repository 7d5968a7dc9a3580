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

import static java.util.Objects.requireNonNull;

/**
 * A complex selector anchored at the element tested by {@code :has()}, for instance {@code > img}.
 */
public final class RelativeSelector {

  /** Relation between the anchor and the leftmost compound. */
  private final Combinator combinator;

  /** The selector. */
  private final ComplexSelector selector;

  public RelativeSelector(final Combinator combinator, final ComplexSelector selector) {
    this.combinator = requireNonNull(combinator);
    this.selector = requireNonNull(selector);
  }

  public Combinator getCombinator() {
    return combinator;
  }

  public ComplexSelector getSelector() {
    return selector;
  }

  void appendTo(final StringBuilder css) {
    if (combinator != Combinator.DESCENDANT) {
      css.append(combinator.getSymbol().strip()).append(' ');
    }
    selector.appendTo(css);
  }

  @Override
  public String toString() {
    final StringBuilder css = new StringBuilder();
    appendTo(css);
    return css.toString();
  }
}
