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
 * Compound selectors joined by combinators, like {@code ul.nav > li a}. The combinator at index
 * {@code i} joins the compounds at {@code i} and {@code i + 1}.
 */
public final class ComplexSelector {

  /** The compounds, left to right. */
  private final ImmutableList<CompoundSelector> compounds;

  /** The combinators, left to right. */
  private final ImmutableList<Combinator> combinators;

  public ComplexSelector(final List<CompoundSelector> compounds, final List<Combinator> combinators) {
    this.compounds = ImmutableList.copyOf(compounds);
    this.combinators = ImmutableList.copyOf(combinators);
    checkArgument(!this.compounds.isEmpty(), "A complex selector must not be empty!");
    checkArgument(this.combinators.size() == this.compounds.size() - 1,
        "Expected one combinator between each pair of compounds!");
  }

  public ImmutableList<CompoundSelector> getCompounds() {
    return compounds;
  }

  public ImmutableList<Combinator> getCombinators() {
    return combinators;
  }

  /**
   * The rightmost compound, the one tested against the candidate element.
   *
   * @return the subject compound
   */
  public CompoundSelector getSubject() {
    return compounds.get(compounds.size() - 1);
  }

  public void accept(final SelectorVisitor visitor) {
    for (final CompoundSelector compound : compounds) {
      compound.accept(visitor);
    }
  }

  void appendTo(final StringBuilder css) {
    compounds.get(0).appendTo(css);
    for (int i = 0; i < combinators.size(); i++) {
      css.append(combinators.get(i).getSymbol());
      compounds.get(i + 1).appendTo(css);
    }
  }

  @Override
  public String toString() {
    final StringBuilder css = new StringBuilder();
    appendTo(css);
    return css.toString();
  }
}
