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

package org.scrape.axis.filter;

import org.scrape.node.Document;
import org.scrape.query.CompiledSelector;
import org.scrape.query.SelectorMatcher;

import static java.util.Objects.requireNonNull;

/**
 * Only lets elements pass which match a compiled selector.
 */
public final class SelectorFilter extends AbstractFilter {

  /** Matcher bound to the document. */
  private final SelectorMatcher matcher;

  /** The selector. */
  private final CompiledSelector selector;

  /**
   * Constructor, {@code :scope} refers to the root.
   *
   * @param document the document
   * @param selector the selector to match
   */
  public SelectorFilter(final Document document, final CompiledSelector selector) {
    this(new SelectorMatcher(document), selector);
  }

  /**
   * Constructor.
   *
   * @param matcher the matcher to use
   * @param selector the selector to match
   */
  public SelectorFilter(final SelectorMatcher matcher, final CompiledSelector selector) {
    super(matcher.getDocument());
    this.matcher = matcher;
    this.selector = requireNonNull(selector);
  }

  public CompiledSelector getSelector() {
    return selector;
  }

  @Override
  public boolean filter(final int nodeKey) {
    return matcher.matches(nodeKey, selector);
  }
}
