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

import com.google.common.collect.ImmutableSet;
import org.scrape.query.SelectorMatcher;

import static java.util.Objects.requireNonNull;

/**
 * Pseudo-elements like {@code ::before}. They don't exist in the document tree, so they never
 * match; they only count towards specificity.
 */
public final class PseudoElementSelector extends SimpleSelector {

  /** Supported pseudo-elements. */
  public static final ImmutableSet<String> NAMES =
      ImmutableSet.of("before", "after", "first-line", "first-letter", "marker", "placeholder", "selection");

  /** Pseudo-elements which may also be written with a single colon. */
  public static final ImmutableSet<String> LEGACY_NAMES =
      ImmutableSet.of("before", "after", "first-line", "first-letter");

  /** Lower case name. */
  private final String name;

  public PseudoElementSelector(final String name) {
    this.name = requireNonNull(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    return false;
  }

  @Override
  public void accept(final SelectorVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  void appendTo(final StringBuilder css) {
    css.append("::").append(name);
  }
}
