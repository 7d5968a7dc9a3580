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
import org.scrape.query.SelectorMatcher;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@code :has(...)}: matches elements for which one of the relative selectors finds an element.
 */
public final class HasSelector extends SimpleSelector {

  /** The arguments. */
  private final ImmutableList<RelativeSelector> arguments;

  public HasSelector(final List<RelativeSelector> arguments) {
    this.arguments = ImmutableList.copyOf(arguments);
    checkArgument(!this.arguments.isEmpty(), ":has() needs an argument!");
  }

  public ImmutableList<RelativeSelector> getArguments() {
    return arguments;
  }

  @Override
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    for (final RelativeSelector argument : arguments) {
      if (matcher.matchesRelative(nodeKey, argument)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void accept(final SelectorVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  void appendTo(final StringBuilder css) {
    css.append(":has(");
    for (int i = 0; i < arguments.size(); i++) {
      if (i > 0) {
        css.append(", ");
      }
      arguments.get(i).appendTo(css);
    }
    css.append(')');
  }
}
