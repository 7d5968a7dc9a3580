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

import org.scrape.query.SelectorMatcher;

import static java.util.Objects.requireNonNull;

/**
 * {@code :not(...)}, {@code :is(...)} and {@code :where(...)}.
 */
public final class LogicalSelector extends SimpleSelector {

  /** The logical pseudo-classes. */
  public enum Kind {
    NOT("not"),
    IS("is"),
    WHERE("where");

    /** CSS name. */
    private final String name;

    Kind(final String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }
  }

  /** The pseudo-class. */
  private final Kind kind;

  /** The argument. */
  private final SelectorList arguments;

  public LogicalSelector(final Kind kind, final SelectorList arguments) {
    this.kind = requireNonNull(kind);
    this.arguments = requireNonNull(arguments);
  }

  public Kind getKind() {
    return kind;
  }

  public SelectorList getArguments() {
    return arguments;
  }

  @Override
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    final boolean matchesAny = matcher.matches(nodeKey, arguments);
    return kind == Kind.NOT ? !matchesAny : matchesAny;
  }

  @Override
  public void accept(final SelectorVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  void appendTo(final StringBuilder css) {
    css.append(':').append(kind.getName()).append('(');
    arguments.appendTo(css);
    css.append(')');
  }
}
