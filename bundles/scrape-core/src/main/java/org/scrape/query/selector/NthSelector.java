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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.query.SelectorMatcher;

import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * {@code :nth-child(An+B)} and its relatives: matches elements whose 1-based position among their
 * element siblings is {@code A*n + B} for some {@code n >= 0}.
 */
public final class NthSelector extends SimpleSelector {

  /** The positional pseudo-classes. */
  public enum Kind {
    CHILD("nth-child", false, false),
    LAST_CHILD("nth-last-child", false, true),
    OF_TYPE("nth-of-type", true, false),
    LAST_OF_TYPE("nth-last-of-type", true, true);

    /** Lookup by CSS name. */
    private static final ImmutableMap<String, Kind> BY_NAME =
        Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(Kind::getName, k -> k));

    /** CSS name. */
    private final String name;

    /** Only count siblings with the same name. */
    private final boolean ofType;

    /** Count from the last sibling. */
    private final boolean fromEnd;

    Kind(final String name, final boolean ofType, final boolean fromEnd) {
      this.name = name;
      this.ofType = ofType;
      this.fromEnd = fromEnd;
    }

    public String getName() {
      return name;
    }

    /**
     * Look up a kind.
     *
     * @param name lower case function name
     * @return the kind or {@code null} if unknown
     */
    public static @Nullable Kind fromName(final String name) {
      return BY_NAME.get(name);
    }
  }

  /** Which siblings are counted. */
  private final Kind kind;

  /** Step. */
  private final int a;

  /** Offset. */
  private final int b;

  public NthSelector(final Kind kind, final int a, final int b) {
    this.kind = requireNonNull(kind);
    this.a = a;
    this.b = b;
  }

  public Kind getKind() {
    return kind;
  }

  public int getA() {
    return a;
  }

  public int getB() {
    return b;
  }

  @Override
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    return matchesPosition(matcher.elementPosition(nodeKey, kind.ofType, kind.fromEnd));
  }

  /**
   * Determines if a position is covered by {@code An+B}.
   *
   * @param position 1-based position
   * @return {@code true} if there's an {@code n >= 0} with {@code A*n + B == position}
   */
  public boolean matchesPosition(final int position) {
    if (a == 0) {
      return position == b;
    }
    final long diff = (long) position - b;
    return diff % a == 0 && diff / a >= 0;
  }

  @Override
  public void accept(final SelectorVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  void appendTo(final StringBuilder css) {
    css.append(':').append(kind.getName()).append('(');
    if (a != 0) {
      if (a == -1) {
        css.append('-');
      } else if (a != 1) {
        css.append(a);
      }
      css.append('n');
      if (b > 0) {
        css.append('+').append(b);
      } else if (b < 0) {
        css.append(b);
      }
    } else {
      css.append(b);
    }
    css.append(')');
  }
}
