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

package org.scrape.query;

import org.scrape.query.selector.AttributeSelector;
import org.scrape.query.selector.ClassSelector;
import org.scrape.query.selector.HasSelector;
import org.scrape.query.selector.IdSelector;
import org.scrape.query.selector.LogicalSelector;
import org.scrape.query.selector.NthSelector;
import org.scrape.query.selector.PseudoClassSelector;
import org.scrape.query.selector.PseudoElementSelector;
import org.scrape.query.selector.SelectorList;
import org.scrape.query.selector.SelectorVisitor;
import org.scrape.query.selector.TypeSelector;

import java.util.Comparator;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * CSS specificity: ids, then classes, attributes and pseudo-classes, then types and
 * pseudo-elements, compared lexicographically.
 *
 * @param ids number of id selectors
 * @param classes number of class, attribute and pseudo-class selectors
 * @param elements number of type selectors and pseudo-elements
 */
public record Specificity(int ids, int classes, int elements) implements Comparable<Specificity> {

  /** Lexicographic order. */
  private static final Comparator<Specificity> ORDER =
      Comparator.comparingInt(Specificity::ids).thenComparingInt(Specificity::classes)
                .thenComparingInt(Specificity::elements);

  public Specificity {
    checkArgument(ids >= 0 && classes >= 0 && elements >= 0, "Specificity counts must be >= 0!");
  }

  /**
   * Compute the specificity of a selector list by counting every simple selector of every member.
   * Combinators and the universal selector count nothing.
   *
   * @param selectors the selector list
   * @return the specificity
   */
  public static Specificity of(final SelectorList selectors) {
    final var counter = new Counter();
    selectors.accept(counter);
    return new Specificity(counter.ids, counter.classes, counter.elements);
  }

  /**
   * Pack the triple into one number: {@code ids << 32 | classes << 16 | elements}. Only ordered
   * like {@link #compareTo(Specificity)} as long as classes and elements stay below 65536.
   *
   * @return the packed value
   */
  public long value() {
    return ((long) ids << 32) | ((long) Math.min(classes, 0xFFFF) << 16) | Math.min(elements, 0xFFFF);
  }

  @Override
  public int compareTo(final Specificity other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + ids + ", " + classes + ", " + elements + ")";
  }

  private static final class Counter implements SelectorVisitor {
    private int ids;
    private int classes;
    private int elements;

    @Override
    public void visit(final IdSelector selector) {
      ids++;
    }

    @Override
    public void visit(final ClassSelector selector) {
      classes++;
    }

    @Override
    public void visit(final AttributeSelector selector) {
      classes++;
    }

    @Override
    public void visit(final PseudoClassSelector selector) {
      classes++;
    }

    @Override
    public void visit(final NthSelector selector) {
      classes++;
    }

    @Override
    public void visit(final LogicalSelector selector) {
      classes++;
    }

    @Override
    public void visit(final HasSelector selector) {
      classes++;
    }

    @Override
    public void visit(final TypeSelector selector) {
      elements++;
    }

    @Override
    public void visit(final PseudoElementSelector selector) {
      elements++;
    }
  }
}
