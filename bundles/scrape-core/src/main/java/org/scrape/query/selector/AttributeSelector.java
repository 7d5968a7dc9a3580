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

import com.google.common.base.Ascii;
import org.scrape.query.SelectorMatcher;

import static java.util.Objects.requireNonNull;

/**
 * Attribute presence and value tests such as {@code [href]} or {@code [lang|=en i]}. Attribute
 * names are compared case-insensitively, values case-sensitively unless the {@code i} flag is
 * given.
 */
public final class AttributeSelector extends SimpleSelector {

  /** Lower case attribute name. */
  private final String name;

  /** The operator. */
  private final AttributeOperator operator;

  /** Expected value, empty for {@link AttributeOperator#EXISTS}. */
  private final String value;

  /** Compare values ASCII case-insensitively. */
  private final boolean ignoreCase;

  public AttributeSelector(final String name, final AttributeOperator operator, final String value,
      final boolean ignoreCase) {
    this.name = Ascii.toLowerCase(requireNonNull(name));
    this.operator = requireNonNull(operator);
    this.value = requireNonNull(value);
    this.ignoreCase = ignoreCase;
  }

  /**
   * An existence test.
   *
   * @param name the attribute name
   * @return the selector
   */
  public static AttributeSelector exists(final String name) {
    return new AttributeSelector(name, AttributeOperator.EXISTS, "", false);
  }

  public String getName() {
    return name;
  }

  public AttributeOperator getOperator() {
    return operator;
  }

  public String getValue() {
    return value;
  }

  public boolean isIgnoreCase() {
    return ignoreCase;
  }

  @Override
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    final String actual = matcher.getDocument().getElement(nodeKey).getAttributeIgnoreCase(name);
    if (actual == null) {
      return false;
    }
    if (ignoreCase) {
      return operator.test(Ascii.toLowerCase(actual), Ascii.toLowerCase(value));
    }
    return operator.test(actual, value);
  }

  @Override
  public void accept(final SelectorVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  void appendTo(final StringBuilder css) {
    css.append('[');
    Identifiers.appendIdentifier(name, css);
    if (operator != AttributeOperator.EXISTS) {
      css.append(operator.getSymbol());
      Identifiers.appendString(value, css);
      if (ignoreCase) {
        css.append(" i");
      }
    }
    css.append(']');
  }
}
