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

import org.scrape.node.Node;
import org.scrape.node.ValueNode;
import org.scrape.query.SelectorMatcher;
import org.scrape.settings.Fixed;

import static java.util.Objects.requireNonNull;

/**
 * Structural pseudo-classes without arguments, such as {@code :first-child}.
 */
public final class PseudoClassSelector extends SimpleSelector {

  /** Null key. */
  private static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The pseudo-class. */
  private final PseudoClass pseudoClass;

  public PseudoClassSelector(final PseudoClass pseudoClass) {
    this.pseudoClass = requireNonNull(pseudoClass);
  }

  public PseudoClass getPseudoClass() {
    return pseudoClass;
  }

  @Override
  public boolean matches(final SelectorMatcher matcher, final int nodeKey) {
    return switch (pseudoClass) {
      case FIRST_CHILD -> matcher.previousElementSibling(nodeKey, false) == NULL_KEY;
      case LAST_CHILD -> matcher.nextElementSibling(nodeKey, false) == NULL_KEY;
      case ONLY_CHILD -> matcher.previousElementSibling(nodeKey, false) == NULL_KEY
          && matcher.nextElementSibling(nodeKey, false) == NULL_KEY;
      case FIRST_OF_TYPE -> matcher.previousElementSibling(nodeKey, true) == NULL_KEY;
      case LAST_OF_TYPE -> matcher.nextElementSibling(nodeKey, true) == NULL_KEY;
      case ONLY_OF_TYPE -> matcher.previousElementSibling(nodeKey, true) == NULL_KEY
          && matcher.nextElementSibling(nodeKey, true) == NULL_KEY;
      case EMPTY -> isEmpty(matcher, nodeKey);
      case ROOT -> !matcher.getDocument().getNode(nodeKey).hasParent();
      case SCOPE -> nodeKey == matcher.getScopeKey();
    };
  }

  private static boolean isEmpty(final SelectorMatcher matcher, final int nodeKey) {
    final Node element = matcher.getDocument().getNode(nodeKey);
    for (int key = element.getFirstChildKey(); key != NULL_KEY; ) {
      final Node child = matcher.getDocument().getNode(key);
      if (child.isElement() || (child.isText() && !((ValueNode) child).getContent().isEmpty())) {
        return false;
      }
      key = child.getRightSiblingKey();
    }
    return true;
  }

  @Override
  public void accept(final SelectorVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  void appendTo(final StringBuilder css) {
    css.append(':').append(pseudoClass.getName());
  }
}
