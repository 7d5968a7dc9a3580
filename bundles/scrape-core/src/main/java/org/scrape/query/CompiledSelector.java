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

import org.scrape.exception.InvalidSelectorException;
import org.scrape.query.explain.SelectorExplainer;
import org.scrape.query.explain.SelectorExplanation;
import org.scrape.query.parser.SelectorParser;
import org.scrape.query.selector.SelectorList;

import static java.util.Objects.requireNonNull;

/**
 * A parsed selector list together with its source and specificity. Compiling is the only step
 * which can fail; a compiled selector is immutable, independent of any document and may be reused
 * from any number of threads.
 */
public final class CompiledSelector {

  /** The source. */
  private final String source;

  /** The parsed selectors. */
  private final SelectorList selectorList;

  /** Specificity, summed over all selectors of the list. */
  private final Specificity specificity;

  private CompiledSelector(final String source, final SelectorList selectorList) {
    this.source = source;
    this.selectorList = selectorList;
    this.specificity = Specificity.of(selectorList);
  }

  /**
   * Compile a selector.
   *
   * @param source one or more comma separated selectors
   * @return the compiled selector
   * @throws InvalidSelectorException if the selector is syntactically invalid or unsupported
   */
  public static CompiledSelector compile(final String source) throws InvalidSelectorException {
    requireNonNull(source);
    return new CompiledSelector(source, new SelectorParser(source).parse());
  }

  public String getSource() {
    return source;
  }

  public SelectorList getSelectorList() {
    return selectorList;
  }

  public Specificity getSpecificity() {
    return specificity;
  }

  /**
   * Explain this selector with the default thresholds, without match count.
   *
   * @return the explanation
   */
  public SelectorExplanation explain() {
    return new SelectorExplainer().explain(this);
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof final CompiledSelector other && other.source.equals(source);
  }

  @Override
  public int hashCode() {
    return source.hashCode();
  }

  @Override
  public String toString() {
    return source;
  }
}
