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

package org.scrape.query.explain;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.scrape.query.Specificity;

import java.util.List;
import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Read-only report about a selector: specificity, what it selects and how it could perform.
 */
public final class SelectorExplanation {

  private final String source;

  private final Specificity specificity;

  private final String description;

  private final ImmutableList<String> performanceNotes;

  private final ImmutableList<OptimizationHint> hints;

  private final OptionalInt estimatedMatches;

  SelectorExplanation(final String source, final Specificity specificity, final String description,
      final List<String> performanceNotes, final List<OptimizationHint> hints, final OptionalInt estimatedMatches) {
    this.source = requireNonNull(source);
    this.specificity = requireNonNull(specificity);
    this.description = requireNonNull(description);
    this.performanceNotes = ImmutableList.copyOf(performanceNotes);
    this.hints = ImmutableList.copyOf(hints);
    this.estimatedMatches = requireNonNull(estimatedMatches);
  }

  public String getSource() {
    return source;
  }

  public Specificity getSpecificity() {
    return specificity;
  }

  public String getDescription() {
    return description;
  }

  public ImmutableList<String> getPerformanceNotes() {
    return performanceNotes;
  }

  public ImmutableList<OptimizationHint> getHints() {
    return hints;
  }

  /**
   * Determines if a hint of a given kind has been given.
   *
   * @param kind the kind
   * @return {@code true} if there is such a hint
   */
  public boolean hasHint(final OptimizationHint.Kind kind) {
    return hints.stream().anyMatch(hint -> hint.getKind() == kind);
  }

  /**
   * Number of matches in the document the selector was explained against.
   *
   * @return the count, empty if no document was given
   */
  public OptionalInt getEstimatedMatches() {
    return estimatedMatches;
  }

  /**
   * Render the report as multi-line text.
   *
   * @return the report
   */
  public String format() {
    final StringBuilder out = new StringBuilder();
    out.append("Selector: ").append(source).append('\n');
    out.append("Specificity: ").append(specificity).append('\n');
    out.append("Description: ").append(description).append('\n');
    estimatedMatches.ifPresent(count -> out.append("Estimated matches: ").append(count).append('\n'));
    if (!performanceNotes.isEmpty()) {
      out.append("Performance notes:\n");
      for (final String note : performanceNotes) {
        out.append("  - ").append(note).append('\n');
      }
    }
    if (!hints.isEmpty()) {
      out.append("Hints:\n");
      for (final OptimizationHint hint : hints) {
        out.append("  - ").append(hint.getMessage()).append('\n');
      }
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("source", source)
                      .add("specificity", specificity)
                      .add("description", description)
                      .add("hints", hints)
                      .toString();
  }
}
