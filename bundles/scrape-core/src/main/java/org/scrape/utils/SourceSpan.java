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

package org.scrape.utils;

import org.checkerframework.checker.index.qual.NonNegative;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A range in some source text, used to point error messages at the offending input.
 *
 * @param start the start position (inclusive)
 * @param end the end position (exclusive)
 */
public record SourceSpan(SourcePosition start, SourcePosition end) {

  public SourceSpan {
    requireNonNull(start);
    requireNonNull(end);
    checkArgument(start.offset() <= end.offset(), "start must not be behind end!");
  }

  /**
   * Create a span between two character offsets of a source.
   *
   * @param source the source text
   * @param startOffset start offset (inclusive)
   * @param endOffset end offset (exclusive)
   * @return the span
   */
  public static SourceSpan of(final CharSequence source, final @NonNegative int startOffset,
      final @NonNegative int endOffset) {
    return new SourceSpan(SourcePosition.of(source, startOffset), SourcePosition.of(source, endOffset));
  }

  /**
   * Create an empty span at a single position.
   *
   * @param position the position
   * @return the span
   */
  public static SourceSpan at(final SourcePosition position) {
    return new SourceSpan(position, position);
  }

  /**
   * Line of the start position.
   *
   * @return the line, starting at 1
   */
  public int line() {
    return start.line();
  }

  /**
   * Column of the start position.
   *
   * @return the column, starting at 1
   */
  public int column() {
    return start.column();
  }

  @Override
  public String toString() {
    return start.toString();
  }
}
