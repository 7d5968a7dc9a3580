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
import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.util.Objects.requireNonNull;

/**
 * A position in some source text: 1-based line and column plus the 0-based character offset.
 *
 * @param line the line, starting at 1
 * @param column the column, starting at 1
 * @param offset the character offset, starting at 0
 */
public record SourcePosition(int line, int column, int offset) {

  public SourcePosition {
    checkArgument(line > 0, "line must be > 0!");
    checkArgument(column > 0, "column must be > 0!");
    checkArgument(offset >= 0, "offset must be >= 0!");
  }

  /**
   * Compute the position of a character offset by counting line breaks up to it. {@code \r\n} and
   * a lone {@code \r} count as one line break each.
   *
   * @param source the source text
   * @param offset the character offset, may be equal to the length of the source
   * @return the position
   * @throws IndexOutOfBoundsException if the offset is out of range
   */
  public static SourcePosition of(final CharSequence source, final @NonNegative int offset) {
    requireNonNull(source);
    checkPositionIndex(offset, source.length());
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      final char c = source.charAt(i);
      if (c == '\n' || (c == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
        line++;
        lineStart = i + 1;
      }
    }
    return new SourcePosition(line, offset - lineStart + 1, offset);
  }

  @Override
  public String toString() {
    return "line " + line + ", column " + column;
  }
}
