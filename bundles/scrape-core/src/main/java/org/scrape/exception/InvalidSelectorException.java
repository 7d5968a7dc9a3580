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

package org.scrape.exception;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.utils.SourceSpan;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A selector string could not be compiled.
 */
public final class InvalidSelectorException extends ScrapeException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /** The bare reason, without position prefix. */
  private final String reason;

  /** Where in the selector the error occurred, if known. */
  private final transient @Nullable SourceSpan span;

  /**
   * Constructor.
   *
   * @param reason what is wrong with the selector
   */
  public InvalidSelectorException(final String reason) {
    this(reason, null);
  }

  /**
   * Constructor.
   *
   * @param reason what is wrong with the selector
   * @param span where in the selector the error occurred, may be {@code null}
   */
  public InvalidSelectorException(final String reason, final @Nullable SourceSpan span) {
    super(format(reason, span));
    this.reason = requireNonNull(reason);
    this.span = span;
  }

  private static String format(final String reason, final @Nullable SourceSpan span) {
    if (span == null) {
      return "invalid selector: " + reason;
    }
    return "invalid selector at line " + span.line() + ", column " + span.column() + ": " + reason;
  }

  /**
   * Get the reason without position information.
   *
   * @return the reason
   */
  public String getReason() {
    return reason;
  }

  /**
   * Get the position of the error.
   *
   * @return the span, if known
   */
  public Optional<SourceSpan> getSpan() {
    return Optional.ofNullable(span);
  }

  /**
   * Line of the error.
   *
   * @return the 1-based line, or {@code -1} if unknown
   */
  public int getLine() {
    return span == null ? -1 : span.line();
  }

  /**
   * Column of the error.
   *
   * @return the 1-based column, or {@code -1} if unknown
   */
  public int getColumn() {
    return span == null ? -1 : span.column();
  }
}
