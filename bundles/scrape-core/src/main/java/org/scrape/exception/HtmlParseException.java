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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * HTML input could not be turned into a document. Instances are created through the static
 * factory methods, one per {@link ParseError} kind.
 */
public final class HtmlParseException extends ScrapeException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /** Kind of the error. */
  private final ParseError error;

  /** Maximum depth which has been exceeded, or {@code -1}. */
  private final int maxDepth;

  /** Location of the error, if known. */
  private final transient @Nullable SourceSpan span;

  private HtmlParseException(final ParseError error, final String message, final int maxDepth,
      final @Nullable SourceSpan span, final @Nullable Throwable cause) {
    super(message, cause);
    this.error = requireNonNull(error);
    this.maxDepth = maxDepth;
    this.span = span;
  }

  /**
   * The element nesting is deeper than allowed.
   *
   * @param maxDepth the configured maximum
   * @param span position of the offending element, may be {@code null}
   * @return the exception
   */
  public static HtmlParseException maxDepthExceeded(final int maxDepth, final @Nullable SourceSpan span) {
    checkArgument(maxDepth > 0, "maxDepth must be > 0!");
    return new HtmlParseException(ParseError.MAX_DEPTH_EXCEEDED,
        "maximum nesting depth of " + maxDepth + " exceeded" + at(span), maxDepth, span, null);
  }

  /**
   * Nothing to parse.
   *
   * @return the exception
   */
  public static HtmlParseException emptyInput() {
    return new HtmlParseException(ParseError.EMPTY_INPUT, "empty or whitespace-only input", -1, null, null);
  }

  /**
   * The input bytes could not be decoded.
   *
   * @param message description
   * @param cause the underlying failure, may be {@code null}
   * @return the exception
   */
  public static HtmlParseException encodingError(final String message, final @Nullable Throwable cause) {
    return new HtmlParseException(ParseError.ENCODING_ERROR, "encoding error: " + message, -1, null, cause);
  }

  /**
   * The markup is malformed.
   *
   * @param message description
   * @param span position of the error, may be {@code null}
   * @return the exception
   */
  public static HtmlParseException malformedHtml(final String message, final @Nullable SourceSpan span) {
    return new HtmlParseException(ParseError.MALFORMED_HTML, "malformed HTML: " + message + at(span), -1, span,
        null);
  }

  /**
   * The parser failed unexpectedly.
   *
   * @param message description
   * @param cause the underlying failure, may be {@code null}
   * @return the exception
   */
  public static HtmlParseException internalError(final String message, final @Nullable Throwable cause) {
    return new HtmlParseException(ParseError.INTERNAL_ERROR, "internal parser error: " + message, -1, null, cause);
  }

  private static String at(final @Nullable SourceSpan span) {
    return span == null ? "" : " at line " + span.line() + ", column " + span.column();
  }

  /**
   * Get the kind of error.
   *
   * @return the kind
   */
  public ParseError getError() {
    return error;
  }

  /**
   * The configured maximum depth, only set for {@link ParseError#MAX_DEPTH_EXCEEDED}.
   *
   * @return the maximum depth or {@code -1}
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  /**
   * Get the location of the error.
   *
   * @return the span, if known
   */
  public Optional<SourceSpan> getSpan() {
    return Optional.ofNullable(span);
  }
}
