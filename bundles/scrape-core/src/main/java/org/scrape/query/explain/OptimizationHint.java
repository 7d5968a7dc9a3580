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
import com.google.common.base.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A suggestion how a selector could be written or used more efficiently.
 */
public final class OptimizationHint {

  /** Kinds of hints. */
  public enum Kind {
    /** Nothing to improve. */
    OPTIMAL,

    /** An attribute test on {@code id} should be an id selector. */
    USE_ID_SELECTOR,

    /** The selector probably visits much more of the document than necessary. */
    TOO_BROAD,

    /** A descendant combinator could be a child combinator. */
    PREFER_CHILD_COMBINATOR,

    /** The universal selector forces a test of every element. */
    AVOID_UNIVERSAL_SELECTOR,

    /** Compiling the selector is costly enough to keep the compiled form around. */
    CACHE_SELECTOR
  }

  /** Shared instances of the hints without details. */
  private static final OptimizationHint OPTIMAL = new OptimizationHint(Kind.OPTIMAL, null, null);

  private static final OptimizationHint AVOID_UNIVERSAL = new OptimizationHint(Kind.AVOID_UNIVERSAL_SELECTOR, null,
      null);

  private static final OptimizationHint CACHE = new OptimizationHint(Kind.CACHE_SELECTOR, null, null);

  /** The kind. */
  private final Kind kind;

  /** First detail: current form, reason or location. */
  private final @Nullable String detail;

  /** Second detail: suggested form. */
  private final @Nullable String suggestion;

  private OptimizationHint(final Kind kind, final @Nullable String detail, final @Nullable String suggestion) {
    this.kind = kind;
    this.detail = detail;
    this.suggestion = suggestion;
  }

  public static OptimizationHint optimal() {
    return OPTIMAL;
  }

  public static OptimizationHint avoidUniversalSelector() {
    return AVOID_UNIVERSAL;
  }

  public static OptimizationHint cacheSelector() {
    return CACHE;
  }

  public static OptimizationHint useIdSelector(final String current, final String suggested) {
    return new OptimizationHint(Kind.USE_ID_SELECTOR, requireNonNull(current), requireNonNull(suggested));
  }

  public static OptimizationHint tooBroad(final String reason) {
    return new OptimizationHint(Kind.TOO_BROAD, requireNonNull(reason), null);
  }

  public static OptimizationHint preferChildCombinator(final String at) {
    return new OptimizationHint(Kind.PREFER_CHILD_COMBINATOR, requireNonNull(at), null);
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * The current form of a {@link Kind#USE_ID_SELECTOR} hint.
   *
   * @return the current form
   */
  public Optional<String> getCurrent() {
    return kind == Kind.USE_ID_SELECTOR ? Optional.ofNullable(detail) : Optional.empty();
  }

  /**
   * The suggested form of a {@link Kind#USE_ID_SELECTOR} hint.
   *
   * @return the suggested form
   */
  public Optional<String> getSuggested() {
    return Optional.ofNullable(suggestion);
  }

  /**
   * The reason of a {@link Kind#TOO_BROAD} hint.
   *
   * @return the reason
   */
  public Optional<String> getReason() {
    return kind == Kind.TOO_BROAD ? Optional.ofNullable(detail) : Optional.empty();
  }

  /**
   * The part of the selector a {@link Kind#PREFER_CHILD_COMBINATOR} hint refers to.
   *
   * @return the location
   */
  public Optional<String> getAt() {
    return kind == Kind.PREFER_CHILD_COMBINATOR ? Optional.ofNullable(detail) : Optional.empty();
  }

  /**
   * Human-readable text of the hint.
   *
   * @return the text
   */
  public String getMessage() {
    return switch (kind) {
      case OPTIMAL -> "Selector is already optimal";
      case USE_ID_SELECTOR -> "Use ID selector '" + suggestion + "' instead of '" + detail + "'";
      case TOO_BROAD -> "Too broad: " + detail;
      case PREFER_CHILD_COMBINATOR -> "Consider using child combinator (>) instead of descendant at '" + detail + "'";
      case AVOID_UNIVERSAL_SELECTOR -> "Avoid universal selector (*) for better performance";
      case CACHE_SELECTOR -> "Consider caching this compiled selector for reuse";
    };
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof final OptimizationHint other && other.kind == kind && Objects.equal(other.detail, detail)
        && Objects.equal(other.suggestion, suggestion);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, detail, suggestion);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("kind", kind)
                      .add("detail", detail)
                      .add("suggestion", suggestion)
                      .omitNullValues()
                      .toString();
  }
}
