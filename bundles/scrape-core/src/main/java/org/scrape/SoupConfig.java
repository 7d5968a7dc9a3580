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

package org.scrape;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.settings.Fixed;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Immutable parser settings.
 */
public final class SoupConfig {

  /** The defaults. */
  private static final SoupConfig DEFAULTS = newBuilder().build();

  /** Maximum element nesting depth, the root element has depth 1. */
  private final int maxDepth;

  /** Report malformed markup instead of recovering from it. */
  private final boolean strictMode;

  /** Keep whitespace-only text nodes. */
  private final boolean preserveWhitespace;

  /** Keep comments. */
  private final boolean includeComments;

  private SoupConfig(final Builder builder) {
    maxDepth = builder.maxDepth;
    strictMode = builder.strictMode;
    preserveWhitespace = builder.preserveWhitespace;
    includeComments = builder.includeComments;
  }

  /**
   * Get the default settings: depth 512, lenient, whitespace-only text and comments dropped.
   *
   * @return the defaults
   */
  public static SoupConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Get a new builder instance.
   *
   * @return {@link Builder} instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  public int getMaxDepth() {
    return maxDepth;
  }

  public boolean isStrictMode() {
    return strictMode;
  }

  public boolean isPreserveWhitespace() {
    return preserveWhitespace;
  }

  public boolean isIncludeComments() {
    return includeComments;
  }

  @Override
  public boolean equals(final Object obj) {
    return obj instanceof final SoupConfig other && other.maxDepth == maxDepth && other.strictMode == strictMode
        && other.preserveWhitespace == preserveWhitespace && other.includeComments == includeComments;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(maxDepth, strictMode, preserveWhitespace, includeComments);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("maxDepth", maxDepth)
                      .add("strictMode", strictMode)
                      .add("preserveWhitespace", preserveWhitespace)
                      .add("includeComments", includeComments)
                      .toString();
  }

  /**
   * Builder for {@link SoupConfig} instances.
   */
  public static final class Builder {

    private int maxDepth = Fixed.DEFAULT_MAX_DEPTH.getStandardProperty();

    private boolean strictMode;

    private boolean preserveWhitespace;

    private boolean includeComments;

    private Builder() {
    }

    /**
     * Set the maximum element nesting depth (default: 512).
     *
     * @param maxDepth the depth, must be > 0
     * @return this builder instance
     */
    public Builder maxDepth(final @NonNegative int maxDepth) {
      checkArgument(maxDepth > 0, "maxDepth must be > 0!");
      this.maxDepth = maxDepth;
      return this;
    }

    /**
     * Fail on malformed markup (default: no).
     *
     * @param strictMode strict or not
     * @return this builder instance
     */
    public Builder strictMode(final boolean strictMode) {
      this.strictMode = strictMode;
      return this;
    }

    /**
     * Keep whitespace-only text nodes (default: no).
     *
     * @param preserveWhitespace keep or not
     * @return this builder instance
     */
    public Builder preserveWhitespace(final boolean preserveWhitespace) {
      this.preserveWhitespace = preserveWhitespace;
      return this;
    }

    /**
     * Keep comments (default: no).
     *
     * @param includeComments keep or not
     * @return this builder instance
     */
    public Builder includeComments(final boolean includeComments) {
      this.includeComments = includeComments;
      return this;
    }

    /**
     * Build the settings.
     *
     * @return a new {@link SoupConfig}
     */
    public SoupConfig build() {
      return new SoupConfig(this);
    }
  }
}
