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
import org.checkerframework.checker.index.qual.NonNegative;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Thresholds of the selector diagnostics.
 */
public final class ExplainConfiguration {

  /** Default maximum number of compounds in a chain before it is reported as too deep. */
  public static final int DEEP_CHAIN_THRESHOLD = 3;

  /** Default selector length above which caching is recommended. */
  public static final int CACHE_LENGTH_THRESHOLD = 30;

  /** Default number of compounds above which caching is recommended. */
  public static final int CACHE_COMPOUND_THRESHOLD = 2;

  /** Shared default configuration. */
  private static final ExplainConfiguration DEFAULTS = newBuilder().build();

  /** Chains with more compounds than this are reported as too deep. */
  private final int deepChainThreshold;

  /** Selectors longer than this get a caching hint. */
  private final int cacheLengthThreshold;

  /** Selectors with more compounds than this get a caching hint. */
  private final int cacheCompoundThreshold;

  private ExplainConfiguration(final Builder builder) {
    deepChainThreshold = builder.deepChainThreshold;
    cacheLengthThreshold = builder.cacheLengthThreshold;
    cacheCompoundThreshold = builder.cacheCompoundThreshold;
  }

  /**
   * Get the default configuration.
   *
   * @return the defaults
   */
  public static ExplainConfiguration defaults() {
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

  public int getDeepChainThreshold() {
    return deepChainThreshold;
  }

  public int getCacheLengthThreshold() {
    return cacheLengthThreshold;
  }

  public int getCacheCompoundThreshold() {
    return cacheCompoundThreshold;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("deepChainThreshold", deepChainThreshold)
                      .add("cacheLengthThreshold", cacheLengthThreshold)
                      .add("cacheCompoundThreshold", cacheCompoundThreshold)
                      .toString();
  }

  /**
   * Builder for {@link ExplainConfiguration} instances.
   */
  public static final class Builder {

    private int deepChainThreshold = DEEP_CHAIN_THRESHOLD;

    private int cacheLengthThreshold = CACHE_LENGTH_THRESHOLD;

    private int cacheCompoundThreshold = CACHE_COMPOUND_THRESHOLD;

    private Builder() {
    }

    /**
     * Set the maximum number of compounds in a chain before it is reported as too deep.
     *
     * @param deepChainThreshold the threshold, must be > 0
     * @return this builder
     */
    public Builder deepChainThreshold(final @NonNegative int deepChainThreshold) {
      checkArgument(deepChainThreshold > 0, "deepChainThreshold must be > 0!");
      this.deepChainThreshold = deepChainThreshold;
      return this;
    }

    /**
     * Set the selector length above which caching is recommended.
     *
     * @param cacheLengthThreshold the threshold, must be >= 0
     * @return this builder
     */
    public Builder cacheLengthThreshold(final @NonNegative int cacheLengthThreshold) {
      checkArgument(cacheLengthThreshold >= 0, "cacheLengthThreshold must be >= 0!");
      this.cacheLengthThreshold = cacheLengthThreshold;
      return this;
    }

    /**
     * Set the number of compounds above which caching is recommended.
     *
     * @param cacheCompoundThreshold the threshold, must be >= 0
     * @return this builder
     */
    public Builder cacheCompoundThreshold(final @NonNegative int cacheCompoundThreshold) {
      checkArgument(cacheCompoundThreshold >= 0, "cacheCompoundThreshold must be >= 0!");
      this.cacheCompoundThreshold = cacheCompoundThreshold;
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return a new {@link ExplainConfiguration}
     */
    public ExplainConfiguration build() {
      return new ExplainConfiguration(this);
    }
  }
}
