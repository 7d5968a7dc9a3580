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
import com.google.common.base.Throwables;
import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.api.HtmlParser;
import org.scrape.exception.HtmlParseException;
import org.scrape.service.html.shredder.JsoupHtmlParser;
import org.scrape.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Parses many independent inputs in parallel. Documents share nothing, so every input is one task
 * on a fixed thread pool. Results come back in input order.
 */
public final class BatchParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(BatchParser.class));

  /** Number of worker threads. */
  private final int threads;

  /** Settings for every input. */
  private final SoupConfig config;

  /** The parser. */
  private final HtmlParser parser;

  /**
   * Builder to build a {@link BatchParser} instance.
   */
  public static final class Builder {

    private int threads = Runtime.getRuntime().availableProcessors();

    private SoupConfig config = SoupConfig.defaults();

    private HtmlParser parser = JsoupHtmlParser.INSTANCE;

    private Builder() {
    }

    /**
     * Number of worker threads (default: available processors).
     *
     * @param threads the number of threads, must be > 0
     * @return this builder instance
     */
    public Builder threads(final @NonNegative int threads) {
      checkArgument(threads > 0, "threads must be > 0!");
      this.threads = threads;
      return this;
    }

    /**
     * Settings used for every input (default: {@link SoupConfig#defaults()}).
     *
     * @param config the settings
     * @return this builder instance
     */
    public Builder config(final SoupConfig config) {
      this.config = requireNonNull(config);
      return this;
    }

    /**
     * Parser used for every input (default: {@link JsoupHtmlParser}).
     *
     * @param parser the parser, must be thread-safe
     * @return this builder instance
     */
    public Builder parser(final HtmlParser parser) {
      this.parser = requireNonNull(parser);
      return this;
    }

    public BatchParser build() {
      return new BatchParser(this);
    }
  }

  private BatchParser(final Builder builder) {
    threads = builder.threads;
    config = builder.config;
    parser = builder.parser;
  }

  /**
   * Get a new builder instance.
   *
   * @return {@link Builder} instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Parse all inputs.
   *
   * @param inputs the markup of every document
   * @return one result per input, in input order
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public List<BatchResult> parse(final List<String> inputs) throws InterruptedException {
    requireNonNull(inputs);
    final List<BatchResult> results = new ArrayList<>(inputs.size());
    if (inputs.isEmpty()) {
      return results;
    }

    final ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, inputs.size()));
    try {
      final List<Future<BatchResult>> futures = new ArrayList<>(inputs.size());
      for (int i = 0; i < inputs.size(); i++) {
        final int index = i;
        final String html = requireNonNull(inputs.get(i));
        futures.add(executor.submit(() -> parse(index, html)));
      }
      for (final Future<BatchResult> future : futures) {
        try {
          results.add(future.get());
        } catch (final ExecutionException e) {
          Throwables.throwIfUnchecked(e.getCause());
          throw new IllegalStateException(e.getCause());
        }
      }
    } finally {
      executor.shutdownNow();
    }
    return results;
  }

  private BatchResult parse(final int index, final String html) {
    try {
      return BatchResult.success(index, Soup.of(parser.parse(html, config)));
    } catch (final HtmlParseException e) {
      LOGWRAPPER.warn("Input {} of the batch failed: {}", index, e.getMessage());
      return BatchResult.failure(index, e);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("threads", threads).add("config", config).toString();
  }
}
