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
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.exception.HtmlParseException;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Outcome of parsing one input of a batch: either a {@link Soup} or the failure.
 */
public final class BatchResult {

  /** Position of the input in the batch. */
  private final int index;

  private final @Nullable Soup soup;

  private final @Nullable HtmlParseException error;

  private BatchResult(final int index, final @Nullable Soup soup, final @Nullable HtmlParseException error) {
    checkArgument(index >= 0, "index must be >= 0!");
    this.index = index;
    this.soup = soup;
    this.error = error;
  }

  static BatchResult success(final @NonNegative int index, final Soup soup) {
    return new BatchResult(index, requireNonNull(soup), null);
  }

  static BatchResult failure(final @NonNegative int index, final HtmlParseException error) {
    return new BatchResult(index, null, requireNonNull(error));
  }

  public int getIndex() {
    return index;
  }

  public boolean isSuccess() {
    return soup != null;
  }

  public Optional<Soup> getSoup() {
    return Optional.ofNullable(soup);
  }

  public Optional<HtmlParseException> getError() {
    return Optional.ofNullable(error);
  }

  /**
   * Get the soup or rethrow the failure.
   *
   * @return the soup
   * @throws HtmlParseException if parsing the input failed
   */
  public Soup getOrThrow() throws HtmlParseException {
    if (error != null) {
      throw error;
    }
    return requireNonNull(soup);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("index", index)
                      .add("success", isSuccess())
                      .add("error", error == null ? null : error.getMessage())
                      .omitNullValues()
                      .toString();
  }
}
