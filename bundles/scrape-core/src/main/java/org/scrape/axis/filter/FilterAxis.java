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

package org.scrape.axis.filter;

import org.checkerframework.checker.index.qual.NonNegative;
import org.scrape.api.Axis;
import org.scrape.api.Filter;
import org.scrape.axis.AbstractAxis;

/**
 * <p>
 * Perform a test on a given axis: only nodes passing all filters are returned.
 * </p>
 */
public final class FilterAxis extends AbstractAxis {

  /** Axis to test. */
  private final Axis axis;

  /** Test to apply to axis. */
  private final Filter[] axisFilter;

  /**
   * Constructor initializing internal state.
   *
   * @param axis axis to iterate over
   * @param firstAxisTest test to perform for each node found with axis
   * @param axisTest tests to perform for each node found with axis
   * @throws IllegalArgumentException if a filter is bound to another document than the axis
   */
  public FilterAxis(final Axis axis, final Filter firstAxisTest, final Filter... axisTest) {
    super(axis.getDocument(), axis.getStartKey(), axis.includeSelf());
    this.axis = axis;
    axisFilter = new Filter[axisTest.length + 1];
    axisFilter[0] = firstAxisTest;
    System.arraycopy(axisTest, 0, axisFilter, 1, axisTest.length);
    for (final Filter filter : axisFilter) {
      if (filter.getDocument() != axis.getDocument()) {
        throw new IllegalArgumentException("The filter must be bound to the same document as the axis!");
      }
    }
  }

  @Override
  public void reset(final @NonNegative int nodeKey) {
    super.reset(nodeKey);
    if (axis != null) {
      axis.reset(nodeKey);
    }
  }

  @Override
  protected int nextKey() {
    while (axis.hasNext()) {
      final int nodeKey = axis.nextInt();
      boolean filterResult = true;
      for (final Filter filter : axisFilter) {
        filterResult = filterResult && filter.filter(nodeKey);
      }
      if (filterResult) {
        return nodeKey;
      }
    }
    return done();
  }

  /**
   * Returns the inner axis.
   *
   * @return the axis
   */
  public Axis getAxis() {
    return axis;
  }
}
