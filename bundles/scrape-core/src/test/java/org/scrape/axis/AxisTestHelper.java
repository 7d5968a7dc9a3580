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

package org.scrape.axis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.testing.IteratorFeature;
import com.google.common.collect.testing.IteratorTester;
import org.scrape.api.Axis;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks the conventions every axis must follow.
 */
public final class AxisTestHelper {

  /** Number of steps {@link IteratorTester} explores. */
  public static final int ITERATIONS = 5;

  private AxisTestHelper() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Run an axis to its end and compare the keys. Afterwards the axis must be exhausted, and after a
   * reset it must yield the same keys again.
   *
   * @param axis the axis
   * @param expectedKeys the expected keys in order
   */
  public static void testAxisConventions(final Axis axis, final int[] expectedKeys) {
    final int startKey = axis.getStartKey();
    assertArrayEquals(expectedKeys, drain(axis));
    assertFalse(axis.hasNext());
    assertThrows(NoSuchElementException.class, axis::nextInt);
    assertEquals(startKey, axis.getStartKey());

    axis.reset(startKey);
    assertArrayEquals(expectedKeys, drain(axis));
  }

  /**
   * Run {@link IteratorTester} on fresh axes.
   *
   * @param axis creates a new axis for every run
   * @param expectedKeys the expected keys in order
   */
  public static void testIterator(final Supplier<Axis> axis, final int[] expectedKeys) {
    final ImmutableList.Builder<Integer> expected = ImmutableList.builder();
    for (final int key : expectedKeys) {
      expected.add(key);
    }
    new IteratorTester<Integer>(ITERATIONS, IteratorFeature.UNMODIFIABLE, expected.build(),
        IteratorTester.KnownOrder.KNOWN_ORDER) {
      @Override
      protected Iterator<Integer> newTargetIterator() {
        return axis.get();
      }
    }.test();
  }

  /**
   * Both checks at once.
   *
   * @param axis creates a new axis for every run
   * @param expectedKeys the expected keys in order
   */
  public static void testAxis(final Supplier<Axis> axis, final int[] expectedKeys) {
    testAxisConventions(axis.get(), expectedKeys);
    testIterator(axis, expectedKeys);
  }

  private static int[] drain(final Axis axis) {
    final int[] keys = new int[256];
    int offset = 0;
    while (axis.hasNext()) {
      final int peeked = axis.peek();
      final int key = axis.nextInt();
      assertEquals(peeked, key);
      assertTrue(offset < keys.length);
      keys[offset++] = key;
    }
    final int[] result = new int[offset];
    System.arraycopy(keys, 0, result, 0, offset);
    return result;
  }
}
