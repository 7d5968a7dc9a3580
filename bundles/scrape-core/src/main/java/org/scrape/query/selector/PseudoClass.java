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

package org.scrape.query.selector;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;

/**
 * Pseudo-classes without arguments.
 */
public enum PseudoClass {
  FIRST_CHILD("first-child"),
  LAST_CHILD("last-child"),
  ONLY_CHILD("only-child"),
  FIRST_OF_TYPE("first-of-type"),
  LAST_OF_TYPE("last-of-type"),
  ONLY_OF_TYPE("only-of-type"),
  EMPTY("empty"),
  ROOT("root"),
  SCOPE("scope");

  /** Lookup by CSS name. */
  private static final ImmutableMap<String, PseudoClass> BY_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(PseudoClass::getName, p -> p));

  /** CSS name. */
  private final String name;

  PseudoClass(final String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Look up a pseudo-class.
   *
   * @param name lower case name without colon
   * @return the pseudo-class or {@code null} if unknown
   */
  public static @Nullable PseudoClass fromName(final String name) {
    return BY_NAME.get(name);
  }
}
