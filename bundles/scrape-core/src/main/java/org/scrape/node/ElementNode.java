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

package org.scrape.node;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An element node: a name and an ordered, immutable map of attributes.
 */
public final class ElementNode extends Node {

  /** Name of the element, as produced by the parser. */
  private final String name;

  /** Attributes in source order. */
  private final ImmutableMap<String, String> attributes;

  ElementNode(final @NonNegative int nodeKey, final String name, final Map<String, String> attributes) {
    super(nodeKey, true);
    this.name = requireNonNull(name);
    this.attributes = ImmutableMap.copyOf(attributes);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ELEMENT;
  }

  public String getName() {
    return name;
  }

  /**
   * Get the name, lower case. HTML element names are case-insensitive.
   *
   * @return the lower case name
   */
  public String getLocalName() {
    return Ascii.toLowerCase(name);
  }

  public ImmutableMap<String, String> getAttributes() {
    return attributes;
  }

  /**
   * Get an attribute value.
   *
   * @param attributeName the exact attribute name
   * @return the value or {@code null} if the attribute doesn't exist
   */
  public @Nullable String getAttribute(final String attributeName) {
    return attributes.get(attributeName);
  }

  /**
   * Get an attribute value, comparing attribute names ASCII case-insensitively.
   *
   * @param attributeName the attribute name
   * @return the value or {@code null} if the attribute doesn't exist
   */
  public @Nullable String getAttributeIgnoreCase(final String attributeName) {
    final String value = attributes.get(attributeName);
    if (value != null) {
      return value;
    }
    for (final Map.Entry<String, String> attribute : attributes.entrySet()) {
      if (Ascii.equalsIgnoreCase(attribute.getKey(), attributeName)) {
        return attribute.getValue();
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return toStringHelper().add("name", name).add("attributes", attributes).toString();
  }
}
