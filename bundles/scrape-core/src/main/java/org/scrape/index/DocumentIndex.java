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

package org.scrape.index;

import com.google.common.base.MoreObjects;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.scrape.axis.DescendantAxis;
import org.scrape.axis.IncludeSelf;
import org.scrape.axis.filter.FilterAxis;
import org.scrape.axis.filter.NodeKindFilter;
import org.scrape.node.Document;
import org.scrape.node.ElementNode;
import org.scrape.utils.HtmlToken;
import org.scrape.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Id, class and tag indexes over the elements reachable from the root of a {@link Document}. Every
 * posting list holds node keys in document order, so candidates taken from an index come out in
 * the same order as a full traversal would produce them.
 *
 * <p>
 * Instances are immutable once built and safe to share between threads.
 * </p>
 */
public final class DocumentIndex {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DocumentIndex.class));

  /** Elements by id. */
  private final Map<String, IntList> ids;

  /** Elements by class. */
  private final Map<String, IntList> classes;

  /** Elements by lower case name. */
  private final Map<String, IntList> tags;

  private DocumentIndex(final Map<String, IntList> ids, final Map<String, IntList> classes,
      final Map<String, IntList> tags) {
    this.ids = ids;
    this.classes = classes;
    this.tags = tags;
  }

  /**
   * Build the indexes with a single preorder traversal from the root.
   *
   * @param document the document
   * @return the indexes, empty if the document has no root
   */
  public static DocumentIndex build(final Document document) {
    requireNonNull(document);
    final long start = System.nanoTime();
    final Object2ObjectOpenHashMap<String, IntList> ids = new Object2ObjectOpenHashMap<>();
    final Object2ObjectOpenHashMap<String, IntList> classes = new Object2ObjectOpenHashMap<>();
    final Object2ObjectOpenHashMap<String, IntList> tags = new Object2ObjectOpenHashMap<>();

    final int rootKey = document.getRootKey();
    int elementCount = 0;
    if (document.isElement(rootKey)) {
      final var axis = new FilterAxis(new DescendantAxis(document, rootKey, IncludeSelf.YES),
                                      NodeKindFilter.elements(document));
      while (axis.hasNext()) {
        final int nodeKey = axis.nextInt();
        final ElementNode element = document.getElement(nodeKey);
        elementCount++;
        add(tags, element.getLocalName(), nodeKey);
        final String id = element.getAttributeIgnoreCase("id");
        if (id != null && !id.isEmpty()) {
          add(ids, id, nodeKey);
        }
        final String classValue = element.getAttributeIgnoreCase("class");
        if (classValue != null) {
          for (final String className : HtmlToken.splitTokens(classValue)) {
            final IntList postings = classes.get(className);
            // A class listed twice on the same element is indexed once.
            if (postings == null || postings.getInt(postings.size() - 1) != nodeKey) {
              add(classes, className, nodeKey);
            }
          }
        }
      }
    }

    LOGWRAPPER.debug("Indexed {} elements ({} ids, {} classes, {} tags) in {} µs", elementCount, ids.size(),
        classes.size(), tags.size(), (System.nanoTime() - start) / 1_000);
    return new DocumentIndex(ids, classes, tags);
  }

  private static void add(final Map<String, IntList> index, final String key, final int nodeKey) {
    index.computeIfAbsent(key, k -> new IntArrayList(1)).add(nodeKey);
  }

  /**
   * Get the postings of an index.
   *
   * @param type the index
   * @param key id, class or lower case tag name
   * @return unmodifiable list of element keys in document order, possibly empty
   */
  public IntList get(final IndexType type, final String key) {
    requireNonNull(key);
    final IntList postings = switch (requireNonNull(type)) {
      case ID -> ids.get(key);
      case CLASS -> classes.get(key);
      case TAG -> tags.get(key);
    };
    return postings == null ? IntLists.emptyList() : IntLists.unmodifiable(postings);
  }

  /**
   * Elements with a given id.
   *
   * @param id the id
   * @return element keys in document order
   */
  public IntList getElementsById(final String id) {
    return get(IndexType.ID, id);
  }

  /**
   * Elements carrying a given class.
   *
   * @param className the class
   * @return element keys in document order
   */
  public IntList getElementsByClass(final String className) {
    return get(IndexType.CLASS, className);
  }

  /**
   * Elements with a given name.
   *
   * @param tagName the element name, lower case
   * @return element keys in document order
   */
  public IntList getElementsByTag(final String tagName) {
    return get(IndexType.TAG, tagName);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("ids", ids.size())
                      .add("classes", classes.size())
                      .add("tags", tags.size())
                      .toString();
  }
}
