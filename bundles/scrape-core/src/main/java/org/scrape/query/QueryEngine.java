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

package org.scrape.query;

import it.unimi.dsi.fastutil.ints.IntList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.api.Axis;
import org.scrape.axis.DescendantAxis;
import org.scrape.axis.IncludeSelf;
import org.scrape.axis.filter.FilterAxis;
import org.scrape.axis.filter.NodeKindFilter;
import org.scrape.axis.filter.SelectorFilter;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.index.DocumentIndex;
import org.scrape.node.Document;
import org.scrape.node.NodeId;
import org.scrape.query.selector.ClassSelector;
import org.scrape.query.selector.CompoundSelector;
import org.scrape.query.selector.IdSelector;
import org.scrape.query.selector.SelectorList;
import org.scrape.query.selector.TypeSelector;
import org.scrape.service.html.serialize.HtmlSerializer;
import org.scrape.settings.Fixed;
import org.scrape.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Evaluates selectors against a {@link Document}, either against the whole tree below the root or
 * against the descendants of a scope element. Results are always in document order.
 * </p>
 *
 * <p>
 * A list of one selector whose subject carries an id, a class or a type selector is answered from
 * the {@link DocumentIndex}: the posting list yields the candidates, each of which is still
 * matched against the full selector. Everything else walks the tree. Both ways produce the same
 * result.
 * </p>
 *
 * <p>
 * Selector strings are compiled on every call, callers running the same selector repeatedly should
 * compile it once with {@link CompiledSelector#compile(String)}.
 * </p>
 */
public final class QueryEngine {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(QueryEngine.class));

  /** Null key. */
  private static final int NULL_KEY = Fixed.NULL_NODE_KEY.getStandardProperty();

  /** The document. */
  private final Document document;

  /**
   * Constructor.
   *
   * @param document the document to query
   */
  public QueryEngine(final Document document) {
    this.document = requireNonNull(document);
  }

  public Document getDocument() {
    return document;
  }

  /**
   * First element matching a selector.
   *
   * @param selector the selector
   * @return the first match in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public Optional<NodeId> find(final String selector) throws InvalidSelectorException {
    return findCompiled(CompiledSelector.compile(selector));
  }

  /**
   * All elements matching a selector.
   *
   * @param selector the selector
   * @return the matches in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<NodeId> findAll(final String selector) throws InvalidSelectorException {
    return selectCompiled(CompiledSelector.compile(selector));
  }

  /**
   * Same as {@link #findAll(String)}.
   *
   * @param selector the selector
   * @return the matches in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<NodeId> select(final String selector) throws InvalidSelectorException {
    return findAll(selector);
  }

  public Optional<NodeId> findCompiled(final CompiledSelector selector) {
    return first(evaluate(NULL_KEY, selector, true));
  }

  public List<NodeId> selectCompiled(final CompiledSelector selector) {
    return evaluate(NULL_KEY, selector, false);
  }

  /**
   * First descendant of a scope element matching a selector.
   *
   * @param scope the scope element
   * @param selector the selector
   * @return the first match in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public Optional<NodeId> findWithin(final NodeId scope, final String selector) throws InvalidSelectorException {
    return findWithinCompiled(scope, CompiledSelector.compile(selector));
  }

  /**
   * All descendants of a scope element matching a selector.
   *
   * @param scope the scope element
   * @param selector the selector
   * @return the matches in document order
   * @throws InvalidSelectorException if the selector is invalid
   */
  public List<NodeId> findAllWithin(final NodeId scope, final String selector) throws InvalidSelectorException {
    return selectWithinCompiled(scope, CompiledSelector.compile(selector));
  }

  public Optional<NodeId> findWithinCompiled(final NodeId scope, final CompiledSelector selector) {
    return first(evaluate(scopeKey(scope), selector, true));
  }

  public List<NodeId> selectWithinCompiled(final NodeId scope, final CompiledSelector selector) {
    return evaluate(scopeKey(scope), selector, false);
  }

  /**
   * Text of every descendant of a scope element matching a selector.
   *
   * @param scope the scope element
   * @param selector the selector
   * @return the texts in document order
   */
  public List<String> selectTextWithin(final NodeId scope, final CompiledSelector selector) {
    final HtmlSerializer serializer = new HtmlSerializer(document);
    final List<NodeId> matches = selectWithinCompiled(scope, selector);
    final List<String> texts = new ArrayList<>(matches.size());
    for (final NodeId match : matches) {
      texts.add(serializer.text(match.index()));
    }
    return texts;
  }

  /**
   * An attribute of every descendant of a scope element matching a selector.
   *
   * @param scope the scope element
   * @param selector the selector
   * @param attribute the attribute name
   * @return one value per match in document order, empty where a match lacks the attribute
   */
  public List<Optional<String>> selectAttrWithin(final NodeId scope, final CompiledSelector selector,
      final String attribute) {
    requireNonNull(attribute);
    final List<NodeId> matches = selectWithinCompiled(scope, selector);
    final List<Optional<String>> values = new ArrayList<>(matches.size());
    for (final NodeId match : matches) {
      values.add(Optional.ofNullable(document.getElement(match.index()).getAttributeIgnoreCase(attribute)));
    }
    return values;
  }

  private int scopeKey(final NodeId scope) {
    final int key = requireNonNull(scope).index();
    checkArgument(document.isElement(key), "Scope %s is no element of this document!", scope);
    return key;
  }

  private static Optional<NodeId> first(final List<NodeId> matches) {
    return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
  }

  /**
   * Evaluate a selector.
   *
   * @param scopeKey the scope element, or {@code NULL_KEY} for the whole tree below the root
   * @param selector the selector
   * @param firstOnly stop after the first match
   * @return the matches in document order
   */
  private List<NodeId> evaluate(final int scopeKey, final CompiledSelector selector, final boolean firstOnly) {
    requireNonNull(selector);
    final int rootKey = document.getRootKey();
    final List<NodeId> result = new ArrayList<>();
    if (rootKey == NULL_KEY) {
      return result;
    }
    final SelectorMatcher matcher = new SelectorMatcher(document, scopeKey == NULL_KEY ? rootKey : scopeKey);

    final IntList candidates = scopeKey == NULL_KEY || isAttached(scopeKey) ? candidates(selector) : null;
    if (candidates != null) {
      LOGWRAPPER.trace("Answering '{}' from {} indexed candidates", selector, candidates.size());
      for (int i = 0, size = candidates.size(); i < size; i++) {
        final int key = candidates.getInt(i);
        if ((scopeKey == NULL_KEY || isStrictDescendant(key, scopeKey)) && matcher.matches(key, selector)) {
          result.add(document.nodeId(key));
          if (firstOnly) {
            break;
          }
        }
      }
      return result;
    }

    LOGWRAPPER.trace("Answering '{}' by traversal", selector);
    final Axis axis = new FilterAxis(scopeKey == NULL_KEY
                                         ? new DescendantAxis(document, rootKey, IncludeSelf.YES)
                                         : new DescendantAxis(document, scopeKey, IncludeSelf.NO),
                                     NodeKindFilter.elements(document), new SelectorFilter(matcher, selector));
    while (axis.hasNext()) {
      result.add(document.nodeId(axis.nextInt()));
      if (firstOnly) {
        break;
      }
    }
    return result;
  }

  /**
   * Candidates from the indexes for a list of one selector, taken from the most selective
   * component of its subject compound.
   *
   * @return the posting list, or {@code null} if there's no indexable component
   */
  private @Nullable IntList candidates(final CompiledSelector selector) {
    final SelectorList list = selector.getSelectorList();
    if (list.getSelectors().size() != 1) {
      return null;
    }
    final CompoundSelector subject = list.getSelectors().get(0).getSubject();
    final DocumentIndex index = document.getIndex();
    final IdSelector id = subject.find(IdSelector.class);
    if (id != null) {
      return index.getElementsById(id.getId());
    }
    final ClassSelector className = subject.find(ClassSelector.class);
    if (className != null) {
      return index.getElementsByClass(className.getClassName());
    }
    final TypeSelector type = subject.find(TypeSelector.class);
    if (type != null) {
      return index.getElementsByTag(type.getName());
    }
    return null;
  }

  private boolean isAttached(final int nodeKey) {
    final int rootKey = document.getRootKey();
    for (int key = nodeKey; key != NULL_KEY; key = document.getNode(key).getParentKey()) {
      if (key == rootKey) {
        return true;
      }
    }
    return false;
  }

  private boolean isStrictDescendant(final int nodeKey, final int ancestorKey) {
    for (int key = document.getNode(nodeKey).getParentKey(); key != NULL_KEY; key = document.getNode(key)
                                                                                            .getParentKey()) {
      if (key == ancestorKey) {
        return true;
      }
    }
    return false;
  }
}
