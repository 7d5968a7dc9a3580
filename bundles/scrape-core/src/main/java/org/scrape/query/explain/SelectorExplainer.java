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

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.node.Document;
import org.scrape.query.CompiledSelector;
import org.scrape.query.QueryEngine;
import org.scrape.query.selector.AttributeOperator;
import org.scrape.query.selector.AttributeSelector;
import org.scrape.query.selector.ClassSelector;
import org.scrape.query.selector.Combinator;
import org.scrape.query.selector.ComplexSelector;
import org.scrape.query.selector.CompoundSelector;
import org.scrape.query.selector.IdSelector;
import org.scrape.query.selector.SelectorList;
import org.scrape.query.selector.SelectorVisitor;
import org.scrape.query.selector.SimpleSelector;
import org.scrape.query.selector.TypeSelector;
import org.scrape.query.selector.UniversalSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static java.util.Objects.requireNonNull;

/**
 * Heuristic analysis of compiled selectors. The analysis only looks at the shape of the selector
 * and, if a document is given, counts the matches. It never modifies anything.
 */
public final class SelectorExplainer {

  /** The thresholds. */
  private final ExplainConfiguration configuration;

  /**
   * Constructor using the default thresholds.
   */
  public SelectorExplainer() {
    this(ExplainConfiguration.defaults());
  }

  /**
   * Constructor.
   *
   * @param configuration the thresholds
   */
  public SelectorExplainer(final ExplainConfiguration configuration) {
    this.configuration = requireNonNull(configuration);
  }

  /**
   * Compile and explain a selector.
   *
   * @param selector the selector
   * @return the explanation
   * @throws InvalidSelectorException if the selector is invalid
   */
  public SelectorExplanation explain(final String selector) throws InvalidSelectorException {
    return explain(CompiledSelector.compile(selector));
  }

  /**
   * Explain a selector without counting matches.
   *
   * @param selector the selector
   * @return the explanation
   */
  public SelectorExplanation explain(final CompiledSelector selector) {
    return analyze(selector, OptionalInt.empty());
  }

  /**
   * Explain a selector and count its matches in a document.
   *
   * @param selector the selector
   * @param document the document to count matches in
   * @return the explanation
   */
  public SelectorExplanation explain(final CompiledSelector selector, final Document document) {
    final int matches = new QueryEngine(document).selectCompiled(selector).size();
    return analyze(selector, OptionalInt.of(matches));
  }

  private SelectorExplanation analyze(final CompiledSelector selector, final OptionalInt estimatedMatches) {
    final String source = selector.getSource();
    final SelectorList list = selector.getSelectorList();
    final List<String> notes = new ArrayList<>();
    final List<OptimizationHint> hints = new ArrayList<>();

    final Shape shape = new Shape();
    list.accept(shape);

    int maxCompounds = 0;
    int totalCompounds = 0;
    boolean hasDescendant = false;
    boolean hasChild = false;
    @Nullable String descendantAt = null;
    for (final ComplexSelector complex : list.getSelectors()) {
      final int compounds = complex.getCompounds().size();
      maxCompounds = Math.max(maxCompounds, compounds);
      totalCompounds += compounds;
      final List<Combinator> combinators = complex.getCombinators();
      for (int i = 0; i < combinators.size(); i++) {
        switch (combinators.get(i)) {
          case DESCENDANT -> {
            hasDescendant = true;
            if (descendantAt == null) {
              descendantAt = complex.getCompounds().get(i) + " " + complex.getCompounds().get(i + 1);
            }
          }
          case CHILD -> hasChild = true;
          default -> {
          }
        }
      }
    }

    if (shape.universal) {
      notes.add("Universal selector (*) tests every element in the document");
      hints.add(OptimizationHint.avoidUniversalSelector());
    }

    if (maxCompounds > configuration.getDeepChainThreshold()) {
      notes.add("Deep descendant chain (" + maxCompounds + " levels) - consider simplifying");
      hints.add(OptimizationHint.tooBroad("selector chain of " + maxCompounds + " compounds"));
    }

    final SimpleSelector only = singleSimpleSelector(list);
    if (only instanceof IdSelector) {
      notes.add("ID selector - uses fast indexed lookup");
      hints.add(OptimizationHint.optimal());
    } else if (only instanceof ClassSelector) {
      notes.add("Class selector - uses the class index");
    } else if (only instanceof TypeSelector) {
      notes.add("Type selector - uses the tag index");
    }

    for (final AttributeSelector attribute : shape.idAttributes) {
      hints.add(OptimizationHint.useIdSelector(attribute.toString(), new IdSelector(attribute.getValue()).toString()));
      notes.add("Attribute test on id - an ID selector uses the id index");
    }

    if (hasDescendant && !hasChild && descendantAt != null) {
      hints.add(OptimizationHint.preferChildCombinator(descendantAt));
    }

    if (source.length() > configuration.getCacheLengthThreshold()
        || totalCompounds > configuration.getCacheCompoundThreshold()) {
      hints.add(OptimizationHint.cacheSelector());
    }

    return new SelectorExplanation(source, selector.getSpecificity(), describe(source, list), notes,
        ImmutableList.copyOf(hints), estimatedMatches);
  }

  /**
   * The only simple selector of a list made of one compound with one simple selector.
   */
  private static @Nullable SimpleSelector singleSimpleSelector(final SelectorList list) {
    if (list.getSelectors().size() != 1) {
      return null;
    }
    final ComplexSelector complex = list.getSelectors().get(0);
    if (complex.getCompounds().size() != 1) {
      return null;
    }
    final List<SimpleSelector> selectors = complex.getSubject().getSelectors();
    return selectors.size() == 1 ? selectors.get(0) : null;
  }

  private static String describe(final String source, final SelectorList list) {
    final List<ComplexSelector> selectors = list.getSelectors();
    if (selectors.size() > 1) {
      return "Elements matching any of " + selectors.size() + " selectors";
    }
    final ComplexSelector complex = selectors.get(0);
    if (complex.getCompounds().size() == 1) {
      return describeCompound(source, complex.getSubject());
    }
    final List<Combinator> combinators = complex.getCombinators();
    final Combinator dominant;
    if (combinators.contains(Combinator.CHILD)) {
      dominant = Combinator.CHILD;
    } else if (combinators.contains(Combinator.DESCENDANT)) {
      dominant = Combinator.DESCENDANT;
    } else if (combinators.contains(Combinator.ADJACENT_SIBLING)) {
      dominant = Combinator.ADJACENT_SIBLING;
    } else {
      dominant = Combinator.GENERAL_SIBLING;
    }
    return switch (dominant) {
      case CHILD -> "Elements matching a child selector";
      case DESCENDANT -> "Elements matching a descendant selector";
      case ADJACENT_SIBLING -> "Elements matching an adjacent sibling selector";
      case GENERAL_SIBLING -> "Elements matching a general sibling selector";
    };
  }

  private static String describeCompound(final String source, final CompoundSelector compound) {
    final List<SimpleSelector> selectors = compound.getSelectors();
    if (selectors.size() == 1) {
      final SimpleSelector selector = selectors.get(0);
      if (selector instanceof final IdSelector id) {
        return "Element with ID '" + id.getId() + "'";
      } else if (selector instanceof final ClassSelector className) {
        return "Elements with class '" + className.getClassName() + "'";
      } else if (selector instanceof final TypeSelector type) {
        return "<" + type.getName() + "> elements";
      } else if (selector instanceof UniversalSelector) {
        return "All elements";
      }
    } else if (selectors.stream().allMatch(ClassSelector.class::isInstance)) {
      final List<String> names = new ArrayList<>(selectors.size());
      for (final SimpleSelector selector : selectors) {
        names.add("'" + ((ClassSelector) selector).getClassName() + "'");
      }
      return "Elements with classes " + String.join(", ", names);
    }
    return "Elements matching '" + source + "'";
  }

  /**
   * Collects the shape features the hints are derived from.
   */
  private static final class Shape implements SelectorVisitor {
    private boolean universal;

    private final List<AttributeSelector> idAttributes = new ArrayList<>();

    @Override
    public void visit(final UniversalSelector selector) {
      universal = true;
    }

    @Override
    public void visit(final AttributeSelector selector) {
      if (selector.getOperator() == AttributeOperator.EQUALS && "id".equals(selector.getName())
          && !selector.isIgnoreCase() && !selector.getValue().isEmpty()) {
        idAttributes.add(selector);
      }
    }
  }
}
