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

package org.scrape.query.parser;

import com.google.common.base.Ascii;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.scrape.exception.InvalidSelectorException;
import org.scrape.query.selector.AttributeOperator;
import org.scrape.query.selector.AttributeSelector;
import org.scrape.query.selector.ClassSelector;
import org.scrape.query.selector.Combinator;
import org.scrape.query.selector.ComplexSelector;
import org.scrape.query.selector.CompoundSelector;
import org.scrape.query.selector.HasSelector;
import org.scrape.query.selector.IdSelector;
import org.scrape.query.selector.LogicalSelector;
import org.scrape.query.selector.NthSelector;
import org.scrape.query.selector.PseudoClass;
import org.scrape.query.selector.PseudoClassSelector;
import org.scrape.query.selector.PseudoElementSelector;
import org.scrape.query.selector.RelativeSelector;
import org.scrape.query.selector.SelectorList;
import org.scrape.query.selector.SimpleSelector;
import org.scrape.query.selector.TypeSelector;
import org.scrape.query.selector.UniversalSelector;
import org.scrape.utils.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Recursive descent parser for CSS selectors. It gets tokens from the {@link SelectorScanner} and
 * builds the selector tree according to the productions documented on each method. Every problem
 * is reported as an {@link InvalidSelectorException} pointing at the offending token.
 * </p>
 */
public final class SelectorParser {

  /** Maximum nesting of functional pseudo-classes. */
  private static final int MAX_NESTING = 32;

  /** {@code An+B} with a step. */
  private static final Pattern NTH_STEP =
      Pattern.compile("([+-]?)(\\d*)n(?:\\s*([+-])\\s*(\\d+))?", Pattern.CASE_INSENSITIVE);

  /** {@code B} only. */
  private static final Pattern NTH_OFFSET = Pattern.compile("[+-]?\\d+");

  /** The selector. */
  private final String selector;

  /** The scanner. */
  private final SelectorScanner scanner;

  /** The current token. */
  private SelectorToken token;

  /** Current nesting of functional pseudo-classes. */
  private int nesting;

  /**
   * Constructor.
   *
   * @param selector the selector to parse
   */
  public SelectorParser(final String selector) {
    this.selector = requireNonNull(selector);
    scanner = new SelectorScanner(selector);
  }

  /**
   * Parse the selector.
   *
   * <p>
   * SelectorsGroup ::= S* SelectorList S* END .
   * </p>
   *
   * @return the selector list
   * @throws InvalidSelectorException if the selector is invalid or unsupported
   */
  public SelectorList parse() throws InvalidSelectorException {
    token = scanner.nextToken();
    skipWhitespace();
    if (token.type() == TokenType.END) {
      throw new InvalidSelectorException("empty selector", span());
    }
    final SelectorList selectors = parseSelectorList();
    if (token.type() != TokenType.END) {
      throw unexpected("',' or end of input");
    }
    return selectors;
  }

  /**
   * <p>
   * SelectorList ::= ComplexSelector (S* "," S* ComplexSelector)* .
   * </p>
   */
  private SelectorList parseSelectorList() throws InvalidSelectorException {
    final List<ComplexSelector> selectors = new ArrayList<>();
    do {
      skipWhitespace();
      selectors.add(parseComplexSelector());
    } while (is(TokenType.COMMA));
    return new SelectorList(selectors);
  }

  /**
   * <p>
   * ComplexSelector ::= CompoundSelector (Combinator CompoundSelector)* .
   * </p>
   * <p>
   * Combinator ::= S* (">" | "+" | "~") S* | S+ .
   * </p>
   */
  private ComplexSelector parseComplexSelector() throws InvalidSelectorException {
    final List<CompoundSelector> compounds = new ArrayList<>();
    final List<Combinator> combinators = new ArrayList<>();
    compounds.add(parseCompoundSelector());
    while (true) {
      final boolean whitespace = skipWhitespace();
      final Combinator combinator = parseCombinator();
      if (combinator != null) {
        skipWhitespace();
        combinators.add(combinator);
        compounds.add(parseCompoundSelector());
      } else if (whitespace && !isTerminator()) {
        combinators.add(Combinator.DESCENDANT);
        compounds.add(parseCompoundSelector());
      } else {
        return new ComplexSelector(compounds, combinators);
      }
    }
  }

  private @Nullable Combinator parseCombinator() {
    if (is(TokenType.GT)) {
      return Combinator.CHILD;
    }
    if (is(TokenType.PLUS)) {
      return Combinator.ADJACENT_SIBLING;
    }
    if (is(TokenType.TILDE)) {
      return Combinator.GENERAL_SIBLING;
    }
    return null;
  }

  /**
   * <p>
   * CompoundSelector ::= (TypeSelector | "*")? (Hash | Class | Attribute | Pseudo)*
   * PseudoElement? .
   * </p>
   */
  private CompoundSelector parseCompoundSelector() throws InvalidSelectorException {
    final List<SimpleSelector> selectors = new ArrayList<>();
    if (token.type() == TokenType.IDENT) {
      selectors.add(new TypeSelector(token.content()));
      next();
    } else if (token.type() == TokenType.STAR) {
      selectors.add(UniversalSelector.INSTANCE);
      next();
    }
    if (token.type() == TokenType.PIPE) {
      throw new InvalidSelectorException("namespace prefixes are not supported", span());
    }

    boolean pseudoElement = false;
    while (true) {
      final SimpleSelector simpleSelector = switch (token.type()) {
        case HASH, UNRESTRICTED_HASH -> parseIdSelector();
        case DOT -> parseClassSelector();
        case LBRACKET -> parseAttributeSelector();
        case COLON -> parsePseudoClass();
        case DOUBLE_COLON -> parsePseudoElement();
        default -> null;
      };
      if (simpleSelector == null) {
        break;
      }
      if (pseudoElement) {
        throw new InvalidSelectorException("a pseudo-element must be the last part of a compound selector",
            SourceSpan.of(selector, scanner.getLastPosition(), scanner.getLastPosition()));
      }
      pseudoElement = simpleSelector instanceof PseudoElementSelector;
      selectors.add(simpleSelector);
    }

    switch (token.type()) {
      case IDENT, STAR, FUNCTION -> {
        if (!selectors.isEmpty()) {
          throw new InvalidSelectorException("a type selector must come first in a compound selector", span());
        }
      }
      case INVALID -> throw new InvalidSelectorException(token.content(), span());
      default -> {
      }
    }
    if (selectors.isEmpty()) {
      throw unexpected("a selector");
    }
    return new CompoundSelector(selectors);
  }

  /**
   * <p>
   * Hash ::= "#" Name .
   * </p>
   */
  private IdSelector parseIdSelector() throws InvalidSelectorException {
    final String id = token.content();
    if (token.type() == TokenType.UNRESTRICTED_HASH) {
      throw new InvalidSelectorException("'#" + id + "' is no valid id selector", span());
    }
    next();
    return new IdSelector(id);
  }

  /**
   * <p>
   * Class ::= "." Ident .
   * </p>
   */
  private ClassSelector parseClassSelector() throws InvalidSelectorException {
    next();
    if (token.type() != TokenType.IDENT) {
      throw unexpected("a class name after '.'");
    }
    final String className = token.content();
    next();
    return new ClassSelector(className);
  }

  /**
   * <p>
   * Attribute ::= "[" S* Ident S* (AttrMatcher S* (Ident | String | Number) S* AttrModifier? S*)? "]" .
   * </p>
   * <p>
   * AttrMatcher ::= "=" | "~=" | "|=" | "^=" | "$=" | "*=" .
   * </p>
   */
  private AttributeSelector parseAttributeSelector() throws InvalidSelectorException {
    next();
    skipWhitespace();
    if (token.type() == TokenType.PIPE) {
      throw new InvalidSelectorException("namespace prefixes are not supported", span());
    }
    if (token.type() != TokenType.IDENT) {
      throw unexpected("an attribute name");
    }
    final String name = token.content();
    next();
    skipWhitespace();
    if (token.type() == TokenType.PIPE) {
      throw new InvalidSelectorException("namespace prefixes are not supported", span());
    }
    if (is(TokenType.RBRACKET)) {
      return AttributeSelector.exists(name);
    }

    final AttributeOperator operator = switch (token.type()) {
      case EQ -> AttributeOperator.EQUALS;
      case INCLUDES -> AttributeOperator.INCLUDES;
      case DASH_MATCH -> AttributeOperator.DASH_MATCH;
      case PREFIX_MATCH -> AttributeOperator.PREFIX;
      case SUFFIX_MATCH -> AttributeOperator.SUFFIX;
      case SUBSTRING_MATCH -> AttributeOperator.SUBSTRING;
      default -> throw unexpected("']' or an attribute operator");
    };
    next();
    skipWhitespace();
    if (token.type() != TokenType.IDENT && token.type() != TokenType.STRING
        && token.type() != TokenType.NUMBER) {
      throw unexpected("an attribute value");
    }
    final String value = token.content();
    next();
    final boolean whitespace = skipWhitespace();

    boolean ignoreCase = false;
    if (whitespace && token.type() == TokenType.IDENT) {
      final String modifier = Ascii.toLowerCase(token.content());
      if (modifier.equals("i")) {
        ignoreCase = true;
      } else if (!modifier.equals("s")) {
        throw new InvalidSelectorException("unknown attribute modifier '" + token.content() + "'", span());
      }
      next();
      skipWhitespace();
    }
    if (!is(TokenType.RBRACKET)) {
      throw unexpected("']'");
    }
    return new AttributeSelector(name, operator, value, ignoreCase);
  }

  /**
   * <p>
   * Pseudo ::= ":" (Ident | Function S* Arguments S* ")") .
   * </p>
   */
  private SimpleSelector parsePseudoClass() throws InvalidSelectorException {
    next();
    if (token.type() == TokenType.IDENT) {
      final String name = Ascii.toLowerCase(token.content());
      final PseudoClass pseudoClass = PseudoClass.fromName(name);
      if (pseudoClass != null) {
        next();
        return new PseudoClassSelector(pseudoClass);
      }
      if (PseudoElementSelector.LEGACY_NAMES.contains(name)) {
        next();
        return new PseudoElementSelector(name);
      }
      throw new InvalidSelectorException("unsupported pseudo-class ':" + token.content() + "'", span());
    }
    if (token.type() != TokenType.FUNCTION) {
      throw unexpected("a pseudo-class name after ':'");
    }

    final String name = Ascii.toLowerCase(token.content());
    final NthSelector.Kind nthKind = NthSelector.Kind.fromName(name);
    if (nthKind != null) {
      return parseNth(nthKind);
    }

    final SourceSpan functionSpan = span();
    if (++nesting > MAX_NESTING) {
      throw new InvalidSelectorException("pseudo-classes nested too deeply", functionSpan);
    }
    try {
      switch (name) {
        case "not", "is", "where" -> {
          next();
          skipWhitespace();
          if (token.type() == TokenType.RPAREN) {
            throw new InvalidSelectorException(":" + name + "() needs an argument", functionSpan);
          }
          final SelectorList arguments = parseSelectorList();
          expectClosingParenthesis();
          final LogicalSelector.Kind kind = switch (name) {
            case "not" -> LogicalSelector.Kind.NOT;
            case "is" -> LogicalSelector.Kind.IS;
            default -> LogicalSelector.Kind.WHERE;
          };
          return new LogicalSelector(kind, arguments);
        }
        case "has" -> {
          next();
          skipWhitespace();
          if (token.type() == TokenType.RPAREN) {
            throw new InvalidSelectorException(":has() needs an argument", functionSpan);
          }
          final List<RelativeSelector> arguments = parseRelativeSelectorList();
          expectClosingParenthesis();
          return new HasSelector(arguments);
        }
        default -> throw new InvalidSelectorException("unsupported pseudo-class ':" + token.content() + "()'",
            functionSpan);
      }
    } finally {
      nesting--;
    }
  }

  /**
   * <p>
   * RelativeSelectorList ::= S* Combinator? S* ComplexSelector (S* "," RelativeSelectorList)* .
   * </p>
   */
  private List<RelativeSelector> parseRelativeSelectorList() throws InvalidSelectorException {
    final List<RelativeSelector> selectors = new ArrayList<>();
    do {
      skipWhitespace();
      final Combinator combinator = parseCombinator();
      skipWhitespace();
      selectors.add(new RelativeSelector(combinator == null ? Combinator.DESCENDANT : combinator,
          parseComplexSelector()));
    } while (is(TokenType.COMMA));
    return selectors;
  }

  /**
   * <p>
   * Nth ::= "odd" | "even" | Integer | Integer? "n" (S* ("+" | "-") S* Digits)? .
   * </p>
   */
  private NthSelector parseNth(final NthSelector.Kind kind) throws InvalidSelectorException {
    final int argumentStart = scanner.getPosition();
    final String argument = scanner.scanRawArgument().strip();
    final SourceSpan argumentSpan = SourceSpan.of(selector, argumentStart, scanner.getPosition());
    token = scanner.nextToken();
    if (token.type() != TokenType.RPAREN) {
      throw unexpected("')'");
    }
    next();

    final String lowerCase = Ascii.toLowerCase(argument);
    try {
      if (lowerCase.equals("odd")) {
        return new NthSelector(kind, 2, 1);
      }
      if (lowerCase.equals("even")) {
        return new NthSelector(kind, 2, 0);
      }
      if (NTH_OFFSET.matcher(lowerCase).matches()) {
        return new NthSelector(kind, 0, Integer.parseInt(lowerCase));
      }
      final Matcher step = NTH_STEP.matcher(lowerCase);
      if (step.matches()) {
        final String digits = step.group(2);
        int a = digits.isEmpty() ? 1 : Integer.parseInt(digits);
        if (step.group(1).equals("-")) {
          a = -a;
        }
        int b = 0;
        if (step.group(4) != null) {
          b = Integer.parseInt(step.group(4));
          if (step.group(3).equals("-")) {
            b = -b;
          }
        }
        return new NthSelector(kind, a, b);
      }
    } catch (final NumberFormatException e) {
      throw new InvalidSelectorException("number out of range in ':" + kind.getName() + "(" + argument + ")'",
          argumentSpan);
    }
    throw new InvalidSelectorException("invalid argument '" + argument + "' for ':" + kind.getName() + "()'",
        argumentSpan);
  }

  /**
   * <p>
   * PseudoElement ::= "::" Ident .
   * </p>
   */
  private PseudoElementSelector parsePseudoElement() throws InvalidSelectorException {
    next();
    if (token.type() != TokenType.IDENT) {
      throw unexpected("a pseudo-element name after '::'");
    }
    final String name = Ascii.toLowerCase(token.content());
    if (!PseudoElementSelector.NAMES.contains(name)) {
      throw new InvalidSelectorException("unsupported pseudo-element '::" + token.content() + "'", span());
    }
    next();
    return new PseudoElementSelector(name);
  }

  private void expectClosingParenthesis() throws InvalidSelectorException {
    skipWhitespace();
    if (!is(TokenType.RPAREN)) {
      throw unexpected("')'");
    }
  }

  private boolean isTerminator() {
    return token.type() == TokenType.COMMA || token.type() == TokenType.RPAREN || token.type() == TokenType.END;
  }

  /**
   * Returns true if the current token has the expected type and fetches the next one in that
   * case.
   *
   * @param type the expected type
   * @return {@code true} if the token was consumed
   */
  private boolean is(final TokenType type) {
    if (token.type() != type) {
      return false;
    }
    next();
    return true;
  }

  private void next() {
    token = scanner.nextToken();
  }

  /**
   * Skip whitespace tokens.
   *
   * @return {@code true} if there was whitespace
   */
  private boolean skipWhitespace() {
    boolean skipped = false;
    while (token.type() == TokenType.SPACE) {
      next();
      skipped = true;
    }
    return skipped;
  }

  private SourceSpan span() {
    return SourceSpan.of(selector, token.start(), token.end());
  }

  private InvalidSelectorException unexpected(final String expected) {
    if (token.type() == TokenType.INVALID) {
      return new InvalidSelectorException(token.content(), span());
    }
    return new InvalidSelectorException("expected " + expected + " but found " + token.describe(), span());
  }
}
