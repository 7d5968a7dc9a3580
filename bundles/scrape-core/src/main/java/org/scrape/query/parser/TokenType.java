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

/**
 * Types of the tokens a selector is split into by the {@link SelectorScanner}.
 */
public enum TokenType {

  /** An identifier, e.g. an element or class name. */
  IDENT("identifier"),

  /** An identifier immediately followed by "(", e.g. {@code not(}. */
  FUNCTION("function"),

  /** "#" followed by a name which is a valid identifier. */
  HASH("'#'"),

  /** "#" followed by a name which doesn't start like an identifier, e.g. {@code #1a}. */
  UNRESTRICTED_HASH("'#'"),

  /** A quoted string, content unescaped. */
  STRING("string"),

  /** A number. */
  NUMBER("number"),

  /** ".". */
  DOT("'.'"),

  /** "*". */
  STAR("'*'"),

  /** ",". */
  COMMA("','"),

  /** ">". */
  GT("'>'"),

  /** "+". */
  PLUS("'+'"),

  /** "~". */
  TILDE("'~'"),

  /** "|". */
  PIPE("'|'"),

  /** ":". */
  COLON("':'"),

  /** "::". */
  DOUBLE_COLON("'::'"),

  /** "[". */
  LBRACKET("'['"),

  /** "]". */
  RBRACKET("']'"),

  /** "(". */
  LPAREN("'('"),

  /** ")". */
  RPAREN("')'"),

  /** "=". */
  EQ("'='"),

  /** "~=". */
  INCLUDES("'~='"),

  /** "|=". */
  DASH_MATCH("'|='"),

  /** "^=". */
  PREFIX_MATCH("'^='"),

  /** "$=". */
  SUFFIX_MATCH("'$='"),

  /** "*=". */
  SUBSTRING_MATCH("'*='"),

  /** Whitespace. */
  SPACE("whitespace"),

  /** End of the selector. */
  END("end of input"),

  /** Something the scanner couldn't make sense of, the content holds the reason. */
  INVALID("invalid input");

  /** Description for error messages. */
  private final String description;

  TokenType(final String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }
}
