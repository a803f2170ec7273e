// Copyright (C) 2019 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.googlesource.spdx.expressions.lib;

import static com.googlesource.spdx.expressions.lib.ParseFailure.ADDITION_REF;
import static com.googlesource.spdx.expressions.lib.ParseFailure.AND;
import static com.googlesource.spdx.expressions.lib.ParseFailure.CLOSE_PAREN;
import static com.googlesource.spdx.expressions.lib.ParseFailure.END_OF_INPUT;
import static com.googlesource.spdx.expressions.lib.ParseFailure.EXCEPTION_ID;
import static com.googlesource.spdx.expressions.lib.ParseFailure.LICENSE_ID;
import static com.googlesource.spdx.expressions.lib.ParseFailure.LICENSE_REF;
import static com.googlesource.spdx.expressions.lib.ParseFailure.OPEN_PAREN;
import static com.googlesource.spdx.expressions.lib.ParseFailure.OR;
import static com.googlesource.spdx.expressions.lib.ParseFailure.WHITESPACE;
import static com.googlesource.spdx.expressions.lib.ParseFailure.WITH;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.googlesource.spdx.expressions.lib.SyntaxNode.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import org.apache.commons.lang.StringUtils;

/**
 * Recursive-descent parser for license expressions.
 *
 * <pre>
 * expression          := ws? or-expr ws?
 * or-expr             := and-expr (OR and-expr)*
 * and-expr            := component (AND component)*
 * component           := license-component (WITH exception-component)? | '(' expression ')'
 * license-component   := license-id '+'? | license-ref
 * exception-component := exception-id | addition-ref
 * </pre>
 *
 * <p>Operators must be separated from their operands by whitespace. A {@code +} must follow its
 * license id immediately. Operators match in any case unless {@code caseSensitiveOperators}.
 *
 * <p>Immutable and safe to share across threads.
 */
final class ExpressionParser {

  /** Maximum depth of nested parentheses. Deeper input fails to parse. */
  static final int MAX_NESTING_DEPTH = 256;

  /** Suggest listed ids within this edit distance of an unknown id. */
  private static final int MAX_SUGGESTION_DISTANCE = 2;

  private static final ImmutableList<String> OPERAND =
      ImmutableList.of(LICENSE_ID, LICENSE_REF, OPEN_PAREN);
  private static final ImmutableList<String> EXCEPTION =
      ImmutableList.of(EXCEPTION_ID, ADDITION_REF);
  private static final ImmutableList<String> OPERATORS = ImmutableList.of(AND, OR, WITH);

  private final ExpressionGrammar grammar;
  private final boolean caseSensitiveOperators;

  ExpressionParser(ExpressionGrammar grammar, boolean caseSensitiveOperators) {
    this.grammar = Preconditions.checkNotNull(grammar);
    this.caseSensitiveOperators = caseSensitiveOperators;
  }

  /**
   * Parses {@code input} into a concrete syntax tree.
   *
   * @throws SyntaxException describing the first position where {@code input} fails the grammar
   */
  SyntaxNode parse(String input) throws SyntaxException {
    Preconditions.checkNotNull(input);
    return new Parse(input, tokenize(input)).expression();
  }

  /** Returns true for the characters separating tokens. */
  static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
  }

  /** Splits {@code input} into words and parentheses. */
  static ImmutableList<Token> tokenize(String input) {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int i = 0;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (isWhitespace(c)) {
        i++;
      } else if (c == '(' || c == ')') {
        tokens.add(new Token(c == '(' ? TokenType.OPEN : TokenType.CLOSE, input, i, i + 1));
        i++;
      } else {
        int start = i;
        while (i < input.length() && !isDelimiter(input.charAt(i))) {
          i++;
        }
        tokens.add(new Token(TokenType.WORD, input, start, i));
      }
    }
    return tokens.build();
  }

  private static boolean isDelimiter(char c) {
    return c == '(' || c == ')' || isWhitespace(c);
  }

  enum TokenType {
    OPEN,
    CLOSE,
    WORD
  }

  /** A word or parenthesis with its position and surrounding whitespace. */
  static final class Token {
    final TokenType type;
    final String text;
    final int start;
    final int end;
    final boolean spaceBefore;
    final boolean spaceAfter;

    Token(TokenType type, String input, int start, int end) {
      this.type = type;
      this.text = input.substring(start, end);
      this.start = start;
      this.end = end;
      this.spaceBefore = start > 0 && isWhitespace(input.charAt(start - 1));
      this.spaceAfter = end < input.length() && isWhitespace(input.charAt(end));
    }

    @Override
    public String toString() {
      return text;
    }
  }

  /** Thrown when the input does not match the grammar. */
  static class SyntaxException extends Exception {
    private static final long serialVersionUID = 1L;

    final ParseFailure failure;

    SyntaxException(ParseFailure failure) {
      super(failure.reason, null, false, false);
      this.failure = failure;
    }
  }

  /** State of a single parse. */
  private class Parse {
    private final String input;
    private final ImmutableList<Token> tokens;
    private int pos;
    // True when the last parsed component could still take a WITH clause.
    private boolean withAllowed;

    Parse(String input, ImmutableList<Token> tokens) {
      this.input = input;
      this.tokens = tokens;
      this.pos = 0;
    }

    SyntaxNode expression() throws SyntaxException {
      SyntaxNode orExpr = orExpression(0);
      if (pos < tokens.size()) {
        throw unexpected(tokens.get(pos), 0);
      }
      return SyntaxNode.interior(Rule.EXPRESSION, ImmutableList.of(orExpr), 0, input.length());
    }

    private SyntaxNode orExpression(int depth) throws SyntaxException {
      List<SyntaxNode> children = new ArrayList<>();
      children.add(andExpression(depth));
      while (isOperator(peek(), OR)) {
        operator();
        children.add(andExpression(depth));
      }
      return interior(Rule.OR_EXPRESSION, children);
    }

    private SyntaxNode andExpression(int depth) throws SyntaxException {
      List<SyntaxNode> children = new ArrayList<>();
      children.add(component(depth));
      while (isOperator(peek(), AND)) {
        operator();
        children.add(component(depth));
      }
      return interior(Rule.AND_EXPRESSION, children);
    }

    private SyntaxNode component(int depth) throws SyntaxException {
      Token token = peek();
      if (token == null) {
        throw failure(input.length(), "", "missing license", OPERAND);
      }
      if (token.type == TokenType.OPEN) {
        if (depth >= MAX_NESTING_DEPTH) {
          throw failure(token.start, token.text, "parentheses nested too deeply", OPERAND);
        }
        pos++;
        SyntaxNode inner = orExpression(depth + 1);
        Token close = peek();
        if (close == null || close.type != TokenType.CLOSE) {
          throw unexpected(close, depth + 1);
        }
        pos++;
        withAllowed = false;
        return SyntaxNode.interior(
            Rule.EXPRESSION, ImmutableList.of(inner), token.start, close.end);
      }
      if (token.type == TokenType.CLOSE) {
        throw failure(token.start, token.text, "missing license", OPERAND);
      }
      pos++;
      SyntaxNode license = license(token);
      if (isOperator(peek(), WITH)) {
        operator();
        SyntaxNode exception = exception();
        withAllowed = false;
        return SyntaxNode.interior(
            Rule.WITH_EXPRESSION,
            ImmutableList.of(license, exception),
            license.start,
            exception.end);
      }
      withAllowed = true;
      return license;
    }

    private SyntaxNode license(Token token) throws SyntaxException {
      Matcher m = grammar.licenseId.matcher(token.text);
      if (m.matches()) {
        if (m.group(2) == null) {
          return terminal(Rule.LICENSE_ID, token, ImmutableList.of(token.text));
        }
        SyntaxNode id =
            SyntaxNode.terminal(
                Rule.LICENSE_ID, ImmutableList.of(m.group(1)), token.start, token.end - 1);
        return SyntaxNode.interior(
            Rule.LICENSE_OR_LATER, ImmutableList.of(id), token.start, token.end);
      }
      m = ExpressionGrammar.LICENSE_REF.matcher(token.text);
      if (m.matches()) {
        return terminal(Rule.LICENSE_REF, token, refTokens(m));
      }
      if (token.text.contains(LicenseComponent.LICENSE_REF)
          || token.text.startsWith(LicenseComponent.DOCUMENT_REF)) {
        throw failure(token.start, token.text, "malformed LicenseRef", OPERAND);
      }
      if (isAnyOperator(token.text)) {
        throw failure(token.start, token.text, "missing license before operator", OPERAND);
      }
      if (grammar.isExceptionId(token.text)
          || ExpressionGrammar.ADDITION_REF.matcher(token.text).matches()) {
        throw failure(
            token.start,
            token.text,
            "exception without license",
            OPERAND,
            ImmutableList.of());
      }
      throw failure(
          token.start,
          token.text,
          "unknown license id",
          OPERAND,
          suggest(token.text, grammar.licenseIds));
    }

    private SyntaxNode exception() throws SyntaxException {
      Token token = peek();
      if (token == null) {
        throw failure(input.length(), "", "missing exception", EXCEPTION);
      }
      if (token.type != TokenType.WORD) {
        throw failure(token.start, token.text, "missing exception", EXCEPTION);
      }
      pos++;
      if (grammar.isExceptionId(token.text)) {
        return terminal(Rule.LICENSE_EXCEPTION_ID, token, ImmutableList.of(token.text));
      }
      Matcher m = ExpressionGrammar.ADDITION_REF.matcher(token.text);
      if (m.matches()) {
        return terminal(Rule.ADDITION_REF, token, refTokens(m));
      }
      if (token.text.contains(LicenseException.ADDITION_REF)
          || token.text.startsWith(LicenseComponent.DOCUMENT_REF)) {
        throw failure(token.start, token.text, "malformed AdditionRef", EXCEPTION);
      }
      if (grammar.isLicenseId(token.text)) {
        throw failure(
            token.start, token.text, "license used as exception", EXCEPTION, ImmutableList.of());
      }
      throw failure(
          token.start,
          token.text,
          "unknown exception id",
          EXCEPTION,
          suggest(token.text, grammar.exceptionIds));
    }

    /** Consumes the operator at the current position checking the surrounding whitespace. */
    private void operator() throws SyntaxException {
      Token token = tokens.get(pos++);
      if (!token.spaceBefore) {
        throw failure(
            token.start,
            token.text,
            "missing whitespace before operator",
            ImmutableList.of(WHITESPACE));
      }
      Token next = peek();
      if (next != null && !token.spaceAfter) {
        throw failure(
            token.end,
            next.text,
            "missing whitespace after operator",
            ImmutableList.of(WHITESPACE));
      }
    }

    private Token peek() {
      return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean isOperator(Token token, String keyword) {
      if (token == null || token.type != TokenType.WORD) {
        return false;
      }
      return caseSensitiveOperators
          ? keyword.equals(token.text)
          : keyword.equalsIgnoreCase(token.text);
    }

    /** Failure for {@code token} following a complete component at nesting {@code depth}. */
    private SyntaxException unexpected(Token token, int depth) {
      ImmutableList.Builder<String> expected = ImmutableList.builder();
      if (withAllowed) {
        expected.add(WITH);
      }
      expected.add(AND, OR);
      expected.add(depth > 0 ? CLOSE_PAREN : END_OF_INPUT);
      if (token == null) {
        return failure(input.length(), "", "unbalanced parentheses", expected.build());
      }
      if (token.type == TokenType.CLOSE) {
        return failure(token.start, token.text, "unbalanced parentheses", expected.build());
      }
      ImmutableList<String> suggestions = ImmutableList.of();
      if (isAnyOperator(token.text)) {
        // Only reachable for the wrong case, or for WITH after a group or exception.
        String keyword = token.text.toUpperCase(Locale.ROOT);
        suggestions = expected.build().contains(keyword) ? ImmutableList.of(keyword) : suggestions;
      }
      return failure(token.start, token.text, "missing operator", expected.build(), suggestions);
    }

    private SyntaxException failure(
        int index, String found, String reason, ImmutableList<String> expected) {
      return failure(index, found, reason, expected, ImmutableList.of());
    }

    private SyntaxException failure(
        int index,
        String found,
        String reason,
        ImmutableList<String> expected,
        ImmutableList<String> suggestions) {
      return new SyntaxException(
          new ParseFailure(input, index, found, reason, expected, suggestions));
    }

    private SyntaxNode interior(Rule rule, List<SyntaxNode> children) {
      return SyntaxNode.interior(
          rule,
          ImmutableList.copyOf(children),
          children.get(0).start,
          children.get(children.size() - 1).end);
    }

    private SyntaxNode terminal(Rule rule, Token token, ImmutableList<String> values) {
      return SyntaxNode.terminal(rule, values, token.start, token.end);
    }
  }

  /** Optional DocumentRef id then the LicenseRef or AdditionRef id from {@code m}. */
  private static ImmutableList<String> refTokens(Matcher m) {
    return m.group(1) == null
        ? ImmutableList.of(m.group(2))
        : ImmutableList.of(m.group(1), m.group(2));
  }

  private static boolean isAnyOperator(String word) {
    for (String keyword : OPERATORS) {
      if (keyword.equalsIgnoreCase(word)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the listed ids closest to {@code word} when any are close enough to be typos. */
  static ImmutableList<String> suggest(String word, ImmutableList<String> ids) {
    String lowerWord = word.toLowerCase(Locale.ROOT);
    int minDist = -1;
    for (String id : ids) {
      int dist = StringUtils.getLevenshteinDistance(id.toLowerCase(Locale.ROOT), lowerWord);
      if (minDist < 0 || dist < minDist) {
        minDist = dist;
      }
    }
    if (minDist < 0 || minDist > MAX_SUGGESTION_DISTANCE) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> closeMatches = ImmutableList.builder();
    for (String id : ImmutableList.sortedCopyOf(ids)) {
      if (StringUtils.getLevenshteinDistance(id.toLowerCase(Locale.ROOT), lowerWord) == minDist) {
        closeMatches.add(id);
      }
    }
    return closeMatches.build();
  }
}
