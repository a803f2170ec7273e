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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExpressionParserTest {

  private static final ExpressionGrammar grammar =
      ExpressionGrammar.build(ListedIdRegistry.bundled());

  private final ExpressionParser parser = new ExpressionParser(grammar, false);
  private final ExpressionParser strictParser = new ExpressionParser(grammar, true);

  @Test
  public void testTokenize() {
    ImmutableList<ExpressionParser.Token> tokens =
        ExpressionParser.tokenize(" (MIT  AND\tBSD-3-Clause)+");

    assertThat(tokens.stream().map(t -> t.text).toArray())
        .asList()
        .containsExactly("(", "MIT", "AND", "BSD-3-Clause", ")", "+")
        .inOrder();
    assertThat(tokens.get(0).type).isEqualTo(ExpressionParser.TokenType.OPEN);
    assertThat(tokens.get(0).spaceBefore).isTrue();
    assertThat(tokens.get(1).spaceBefore).isFalse();
    assertThat(tokens.get(1).spaceAfter).isTrue();
    assertThat(tokens.get(2).start).isEqualTo(7);
    assertThat(tokens.get(2).end).isEqualTo(10);
    assertThat(tokens.get(4).type).isEqualTo(ExpressionParser.TokenType.CLOSE);
    assertThat(tokens.get(5).type).isEqualTo(ExpressionParser.TokenType.WORD);
  }

  @Test
  public void testTokenize_blank() {
    assertThat(ExpressionParser.tokenize("")).isEmpty();
    assertThat(ExpressionParser.tokenize(" \t\r\n\f\u000B")).isEmpty();
  }

  @Test
  public void testSyntaxTree_keepsTextAsWritten() throws Exception {
    SyntaxNode tree = parser.parse("mit OR Apache-2.0+ WITH classpath-exception-2.0");

    assertThat(tree.toString())
        .isEqualTo(
            "[EXPRESSION [OR_EXPRESSION [AND_EXPRESSION [LICENSE_ID mit]]"
                + " [AND_EXPRESSION [WITH_EXPRESSION [LICENSE_OR_LATER [LICENSE_ID Apache-2.0]]"
                + " [LICENSE_EXCEPTION_ID classpath-exception-2.0]]]]]");
    assertThat(tree.start).isEqualTo(0);
    assertThat(tree.end).isEqualTo(47);
  }

  @Test
  public void testSyntaxTree_refs() throws Exception {
    SyntaxNode tree = parser.parse("DocumentRef-a:LicenseRef-b WITH AdditionRef-c");

    assertThat(tree.toString())
        .isEqualTo(
            "[EXPRESSION [OR_EXPRESSION [AND_EXPRESSION [WITH_EXPRESSION"
                + " [LICENSE_REF a:b] [ADDITION_REF c]]]]]");
  }

  @Test
  public void testSyntaxTree_parenthesized() throws Exception {
    SyntaxNode tree = parser.parse("(MIT)");

    assertThat(tree.toString())
        .isEqualTo(
            "[EXPRESSION [OR_EXPRESSION [AND_EXPRESSION"
                + " [EXPRESSION [OR_EXPRESSION [AND_EXPRESSION [LICENSE_ID MIT]]]]]]]");
  }

  @Test
  public void testMissingLicense_atEnd() {
    ParseFailure failure = failure(parser, "MIT AND");

    assertThat(failure.index).isEqualTo(7);
    assertThat(failure.found).isEmpty();
    assertThat(failure.reason).isEqualTo("missing license");
    assertThat(failure.expected)
        .containsExactly(ParseFailure.LICENSE_ID, ParseFailure.LICENSE_REF, ParseFailure.OPEN_PAREN)
        .inOrder();
  }

  @Test
  public void testMissingLicense_beforeOperator() {
    ParseFailure failure = failure(parser, "OR MIT");

    assertThat(failure.index).isEqualTo(0);
    assertThat(failure.found).isEqualTo("OR");
    assertThat(failure.reason).isEqualTo("missing license before operator");
  }

  @Test
  public void testMissingOperator() {
    ParseFailure failure = failure(parser, "MIT ANDD Apache-2.0");

    assertThat(failure.index).isEqualTo(4);
    assertThat(failure.found).isEqualTo("ANDD");
    assertThat(failure.reason).isEqualTo("missing operator");
    assertThat(failure.expected)
        .containsExactly(
            ParseFailure.WITH, ParseFailure.AND, ParseFailure.OR, ParseFailure.END_OF_INPUT)
        .inOrder();
    assertThat(failure.suggestions).isEmpty();
  }

  @Test
  public void testMissingOperator_afterGroupNoWith() {
    ParseFailure failure = failure(parser, "(GPL-2.0) WITH Classpath-exception-2.0");

    assertThat(failure.index).isEqualTo(10);
    assertThat(failure.expected)
        .containsExactly(ParseFailure.AND, ParseFailure.OR, ParseFailure.END_OF_INPUT)
        .inOrder();
    assertThat(failure.suggestions).isEmpty();
  }

  @Test
  public void testLowerCaseOperator_suggestsKeyword() {
    ParseFailure failure = failure(strictParser, "MIT and Apache-2.0");

    assertThat(failure.index).isEqualTo(4);
    assertThat(failure.reason).isEqualTo("missing operator");
    assertThat(failure.suggestions).containsExactly("AND");
  }

  @Test
  public void testLowerCaseOperator_acceptedByDefault() throws Exception {
    assertThat(parser.parse("MIT and Apache-2.0 oR ISC")).isNotNull();
  }

  @Test
  public void testUnknownLicense_suggestsCloseIds() {
    ParseFailure failure = failure(parser, "MIT AND Apache-2.1");

    assertThat(failure.index).isEqualTo(8);
    assertThat(failure.reason).isEqualTo("unknown license id");
    assertThat(failure.suggestions).containsExactly("Apache-1.1", "Apache-2.0").inOrder();
  }

  @Test
  public void testUnknownLicense_noSuggestionsWhenFar() {
    ParseFailure failure = failure(parser, "THIS-IS-NOT-A-LICENSE-ID");

    assertThat(failure.reason).isEqualTo("unknown license id");
    assertThat(failure.suggestions).isEmpty();
  }

  @Test
  public void testUnknownException_suggestsCloseIds() {
    ParseFailure failure = failure(parser, "GPL-2.0 WITH Classpath-exception-2.1");

    assertThat(failure.index).isEqualTo(13);
    assertThat(failure.reason).isEqualTo("unknown exception id");
    assertThat(failure.expected)
        .containsExactly(ParseFailure.EXCEPTION_ID, ParseFailure.ADDITION_REF)
        .inOrder();
    assertThat(failure.suggestions).containsExactly("Classpath-exception-2.0");
  }

  @Test
  public void testMissingException() {
    ParseFailure failure = failure(parser, "GPL-2.0 WITH");

    assertThat(failure.index).isEqualTo(12);
    assertThat(failure.reason).isEqualTo("missing exception");
  }

  @Test
  public void testExceptionWithoutLicense() {
    assertThat(failure(parser, "Classpath-exception-2.0").reason)
        .isEqualTo("exception without license");
    assertThat(failure(parser, "MIT OR AdditionRef-foo").reason)
        .isEqualTo("exception without license");
  }

  @Test
  public void testLicenseAsException() {
    ParseFailure failure = failure(parser, "GPL-2.0 WITH mit");

    assertThat(failure.index).isEqualTo(13);
    assertThat(failure.found).isEqualTo("mit");
    assertThat(failure.reason).isEqualTo("license used as exception");
    assertThat(failure.expected)
        .containsExactly(ParseFailure.EXCEPTION_ID, ParseFailure.ADDITION_REF)
        .inOrder();
    assertThat(failure.suggestions).isEmpty();
  }

  @Test
  public void testMalformedRefs() {
    assertThat(failure(parser, "LicenseRef-a_b").reason).isEqualTo("malformed LicenseRef");
    assertThat(failure(parser, "DocumentRef-foo").reason).isEqualTo("malformed LicenseRef");
    assertThat(failure(parser, "MIT WITH AdditionRef-").reason)
        .isEqualTo("malformed AdditionRef");
    assertThat(failure(parser, "MIT WITH DocumentRef-x:AdditionRef-").reason)
        .isEqualTo("malformed AdditionRef");
  }

  @Test
  public void testUnbalancedParentheses() {
    ParseFailure open = failure(parser, "(MIT");
    ParseFailure close = failure(parser, "MIT)");

    assertThat(open.index).isEqualTo(4);
    assertThat(open.reason).isEqualTo("unbalanced parentheses");
    assertThat(open.expected).contains(ParseFailure.CLOSE_PAREN);
    assertThat(close.index).isEqualTo(3);
    assertThat(close.reason).isEqualTo("unbalanced parentheses");
    assertThat(close.expected).contains(ParseFailure.END_OF_INPUT);
  }

  @Test
  public void testOperatorWhitespace() {
    ParseFailure after = failure(parser, "MIT AND(Apache-2.0)");
    ParseFailure before = failure(parser, "(MIT)AND Apache-2.0");

    assertThat(after.reason).isEqualTo("missing whitespace after operator");
    assertThat(after.index).isEqualTo(7);
    assertThat(after.expected).containsExactly(ParseFailure.WHITESPACE);
    assertThat(before.reason).isEqualTo("missing whitespace before operator");
    assertThat(before.index).isEqualTo(5);
  }

  @Test
  public void testLineAndColumn() {
    ParseFailure failure = failure(parser, "MIT AND\n  NOT-A-LICENSE");

    assertThat(failure.index).isEqualTo(10);
    assertThat(failure.line).isEqualTo(2);
    assertThat(failure.column).isEqualTo(3);
  }

  @Test
  public void testNestingLimit() throws Exception {
    int limit = ExpressionParser.MAX_NESTING_DEPTH;
    parser.parse(Strings.repeat("(", limit) + "MIT" + Strings.repeat(")", limit));

    ParseFailure failure =
        failure(parser, Strings.repeat("(", limit + 1) + "MIT" + Strings.repeat(")", limit + 1));

    assertThat(failure.index).isEqualTo(limit);
    assertThat(failure.reason).isEqualTo("parentheses nested too deeply");
  }

  @Test
  public void testSuggest() {
    ImmutableList<String> ids = ImmutableList.of("MIT", "MIT-0", "ISC", "Apache-2.0");

    assertThat(ExpressionParser.suggest("mit-1", ids)).containsExactly("MIT-0");
    assertThat(ExpressionParser.suggest("MTI", ids)).containsExactly("MIT");
    assertThat(ExpressionParser.suggest("GPL-2.0", ids)).isEmpty();
    assertThat(ExpressionParser.suggest("MIT", ImmutableList.of())).isEmpty();
  }

  private static ParseFailure failure(ExpressionParser parser, String input) {
    try {
      SyntaxNode tree = parser.parse(input);
      fail("expected failure parsing \"" + input + "\" got " + tree);
    } catch (ExpressionParser.SyntaxException e) {
      return e.failure;
    }
    return null;
  }
}
