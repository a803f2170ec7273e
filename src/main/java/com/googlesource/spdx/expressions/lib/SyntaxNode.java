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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Node of the concrete syntax tree produced by {@link ExpressionParser}.
 *
 * <p>Interior nodes mirror the grammar rules. Terminal nodes hold the matched text exactly as
 * written, before any case canonicalization.
 */
final class SyntaxNode {

  /** Grammar rule matched by a node. */
  enum Rule {
    /** Whole input or a parenthesized sub-expression. One child. */
    EXPRESSION,
    /** One or more AND_EXPRESSION children separated by OR. */
    OR_EXPRESSION,
    /** One or more component children separated by AND. */
    AND_EXPRESSION,
    /** A license child followed by an exception child. */
    WITH_EXPRESSION,
    /** One LICENSE_ID child followed by a plus sign. */
    LICENSE_OR_LATER,
    /** Terminal: the listed license id as written. */
    LICENSE_ID,
    /** Terminal: optional DocumentRef id then the LicenseRef id, prefixes removed. */
    LICENSE_REF,
    /** Terminal: the listed exception id as written. */
    LICENSE_EXCEPTION_ID,
    /** Terminal: optional DocumentRef id then the AdditionRef id, prefixes removed. */
    ADDITION_REF
  }

  final Rule rule;
  final ImmutableList<SyntaxNode> children;
  final ImmutableList<String> tokens;
  final int start; // offset of first char in the input
  final int end; // offset just past the last char in the input

  private SyntaxNode(
      Rule rule,
      ImmutableList<SyntaxNode> children,
      ImmutableList<String> tokens,
      int start,
      int end) {
    this.rule = rule;
    this.children = children;
    this.tokens = tokens;
    this.start = start;
    this.end = end;
  }

  static SyntaxNode interior(Rule rule, ImmutableList<SyntaxNode> children, int start, int end) {
    return new SyntaxNode(rule, children, ImmutableList.of(), start, end);
  }

  static SyntaxNode terminal(Rule rule, ImmutableList<String> tokens, int start, int end) {
    return new SyntaxNode(rule, ImmutableList.of(), tokens, start, end);
  }

  /** Renders the subtree as nested brackets, e.g. {@code [AND_EXPRESSION [LICENSE_ID mit] ...]}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(rule);
    if (!tokens.isEmpty()) {
      sb.append(' ').append(Joiner.on(':').join(tokens));
    }
    for (SyntaxNode child : children) {
      sb.append(' ').append(child);
    }
    return sb.append(']').toString();
  }
}
