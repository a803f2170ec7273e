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
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/** Describes where and why a license expression failed to parse. */
public final class ParseFailure {
  public static final String LICENSE_ID = "license id";
  public static final String LICENSE_REF = "LicenseRef";
  public static final String EXCEPTION_ID = "exception id";
  public static final String ADDITION_REF = "AdditionRef";
  public static final String OPEN_PAREN = "'('";
  public static final String CLOSE_PAREN = "')'";
  public static final String AND = "AND";
  public static final String OR = "OR";
  public static final String WITH = "WITH";
  public static final String WHITESPACE = "whitespace";
  public static final String END_OF_INPUT = "end of input";

  /** The complete input that failed to parse. */
  public final String input;
  /** Zero-based offset into {@link #input} where the failure was detected. */
  public final int index;
  /** One-based line number of {@link #index}. */
  public final int line;
  /** One-based column number of {@link #index} within its line. */
  public final int column;
  /** The offending token, or the empty string at the end of input. */
  public final String found;
  /** Short description of the problem. e.g. "unknown license id" */
  public final String reason;
  /** Token classes the grammar accepts at {@link #index}. */
  public final ImmutableList<String> expected;
  /** Listed ids or keywords close to {@link #found}. Often empty. */
  public final ImmutableList<String> suggestions;

  ParseFailure(
      String input,
      int index,
      String found,
      String reason,
      ImmutableList<String> expected,
      ImmutableList<String> suggestions) {
    Preconditions.checkNotNull(input);
    Preconditions.checkArgument(index >= 0 && index <= input.length());
    this.input = input;
    this.index = index;
    this.found = Strings.nullToEmpty(found);
    this.reason = reason;
    this.expected = expected;
    this.suggestions = suggestions;
    int lineNumber = 1;
    int lineStart = 0;
    for (int i = 0; i < index; i++) {
      if (input.charAt(i) == '\n') {
        lineNumber++;
        lineStart = i + 1;
      }
    }
    this.line = lineNumber;
    this.column = index - lineStart + 1;
  }

  /** Multi-line description with the offending line and a caret under the failing column. */
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    sb.append("Parse error at line ")
        .append(line)
        .append(", column ")
        .append(column)
        .append(": ")
        .append(reason);
    if (!found.isEmpty()) {
      sb.append(" \"").append(found).append('"');
    }
    sb.append('\n');
    int lineStart = index - column + 1;
    int lineEnd = input.indexOf('\n', lineStart);
    sb.append(input, lineStart, lineEnd < 0 ? input.length() : lineEnd).append('\n');
    sb.append(Strings.repeat(" ", column - 1)).append("^\n");
    sb.append("Expected ")
        .append(expected.size() > 1 ? "one of: " : "")
        .append(Joiner.on(", ").join(expected));
    if (!suggestions.isEmpty()) {
      sb.append("\nDid you mean ").append(joinAlternatives(suggestions)).append('?');
    }
    return sb.toString();
  }

  /** Joins {@code items} as "a, b or c". */
  static String joinAlternatives(ImmutableList<String> items) {
    String joined = Joiner.on(", ").join(items);
    int lastIndex = joined.lastIndexOf(", ");
    if (lastIndex > 0) {
      joined = joined.substring(0, lastIndex) + " or " + joined.substring(lastIndex + 2);
    }
    return joined;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof ParseFailure) {
      ParseFailure otherFailure = (ParseFailure) other;
      return index == otherFailure.index
          && input.equals(otherFailure.input)
          && found.equals(otherFailure.found)
          && Objects.equals(reason, otherFailure.reason)
          && expected.equals(otherFailure.expected)
          && suggestions.equals(otherFailure.suggestions);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(input, index, found, reason, expected, suggestions);
  }

  @Override
  public String toString() {
    return getMessage();
  }
}
