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

import com.google.common.base.Preconditions;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link ExpressionEngine#parseWithInfo}: an expression, a failure, or neither when the
 * input was blank.
 */
public final class ParseResult {
  private static final ParseResult NO_INPUT = new ParseResult(null, null);

  private final LicenseExpression expression;
  private final ParseFailure failure;

  private ParseResult(LicenseExpression expression, ParseFailure failure) {
    this.expression = expression;
    this.failure = failure;
  }

  static ParseResult success(LicenseExpression expression) {
    return new ParseResult(Preconditions.checkNotNull(expression), null);
  }

  static ParseResult failure(ParseFailure failure) {
    return new ParseResult(null, Preconditions.checkNotNull(failure));
  }

  static ParseResult noInput() {
    return NO_INPUT;
  }

  /** The parsed expression, when the input was a valid expression. */
  public Optional<LicenseExpression> expression() {
    return Optional.ofNullable(expression);
  }

  /** Where and why parsing failed, when the input was not blank and not a valid expression. */
  public Optional<ParseFailure> failure() {
    return Optional.ofNullable(failure);
  }

  public boolean isSuccess() {
    return expression != null;
  }

  public boolean isFailure() {
    return failure != null;
  }

  /** Returns true when the input held no license information at all. */
  public boolean isBlank() {
    return expression == null && failure == null;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof ParseResult) {
      ParseResult otherResult = (ParseResult) other;
      return Objects.equals(expression, otherResult.expression)
          && Objects.equals(failure, otherResult.failure);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression, failure);
  }

  @Override
  public String toString() {
    if (expression != null) {
      return expression.toString();
    }
    return failure != null ? failure.getMessage() : "<blank>";
  }
}
