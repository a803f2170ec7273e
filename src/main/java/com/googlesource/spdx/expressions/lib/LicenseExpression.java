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

/**
 * Immutable tree describing a parsed license expression.
 *
 * <p>Every expression is either a single {@link LicenseComponent} or a {@link LicenseGroup} of
 * child expressions joined by one {@link Operator}. No other subclasses exist.
 */
public abstract class LicenseExpression {

  LicenseExpression() {}

  /** Returns true for a bare license component, and false for a group. */
  public abstract boolean isComponent();

  /** Returns the canonical string form of this expression. */
  @Override
  public String toString() {
    return ExpressionUnparser.unparse(this);
  }
}
