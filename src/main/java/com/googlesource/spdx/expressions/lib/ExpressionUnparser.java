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
 * Renders a {@link LicenseExpression} as a string.
 *
 * <p>Operators are upper case and separated by single spaces. Only nested groups are wrapped in
 * parentheses; the outermost group never is.
 */
public final class ExpressionUnparser implements ExpressionWalker.Visitor<String> {
  private static final ExpressionUnparser INSTANCE = new ExpressionUnparser();

  private ExpressionUnparser() {}

  /** Returns the string form of {@code expression}, or null when {@code expression} is null. */
  public static String unparse(LicenseExpression expression) {
    return ExpressionWalker.walk(expression, INSTANCE);
  }

  /** Returns the string form of {@code component} without any enclosing group. */
  public static String unparseComponent(LicenseComponent component) {
    StringBuilder sb = new StringBuilder();
    if (component.isLicenseRef()) {
      if (component.documentRef != null) {
        sb.append(LicenseComponent.DOCUMENT_REF).append(component.documentRef).append(':');
      }
      sb.append(LicenseComponent.LICENSE_REF).append(component.licenseRef);
    } else {
      sb.append(component.licenseId);
      if (component.orLater) {
        sb.append('+');
      }
    }
    if (component.hasException()) {
      sb.append(" WITH ").append(component.exception);
    }
    return sb.toString();
  }

  @Override
  public String visitComponent(LicenseComponent component, int depth) {
    return unparseComponent(component);
  }

  @Override
  public String visitGroup(Operator operator, ImmutableList<String> children, int depth) {
    String joined = Joiner.on(operator.separator()).join(children);
    return depth > 0 ? "(" + joined + ")" : joined;
  }
}
