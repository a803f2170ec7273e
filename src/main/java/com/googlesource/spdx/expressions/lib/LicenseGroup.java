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
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Objects;

/** Ordered, non-empty list of child expressions joined by a single {@link Operator}. */
public final class LicenseGroup extends LicenseExpression {
  public final Operator operator;
  public final ImmutableList<LicenseExpression> children;

  public LicenseGroup(Operator operator, Iterable<? extends LicenseExpression> children) {
    this.operator = Preconditions.checkNotNull(operator);
    this.children = ImmutableList.copyOf(children);
    Preconditions.checkArgument(!this.children.isEmpty(), "empty %s group", operator);
  }

  public static LicenseGroup of(Operator operator, LicenseExpression... children) {
    return new LicenseGroup(operator, Arrays.asList(children));
  }

  @Override
  public boolean isComponent() {
    return false;
  }

  /** Returns true when {@code expression} is a group joined by {@code operator}. */
  static boolean isGroup(LicenseExpression expression, Operator operator) {
    return expression instanceof LicenseGroup && ((LicenseGroup) expression).operator == operator;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof LicenseGroup) {
      LicenseGroup otherGroup = (LicenseGroup) other;
      return operator == otherGroup.operator && children.equals(otherGroup.children);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(operator, children);
  }
}
