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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;

/**
 * Puts the children of every group into a canonical order so that reordered operands of AND and
 * OR produce equal trees.
 *
 * <p>Components come before groups and sort by their string form. Groups sort by number of
 * children, then by string form.
 */
final class CanonicalSorter extends ExpressionWalker.TreeRewriter {
  static final CanonicalSorter INSTANCE = new CanonicalSorter();

  /** Orders sibling expressions. */
  static final Comparator<LicenseExpression> ORDER =
      new Comparator<LicenseExpression>() {
        @Override
        public int compare(LicenseExpression a, LicenseExpression b) {
          if (a.isComponent() != b.isComponent()) {
            return a.isComponent() ? -1 : 1;
          }
          if (!a.isComponent()) {
            int sizes =
                Integer.compare(
                    ((LicenseGroup) a).children.size(), ((LicenseGroup) b).children.size());
            if (sizes != 0) {
              return sizes;
            }
          }
          return ExpressionUnparser.unparse(a).compareTo(ExpressionUnparser.unparse(b));
        }
      };

  private CanonicalSorter() {}

  LicenseExpression sort(LicenseExpression expression) {
    return ExpressionWalker.walk(expression, this);
  }

  @Override
  public LicenseExpression visitGroup(
      Operator operator, ImmutableList<LicenseExpression> children, int depth) {
    return new LicenseGroup(operator, ImmutableList.sortedCopyOf(ORDER, children));
  }
}
