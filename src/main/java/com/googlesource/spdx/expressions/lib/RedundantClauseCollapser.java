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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Removes duplicate siblings from every group and dissolves groups left with a single child.
 *
 * <p>Siblings are duplicates when they render to the same string once put in canonical order, so
 * {@code (MIT AND ISC) OR (ISC AND MIT)} keeps only the first clause. Only siblings under the
 * same operator are compared: {@code A OR (A AND B)} keeps both clauses.
 */
final class RedundantClauseCollapser extends ExpressionWalker.TreeRewriter {
  static final RedundantClauseCollapser INSTANCE = new RedundantClauseCollapser();

  private RedundantClauseCollapser() {}

  LicenseExpression collapse(LicenseExpression expression) {
    return ExpressionWalker.walk(expression, this);
  }

  @Override
  public LicenseExpression visitGroup(
      Operator operator, ImmutableList<LicenseExpression> children, int depth) {
    // A child that dissolved into a group with this operator joins this group.
    List<LicenseExpression> flattened = new ArrayList<>(children.size());
    for (LicenseExpression child : children) {
      TreeTransformer.addFlattened(flattened, operator, child);
    }
    LinkedHashMap<String, LicenseExpression> distinct = new LinkedHashMap<>();
    for (LicenseExpression child : flattened) {
      distinct.putIfAbsent(ExpressionUnparser.unparse(CanonicalSorter.INSTANCE.sort(child)), child);
    }
    if (distinct.size() == 1) {
      return distinct.values().iterator().next();
    }
    return new LicenseGroup(operator, distinct.values());
  }
}
