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

/**
 * Depth-first traversal of a {@link LicenseExpression}.
 *
 * <p>Children are visited before their group, so {@link Visitor#visitGroup} receives the results
 * for every child. The root has depth 0 and each group adds one level for its children.
 */
public final class ExpressionWalker {

  private ExpressionWalker() {}

  /** Callbacks for {@link ExpressionWalker#walk}. Visit methods must not return null. */
  public interface Visitor<T> {

    /** Visits the operator of a group at {@code depth} before its children. */
    default Operator visitOperator(Operator operator, int depth) {
      return operator;
    }

    /** Visits a license component at {@code depth}. */
    T visitComponent(LicenseComponent component, int depth);

    /** Visits a group at {@code depth} given the visited operator and the visited children. */
    T visitGroup(Operator operator, ImmutableList<T> children, int depth);
  }

  /**
   * Visitor rebuilding the tree it walks. Every visit method defaults to identity, so subclasses
   * override only the node kinds they rewrite.
   */
  public abstract static class TreeRewriter implements Visitor<LicenseExpression> {

    @Override
    public LicenseExpression visitComponent(LicenseComponent component, int depth) {
      return component;
    }

    @Override
    public LicenseExpression visitGroup(
        Operator operator, ImmutableList<LicenseExpression> children, int depth) {
      return new LicenseGroup(operator, children);
    }
  }

  /** Rewriter returning a tree equal to the one it walks. */
  public static TreeRewriter identity() {
    return new TreeRewriter() {};
  }

  /** Walks {@code expression} with {@code visitor} returning the root's result, or null. */
  public static <T> T walk(LicenseExpression expression, Visitor<T> visitor) {
    Preconditions.checkNotNull(visitor);
    if (expression == null) {
      return null;
    }
    return walk(expression, visitor, 0);
  }

  private static <T> T walk(LicenseExpression expression, Visitor<T> visitor, int depth) {
    if (expression instanceof LicenseComponent) {
      return visitor.visitComponent((LicenseComponent) expression, depth);
    }
    LicenseGroup group = (LicenseGroup) expression;
    Operator operator = visitor.visitOperator(group.operator, depth);
    ImmutableList.Builder<T> children =
        ImmutableList.builderWithExpectedSize(group.children.size());
    for (LicenseExpression child : group.children) {
      children.add(walk(child, visitor, depth + 1));
    }
    return visitor.visitGroup(operator, children.build(), depth);
  }
}
