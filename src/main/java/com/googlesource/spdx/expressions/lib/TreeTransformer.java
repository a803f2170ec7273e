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
import java.util.ArrayList;
import java.util.List;

/**
 * Converts the concrete syntax tree into {@link LicenseExpression} form.
 *
 * <p>Canonicalizes the case of listed ids, splits DocumentRef scopes from LicenseRefs and
 * AdditionRefs, merges or-later markers and WITH clauses into their license components, flattens
 * nested groups sharing an operator, and replaces single-child sequences with their child.
 */
final class TreeTransformer {
  private final IdRegistry registry;

  TreeTransformer(IdRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
  }

  LicenseExpression transform(SyntaxNode node) {
    switch (node.rule) {
      case EXPRESSION:
        return transform(node.children.get(0));
      case OR_EXPRESSION:
        return sequence(Operator.OR, node.children);
      case AND_EXPRESSION:
        return sequence(Operator.AND, node.children);
      case WITH_EXPRESSION:
        return component(node.children.get(0)).withException(exception(node.children.get(1)));
      case LICENSE_ID:
      case LICENSE_OR_LATER:
      case LICENSE_REF:
        return component(node);
      default:
        throw new IllegalArgumentException("unexpected " + node.rule + " in expression");
    }
  }

  private LicenseExpression sequence(Operator operator, ImmutableList<SyntaxNode> nodes) {
    if (nodes.size() == 1) {
      return transform(nodes.get(0));
    }
    List<LicenseExpression> children = new ArrayList<>(nodes.size());
    for (SyntaxNode node : nodes) {
      addFlattened(children, operator, transform(node));
    }
    return new LicenseGroup(operator, children);
  }

  private LicenseComponent component(SyntaxNode node) {
    switch (node.rule) {
      case LICENSE_ID:
        return LicenseComponent.of(canonicalCase(node.tokens.get(0)));
      case LICENSE_OR_LATER:
        return LicenseComponent.of(canonicalCase(node.children.get(0).tokens.get(0)), true);
      case LICENSE_REF:
        return node.tokens.size() == 2
            ? LicenseComponent.licenseRef(node.tokens.get(0), node.tokens.get(1))
            : LicenseComponent.licenseRef(null, node.tokens.get(0));
      default:
        throw new IllegalArgumentException("unexpected " + node.rule + " as license");
    }
  }

  private LicenseException exception(SyntaxNode node) {
    switch (node.rule) {
      case LICENSE_EXCEPTION_ID:
        return LicenseException.exceptionId(canonicalCase(node.tokens.get(0)));
      case ADDITION_REF:
        return node.tokens.size() == 2
            ? LicenseException.additionRef(node.tokens.get(0), node.tokens.get(1))
            : LicenseException.additionRef(null, node.tokens.get(0));
      default:
        throw new IllegalArgumentException("unexpected " + node.rule + " as exception");
    }
  }

  private String canonicalCase(String id) {
    return registry.canonicalCase(id).orElse(id);
  }

  /**
   * Appends {@code child} to {@code children}, splicing in its children instead when it is a
   * group with the same {@code operator}.
   */
  static void addFlattened(
      List<LicenseExpression> children, Operator operator, LicenseExpression child) {
    if (LicenseGroup.isGroup(child, operator)) {
      children.addAll(((LicenseGroup) child).children);
    } else {
      children.add(child);
    }
  }
}
