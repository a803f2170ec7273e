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
import com.google.common.collect.ImmutableSet;

/**
 * Collects every license id, exception id, LicenseRef and AdditionRef named in an expression.
 *
 * <p>LicenseRefs and AdditionRefs keep their prefixes and any DocumentRef scope. License ids get a
 * {@code +} suffix only when {@code includeOrLater} and the component is or-later.
 */
final class IdExtractor implements ExpressionWalker.Visitor<ImmutableSet<String>> {
  private final boolean includeOrLater;

  IdExtractor(boolean includeOrLater) {
    this.includeOrLater = includeOrLater;
  }

  ImmutableSet<String> extract(LicenseExpression expression) {
    ImmutableSet<String> ids = ExpressionWalker.walk(expression, this);
    return ids == null ? ImmutableSet.of() : ids;
  }

  @Override
  public ImmutableSet<String> visitComponent(LicenseComponent component, int depth) {
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    if (component.isLicenseRef()) {
      ids.add(
          component.documentRef == null
              ? LicenseComponent.LICENSE_REF + component.licenseRef
              : LicenseComponent.DOCUMENT_REF
                  + component.documentRef
                  + ":"
                  + LicenseComponent.LICENSE_REF
                  + component.licenseRef);
    } else {
      ids.add(
          includeOrLater && component.orLater ? component.licenseId + "+" : component.licenseId);
    }
    if (component.hasException()) {
      ids.add(component.exception.toString());
    }
    return ids.build();
  }

  @Override
  public ImmutableSet<String> visitGroup(
      Operator operator, ImmutableList<ImmutableSet<String>> children, int depth) {
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    for (ImmutableSet<String> child : children) {
      ids.addAll(child);
    }
    return ids.build();
  }
}
