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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites deprecated license and exception ids to their current equivalents.
 *
 * <p>Most of the work concerns the GPL family, whose bare version ids (e.g. GPL-2.0) became
 * {@code -only} and {@code -or-later} ids, and whose "with exception" ids became a license id plus
 * a WITH clause.
 */
final class DeprecatedIdNormalizer extends ExpressionWalker.TreeRewriter {
  private static final String ONLY = "-only";
  private static final String OR_LATER = "-or-later";

  /** Current ids of the GPL family. */
  static final ImmutableSet<String> GPL_FAMILY =
      ImmutableSet.of(
          "AGPL-1.0-only",
          "AGPL-1.0-or-later",
          "AGPL-3.0-only",
          "AGPL-3.0-or-later",
          "GPL-1.0-only",
          "GPL-1.0-or-later",
          "GPL-2.0-only",
          "GPL-2.0-or-later",
          "GPL-3.0-only",
          "GPL-3.0-or-later",
          "LGPL-2.0-only",
          "LGPL-2.0-or-later",
          "LGPL-2.1-only",
          "LGPL-2.1-or-later",
          "LGPL-3.0-only",
          "LGPL-3.0-or-later");

  /** Deprecated GPL family ids naming just a license. */
  static final ImmutableMap<String, String> DEPRECATED_SIMPLE =
      ImmutableMap.<String, String>builder()
          .put("AGPL-1.0", "AGPL-1.0-only")
          .put("AGPL-3.0", "AGPL-3.0-only")
          .put("GPL-1.0", "GPL-1.0-only")
          .put("GPL-1.0+", "GPL-1.0-or-later")
          .put("GPL-2.0", "GPL-2.0-only")
          .put("GPL-2.0+", "GPL-2.0-or-later")
          .put("GPL-3.0", "GPL-3.0-only")
          .put("GPL-3.0+", "GPL-3.0-or-later")
          .put("LGPL-2.0", "LGPL-2.0-only")
          .put("LGPL-2.0+", "LGPL-2.0-or-later")
          .put("LGPL-2.1", "LGPL-2.1-only")
          .put("LGPL-2.1+", "LGPL-2.1-or-later")
          .put("LGPL-3.0", "LGPL-3.0-only")
          .put("LGPL-3.0+", "LGPL-3.0-or-later")
          .build();

  /** Deprecated GPL family ids naming a license and an exception: id -> {license, exception}. */
  static final ImmutableMap<String, ImmutableList<String>> DEPRECATED_COMPOUND =
      ImmutableMap.<String, ImmutableList<String>>builder()
          .put(
              "GPL-2.0-with-autoconf-exception",
              ImmutableList.of("GPL-2.0-only", "Autoconf-exception-2.0"))
          .put(
              "GPL-2.0-with-bison-exception",
              ImmutableList.of("GPL-2.0-only", "Bison-exception-2.2"))
          .put(
              "GPL-2.0-with-classpath-exception",
              ImmutableList.of("GPL-2.0-only", "Classpath-exception-2.0"))
          .put(
              "GPL-2.0-with-font-exception",
              ImmutableList.of("GPL-2.0-only", "Font-exception-2.0"))
          .put(
              "GPL-2.0-with-GCC-exception",
              ImmutableList.of("GPL-2.0-only", "GCC-exception-2.0"))
          .put(
              "GPL-3.0-with-autoconf-exception",
              ImmutableList.of("GPL-3.0-only", "Autoconf-exception-3.0"))
          .put(
              "GPL-3.0-with-GCC-exception",
              ImmutableList.of("GPL-3.0-only", "GCC-exception-3.1"))
          .build();

  /** Deprecated license ids replaced by a differently named id. */
  static final ImmutableMap<String, String> RENAMED_LICENSES =
      ImmutableMap.of("StandardML-NJ", "SMLNJ");

  /** Deprecated exception ids replaced by a differently named id. */
  static final ImmutableMap<String, String> RENAMED_EXCEPTIONS =
      ImmutableMap.of("Nokia-Qt-exception-1.1", "Qt-LGPL-exception-1.1");

  private final IdRegistry registry;

  DeprecatedIdNormalizer(IdRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
  }

  /** Returns {@code expression} with every deprecated id replaced. */
  LicenseExpression normalize(LicenseExpression expression) {
    return ExpressionWalker.walk(expression, this);
  }

  @Override
  public LicenseExpression visitComponent(LicenseComponent component, int depth) {
    component = rename(component);
    if (component.isLicenseRef()) {
      return component;
    }
    ImmutableList<String> compound = DEPRECATED_COMPOUND.get(component.licenseId);
    if (compound != null) {
      return expandCompound(component, compound.get(0), compound.get(1));
    }
    String current = DEPRECATED_SIMPLE.get(component.licenseId);
    if (current != null) {
      return orLaterVariant(component.withLicenseId(current, component.orLater));
    }
    if (GPL_FAMILY.contains(component.licenseId)) {
      return orLaterVariant(component);
    }
    return component;
  }

  @Override
  public LicenseExpression visitGroup(
      Operator operator, ImmutableList<LicenseExpression> children, int depth) {
    // Expanded compound ids may have added an AND group under an AND group.
    List<LicenseExpression> flattened = new ArrayList<>(children.size());
    for (LicenseExpression child : children) {
      TreeTransformer.addFlattened(flattened, operator, child);
    }
    return new LicenseGroup(operator, flattened);
  }

  private static LicenseComponent rename(LicenseComponent component) {
    if (component.exception != null && !component.exception.isAdditionRef()) {
      String exceptionId = RENAMED_EXCEPTIONS.get(component.exception.exceptionId);
      if (exceptionId != null) {
        component = component.withException(LicenseException.exceptionId(exceptionId));
      }
    }
    if (!component.isLicenseRef()) {
      String licenseId = RENAMED_LICENSES.get(component.licenseId);
      if (licenseId != null) {
        component = component.withLicenseId(licenseId, component.orLater);
      }
    }
    return component;
  }

  /**
   * Replaces a compound id with its license id and implied exception. An explicit, different WITH
   * exception yields both exceptions joined by AND.
   */
  private LicenseExpression expandCompound(
      LicenseComponent component, String licenseId, String exceptionId) {
    LicenseComponent license =
        orLaterVariant(component.withLicenseId(licenseId, component.orLater));
    LicenseException implied = LicenseException.exceptionId(exceptionId);
    if (component.exception == null || component.exception.equals(implied)) {
      return license.withException(implied);
    }
    return LicenseGroup.of(
        Operator.AND, license.withException(implied), license.withException(component.exception));
  }

  /**
   * Moves the or-later flag of a GPL family component into its id when the {@code -or-later} id
   * is listed and current. Otherwise returns {@code component} unchanged.
   */
  private LicenseComponent orLaterVariant(LicenseComponent component) {
    if (!component.orLater) {
      return component;
    }
    String id = component.licenseId;
    String variant =
        id.endsWith(ONLY) ? id.substring(0, id.length() - ONLY.length()) + OR_LATER : id;
    if (variant.endsWith(OR_LATER) && isCurrent(variant)) {
      return component.withLicenseId(variant, false);
    }
    return component;
  }

  private boolean isCurrent(String licenseId) {
    return registry.isKnownLicenseId(licenseId)
        && !registry.isDeprecated(licenseId).orElse(false);
  }
}
