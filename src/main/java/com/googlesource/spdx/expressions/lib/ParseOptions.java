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

import java.util.Objects;

/** Selects which canonicalization passes run when parsing a license expression. */
public final class ParseOptions {
  private static final ParseOptions DEFAULTS = builder().build();
  private static final ParseOptions STRICT =
      builder().normaliseDeprecatedIds(false).caseSensitiveOperators(true).build();

  /** Rewrite deprecated ids to their current equivalents. Default true. */
  public final boolean normaliseDeprecatedIds;
  /** Accept only upper case AND, OR and WITH. Default false. */
  public final boolean caseSensitiveOperators;
  /** Remove duplicate siblings and dissolve single-child groups. Default true. */
  public final boolean collapseRedundantClauses;
  /** Put group children into canonical order. Default true. */
  public final boolean sortLicenses;
  /** Keep the {@code +} suffix on extracted license ids. Default false. */
  public final boolean includeOrLater;

  private ParseOptions(Builder builder) {
    this.normaliseDeprecatedIds = builder.normaliseDeprecatedIds;
    this.caseSensitiveOperators = builder.caseSensitiveOperators;
    this.collapseRedundantClauses = builder.collapseRedundantClauses;
    this.sortLicenses = builder.sortLicenses;
    this.includeOrLater = builder.includeOrLater;
  }

  /** The default options. */
  public static ParseOptions defaults() {
    return DEFAULTS;
  }

  /** Options for strict SPDX syntax: upper case operators and deprecated ids left as written. */
  public static ParseOptions strict() {
    return STRICT;
  }

  /** Returns a Builder object for the ParseOptions class, starting from the defaults. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns a Builder starting from these options. */
  public Builder toBuilder() {
    return new Builder()
        .normaliseDeprecatedIds(normaliseDeprecatedIds)
        .caseSensitiveOperators(caseSensitiveOperators)
        .collapseRedundantClauses(collapseRedundantClauses)
        .sortLicenses(sortLicenses)
        .includeOrLater(includeOrLater);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof ParseOptions) {
      ParseOptions otherOptions = (ParseOptions) other;
      return normaliseDeprecatedIds == otherOptions.normaliseDeprecatedIds
          && caseSensitiveOperators == otherOptions.caseSensitiveOperators
          && collapseRedundantClauses == otherOptions.collapseRedundantClauses
          && sortLicenses == otherOptions.sortLicenses
          && includeOrLater == otherOptions.includeOrLater;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        normaliseDeprecatedIds,
        caseSensitiveOperators,
        collapseRedundantClauses,
        sortLicenses,
        includeOrLater);
  }

  @Override
  public String toString() {
    return "ParseOptions{normaliseDeprecatedIds="
        + normaliseDeprecatedIds
        + ", caseSensitiveOperators="
        + caseSensitiveOperators
        + ", collapseRedundantClauses="
        + collapseRedundantClauses
        + ", sortLicenses="
        + sortLicenses
        + ", includeOrLater="
        + includeOrLater
        + "}";
  }

  /** Implements the Builder pattern for ParseOptions. */
  public static class Builder {
    private boolean normaliseDeprecatedIds = true;
    private boolean caseSensitiveOperators = false;
    private boolean collapseRedundantClauses = true;
    private boolean sortLicenses = true;
    private boolean includeOrLater = false;

    private Builder() {}

    public ParseOptions build() {
      return new ParseOptions(this);
    }

    public Builder normaliseDeprecatedIds(boolean value) {
      normaliseDeprecatedIds = value;
      return this;
    }

    public Builder caseSensitiveOperators(boolean value) {
      caseSensitiveOperators = value;
      return this;
    }

    public Builder collapseRedundantClauses(boolean value) {
      collapseRedundantClauses = value;
      return this;
    }

    public Builder sortLicenses(boolean value) {
      sortLicenses = value;
      return this;
    }

    public Builder includeOrLater(boolean value) {
      includeOrLater = value;
      return this;
    }
  }
}
