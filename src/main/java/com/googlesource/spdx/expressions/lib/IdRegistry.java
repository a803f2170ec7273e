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

import com.google.common.collect.ImmutableSet;
import java.util.Optional;

/**
 * Source of the license and exception identifiers an expression may reference.
 *
 * <p>The expression engine reads {@link #knownLicenseIds()} and {@link #knownExceptionIds()} once
 * when it builds its grammar. Implementations must return the same answers for the lifetime of an
 * engine.
 */
public interface IdRegistry {

  /** All listed license ids in their canonical spelling. */
  ImmutableSet<String> knownLicenseIds();

  /** All listed exception ids in their canonical spelling. */
  ImmutableSet<String> knownExceptionIds();

  /** Returns true if {@code id} is a listed license id, compared case-sensitively. */
  boolean isKnownLicenseId(String id);

  /** Returns true if {@code id} is a listed exception id, compared case-sensitively. */
  boolean isKnownExceptionId(String id);

  /** Returns the canonical spelling of the listed id equal to {@code id} ignoring case. */
  Optional<String> canonicalCase(String id);

  /** Returns whether the listed license or exception {@code id} is deprecated, if it is listed. */
  Optional<Boolean> isDeprecated(String id);
}
