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
import com.google.common.base.Strings;
import java.util.Objects;

/**
 * Atomic leaf of a license expression.
 *
 * <p>Names exactly one license: either a listed license id, optionally "or any later version", or
 * a user-defined {@code LicenseRef-} optionally scoped to an external document. Either form may
 * carry a {@link LicenseException} from a trailing {@code WITH} clause.
 */
public final class LicenseComponent extends LicenseExpression {
  static final String DOCUMENT_REF = "DocumentRef-";
  static final String LICENSE_REF = "LicenseRef-";

  /** The listed license id, or null for a LicenseRef. */
  public final String licenseId;
  /** True when the listed license is followed by {@code +}. Always false for a LicenseRef. */
  public final boolean orLater;
  /** The LicenseRef id without its prefix, or null for a listed license id. */
  public final String licenseRef;
  /** The DocumentRef id without its prefix scoping the LicenseRef, or null. */
  public final String documentRef;
  /** The exception from a {@code WITH} clause, or null. */
  public final LicenseException exception;

  private LicenseComponent(
      String licenseId,
      boolean orLater,
      String licenseRef,
      String documentRef,
      LicenseException exception) {
    this.licenseId = licenseId;
    this.orLater = orLater;
    this.licenseRef = licenseRef;
    this.documentRef = documentRef;
    this.exception = exception;
  }

  /** Component naming the listed license {@code licenseId}. */
  public static LicenseComponent of(String licenseId) {
    return of(licenseId, false);
  }

  /** Component naming the listed license {@code licenseId}, or any later version if requested. */
  public static LicenseComponent of(String licenseId, boolean orLater) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(licenseId), "missing license id");
    return new LicenseComponent(licenseId, orLater, null, null, null);
  }

  /**
   * Component naming {@code [DocumentRef-documentRef:]LicenseRef-licenseRef}.
   *
   * @param documentRef the optional document scope without its prefix, or null
   * @param licenseRef the user-defined id without its prefix
   */
  public static LicenseComponent licenseRef(String documentRef, String licenseRef) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(licenseRef), "missing LicenseRef id");
    Preconditions.checkArgument(
        documentRef == null || !documentRef.isEmpty(), "empty DocumentRef id");
    return new LicenseComponent(null, false, licenseRef, documentRef, null);
  }

  @Override
  public boolean isComponent() {
    return true;
  }

  public boolean isLicenseRef() {
    return licenseRef != null;
  }

  public boolean hasException() {
    return exception != null;
  }

  /** Returns a copy of this component carrying {@code exception}, or no exception when null. */
  public LicenseComponent withException(LicenseException exception) {
    return new LicenseComponent(licenseId, orLater, licenseRef, documentRef, exception);
  }

  /** Returns a copy of this listed-license component naming {@code newLicenseId} instead. */
  public LicenseComponent withLicenseId(String newLicenseId, boolean newOrLater) {
    Preconditions.checkState(!isLicenseRef(), "LicenseRef has no license id");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(newLicenseId), "missing license id");
    return new LicenseComponent(newLicenseId, newOrLater, null, null, exception);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof LicenseComponent) {
      LicenseComponent otherComponent = (LicenseComponent) other;
      return orLater == otherComponent.orLater
          && Objects.equals(licenseId, otherComponent.licenseId)
          && Objects.equals(licenseRef, otherComponent.licenseRef)
          && Objects.equals(documentRef, otherComponent.documentRef)
          && Objects.equals(exception, otherComponent.exception);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(licenseId, orLater, licenseRef, documentRef, exception);
  }
}
