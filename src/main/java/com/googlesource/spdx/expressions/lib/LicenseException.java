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
 * The exception named by a {@code WITH} clause: either a listed exception id or a user-defined
 * {@code AdditionRef-} optionally scoped to an external document.
 */
public final class LicenseException {
  static final String ADDITION_REF = "AdditionRef-";

  /** The listed exception id, or null for an AdditionRef. */
  public final String exceptionId;
  /** The AdditionRef id without its prefix, or null for a listed exception id. */
  public final String additionRef;
  /** The DocumentRef id without its prefix scoping the AdditionRef, or null. */
  public final String documentRef;

  private LicenseException(String exceptionId, String additionRef, String documentRef) {
    this.exceptionId = exceptionId;
    this.additionRef = additionRef;
    this.documentRef = documentRef;
  }

  /** Exception attachment for the listed exception identified by {@code exceptionId}. */
  public static LicenseException exceptionId(String exceptionId) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(exceptionId), "missing exception id");
    return new LicenseException(exceptionId, null, null);
  }

  /**
   * Exception attachment for {@code [DocumentRef-documentRef:]AdditionRef-additionRef}.
   *
   * @param documentRef the optional document scope without its prefix, or null
   * @param additionRef the user-defined id without its prefix
   */
  public static LicenseException additionRef(String documentRef, String additionRef) {
    Preconditions.checkArgument(!Strings.isNullOrEmpty(additionRef), "missing AdditionRef id");
    Preconditions.checkArgument(
        documentRef == null || !documentRef.isEmpty(), "empty DocumentRef id");
    return new LicenseException(null, additionRef, documentRef);
  }

  public boolean isAdditionRef() {
    return additionRef != null;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof LicenseException) {
      LicenseException otherException = (LicenseException) other;
      return Objects.equals(exceptionId, otherException.exceptionId)
          && Objects.equals(additionRef, otherException.additionRef)
          && Objects.equals(documentRef, otherException.documentRef);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return Objects.hash(exceptionId, additionRef, documentRef);
  }

  /** Renders the exception as it appears after {@code WITH}. */
  @Override
  public String toString() {
    if (!isAdditionRef()) {
      return exceptionId;
    }
    return documentRef == null
        ? ADDITION_REF + additionRef
        : LicenseComponent.DOCUMENT_REF + documentRef + ":" + ADDITION_REF + additionRef;
  }
}
