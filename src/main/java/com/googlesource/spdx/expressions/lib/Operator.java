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

/** Boolean operator joining the children of a {@link LicenseGroup}. */
public enum Operator {
  AND,
  OR;

  /** The operator as it appears in a canonical expression. */
  public String keyword() {
    return name();
  }

  /** The separator placed between the children of a group. e.g. " AND " */
  public String separator() {
    return " " + keyword() + " ";
  }
}
