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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParseOptionsTest {

  @Test
  public void testDefaults() {
    ParseOptions options = ParseOptions.defaults();

    assertThat(options.normaliseDeprecatedIds).isTrue();
    assertThat(options.caseSensitiveOperators).isFalse();
    assertThat(options.collapseRedundantClauses).isTrue();
    assertThat(options.sortLicenses).isTrue();
    assertThat(options.includeOrLater).isFalse();
    assertThat(ParseOptions.builder().build()).isEqualTo(options);
  }

  @Test
  public void testStrict() {
    ParseOptions options = ParseOptions.strict();

    assertThat(options.normaliseDeprecatedIds).isFalse();
    assertThat(options.caseSensitiveOperators).isTrue();
    assertThat(options.collapseRedundantClauses).isTrue();
    assertThat(options.sortLicenses).isTrue();
    assertThat(options).isNotEqualTo(ParseOptions.defaults());
  }

  @Test
  public void testToBuilder_roundTrips() {
    ParseOptions options =
        ParseOptions.builder().sortLicenses(false).includeOrLater(true).build();

    assertThat(options.toBuilder().build()).isEqualTo(options);
    assertThat(options.toBuilder().build().hashCode()).isEqualTo(options.hashCode());
    assertThat(options.toBuilder().sortLicenses(true).build()).isNotEqualTo(options);
  }

  @Test
  public void testToString() {
    assertThat(ParseOptions.strict().toString())
        .isEqualTo(
            "ParseOptions{normaliseDeprecatedIds=false, caseSensitiveOperators=true,"
                + " collapseRedundantClauses=true, sortLicenses=true, includeOrLater=false}");
  }
}
