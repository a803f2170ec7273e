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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParseFailureTest {

  @Test
  public void testMessage() {
    ParseFailure failure =
        new ParseFailure(
            "MIT AND Apache-2.1",
            8,
            "Apache-2.1",
            "unknown license id",
            ImmutableList.of(ParseFailure.LICENSE_ID, ParseFailure.LICENSE_REF),
            ImmutableList.of("Apache-1.1", "Apache-2.0"));

    assertThat(failure.getMessage())
        .isEqualTo(
            "Parse error at line 1, column 9: unknown license id \"Apache-2.1\"\n"
                + "MIT AND Apache-2.1\n"
                + "        ^\n"
                + "Expected one of: license id, LicenseRef\n"
                + "Did you mean Apache-1.1 or Apache-2.0?");
  }

  @Test
  public void testMessage_endOfInputOnSecondLine() {
    ParseFailure failure =
        new ParseFailure(
            "MIT\nAND",
            7,
            "",
            "missing license",
            ImmutableList.of(ParseFailure.LICENSE_ID),
            ImmutableList.of());

    assertThat(failure.line).isEqualTo(2);
    assertThat(failure.column).isEqualTo(4);
    assertThat(failure.getMessage())
        .isEqualTo(
            "Parse error at line 2, column 4: missing license\n"
                + "AND\n"
                + "   ^\n"
                + "Expected license id");
  }

  @Test
  public void testJoinAlternatives() {
    assertThat(ParseFailure.joinAlternatives(ImmutableList.of("a"))).isEqualTo("a");
    assertThat(ParseFailure.joinAlternatives(ImmutableList.of("a", "b"))).isEqualTo("a or b");
    assertThat(ParseFailure.joinAlternatives(ImmutableList.of("a", "b", "c")))
        .isEqualTo("a, b or c");
  }

  @Test
  public void testEquality() {
    ParseFailure failure =
        new ParseFailure("X", 0, "X", "unknown license id", ImmutableList.of(), ImmutableList.of());
    ParseFailure same =
        new ParseFailure("X", 0, "X", "unknown license id", ImmutableList.of(), ImmutableList.of());
    ParseFailure other =
        new ParseFailure("X", 1, "", "missing operator", ImmutableList.of(), ImmutableList.of());

    assertThat(failure).isEqualTo(same);
    assertThat(failure.hashCode()).isEqualTo(same.hashCode());
    assertThat(failure).isNotEqualTo(other);
    assertThat(failure.toString()).isEqualTo(failure.getMessage());
  }
}
