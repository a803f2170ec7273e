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
public class TreeTransformerTest {

  private static final ListedIdRegistry registry = ListedIdRegistry.bundled();
  private static final ExpressionParser parser =
      new ExpressionParser(ExpressionGrammar.build(registry), false);

  private final TreeTransformer transformer = new TreeTransformer(registry);

  @Test
  public void testLicenseId_canonicalCase() throws Exception {
    assertThat(transform("apache-2.0")).isEqualTo(LicenseComponent.of("Apache-2.0"));
    assertThat(transform("mit+")).isEqualTo(LicenseComponent.of("MIT", true));
  }

  @Test
  public void testLicenseRef_splitsDocumentRef() throws Exception {
    assertThat(transform("LicenseRef-foo")).isEqualTo(LicenseComponent.licenseRef(null, "foo"));
    assertThat(transform("DocumentRef-spdx-tool-1.2:LicenseRef-MIT-Style-2"))
        .isEqualTo(LicenseComponent.licenseRef("spdx-tool-1.2", "MIT-Style-2"));
  }

  @Test
  public void testWith_attachesException() throws Exception {
    assertThat(transform("gpl-2.0+ with classpath-exception-2.0"))
        .isEqualTo(
            LicenseComponent.of("GPL-2.0", true)
                .withException(LicenseException.exceptionId("Classpath-exception-2.0")));
    assertThat(transform("LicenseRef-a WITH DocumentRef-b:AdditionRef-c"))
        .isEqualTo(
            LicenseComponent.licenseRef(null, "a")
                .withException(LicenseException.additionRef("b", "c")));
  }

  @Test
  public void testParentheses_dissolve() throws Exception {
    assertThat(transform("((MIT))")).isEqualTo(LicenseComponent.of("MIT"));
    assertThat(transform("(MIT OR ISC)"))
        .isEqualTo(
            LicenseGroup.of(Operator.OR, LicenseComponent.of("MIT"), LicenseComponent.of("ISC")));
  }

  @Test
  public void testSameOperator_flattened() throws Exception {
    assertThat(transform("mit AND (apache-2.0 AND bsd-3-clause)"))
        .isEqualTo(
            LicenseGroup.of(
                Operator.AND,
                LicenseComponent.of("MIT"),
                LicenseComponent.of("Apache-2.0"),
                LicenseComponent.of("BSD-3-Clause")));
  }

  @Test
  public void testPrecedence_keepsInputOrder() throws Exception {
    assertThat(transform("ISC OR MIT AND Apache-2.0 OR (Zlib OR 0BSD)"))
        .isEqualTo(
            LicenseGroup.of(
                Operator.OR,
                LicenseComponent.of("ISC"),
                LicenseGroup.of(
                    Operator.AND, LicenseComponent.of("MIT"), LicenseComponent.of("Apache-2.0")),
                LicenseComponent.of("Zlib"),
                LicenseComponent.of("0BSD")));
  }

  @Test
  public void testDeprecatedIds_kept() throws Exception {
    assertThat(transform("GPL-2.0-with-GCC-exception"))
        .isEqualTo(LicenseComponent.of("GPL-2.0-with-GCC-exception"));
  }

  private LicenseExpression transform(String input) throws Exception {
    return transformer.transform(parser.parse(input));
  }
}
