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

package com.googlesource.spdx.expressions.tools;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NormaliseToolTest {

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

  @Test
  public void testArguments_normalised() throws Exception {
    assertThat(run("", "mit and apache-2.0", "GPL-2.0+")).isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEqualTo("Apache-2.0 AND MIT\nGPL-2.0-or-later\n");
    assertThat(err()).isEmpty();
  }

  @Test
  public void testInvalidArgument_reported() throws Exception {
    assertThat(run("", "MIT", "MIT AND", "Apache-2.0")).isEqualTo(NormaliseTool.EXIT_INVALID);

    assertThat(out()).isEqualTo("MIT\nApache-2.0\n");
    assertThat(err()).startsWith("argument 2: Parse error at line 1, column 8: missing license\n");
  }

  @Test
  public void testBlankArgument_skipped() throws Exception {
    assertThat(run("", " ", "MIT")).isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEqualTo("MIT\n");
  }

  @Test
  public void testCheck_printsNothingForValid() throws Exception {
    assertThat(run("", "--check", "MIT", "Apache-2.0")).isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEmpty();
    assertThat(err()).isEmpty();
  }

  @Test
  public void testIds() throws Exception {
    assertThat(run("", "--ids", "mit AND apache-2.0", "GPL-2.0+ WITH Classpath-exception-2.0"))
        .isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out())
        .isEqualTo("Apache-2.0 MIT\nGPL-2.0-or-later Classpath-exception-2.0\n");
  }

  @Test
  public void testStrict() throws Exception {
    assertThat(run("", "--strict", "GPL-2.0", "MIT and ISC")).isEqualTo(NormaliseTool.EXIT_INVALID);

    assertThat(out()).isEqualTo("GPL-2.0\n");
    assertThat(err()).startsWith("argument 2: ");
  }

  @Test
  public void testStdin() throws Exception {
    assertThat(run("MIT\n\nbogus-license\nISC OR mit\n", "-f", "-"))
        .isEqualTo(NormaliseTool.EXIT_INVALID);

    assertThat(out()).isEqualTo("MIT\nISC OR MIT\n");
    assertThat(err()).startsWith("- record 3: Parse error at line 1, column 1: ");
  }

  @Test
  public void testNulDelimitedStdin() throws Exception {
    assertThat(run("MIT\nAND\nISC\000Apache-2.0", "-0", "-f=-"))
        .isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEqualTo("ISC AND MIT\nApache-2.0\n");
  }

  @Test
  public void testInputFile() throws Exception {
    File input = tempFolder.newFile("expressions.txt");
    Files.write(input.toPath(), "Zlib\nMIT OR MIT\n".getBytes(UTF_8));

    assertThat(run("", "-f=" + input.getPath())).isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEqualTo("Zlib\nMIT\n");
  }

  @Test
  public void testMissingInputFile() throws Exception {
    File missing = new File(tempFolder.getRoot(), "missing.txt");

    assertThat(run("", "-f", missing.getPath())).isEqualTo(NormaliseTool.EXIT_USAGE);

    assertThat(out()).isEmpty();
    assertThat(err()).contains("missing.txt");
  }

  @Test
  public void testConfig_addsIds() throws Exception {
    File config = tempFolder.newFile("expressions.config");
    Files.write(
        config.toPath(),
        "[expressions]\n  licenseId = Custom-License-1.0\n  sortLicenses = false\n"
            .getBytes(UTF_8));

    assertThat(run("", "--config=" + config.getPath(), "MIT OR custom-license-1.0"))
        .isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEqualTo("MIT OR Custom-License-1.0\n");
  }

  @Test
  public void testConfigErrors_usageExit() throws Exception {
    File config = tempFolder.newFile("bad.config");
    Files.write(config.toPath(), "[expressions]\n  sortLicenses = maybe\n".getBytes(UTF_8));

    assertThat(run("", "--config", config.getPath(), "MIT")).isEqualTo(NormaliseTool.EXIT_USAGE);

    assertThat(out()).isEmpty();
    assertThat(err()).contains("expected true or false");
  }

  @Test
  public void testVerbose() throws Exception {
    assertThat(run("", "-v", "MIT")).isEqualTo(NormaliseTool.EXIT_VALID);

    assertThat(out()).isEqualTo("MIT\n");
    assertThat(err()).containsMatch("Grammar: \\S+ \\(\\d+ license ids, \\d+ exception ids\\)");
    assertThat(err()).contains("1 expressions, 0 invalid in ");
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertThat(run("")).isEqualTo(NormaliseTool.EXIT_USAGE);
    assertThat(run("", "--bogus", "MIT")).isEqualTo(NormaliseTool.EXIT_USAGE);
    assertThat(run("", "--ids", "--check", "MIT")).isEqualTo(NormaliseTool.EXIT_USAGE);
    assertThat(run("", "-0", "MIT")).isEqualTo(NormaliseTool.EXIT_USAGE);
    assertThat(run("", "--strict", "--strict", "MIT")).isEqualTo(NormaliseTool.EXIT_USAGE);
    assertThat(run("", "-f=-", "MIT")).isEqualTo(NormaliseTool.EXIT_USAGE);
    assertThat(run("", "-f")).isEqualTo(NormaliseTool.EXIT_USAGE);

    assertThat(out()).isEmpty();
    assertThat(err()).contains("where flags are:");
  }

  private int run(String stdin, String... args) {
    return NormaliseTool.run(
        args,
        new ByteArrayInputStream(stdin.getBytes(UTF_8)),
        new PrintStream(outBytes, true, UTF_8),
        new PrintStream(errBytes, true, UTF_8));
  }

  private String out() {
    return new String(outBytes.toByteArray(), UTF_8);
  }

  private String err() {
    return new String(errBytes.toByteArray(), UTF_8);
  }
}
