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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import com.googlesource.spdx.expressions.ExpressionConfig;
import com.googlesource.spdx.expressions.lib.ExpressionEngine;
import com.googlesource.spdx.expressions.lib.ExpressionReader;
import com.googlesource.spdx.expressions.lib.LicenseExpression;
import com.googlesource.spdx.expressions.lib.ListedIdRegistry;
import com.googlesource.spdx.expressions.lib.ParseFailure;
import com.googlesource.spdx.expressions.lib.ParseOptions;
import com.googlesource.spdx.expressions.lib.ParseResult;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.eclipse.jgit.errors.ConfigInvalidException;

/** Command-line tool to validate and normalise license expressions. */
public class NormaliseTool {

  public static String toolName = "normalise_tool";

  static final int EXIT_VALID = 0;
  static final int EXIT_INVALID = 1;
  static final int EXIT_USAGE = 2;

  private static final Pattern flagsPattern =
      Pattern.compile(
          "^[-][-]*(strict|ids|check|0|v(?:erbose)?|config(?:=.*)?|f(?:[-]|=.*)?)$");

  // Flag -f=<inputFile>
  private String inputFile = "";

  // Flag --config=<configFile>
  private String configFile = "";

  // Flag --strict
  private boolean strict = false;

  // Flag --ids
  private boolean printIds = false;

  // Flag --check
  private boolean checkOnly = false;

  // Flag -0
  private boolean nulDelim = false;

  // Flag -v or --verbose
  private boolean verbose = false;

  private final InputStream in;
  private final PrintStream out;
  private final PrintStream err;

  private ExpressionEngine engine;
  private ParseOptions options;
  private long numRecords;
  private long numInvalid;

  private NormaliseTool(InputStream in, PrintStream out, PrintStream err) {
    this.in = in;
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  /**
   * Runs the tool for command-line {@code args}.
   *
   * @return 0 when every expression is valid, 1 when any is invalid, 2 for usage or input errors
   */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    NormaliseTool tool = new NormaliseTool(in, out, err);
    List<String> targets;
    try {
      targets = tool.parseFlags(args);
    } catch (UsageException e) {
      tool.usage(e.getMessage());
      return EXIT_USAGE;
    }
    try {
      return tool.process(targets);
    } catch (UsageException e) {
      tool.usage(e.getMessage());
      return EXIT_USAGE;
    } catch (ConfigInvalidException e) {
      err.printf("%s: invalid config %s: %s\n", toolName, tool.configFile, e.getMessage());
      return EXIT_USAGE;
    } catch (IOException e) {
      err.printf("%s: %s\n", toolName, e.getMessage());
      return EXIT_USAGE;
    }
  }

  private void usage(String problem) {
    err.printf(
        "%s: %s\n%s <flags> {expression...}\n  where flags are:\n"
            + "    -f=<filename>      file named `filename` contains the expressions to check\n"
            + "                       use - as filename to read expressions from stdin\n"
            + "    -0                 with -f to use nul instead of newline between expressions\n"
            + "    --config=<file>    read options and additional ids from `file`\n"
            + "    --strict           case-sensitive operators and no deprecated id rewriting\n"
            + "    --ids              output the ids in each expression instead of the expression\n"
            + "    --check            output nothing for valid expressions\n"
            + "    -v (or --verbose)  output additional progress and status to err\n",
        toolName,
        problem,
        toolName);
  }

  private List<String> parseFlags(String[] args) throws UsageException {
    ArrayList<String> targets = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      Matcher flagMatcher = flagsPattern.matcher(arg);
      if (!flagMatcher.matches()) {
        if (arg.startsWith("-") && arg.length() > 1) {
          throw new UsageException("unknown flag " + arg);
        }
        targets.add(arg);
        continue;
      }
      String flag = flagMatcher.group(1);
      if ("strict".equals(flag)) {
        strict = once(strict, arg);
      } else if ("ids".equals(flag)) {
        printIds = once(printIds, arg);
      } else if ("check".equals(flag)) {
        checkOnly = once(checkOnly, arg);
      } else if ("0".equals(flag)) {
        nulDelim = once(nulDelim, arg);
      } else if ("v".equals(flag) || "verbose".equals(flag)) {
        verbose = once(verbose, arg);
      } else if ("config".equals(flag)) {
        if (++i >= args.length || !configFile.isEmpty()) {
          throw new UsageException("--config needs exactly one file");
        }
        configFile = args[i];
      } else if (flag.startsWith("config=")) {
        if (!configFile.isEmpty() || flag.length() == 7) {
          throw new UsageException("--config needs exactly one file");
        }
        configFile = flag.substring(7);
      } else if ("f".equals(flag)) {
        if (++i >= args.length || !inputFile.isEmpty()) {
          throw new UsageException("-f needs exactly one file");
        }
        inputFile = args[i];
      } else if ("f-".equals(flag)) {
        if (!inputFile.isEmpty()) {
          throw new UsageException("-f needs exactly one file");
        }
        inputFile = "-";
      } else if (flag.startsWith("f=")) {
        if (!inputFile.isEmpty() || flag.length() == 2) {
          throw new UsageException("-f needs exactly one file");
        }
        inputFile = flag.substring(2);
      } else {
        throw new UsageException("unknown flag " + arg);
      }
    }
    if (printIds && checkOnly) {
      throw new UsageException("--ids and --check are mutually exclusive");
    }
    if (nulDelim && inputFile.isEmpty()) {
      throw new UsageException("-0 requires -f");
    }
    return targets;
  }

  private static boolean once(boolean alreadySet, String arg) throws UsageException {
    if (alreadySet) {
      throw new UsageException("repeated flag " + arg);
    }
    return true;
  }

  private int process(List<String> targets)
      throws UsageException, ConfigInvalidException, IOException {
    Stopwatch entireSw = Stopwatch.createStarted();
    ExpressionConfig config = ExpressionConfig.defaults();
    if (!configFile.isEmpty()) {
      config =
          ExpressionConfig.fromText(
              new String(Files.readAllBytes(Paths.get(configFile.trim())), UTF_8));
      if (!config.messages.isEmpty()) {
        StringBuilder sb = new StringBuilder();
        config.appendMessages(sb);
        err.printf("%s: %s%s\n", toolName, configFile, sb);
      }
      if (config.hasErrors()) {
        return EXIT_USAGE;
      }
    }
    options = config.options();
    if (strict) {
      options =
          options.toBuilder().normaliseDeprecatedIds(false).caseSensitiveOperators(true).build();
    }
    engine = new ExpressionEngine(config.registry(ListedIdRegistry.bundled()));
    engine.init();
    if (verbose) {
      err.printf(
          "Grammar: %s (%d license ids, %d exception ids)\nOptions: %s\n",
          engine.grammarSignature(),
          engine.registry().knownLicenseIds().size(),
          engine.registry().knownExceptionIds().size(),
          options);
    }

    if (inputFile.isEmpty()) { // each command-line argument is an expression
      if (targets.isEmpty()) {
        throw new UsageException("no expressions");
      }
      int argNumber = 0;
      for (String target : targets) {
        processRecord("argument " + (++argNumber), target);
      }
    } else { // inputFile lists expressions -- 1 per record. (use stdin if "-")
      if (!targets.isEmpty()) {
        throw new UsageException("expressions on the command line conflict with -f");
      }
      String name = inputFile.trim();
      try (ExpressionReader reader =
          name.equals("-")
              ? new ExpressionReader("-", in)
              : new ExpressionReader(name, new FileInputStream(name))) {
        char delim = nulDelim ? '\000' : '\n';
        StringBuilder sb = new StringBuilder();
        while (reader.readString(delim, sb) >= 0) {
          String record = sb.toString();
          sb.setLength(0);
          processRecord(reader.getName() + " record " + reader.getRecordNumber(), record);
        }
      }
    }
    entireSw.stop();
    if (verbose) {
      err.printf(
          "%d expressions, %d invalid in %dms\n",
          numRecords, numInvalid, entireSw.elapsed(TimeUnit.MILLISECONDS));
    }
    return numInvalid == 0 ? EXIT_VALID : EXIT_INVALID;
  }

  /** Validates and outputs one expression. Blank records are skipped. */
  private void processRecord(String source, String record) {
    ParseResult result = engine.parseWithInfo(record, options);
    if (result.isBlank()) {
      return;
    }
    numRecords++;
    if (result.isFailure()) {
      numInvalid++;
      ParseFailure failure = result.failure().get();
      err.printf("%s: %s\n", source, failure.getMessage());
      return;
    }
    if (checkOnly) {
      return;
    }
    LicenseExpression expression = result.expression().get();
    if (printIds) {
      out.println(Joiner.on(' ').join(engine.extractIds(expression, options)));
    } else {
      out.println(engine.unparse(expression).get());
    }
  }

  /** Thrown for malformed command lines. */
  private static class UsageException extends Exception {
    private static final long serialVersionUID = 1L;

    UsageException(String message) {
      super(message);
    }
  }
}
