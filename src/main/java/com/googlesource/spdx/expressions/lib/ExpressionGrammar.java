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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.hash.Hashing;
import java.util.Comparator;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Terminal patterns of the license expression grammar for one snapshot of listed ids.
 *
 * <p>License and exception ids are embedded as quoted, case-insensitive alternatives so the
 * grammar accepts only listed identifiers. Listed ids ending in {@code +} are left out: they would
 * be ambiguous with the or-later suffix, and the normalizer rewrites their spellings anyway.
 *
 * <p>Immutable and safe to share across threads once built.
 */
public final class ExpressionGrammar {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Regular expression for the user-defined part of a DocumentRef, LicenseRef or AdditionRef. */
  static final String ID_STRING = "[A-Za-z0-9.\\-]+";

  /** Matches {@code [DocumentRef-x:]LicenseRef-y} capturing x and y. Case-sensitive prefixes. */
  static final Pattern LICENSE_REF =
      Pattern.compile(
          "(?:" + LicenseComponent.DOCUMENT_REF + "(" + ID_STRING + "):)?"
              + LicenseComponent.LICENSE_REF + "(" + ID_STRING + ")");

  /** Matches {@code [DocumentRef-x:]AdditionRef-y} capturing x and y. */
  static final Pattern ADDITION_REF =
      Pattern.compile(
          "(?:" + LicenseComponent.DOCUMENT_REF + "(" + ID_STRING + "):)?"
              + LicenseException.ADDITION_REF + "(" + ID_STRING + ")");

  /** Matches a listed license id capturing the id and the optional or-later suffix. */
  final Pattern licenseId;
  /** Matches a listed exception id. */
  final Pattern exceptionId;
  /** License ids embedded in {@link #licenseId}. */
  final ImmutableList<String> licenseIds;
  /** Exception ids embedded in {@link #exceptionId}. */
  final ImmutableList<String> exceptionIds;

  private final String signature;

  private ExpressionGrammar(ImmutableList<String> licenseIds, ImmutableList<String> exceptionIds) {
    this.licenseIds = licenseIds;
    this.exceptionIds = exceptionIds;
    this.licenseId =
        Pattern.compile("(" + alternatives(licenseIds) + ")([+])?", Pattern.CASE_INSENSITIVE);
    this.exceptionId = Pattern.compile(alternatives(exceptionIds), Pattern.CASE_INSENSITIVE);
    this.signature = computeSignature(licenseIds, exceptionIds);
  }

  /** Builds the grammar terminals for the ids currently known to {@code registry}. */
  public static ExpressionGrammar build(IdRegistry registry) {
    Preconditions.checkNotNull(registry);
    Stopwatch sw = Stopwatch.createStarted();
    ExpressionGrammar grammar =
        new ExpressionGrammar(
            grammarIds(registry.knownLicenseIds()), grammarIds(registry.knownExceptionIds()));
    logger.atFine().log(
        "built grammar %s from %d license ids and %d exception ids in %dms",
        grammar.signature,
        grammar.licenseIds.size(),
        grammar.exceptionIds.size(),
        sw.elapsed(TimeUnit.MILLISECONDS));
    return grammar;
  }

  /** Fingerprint of the embedded ids. Equal for grammars built from equal id sets. */
  public String signature() {
    return signature;
  }

  /** Returns true if {@code word} is a listed license id in any case, with or without a +. */
  boolean isLicenseId(String word) {
    return licenseId.matcher(word).matches();
  }

  /** Returns true if {@code word} is a listed exception id in any case. */
  boolean isExceptionId(String word) {
    return exceptionId.matcher(word).matches();
  }

  /** Usable ids, longest first, so no alternative is shadowed by a shorter prefix. */
  private static ImmutableList<String> grammarIds(Iterable<String> ids) {
    return ImmutableList.sortedCopyOf(
        Comparator.comparing(String::length).reversed().thenComparing(Comparator.naturalOrder()),
        filterOrLater(ids));
  }

  private static ImmutableList<String> filterOrLater(Iterable<String> ids) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String id : ids) {
      if (!id.endsWith("+")) {
        builder.add(id);
      }
    }
    return builder.build();
  }

  private static String alternatives(ImmutableList<String> ids) {
    if (ids.isEmpty()) {
      return "(?!)"; // matches nothing
    }
    StringBuilder sb = new StringBuilder();
    sb.append("(?:");
    for (String id : ids) {
      if (sb.length() > 3) {
        sb.append('|');
      }
      sb.append(Pattern.quote(id));
    }
    sb.append(')');
    return sb.toString();
  }

  private static String computeSignature(
      ImmutableList<String> licenseIds, ImmutableList<String> exceptionIds) {
    StringBuilder sb = new StringBuilder();
    sb.append("licenses:\n");
    sb.append(Joiner.on("\n").join(licenseIds));
    sb.append("\nexceptions:\n");
    sb.append(Joiner.on("\n").join(exceptionIds));
    return Hashing.farmHashFingerprint64().hashBytes(sb.toString().getBytes(UTF_8)).toString();
  }
}
