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
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.Optional;

/**
 * Parses, validates and canonicalizes SPDX license expressions.
 *
 * <p>An engine embeds the ids of one {@link IdRegistry} snapshot in its grammar. The grammar is
 * built on first use, or by {@link #init()}, and shared by all later calls. Engines are immutable
 * and safe for concurrent use.
 *
 * <p>Malformed input never throws: the parse methods return an empty result instead, and {@link
 * #parseWithInfo} describes the problem.
 */
public final class ExpressionEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final IdRegistry registry;
  private final Supplier<ExpressionGrammar> grammar;
  private final Supplier<ExpressionParser> parser;
  private final Supplier<ExpressionParser> caseSensitiveParser;
  private final TreeTransformer transformer;
  private final DeprecatedIdNormalizer normalizer;

  public ExpressionEngine(IdRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry);
    this.grammar = Suppliers.memoize(() -> ExpressionGrammar.build(registry));
    this.parser = Suppliers.memoize(() -> new ExpressionParser(grammar.get(), false));
    this.caseSensitiveParser = Suppliers.memoize(() -> new ExpressionParser(grammar.get(), true));
    this.transformer = new TreeTransformer(registry);
    this.normalizer = new DeprecatedIdNormalizer(registry);
  }

  /** Returns an engine for the ids shipped with this library. */
  public static ExpressionEngine withBundledIds() {
    return new ExpressionEngine(ListedIdRegistry.bundled());
  }

  /** Builds the grammar now instead of on first use. */
  public void init() {
    parser.get();
    caseSensitiveParser.get();
  }

  /** The registry whose ids this engine accepts. */
  public IdRegistry registry() {
    return registry;
  }

  /** Fingerprint of the ids embedded in the grammar. */
  public String grammarSignature() {
    return grammar.get().signature();
  }

  /** Parses {@code input} with the default options. */
  public Optional<LicenseExpression> parse(String input) {
    return parse(input, ParseOptions.defaults());
  }

  /**
   * Parses {@code input} into a canonical expression tree.
   *
   * @return the tree, or empty when {@code input} is null, blank or not a valid expression
   */
  public Optional<LicenseExpression> parse(String input, ParseOptions options) {
    return parseWithInfo(input, options).expression();
  }

  /** Parses {@code input} with the default options describing any failure. */
  public ParseResult parseWithInfo(String input) {
    return parseWithInfo(input, ParseOptions.defaults());
  }

  /**
   * Parses {@code input} into a canonical expression tree, describing any failure.
   *
   * @return the tree; or a failure for any input that is not blank and not a valid expression; or
   *     neither when {@code input} is null or blank
   */
  public ParseResult parseWithInfo(String input, ParseOptions options) {
    Preconditions.checkNotNull(options);
    if (isBlank(input)) {
      return ParseResult.noInput();
    }
    SyntaxNode tree;
    try {
      tree = parser(options).parse(input);
    } catch (ExpressionParser.SyntaxException e) {
      logger.atFine().log(
          "invalid license expression \"%s\": %s at offset %d",
          input, e.failure.reason, e.failure.index);
      return ParseResult.failure(e.failure);
    }
    return ParseResult.success(canonicalize(transformer.transform(tree), options));
  }

  /** Returns true if {@code input} is a valid expression under the default options. */
  public boolean isValid(String input) {
    return isValid(input, ParseOptions.defaults());
  }

  /** Returns true if {@code input} is a valid expression. Blank input is not valid. */
  public boolean isValid(String input, ParseOptions options) {
    Preconditions.checkNotNull(options);
    if (isBlank(input)) {
      return false;
    }
    try {
      parser(options).parse(input);
      return true;
    } catch (ExpressionParser.SyntaxException e) {
      return false;
    }
  }

  /** Like {@link #isSimple(String, ParseOptions)} with the default options. */
  public Optional<Boolean> isSimple(String input) {
    return isSimple(input, ParseOptions.defaults());
  }

  /**
   * Returns whether {@code input} names a single license component, or empty when it is not a
   * valid expression.
   */
  public Optional<Boolean> isSimple(String input, ParseOptions options) {
    return parse(input, options).map(LicenseExpression::isComponent);
  }

  /** Like {@link #isCompound(String, ParseOptions)} with the default options. */
  public Optional<Boolean> isCompound(String input) {
    return isCompound(input, ParseOptions.defaults());
  }

  /**
   * Returns whether {@code input} combines licenses with AND or OR, or empty when it is not a
   * valid expression.
   */
  public Optional<Boolean> isCompound(String input, ParseOptions options) {
    return isSimple(input, options).map(simple -> !simple);
  }

  /** Returns the string form of {@code expression}, or empty when {@code expression} is null. */
  public Optional<String> unparse(LicenseExpression expression) {
    return Optional.ofNullable(ExpressionUnparser.unparse(expression));
  }

  /** Like {@link #normalise(String, ParseOptions)} with the default options. */
  public Optional<String> normalise(String input) {
    return normalise(input, ParseOptions.defaults());
  }

  /** Returns the canonical string form of {@code input}, or empty when it does not parse. */
  public Optional<String> normalise(String input, ParseOptions options) {
    return parse(input, options).flatMap(this::unparse);
  }

  /** Like {@link #extractIds(LicenseExpression, ParseOptions)} with the default options. */
  public ImmutableSet<String> extractIds(LicenseExpression expression) {
    return extractIds(expression, ParseOptions.defaults());
  }

  /**
   * Returns every license id, exception id, LicenseRef and AdditionRef in {@code expression}.
   * Empty when {@code expression} is null.
   */
  public ImmutableSet<String> extractIds(LicenseExpression expression, ParseOptions options) {
    Preconditions.checkNotNull(options);
    return new IdExtractor(options.includeOrLater).extract(expression);
  }

  /** Walks {@code expression} depth-first with {@code visitor}. Returns null for null. */
  public <T> T walk(LicenseExpression expression, ExpressionWalker.Visitor<T> visitor) {
    return ExpressionWalker.walk(expression, visitor);
  }

  private ExpressionParser parser(ParseOptions options) {
    return options.caseSensitiveOperators ? caseSensitiveParser.get() : parser.get();
  }

  private LicenseExpression canonicalize(LicenseExpression expression, ParseOptions options) {
    if (options.normaliseDeprecatedIds) {
      expression = normalizer.normalize(expression);
    }
    if (options.collapseRedundantClauses) {
      expression = RedundantClauseCollapser.INSTANCE.collapse(expression);
    }
    if (options.sortLicenses) {
      expression = CanonicalSorter.INSTANCE.sort(expression);
    }
    return expression;
  }

  private static boolean isBlank(String input) {
    if (input == null) {
      return true;
    }
    for (int i = 0; i < input.length(); i++) {
      if (!ExpressionParser.isWhitespace(input.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
