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

package com.googlesource.spdx.expressions;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.googlesource.spdx.expressions.lib.IdRegistry;
import com.googlesource.spdx.expressions.lib.ListedIdRegistry;
import com.googlesource.spdx.expressions.lib.ParseOptions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;

/**
 * Expression engine settings read from a git-config style file.
 *
 * <pre>
 * [expressions]
 *   normaliseDeprecatedIds = true
 *   caseSensitiveOperators = false
 *   collapseRedundantClauses = true
 *   sortLicenses = true
 *   includeOrLater = false
 *   licenseId = Custom-License-1.0
 *   exceptionId = Custom-exception-1.0
 * </pre>
 *
 * <p>{@code licenseId} and {@code exceptionId} may repeat. They add ids to the registry, e.g. ids
 * newer than the bundled snapshot. Problems with individual values are collected in {@link
 * #messages} instead of failing the whole file.
 */
public class ExpressionConfig {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String SECTION = "expressions";

  static final String KEY_NORMALISE_DEPRECATED_IDS = "normaliseDeprecatedIds";
  static final String KEY_CASE_SENSITIVE_OPERATORS = "caseSensitiveOperators";
  static final String KEY_COLLAPSE_REDUNDANT_CLAUSES = "collapseRedundantClauses";
  static final String KEY_SORT_LICENSES = "sortLicenses";
  static final String KEY_INCLUDE_OR_LATER = "includeOrLater";
  static final String KEY_LICENSE_ID = "licenseId";
  static final String KEY_EXCEPTION_ID = "exceptionId";

  private static final ImmutableSet<String> KNOWN_KEYS =
      ImmutableSet.of(
          KEY_NORMALISE_DEPRECATED_IDS.toLowerCase(Locale.ROOT),
          KEY_CASE_SENSITIVE_OPERATORS.toLowerCase(Locale.ROOT),
          KEY_COLLAPSE_REDUNDANT_CLAUSES.toLowerCase(Locale.ROOT),
          KEY_SORT_LICENSES.toLowerCase(Locale.ROOT),
          KEY_INCLUDE_OR_LATER.toLowerCase(Locale.ROOT),
          KEY_LICENSE_ID.toLowerCase(Locale.ROOT),
          KEY_EXCEPTION_ID.toLowerCase(Locale.ROOT));

  /** Problems found reading the configuration. */
  public final ArrayList<ConfigMessage> messages;
  /** License ids added to the registry. */
  final LinkedHashSet<String> licenseIds;
  /** Exception ids added to the registry. */
  final LinkedHashSet<String> exceptionIds;

  private ParseOptions options;

  ExpressionConfig() {
    this.messages = new ArrayList<>();
    this.licenseIds = new LinkedHashSet<>();
    this.exceptionIds = new LinkedHashSet<>();
    this.options = ParseOptions.defaults();
  }

  /** Returns the configuration used when no file is given. */
  public static ExpressionConfig defaults() {
    return new ExpressionConfig();
  }

  /**
   * Parses {@code text} in git-config syntax.
   *
   * @throws ConfigInvalidException when {@code text} is not valid git-config syntax
   */
  public static ExpressionConfig fromText(String text) throws ConfigInvalidException {
    Preconditions.checkNotNull(text);
    Config cfg = new Config();
    cfg.fromText(text);
    ExpressionConfig config = new ExpressionConfig();
    config.readConfig(cfg);
    return config;
  }

  /** The parse options selected by the configuration. */
  public ParseOptions options() {
    return options;
  }

  /**
   * Returns {@code base} extended with the configured ids, or {@code base} itself when the
   * configuration adds none.
   */
  public IdRegistry registry(IdRegistry base) {
    Preconditions.checkNotNull(base);
    if (licenseIds.isEmpty() && exceptionIds.isEmpty()) {
      return base;
    }
    ListedIdRegistry.Builder builder = ListedIdRegistry.builder().addAll(base);
    for (String id : licenseIds) {
      builder.addLicense(id);
    }
    for (String id : exceptionIds) {
      builder.addException(id);
    }
    return builder.build();
  }

  /** Returns true if the configuration triggers any error messages. */
  public boolean hasErrors() {
    return messages.stream().anyMatch(m -> m.type == ConfigMessage.Type.ERROR);
  }

  /** Formats and appends config validation messages to {@code sb}. */
  public void appendMessages(StringBuilder sb) {
    for (ConfigMessage msg : messages) {
      sb.append("\n\n");
      sb.append(msg.type);
      sb.append(" ");
      sb.append(msg.message);
    }
  }

  /** Adjusts the configuration state per {@code cfg}. */
  void readConfig(Config cfg) {
    for (String section : cfg.getSections()) {
      if (!SECTION.equalsIgnoreCase(section)) {
        messages.add(ConfigMessage.warning("ignoring unknown section [" + section + "]"));
      }
    }
    for (String name : cfg.getNames(SECTION)) {
      if (!KNOWN_KEYS.contains(name.toLowerCase(Locale.ROOT))) {
        String value = Strings.nullToEmpty(cfg.getString(SECTION, null, name));
        messages.add(
            ConfigMessage.warning(keyValueMessage(name, value, "unknown key ignored")));
      }
    }
    ParseOptions defaults = ParseOptions.defaults();
    options =
        ParseOptions.builder()
            .normaliseDeprecatedIds(
                readBoolean(cfg, KEY_NORMALISE_DEPRECATED_IDS, defaults.normaliseDeprecatedIds))
            .caseSensitiveOperators(
                readBoolean(cfg, KEY_CASE_SENSITIVE_OPERATORS, defaults.caseSensitiveOperators))
            .collapseRedundantClauses(
                readBoolean(
                    cfg, KEY_COLLAPSE_REDUNDANT_CLAUSES, defaults.collapseRedundantClauses))
            .sortLicenses(readBoolean(cfg, KEY_SORT_LICENSES, defaults.sortLicenses))
            .includeOrLater(readBoolean(cfg, KEY_INCLUDE_OR_LATER, defaults.includeOrLater))
            .build();
    addIdList(cfg, licenseIds, KEY_LICENSE_ID, "license id");
    addIdList(cfg, exceptionIds, KEY_EXCEPTION_ID, "exception id");
    if (!messages.isEmpty()) {
      logger.atWarning().log("%d problems in expression configuration", messages.size());
    }
  }

  /** Formats {@code message} into a message about the {@code key = value} line of the config. */
  static String keyValueMessage(String key, String value, String message) {
    StringBuilder sb = new StringBuilder();
    sb.append("in\n[").append(SECTION).append("]\n");
    sb.append("  ");
    sb.append(key);
    sb.append(" = ");
    sb.append(value.trim());
    sb.append("\n");
    sb.append(Strings.repeat(" ", key.length() + 5));
    sb.append("^\n"); // ^ aligned under start of value in message
    sb.append(message);
    return sb.toString();
  }

  private boolean readBoolean(Config cfg, String key, boolean defaultValue) {
    try {
      return cfg.getBoolean(SECTION, key, defaultValue);
    } catch (IllegalArgumentException e) {
      String value = Strings.nullToEmpty(cfg.getString(SECTION, null, key));
      messages.add(
          ConfigMessage.error(keyValueMessage(key, value, "expected true or false")));
      return defaultValue;
    }
  }

  /** Looks up {@code key} in {@code cfg} adding values to {@code dest} as ids. */
  private void addIdList(Config cfg, Collection<String> dest, String key, String shortDesc) {
    for (String id : cfg.getStringList(SECTION, null, key)) {
      id = Strings.nullToEmpty(id).trim();
      if (id.isEmpty()) {
        messages.add(ConfigMessage.error(keyValueMessage(key, id, "missing " + shortDesc)));
        continue;
      }
      if (!ListedIdRegistry.ID_PATTERN.matcher(id).matches()) {
        messages.add(
            ConfigMessage.error(keyValueMessage(key, id, "malformed " + shortDesc + " " + id)));
        continue;
      }
      if (id.endsWith("+")) {
        messages.add(
            ConfigMessage.warning(
                keyValueMessage(
                    key, id, shortDesc + " ending in '+' cannot appear in an expression")));
      }
      dest.add(id);
    }
  }

  /** Describes a problem with one configuration value. */
  public static final class ConfigMessage {
    /** Severity of a configuration problem. */
    public enum Type {
      ERROR,
      WARNING
    }

    public final Type type;
    public final String message;

    private ConfigMessage(Type type, String message) {
      this.type = type;
      this.message = message;
    }

    static ConfigMessage error(String message) {
      return new ConfigMessage(Type.ERROR, message);
    }

    static ConfigMessage warning(String message) {
      return new ConfigMessage(Type.WARNING, message);
    }

    @Override
    public boolean equals(Object other) {
      if (this == other) {
        return true;
      }
      if (other instanceof ConfigMessage) {
        ConfigMessage otherMessage = (ConfigMessage) other;
        return type == otherMessage.type && message.equals(otherMessage.message);
      }
      return false;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, message);
    }

    @Override
    public String toString() {
      return type + " " + message;
    }
  }

  /** Returns the license ids added by the configuration. */
  public ImmutableList<String> licenseIds() {
    return ImmutableList.copyOf(licenseIds);
  }

  /** Returns the exception ids added by the configuration. */
  public ImmutableList<String> exceptionIds() {
    return ImmutableList.copyOf(exceptionIds);
  }
}
