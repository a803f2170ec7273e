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

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Resources;
import java.io.IOException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;

/**
 * {@link IdRegistry} backed by fixed lists of license and exception ids.
 *
 * <p>{@link #bundled()} returns the snapshot of the SPDX license list shipped with this library.
 * {@link #builder()} assembles custom or extended registries, e.g. for ids newer than the bundled
 * snapshot.
 */
public final class ListedIdRegistry implements IdRegistry {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String LICENSES_RESOURCE = "licenses.txt";
  static final String EXCEPTIONS_RESOURCE = "exceptions.txt";
  private static final String DEPRECATED = "deprecated";

  /** Characters allowed in a listed id. */
  public static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][-A-Za-z0-9.+]*");

  private static final Supplier<ListedIdRegistry> BUNDLED =
      Suppliers.memoize(ListedIdRegistry::loadBundled);

  private final ImmutableMap<String, Boolean> licenses; // id -> deprecated
  private final ImmutableMap<String, Boolean> exceptions; // id -> deprecated
  private final ImmutableMap<String, String> lowerCase; // lowercase id -> canonical id

  private ListedIdRegistry(Map<String, Boolean> licenses, Map<String, Boolean> exceptions) {
    this.licenses = ImmutableMap.copyOf(licenses);
    this.exceptions = ImmutableMap.copyOf(exceptions);
    Map<String, String> lower = new LinkedHashMap<>();
    // License spellings win over exceptions differing only in case.
    for (String id : this.exceptions.keySet()) {
      lower.put(id.toLowerCase(Locale.ROOT), id);
    }
    for (String id : this.licenses.keySet()) {
      lower.put(id.toLowerCase(Locale.ROOT), id);
    }
    this.lowerCase = ImmutableMap.copyOf(lower);
  }

  /** Returns the registry of ids shipped with this library. */
  public static ListedIdRegistry bundled() {
    return BUNDLED.get();
  }

  /** Returns a Builder object for the ListedIdRegistry class. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public ImmutableSet<String> knownLicenseIds() {
    return licenses.keySet();
  }

  @Override
  public ImmutableSet<String> knownExceptionIds() {
    return exceptions.keySet();
  }

  @Override
  public boolean isKnownLicenseId(String id) {
    return id != null && licenses.containsKey(id);
  }

  @Override
  public boolean isKnownExceptionId(String id) {
    return id != null && exceptions.containsKey(id);
  }

  @Override
  public Optional<String> canonicalCase(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(lowerCase.get(id.toLowerCase(Locale.ROOT)));
  }

  @Override
  public Optional<Boolean> isDeprecated(String id) {
    if (id == null) {
      return Optional.empty();
    }
    Boolean deprecated = licenses.get(id);
    if (deprecated == null) {
      deprecated = exceptions.get(id);
    }
    return Optional.ofNullable(deprecated);
  }

  private static ListedIdRegistry loadBundled() {
    Builder builder = builder();
    readResource(LICENSES_RESOURCE, builder::addLicense);
    readResource(EXCEPTIONS_RESOURCE, builder::addException);
    ListedIdRegistry registry = builder.build();
    logger.atFine().log(
        "loaded %d license ids and %d exception ids",
        registry.licenses.size(), registry.exceptions.size());
    return registry;
  }

  /** Reads the id list in resource {@code name} passing each id and deprecation to {@code dest}. */
  private static void readResource(String name, BiConsumer<String, Boolean> dest) {
    List<String> lines;
    try {
      URL url = Resources.getResource(ListedIdRegistry.class, name);
      lines = Resources.readLines(url, UTF_8);
    } catch (IllegalArgumentException | IOException e) {
      throw new IllegalStateException("cannot read bundled id list " + name, e);
    }
    int lineNumber = 0;
    for (String line : lines) {
      lineNumber++;
      int comment = line.indexOf('#');
      if (comment >= 0) {
        line = line.substring(0, comment);
      }
      line = line.trim();
      if (line.isEmpty()) {
        continue;
      }
      String[] fields = line.split("\\s+");
      boolean deprecated = fields.length == 2 && DEPRECATED.equals(fields[1]);
      if ((fields.length != 1 && !deprecated) || !ID_PATTERN.matcher(fields[0]).matches()) {
        logger.atWarning().log("skipping malformed line %d of %s: %s", lineNumber, name, line);
        continue;
      }
      dest.accept(fields[0], deprecated);
    }
  }

  /** Implements the Builder pattern for ListedIdRegistry. */
  public static class Builder {
    private final LinkedHashMap<String, Boolean> licenses = new LinkedHashMap<>();
    private final LinkedHashMap<String, Boolean> exceptions = new LinkedHashMap<>();

    private Builder() {}

    /** Create a ListedIdRegistry reflecting the current state of this Builder. */
    public ListedIdRegistry build() {
      return new ListedIdRegistry(licenses, exceptions);
    }

    /** Add the current license id {@code id}. */
    public Builder addLicense(String id) {
      return addLicense(id, false);
    }

    /** Add the license id {@code id} marking whether it is {@code deprecated}. */
    public Builder addLicense(String id, boolean deprecated) {
      licenses.put(checkId(id), deprecated);
      return this;
    }

    /** Add the current exception id {@code id}. */
    public Builder addException(String id) {
      return addException(id, false);
    }

    /** Add the exception id {@code id} marking whether it is {@code deprecated}. */
    public Builder addException(String id, boolean deprecated) {
      exceptions.put(checkId(id), deprecated);
      return this;
    }

    /** Add every license and exception id known to {@code registry}. */
    public Builder addAll(IdRegistry registry) {
      Preconditions.checkNotNull(registry);
      for (String id : registry.knownLicenseIds()) {
        addLicense(id, registry.isDeprecated(id).orElse(false));
      }
      for (String id : registry.knownExceptionIds()) {
        addException(id, registry.isDeprecated(id).orElse(false));
      }
      return this;
    }

    private static String checkId(String id) {
      Preconditions.checkNotNull(id);
      Preconditions.checkArgument(
          ID_PATTERN.matcher(id).matches(), "malformed license or exception id: %s", id);
      return id;
    }
  }
}
