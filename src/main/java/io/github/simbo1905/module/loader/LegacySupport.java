// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Arrays;

/// Whether containers in the legacy layout (marked by a `model.json` record) may be read.
/// Set via system property `no.framework.ModuleLoader.Legacy`. The default is ENABLED.
///
/// **ENABLED** the load is handed to the [LegacyImporter] of the [LoaderContext]; a context without one still
/// fails with [UnsupportedFormatException].
///
/// **DISABLED** a restricted build: legacy containers always fail with [UnsupportedFormatException] before any
/// archive is decoded.
enum LegacySupport {
  ENABLED,
  DISABLED;

  static final String PROPERTY = "no.framework.ModuleLoader.Legacy";

  static LegacySupport current() {
    final String mode = System.getProperty(PROPERTY, "ENABLED").toUpperCase();
    try {
      return LegacySupport.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid legacy support mode: " + mode + ". Must be one of: " + Arrays.toString(LegacySupport.values()));
    }
  }
}
