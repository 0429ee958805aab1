// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Optional;

/// Reads containers written in the legacy layout. Only called when the `model.json` marker record is present.
@FunctionalInterface
public interface LegacyImporter {

  @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
  LoadedModule importLegacy(ArchiveReader archive, Optional<Device> deviceOverride);
}
