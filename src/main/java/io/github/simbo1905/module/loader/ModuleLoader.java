// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Main interface for the No Framework Module Loader.
/// Reconstructs a saved module snapshot, its object graph and the tensors it references, from a container.
///
/// ```java
/// final var loader = ModuleLoader.forContext(LoaderContext.of(myTypeLoader));
/// final var extraFiles = new HashMap<>(Map.of("metadata.json", "{}"));
/// final LoadedModule module = loader.load(Path.of("model.pt"), Optional.empty(), extraFiles);
/// ```
///
/// Every call performs an independent load with its own backreferences and type bindings.
/// All failures are unchecked subclasses of [ModuleLoadException] and abort the whole load.
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
@FunctionalInterface
public interface ModuleLoader {

  Logger LOGGER = Logger.getLogger(ModuleLoader.class.getName());

  /// Load from an already opened container
  /// @param archive the container
  /// @param deviceOverride device to place every tensor on, replacing the recorded one
  /// @param extraFiles keys of `extra/` records wanted by the caller mapped to defaults; found records replace
  ///                   the defaults in place, absent ones leave them untouched
  /// @return the root instance with its constants and type bindings
  LoadedModule load(ArchiveReader archive, Optional<Device> deviceOverride, Map<String, String> extraFiles);

  /// Load from a zip container on disk
  default LoadedModule load(Path path, Optional<Device> deviceOverride, Map<String, String> extraFiles) {
    return load(ZipArchiveReader.open(path), deviceOverride, extraFiles);
  }

  /// Load from a zip container read fully from the stream, which is left open
  default LoadedModule load(InputStream in, Optional<Device> deviceOverride, Map<String, String> extraFiles) {
    return load(ZipArchiveReader.open(in), deviceOverride, extraFiles);
  }

  /// Load from a zip container behind a random access adapter
  default LoadedModule load(ReadAdapter adapter, Optional<Device> deviceOverride, Map<String, String> extraFiles) {
    return load(ZipArchiveReader.open(adapter), deviceOverride, extraFiles);
  }

  /// Factory method for a loader bound to a set of collaborators
  /// @param context the type loader, tensor materializer and optional legacy importer
  /// @return a loader that starts a fresh deserializer for every call
  static ModuleLoader forContext(LoaderContext context) {
    Objects.requireNonNull(context, "context must not be null");
    return (archive, deviceOverride, extraFiles) -> {
      Objects.requireNonNull(archive, "archive must not be null");
      return new ModuleDeserializer(archive, context).deserialize(deviceOverride, extraFiles);
    };
  }
}
