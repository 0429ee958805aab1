// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Objects;
import java.util.Optional;

/// The collaborators a load needs besides the container itself.
/// @param typeLoader builds descriptors for user types met in the stream
/// @param tensorMaterializer turns storage records into tensors
/// @param legacyImporter reads the legacy layout, if this build supports it
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public record LoaderContext(TypeLoader typeLoader,
                            TensorMaterializer tensorMaterializer,
                            Optional<LegacyImporter> legacyImporter) {
  public LoaderContext {
    Objects.requireNonNull(typeLoader, "typeLoader must not be null");
    Objects.requireNonNull(tensorMaterializer, "tensorMaterializer must not be null");
    Objects.requireNonNull(legacyImporter, "legacyImporter must not be null");
  }

  /// Context keeping raw tensor bytes as [ByteTensor] and with no legacy importer
  public static LoaderContext of(TypeLoader typeLoader) {
    return new LoaderContext(typeLoader, ByteTensor::of, Optional.empty());
  }

  public LoaderContext withTensorMaterializer(TensorMaterializer materializer) {
    return new LoaderContext(typeLoader, materializer, legacyImporter);
  }

  public LoaderContext withLegacyImporter(LegacyImporter importer) {
    return new LoaderContext(typeLoader, tensorMaterializer, Optional.of(importer));
  }
}
