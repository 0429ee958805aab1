// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Checks that a restoration method left no non-optional attribute empty.
final class PostRestoreValidator {

  private PostRestoreValidator() {
  }

  static void validate(ObjectInstance instance) {
    final var type = instance.type();
    final var attributes = type.attributes();
    for (int i = 0; i < attributes.size(); i++) {
      final var attribute = attributes.get(i);
      if (!attribute.isOptional() && instance.isSlotEmpty(i)) {
        throw new UninitializedAttributeException(type.qualifiedName(), attribute.name(), attribute.type());
      }
    }
    LOGGER.finer(() -> "Validated " + instance);
  }
}
