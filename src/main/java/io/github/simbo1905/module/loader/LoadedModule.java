// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.List;
import java.util.Objects;

/// Result of a load: the root instance, the constants table, and the types bound while decoding.
public record LoadedModule(ObjectInstance root, List<Tensor> constants, ClassResolver types) {
  public LoadedModule {
    Objects.requireNonNull(root, "root must not be null");
    constants = List.copyOf(Objects.requireNonNull(constants, "constants must not be null"));
    Objects.requireNonNull(types, "types must not be null");
  }

  public TaggedValue attribute(String name) {
    return root.getAttribute(name);
  }
}
