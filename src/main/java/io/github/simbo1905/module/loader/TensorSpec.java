// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.List;
import java.util.Objects;

/// Metadata recorded alongside a raw storage record.
public record TensorSpec(String dtype, List<Long> shape, Device device) {
  public TensorSpec {
    Objects.requireNonNull(dtype, "dtype cannot be null");
    shape = List.copyOf(Objects.requireNonNull(shape, "shape cannot be null"));
    Objects.requireNonNull(device, "device cannot be null");
    for (long dimension : shape) {
      if (dimension < 0) {
        throw new IllegalArgumentException("Tensor dimensions must not be negative: " + shape);
      }
    }
  }

  public long numel() {
    return shape.stream().mapToLong(Long::longValue).reduce(1L, Math::multiplyExact);
  }

  public TensorSpec withDevice(Device override) {
    return new TensorSpec(dtype, shape, override);
  }
}
