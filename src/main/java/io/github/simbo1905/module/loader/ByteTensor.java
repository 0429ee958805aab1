// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/// Default tensor: keeps the raw little endian storage bytes untouched.
public record ByteTensor(String dtype, List<Long> shape, Device device, ByteBuffer data) implements Tensor {
  public ByteTensor {
    Objects.requireNonNull(dtype, "dtype cannot be null");
    shape = List.copyOf(shape);
    Objects.requireNonNull(device, "device cannot be null");
    data = data.asReadOnlyBuffer();
  }

  public static ByteTensor of(ByteBuffer storage, TensorSpec spec) {
    return new ByteTensor(spec.dtype(), spec.shape(), spec.device(), storage.slice());
  }
}
