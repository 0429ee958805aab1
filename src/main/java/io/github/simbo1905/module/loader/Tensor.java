// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.List;

/// Opaque numeric value referenced from a snapshot. The numeric representation itself is owned by the caller
/// through a [TensorMaterializer]; this library only needs to know its metadata.
public interface Tensor {

  String dtype();

  List<Long> shape();

  Device device();
}
