// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.nio.ByteBuffer;

/// Turns a raw storage record plus its recorded metadata into a tensor value.
/// The device of the [TensorSpec] already has any caller supplied override applied.
@FunctionalInterface
public interface TensorMaterializer {

  Tensor materialize(ByteBuffer storage, TensorSpec spec);
}
