// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.nio.ByteBuffer;
import java.util.Set;

/// Read-only view of a container as a set of named, immutable byte records.
public interface ArchiveReader {

  /// Returns the whole record as a read-only buffer positioned at zero; its size is `remaining()`.
  /// @throws RecordNotFoundException if the container has no record with this name
  ByteBuffer getRecord(String name);

  boolean hasRecord(String name);

  Set<String> recordNames();
}
