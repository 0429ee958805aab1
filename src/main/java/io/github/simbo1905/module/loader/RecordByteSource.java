// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.nio.ByteBuffer;
import java.util.Objects;

/// Pull based reader over one whole record, consumed incrementally by the [Unpickler].
final class RecordByteSource {
  private final ByteBuffer record;

  RecordByteSource(ByteBuffer record) {
    this.record = Objects.requireNonNull(record, "record must not be null").slice();
  }

  /// Copies up to `length` bytes into `buffer`.
  /// @return the number of bytes copied, zero once the record is exhausted
  int read(byte[] buffer, int offset, int length) {
    final int count = Math.min(length, record.remaining());
    record.get(buffer, offset, count);
    return count;
  }

  /// @return the next byte as 0..255, or -1 once the record is exhausted
  int read() {
    return record.hasRemaining() ? record.get() & 0xFF : -1;
  }

  long position() {
    return record.position();
  }

  long size() {
    return record.limit();
  }
}
