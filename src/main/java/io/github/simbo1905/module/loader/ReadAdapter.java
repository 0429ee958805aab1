// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/// Generic random access byte source a container can be opened from.
public interface ReadAdapter {

  long size() throws IOException;

  /// Reads up to `length` bytes starting at `position`.
  /// @return the number of bytes copied, zero only at or beyond the end
  int read(long position, byte[] buffer, int offset, int length) throws IOException;

  static ReadAdapter ofBytes(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    return new ReadAdapter() {
      @Override
      public long size() {
        return bytes.length;
      }

      @Override
      public int read(long position, byte[] buffer, int offset, int length) {
        if (position >= bytes.length) {
          return 0;
        }
        final int count = (int) Math.min(length, bytes.length - position);
        System.arraycopy(bytes, (int) position, buffer, offset, count);
        return count;
      }
    };
  }

  /// Sequential view from position zero, used to stream the container through the zip decoder
  default InputStream asInputStream() {
    final ReadAdapter adapter = this;
    return new InputStream() {
      private long position;

      @Override
      public int read() throws IOException {
        final byte[] one = new byte[1];
        return read(one, 0, 1) == 1 ? one[0] & 0xFF : -1;
      }

      @Override
      public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
          return 0;
        }
        final int count = adapter.read(position, b, off, len);
        if (count <= 0) {
          return -1;
        }
        position += count;
        return count;
      }
    };
  }
}
