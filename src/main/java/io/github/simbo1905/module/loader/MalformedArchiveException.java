// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// The instruction stream of an archive could not be decoded, or its root value had the wrong shape.
public class MalformedArchiveException extends ModuleLoadException {
  /// Marker for failures that are not tied to a position in the stream.
  public static final long NO_OFFSET = -1L;

  private final String archiveName;
  private final long offset;

  public MalformedArchiveException(String archiveName, long offset, String message) {
    super(describe(archiveName, offset, message));
    this.archiveName = archiveName;
    this.offset = offset;
  }

  public MalformedArchiveException(String archiveName, String message) {
    this(archiveName, NO_OFFSET, message);
  }

  public String archiveName() {
    return archiveName;
  }

  /// @return the byte offset of the failing instruction, or [#NO_OFFSET]
  public long offset() {
    return offset;
  }

  private static String describe(String archiveName, long offset, String message) {
    final var where = offset == NO_OFFSET ? archiveName : archiveName + " @" + offset;
    return "Malformed archive '" + where + "': " + message;
  }
}
