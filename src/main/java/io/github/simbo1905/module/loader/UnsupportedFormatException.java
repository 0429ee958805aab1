// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// The container uses a format this loader will not read: the legacy layout where it is disabled,
/// or a format version outside the supported range.
public class UnsupportedFormatException extends ModuleLoadException {

  public UnsupportedFormatException(String message) {
    super(message);
  }
}
