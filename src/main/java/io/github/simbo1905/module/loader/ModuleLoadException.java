// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// Root of the unchecked failures raised while loading a module snapshot.
/// Every subclass is fatal to the enclosing load: nothing is retried and no partial result is returned.
public class ModuleLoadException extends RuntimeException {

  public ModuleLoadException(String message) {
    super(message);
  }

  public ModuleLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
