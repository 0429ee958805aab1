// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// The type loader could not produce a descriptor for a qualified type name.
public class UnresolvedTypeException extends ModuleLoadException {
  private final String typeName;

  public UnresolvedTypeException(String typeName, String reason) {
    super("Unable to resolve type '" + typeName + "': " + reason);
    this.typeName = typeName;
  }

  public UnresolvedTypeException(String typeName, Throwable cause) {
    super("Unable to resolve type '" + typeName + "': " + cause.getMessage(), cause);
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }
}
