// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// A recorded state value is structurally incompatible with the declared parameter type of a restoration method.
public class TypeReconciliationException extends ModuleLoadException {
  private final String typeName;
  private final String path;

  public TypeReconciliationException(String typeName, String path, ValueType expected, String actual) {
    super("State of '" + typeName + "' at " + path + " expected " + expected.toTreeString() + " but was " + actual);
    this.typeName = typeName;
    this.path = path;
  }

  public String typeName() {
    return typeName;
  }

  /// @return where inside the state value the mismatch was found, e.g. `state[1]`
  public String path() {
    return path;
  }
}
