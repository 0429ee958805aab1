// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// A non-optional attribute was left empty by a restoration method.
public class UninitializedAttributeException extends ModuleLoadException {
  private final String typeName;
  private final String attributeName;

  public UninitializedAttributeException(String typeName, String attributeName, ValueType declaredType) {
    super("The field '" + attributeName + "' of '" + typeName + "' was left uninitialized after restoration, " +
        "but expected a value of type '" + declaredType.toTreeString() + "'");
    this.typeName = typeName;
    this.attributeName = attributeName;
  }

  public String typeName() {
    return typeName;
  }

  public String attributeName() {
    return attributeName;
  }
}
