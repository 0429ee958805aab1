// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// A state mapping handed to the default field-assignment path lacks a declared attribute.
public class MissingAttributeException extends ModuleLoadException {
  private final String typeName;
  private final String attributeName;

  public MissingAttributeException(String typeName, String attributeName) {
    super("State of '" + typeName + "' has no entry for attribute '" + attributeName + "'");
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
