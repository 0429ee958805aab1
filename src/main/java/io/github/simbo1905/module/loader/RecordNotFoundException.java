// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// A named record was requested from the container but the container does not hold it.
public class RecordNotFoundException extends ModuleLoadException {
  private final String recordName;

  public RecordNotFoundException(String recordName) {
    super("Record not found in container: " + recordName);
    this.recordName = recordName;
  }

  public String recordName() {
    return recordName;
  }
}
