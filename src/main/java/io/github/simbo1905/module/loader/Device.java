// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Objects;

/// Where a tensor lives, e.g. `cpu` or `cuda:1`. An index of `-1` means the default device of that type.
public record Device(String type, int index) {
  public static final Device CPU = new Device("cpu", -1);

  public Device {
    Objects.requireNonNull(type, "Device type cannot be null");
    if (type.isBlank() || type.indexOf(':') >= 0) {
      throw new IllegalArgumentException("Invalid device type: '" + type + "'");
    }
    if (index < -1) {
      throw new IllegalArgumentException("Device index must be -1 or greater, got: " + index);
    }
  }

  public static Device parse(String text) {
    Objects.requireNonNull(text, "Device string cannot be null");
    final int colon = text.indexOf(':');
    if (colon < 0) {
      return new Device(text, -1);
    }
    try {
      return new Device(text.substring(0, colon), Integer.parseInt(text.substring(colon + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid device index in: '" + text + "'", e);
    }
  }

  @Override
  public String toString() {
    return index == -1 ? type : type + ":" + index;
  }
}
