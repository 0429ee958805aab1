// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Memo of values that the stream may refer to again, keyed by dense ids assigned in read order.
/// A value is registered as soon as it is addressable, which for an instance is before its state is restored.
final class BackreferenceTable {
  private final List<TaggedValue> values = new ArrayList<>();

  /// @return the id the next registered value must carry
  int nextId() {
    return values.size();
  }

  int register(TaggedValue value) {
    values.add(Objects.requireNonNull(value, "value must not be null"));
    return values.size() - 1;
  }

  boolean isDefined(long id) {
    return id >= 0 && id < values.size();
  }

  TaggedValue get(int id) {
    if (!isDefined(id)) {
      throw new IllegalArgumentException("Backreference " + id + " is not defined, " + values.size() + " are known");
    }
    return values.get(id);
  }

  int size() {
    return values.size();
  }
}
