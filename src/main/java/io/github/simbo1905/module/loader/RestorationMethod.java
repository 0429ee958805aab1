// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Objects;
import java.util.function.BiConsumer;

/// User defined logic that fills the slots of a freshly allocated instance from its recorded state.
/// It may set slots in any order; afterwards every non-optional slot must be populated.
public interface RestorationMethod {

  /// Declared type of the state argument. Incoming containers are narrowed to it before [#restore] runs.
  ValueType stateType();

  void restore(ObjectInstance self, TaggedValue state);

  static RestorationMethod of(ValueType stateType, BiConsumer<ObjectInstance, TaggedValue> body) {
    Objects.requireNonNull(stateType, "stateType must not be null");
    Objects.requireNonNull(body, "body must not be null");
    return new RestorationMethod() {
      @Override
      public ValueType stateType() {
        return stateType;
      }

      @Override
      public void restore(ObjectInstance self, TaggedValue state) {
        body.accept(self, state);
      }
    };
  }
}
