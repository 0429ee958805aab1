// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// Second half of object construction, invoked by the [Unpickler]. Allocation and restoration are separate
/// so an instance can be registered as a backreference before its state, which may point back at it, is applied.
public interface InstanceBuilder {

  /// @return a new instance of the type with every slot empty
  ObjectInstance allocate(TypeDescriptor type);

  /// Applies recorded state to an allocated instance.
  void restore(ObjectInstance instance, TaggedValue state);

  default ObjectInstance construct(TypeDescriptor type, TaggedValue state) {
    final var instance = allocate(type);
    restore(instance, state);
    return instance;
  }
}
