// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Arrays;
import java.util.Objects;

/// A live instance of a user type: one slot per declared attribute, each starting out empty (None).
public final class ObjectInstance {
  private final TypeDescriptor type;
  private final TaggedValue[] slots;

  ObjectInstance(TypeDescriptor type) {
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.slots = new TaggedValue[type.attributes().size()];
    Arrays.fill(slots, TaggedValue.NONE);
  }

  public TypeDescriptor type() {
    return type;
  }

  public int slotCount() {
    return slots.length;
  }

  public TaggedValue getSlot(int index) {
    return slots[index];
  }

  public void setSlot(int index, TaggedValue value) {
    slots[index] = Objects.requireNonNull(value, "use TaggedValue.NONE to clear a slot");
  }

  public boolean isSlotEmpty(int index) {
    return slots[index] instanceof TaggedValue.NoneValue;
  }

  public TaggedValue getAttribute(String name) {
    return slots[type.attributeIndex(name)];
  }

  public void setAttribute(String name, TaggedValue value) {
    setSlot(type.attributeIndex(name), value);
  }

  @Override
  public String toString() {
    // slots are not printed as the graph may be cyclic
    return "ObjectInstance[" + type.qualifiedName() + "@" + Integer.toHexString(System.identityHashCode(this)) + "]";
  }
}
