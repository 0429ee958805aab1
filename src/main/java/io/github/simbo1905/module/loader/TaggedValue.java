// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Closed set of values produced by decoding an instruction stream.
/// Sequences and mappings are mutable while the stream is being decoded and may be shared or cyclic,
/// so they use identity equality. Use [#deepEquals] to compare two decoded graphs structurally.
public sealed interface TaggedValue permits
    TaggedValue.NoneValue, TaggedValue.Bool, TaggedValue.Int, TaggedValue.Float, TaggedValue.Str,
    TaggedValue.Sequence, TaggedValue.Mapping, TaggedValue.TensorRef, TaggedValue.ObjectRef {

  NoneValue NONE = new NoneValue();

  /// Short name of the variant used in diagnostics
  String variantName();

  record NoneValue() implements TaggedValue {
    @Override
    public String variantName() {
      return "None";
    }
  }

  record Bool(boolean value) implements TaggedValue {
    @Override
    public String variantName() {
      return "Bool";
    }
  }

  record Int(long value) implements TaggedValue {
    @Override
    public String variantName() {
      return "Int";
    }
  }

  record Float(double value) implements TaggedValue {
    @Override
    public String variantName() {
      return "Float";
    }
  }

  record Str(String value) implements TaggedValue {
    public Str {
      Objects.requireNonNull(value, "String value cannot be null");
    }

    @Override
    public String variantName() {
      return "Str";
    }
  }

  record TensorRef(Tensor tensor) implements TaggedValue {
    public TensorRef {
      Objects.requireNonNull(tensor, "Tensor cannot be null");
    }

    @Override
    public String variantName() {
      return "Tensor";
    }
  }

  record ObjectRef(ObjectInstance instance) implements TaggedValue {
    public ObjectRef {
      Objects.requireNonNull(instance, "Instance cannot be null");
    }

    @Override
    public String variantName() {
      return "Object(" + instance.type().qualifiedName() + ")";
    }

    /// Two references are equal only when they point at the very same instance
    @Override
    public boolean equals(Object o) {
      return o instanceof ObjectRef other && other.instance == instance;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(instance);
    }
  }

  /// Ordered list or tuple. The element tag starts as [ValueType#ANY] and is narrowed by reconciliation.
  final class Sequence implements TaggedValue {
    private final List<TaggedValue> elements;
    private final boolean tuple;
    private ValueType elementType = ValueType.ANY;

    private Sequence(List<TaggedValue> elements, boolean tuple) {
      this.elements = elements;
      this.tuple = tuple;
    }

    public static Sequence list() {
      return new Sequence(new ArrayList<>(), false);
    }

    public static Sequence list(List<? extends TaggedValue> elements) {
      return new Sequence(new ArrayList<>(elements), false);
    }

    /// Tuples are fixed once built.
    public static Sequence tuple(List<? extends TaggedValue> elements) {
      return new Sequence(List.copyOf(elements), true);
    }

    public List<TaggedValue> elements() {
      return tuple ? elements : Collections.unmodifiableList(elements);
    }

    public int size() {
      return elements.size();
    }

    public TaggedValue get(int index) {
      return elements.get(index);
    }

    public boolean isTuple() {
      return tuple;
    }

    public ValueType elementType() {
      return elementType;
    }

    void elementType(ValueType elementType) {
      this.elementType = Objects.requireNonNull(elementType);
    }

    void append(TaggedValue value) {
      if (tuple) {
        throw new UnsupportedOperationException("Tuples cannot be appended to");
      }
      elements.add(Objects.requireNonNull(value));
    }

    @Override
    public String variantName() {
      return tuple ? "Tuple" : "List";
    }

    @Override
    public String toString() {
      return variantName() + "[size=" + elements.size() + ", elementType=" + elementType.toTreeString() + "]";
    }
  }

  /// Insertion ordered dict with unique keys. Key and value tags start as [ValueType#ANY].
  final class Mapping implements TaggedValue {
    private final Map<TaggedValue, TaggedValue> entries = new LinkedHashMap<>();
    private ValueType keyType = ValueType.ANY;
    private ValueType valueType = ValueType.ANY;

    public static Mapping empty() {
      return new Mapping();
    }

    public Map<TaggedValue, TaggedValue> entries() {
      return Collections.unmodifiableMap(entries);
    }

    public int size() {
      return entries.size();
    }

    public TaggedValue get(TaggedValue key) {
      return entries.get(key);
    }

    public TaggedValue get(String key) {
      return entries.get(new Str(key));
    }

    public boolean containsKey(String key) {
      return entries.containsKey(new Str(key));
    }

    public ValueType keyType() {
      return keyType;
    }

    public ValueType valueType() {
      return valueType;
    }

    void keyType(ValueType keyType) {
      this.keyType = Objects.requireNonNull(keyType);
    }

    void valueType(ValueType valueType) {
      this.valueType = Objects.requireNonNull(valueType);
    }

    void put(TaggedValue key, TaggedValue value) {
      entries.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
    }

    @Override
    public String variantName() {
      return "Dict";
    }

    @Override
    public String toString() {
      return "Dict[size=" + entries.size() + ", keyType=" + keyType.toTreeString() +
          ", valueType=" + valueType.toTreeString() + "]";
    }
  }

  /// Structural comparison of two decoded graphs. Sharing and cycles are followed by pairing
  /// containers and instances on first visit, so a cyclic graph compares equal to its copy.
  static boolean deepEquals(TaggedValue left, TaggedValue right) {
    return new DeepEquality().equal(left, right);
  }

  final class DeepEquality {
    private final Map<Object, Object> paired = new IdentityHashMap<>();

    private DeepEquality() {
    }

    private boolean equal(TaggedValue left, TaggedValue right) {
      if (left == right) {
        return true;
      }
      if (left instanceof Sequence l && right instanceof Sequence r) {
        if (alreadyPaired(l, r)) {
          return paired.get(l) == r;
        }
        if (l.isTuple() != r.isTuple() || l.size() != r.size()) {
          return false;
        }
        for (int i = 0; i < l.size(); i++) {
          if (!equal(l.get(i), r.get(i))) {
            return false;
          }
        }
        return true;
      }
      if (left instanceof Mapping l && right instanceof Mapping r) {
        if (alreadyPaired(l, r)) {
          return paired.get(l) == r;
        }
        if (l.size() != r.size()) {
          return false;
        }
        final var li = l.entries.entrySet().iterator();
        final var ri = r.entries.entrySet().iterator();
        while (li.hasNext()) {
          final var le = li.next();
          final var re = ri.next();
          if (!equal(le.getKey(), re.getKey()) || !equal(le.getValue(), re.getValue())) {
            return false;
          }
        }
        return true;
      }
      if (left instanceof ObjectRef l && right instanceof ObjectRef r) {
        final var li = l.instance();
        final var ri = r.instance();
        if (alreadyPaired(li, ri)) {
          return paired.get(li) == ri;
        }
        if (!li.type().qualifiedName().equals(ri.type().qualifiedName()) || li.slotCount() != ri.slotCount()) {
          return false;
        }
        for (int i = 0; i < li.slotCount(); i++) {
          if (!equal(li.getSlot(i), ri.getSlot(i))) {
            return false;
          }
        }
        return true;
      }
      return left.equals(right);
    }

    /// Records the pairing on first visit and reports whether it was seen before
    private boolean alreadyPaired(Object left, Object right) {
      if (paired.containsKey(left)) {
        return true;
      }
      paired.put(left, right);
      return false;
    }
  }

  /// Identity set used when walking graphs that may be cyclic
  static Set<Object> identitySet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}
