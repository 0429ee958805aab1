// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Narrows the element tags of containers decoded without static type context to a declared type.
/// Tags only ever move from [ValueType#ANY] to something more precise. A value whose shape cannot
/// match the declared type fails the load. A container reached along several paths is checked against the
/// declared type of every path; its elements are walked once per distinct declared type.
final class TypeTagReconciler {
  private final String typeName;
  private final Map<Object, Set<ValueType>> visited = new IdentityHashMap<>();

  private TypeTagReconciler(String typeName) {
    this.typeName = typeName;
  }

  /// @param typeName the type whose restoration method receives the value, used in diagnostics
  static void reconcile(String typeName, TaggedValue value, ValueType declared) {
    LOGGER.finer(() -> "Reconciling state of " + typeName + " against " + declared.toTreeString());
    new TypeTagReconciler(typeName).visit(value, declared, "state");
  }

  private void visit(TaggedValue value, ValueType declared, String path) {
    if (declared instanceof ValueType.OptionalNode optional) {
      if (!(value instanceof TaggedValue.NoneValue)) {
        visit(value, optional.wrapped(), path);
      }
    } else if (declared instanceof ValueType.ListNode list) {
      if (!(value instanceof TaggedValue.Sequence sequence) || sequence.isTuple()) {
        throw mismatch(path, declared, value);
      }
      sequence.elementType(narrow(sequence.elementType(), list.element(), path));
      if (firstVisit(sequence, declared)) {
        for (int i = 0; i < sequence.size(); i++) {
          visit(sequence.get(i), list.element(), path + "[" + i + "]");
        }
      }
    } else if (declared instanceof ValueType.TupleNode tuple) {
      if (!(value instanceof TaggedValue.Sequence sequence) || !sequence.isTuple()) {
        throw mismatch(path, declared, value);
      }
      if (sequence.size() != tuple.elements().size()) {
        throw new TypeReconciliationException(typeName, path, declared, "Tuple of arity " + sequence.size());
      }
      if (firstVisit(sequence, declared)) {
        for (int i = 0; i < sequence.size(); i++) {
          visit(sequence.get(i), tuple.elements().get(i), path + "[" + i + "]");
        }
      }
    } else if (declared instanceof ValueType.DictNode dict) {
      if (!(value instanceof TaggedValue.Mapping mapping)) {
        throw mismatch(path, declared, value);
      }
      mapping.keyType(narrow(mapping.keyType(), dict.key(), path));
      mapping.valueType(narrow(mapping.valueType(), dict.value(), path));
      if (firstVisit(mapping, declared)) {
        for (var entry : mapping.entries().entrySet()) {
          final var entryPath = path + "[" + describeKey(entry.getKey()) + "]";
          visit(entry.getKey(), dict.key(), entryPath);
          visit(entry.getValue(), dict.value(), entryPath);
        }
      }
    } else if (declared instanceof ValueType.ClassNode cls) {
      // instances are restored by their own type, only their identity is checked here
      if (!(value instanceof TaggedValue.ObjectRef ref) ||
          !ref.instance().type().qualifiedName().equals(cls.qualifiedName())) {
        throw mismatch(path, declared, value);
      }
    } else if (declared instanceof ValueType.LeafNode leaf) {
      if (!matches(leaf.kind(), value)) {
        throw mismatch(path, declared, value);
      }
    }
  }

  /// Records the pair and reports whether this container was not yet walked against this declared type
  private boolean firstVisit(Object container, ValueType declared) {
    return visited.computeIfAbsent(container, k -> new HashSet<>()).add(declared);
  }

  private static boolean matches(ValueType.LeafKind kind, TaggedValue value) {
    switch (kind) {
      case ANY:
        return true;
      case NONE:
        return value instanceof TaggedValue.NoneValue;
      case BOOL:
        return value instanceof TaggedValue.Bool;
      case INT:
        return value instanceof TaggedValue.Int;
      case FLOAT:
        return value instanceof TaggedValue.Float;
      case STRING:
        return value instanceof TaggedValue.Str;
      case TENSOR:
        return value instanceof TaggedValue.TensorRef;
      default:
        throw new AssertionError("Unknown leaf kind: " + kind);
    }
  }

  private ValueType narrow(ValueType current, ValueType declared, String path) {
    if (current.equals(ValueType.ANY) || current.equals(declared)) {
      return declared;
    }
    if (declared.equals(ValueType.ANY)) {
      return current;
    }
    throw new TypeReconciliationException(typeName, path, declared, "a container tagged " + current.toTreeString());
  }

  private TypeReconciliationException mismatch(String path, ValueType declared, TaggedValue value) {
    return new TypeReconciliationException(typeName, path, declared, value.variantName());
  }

  private static String describeKey(TaggedValue key) {
    if (key instanceof TaggedValue.Str s) {
      return "'" + s.value() + "'";
    }
    if (key instanceof TaggedValue.Int i) {
      return Long.toString(i.value());
    }
    return key.variantName();
  }
}
