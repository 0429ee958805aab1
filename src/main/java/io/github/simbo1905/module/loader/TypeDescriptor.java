// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Resolved schema of a named user type: its ordered attributes and how instances get their state.
/// Descriptors are compared by identity; a session hands out one instance per qualified name.
public final class TypeDescriptor {
  private final String qualifiedName;
  private final List<Attribute> attributes;
  private final Construction construction;
  private final Map<String, Integer> attributeIndexes;

  private TypeDescriptor(String qualifiedName, List<Attribute> attributes, Construction construction) {
    this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
    this.attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes must not be null"));
    this.construction = Objects.requireNonNull(construction, "construction must not be null");
    final var indexes = new HashMap<String, Integer>();
    for (int i = 0; i < this.attributes.size(); i++) {
      final var name = this.attributes.get(i).name();
      if (indexes.put(name, i) != null) {
        throw new IllegalArgumentException("Duplicate attribute '" + name + "' in type " + qualifiedName);
      }
    }
    this.attributeIndexes = Map.copyOf(indexes);
  }

  /// A type whose state is a dict of attribute name to value, assigned slot by slot
  public static TypeDescriptor withFields(String qualifiedName, List<Attribute> attributes) {
    return new TypeDescriptor(qualifiedName, attributes, new Construction.FieldAssignment());
  }

  /// A type that defines its own restoration method
  public static TypeDescriptor withRestoration(String qualifiedName, List<Attribute> attributes,
                                               RestorationMethod method) {
    return new TypeDescriptor(qualifiedName, attributes, new Construction.CustomRestoration(method));
  }

  public String qualifiedName() {
    return qualifiedName;
  }

  public List<Attribute> attributes() {
    return attributes;
  }

  public Construction construction() {
    return construction;
  }

  public boolean hasRestorationMethod() {
    return construction instanceof Construction.CustomRestoration;
  }

  public int attributeIndex(String name) {
    final var index = attributeIndexes.get(name);
    if (index == null) {
      throw new IllegalArgumentException("Type " + qualifiedName + " has no attribute '" + name + "'");
    }
    return index;
  }

  @Override
  public String toString() {
    return "TypeDescriptor[" + qualifiedName + "(" +
        attributes.stream().map(a -> a.name() + ":" + a.type().toTreeString()).collect(Collectors.joining(", ")) +
        ")" + (hasRestorationMethod() ? " with restoration method" : "") + "]";
  }

  public record Attribute(String name, ValueType type) {
    public Attribute {
      Objects.requireNonNull(name, "Attribute name cannot be null");
      Objects.requireNonNull(type, "Attribute type cannot be null");
    }

    public static Attribute of(String name, String typeAnnotation) {
      return new Attribute(name, ValueType.parse(typeAnnotation));
    }

    public boolean isOptional() {
      return type.isOptional();
    }
  }

  /// How an instance receives its recorded state, decided once when the descriptor is built.
  public sealed interface Construction permits Construction.FieldAssignment, Construction.CustomRestoration {

    record FieldAssignment() implements Construction {
    }

    record CustomRestoration(RestorationMethod method) implements Construction {
      public CustomRestoration {
        Objects.requireNonNull(method, "Restoration method cannot be null");
      }
    }
  }
}
