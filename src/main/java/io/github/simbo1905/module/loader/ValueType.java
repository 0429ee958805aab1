// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Declared type of an attribute or of a restoration method parameter.
/// Containers decoded from the stream carry an imprecise tag ([#ANY]) until a declared type narrows it.
public sealed interface ValueType permits
    ValueType.LeafNode, ValueType.ListNode, ValueType.TupleNode, ValueType.DictNode,
    ValueType.OptionalNode, ValueType.ClassNode {

  ValueType ANY = new LeafNode(LeafKind.ANY);
  ValueType NONE = new LeafNode(LeafKind.NONE);
  ValueType BOOL = new LeafNode(LeafKind.BOOL);
  ValueType INT = new LeafNode(LeafKind.INT);
  ValueType FLOAT = new LeafNode(LeafKind.FLOAT);
  ValueType STRING = new LeafNode(LeafKind.STRING);
  ValueType TENSOR = new LeafNode(LeafKind.TENSOR);

  static ValueType list(ValueType element) {
    return new ListNode(element);
  }

  static ValueType tuple(ValueType... elements) {
    return new TupleNode(List.of(elements));
  }

  static ValueType dict(ValueType key, ValueType value) {
    return new DictNode(key, value);
  }

  static ValueType optional(ValueType wrapped) {
    return new OptionalNode(wrapped);
  }

  static ValueType ofClass(String qualifiedName) {
    return new ClassNode(qualifiedName);
  }

  /// Recursive descent parser for annotation strings such as `Dict[str, List[Tensor]]`.
  /// Names that are not built in are taken to be qualified class names.
  static ValueType parse(String annotation) {
    Objects.requireNonNull(annotation, "annotation must not be null");
    final var parser = new Parser(annotation);
    final var result = parser.parseType();
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw new IllegalArgumentException("Unexpected trailing input at " + parser.pos + " in type: " + annotation);
    }
    LOGGER.finer(() -> "Parsed type annotation '" + annotation + "' as " + result.toTreeString());
    return result;
  }

  /// Helper method to get a string representation for debugging
  /// Example: LIST(STRING) or DICT(STRING,INT)
  String toTreeString();

  /// @return true when this type admits an empty (None) value
  default boolean isOptional() {
    return false;
  }

  /// Leaf types with no children
  record LeafNode(LeafKind kind) implements ValueType {
    public LeafNode {
      Objects.requireNonNull(kind, "Leaf kind cannot be null");
    }

    @Override
    public String toTreeString() {
      return kind.name();
    }

    @Override
    public boolean isOptional() {
      // a None typed slot can only ever hold None; Any still requires a value
      return kind == LeafKind.NONE;
    }
  }

  enum LeafKind {
    ANY, NONE, BOOL, INT, FLOAT, STRING, TENSOR
  }

  /// Container node for lists - has one child (element type)
  record ListNode(ValueType element) implements ValueType {
    public ListNode {
      Objects.requireNonNull(element, "List element type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "LIST(" + element.toTreeString() + ")";
    }
  }

  /// Container node for fixed arity tuples - one child per position
  record TupleNode(List<ValueType> elements) implements ValueType {
    public TupleNode {
      elements = List.copyOf(Objects.requireNonNull(elements, "Tuple element types cannot be null"));
    }

    @Override
    public String toTreeString() {
      return elements.stream().map(ValueType::toTreeString).collect(Collectors.joining(",", "TUPLE(", ")"));
    }
  }

  /// Container node for dicts - has two children (key type, value type)
  record DictNode(ValueType key, ValueType value) implements ValueType {
    public DictNode {
      Objects.requireNonNull(key, "Dict key type cannot be null");
      Objects.requireNonNull(value, "Dict value type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "DICT(" + key.toTreeString() + "," + value.toTreeString() + ")";
    }
  }

  /// Container node for optionals - has one child (wrapped type)
  record OptionalNode(ValueType wrapped) implements ValueType {
    public OptionalNode {
      Objects.requireNonNull(wrapped, "Optional wrapped type cannot be null");
    }

    @Override
    public String toTreeString() {
      return "OPTIONAL(" + wrapped.toTreeString() + ")";
    }

    @Override
    public boolean isOptional() {
      return true;
    }
  }

  /// Leaf node naming a user type by its qualified name
  record ClassNode(String qualifiedName) implements ValueType {
    public ClassNode {
      Objects.requireNonNull(qualifiedName, "Class name cannot be null");
      if (qualifiedName.isBlank()) {
        throw new IllegalArgumentException("Class name cannot be blank");
      }
    }

    @Override
    public String toTreeString() {
      return qualifiedName;
    }
  }

  final class Parser {
    private final String text;
    private int pos;

    private Parser(String text) {
      this.text = text;
    }

    private @NotNull ValueType parseType() {
      skipWhitespace();
      final var name = parseName();
      skipWhitespace();
      if (!atEnd() && text.charAt(pos) == '[') {
        pos++;
        final var args = new ArrayList<ValueType>();
        skipWhitespace();
        if (!atEnd() && text.charAt(pos) != ']') {
          args.add(parseType());
          skipWhitespace();
          while (!atEnd() && text.charAt(pos) == ',') {
            pos++;
            args.add(parseType());
            skipWhitespace();
          }
        }
        expect(']');
        return generic(name, args);
      }
      return simple(name);
    }

    private ValueType generic(String name, List<ValueType> args) {
      switch (name) {
        case "List":
          requireArity(name, args, 1);
          return new ListNode(args.get(0));
        case "Optional":
          requireArity(name, args, 1);
          return new OptionalNode(args.get(0));
        case "Dict":
          requireArity(name, args, 2);
          return new DictNode(args.get(0), args.get(1));
        case "Tuple":
          return new TupleNode(args);
        default:
          throw new IllegalArgumentException("Unsupported generic type '" + name + "' in: " + text);
      }
    }

    private ValueType simple(String name) {
      switch (name) {
        case "Any":
          return ANY;
        case "None":
        case "NoneType":
          return NONE;
        case "bool":
          return BOOL;
        case "int":
          return INT;
        case "float":
          return FLOAT;
        case "str":
          return STRING;
        case "Tensor":
          return TENSOR;
        default:
          return new ClassNode(name);
      }
    }

    private void requireArity(String name, List<ValueType> args, int arity) {
      if (args.size() != arity) {
        throw new IllegalArgumentException(name + " must have exactly " + arity + " type argument(s): " + text);
      }
    }

    private String parseName() {
      final int start = pos;
      while (!atEnd() && (Character.isJavaIdentifierPart(text.charAt(pos)) || text.charAt(pos) == '.')) {
        pos++;
      }
      if (start == pos) {
        throw new IllegalArgumentException("Expected a type name at " + pos + " in: " + text);
      }
      return text.substring(start, pos);
    }

    private void expect(char c) {
      if (atEnd() || text.charAt(pos) != c) {
        throw new IllegalArgumentException("Expected '" + c + "' at " + pos + " in: " + text);
      }
      pos++;
    }

    private void skipWhitespace() {
      while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private boolean atEnd() {
      return pos >= text.length();
    }
  }
}
