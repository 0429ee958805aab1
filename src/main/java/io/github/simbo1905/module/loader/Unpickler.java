// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Stack machine that decodes the instruction stream of one archive into a [TaggedValue].
///
/// User types are built in three steps so that graphs may refer back to an instance while it is being
/// restored: `GLOBAL` binds the type through the [TypeResolver], `NEWOBJ` allocates an empty instance
/// that the stream then memoizes, and `BUILD` hands the decoded state to the [InstanceBuilder].
///
/// `BINPERSID` materializes a tensor from the persistent id tuple
/// `("storage", dtype, key, device, shape)` whose bytes live in the record `<archive>/<key>`.
///
/// Every instance allocated by `NEWOBJ` must receive exactly one `BUILD` before `STOP`.
///
/// One instance decodes one archive and is then discarded.
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
final class Unpickler {
  private final String archiveName;
  private final RecordByteSource source;
  private final TypeResolver typeResolver;
  private final InstanceBuilder instanceBuilder;
  private final ArchiveReader archive;
  private final TensorMaterializer tensorMaterializer;
  private final Optional<Device> deviceOverride;

  private final List<Object> stack = new ArrayList<>();
  private final Deque<Integer> marks = new ArrayDeque<>();
  private final BackreferenceTable backreferences = new BackreferenceTable();
  private final Map<StorageKey, Tensor> tensors = new HashMap<>();
  private final Set<Object> awaitingState = TaggedValue.identitySet();
  private final Set<Object> restored = TaggedValue.identitySet();
  private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
      .onMalformedInput(CodingErrorAction.REPORT)
      .onUnmappableCharacter(CodingErrorAction.REPORT);
  private long opOffset;

  /// A type bound by `GLOBAL` waiting for `NEWOBJ`. It lives on the stack only and is never a value.
  private record TypeBinding(TypeDescriptor type) {
  }

  private record StorageKey(String key, TensorSpec spec) {
  }

  Unpickler(String archiveName,
            RecordByteSource source,
            TypeResolver typeResolver,
            InstanceBuilder instanceBuilder,
            ArchiveReader archive,
            TensorMaterializer tensorMaterializer,
            Optional<Device> deviceOverride) {
    this.archiveName = Objects.requireNonNull(archiveName, "archiveName must not be null");
    this.source = Objects.requireNonNull(source, "source must not be null");
    this.typeResolver = Objects.requireNonNull(typeResolver, "typeResolver must not be null");
    this.instanceBuilder = Objects.requireNonNull(instanceBuilder, "instanceBuilder must not be null");
    this.archive = Objects.requireNonNull(archive, "archive must not be null");
    this.tensorMaterializer = Objects.requireNonNull(tensorMaterializer, "tensorMaterializer must not be null");
    this.deviceOverride = Objects.requireNonNull(deviceOverride, "deviceOverride must not be null");
  }

  /// Runs the stream up to its `STOP` instruction.
  /// @return the single value left on the stack
  TaggedValue parse() {
    while (true) {
      opOffset = source.position();
      final int code = source.read();
      if (code < 0) {
        throw malformed("stream ended without a STOP instruction");
      }
      final Opcode op = Opcode.fromCode(code);
      if (op == null) {
        throw malformed("unknown opcode 0x" + Integer.toHexString(code));
      }
      LOGGER.finer(() -> "[" + archiveName + " @" + opOffset + "] " + op + " stack=" + stack.size());
      if (op == Opcode.STOP) {
        return finish();
      }
      execute(op);
    }
  }

  /// Number of backreferences registered so far
  int backreferenceCount() {
    return backreferences.size();
  }

  private void execute(Opcode op) {
    switch (op) {
      case PROTO -> {
        final int protocol = (int) readUnsigned(1);
        if (protocol < Opcode.LOWEST_PROTOCOL || protocol > Opcode.HIGHEST_PROTOCOL) {
          throw malformed("unsupported protocol " + protocol);
        }
      }
      case FRAME -> readBytes(8);
      case NONE -> stack.add(TaggedValue.NONE);
      case NEWTRUE -> stack.add(new TaggedValue.Bool(true));
      case NEWFALSE -> stack.add(new TaggedValue.Bool(false));
      case BININT -> stack.add(new TaggedValue.Int((int) readUnsigned(4)));
      case BININT1 -> stack.add(new TaggedValue.Int(readUnsigned(1)));
      case BININT2 -> stack.add(new TaggedValue.Int(readUnsigned(2)));
      case LONG1 -> stack.add(new TaggedValue.Int(readLong1()));
      case BINFLOAT -> stack.add(new TaggedValue.Float(Double.longBitsToDouble(readBigEndianLong())));
      case BINUNICODE -> stack.add(new TaggedValue.Str(readString(readUnsigned(4))));
      case SHORT_BINUNICODE -> stack.add(new TaggedValue.Str(readString(readUnsigned(1))));
      case MARK -> marks.push(stack.size());
      case EMPTY_TUPLE -> stack.add(TaggedValue.Sequence.tuple(List.of()));
      case TUPLE -> stack.add(TaggedValue.Sequence.tuple(popToMark()));
      case TUPLE1 -> stack.add(TaggedValue.Sequence.tuple(popValues(1)));
      case TUPLE2 -> stack.add(TaggedValue.Sequence.tuple(popValues(2)));
      case TUPLE3 -> stack.add(TaggedValue.Sequence.tuple(popValues(3)));
      case EMPTY_LIST -> stack.add(TaggedValue.Sequence.list());
      case APPEND -> {
        final var value = popValue();
        peekList().append(value);
      }
      case APPENDS -> {
        final var values = popToMark();
        final var list = peekList();
        values.forEach(list::append);
      }
      case EMPTY_DICT -> stack.add(TaggedValue.Mapping.empty());
      case SETITEM -> {
        final var value = popValue();
        final var key = popValue();
        peekDict().put(key, value);
      }
      case SETITEMS -> {
        final var items = popToMark();
        if (items.size() % 2 != 0) {
          throw malformed("SETITEMS needs key value pairs but found " + items.size() + " items");
        }
        final var dict = peekDict();
        for (int i = 0; i < items.size(); i += 2) {
          dict.put(items.get(i), items.get(i + 1));
        }
      }
      case BINPUT -> memoize(readUnsigned(1));
      case LONG_BINPUT -> memoize(readUnsigned(4));
      case MEMOIZE -> memoize(backreferences.nextId());
      case BINGET -> stack.add(backreference(readUnsigned(1)));
      case LONG_BINGET -> stack.add(backreference(readUnsigned(4)));
      case GLOBAL -> {
        final var module = readLine();
        final var name = readLine();
        stack.add(new TypeBinding(typeResolver.resolve(module + "." + name)));
      }
      case NEWOBJ -> {
        final var args = popValue();
        if (!(args instanceof TaggedValue.Sequence tuple) || !tuple.isTuple()) {
          throw malformed("NEWOBJ expects an argument Tuple but found " + args.variantName());
        }
        final var binding = pop();
        if (!(binding instanceof TypeBinding typeBinding)) {
          throw malformed("NEWOBJ expects a type bound by GLOBAL but found " + describe(binding));
        }
        final var instance = instanceBuilder.allocate(typeBinding.type());
        awaitingState.add(instance);
        LOGGER.fine(() -> "Allocated " + instance + " in " + archiveName);
        stack.add(new TaggedValue.ObjectRef(instance));
      }
      case BUILD -> {
        final var state = popValue();
        final var top = peek();
        if (!(top instanceof TaggedValue.ObjectRef ref)) {
          throw malformed("BUILD expects an allocated instance but found " + describe(top));
        }
        final var instance = ref.instance();
        if (restored.contains(instance)) {
          throw malformed("BUILD applied twice to " + instance.type().qualifiedName());
        }
        if (!awaitingState.remove(instance)) {
          throw malformed("BUILD target " + instance.type().qualifiedName() + " was not allocated by this stream");
        }
        restored.add(instance);
        instanceBuilder.restore(instance, state);
      }
      case BINPERSID -> stack.add(new TaggedValue.TensorRef(loadTensor(popValue())));
      default -> throw new AssertionError("Unhandled opcode " + op);
    }
  }

  private TaggedValue finish() {
    if (!marks.isEmpty()) {
      throw malformed("STOP with " + marks.size() + " unterminated MARK(s)");
    }
    if (stack.size() != 1) {
      throw malformed("STOP expects exactly one value on the stack but found " + stack.size());
    }
    if (!awaitingState.isEmpty()) {
      final var unbuilt = (ObjectInstance) awaitingState.iterator().next();
      throw malformed(awaitingState.size() + " allocated instance(s) never received state, e.g. " +
          unbuilt.type().qualifiedName());
    }
    final var result = popValue();
    if (source.position() < source.size()) {
      LOGGER.fine(() -> "Ignoring " + (source.size() - source.position()) + " bytes after STOP in " + archiveName);
    }
    LOGGER.fine(() -> "Decoded " + archiveName + " to " + result.variantName() + " using " +
        backreferences.size() + " backreferences");
    return result;
  }

  private void memoize(long id) {
    final var top = peek();
    if (!(top instanceof TaggedValue value)) {
      throw malformed("only values can be memoized but found " + describe(top));
    }
    if (id != backreferences.nextId()) {
      throw malformed("backreference id " + id + " is out of order, expected " + backreferences.nextId());
    }
    backreferences.register(value);
  }

  private TaggedValue backreference(long id) {
    if (!backreferences.isDefined(id)) {
      throw malformed("undefined backreference " + id + ", only " + backreferences.size() + " are defined");
    }
    return backreferences.get((int) id);
  }

  private Tensor loadTensor(TaggedValue persistentId) {
    if (!(persistentId instanceof TaggedValue.Sequence pid) || !pid.isTuple() || pid.size() != 5) {
      throw malformed("persistent id must be a Tuple of 5 but found " + persistentId);
    }
    final var kind = string(pid.get(0), "persistent id kind");
    if (!"storage".equals(kind)) {
      throw malformed("unsupported persistent id kind '" + kind + "'");
    }
    final var dtype = string(pid.get(1), "storage dtype");
    final var key = string(pid.get(2), "storage key");
    final var recordedDevice = string(pid.get(3), "storage device");
    final var shape = shape(pid.get(4));
    final Device device;
    try {
      device = deviceOverride.orElseGet(() -> Device.parse(recordedDevice));
    } catch (IllegalArgumentException e) {
      throw malformed("invalid device '" + recordedDevice + "': " + e.getMessage());
    }
    final var spec = new TensorSpec(dtype, shape, device);
    return tensors.computeIfAbsent(new StorageKey(key, spec), k -> {
      final var recordName = archiveName + "/" + key;
      LOGGER.fine(() -> "Materializing tensor " + recordName + " " + spec);
      return tensorMaterializer.materialize(archive.getRecord(recordName), spec);
    });
  }

  private String string(TaggedValue value, String what) {
    if (!(value instanceof TaggedValue.Str str)) {
      throw malformed(what + " must be a Str but found " + value.variantName());
    }
    return str.value();
  }

  private List<Long> shape(TaggedValue value) {
    if (!(value instanceof TaggedValue.Sequence dims)) {
      throw malformed("storage shape must be a sequence of Int but found " + value.variantName());
    }
    final var shape = new ArrayList<Long>(dims.size());
    for (TaggedValue dim : dims.elements()) {
      if (!(dim instanceof TaggedValue.Int size) || size.value() < 0) {
        throw malformed("storage shape must hold non-negative Int sizes but found " + dim);
      }
      shape.add(size.value());
    }
    return shape;
  }

  private Object peek() {
    if (stack.isEmpty()) {
      throw malformed("stack underflow");
    }
    return stack.get(stack.size() - 1);
  }

  private Object pop() {
    if (stack.isEmpty() || (!marks.isEmpty() && stack.size() == marks.peek())) {
      throw malformed("stack underflow");
    }
    return stack.remove(stack.size() - 1);
  }

  private TaggedValue popValue() {
    final var item = pop();
    if (!(item instanceof TaggedValue value)) {
      throw malformed("expected a value but found " + describe(item));
    }
    return value;
  }

  private List<TaggedValue> popValues(int count) {
    final var values = new TaggedValue[count];
    for (int i = count - 1; i >= 0; i--) {
      values[i] = popValue();
    }
    return List.of(values);
  }

  private List<TaggedValue> popToMark() {
    if (marks.isEmpty()) {
      throw malformed("no MARK to pop to");
    }
    final int mark = marks.pop();
    final var items = stack.subList(mark, stack.size());
    final var values = new ArrayList<TaggedValue>(items.size());
    for (Object item : items) {
      if (!(item instanceof TaggedValue value)) {
        throw malformed("expected a value but found " + describe(item));
      }
      values.add(value);
    }
    items.clear();
    return values;
  }

  private TaggedValue.Sequence peekList() {
    final var top = peek();
    if (!(top instanceof TaggedValue.Sequence list) || list.isTuple()) {
      throw malformed("expected a List on the stack but found " + describe(top));
    }
    return list;
  }

  private TaggedValue.Mapping peekDict() {
    final var top = peek();
    if (!(top instanceof TaggedValue.Mapping dict)) {
      throw malformed("expected a Dict on the stack but found " + describe(top));
    }
    return dict;
  }

  private static String describe(Object item) {
    if (item instanceof TaggedValue value) {
      return value.variantName();
    }
    if (item instanceof TypeBinding binding) {
      return "type " + binding.type().qualifiedName();
    }
    return String.valueOf(item);
  }

  /// Little endian unsigned read of 1, 2 or 4 bytes
  private long readUnsigned(int width) {
    final var bytes = readBytes(width);
    long value = 0;
    for (int i = width - 1; i >= 0; i--) {
      value = (value << 8) | (bytes[i] & 0xFF);
    }
    return value;
  }

  /// Little endian two's complement integer of up to 8 bytes
  private long readLong1() {
    final int width = (int) readUnsigned(1);
    if (width > Long.BYTES) {
      throw malformed("LONG1 of " + width + " bytes does not fit in 64 bits");
    }
    if (width == 0) {
      return 0L;
    }
    final var bytes = readBytes(width);
    long value = 0;
    for (int i = width - 1; i >= 0; i--) {
      value = (value << 8) | (bytes[i] & 0xFF);
    }
    if (width < Long.BYTES && (bytes[width - 1] & 0x80) != 0) {
      value |= -1L << (8 * width);
    }
    return value;
  }

  private long readBigEndianLong() {
    final var bytes = readBytes(Long.BYTES);
    long value = 0;
    for (byte b : bytes) {
      value = (value << 8) | (b & 0xFF);
    }
    return value;
  }

  private String readString(long length) {
    if (length > source.size() - source.position()) {
      throw malformed("string of " + length + " bytes runs past the end of the stream");
    }
    return decodeUtf8(readBytes((int) length));
  }

  private String readLine() {
    final var line = new ByteArrayOutputStream();
    int b;
    while ((b = source.read()) != '\n') {
      if (b < 0) {
        throw malformed("stream ended inside a GLOBAL name");
      }
      line.write(b);
    }
    return decodeUtf8(line.toByteArray());
  }

  private String decodeUtf8(byte[] bytes) {
    try {
      return utf8.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException e) {
      throw malformed("invalid UTF-8 text: " + e.getMessage());
    }
  }

  private byte[] readBytes(int length) {
    final var bytes = new byte[length];
    int read = 0;
    while (read < length) {
      final int count = source.read(bytes, read, length - read);
      if (count == 0) {
        throw malformed("stream truncated, needed " + length + " bytes but only " + read + " remain");
      }
      read += count;
    }
    return bytes;
  }

  private MalformedArchiveException malformed(String message) {
    return new MalformedArchiveException(archiveName, opOffset, message);
  }
}
