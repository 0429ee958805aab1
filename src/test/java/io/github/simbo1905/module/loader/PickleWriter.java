// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/// Emits instruction streams for tests, one opcode per call. Nothing is validated so broken streams can be written too.
final class PickleWriter {
  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  static PickleWriter stream() {
    return new PickleWriter().proto(2);
  }

  PickleWriter proto(int version) {
    return op(Opcode.PROTO).raw(version);
  }

  PickleWriter none() {
    return op(Opcode.NONE);
  }

  PickleWriter bool(boolean value) {
    return op(value ? Opcode.NEWTRUE : Opcode.NEWFALSE);
  }

  /// Picks the shortest encoding the way a pickler does
  PickleWriter integer(long value) {
    if (value >= 0 && value <= 0xFF) {
      return op(Opcode.BININT1).raw((int) value);
    }
    if (value >= 0 && value <= 0xFFFF) {
      op(Opcode.BININT2);
      return littleEndian(value, 2);
    }
    if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      op(Opcode.BININT);
      return littleEndian(value, 4);
    }
    op(Opcode.LONG1).raw(8);
    return littleEndian(value, 8);
  }

  PickleWriter long1(byte... littleEndianTwosComplement) {
    op(Opcode.LONG1).raw(littleEndianTwosComplement.length);
    out.writeBytes(littleEndianTwosComplement);
    return this;
  }

  PickleWriter floating(double value) {
    op(Opcode.BINFLOAT);
    out.writeBytes(ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN).putDouble(value).array());
    return this;
  }

  PickleWriter string(String value) {
    final var bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length < 256) {
      op(Opcode.SHORT_BINUNICODE).raw(bytes.length);
    } else {
      op(Opcode.BINUNICODE);
      littleEndian(bytes.length, 4);
    }
    out.writeBytes(bytes);
    return this;
  }

  PickleWriter mark() {
    return op(Opcode.MARK);
  }

  PickleWriter emptyTuple() {
    return op(Opcode.EMPTY_TUPLE);
  }

  PickleWriter tuple() {
    return op(Opcode.TUPLE);
  }

  PickleWriter tuple2() {
    return op(Opcode.TUPLE2);
  }

  PickleWriter emptyList() {
    return op(Opcode.EMPTY_LIST);
  }

  PickleWriter append() {
    return op(Opcode.APPEND);
  }

  PickleWriter appends() {
    return op(Opcode.APPENDS);
  }

  PickleWriter emptyDict() {
    return op(Opcode.EMPTY_DICT);
  }

  PickleWriter setItem() {
    return op(Opcode.SETITEM);
  }

  PickleWriter setItems() {
    return op(Opcode.SETITEMS);
  }

  PickleWriter put(long id) {
    if (id < 256) {
      return op(Opcode.BINPUT).raw((int) id);
    }
    op(Opcode.LONG_BINPUT);
    return littleEndian(id, 4);
  }

  PickleWriter memoize() {
    return op(Opcode.MEMOIZE);
  }

  PickleWriter get(long id) {
    if (id < 256) {
      return op(Opcode.BINGET).raw((int) id);
    }
    op(Opcode.LONG_BINGET);
    return littleEndian(id, 4);
  }

  PickleWriter global(String module, String name) {
    op(Opcode.GLOBAL);
    out.writeBytes((module + "\n" + name + "\n").getBytes(StandardCharsets.UTF_8));
    return this;
  }

  /// `GLOBAL`, empty args and `NEWOBJ`: leaves an allocated instance on the stack
  PickleWriter newObject(String module, String name) {
    return global(module, name).emptyTuple().op(Opcode.NEWOBJ);
  }

  PickleWriter newObj() {
    return op(Opcode.NEWOBJ);
  }

  PickleWriter build() {
    return op(Opcode.BUILD);
  }

  /// Persistent id tuple of a tensor storage followed by `BINPERSID`
  PickleWriter storage(String dtype, String key, String device, long... shape) {
    mark().string("storage").string(dtype).string(key).string(device);
    mark();
    for (long dim : shape) {
      integer(dim);
    }
    tuple();
    return tuple().op(Opcode.BINPERSID);
  }

  PickleWriter stop() {
    return op(Opcode.STOP);
  }

  PickleWriter op(Opcode opcode) {
    return raw(opcode.code());
  }

  PickleWriter raw(int... bytes) {
    for (int b : bytes) {
      out.write(b);
    }
    return this;
  }

  private PickleWriter littleEndian(long value, int width) {
    for (int i = 0; i < width; i++) {
      out.write((int) (value >>> (8 * i)) & 0xFF);
    }
    return this;
  }

  int size() {
    return out.size();
  }

  byte[] bytes() {
    return out.toByteArray();
  }
}
