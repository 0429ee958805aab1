// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// Instructions understood by the [Unpickler]. Byte values are those of the pickle protocol (versions 2 to 4)
/// so snapshots written by a standard pickler restricted to this subset can be read.
enum Opcode {
  PROTO(0x80),
  FRAME(0x95),
  STOP('.'),
  NONE('N'),
  NEWTRUE(0x88),
  NEWFALSE(0x89),
  BININT('J'),
  BININT1('K'),
  BININT2('M'),
  LONG1(0x8a),
  BINFLOAT('G'),
  BINUNICODE('X'),
  SHORT_BINUNICODE(0x8c),
  MARK('('),
  EMPTY_TUPLE(')'),
  TUPLE('t'),
  TUPLE1(0x85),
  TUPLE2(0x86),
  TUPLE3(0x87),
  EMPTY_LIST(']'),
  APPEND('a'),
  APPENDS('e'),
  EMPTY_DICT('}'),
  SETITEM('s'),
  SETITEMS('u'),
  BINPUT('q'),
  LONG_BINPUT('r'),
  MEMOIZE(0x94),
  BINGET('h'),
  LONG_BINGET('j'),
  GLOBAL('c'),
  NEWOBJ(0x81),
  BUILD('b'),
  BINPERSID('Q');

  static final int LOWEST_PROTOCOL = 2;
  static final int HIGHEST_PROTOCOL = 4;

  private static final Opcode[] BY_CODE = new Opcode[256];

  static {
    for (Opcode op : values()) {
      assert BY_CODE[op.code] == null : "Duplicate opcode byte " + op.code;
      BY_CODE[op.code] = op;
    }
  }

  private final int code;

  Opcode(int code) {
    this.code = code;
  }

  int code() {
    return code;
  }

  /// @return the opcode for a byte value 0..255, or null if it is not part of the supported subset
  static Opcode fromCode(int code) {
    return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : null;
  }
}
