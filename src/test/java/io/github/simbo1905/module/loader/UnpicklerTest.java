// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Optional;

import static io.github.simbo1905.module.loader.TestTypes.MODULE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnpicklerTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private final TestTypes types = new TestTypes().add(TestTypes.node()).add(TestTypes.linear());

  private TaggedValue decode(PickleWriter stream) {
    return decode(stream, ContainerBuilder.container().noConstants().open(), Optional.empty());
  }

  private TaggedValue decode(PickleWriter stream, ArchiveReader archive, Optional<Device> device) {
    return new Unpickler("data",
        new RecordByteSource(ByteBuffer.wrap(stream.bytes())),
        new ClassResolver(types, SourceLookup.NONE),
        new ObjectConstructor("data"),
        archive,
        ByteTensor::of,
        device).parse();
  }

  @Test
  void testPrimitiveLiterals() {
    final var longText = "x".repeat(300);
    final var stream = PickleWriter.stream().emptyList().mark()
        .none().bool(true).bool(false)
        .integer(7).integer(300).integer(70_000).integer(-5).integer(Long.MAX_VALUE)
        .floating(2.5).string("héllo").string(longText)
        .appends().stop();

    final var list = (TaggedValue.Sequence) decode(stream);

    assertThat(list.isTuple()).isFalse();
    assertThat(list.elements()).containsExactly(
        TaggedValue.NONE, new TaggedValue.Bool(true), new TaggedValue.Bool(false),
        new TaggedValue.Int(7), new TaggedValue.Int(300), new TaggedValue.Int(70_000), new TaggedValue.Int(-5),
        new TaggedValue.Int(Long.MAX_VALUE),
        new TaggedValue.Float(2.5), new TaggedValue.Str("héllo"), new TaggedValue.Str(longText));
  }

  @Test
  void testLong1SignExtension() {
    final var stream = PickleWriter.stream().mark()
        .long1()
        .long1((byte) 0xFF)
        .long1((byte) 0x00, (byte) 0x80)
        .long1((byte) 0x01, (byte) 0x00)
        .tuple().stop();

    final var tuple = (TaggedValue.Sequence) decode(stream);

    assertThat(tuple.elements()).containsExactly(
        new TaggedValue.Int(0), new TaggedValue.Int(-1), new TaggedValue.Int(-32768), new TaggedValue.Int(1));
  }

  @Test
  void testLong1WiderThanEightBytesIsRejected() {
    final var stream = PickleWriter.stream().long1(new byte[9]).stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("does not fit in 64 bits");
  }

  @Test
  void testTuplesAndDicts() {
    final var stream = PickleWriter.stream()
        .emptyDict()
        .mark().string("a").integer(1).string("b").mark().integer(1).integer(2).integer(3).tuple().setItems()
        .string("a").integer(9).setItem()
        .stop();

    final var dict = (TaggedValue.Mapping) decode(stream);

    assertThat(dict.size()).isEqualTo(2);
    assertThat(dict.get("a")).isEqualTo(new TaggedValue.Int(9));
    final var tuple = (TaggedValue.Sequence) dict.get("b");
    assertThat(tuple.isTuple()).isTrue();
    assertThat(tuple.elements()).extracting(v -> ((TaggedValue.Int) v).value()).containsExactly(1L, 2L, 3L);
    assertThat(dict.keyType()).isEqualTo(ValueType.ANY);
    assertThat(tuple.elementType()).isEqualTo(ValueType.ANY);
  }

  @Test
  @DisplayName("Backreferences share one decoded value")
  void testBackreferencesShareValues() {
    final var stream = PickleWriter.stream()
        .mark().emptyList().put(0).get(0).emptyDict().memoize().get(1).tuple()
        .stop();

    final var tuple = (TaggedValue.Sequence) decode(stream);

    assertThat(tuple.size()).isEqualTo(4);
    assertThat(tuple.get(0)).isSameAs(tuple.get(1));
    assertThat(tuple.get(2)).isSameAs(tuple.get(3));
  }

  @Test
  void testSelfReferentialList() {
    final var stream = PickleWriter.stream().emptyList().put(0).get(0).append().stop();

    final var list = (TaggedValue.Sequence) decode(stream);

    assertThat(list.get(0)).isSameAs(list);
  }

  @Test
  void testObjectWithFieldState() {
    final var stream = PickleWriter.stream()
        .newObject(MODULE, "Node").put(0)
        .emptyDict().mark().string("value").integer(42).string("next").none().setItems()
        .build().stop();

    final var root = ((TaggedValue.ObjectRef) decode(stream)).instance();

    assertThat(root.type().qualifiedName()).isEqualTo(TestTypes.qualified("Node"));
    assertThat(root.getAttribute("value")).isEqualTo(new TaggedValue.Int(42));
    assertThat(root.isSlotEmpty(1)).isTrue();
  }

  @Test
  @DisplayName("An instance is addressable before its state is applied")
  void testSelfReferentialObject() {
    final var stream = PickleWriter.stream()
        .newObject(MODULE, "Node").put(0)
        .emptyDict().mark().string("value").integer(1).string("next").get(0).setItems()
        .build().stop();

    final var root = ((TaggedValue.ObjectRef) decode(stream)).instance();

    assertThat(((TaggedValue.ObjectRef) root.getAttribute("next")).instance()).isSameAs(root);
  }

  @Test
  void testTypesAreResolvedOncePerSession() {
    final var stream = PickleWriter.stream().mark();
    for (int i = 0; i < 3; i++) {
      stream.newObject(MODULE, "Node")
          .emptyDict().mark().string("value").integer(i).string("next").none().setItems().build();
    }
    stream.tuple().stop();

    final var tuple = (TaggedValue.Sequence) decode(stream);

    assertThat(tuple.elements()).extracting(v -> ((TaggedValue.ObjectRef) v).instance().type())
        .allMatch(type -> type == ((TaggedValue.ObjectRef) tuple.get(0)).instance().type());
    assertThat(types.loadCount(TestTypes.qualified("Node"))).isEqualTo(1);
  }

  @Test
  void testUnknownTypeFailsResolution() {
    final var stream = PickleWriter.stream().newObject(MODULE, "Missing").stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(UnresolvedTypeException.class)
        .hasMessageContaining("__torch__.Missing");
  }

  @Test
  void testTensorsAreMaterializedFromStorageRecords() {
    final var storage = new byte[]{1, 2, 3, 4, 5, 6, 7, 8};
    final var archive = ContainerBuilder.container().record("data/0", storage).open();
    final var stream = PickleWriter.stream().mark()
        .storage("float32", "0", "cpu", 2, 1)
        .storage("float32", "0", "cpu", 2, 1)
        .tuple().stop();

    final var tuple = (TaggedValue.Sequence) decode(stream, archive, Optional.empty());

    final var tensor = ((TaggedValue.TensorRef) tuple.get(0)).tensor();
    assertThat(tensor.dtype()).isEqualTo("float32");
    assertThat(tensor.shape()).containsExactly(2L, 1L);
    assertThat(tensor.device()).isEqualTo(Device.CPU);
    assertThat(((ByteTensor) tensor).data()).isEqualTo(ByteBuffer.wrap(storage));
    assertThat(((TaggedValue.TensorRef) tuple.get(1)).tensor()).isSameAs(tensor);
  }

  @Test
  void testDeviceOverrideAppliesToEveryTensor() {
    final var archive = ContainerBuilder.container().record("data/0", new byte[4]).record("data/1", new byte[4]).open();
    final var stream = PickleWriter.stream().mark()
        .storage("int32", "0", "cpu", 1)
        .storage("int32", "1", "cuda:0", 1)
        .tuple().stop();

    final var tuple = (TaggedValue.Sequence) decode(stream, archive, Optional.of(Device.parse("cuda:1")));

    assertThat(tuple.elements()).extracting(v -> ((TaggedValue.TensorRef) v).tensor().device())
        .containsExactly(new Device("cuda", 1), new Device("cuda", 1));
  }

  @Test
  void testMissingStorageRecord() {
    final var stream = PickleWriter.stream().storage("float32", "7", "cpu", 1).stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(RecordNotFoundException.class)
        .extracting(e -> ((RecordNotFoundException) e).recordName())
        .isEqualTo("data/7");
  }

  @Test
  void testUnknownOpcodeReportsOffset() {
    final var stream = PickleWriter.stream().none().raw(0xFF);
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOfSatisfying(MalformedArchiveException.class, e -> {
          assertThat(e.archiveName()).isEqualTo("data");
          assertThat(e.offset()).isEqualTo(3L);
          assertThat(e.getMessage()).contains("unknown opcode 0xff");
        });
  }

  @Test
  void testStackUnderflow() {
    final var stream = PickleWriter.stream().append().stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOfSatisfying(MalformedArchiveException.class, e -> {
          assertThat(e.offset()).isEqualTo(2L);
          assertThat(e.getMessage()).contains("stack underflow");
        });
  }

  @Test
  void testPopDoesNotCrossMark() {
    final var stream = PickleWriter.stream().emptyList().mark().append().stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("stack underflow");
  }

  @Test
  void testUndefinedBackreference() {
    final var stream = PickleWriter.stream().none().put(0).get(3).stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("undefined backreference 3");
  }

  @Test
  void testBackreferenceIdsMustBeDense() {
    final var stream = PickleWriter.stream().none().put(1).stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("out of order, expected 0");
  }

  @Test
  void testTypeBindingIsNotAValue() {
    final var stream = PickleWriter.stream().global(MODULE, "Node").put(0).stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("only values can be memoized");
  }

  @Test
  void testNewObjNeedsType() {
    final var stream = PickleWriter.stream().none().emptyTuple().newObj().stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("NEWOBJ expects a type bound by GLOBAL");
  }

  @Test
  void testBuildNeedsInstance() {
    final var stream = PickleWriter.stream().emptyDict().emptyDict().build().stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("BUILD expects an allocated instance");
  }

  @Test
  @DisplayName("An instance allocated but never given state fails at STOP")
  void testAllocatedInstanceMustBeBuilt() {
    final var stream = PickleWriter.stream().newObject(MODULE, "Node").stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("1 allocated instance(s) never received state")
        .hasMessageContaining(TestTypes.qualified("Node"));
  }

  @Test
  void testUnbuiltInstanceNestedInContainerFails() {
    final var stream = PickleWriter.stream()
        .newObject(MODULE, "Node")
        .emptyDict().mark().string("value").integer(1).string("next").none().setItems().build()
        .newObject(MODULE, "Node")
        .tuple2().stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("never received state");
  }

  @Test
  void testSecondBuildOnSameInstanceIsRejected() {
    final var stream = PickleWriter.stream().newObject(MODULE, "Node")
        .emptyDict().mark().string("value").integer(1).string("next").none().setItems().build()
        .emptyDict().mark().string("value").integer(2).string("next").none().setItems().build()
        .stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("BUILD applied twice to " + TestTypes.qualified("Node"));
  }

  @Test
  void testInvalidUtf8TextIsRejected() {
    final var shortText = PickleWriter.stream().op(Opcode.SHORT_BINUNICODE).raw(2, 0xC3, 0x28).stop();
    assertThatThrownBy(() -> decode(shortText))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("invalid UTF-8");

    final var loneContinuation = PickleWriter.stream().op(Opcode.BINUNICODE).raw(1, 0, 0, 0, 0x80).stop();
    assertThatThrownBy(() -> decode(loneContinuation))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("invalid UTF-8");
  }

  @Test
  void testStreamWithoutStop() {
    assertThatThrownBy(() -> decode(PickleWriter.stream().none()))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("without a STOP");
  }

  @Test
  void testStopNeedsExactlyOneValue() {
    assertThatThrownBy(() -> decode(PickleWriter.stream().none().none().stop()))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("exactly one value");
    assertThatThrownBy(() -> decode(PickleWriter.stream().mark().none().stop()))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("unterminated MARK");
  }

  @Test
  void testTruncatedOperand() {
    final var stream = PickleWriter.stream().op(Opcode.BININT).raw(1, 2);
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("stream truncated");
  }

  @Test
  void testUnsupportedProtocol() {
    final var stream = new PickleWriter().proto(9).none().stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("unsupported protocol 9");
  }

  @Test
  void testMalformedPersistentId() {
    final var stream = PickleWriter.stream().mark().string("storage").tuple().op(Opcode.BINPERSID).stop();
    assertThatThrownBy(() -> decode(stream))
        .isInstanceOf(MalformedArchiveException.class)
        .hasMessageContaining("persistent id must be a Tuple of 5");
  }

  @Test
  void testOpcodeTableIsConsistent() {
    for (Opcode op : Opcode.values()) {
      assertThat(Opcode.fromCode(op.code())).isSameAs(op);
    }
    assertThat(Opcode.fromCode(0x00)).isNull();
    assertThat(List.of(Opcode.STOP.code(), Opcode.GLOBAL.code(), Opcode.BUILD.code()))
        .containsExactly((int) '.', (int) 'c', (int) 'b');
  }
}
