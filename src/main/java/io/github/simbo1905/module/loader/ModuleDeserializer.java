// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Performs one load of a container: `START -> {LEGACY, CURRENT} -> DONE`.
///
/// Requested extra files are harvested first. A `model.json` record selects the legacy path, which never
/// touches the archives. Otherwise the `constants` archive yields the constants table and the `data` archive
/// the root instance. The archive reader, backreferences and type bindings belong to this load alone.
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
final class ModuleDeserializer {
  static final String LEGACY_MARKER = "model.json";
  static final String EXTRA_PREFIX = "extra/";
  static final String CONSTANTS_ARCHIVE = "constants";
  static final String DATA_ARCHIVE = "data";
  static final String STREAM_SUFFIX = ".pkl";

  enum State {START, LEGACY, CURRENT, DONE}

  private final ArchiveReader archive;
  private final LoaderContext context;
  private final LegacySupport legacySupport;
  private final ClassResolver types;
  private final List<Tensor> constantsTable = new ArrayList<>();
  private Optional<Device> deviceOverride = Optional.empty();
  private State state = State.START;

  ModuleDeserializer(ArchiveReader archive, LoaderContext context) {
    this(archive, context, LegacySupport.current());
  }

  ModuleDeserializer(ArchiveReader archive, LoaderContext context, LegacySupport legacySupport) {
    this.archive = Objects.requireNonNull(archive, "archive must not be null");
    this.context = Objects.requireNonNull(context, "context must not be null");
    this.legacySupport = Objects.requireNonNull(legacySupport, "legacySupport must not be null");
    this.types = new ClassResolver(context.typeLoader(), SourceLookup.inArchive(archive));
  }

  /// @param extraFiles keys to look up under `extra/`; values found replace the caller's defaults in place
  LoadedModule deserialize(Optional<Device> deviceOverride, Map<String, String> extraFiles) {
    Objects.requireNonNull(deviceOverride, "deviceOverride must not be null");
    Objects.requireNonNull(extraFiles, "extraFiles must not be null");
    if (state != State.START) {
      throw new IllegalStateException("A deserializer performs a single load, this one is " + state);
    }
    this.deviceOverride = deviceOverride;
    readExtraFiles(extraFiles);

    final LoadedModule module;
    if (archive.hasRecord(LEGACY_MARKER)) {
      state = State.LEGACY;
      module = deserializeLegacy();
    } else {
      state = State.CURRENT;
      module = deserializeCurrent();
    }
    state = State.DONE;
    return module;
  }

  State state() {
    return state;
  }

  private void readExtraFiles(Map<String, String> extraFiles) {
    for (String key : List.copyOf(extraFiles.keySet())) {
      final var recordName = EXTRA_PREFIX + key;
      if (archive.hasRecord(recordName)) {
        final var text = utf8Text(recordName);
        extraFiles.put(key, text);
        LOGGER.fine(() -> "Read extra file " + recordName + " (" + text.length() + " chars)");
      } else {
        LOGGER.finer(() -> "Extra file " + recordName + " not present, keeping the default");
      }
    }
  }

  private String utf8Text(String recordName) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(archive.getRecord(recordName))
          .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedArchiveException(recordName, "extra file is not valid UTF-8 text: " + e.getMessage());
    }
  }

  private LoadedModule deserializeLegacy() {
    if (legacySupport == LegacySupport.DISABLED) {
      throw new UnsupportedFormatException("Legacy model format is not supported by this build (" +
          LegacySupport.PROPERTY + "=" + legacySupport + ")");
    }
    final var importer = context.legacyImporter().orElseThrow(() ->
        new UnsupportedFormatException("Container uses the legacy model format but no legacy importer is configured"));
    LOGGER.warning(() -> "Container has a " + LEGACY_MARKER + " record, delegating to the legacy importer");
    return importer.importLegacy(archive, deviceOverride);
  }

  private LoadedModule deserializeCurrent() {
    final var constants = readArchive(CONSTANTS_ARCHIVE);
    if (!(constants instanceof TaggedValue.Sequence sequence)) {
      throw new MalformedArchiveException(CONSTANTS_ARCHIVE,
          "root value must be a sequence of tensors but was " + constants.variantName());
    }
    for (int i = 0; i < sequence.size(); i++) {
      if (!(sequence.get(i) instanceof TaggedValue.TensorRef tensor)) {
        throw new MalformedArchiveException(CONSTANTS_ARCHIVE,
            "constant " + i + " must be a tensor but was " + sequence.get(i).variantName());
      }
      constantsTable.add(tensor.tensor());
    }

    final var data = readArchive(DATA_ARCHIVE);
    if (!(data instanceof TaggedValue.ObjectRef root)) {
      throw new MalformedArchiveException(DATA_ARCHIVE, "root value must be an object but was " + data.variantName());
    }
    LOGGER.info(() -> "Loaded " + root.instance().type().qualifiedName() + " with " + constantsTable.size() +
        " constants and " + types.loadedTypes().size() + " types");
    return new LoadedModule(root.instance(), constantsTable, types);
  }

  /// Decodes `<name>.pkl`; auxiliary records it refers to are read from `<name>/`.
  private TaggedValue readArchive(String archiveName) {
    final var stream = archive.getRecord(archiveName + STREAM_SUFFIX);
    LOGGER.fine(() -> "Reading archive " + archiveName + " (" + stream.remaining() + " bytes)");
    final var unpickler = new Unpickler(
        archiveName,
        new RecordByteSource(stream),
        types,
        new ObjectConstructor(archiveName),
        archive,
        context.tensorMaterializer(),
        deviceOverride);
    return unpickler.parse();
  }
}
