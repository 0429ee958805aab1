// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipInputStream;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Container backed by a zip file. Writers place every record under a single top level directory
/// (its name is arbitrary, usually the model name); record names handed to [#getRecord] are relative
/// to that directory. A zip written without the enclosing directory is read as-is.
///
/// All entries are read into memory when the reader is opened. Files on disk are read through their central
/// directory; streams and adapters are read entry by entry. Duplicate entry names are rejected.
public final class ZipArchiveReader implements ArchiveReader {
  static final int MIN_VERSION = 1;
  static final int MAX_VERSION = 2;
  static final String VERSION_RECORD = "version";

  /// Top level names that are record groups of the layout and never the enclosing directory
  private static final Set<String> RECORD_GROUPS = Set.of("code", "constants", "data", "extra");

  private final String directory;
  private final Map<String, byte[]> records;

  private ZipArchiveReader(String directory, Map<String, byte[]> records) {
    this.directory = directory;
    this.records = Map.copyOf(records);
  }

  public static ZipArchiveReader open(Path path) {
    Objects.requireNonNull(path, "path must not be null");
    try (ZipFile zip = new ZipFile(path.toFile(), StandardCharsets.UTF_8)) {
      final var raw = new LinkedHashMap<String, byte[]>();
      final var entries = zip.entries();
      while (entries.hasMoreElements()) {
        final var entry = entries.nextElement();
        if (!entry.isDirectory()) {
          try (InputStream in = zip.getInputStream(entry)) {
            addEntry(raw, entry.getName(), in.readAllBytes(), path.toString());
          }
        }
      }
      return fromEntries(raw, path.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open container " + path, e);
    }
  }

  /// The stream is consumed to its end but not closed.
  public static ZipArchiveReader open(InputStream in) {
    Objects.requireNonNull(in, "input stream must not be null");
    try {
      return read(in, "<stream>");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read container from stream", e);
    }
  }

  public static ZipArchiveReader open(byte[] bytes) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    return open(new ByteArrayInputStream(bytes));
  }

  public static ZipArchiveReader open(ReadAdapter adapter) {
    Objects.requireNonNull(adapter, "adapter must not be null");
    try (InputStream in = adapter.asInputStream()) {
      return read(in, "<adapter>");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read container from adapter", e);
    }
  }

  private static ZipArchiveReader read(InputStream in, String source) throws IOException {
    final var raw = new LinkedHashMap<String, byte[]>();
    final var zip = new ZipInputStream(in, StandardCharsets.UTF_8);
    ZipEntry entry;
    while ((entry = zip.getNextEntry()) != null) {
      if (!entry.isDirectory()) {
        addEntry(raw, entry.getName(), zip.readAllBytes(), source);
      }
      zip.closeEntry();
    }
    return fromEntries(raw, source);
  }

  private static void addEntry(Map<String, byte[]> raw, String name, byte[] bytes, String source) {
    if (raw.putIfAbsent(name, bytes) != null) {
      throw new MalformedArchiveException(source, "duplicate zip entry '" + name + "'");
    }
  }

  private static ZipArchiveReader fromEntries(Map<String, byte[]> raw, String source) {
    final var directory = enclosingDirectory(raw.keySet());
    final var records = new LinkedHashMap<String, byte[]>();
    raw.forEach((name, bytes) -> records.put(directory.isEmpty() ? name : name.substring(directory.length() + 1), bytes));
    LOGGER.fine(() -> "Opened container " + source + " with " + records.size() + " records" +
        (directory.isEmpty() ? "" : " under directory '" + directory + "'"));
    final var reader = new ZipArchiveReader(directory, records);
    reader.checkVersion();
    return reader;
  }

  /// @return the shared first path segment of every entry, or the empty string when there is none
  static String enclosingDirectory(Set<String> names) {
    String candidate = null;
    for (String name : names) {
      final int slash = name.indexOf('/');
      if (slash <= 0) {
        return "";
      }
      final var first = name.substring(0, slash);
      if (candidate == null) {
        candidate = first;
      } else if (!candidate.equals(first)) {
        return "";
      }
    }
    if (candidate == null || RECORD_GROUPS.contains(candidate)) {
      return "";
    }
    return candidate;
  }

  private void checkVersion() {
    if (!hasRecord(VERSION_RECORD)) {
      return;
    }
    final var text = new String(records.get(VERSION_RECORD), StandardCharsets.UTF_8).trim();
    final int version;
    try {
      version = Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new UnsupportedFormatException("Container version record is not a number: '" + text + "'");
    }
    if (version < MIN_VERSION || version > MAX_VERSION) {
      throw new UnsupportedFormatException("Container format version " + version +
          " is not supported, expected a version between " + MIN_VERSION + " and " + MAX_VERSION);
    }
    LOGGER.finer(() -> "Container format version " + version);
  }

  /// @return the name of the enclosing directory, empty when records sit at the root of the zip
  public String directory() {
    return directory;
  }

  @Override
  public ByteBuffer getRecord(String name) {
    final var bytes = records.get(name);
    if (bytes == null) {
      throw new RecordNotFoundException(name);
    }
    return ByteBuffer.wrap(bytes).asReadOnlyBuffer();
  }

  @Override
  public boolean hasRecord(String name) {
    return records.containsKey(name);
  }

  @Override
  public Set<String> recordNames() {
    return records.keySet();
  }
}
