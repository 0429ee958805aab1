// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/// Writes zip containers for tests, by default with every record under a `model/` directory.
final class ContainerBuilder {
  private final String directory;
  private final Map<String, byte[]> records = new LinkedHashMap<>();

  private ContainerBuilder(String directory) {
    this.directory = directory;
  }

  static ContainerBuilder container() {
    return new ContainerBuilder("model");
  }

  static ContainerBuilder withoutDirectory() {
    return new ContainerBuilder("");
  }

  ContainerBuilder record(String name, byte[] bytes) {
    records.put(name, bytes);
    return this;
  }

  ContainerBuilder record(String name, PickleWriter stream) {
    return record(name, stream.bytes());
  }

  ContainerBuilder text(String name, String text) {
    return record(name, text.getBytes(StandardCharsets.UTF_8));
  }

  /// A `constants.pkl` holding an empty tuple
  ContainerBuilder noConstants() {
    return record("constants.pkl", PickleWriter.stream().emptyTuple().stop());
  }

  byte[] bytes() {
    final var buffer = new ByteArrayOutputStream();
    try (var zip = new ZipOutputStream(buffer, StandardCharsets.UTF_8)) {
      for (var entry : records.entrySet()) {
        zip.putNextEntry(new ZipEntry(directory.isEmpty() ? entry.getKey() : directory + "/" + entry.getKey()));
        zip.write(entry.getValue());
        zip.closeEntry();
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return buffer.toByteArray();
  }

  ZipArchiveReader open() {
    return ZipArchiveReader.open(bytes());
  }
}
