// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/// Finds the source text that defines a qualified type name inside the container.
@FunctionalInterface
public interface SourceLookup {
  String CODE_PREFIX = "code/";

  Optional<String> findSource(String qualifiedName);

  SourceLookup NONE = qualifiedName -> Optional.empty();

  /// Looks for `code/a/b.py` for the name `a.b.C`, the module that declares the type, then for `code/a/b/C.py`.
  static SourceLookup inArchive(ArchiveReader archive) {
    Objects.requireNonNull(archive, "archive must not be null");
    return qualifiedName -> {
      final var path = qualifiedName.replace('.', '/');
      final int lastSlash = path.lastIndexOf('/');
      if (lastSlash > 0) {
        final var moduleRecord = CODE_PREFIX + path.substring(0, lastSlash) + ".py";
        if (archive.hasRecord(moduleRecord)) {
          return Optional.of(text(archive, moduleRecord));
        }
      }
      final var typeRecord = CODE_PREFIX + path + ".py";
      return archive.hasRecord(typeRecord) ? Optional.of(text(archive, typeRecord)) : Optional.empty();
    };
  }

  private static String text(ArchiveReader archive, String record) {
    return StandardCharsets.UTF_8.decode(archive.getRecord(record)).toString();
  }
}
