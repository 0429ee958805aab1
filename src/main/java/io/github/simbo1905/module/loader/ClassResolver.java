// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Session scoped [TypeResolver] that loads each name at most once and hands out the same descriptor afterwards.
/// It is the type binding context of a [LoadedModule].
public final class ClassResolver implements TypeResolver {
  private final TypeLoader loader;
  private final SourceLookup sources;
  private final Map<String, TypeDescriptor> loaded = new ConcurrentHashMap<>();

  public ClassResolver(TypeLoader loader, SourceLookup sources) {
    this.loader = Objects.requireNonNull(loader, "loader must not be null");
    this.sources = Objects.requireNonNull(sources, "sources must not be null");
  }

  @Override
  public TypeDescriptor resolve(String qualifiedName) {
    Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
    // computeIfAbsent runs the loader at most once per name, even with concurrent callers
    return loaded.computeIfAbsent(qualifiedName, this::load);
  }

  private TypeDescriptor load(String qualifiedName) {
    LOGGER.fine(() -> "Loading type " + qualifiedName);
    final TypeDescriptor descriptor;
    try {
      descriptor = loader.load(qualifiedName, sources);
    } catch (UnresolvedTypeException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new UnresolvedTypeException(qualifiedName, e);
    }
    if (descriptor == null) {
      throw new UnresolvedTypeException(qualifiedName, "the type loader returned no descriptor");
    }
    if (!descriptor.qualifiedName().equals(qualifiedName)) {
      throw new UnresolvedTypeException(qualifiedName,
          "the type loader returned a descriptor for '" + descriptor.qualifiedName() + "'");
    }
    LOGGER.finer(() -> "Loaded " + descriptor);
    return descriptor;
  }

  public Optional<TypeDescriptor> find(String qualifiedName) {
    return Optional.ofNullable(loaded.get(qualifiedName));
  }

  /// @return read-only view of every type loaded so far
  public Map<String, TypeDescriptor> loadedTypes() {
    return Collections.unmodifiableMap(loaded);
  }
}
