// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// Binds a qualified type name met in the stream to its descriptor.
@FunctionalInterface
public interface TypeResolver {

  /// @throws UnresolvedTypeException if no descriptor can be produced for the name
  TypeDescriptor resolve(String qualifiedName);
}
