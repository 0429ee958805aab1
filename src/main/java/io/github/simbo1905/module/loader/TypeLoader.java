// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

/// Produces the descriptor of a user type on first use. How the descriptor is built, for example by compiling
/// source text found through the [SourceLookup], is up to the implementation.
@FunctionalInterface
public interface TypeLoader {

  /// @return the descriptor, never null; throwing or returning null makes the load fail
  TypeDescriptor load(String qualifiedName, SourceLookup sources);
}
