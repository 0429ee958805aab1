// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import java.util.concurrent.atomic.AtomicInteger;

import static io.github.simbo1905.module.loader.ModuleLoader.LOGGER;

/// Process wide switch that allows the execution layer to specialise a type once its instances are stable.
/// It must be off while a restoration method runs, as the instance it sees is still partially initialised.
/// Loads may run concurrently, so the switch is a count of open suspensions rather than a flag: it is on
/// only when no [Guard] is open, whatever order guards are closed in.
public final class GraphOptimization {
  private static final AtomicInteger SUSPENSIONS = new AtomicInteger();

  private GraphOptimization() {
  }

  public static boolean isEnabled() {
    return SUSPENSIONS.get() == 0;
  }

  /// Turns specialisation off until the returned guard is closed.
  /// Use with try-with-resources; guards from any thread may overlap.
  public static Guard suspend() {
    final int depth = SUSPENSIONS.incrementAndGet();
    LOGGER.finer(() -> "Graph optimization suspended, depth " + depth);
    return new Guard();
  }

  public static final class Guard implements AutoCloseable {
    private boolean closed;

    private Guard() {
    }

    /// Releases this suspension; closing twice has no further effect.
    @Override
    public void close() {
      if (!closed) {
        closed = true;
        final int depth = SUSPENSIONS.decrementAndGet();
        LOGGER.finer(() -> "Graph optimization suspension released, depth " + depth);
      }
    }
  }
}
