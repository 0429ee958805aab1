// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.module.loader;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClassResolverTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void testSameDescriptorForEveryLookup() {
    final var types = new TestTypes().add(TestTypes.node());
    final var resolver = new ClassResolver(types, SourceLookup.NONE);
    final var name = TestTypes.qualified("Node");

    final var first = resolver.resolve(name);
    final var second = resolver.resolve(name);

    assertThat(second).isSameAs(first);
    assertThat(types.loadCount(name)).isEqualTo(1);
    assertThat(resolver.find(name)).containsSame(first);
    assertThat(resolver.loadedTypes()).containsOnlyKeys(name);
  }

  @Test
  void testConcurrentCallersShareOneLoad() throws Exception {
    final var types = new TestTypes().add(TestTypes.linear());
    final var resolver = new ClassResolver(types, SourceLookup.NONE);
    final var name = TestTypes.qualified("Linear");
    final int callers = 8;
    final var start = new CountDownLatch(1);
    final ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      final List<Future<TypeDescriptor>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(pool.submit(() -> {
          start.await();
          return resolver.resolve(name);
        }));
      }
      start.countDown();
      final var expected = results.get(0).get(5, TimeUnit.SECONDS);
      for (var result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(expected);
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(types.loadCount(name)).isEqualTo(1);
  }

  @Test
  void testUnknownNameFails() {
    final var resolver = new ClassResolver(new TestTypes(), SourceLookup.NONE);
    assertThatThrownBy(() -> resolver.resolve("__torch__.Ghost"))
        .isInstanceOfSatisfying(UnresolvedTypeException.class,
            e -> assertThat(e.typeName()).isEqualTo("__torch__.Ghost"))
        .hasMessageContaining("returned no descriptor");
    assertThat(resolver.find("__torch__.Ghost")).isEmpty();
  }

  @Test
  void testLoaderFailureIsWrapped() {
    final var failure = new IllegalStateException("syntax error in code/__torch__.py");
    final var resolver = new ClassResolver((name, sources) -> {
      throw failure;
    }, SourceLookup.NONE);

    assertThatThrownBy(() -> resolver.resolve("__torch__.Net"))
        .isInstanceOf(UnresolvedTypeException.class)
        .hasCause(failure)
        .hasMessageContaining("syntax error");
  }

  @Test
  void testDescriptorMustMatchRequestedName() {
    final var resolver = new ClassResolver((name, sources) -> TestTypes.node(), SourceLookup.NONE);
    assertThatThrownBy(() -> resolver.resolve("__torch__.Other"))
        .isInstanceOf(UnresolvedTypeException.class)
        .hasMessageContaining("descriptor for '__torch__.Node'");
  }

  @Test
  void testLoaderSeesSourceLookup() {
    final var archive = ContainerBuilder.container().text("code/__torch__/models.py", "class Net: ...").open();
    final var seen = new ArrayList<String>();
    final var resolver = new ClassResolver((name, sources) -> {
      sources.findSource(name).ifPresent(seen::add);
      return TypeDescriptor.withFields(name, List.of());
    }, SourceLookup.inArchive(archive));

    resolver.resolve("__torch__.models.Net");

    assertThat(seen).containsExactly("class Net: ...");
  }
}
