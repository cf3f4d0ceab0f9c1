// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.Release;
import com.github.lockstep_mutex.msg.Request;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResourceManagerEngineTests {

  @BeforeAll
  static void setupLogging() {
    LoggerConfig.initialize();
  }

  final List<Long> grants = Collections.synchronizedList(new ArrayList<>());

  ResourceManagerEngine engine(int id, int peerCount) {
    return new ResourceManagerEngine(new ResourceManager(new MutexConfig(id, peerCount)), grants::add);
  }

  @Test
  public void testLocalSignalsAreLatchedUntilNextTick() {
    try (final var engine = engine(0, 2)) {
      engine.requestLocal();
      engine.requestLocal();

      assertThat(engine.announce(1)).containsExactly(new Request(0));
      final var result = engine.reconcile(1, List.of());

      assertThat(result.grant()).isTrue();
      assertThat(grants).containsExactly(1L);

      // the latch was consumed
      assertThat(engine.announce(2)).isEmpty();
      assertThat(engine.reconcile(2, List.of()).broadcasts()).isEmpty();
    }
  }

  @Test
  public void testGrantUpCallFollowsRemoteRelease() {
    try (final var engine = engine(1, 2)) {
      engine.requestLocal();
      engine.announce(1);
      engine.reconcile(1, List.of(new Request(0)));
      assertThat(grants).isEmpty();

      engine.announce(2);
      final var result = engine.reconcile(2, List.of(new Release(0)));

      assertThat(result.grant()).isTrue();
      assertThat(grants).containsExactly(2L);
      assertThat(engine.resourceManager().queueSnapshot()).containsExactly(1);

      engine.releaseLocal();
      assertThat(engine.announce(3)).containsExactly(new Release(1));
      engine.reconcile(3, List.of());
      assertThat(engine.resourceManager().queueSnapshot()).isEmpty();
    }
  }

  @Test
  public void testReconcileRequiresAnnounceOfSameTick() {
    try (final var engine = engine(0, 2)) {
      assertThatThrownBy(() -> engine.reconcile(1, List.of())).isInstanceOf(IllegalStateException.class);

      engine.announce(1);
      assertThatThrownBy(() -> engine.announce(2)).isInstanceOf(IllegalStateException.class);
      assertThatThrownBy(() -> engine.reconcile(2, List.of())).isInstanceOf(IllegalStateException.class);

      // the announced tick can still be reconciled
      assertThat(engine.reconcile(1, List.of()).tick()).isEqualTo(1);
    }
  }

  @Test
  public void testStaleTickKeepsPendingRequest() {
    try (final var engine = engine(0, 2)) {
      engine.announce(5);
      engine.reconcile(5, List.of());

      engine.requestLocal();
      assertThatThrownBy(() -> engine.announce(5)).isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> engine.announce(4)).isInstanceOf(IllegalArgumentException.class);

      // the request is still latched for the next good tick
      assertThat(engine.announce(6)).containsExactly(new Request(0));
      assertThat(engine.reconcile(6, List.of()).grant()).isTrue();
      assertThat(grants).containsExactly(6L);
    }
  }

  @Test
  public void testCloseReportsOutstandingRequests() {
    final var engine = engine(1, 2);
    engine.requestLocal();
    engine.announce(1);
    engine.reconcile(1, List.of(new Request(0)));

    engine.close();

    assertThat(engine.isClosed()).isTrue();
    assertThat(engine.outstandingRequests()).isEqualTo(1);
    engine.requestLocal();
    assertThat(engine.announce(2)).isEmpty();
    assertThat(engine.reconcile(2, List.of(new Release(0))).grant()).isFalse();
    assertThat(grants).isEmpty();
  }

  @Test
  public void testInterruptedWhileWaitingClosesEngine() {
    final var engine = engine(0, 2);
    engine.requestLocal();
    Thread.currentThread().interrupt();
    try {
      assertThat(engine.announce(1)).isEmpty();
      assertThat(engine.isClosed()).isTrue();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      //noinspection ResultOfMethodCallIgnored
      Thread.interrupted();
    }
  }

  @Test
  public void testClientThreadsSignalWhileTicking() throws Exception {
    final var peerCount = 2;
    final var engines = List.of(engine(0, peerCount), engine(1, peerCount));
    final var running = new AtomicBoolean(true);
    final var started = new CountDownLatch(peerCount);
    final ExecutorService clients = Executors.newFixedThreadPool(peerCount);
    try {
      engines.forEach(engine -> clients.submit(() -> {
        started.countDown();
        while (running.get()) {
          engine.requestLocal();
          engine.releaseLocal();
        }
      }));
      assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

      for (long tick = 1; tick <= 200; tick++) {
        final var a0 = engines.get(0).announce(tick);
        final var a1 = engines.get(1).announce(tick);
        // at most one request and one release each per tick however often the client signals
        assertThat(a0).hasSizeLessThanOrEqualTo(2).doesNotHaveDuplicates();
        assertThat(a1).hasSizeLessThanOrEqualTo(2).doesNotHaveDuplicates();
        engines.get(0).reconcile(tick, a1);
        engines.get(1).reconcile(tick, a0);
        assertThat(engines.get(0).resourceManager().queueSnapshot())
            .isEqualTo(engines.get(1).resourceManager().queueSnapshot());
      }
    } finally {
      running.set(false);
      clients.shutdown();
      assertThat(clients.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
      engines.forEach(ResourceManagerEngine::close);
    }
    assertThat(grants).isNotEmpty();
  }
}
