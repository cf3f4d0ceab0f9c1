// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.MutexMessage;
import org.jetbrains.annotations.TestOnly;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongConsumer;

import static com.github.lockstep_mutex.ErrorStrings.INTERRUPTED;
import static com.github.lockstep_mutex.MutexLogger.LOGGER;

/// Manages thread safety and coordinates between the co-located client, the host's broadcast fabric and the
/// [ResourceManager]. Ensures:
/// - Single-threaded access to the ResourceManager via a mutex
/// - Local signals raised by client threads at any time are applied in the next tick
/// - The grant up-call to the client is made while the mutex is held
///
/// The fabric must deliver the broadcasts of a tick to every other agent within that same tick. So a tick is two
/// calls. First [#announce(long)] returns the broadcasts of this agent for the tick which the host hands to the
/// fabric. Then, once the fabric has gathered the broadcasts of every other agent for the tick,
/// [#reconcile(long, List)] runs the full reconciliation.
///
/// It is closable to use try-with-resources so that the outstanding-request report is logged on shutdown.
public class ResourceManagerEngine implements AutoCloseable {
  /// The underlying ResourceManager guarded by this class.
  final protected ResourceManager resourceManager;

  /// The callback to the host application to tell the local client that it now holds the resource.
  final protected LongConsumer grantUpCallUnderMutex;

  /// The Semaphore acts as a mutex with non-reentrant locking.
  private final Semaphore mutex = new Semaphore(1);

  private final AtomicBoolean localRequest = new AtomicBoolean(false);

  private final AtomicBoolean localRelease = new AtomicBoolean(false);

  /// The local signals consumed by the last announce that have not yet been reconciled. Guarded by the mutex.
  private Announced announced = null;

  private record Announced(long tick, boolean localRequest, boolean localRelease) {
  }

  public ResourceManagerEngine(ResourceManager resourceManager, LongConsumer grantUpCall) {
    this.resourceManager = Objects.requireNonNull(resourceManager, "resourceManager");
    this.grantUpCallUnderMutex = Objects.requireNonNull(grantUpCall, "grantUpCall");
  }

  /// Called by the client to ask for the resource. It will be forwarded in the next tick.
  public void requestLocal() {
    if (localRequest.getAndSet(true)) {
      LOGGER.fine(() -> resourceManager.config().name() + " request already pending for the next tick");
    }
  }

  /// Called by the client to give up the resource. It will be applied in the next tick.
  public void releaseLocal() {
    if (localRelease.getAndSet(true)) {
      LOGGER.fine(() -> resourceManager.config().name() + " release already pending for the next tick");
    }
  }

  /// Consume the pending local signals for this tick and return the broadcasts that they produce. The host must
  /// hand these to the fabric.
  ///
  /// @throws IllegalStateException    if the previous announced tick has not been reconciled.
  /// @throws IllegalArgumentException if the tick is not after the last reconciled tick. The pending local signals
  ///                                  are kept for a later tick.
  public List<MutexMessage> announce(long tick) {
    if (!acquire()) {
      return List.of();
    }
    try {
      if (announced != null) {
        throw new IllegalStateException("tick=" + announced.tick() + " was announced but not reconciled");
      }
      if (tick <= resourceManager.lastTick()) {
        throw new IllegalArgumentException("tick=" + tick + " is not after lastTick=" + resourceManager.lastTick());
      }
      final var pending = new Announced(tick, localRequest.getAndSet(false), localRelease.getAndSet(false));
      announced = pending;
      return resourceManager.announce(pending.localRequest(), pending.localRelease());
    } finally {
      mutex.release();
    }
  }

  /// The main entry point to reconcile a tick. This method is thread safe and allows only one thread at a time.
  ///
  /// 1. The local signals consumed by [#announce(long)] for this tick are combined with the remote broadcasts.
  /// 2. The [ResourceManager] runs all of its phases.
  /// 3. While the mutex is held the [#grantUpCallUnderMutex] is called if the local client was granted.
  /// 4. The mutex will be released.
  ///
  /// @param tick   The tick that was announced.
  /// @param remote The broadcasts of the other agents for this tick in any order.
  /// @return The result of the tick. Its broadcasts are the ones that were announced.
  /// @throws IllegalStateException if this tick was not announced.
  public TickResult reconcile(long tick, List<? extends MutexMessage> remote) {
    Objects.requireNonNull(remote, "remote");
    if (!acquire()) {
      return TickResult.noResult(tick);
    }
    try {
      final var pending = announced;
      if (pending == null || pending.tick() != tick) {
        throw new IllegalStateException("tick=" + tick + " was not announced. announced=" + pending);
      }
      announced = null;
      final var events = TickEvents.of(tick, pending.localRequest(), pending.localRelease(), remote);
      final var result = resourceManager.reconcile(events);
      if (result.grant()) {
        grantUpCallUnderMutex.accept(tick);
      }
      return result;
    } finally {
      mutex.release();
    }
  }

  private boolean acquire() {
    try {
      mutex.acquire();
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warning(INTERRUPTED + resourceManager.config().name());
      resourceManager.close();
      return false;
    }
  }

  @Override
  public void close() {
    LOGGER.info(() -> "Closing ResourceManagerEngine " + resourceManager.config().name());
    resourceManager.close();
  }

  public boolean isClosed() {
    return resourceManager.isClosed();
  }

  public int id() {
    return resourceManager.id();
  }

  public long outstandingRequests() {
    return resourceManager.outstandingRequests();
  }

  @TestOnly
  public ResourceManager resourceManager() {
    return resourceManager;
  }
}
