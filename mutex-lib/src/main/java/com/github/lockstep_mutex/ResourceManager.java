// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.MutexMessage;
import com.github.lockstep_mutex.msg.Release;
import com.github.lockstep_mutex.msg.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.stream.Collectors;

import static com.github.lockstep_mutex.ErrorStrings.CLOSED;
import static com.github.lockstep_mutex.MutexLogger.LOGGER;

/// A ResourceManager is the agent at one site of a group that grants first-come-first-served exclusive access to a
/// single logical resource without any central arbiter. It handles:
/// - Forwarding local requests and releases as broadcasts
/// - Applying local and remote releases to its queue
/// - Merging the requests of a tick into its queue in ascending peer order
/// - Granting the local client when its own id becomes the head
/// Does NOT handle:
/// - Thread safety (managed by [ResourceManagerEngine])
/// - Delivering broadcasts (handled by the host's fabric)
///
/// No agent ever reads the state of another. Every agent holds its own [RequestQueue] and applies the same
/// deterministic [Phase#ORDER] to the same per-tick batch of events. That is what keeps every queue identical
/// after every tick. It relies on a fabric that delivers every broadcast of a tick to every other agent within
/// that same tick. If the fabric cannot do that the queues may diverge and nothing in here can detect it.
///
/// Protocol violations are logged to JUL as warnings, dropped, and returned in [TickResult#violations()]. They
/// never stop the agent. This class is not thread safe.
public class ResourceManager {

  /// We log when we grant.
  private final Level logAtLevel;

  final MutexConfig config;

  final RequestQueue queue;

  /// The last tick that was reconciled.
  long lastTick = Long.MIN_VALUE;

  /// Granted and not yet released.
  boolean holding = false;

  /// Local requests that were admitted to the queue. Redundant or rejected ones are not counted.
  long requestsAdmitted = 0;

  long grantsIssued = 0;

  volatile private boolean closed = false;

  /// @param logAtLevel The level to log grants and releases of the local client.
  /// @param config     The identity of this agent and the size of the group.
  public ResourceManager(Level logAtLevel, MutexConfig config) {
    this.logAtLevel = Objects.requireNonNull(logAtLevel, "logAtLevel");
    this.config = Objects.requireNonNull(config, "config");
    this.queue = new RequestQueue(config.peerCount());
  }

  public ResourceManager(MutexConfig config) {
    this(Level.INFO, config);
  }

  /// The scratch state of a single reconciliation. It does not outlive the tick.
  private static final class Reconciliation {
    final TickEvents events;
    final List<MutexMessage> broadcasts = new ArrayList<>();
    final List<ProtocolViolation> violations = new ArrayList<>();
    boolean releaseApplied = false;
    boolean localRequestAdmitted = false;
    boolean grant = false;

    Reconciliation(TickEvents events) {
      this.events = events;
    }

    long tick() {
      return events.tick();
    }
  }

  /// Reconcile one tick by running every [Phase] in [Phase#ORDER]. Nothing is observable by another agent until
  /// this method returns.
  ///
  /// @param events The local signals and the remote broadcasts of this tick.
  /// @return The grant, the broadcasts to hand to the fabric and any violations that were absorbed.
  /// @throws IllegalArgumentException if the tick is not after the last reconciled tick.
  public TickResult reconcile(TickEvents events) {
    Objects.requireNonNull(events, "events");
    if (closed) {
      LOGGER.warning(() -> CLOSED + config.name() + " tick=" + events.tick());
      return TickResult.noResult(events.tick());
    }
    if (events.tick() <= lastTick) {
      throw new IllegalArgumentException("tick=" + events.tick() + " is not after lastTick=" + lastTick);
    }
    lastTick = events.tick();
    LOGGER.finer(() -> config.name() + " <~ " + events);
    final var reconciliation = new Reconciliation(events);
    for (Phase phase : Phase.ORDER) {
      run(phase, reconciliation);
    }
    LOGGER.fine(() -> config.name() + " tick=" + events.tick() + " " + queue
        + (reconciliation.grant ? " GRANT" : ""));
    return new TickResult(events.tick(), reconciliation.grant, reconciliation.broadcasts, reconciliation.violations);
  }

  /// The broadcasts that the first two phases would emit for these local signals given the current queue. The queue
  /// is not changed. A host uses this to hand the broadcasts of a tick to the fabric before it has collected the
  /// broadcasts of the other agents for the same tick. [#reconcile(TickEvents)] will emit exactly these.
  public List<MutexMessage> announce(boolean localRequest, boolean localRelease) {
    if (closed) {
      return List.of();
    }
    final var broadcasts = new ArrayList<MutexMessage>(2);
    if (localRequest) {
      broadcasts.add(new Request(config.id()));
    }
    if (localRelease && queue.isHead(config.id())) {
      broadcasts.add(new Release(config.id()));
    }
    return List.copyOf(broadcasts);
  }

  void run(Phase phase, Reconciliation r) {
    switch (phase) {
      case FORWARD_LOCAL_REQUEST -> forwardLocalRequest(r);
      case APPLY_LOCAL_RELEASE -> applyLocalRelease(r);
      case APPLY_REMOTE_RELEASES -> applyRemoteReleases(r);
      case MERGE_REQUESTS -> mergeRequests(r);
    }
  }

  private void forwardLocalRequest(Reconciliation r) {
    if (r.events.localRequest()) {
      r.broadcasts.add(new Request(config.id()));
    }
  }

  private void applyLocalRelease(Reconciliation r) {
    if (!r.events.localRelease()) {
      return;
    }
    if (queue.isHead(config.id())) {
      queue.pop();
      holding = false;
      r.releaseApplied = true;
      r.broadcasts.add(new Release(config.id()));
      LOGGER.log(logAtLevel, () -> config.name() + " RELEASE tick=" + r.tick());
    } else {
      violation(r, new ProtocolViolation.ReleaseWithoutHold(r.tick(), config.id(), queue.peekHead()));
    }
  }

  private void applyRemoteReleases(Reconciliation r) {
    for (Release release : r.events.remoteReleases()) {
      final int holder = release.from();
      if (isSelf(holder, release)) {
        continue;
      }
      if (r.releaseApplied) {
        violation(r, new ProtocolViolation.MultipleSimultaneousReleases(r.tick(), holder));
        continue;
      }
      if (queue.isHead(holder)) {
        queue.pop();
        r.releaseApplied = true;
        if (queue.isHead(config.id())) {
          grant(r);
        }
      } else {
        violation(r, new ProtocolViolation.ReleaseWithoutHold(r.tick(), holder, queue.peekHead()));
      }
    }
  }

  private void mergeRequests(Reconciliation r) {
    final var batch = new ArrayList<Integer>();
    for (Request request : r.events.remoteRequests()) {
      if (!isSelf(request.from(), request)) {
        batch.add(request.from());
      }
    }
    if (r.events.localRequest()) {
      batch.add(config.id());
    }
    // the tie-break for requests made in the same tick
    batch.sort(null);
    for (int peer : batch) {
      switch (queue.push(peer)) {
        case ADMITTED -> {
          if (peer == config.id()) {
            requestsAdmitted++;
            r.localRequestAdmitted = true;
          }
        }
        case REDUNDANT -> violation(r, new ProtocolViolation.RedundantRequest(r.tick(), peer));
        case QUEUE_FULL -> violation(r, new ProtocolViolation.QueueFull(r.tick(), peer, queue.capacity()));
      }
    }
    // a redundant local request must not grant a second time
    if (r.localRequestAdmitted && queue.isHead(config.id())) {
      grant(r);
    }
  }

  private void grant(Reconciliation r) {
    assert !holding : config.name() + " granted twice without a release";
    holding = true;
    grantsIssued++;
    r.grant = true;
    LOGGER.log(logAtLevel, () -> config.name() + " GRANT tick=" + r.tick());
  }

  /// The fabric should never hand us our own broadcasts as we act on our own signals directly.
  private boolean isSelf(int peer, MutexMessage message) {
    if (peer == config.id()) {
      LOGGER.finer(() -> config.name() + " dropping own message " + message);
      return true;
    }
    return false;
  }

  private void violation(Reconciliation r, ProtocolViolation violation) {
    r.violations.add(violation);
    LOGGER.warning(() -> config.name() + " protocol violation " + violation);
  }

  /// Mark this manager as closed and report how many locally issued requests were never granted. Any further tick
  /// is ignored with a warning.
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    final long outstanding = outstandingRequests();
    LOGGER.info(() -> config.name() + " closing with " + outstanding + " outstanding request(s) never granted. queue="
        + queue.snapshot().stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]")));
  }

  public boolean isClosed() {
    return closed;
  }

  /// @return the number of locally issued requests that are queued and not yet granted. Never more than one.
  public long outstandingRequests() {
    return requestsAdmitted - grantsIssued;
  }

  public boolean isHolding() {
    return holding;
  }

  public OptionalInt queueHead() {
    return queue.peekHead();
  }

  /// @return the queue from head to tail. Every agent returns the same list after the same tick.
  public List<Integer> queueSnapshot() {
    return queue.snapshot();
  }

  public MutexConfig config() {
    return config;
  }

  public int id() {
    return config.id();
  }

  public long lastTick() {
    return lastTick;
  }
}
