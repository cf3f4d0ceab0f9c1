// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.MutexMessage;
import com.github.lockstep_mutex.msg.Release;
import com.github.lockstep_mutex.msg.Request;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// Everything a [ResourceManager] observes during one logical tick. The fabric may hand over the remote messages in
/// whatever order its wiring produces. They are put into ascending peer order here so that the merge never depends
/// on how the fabric indexed its inputs.
///
/// @param tick           The logical tick. Ticks must strictly increase from one reconciliation to the next.
/// @param localRequest   The co-located client asked for the resource this tick.
/// @param localRelease   The co-located client gave up the resource this tick.
/// @param remoteRequests Requests broadcast by other agents this tick in ascending peer order.
/// @param remoteReleases Releases broadcast by other agents this tick in ascending peer order.
public record TickEvents(
    long tick,
    boolean localRequest,
    boolean localRelease,
    List<Request> remoteRequests,
    List<Release> remoteReleases
) {
  public TickEvents {
    remoteRequests = inPeerOrder(remoteRequests);
    remoteReleases = inPeerOrder(remoteReleases);
  }

  /// Partition a flat batch of delivered messages into requests and releases.
  public static TickEvents of(long tick, boolean localRequest, boolean localRelease,
                              Collection<? extends MutexMessage> remote) {
    Objects.requireNonNull(remote, "remote");
    final var requests = new ArrayList<Request>();
    final var releases = new ArrayList<Release>();
    for (MutexMessage message : remote) {
      Objects.requireNonNull(message, "message");
      if (message instanceof Request request) {
        requests.add(request);
      } else {
        releases.add((Release) message);
      }
    }
    return new TickEvents(tick, localRequest, localRelease, requests, releases);
  }

  public static TickEvents local(long tick, boolean localRequest, boolean localRelease) {
    return new TickEvents(tick, localRequest, localRelease, List.of(), List.of());
  }

  public static TickEvents remote(long tick, Collection<? extends MutexMessage> remote) {
    return of(tick, false, false, remote);
  }

  // stable so that a peer listed twice keeps its relative order
  private static <T extends MutexMessage> List<T> inPeerOrder(List<T> messages) {
    Objects.requireNonNull(messages, "messages");
    return messages.stream()
        .map(m -> Objects.requireNonNull(m, "message"))
        .sorted(Comparator.comparingInt(MutexMessage::from))
        .toList();
  }
}
