// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.MutexMessage;

import java.util.List;

/// The result of reconciling one tick. The broadcasts must be handed to the fabric for delivery to every other agent
/// and the grant, if raised, must be passed to the co-located client.
///
/// @param tick       The tick that was reconciled.
/// @param grant      The local client now holds the resource.
/// @param broadcasts A possibly empty list of request and release messages in the order they were emitted.
/// @param violations A possibly empty list of protocol violations that were logged and absorbed.
public record TickResult(
    long tick,
    boolean grant,
    List<MutexMessage> broadcasts,
    List<ProtocolViolation> violations
) {
  public TickResult {
    broadcasts = List.copyOf(broadcasts);
    violations = List.copyOf(violations);
  }

  static TickResult noResult(long tick) {
    return new TickResult(tick, false, List.of(), List.of());
  }
}
