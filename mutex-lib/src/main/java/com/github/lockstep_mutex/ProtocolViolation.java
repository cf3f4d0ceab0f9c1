// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import java.util.OptionalInt;

/// A misbehaving client or peer, or a configuration mismatch, observed while reconciling a tick. None of these are
/// fatal. Each is logged as a warning, the offending event is dropped, and the violation is reported in
/// [TickResult#violations()]. A misbehaving peer must not bring down a healthy one.
public sealed interface ProtocolViolation {
  /// @return the tick in which the violation was observed.
  long tick();

  /// @return the peer whose event was dropped.
  int peer();

  /// A peer requested while it already had a request queued.
  record RedundantRequest(long tick, int peer) implements ProtocolViolation {
  }

  /// More peers requested than the queue has slots. As the queue is sized to the peer count this means some agent
  /// was configured with a different peer count or an identifier outside of it.
  record QueueFull(long tick, int peer, int capacity) implements ProtocolViolation {
  }

  /// A release arrived from a peer that is not the head of the queue.
  record ReleaseWithoutHold(long tick, int peer, OptionalInt head) implements ProtocolViolation {
  }

  /// A release arrived after a valid release was already applied in the same tick. Only the holder may release so
  /// there can only ever be one.
  record MultipleSimultaneousReleases(long tick, int peer) implements ProtocolViolation {
  }
}
