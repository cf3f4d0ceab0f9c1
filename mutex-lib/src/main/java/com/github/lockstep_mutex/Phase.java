// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import java.util.List;

/// The phases that a [ResourceManager] runs, in [#ORDER], to reconcile one tick. Releases are applied before
/// requests are merged so that a slot vacated in a tick is visible to the requests that arrive in the same tick.
public enum Phase {
  /// Broadcast `request(id)` if the local client asked for the resource. Never touches the queue.
  FORWARD_LOCAL_REQUEST,
  /// Pop our own id and broadcast `release(id)` if the local client gave up the resource and we are the head.
  APPLY_LOCAL_RELEASE,
  /// Pop the head for the first remote release that names it. Grant if that makes us the head.
  APPLY_REMOTE_RELEASES,
  /// Push the local and remote requests of this tick in ascending peer order. Grant if our own request made us the
  /// head.
  MERGE_REQUESTS;

  /// Every agent must run the phases in this order.
  public static final List<Phase> ORDER = List.of(values());
}
