// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex.msg;

/// Broadcast when the co-located client asks for the resource. Every agent that sees it in a tick merges `from`
/// into its queue in ascending peer order alongside the other requests of that tick.
///
/// @param from see {@link MutexMessage}
public record Request(int from) implements MutexMessage {
  public Request {
    if (from < 0) throw new IllegalArgumentException("from must be non-negative but was " + from);
  }
}
