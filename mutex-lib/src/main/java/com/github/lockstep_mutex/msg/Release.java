// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex.msg;

/// Broadcast by the holder when its client gives up the resource. Every agent pops `from` off the head of its queue.
///
/// @param from see {@link MutexMessage}
public record Release(int from) implements MutexMessage {
  public Release {
    if (from < 0) throw new IllegalArgumentException("from must be non-negative but was " + from);
  }
}
