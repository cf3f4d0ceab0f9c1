// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import java.util.Objects;

/// The construction parameters of one [ResourceManager]. Every agent in the group must be configured with the same
/// `peerCount` and a distinct `id`.
///
/// @param id        The unique identifier of this agent in `[0, peerCount)`. It is also the tie-break key when
///                  several peers request in the same tick.
/// @param peerCount The number of agents in the group. The request queue is sized to hold one entry per agent.
/// @param name      Only used in log lines.
public record MutexConfig(int id, int peerCount, String name) {
  public MutexConfig {
    Objects.requireNonNull(name, "name");
    if (peerCount < 1) {
      throw new IllegalArgumentException("peerCount must be at least 1 but was " + peerCount);
    }
    if (id < 0 || id >= peerCount) {
      throw new IllegalArgumentException("id=" + id + " must be in [0," + peerCount + ")");
    }
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
  }

  public MutexConfig(int id, int peerCount) {
    this(id, peerCount, "rm-" + id);
  }
}
