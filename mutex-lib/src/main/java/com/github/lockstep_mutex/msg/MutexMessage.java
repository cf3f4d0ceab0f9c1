// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex.msg;

/// MutexMessage is the base interface for the two notifications that every agent broadcasts to all of its peers.
public sealed interface MutexMessage permits Request, Release {
  /// @return the peer that broadcast this message.
  int from();
}
