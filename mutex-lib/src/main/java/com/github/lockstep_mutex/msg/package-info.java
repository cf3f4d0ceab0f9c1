// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The msg package contains the broadcast notifications exchanged between resource managers.
///
/// ```
/// MutexMessage
/// ├── Request
/// └── Release
///```
///
/// The broadcast fabric must deliver every message sent in a tick to every other agent within that same tick. The
/// messages carry no timestamp as the tick they are delivered in is their timestamp.
package com.github.lockstep_mutex.msg;
