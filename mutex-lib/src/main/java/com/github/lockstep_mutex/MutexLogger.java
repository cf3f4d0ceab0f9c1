// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. Protocol violations are logged at WARNING, grants at the level the host chooses, and per-tick traces
/// at FINE and FINER.
public final class MutexLogger {
  public static final Logger LOGGER = Logger.getLogger(MutexLogger.class.getPackageName());

  private MutexLogger() {
  }
}
