// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

final class ErrorStrings {
  static final String CLOSED = "This resource manager has been closed so will not process any more ticks: ";
  static final String INTERRUPTED = "ResourceManagerEngine was interrupted probably to shutdown while under load so we will close: ";

  private ErrorStrings() {
  }
}
