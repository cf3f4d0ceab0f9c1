// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import java.nio.ByteBuffer;

/// Interface for a fabric to write and read values to and from ByteBuffers.
public interface Pickler<T> {
  /// Writes the value at the current position of the buffer.
  void serialize(T value, ByteBuffer buffer);

  /// Reads a value from the current position of the buffer.
  T deserialize(ByteBuffer buffer);

  /// @return the number of bytes that [#serialize(Object, ByteBuffer)] will write so that buffers can be sized
  /// up front.
  int sizeOf(T value);
}
