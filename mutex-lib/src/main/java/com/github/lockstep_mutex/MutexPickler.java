// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.MutexMessage;
import com.github.lockstep_mutex.msg.Release;
import com.github.lockstep_mutex.msg.Request;

import java.nio.ByteBuffer;
import java.util.Objects;

/// The wire form of a [MutexMessage] for fabrics that need one. The core never uses it. Every message is
/// `from(4) + type(1)` bytes.
public class MutexPickler implements Pickler<MutexMessage> {
  public static final MutexPickler instance = new MutexPickler();

  static final int SIZE = Integer.BYTES + 1;

  static final byte REQUEST = 1;
  static final byte RELEASE = 2;

  protected MutexPickler() {
  }

  public static byte[] pickle(MutexMessage msg) {
    final ByteBuffer buffer = ByteBuffer.allocate(SIZE);
    instance.serialize(msg, buffer);
    return buffer.array();
  }

  public static MutexMessage unpickle(byte[] bytes) {
    return instance.deserialize(ByteBuffer.wrap(bytes));
  }

  public static byte toByte(MutexMessage msg) {
    Objects.requireNonNull(msg, "msg");
    if (msg instanceof Request) {
      return REQUEST;
    } else if (msg instanceof Release) {
      return RELEASE;
    }
    throw new IllegalArgumentException("Unknown message: " + msg);
  }

  @Override
  public void serialize(MutexMessage msg, ByteBuffer buffer) {
    final byte type = toByte(msg);
    buffer.putInt(msg.from());
    buffer.put(type);
  }

  @Override
  public MutexMessage deserialize(ByteBuffer buffer) {
    final int from = buffer.getInt();
    final byte type = buffer.get();
    return switch (type) {
      case REQUEST -> new Request(from);
      case RELEASE -> new Release(from);
      default -> throw new IllegalArgumentException("Unknown type: " + type);
    };
  }

  @Override
  public int sizeOf(MutexMessage value) {
    return SIZE;
  }
}
