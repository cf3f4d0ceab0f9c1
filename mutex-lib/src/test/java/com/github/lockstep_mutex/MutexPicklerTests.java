// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import com.github.lockstep_mutex.msg.MutexMessage;
import com.github.lockstep_mutex.msg.Release;
import com.github.lockstep_mutex.msg.Request;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class MutexPicklerTests {

  @Test
  public void testPickleRequest() {
    final var request = new Request(7);
    final byte[] pickled = MutexPickler.pickle(request);
    assertThat(pickled).containsExactly(0, 0, 0, 7, 1);
    assertEquals(request, MutexPickler.unpickle(pickled));
  }

  @Test
  public void testPickleRelease() {
    final var release = new Release(300);
    final byte[] pickled = MutexPickler.pickle(release);
    assertThat(pickled).containsExactly(0, 0, 1, 44, 2);
    assertEquals(release, MutexPickler.unpickle(pickled));
  }

  @Test
  public void testBatchInOneBuffer() {
    final List<MutexMessage> batch = List.of(new Request(0), new Release(1), new Request(2));
    final var pickler = MutexPickler.instance;
    final var buffer = ByteBuffer.allocate(batch.stream().mapToInt(pickler::sizeOf).sum());
    batch.forEach(m -> pickler.serialize(m, buffer));
    assertThat(buffer.hasRemaining()).isFalse();

    buffer.flip();
    assertThat(List.of(pickler.deserialize(buffer), pickler.deserialize(buffer), pickler.deserialize(buffer)))
        .isEqualTo(batch);
  }

  @Test
  public void testUnknownTypeIsRejected() {
    assertThatThrownBy(() -> MutexPickler.unpickle(new byte[]{0, 0, 0, 1, 9}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown type");
  }

  @Test
  public void testNegativePeerIsRejected() {
    assertThatThrownBy(() -> MutexPickler.unpickle(new byte[]{-1, -1, -1, -1, 1}))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testNullMessageIsRejected() {
    assertThatThrownBy(() -> MutexPickler.toByte(null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("msg");
    assertThatThrownBy(() -> MutexPickler.pickle(null)).isInstanceOf(NullPointerException.class);
  }
}
