// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.lockstep_mutex;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/// A bounded FIFO of peer identifiers. The head is the peer that holds, or is about to hold, the resource. Each peer
/// may have at most one outstanding request so an identifier never appears twice and the capacity is the number of
/// peers.
///
/// This class is not thread safe. It is owned by a single [ResourceManager] and only mutated while that manager
/// reconciles a tick.
public class RequestQueue {

  /// The outcome of a [#push(int)]. Only `ADMITTED` changes the queue.
  public enum PushOutcome {
    ADMITTED, QUEUE_FULL, REDUNDANT
  }

  private final int capacity;

  private final ArrayDeque<Integer> entries;

  private final Set<Integer> members = new HashSet<>();

  public RequestQueue(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be at least 1 but was " + capacity);
    }
    this.capacity = capacity;
    this.entries = new ArrayDeque<>(capacity);
  }

  /// Append a peer to the tail. A peer that is already queued is rejected before the capacity is considered.
  public PushOutcome push(int peerId) {
    if (members.contains(peerId)) {
      return PushOutcome.REDUNDANT;
    }
    if (entries.size() == capacity) {
      return PushOutcome.QUEUE_FULL;
    }
    entries.addLast(peerId);
    members.add(peerId);
    return PushOutcome.ADMITTED;
  }

  public OptionalInt pop() {
    final Integer head = entries.pollFirst();
    if (head == null) {
      return OptionalInt.empty();
    }
    members.remove(head);
    return OptionalInt.of(head);
  }

  public OptionalInt peekHead() {
    final Integer head = entries.peekFirst();
    return head == null ? OptionalInt.empty() : OptionalInt.of(head);
  }

  public boolean contains(int peerId) {
    return members.contains(peerId);
  }

  public boolean isHead(int peerId) {
    final Integer head = entries.peekFirst();
    return head != null && head == peerId;
  }

  public int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /// @return an immutable copy of the queue from head to tail.
  public List<Integer> snapshot() {
    return List.copyOf(entries);
  }

  @Override
  public String toString() {
    return "Q" + entries;
  }
}
