// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains a first-come-first-served distributed mutual exclusion protocol for a fixed group of
/// peer agents that share a single logical resource without any central arbiter.
///
/// Every agent runs a [com.github.lockstep_mutex.ResourceManager] holding its own
/// [com.github.lockstep_mutex.RequestQueue]. There is no shared state and no coordination round. Agreement is the
/// result of every agent applying the same [com.github.lockstep_mutex.Phase#ORDER] to the same per-tick batch of
/// events, with requests made in the same tick ordered by ascending peer id. This is Lamport's "time instead of
/// timeout" approach. It requires a fabric that delivers every broadcast of a tick to every other agent within that
/// same tick. It does not tolerate lost messages, crashed peers or Byzantine peers.
///
/// To use it a host needs to provide:
/// 1. A broadcast fabric that carries [com.github.lockstep_mutex.msg.MutexMessage]s between agents. The
///    [com.github.lockstep_mutex.MutexPickler] gives them a wire form.
/// 2. A grant callback of type `LongConsumer` that tells the local client it holds the resource.
///
/// Supporting classes:
/// - [com.github.lockstep_mutex.ResourceManagerEngine]: Thread safe wrapper that latches client signals and runs
///   each tick as an announce step followed by a reconcile step.
/// - [com.github.lockstep_mutex.TickEvents] and [com.github.lockstep_mutex.TickResult]: The inputs and outputs of
///   one tick.
/// - [com.github.lockstep_mutex.ProtocolViolation]: The non-fatal violations that are logged and absorbed.
/// - [com.github.lockstep_mutex.MutexConfig]: The identity of an agent and the size of the group.
package com.github.lockstep_mutex;
