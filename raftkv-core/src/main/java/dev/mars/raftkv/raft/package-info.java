/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Raft consensus core.
 * <p>
 * {@link dev.mars.raftkv.raft.RaftCore} implements
 * {@link dev.mars.raftkv.raft.ConsensusCore}: a pure state machine fed with
 * ticks, proposals and messages, whose effects are harvested as
 * {@link dev.mars.raftkv.raft.Ready} batches. It performs no I/O itself.
 * <p>
 * <b>Processing contract:</b>
 * <pre>{@code
 * if (core.hasReady()) {
 *     Ready ready = core.ready();
 *     // persist hard state, install snapshot, apply committed entries, send messages
 *     core.advance(ready);
 * }
 * }</pre>
 */
package dev.mars.raftkv.raft;
