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
package dev.mars.raftkv.raft;

import java.util.List;

/**
 * The consensus capability a node drives.
 * <p>
 * The contract follows the familiar ready/advance style: callers feed
 * {@link #tick()}, {@link #step(Message)} and proposals in, then poll
 * {@link #hasReady()} and process each {@link Ready} batch before calling
 * {@link #advance(Ready)}.
 * <p>
 * Implementations are <b>not thread-safe</b>. Exactly one thread may call
 * into an instance.
 *
 * @see RaftCore
 */
public interface ConsensusCore {

    // ========================================================================
    // Inputs
    // ========================================================================

    /** Advances the logical clock by one tick (elections, heartbeats). */
    void tick();

    /** Starts an election immediately, as if the election timeout had elapsed. */
    void campaign();

    /**
     * Proposes data for replication.
     *
     * @return the log index assigned to the entry
     * @throws ProposalDroppedException if this node is not the leader
     * @throws IllegalArgumentException  if the data could never fit in one append message
     */
    long propose(byte[] data);

    /**
     * Proposes a membership change. Only one change may be pending at a time.
     *
     * @return the log index assigned to the entry
     * @throws ProposalDroppedException if not leader or a change is already pending
     */
    long proposeConfChange(ConfChange change);

    /**
     * Applies a committed membership change to the voter set.
     *
     * @return the voters after the change
     */
    List<Long> applyConfChange(ConfChange change);

    /**
     * Feeds one inbound message. Never throws for protocol-level invalid
     * messages; those are ignored or answered with a rejection.
     */
    void step(Message message);

    // ========================================================================
    // Ready / Advance
    // ========================================================================

    boolean hasReady();

    /**
     * Harvests the current batch.
     *
     * @throws IllegalStateException if the previous batch has not been advanced
     */
    Ready ready();

    /** Acknowledges that {@code ready} was fully processed. */
    void advance(Ready ready);

    /**
     * Discards log entries up to {@code index}, keeping {@code data} as the
     * snapshot to send to followers that fall behind it.
     */
    void compact(long index, byte[] data);

    // ========================================================================
    // Status
    // ========================================================================

    long id();

    StateRole role();

    long term();

    long leaderId();

    long commitIndex();

    long appliedIndex();

    long lastIndex();

    List<Long> voters();
}
