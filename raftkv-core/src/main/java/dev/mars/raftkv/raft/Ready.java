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
import java.util.Optional;

/**
 * One harvest of work from a {@link ConsensusCore}.
 * <p>
 * The consumer must, in this order: persist {@code hardState} if present,
 * install {@code snapshot} if present, apply {@code committedEntries} in
 * ascending index order, hand {@code messages} to the transport, and finally
 * call {@link ConsensusCore#advance(Ready)}. No new batch is produced until then.
 *
 * @param messages         outbound protocol messages
 * @param committedEntries newly committed entries, ascending by index
 * @param snapshot         a snapshot received from the leader that must replace local state
 * @param hardState        term/vote/commit, present only when changed since the last batch
 */
public record Ready(
        List<Message> messages,
        List<LogEntry> committedEntries,
        Optional<SnapshotData> snapshot,
        Optional<HardState> hardState
) {

    public Ready {
        messages = List.copyOf(messages);
        committedEntries = List.copyOf(committedEntries);
    }

    /** True when the batch carries nothing to do. */
    public boolean isEmpty() {
        return messages.isEmpty() && committedEntries.isEmpty()
                && snapshot.isEmpty() && hardState.isEmpty();
    }
}
