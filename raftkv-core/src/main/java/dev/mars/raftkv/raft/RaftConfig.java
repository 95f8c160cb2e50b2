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
import java.util.Objects;

/**
 * Static parameters of a {@link RaftCore}.
 *
 * @param id                   this node's id (positive)
 * @param voters               initial voting members, including {@code id}
 * @param electionTicks        base election timeout in ticks; the effective timeout is
 *                             randomized in {@code [electionTicks, 2 * electionTicks)}
 * @param heartbeatTicks       ticks between leader heartbeats, less than {@code electionTicks}
 * @param maxEntriesPerMessage upper bound on entries in one append message
 * @param maxBytesPerMessage   upper bound on entry payload bytes in one append message; a
 *                             single entry is always sent, so no proposal may be larger
 */
public record RaftConfig(long id, List<Long> voters, int electionTicks, int heartbeatTicks,
                         int maxEntriesPerMessage, long maxBytesPerMessage) {

    /** Default payload budget of one append message. */
    public static final long DEFAULT_MAX_BYTES_PER_MESSAGE = 64L * 1024 * 1024;

    public RaftConfig(long id, List<Long> voters, int electionTicks, int heartbeatTicks,
                      int maxEntriesPerMessage) {
        this(id, voters, electionTicks, heartbeatTicks, maxEntriesPerMessage, DEFAULT_MAX_BYTES_PER_MESSAGE);
    }

    public RaftConfig {
        voters = List.copyOf(Objects.requireNonNull(voters, "voters"));
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive: " + id);
        }
        if (voters.isEmpty()) {
            throw new IllegalArgumentException("voters must not be empty");
        }
        if (heartbeatTicks <= 0) {
            throw new IllegalArgumentException("heartbeatTicks must be > 0: " + heartbeatTicks);
        }
        if (electionTicks <= heartbeatTicks) {
            throw new IllegalArgumentException("electionTicks (" + electionTicks
                    + ") must be greater than heartbeatTicks (" + heartbeatTicks + ")");
        }
        if (maxEntriesPerMessage <= 0) {
            throw new IllegalArgumentException("maxEntriesPerMessage must be > 0: " + maxEntriesPerMessage);
        }
        if (maxBytesPerMessage <= 0) {
            throw new IllegalArgumentException("maxBytesPerMessage must be > 0: " + maxBytesPerMessage);
        }
    }
}
