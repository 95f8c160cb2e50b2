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
 * A snapshot of the replicated state machine as the consensus layer sees it:
 * the log position it covers, the voters at that point and the opaque
 * storage image.
 *
 * @param index  last log index covered by the snapshot
 * @param term   term of the entry at {@code index}
 * @param voters voting members at {@code index}
 * @param data   the storage snapshot bytes
 */
public record SnapshotData(long index, long term, List<Long> voters, byte[] data) {

    public SnapshotData {
        voters = List.copyOf(Objects.requireNonNull(voters, "voters"));
        Objects.requireNonNull(data, "data");
    }

    @Override
    public String toString() {
        return "SnapshotData{index=" + index + ", term=" + term + ", voters=" + voters
                + ", dataLen=" + data.length + '}';
    }
}
