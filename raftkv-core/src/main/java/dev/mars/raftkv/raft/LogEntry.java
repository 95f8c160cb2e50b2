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

import java.util.Arrays;
import java.util.Objects;

/**
 * A single entry of the replicated log.
 *
 * @param index the log index (1-based)
 * @param term  the term of the leader that created the entry
 * @param type  whether the payload is an application command or a membership change
 * @param data  the opaque payload, empty for the leader's no-op entry
 */
public record LogEntry(long index, long term, EntryType type, byte[] data) {

    public LogEntry {
        Objects.requireNonNull(type, "type");
        data = data == null ? new byte[0] : data;
    }

    public static LogEntry normal(long index, long term, byte[] data) {
        return new LogEntry(index, term, EntryType.NORMAL, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogEntry other)) {
            return false;
        }
        return index == other.index
                && term == other.term
                && type == other.type
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(index, term, type) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "LogEntry{index=" + index + ", term=" + term + ", type=" + type + ", dataLen=" + data.length + '}';
    }
}
