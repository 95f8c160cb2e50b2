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
import java.util.Optional;

/**
 * A protocol message between two consensus cores.
 * <p>
 * One flat shape covers every {@link MessageType}; fields a type does not use
 * are zero, empty or null. Use the static factories rather than the canonical
 * constructor.
 * <p>
 * Field meaning per type:
 * <ul>
 *   <li>{@code REQUEST_VOTE}: {@code index}/{@code logTerm} = candidate's last log position</li>
 *   <li>{@code REQUEST_VOTE_RESPONSE}: {@code reject} = vote denied</li>
 *   <li>{@code APPEND_ENTRIES}: {@code index}/{@code logTerm} = position preceding {@code entries},
 *       {@code commit} = leader commit index</li>
 *   <li>{@code APPEND_ENTRIES_RESPONSE}: on success {@code index} = last matching index;
 *       on reject {@code index} = the rejected position, {@code rejectHint} = follower's last index</li>
 *   <li>{@code INSTALL_SNAPSHOT}: {@code snapshot} is set</li>
 * </ul>
 *
 * @param type       message kind
 * @param from       sender id
 * @param to         recipient id
 * @param term       sender's term
 * @param logTerm    term of the log position in {@code index}
 * @param index      log position, meaning depends on type
 * @param entries    entries carried by an append
 * @param commit     sender's commit index
 * @param reject     whether a response is negative
 * @param rejectHint follower's last index on a rejected append
 * @param snapshot   snapshot carried by {@code INSTALL_SNAPSHOT}, null otherwise
 */
public record Message(
        MessageType type,
        long from,
        long to,
        long term,
        long logTerm,
        long index,
        List<LogEntry> entries,
        long commit,
        boolean reject,
        long rejectHint,
        SnapshotData snapshot
) {

    public Message {
        Objects.requireNonNull(type, "type");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static Message voteRequest(long from, long to, long term, long lastIndex, long lastTerm) {
        return new Message(MessageType.REQUEST_VOTE, from, to, term, lastTerm, lastIndex,
                List.of(), 0, false, 0, null);
    }

    public static Message voteResponse(long from, long to, long term, boolean reject) {
        return new Message(MessageType.REQUEST_VOTE_RESPONSE, from, to, term, 0, 0,
                List.of(), 0, reject, 0, null);
    }

    public static Message append(long from, long to, long term, long prevIndex, long prevTerm,
                                 List<LogEntry> entries, long commit) {
        return new Message(MessageType.APPEND_ENTRIES, from, to, term, prevTerm, prevIndex,
                entries, commit, false, 0, null);
    }

    public static Message appendResponse(long from, long to, long term, long index,
                                         boolean reject, long rejectHint) {
        return new Message(MessageType.APPEND_ENTRIES_RESPONSE, from, to, term, 0, index,
                List.of(), 0, reject, rejectHint, null);
    }

    public static Message installSnapshot(long from, long to, long term, SnapshotData snapshot) {
        return new Message(MessageType.INSTALL_SNAPSHOT, from, to, term, snapshot.term(), snapshot.index(),
                List.of(), snapshot.index(), false, 0, snapshot);
    }

    public Optional<SnapshotData> snapshotData() {
        return Optional.ofNullable(snapshot);
    }

    @Override
    public String toString() {
        return "Message{" + type + " " + from + "->" + to +
                ", term=" + term +
                ", logTerm=" + logTerm +
                ", index=" + index +
                ", entries=" + entries.size() +
                ", commit=" + commit +
                (reject ? ", reject, hint=" + rejectHint : "") +
                (snapshot != null ? ", " + snapshot : "") +
                '}';
    }
}
