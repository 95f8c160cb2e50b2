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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of matching the entries of an append message against the local log.
 * <p>
 * Computing the plan does not mutate anything:
 * <ul>
 *   <li>Entries already present with the same term are skipped</li>
 *   <li>The first entry whose term differs marks the truncation point</li>
 *   <li>Entries beyond the end of the log are appended</li>
 *   <li>Entries inside the compacted prefix are committed and therefore match</li>
 * </ul>
 * <p>
 * <b>Usage:</b>
 * <pre>{@code
 * AppendPlan plan = AppendPlan.from(prevIndex + 1, message.entries(), raftLog);
 * plan.applyTo(raftLog);
 * }</pre>
 *
 * @param truncateFromIndex the index from which to truncate (null if no truncation needed)
 * @param entriesToAppend   the entries to append after any truncation
 */
public record AppendPlan(
        Long truncateFromIndex,
        List<LogEntry> entriesToAppend
) {

    public AppendPlan {
        entriesToAppend = entriesToAppend == null
                ? Collections.emptyList()
                : List.copyOf(entriesToAppend);
    }

    /**
     * Creates an empty plan (no truncation, no appends).
     */
    public static AppendPlan empty() {
        return new AppendPlan(null, Collections.emptyList());
    }

    /**
     * Calculates the plan for entries starting at {@code startIndex}.
     *
     * @param startIndex      index of the first incoming entry (prevIndex + 1)
     * @param incomingEntries the entries from the leader's append
     * @param log             the local log
     * @return the calculated plan
     */
    public static AppendPlan from(long startIndex, List<LogEntry> incomingEntries, RaftLog log) {
        if (incomingEntries == null || incomingEntries.isEmpty()) {
            return empty();
        }

        Long truncateAt = null;
        int firstNewEntryIdx = incomingEntries.size();

        for (int i = 0; i < incomingEntries.size(); i++) {
            long logIndex = startIndex + i;

            if (logIndex <= log.snapshotIndex()) {
                continue;
            }
            if (logIndex > log.lastIndex()) {
                firstNewEntryIdx = i;
                break;
            }
            if (log.term(logIndex) != incomingEntries.get(i).term()) {
                truncateAt = logIndex;
                firstNewEntryIdx = i;
                break;
            }
        }

        List<LogEntry> toAppend = firstNewEntryIdx >= incomingEntries.size()
                ? Collections.emptyList()
                : new ArrayList<>(incomingEntries.subList(firstNewEntryIdx, incomingEntries.size()));

        return new AppendPlan(truncateAt, toAppend);
    }

    /**
     * Applies this plan to the log: truncation first, then appends.
     */
    public void applyTo(RaftLog log) {
        if (truncateFromIndex != null) {
            log.truncateFrom(truncateFromIndex);
        }
        for (LogEntry entry : entriesToAppend) {
            log.append(entry);
        }
    }

    public boolean requiresTruncation() {
        return truncateFromIndex != null;
    }

    public boolean hasEntriesToAppend() {
        return !entriesToAppend.isEmpty();
    }

    /**
     * @return true if applying this plan changes the log
     */
    public boolean changesLog() {
        return requiresTruncation() || hasEntriesToAppend();
    }
}
