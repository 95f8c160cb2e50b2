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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AppendPlan}.
 * <p>
 * These tests verify the plan calculation against a {@link RaftLog}:
 * <ul>
 *   <li>Appending to an empty log and beyond the current end</li>
 *   <li>Skipping entries the log already holds</li>
 *   <li>Truncating at the first conflicting term</li>
 *   <li>Ignoring entries inside the compacted prefix</li>
 * </ul>
 */
class AppendPlanTest {

    private static LogEntry entry(long index, long term) {
        return LogEntry.normal(index, term, ("cmd-" + index).getBytes(StandardCharsets.UTF_8));
    }

    private static RaftLog logWithTerms(long... terms) {
        RaftLog log = new RaftLog();
        for (int i = 0; i < terms.length; i++) {
            log.append(entry(i + 1, terms[i]));
        }
        return log;
    }

    // ========================================================================
    // Empty / No-Op Cases
    // ========================================================================

    @Test
    void testFrom_NullEntries_ReturnsEmptyPlan() {
        AppendPlan plan = AppendPlan.from(1, null, new RaftLog());

        assertFalse(plan.requiresTruncation());
        assertFalse(plan.hasEntriesToAppend());
        assertFalse(plan.changesLog());
    }

    @Test
    void testEmpty_HasNothing() {
        AppendPlan plan = AppendPlan.empty();

        assertNull(plan.truncateFromIndex());
        assertTrue(plan.entriesToAppend().isEmpty());
    }

    // ========================================================================
    // Appends
    // ========================================================================

    @Test
    void testFrom_AppendToEmptyLog() {
        RaftLog log = new RaftLog();

        AppendPlan plan = AppendPlan.from(1, List.of(entry(1, 1), entry(2, 1)), log);
        plan.applyTo(log);

        assertNull(plan.truncateFromIndex());
        assertEquals(2, plan.entriesToAppend().size());
        assertEquals(2, log.lastIndex());
    }

    @Test
    void testFrom_AllEntriesAlreadyPresent_NoChange() {
        RaftLog log = logWithTerms(1, 1, 2);

        AppendPlan plan = AppendPlan.from(2, List.of(entry(2, 1), entry(3, 2)), log);

        assertFalse(plan.changesLog());
    }

    @Test
    void testFrom_OverlapThenNew_AppendsOnlyNewTail() {
        RaftLog log = logWithTerms(1, 1);

        AppendPlan plan = AppendPlan.from(2, List.of(entry(2, 1), entry(3, 1), entry(4, 1)), log);

        assertFalse(plan.requiresTruncation());
        assertEquals(List.of(3L, 4L), plan.entriesToAppend().stream().map(LogEntry::index).toList());
    }

    // ========================================================================
    // Conflicts
    // ========================================================================

    @Test
    void testFrom_ConflictingTerm_TruncatesAtConflict() {
        RaftLog log = logWithTerms(1, 1, 1, 1);

        AppendPlan plan = AppendPlan.from(2, List.of(entry(2, 1), entry(3, 2)), log);
        plan.applyTo(log);

        assertEquals(3L, plan.truncateFromIndex());
        assertEquals(1, plan.entriesToAppend().size());
        assertEquals(3, log.lastIndex());
        assertEquals(2, log.term(3));
    }

    @Test
    void testApplyTo_TruncatingCommittedEntry_Refused() {
        RaftLog log = logWithTerms(1, 1, 1);
        log.commitTo(3);

        AppendPlan plan = AppendPlan.from(2, List.of(entry(2, 5)), log);

        assertTrue(plan.requiresTruncation());
        assertThrows(IllegalStateException.class, () -> plan.applyTo(log));
        assertEquals(1, log.term(2));
    }

    // ========================================================================
    // Compacted Prefix
    // ========================================================================

    @Test
    void testFrom_EntriesInsideSnapshot_Skipped() {
        RaftLog log = new RaftLog();
        log.restoreApplied(5, 2);

        AppendPlan plan = AppendPlan.from(4, List.of(entry(4, 2), entry(5, 2), entry(6, 3)), log);
        plan.applyTo(log);

        assertFalse(plan.requiresTruncation());
        assertEquals(1, plan.entriesToAppend().size());
        assertEquals(6, log.lastIndex());
        assertEquals(3, log.lastTerm());
    }
}
