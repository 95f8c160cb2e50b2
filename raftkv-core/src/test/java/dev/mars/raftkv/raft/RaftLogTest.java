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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RaftLogTest {

    private RaftLog log;

    @BeforeEach
    void setUp() {
        log = new RaftLog();
        for (int i = 1; i <= 5; i++) {
            log.append(LogEntry.normal(i, i <= 3 ? 1 : 2, new byte[]{(byte) i}));
        }
    }

    @Test
    void testEmptyLog() {
        RaftLog empty = new RaftLog();

        assertEquals(0, empty.lastIndex());
        assertEquals(0, empty.lastTerm());
        assertEquals(1, empty.firstIndex());
        assertEquals(0, empty.term(0));
        assertEquals(RaftLog.TERM_UNAVAILABLE, empty.term(1));
    }

    @Test
    void testAppend_NonContiguous_Rejected() {
        assertThrows(IllegalStateException.class, () -> log.append(LogEntry.normal(7, 2, null)));
    }

    @Test
    void testTermAndMatch() {
        assertEquals(1, log.term(3));
        assertEquals(2, log.term(4));
        assertTrue(log.matchTerm(5, 2));
        assertFalse(log.matchTerm(5, 1));
        assertFalse(log.matchTerm(6, 2));
    }

    @Test
    void testIsUpToDate() {
        assertTrue(log.isUpToDate(5, 2));
        assertTrue(log.isUpToDate(1, 3));
        assertFalse(log.isUpToDate(4, 2));
        assertFalse(log.isUpToDate(9, 1));
    }

    @Test
    void testSlice_ClippedToLog() {
        assertEquals(3, log.slice(3, 10).size());
        assertEquals(3, log.slice(3, 10).get(0).index());
        assertTrue(log.slice(6, 8).isEmpty());
    }

    @Test
    void testSlice_ByteBudget() {
        assertEquals(2, log.slice(1, 5, 2).size());
        assertEquals(5, log.slice(1, 5, 100).size());
        // The first entry goes out even when it alone exceeds the budget
        assertEquals(1, log.slice(1, 5, 0).size());
        assertEquals(1, log.slice(1, 5, 0).get(0).index());
    }

    @Test
    void testCommitTo_NeverMovesBackwards() {
        assertTrue(log.commitTo(3));
        assertFalse(log.commitTo(2));
        assertEquals(3, log.committed());
        assertThrows(IllegalStateException.class, () -> log.commitTo(6));
    }

    @Test
    void testTruncateFrom_CommittedEntry_Refused() {
        log.commitTo(3);

        assertThrows(IllegalStateException.class, () -> log.truncateFrom(3));
        log.truncateFrom(4);
        assertEquals(3, log.lastIndex());
    }

    @Test
    void testAppliedTo_BeyondCommitted_Refused() {
        log.commitTo(2);

        assertThrows(IllegalStateException.class, () -> log.appliedTo(3));
        log.appliedTo(2);
        assertEquals(2, log.applied());
    }

    @Test
    void testCompactTo_KeepsBoundaryTerm() {
        log.commitTo(4);
        log.appliedTo(4);

        log.compactTo(4);

        assertEquals(4, log.snapshotIndex());
        assertEquals(2, log.snapshotTerm());
        assertEquals(5, log.firstIndex());
        assertEquals(5, log.lastIndex());
        assertEquals(2, log.term(4));
        assertEquals(RaftLog.TERM_UNAVAILABLE, log.term(3));
        assertThrows(IndexOutOfBoundsException.class, () -> log.entry(4));
    }

    @Test
    void testCompactTo_Unapplied_Refused() {
        log.commitTo(4);
        log.appliedTo(2);

        assertThrows(IllegalStateException.class, () -> log.compactTo(3));
    }

    @Test
    void testRestore_ReplacesLog() {
        log.restore(10, 4);

        assertEquals(10, log.lastIndex());
        assertEquals(4, log.lastTerm());
        assertEquals(10, log.committed());
        assertTrue(log.slice(1, 10).isEmpty());
    }
}
