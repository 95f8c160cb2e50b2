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
import java.util.List;

/**
 * In-memory replicated log with a compaction offset.
 * <p>
 * Entries at or below {@link #snapshotIndex()} have been compacted away; only
 * their boundary term is remembered. Index 0 always has term 0.
 * <p>
 * <b>Cursors:</b> {@code applied <= committed <= lastIndex()}, and
 * {@code snapshotIndex <= applied}.
 * <p>
 * Not thread-safe; owned by a single {@link RaftCore}.
 */
public final class RaftLog {

    /** Returned by {@link #term(long)} for positions that are compacted or beyond the end. */
    public static final long TERM_UNAVAILABLE = -1;

    private final List<LogEntry> entries = new ArrayList<>();
    private long snapshotIndex;
    private long snapshotTerm;
    private long committed;
    private long applied;

    public long snapshotIndex() {
        return snapshotIndex;
    }

    public long snapshotTerm() {
        return snapshotTerm;
    }

    public long firstIndex() {
        return snapshotIndex + 1;
    }

    public long lastIndex() {
        return snapshotIndex + entries.size();
    }

    public long lastTerm() {
        return entries.isEmpty() ? snapshotTerm : entries.get(entries.size() - 1).term();
    }

    public long committed() {
        return committed;
    }

    public long applied() {
        return applied;
    }

    /**
     * Term of the entry at {@code index}, or {@link #TERM_UNAVAILABLE}.
     */
    public long term(long index) {
        if (index == snapshotIndex) {
            return snapshotTerm;
        }
        if (index < snapshotIndex || index > lastIndex()) {
            return TERM_UNAVAILABLE;
        }
        return entries.get(position(index)).term();
    }

    public boolean matchTerm(long index, long term) {
        long t = term(index);
        return t != TERM_UNAVAILABLE && t == term;
    }

    /**
     * Election restriction: a candidate's log is at least as up-to-date as ours
     * if its last term is higher, or equal with an index at least as large.
     */
    public boolean isUpToDate(long candidateLastIndex, long candidateLastTerm) {
        long myLastTerm = lastTerm();
        return candidateLastTerm > myLastTerm
                || (candidateLastTerm == myLastTerm && candidateLastIndex >= lastIndex());
    }

    public LogEntry entry(long index) {
        if (index <= snapshotIndex || index > lastIndex()) {
            throw new IndexOutOfBoundsException("Entry " + index + " not in log ["
                    + firstIndex() + ", " + lastIndex() + "]");
        }
        return entries.get(position(index));
    }

    /**
     * Entries in {@code [lo, hi]}, both inclusive, clipped to what the log holds.
     */
    public List<LogEntry> slice(long lo, long hi) {
        long from = Math.max(lo, firstIndex());
        long to = Math.min(hi, lastIndex());
        if (from > to) {
            return List.of();
        }
        return new ArrayList<>(entries.subList(position(from), position(to) + 1));
    }

    /**
     * Like {@link #slice(long, long)}, but stops before the entry that would take the
     * summed payload size past {@code maxBytes}. The first entry is always included.
     */
    public List<LogEntry> slice(long lo, long hi, long maxBytes) {
        List<LogEntry> all = slice(lo, hi);
        long bytes = 0;
        for (int i = 0; i < all.size(); i++) {
            bytes += all.get(i).data().length;
            if (bytes > maxBytes && i > 0) {
                return new ArrayList<>(all.subList(0, i));
            }
        }
        return all;
    }

    public void append(LogEntry entry) {
        if (entry.index() != lastIndex() + 1) {
            throw new IllegalStateException("Non-contiguous append: expected index "
                    + (lastIndex() + 1) + ", got " + entry.index());
        }
        entries.add(entry);
    }

    /**
     * Removes every entry at or after {@code fromIndex}. Committed entries are never removed.
     */
    public void truncateFrom(long fromIndex) {
        if (fromIndex <= committed) {
            throw new IllegalStateException("Cannot truncate committed entry " + fromIndex
                    + " (committed=" + committed + ")");
        }
        if (fromIndex > lastIndex()) {
            return;
        }
        entries.subList(position(fromIndex), entries.size()).clear();
    }

    /**
     * Advances the commit index. Never moves it backwards.
     *
     * @return true if the commit index changed
     */
    public boolean commitTo(long index) {
        if (index <= committed) {
            return false;
        }
        if (index > lastIndex()) {
            throw new IllegalStateException("Commit index " + index + " beyond last index " + lastIndex());
        }
        committed = index;
        return true;
    }

    public void appliedTo(long index) {
        if (index <= applied) {
            return;
        }
        if (index > committed) {
            throw new IllegalStateException("Applied index " + index + " beyond committed " + committed);
        }
        applied = index;
    }

    /**
     * Discards entries up to and including {@code index}, remembering its term.
     */
    public void compactTo(long index) {
        if (index <= snapshotIndex) {
            return;
        }
        if (index > applied) {
            throw new IllegalStateException("Cannot compact unapplied index " + index + " (applied=" + applied + ")");
        }
        long newSnapshotTerm = term(index);
        entries.subList(0, position(index) + 1).clear();
        snapshotIndex = index;
        snapshotTerm = newSnapshotTerm;
    }

    /**
     * Replaces the whole log with a snapshot boundary. Everything the snapshot
     * covers counts as committed; {@code applied} catches up when the snapshot
     * has been installed.
     */
    public void restore(long index, long term) {
        entries.clear();
        snapshotIndex = index;
        snapshotTerm = term;
        committed = index;
        if (applied > index) {
            applied = index;
        }
    }

    /**
     * Restores the log as if a snapshot at {@code index} had already been applied.
     */
    public void restoreApplied(long index, long term) {
        restore(index, term);
        applied = index;
    }

    private int position(long index) {
        return (int) (index - snapshotIndex - 1);
    }

    @Override
    public String toString() {
        return "RaftLog{snapshot=" + snapshotIndex + "@" + snapshotTerm
                + ", last=" + lastIndex() + "@" + lastTerm()
                + ", committed=" + committed + ", applied=" + applied + '}';
    }
}
