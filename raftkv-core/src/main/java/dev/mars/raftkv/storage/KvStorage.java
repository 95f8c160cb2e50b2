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
package dev.mars.raftkv.storage;

import dev.mars.raftkv.command.Command;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Key-value storage engine driven by the consensus layer.
 * <p>
 * The node depends solely on this interface, not on concrete implementations.
 * <p>
 * <b>Critical Contract:</b> every method that mutates state is durable before it
 * returns, and the in-memory view only changes after the durable write
 * succeeded. All operations are synchronous with respect to the caller; one
 * exclusive lock guards the whole key space.
 * <p>
 * <b>Failure policy:</b>
 * <ul>
 *   <li>{@link #open}, {@link #snapshot}, {@link #loadSnapshot}, {@link #compact}
 *       throw {@link StorageException}, which is fatal for the node.</li>
 *   <li>{@link #set}, {@link #get}, {@link #delete}, {@link #apply} throw
 *       {@link StorageOperationException}, which the caller may recover from.</li>
 * </ul>
 *
 * @see FileKvStorage
 */
public interface KvStorage extends Closeable {

    /**
     * Opens the storage engine and recovers the key space from disk.
     *
     * @param dataDir the directory holding the storage files
     */
    void open(Path dataDir);

    // ========================================================================
    // Key-Value Operations
    // ========================================================================

    /**
     * Durably maps {@code key} to {@code value}.
     */
    void set(String key, byte[] value);

    /**
     * Returns the current value for {@code key}, or empty if absent.
     * The returned array is a copy.
     */
    Optional<byte[]> get(String key);

    /**
     * Durably removes the mapping for {@code key}. Absence is not an error.
     */
    void delete(String key);

    /** Number of keys currently stored. */
    int size();

    // ========================================================================
    // Applying Committed Entries
    // ========================================================================

    /**
     * Applies a committed command at the given log position.
     * <p>
     * Indices at or below {@link #lastAppliedIndex()} are skipped, so
     * re-delivery of an already-applied entry is a no-op.
     *
     * @param index   the log index of the entry carrying the command
     * @param term    the term of that entry
     * @param command the decoded command
     * @return true if the command was applied, false if the index was already applied
     */
    boolean apply(long index, long term, Command command);

    /** Highest log index whose command has been applied, 0 if none. */
    long lastAppliedIndex();

    /** Term of the entry at {@link #lastAppliedIndex()}, 0 if none. */
    long lastAppliedTerm();

    // ========================================================================
    // Snapshots
    // ========================================================================

    /**
     * Serializes the full key space together with the last applied position.
     * Equal key spaces at equal positions produce equal bytes.
     */
    byte[] snapshot();

    /**
     * Atomically replaces the key space with the contents of a snapshot.
     * <p>
     * The snapshot is decoded and validated completely first; on any failure
     * the existing key space is left untouched.
     */
    void loadSnapshot(byte[] snapshot);

    /**
     * Writes the current key space as the on-disk snapshot and resets the
     * write-ahead log.
     */
    void compact();

    // ========================================================================
    // Metadata (Term & Vote)
    // ========================================================================

    /**
     * Atomically persists the consensus term and vote.
     *
     * @param currentTerm the current term
     * @param votedFor    the node voted for in that term, 0 if none
     */
    void updateMetadata(long currentTerm, long votedFor);

    /**
     * Loads the persisted term and vote.
     *
     * @return the metadata, or {@link PersistentMeta#EMPTY} if none was ever written
     */
    PersistentMeta loadMetadata();

    /**
     * Persistent consensus metadata: currentTerm and votedFor.
     *
     * @param currentTerm the persisted term
     * @param votedFor    the node voted for in currentTerm, 0 if none
     */
    record PersistentMeta(long currentTerm, long votedFor) {
        public static final PersistentMeta EMPTY = new PersistentMeta(0L, 0L);
    }

    /**
     * Closes the storage, releasing the file lock. Idempotent.
     */
    @Override
    void close();
}
