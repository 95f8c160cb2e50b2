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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.CRC32C;

/**
 * File-based implementation of {@link KvStorage}.
 * <p>
 * The key space lives in memory in a sorted map. Every mutation is first
 * written to an append-only write-ahead log and forced to disk, then applied
 * to the map.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data_N/
 *  ├─ kv.lock      // exclusive process lock, held while open
 *  ├─ kv.snap      // last snapshot + generation (atomic replace)
 *  ├─ kv.log       // generation header, then SET / DELETE records
 *  └─ meta.dat     // currentTerm + votedFor (atomic replace)
 * </pre>
 * <p>
 * <b>Generations:</b> installing or taking a snapshot writes {@code kv.snap}
 * with generation {@code g+1} and then replaces {@code kv.log} with an empty
 * log stamped {@code g+1}. A crash between the two steps leaves a log whose
 * generation does not match the snapshot; such a log is stale and discarded
 * on open, since the snapshot already supersedes every record in it.
 * <p>
 * <b>Thread Safety:</b>
 * One {@link ReentrantLock} guards the whole key space and all file channels.
 * <p>
 * <b>Recovery:</b> open loads the snapshot, then replays the log. A torn or
 * corrupt tail is truncated at the last record whose CRC checks out.
 *
 * @see KvStorage
 */
public final class FileKvStorage implements KvStorage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileKvStorage.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Log file header magic: 'KVWL' in ASCII */
    private static final int LOG_MAGIC = 0x4B56574C;

    /** Record magic: 'KVRC' in ASCII */
    private static final int RECORD_MAGIC = 0x4B565243;

    /** Snapshot payload magic: 'KVSN' in ASCII */
    private static final int SNAPSHOT_MAGIC = 0x4B56534E;

    /** Snapshot file magic: 'KVSF' in ASCII */
    private static final int SNAPSHOT_FILE_MAGIC = 0x4B565346;

    /** Format version shared by all files */
    private static final short VERSION = 1;

    private static final byte TYPE_SET = 1;
    private static final byte TYPE_DELETE = 2;

    /** Log header: MAGIC(4) + VERSION(2) + GENERATION(8) + CRC(4) */
    private static final int LOG_HEADER_SIZE = 4 + 2 + 8 + 4;

    /** Record header: MAGIC(4) + VERSION(2) + TYPE(1) + INDEX(8) + TERM(8) + KEY_LEN(4) + VALUE_LEN(4) */
    private static final int RECORD_HEADER_SIZE = 4 + 2 + 1 + 8 + 8 + 4 + 4;

    /** Snapshot header: MAGIC(4) + VERSION(2) + LAST_APPLIED(8) + LAST_TERM(8) + COUNT(4) */
    private static final int SNAPSHOT_HEADER_SIZE = 4 + 2 + 8 + 8 + 4;

    /** Snapshot file framing: FILE_MAGIC(4) + GENERATION(8) ... CRC(4) */
    private static final int SNAPSHOT_FILE_OVERHEAD = 4 + 8 + 4;

    private static final int CRC_SIZE = 4;

    /** Writes above this size re-check free disk space first. */
    private static final int LARGE_WRITE_BYTES = 1024 * 1024;

    private static final String LOCK_FILE = "kv.lock";
    private static final String LOG_FILE = "kv.log";
    private static final String LOG_TMP_FILE = "kv.log.tmp";
    private static final String SNAPSHOT_FILE = "kv.snap";
    private static final String SNAPSHOT_TMP_FILE = "kv.snap.tmp";
    private static final String META_FILE = "meta.dat";
    private static final String META_TMP_FILE = "meta.dat.tmp";

    // ========================================================================
    // State
    // ========================================================================

    private final ReentrantLock lock = new ReentrantLock();
    private final KvStorageConfig config;
    private final boolean syncEnabled;
    private final int maxValueSize;
    private final long minFreeSpace;

    private TreeMap<String, byte[]> data = new TreeMap<>();
    private long lastAppliedIndex;
    private long lastAppliedTerm;
    private long generation;

    private Path dataDir;
    private FileChannel logChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private boolean opened;
    private volatile boolean closed;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a new FileKvStorage with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     *
     * @see KvStorageConfig
     */
    public FileKvStorage() {
        this(KvStorageConfig.load());
    }

    /**
     * Creates a new FileKvStorage with the specified configuration.
     *
     * @param config the storage configuration
     */
    public FileKvStorage(KvStorageConfig config) {
        this.config = config;
        this.syncEnabled = config.syncEnabled();
        this.maxValueSize = config.maxValueSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();

        LOG.info("FileKvStorage initialized: syncEnabled={}, maxValueSize={} MB, minFreeSpace={} MB",
                syncEnabled, config.maxValueSizeMb(), config.minFreeSpaceMb());

        if (!syncEnabled) {
            LOG.warn("FileKvStorage created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Returns the configuration used by this storage instance.
     */
    public KvStorageConfig config() {
        return config;
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the storage using the data directory from the configuration.
     */
    public void open() {
        open(config.dataDir());
    }

    @Override
    public void open(Path dataDir) {
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Storage has been closed");
            }
            if (opened) {
                LOG.debug("Storage already open at {}, ignoring duplicate open()", this.dataDir);
                return;
            }
            LOG.info("Opening KV storage at: {}", dataDir);
            this.dataDir = dataDir;
            Files.createDirectories(dataDir);

            acquireExclusiveLock();
            checkDiskSpace();

            loadSnapshotFile();
            openLog();
            opened = true;

            LOG.info("KV storage opened: keys={}, lastApplied={}, lastAppliedTerm={}, generation={}",
                    data.size(), lastAppliedIndex, lastAppliedTerm, generation);

        } catch (IOException e) {
            LOG.error("Failed to open KV storage at {}: {}", dataDir, e.getMessage(), e);
            closeLogChannel();
            releaseExclusiveLock();
            throw new StorageException("Failed to open KV storage at " + dataDir, e);
        } catch (StorageException e) {
            closeLogChannel();
            releaseExclusiveLock();
            throw e;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Storage already closed, ignoring duplicate close()");
            return;
        }
        lock.lock();
        try {
            closed = true;
            LOG.info("Closing KV storage at: {}", dataDir);
            closeLogChannel();
            releaseExclusiveLock();
            opened = false;
            LOG.info("KV storage closed");
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Key-Value Operations
    // ========================================================================

    @Override
    public void set(String key, byte[] value) {
        byte[] keyBytes = keyBytes(key);
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        checkValueSize(value.length);

        lock.lock();
        try {
            requireOpen();
            writeRecord(TYPE_SET, lastAppliedIndex, lastAppliedTerm, keyBytes, value);
            data.put(key, value.clone());
            LOG.trace("SET key={} valueLen={}", key, value.length);
        } catch (IOException e) {
            LOG.error("Failed to set key {}: {}", key, e.getMessage(), e);
            throw new StorageOperationException("Failed to set key " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        lock.lock();
        try {
            requireOpen();
            byte[] value = data.get(key);
            return value == null ? Optional.empty() : Optional.of(value.clone());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) {
        byte[] keyBytes = keyBytes(key);
        lock.lock();
        try {
            requireOpen();
            if (!data.containsKey(key)) {
                LOG.trace("DELETE key={} (absent, nothing to do)", key);
                return;
            }
            writeRecord(TYPE_DELETE, lastAppliedIndex, lastAppliedTerm, keyBytes, new byte[0]);
            data.remove(key);
            LOG.trace("DELETE key={}", key);
        } catch (IOException e) {
            LOG.error("Failed to delete key {}: {}", key, e.getMessage(), e);
            throw new StorageOperationException("Failed to delete key " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            requireOpen();
            return data.size();
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Applying Committed Entries
    // ========================================================================

    @Override
    public boolean apply(long index, long term, Command command) {
        if (index <= 0) {
            throw new IllegalArgumentException("index must be positive: " + index);
        }
        byte[] keyBytes = keyBytes(command.key());
        byte[] valueBytes = command instanceof Command.Set set
                ? set.value().getBytes(StandardCharsets.UTF_8)
                : new byte[0];
        checkValueSize(valueBytes.length);

        lock.lock();
        try {
            requireOpen();
            if (index <= lastAppliedIndex) {
                LOG.debug("Skipping already applied entry: index={}, lastApplied={}", index, lastAppliedIndex);
                return false;
            }

            if (command instanceof Command.Set) {
                writeRecord(TYPE_SET, index, term, keyBytes, valueBytes);
                data.put(command.key(), valueBytes);
            } else {
                writeRecord(TYPE_DELETE, index, term, keyBytes, valueBytes);
                data.remove(command.key());
            }
            lastAppliedIndex = index;
            lastAppliedTerm = term;
            LOG.trace("Applied entry: index={}, term={}, command={}", index, term,
                    command.getClass().getSimpleName());
            return true;

        } catch (IOException e) {
            LOG.error("Failed to apply entry {}: {}", index, e.getMessage(), e);
            throw new StorageOperationException("Failed to apply entry " + index, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long lastAppliedIndex() {
        lock.lock();
        try {
            return lastAppliedIndex;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long lastAppliedTerm() {
        lock.lock();
        try {
            return lastAppliedTerm;
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Snapshots
    // ========================================================================

    @Override
    public byte[] snapshot() {
        lock.lock();
        try {
            requireOpen();
            byte[] snapshot = encodeSnapshot(lastAppliedIndex, lastAppliedTerm, data);
            LOG.debug("Snapshot exported: keys={}, lastApplied={}, {} bytes",
                    data.size(), lastAppliedIndex, snapshot.length);
            return snapshot;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void loadSnapshot(byte[] snapshot) {
        // Decode fully before touching any state
        SnapshotImage image = decodeSnapshot(snapshot, maxValueSize);

        lock.lock();
        try {
            requireOpen();
            long nextGeneration = generation + 1;
            writeSnapshotFile(snapshot, nextGeneration);
            resetLog(nextGeneration);

            generation = nextGeneration;
            data = image.data();
            lastAppliedIndex = image.lastAppliedIndex();
            lastAppliedTerm = image.lastAppliedTerm();

            LOG.info("Snapshot installed: keys={}, lastApplied={}, lastAppliedTerm={}, generation={}",
                    data.size(), lastAppliedIndex, lastAppliedTerm, generation);

        } catch (IOException e) {
            LOG.error("Failed to install snapshot: {}", e.getMessage(), e);
            throw new StorageException("Failed to install snapshot", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void compact() {
        lock.lock();
        try {
            requireOpen();
            long startNanos = System.nanoTime();
            long nextGeneration = generation + 1;
            writeSnapshotFile(encodeSnapshot(lastAppliedIndex, lastAppliedTerm, data), nextGeneration);
            resetLog(nextGeneration);
            generation = nextGeneration;

            LOG.info("Storage compacted: keys={}, lastApplied={}, generation={}, {} us",
                    data.size(), lastAppliedIndex, generation, (System.nanoTime() - startNanos) / 1000);

        } catch (IOException e) {
            LOG.error("Failed to compact storage: {}", e.getMessage(), e);
            throw new StorageException("Failed to compact storage", e);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Metadata Operations
    // ========================================================================

    @Override
    public void updateMetadata(long currentTerm, long votedFor) {
        lock.lock();
        try {
            requireOpen();
            LOG.debug("Updating metadata: term={}, votedFor={}", currentTerm, votedFor);

            // Format: TERM(8) + VOTED_FOR(8) + CRC(4)
            ByteBuffer buf = ByteBuffer.allocate(8 + 8 + CRC_SIZE);
            buf.putLong(currentTerm);
            buf.putLong(votedFor);
            CRC32C crc = new CRC32C();
            crc.update(buf.array(), 0, 16);
            buf.putInt((int) crc.getValue());
            buf.flip();

            replaceFile(dataDir.resolve(META_TMP_FILE), dataDir.resolve(META_FILE), buf);
            LOG.debug("Metadata updated: term={}, votedFor={}", currentTerm, votedFor);

        } catch (IOException e) {
            LOG.error("Failed to update metadata: {}", e.getMessage(), e);
            throw new StorageException("Failed to update metadata", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PersistentMeta loadMetadata() {
        lock.lock();
        try {
            requireOpen();
            Path metaPath = dataDir.resolve(META_FILE);
            if (!Files.exists(metaPath)) {
                LOG.debug("No metadata file found, returning empty metadata");
                return PersistentMeta.EMPTY;
            }

            byte[] all = Files.readAllBytes(metaPath);
            if (all.length != 8 + 8 + CRC_SIZE) {
                LOG.error("Corrupt metadata: unexpected size {}", all.length);
                throw new StorageException("Corrupt " + META_FILE + ": unexpected size " + all.length);
            }
            ByteBuffer buf = ByteBuffer.wrap(all);
            long term = buf.getLong();
            long votedFor = buf.getLong();
            int expectedCrc = buf.getInt();

            CRC32C crc = new CRC32C();
            crc.update(all, 0, 16);
            if ((int) crc.getValue() != expectedCrc) {
                LOG.error("Corrupt metadata: CRC mismatch (expected={}, computed={})",
                        expectedCrc, (int) crc.getValue());
                throw new StorageException("Corrupt " + META_FILE + ": CRC mismatch");
            }

            LOG.info("Metadata loaded: term={}, votedFor={}", term, votedFor);
            return new PersistentMeta(term, votedFor);

        } catch (IOException e) {
            LOG.error("Failed to load metadata: {}", e.getMessage(), e);
            throw new StorageException("Failed to load metadata", e);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    private void loadSnapshotFile() throws IOException {
        Path snapPath = dataDir.resolve(SNAPSHOT_FILE);
        if (!Files.exists(snapPath)) {
            LOG.debug("No snapshot file found, starting from empty key space");
            generation = 0;
            return;
        }

        byte[] all = Files.readAllBytes(snapPath);
        if (all.length < SNAPSHOT_FILE_OVERHEAD) {
            throw new StorageException("Corrupt " + SNAPSHOT_FILE + ": only " + all.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(all);
        int magic = buf.getInt();
        long fileGeneration = buf.getLong();
        int storedCrc = buf.getInt(all.length - CRC_SIZE);

        CRC32C crc = new CRC32C();
        crc.update(all, 0, all.length - CRC_SIZE);
        if (magic != SNAPSHOT_FILE_MAGIC || (int) crc.getValue() != storedCrc) {
            LOG.error("Corrupt snapshot file {}: magic=0x{}, crc stored={}, computed={}",
                    snapPath, Integer.toHexString(magic), storedCrc, (int) crc.getValue());
            throw new StorageException("Corrupt " + SNAPSHOT_FILE + ": header or CRC mismatch");
        }

        byte[] payload = new byte[all.length - SNAPSHOT_FILE_OVERHEAD];
        System.arraycopy(all, 4 + 8, payload, 0, payload.length);
        SnapshotImage image = decodeSnapshot(payload, maxValueSize);

        generation = fileGeneration;
        data = image.data();
        lastAppliedIndex = image.lastAppliedIndex();
        lastAppliedTerm = image.lastAppliedTerm();
        LOG.info("Snapshot file loaded: keys={}, lastApplied={}, generation={}",
                data.size(), lastAppliedIndex, generation);
    }

    private void openLog() throws IOException {
        Path logPath = dataDir.resolve(LOG_FILE);
        if (!Files.exists(logPath) || Files.size(logPath) < LOG_HEADER_SIZE) {
            if (Files.exists(logPath) && Files.size(logPath) > 0) {
                LOG.warn("WAL {} shorter than its header ({} bytes), discarding", logPath, Files.size(logPath));
            }
            resetLog(generation);
            return;
        }

        long logGeneration = readLogGeneration(logPath);
        if (logGeneration != generation) {
            LOG.warn("Discarding stale WAL: generation {} does not match snapshot generation {}",
                    logGeneration, generation);
            resetLog(generation);
            return;
        }

        replayLog(logPath);
        this.logChannel = FileChannel.open(logPath,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        logChannel.position(logChannel.size());
        LOG.info("WAL opened: path={}, size={} bytes", logPath, logChannel.size());
    }

    /**
     * Returns the generation stamped in the log header, or -1 if the header is unreadable.
     */
    private long readLogGeneration(Path logPath) throws IOException {
        try (FileChannel ch = FileChannel.open(logPath, StandardOpenOption.READ)) {
            ByteBuffer header = ByteBuffer.allocate(LOG_HEADER_SIZE);
            if (readFully(ch, header, 0) < LOG_HEADER_SIZE) {
                return -1;
            }
            header.flip();
            int magic = header.getInt();
            short version = header.getShort();
            long logGeneration = header.getLong();
            int storedCrc = header.getInt();

            CRC32C crc = new CRC32C();
            crc.update(header.array(), 0, LOG_HEADER_SIZE - CRC_SIZE);
            if (magic != LOG_MAGIC || version != VERSION || (int) crc.getValue() != storedCrc) {
                LOG.warn("Invalid WAL header: magic=0x{}, version={}", Integer.toHexString(magic), version);
                return -1;
            }
            return logGeneration;
        }
    }

    private void replayLog(Path logPath) throws IOException {
        LOG.info("Replaying WAL from: {}", logPath);
        long startTime = System.currentTimeMillis();
        int setCount = 0;
        int deleteCount = 0;

        try (FileChannel ch = FileChannel.open(logPath,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE)) {

            long fileSize = ch.size();
            long pos = LOG_HEADER_SIZE;
            long lastGoodPos = pos;
            ByteBuffer headerBuf = ByteBuffer.allocate(RECORD_HEADER_SIZE);

            while (true) {
                headerBuf.clear();
                int headerRead = readFully(ch, headerBuf, pos);
                if (headerRead < RECORD_HEADER_SIZE) {
                    if (headerRead > 0) {
                        LOG.debug("Incomplete header at pos {}: read {} bytes, expected {}",
                                pos, headerRead, RECORD_HEADER_SIZE);
                    }
                    break;
                }
                headerBuf.flip();

                int magic = headerBuf.getInt();
                short version = headerBuf.getShort();
                byte type = headerBuf.get();
                long index = headerBuf.getLong();
                long term = headerBuf.getLong();
                int keyLen = headerBuf.getInt();
                int valueLen = headerBuf.getInt();

                if (magic != RECORD_MAGIC || version != VERSION) {
                    LOG.warn("Invalid record header at pos {}: magic=0x{}, version={}",
                            pos, Integer.toHexString(magic), version);
                    break;
                }
                if (keyLen <= 0 || keyLen > maxValueSize || valueLen < 0 || valueLen > maxValueSize) {
                    LOG.warn("Invalid record lengths at pos {}: keyLen={}, valueLen={}", pos, keyLen, valueLen);
                    break;
                }

                ByteBuffer bodyBuf = ByteBuffer.allocate(keyLen + valueLen + CRC_SIZE);
                int bodyRead = readFully(ch, bodyBuf, pos + RECORD_HEADER_SIZE);
                if (bodyRead < bodyBuf.capacity()) {
                    LOG.debug("Incomplete record body at pos {}: read {} bytes, expected {}",
                            pos, bodyRead, bodyBuf.capacity());
                    break;
                }
                bodyBuf.flip();

                CRC32C crc = new CRC32C();
                crc.update(headerBuf.array(), 0, RECORD_HEADER_SIZE);
                crc.update(bodyBuf.array(), 0, keyLen + valueLen);
                int expectedCrc = bodyBuf.getInt(keyLen + valueLen);
                if ((int) crc.getValue() != expectedCrc) {
                    LOG.warn("CRC mismatch at pos {}: expected={}, computed={}",
                            pos, expectedCrc, (int) crc.getValue());
                    break;
                }

                String key = new String(bodyBuf.array(), 0, keyLen, StandardCharsets.UTF_8);
                if (type == TYPE_SET) {
                    byte[] value = new byte[valueLen];
                    System.arraycopy(bodyBuf.array(), keyLen, value, 0, valueLen);
                    data.put(key, value);
                    setCount++;
                } else if (type == TYPE_DELETE) {
                    data.remove(key);
                    deleteCount++;
                } else {
                    LOG.warn("Unknown record type at pos {}: {}", pos, type);
                    break;
                }
                if (index > lastAppliedIndex) {
                    lastAppliedIndex = index;
                    lastAppliedTerm = term;
                }
                LOG.trace("Replay {}: key={}, index={}, term={}",
                        type == TYPE_SET ? "SET" : "DELETE", key, index, term);

                lastGoodPos = pos + RECORD_HEADER_SIZE + keyLen + valueLen + CRC_SIZE;
                pos = lastGoodPos;
            }

            // Truncate file to last good position (remove torn tail)
            if (lastGoodPos < fileSize) {
                LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                        fileSize - lastGoodPos, fileSize, lastGoodPos);
                ch.truncate(lastGoodPos);
                if (syncEnabled) {
                    ch.force(true);
                }
            }
        }

        LOG.info("WAL replay complete: {} sets, {} deletes, lastApplied={}, {} ms",
                setCount, deleteCount, lastAppliedIndex, System.currentTimeMillis() - startTime);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Appends a single record to the WAL and forces it to disk.
     * Must be called with the lock held. On failure the partial record is cut off again.
     */
    private void writeRecord(byte type, long index, long term, byte[] key, byte[] value) throws IOException {
        int recordSize = RECORD_HEADER_SIZE + key.length + value.length + CRC_SIZE;

        if (recordSize > LARGE_WRITE_BYTES) {
            LOG.debug("Large write detected ({} bytes), checking disk space", recordSize);
            checkDiskSpace();
        }

        ByteBuffer buf = ByteBuffer.allocate(recordSize);
        buf.putInt(RECORD_MAGIC);
        buf.putShort(VERSION);
        buf.put(type);
        buf.putLong(index);
        buf.putLong(term);
        buf.putInt(key.length);
        buf.putInt(value.length);
        buf.put(key);
        buf.put(value);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, recordSize - CRC_SIZE);
        buf.putInt((int) crc.getValue());
        buf.flip();

        long writePosition = logChannel.position();
        try {
            while (buf.hasRemaining()) {
                logChannel.write(buf);
            }
            if (syncEnabled) {
                logChannel.force(true);
            }
        } catch (IOException e) {
            rollbackPartialWrite(writePosition, e);
            throw e;
        }
    }

    private void rollbackPartialWrite(long writePosition, IOException cause) {
        try {
            logChannel.truncate(writePosition);
            logChannel.position(writePosition);
            LOG.warn("Rolled back partial WAL record at position {}", writePosition);
        } catch (IOException e) {
            cause.addSuppressed(e);
            LOG.error("Could not roll back partial WAL record at position {}: {}", writePosition, e.getMessage());
        }
    }

    /**
     * Replaces the log with an empty one stamped with the given generation.
     */
    private void resetLog(long logGeneration) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(LOG_HEADER_SIZE);
        header.putInt(LOG_MAGIC);
        header.putShort(VERSION);
        header.putLong(logGeneration);
        CRC32C crc = new CRC32C();
        crc.update(header.array(), 0, LOG_HEADER_SIZE - CRC_SIZE);
        header.putInt((int) crc.getValue());
        header.flip();

        closeLogChannel();
        Path logPath = dataDir.resolve(LOG_FILE);
        replaceFile(dataDir.resolve(LOG_TMP_FILE), logPath, header);

        this.logChannel = FileChannel.open(logPath,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);
        logChannel.position(logChannel.size());
        LOG.debug("WAL reset: path={}, generation={}", logPath, logGeneration);
    }

    private void writeSnapshotFile(byte[] snapshot, long snapshotGeneration) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(SNAPSHOT_FILE_OVERHEAD + snapshot.length);
        buf.putInt(SNAPSHOT_FILE_MAGIC);
        buf.putLong(snapshotGeneration);
        buf.put(snapshot);
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        buf.flip();

        replaceFile(dataDir.resolve(SNAPSHOT_TMP_FILE), dataDir.resolve(SNAPSHOT_FILE), buf);
        LOG.debug("Snapshot file written: generation={}, {} bytes", snapshotGeneration, buf.capacity());
    }

    /**
     * Durably replaces {@code target}: write temp, fsync, atomic rename, fsync directory.
     */
    private void replaceFile(Path tmpPath, Path target, ByteBuffer contents) throws IOException {
        try (FileChannel ch = FileChannel.open(tmpPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            while (contents.hasRemaining()) {
                ch.write(contents);
            }
            if (syncEnabled) {
                ch.force(true);
            }
        }

        Files.move(tmpPath, target,
                StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.ATOMIC_MOVE);
        LOG.trace("Atomic rename: {} -> {}", tmpPath, target);

        if (syncEnabled) {
            syncDirectory(dataDir);
        }
    }

    private static int readFully(FileChannel ch, ByteBuffer buf, long position) throws IOException {
        int total = 0;
        while (buf.hasRemaining()) {
            int n = ch.read(buf, position + total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    /**
     * Fsyncs a directory so that renames inside it are durable.
     * Skipped on Windows, where directories cannot be opened for sync.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some file systems do not support directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock on the data directory to prevent two
     * processes (or two instances in one JVM) from sharing it.
     *
     * @throws StorageException if another holder has the lock
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on data directory: " + dataDir +
                        ". Another process may be using this storage.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
        exclusiveLock = null;
        lockChannel = null;
    }

    private void closeLogChannel() {
        try {
            if (logChannel != null && logChannel.isOpen()) {
                logChannel.close();
                LOG.trace("Log channel closed");
            }
        } catch (IOException e) {
            LOG.warn("Error closing log channel: {}", e.getMessage());
        }
        logChannel = null;
    }

    /**
     * Fails with an IOException when free space is below the configured minimum.
     */
    private void checkDiskSpace() throws IOException {
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        long usableSpaceMb = usableSpace / 1024 / 1024;
        long minFreeSpaceMb = minFreeSpace / 1024 / 1024;

        LOG.trace("Disk space check: {} MB available, {} MB required", usableSpaceMb, minFreeSpaceMb);

        if (usableSpace < minFreeSpace) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new IOException("Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB");
        }
    }

    private void requireOpen() {
        if (!opened || closed) {
            throw new IllegalStateException("Storage is not open");
        }
    }

    private void checkValueSize(int length) {
        if (length > maxValueSize) {
            LOG.error("Value too large: {} bytes (max: {})", length, maxValueSize);
            throw new StorageOperationException("Value too large: " + length +
                    " bytes (max: " + maxValueSize + ")");
        }
    }

    private static byte[] keyBytes(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be null or empty");
        }
        return key.getBytes(StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Snapshot Format
    // ========================================================================

    /**
     * Decoded snapshot contents.
     */
    record SnapshotImage(long lastAppliedIndex, long lastAppliedTerm, TreeMap<String, byte[]> data) {
    }

    /**
     * Format: MAGIC(4) + VERSION(2) + LAST_APPLIED(8) + LAST_TERM(8) + COUNT(4)
     * + (KEY_LEN(4) + KEY + VALUE_LEN(4) + VALUE)* + CRC(4), keys in sorted order.
     */
    static byte[] encodeSnapshot(long lastApplied, long lastTerm, TreeMap<String, byte[]> entries) {
        long size = SNAPSHOT_HEADER_SIZE + CRC_SIZE;
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            size += 4L + e.getKey().getBytes(StandardCharsets.UTF_8).length + 4L + e.getValue().length;
        }
        if (size > Integer.MAX_VALUE - 16) {
            throw new StorageException("Key space too large to snapshot: " + size + " bytes");
        }

        ByteBuffer buf = ByteBuffer.allocate((int) size);
        buf.putInt(SNAPSHOT_MAGIC);
        buf.putShort(VERSION);
        buf.putLong(lastApplied);
        buf.putLong(lastTerm);
        buf.putInt(entries.size());
        for (Map.Entry<String, byte[]> e : entries.entrySet()) {
            byte[] key = e.getKey().getBytes(StandardCharsets.UTF_8);
            buf.putInt(key.length);
            buf.put(key);
            buf.putInt(e.getValue().length);
            buf.put(e.getValue());
        }
        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, buf.position());
        buf.putInt((int) crc.getValue());
        return buf.array();
    }

    /**
     * Decodes and validates a snapshot without touching any storage state.
     *
     * @throws StorageException if the bytes are not a well-formed snapshot
     */
    static SnapshotImage decodeSnapshot(byte[] snapshot, int maxValueSize) {
        if (snapshot == null || snapshot.length < SNAPSHOT_HEADER_SIZE + CRC_SIZE) {
            throw new StorageException("Corrupt snapshot: too short ("
                    + (snapshot == null ? "null" : snapshot.length + " bytes") + ")");
        }

        CRC32C crc = new CRC32C();
        crc.update(snapshot, 0, snapshot.length - CRC_SIZE);
        int storedCrc = ByteBuffer.wrap(snapshot).getInt(snapshot.length - CRC_SIZE);
        if ((int) crc.getValue() != storedCrc) {
            throw new StorageException("Corrupt snapshot: CRC mismatch");
        }

        ByteBuffer buf = ByteBuffer.wrap(snapshot, 0, snapshot.length - CRC_SIZE);
        try {
            int magic = buf.getInt();
            short version = buf.getShort();
            if (magic != SNAPSHOT_MAGIC || version != VERSION) {
                throw new StorageException("Corrupt snapshot: magic=0x" + Integer.toHexString(magic)
                        + ", version=" + version);
            }
            long lastApplied = buf.getLong();
            long lastTerm = buf.getLong();
            int count = buf.getInt();
            if (count < 0 || lastApplied < 0 || lastTerm < 0) {
                throw new StorageException("Corrupt snapshot: count=" + count + ", lastApplied=" + lastApplied);
            }

            TreeMap<String, byte[]> entries = new TreeMap<>();
            for (int i = 0; i < count; i++) {
                int keyLen = buf.getInt();
                if (keyLen <= 0 || keyLen > buf.remaining()) {
                    throw new StorageException("Corrupt snapshot: invalid key length " + keyLen);
                }
                byte[] key = new byte[keyLen];
                buf.get(key);
                int valueLen = buf.getInt();
                if (valueLen < 0 || valueLen > maxValueSize || valueLen > buf.remaining()) {
                    throw new StorageException("Corrupt snapshot: invalid value length " + valueLen);
                }
                byte[] value = new byte[valueLen];
                buf.get(value);
                if (entries.put(new String(key, StandardCharsets.UTF_8), value) != null) {
                    throw new StorageException("Corrupt snapshot: duplicate key");
                }
            }
            if (buf.hasRemaining()) {
                throw new StorageException("Corrupt snapshot: " + buf.remaining() + " trailing bytes");
            }
            return new SnapshotImage(lastApplied, lastTerm, entries);

        } catch (BufferUnderflowException e) {
            throw new StorageException("Corrupt snapshot: truncated", e);
        }
    }
}
