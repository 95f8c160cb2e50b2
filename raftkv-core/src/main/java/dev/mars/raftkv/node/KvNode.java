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
package dev.mars.raftkv.node;

import dev.mars.raftkv.raft.HardState;
import dev.mars.raftkv.raft.RaftCore;
import dev.mars.raftkv.raft.SnapshotData;
import dev.mars.raftkv.storage.FileKvStorage;
import dev.mars.raftkv.storage.KvStorage;
import dev.mars.raftkv.storage.KvStorageConfig;
import dev.mars.raftkv.transport.PeerDirectory;
import dev.mars.raftkv.transport.PeerListener;
import dev.mars.raftkv.transport.TcpPeerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.Random;

/**
 * One replicated key-value node: storage, consensus core, driver and peer transport.
 * <p>
 * On construction the storage is opened and the core resumes from it: the
 * persisted term and vote, and the storage contents as an already-applied
 * snapshot at the last applied index. Only the log tail after that index
 * is rebuilt from the leader.
 *
 * <pre>
 * try (KvNode node = new KvNode(nodeConfig, storageConfig)) {
 *     node.start();
 *     node.service().set("k", "v");
 * }
 * </pre>
 */
public final class KvNode implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(KvNode.class);

    private static final int MAX_INBOUND_CONNECTIONS = 64;

    private final NodeConfig config;
    private final KvStorage storage;
    private final PeerDirectory directory;
    private final TcpPeerTransport transport;
    private final RaftCore core;
    private final ConsensusDriver driver;
    private final PeerListener listener;
    private final KvService service;
    private boolean closed;

    /**
     * Opens storage in {@code storageConfig.dataDir()} and assembles the node.
     * If assembly fails after storage was opened, storage is closed again.
     *
     * @throws dev.mars.raftkv.storage.StorageException if storage cannot be opened
     * @throws IllegalArgumentException                 if the storage value limit does not fit
     *                                                  into one replication message, or a
     *                                                  peer address is malformed
     */
    public KvNode(NodeConfig config, KvStorageConfig storageConfig) {
        config.requireReplicable(storageConfig);
        this.config = config;
        FileKvStorage fileStorage = new FileKvStorage(storageConfig);
        fileStorage.open(storageConfig.dataDir());
        this.storage = fileStorage;

        TcpPeerTransport peerTransport = null;
        try {
            this.directory = PeerDirectory.fromPeerList(config.peers());
            this.core = new RaftCore(config.toRaftConfig(), restoredHardState(storage),
                    restoredSnapshot(storage, config), new Random());
            peerTransport = new TcpPeerTransport(config.nodeId(), directory,
                    config.sendThreads(), config.sendQueueCapacity(), config.sendTimeoutMs());
            this.transport = peerTransport;
            this.driver = new ConsensusDriver(config, core, storage, transport, directory);

            InetSocketAddress self = PeerDirectory.parseAddress(config.selfPeerAddress());
            this.listener = new PeerListener(config.nodeId(), new InetSocketAddress(self.getPort()),
                    driver::step, MAX_INBOUND_CONNECTIONS);
            this.service = new KvService(driver, storage, config.proposalTimeoutMs());
        } catch (RuntimeException e) {
            LOG.error("Failed to assemble node {}, releasing storage: {}", config.nodeId(), e.getMessage());
            if (peerTransport != null) {
                peerTransport.close();
            }
            fileStorage.close();
            throw e;
        }
    }

    private static HardState restoredHardState(KvStorage storage) {
        KvStorage.PersistentMeta meta = storage.loadMetadata();
        return new HardState(meta.currentTerm(), meta.votedFor(), 0);
    }

    private static SnapshotData restoredSnapshot(KvStorage storage, NodeConfig config) {
        if (storage.lastAppliedIndex() == 0) {
            return null;
        }
        // Voters come from configuration; membership changes are not persisted
        return new SnapshotData(storage.lastAppliedIndex(), storage.lastAppliedTerm(),
                config.voters(), storage.snapshot());
    }

    /**
     * Starts listening for peers and starts the driver.
     *
     * @throws IOException if the peer port cannot be bound
     */
    public void start() throws IOException {
        listener.start();
        driver.start();
        LOG.info("Node {} started: peer port {}, applied index {}, {} keys",
                config.nodeId(), listener.port(), storage.lastAppliedIndex(), storage.size());
    }

    public NodeConfig config() {
        return config;
    }

    public KvService service() {
        return service;
    }

    public ConsensusDriver driver() {
        return driver;
    }

    public KvStorage storage() {
        return storage;
    }

    public PeerDirectory directory() {
        return directory;
    }

    public NodeStatus status() {
        return driver.status();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Closing node {}", config.nodeId());
        listener.close();
        driver.close();
        transport.close();
        storage.close();
    }
}
