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

import dev.mars.raftkv.config.ConfigSource;
import dev.mars.raftkv.raft.RaftConfig;
import dev.mars.raftkv.storage.KvStorageConfig;
import dev.mars.raftkv.transport.MessageCodec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Configuration of one replicated key-value node.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Draftkv.tickIntervalMs=50})</li>
 *   <li>Environment variables (e.g., {@code RAFTKV_TICK_INTERVAL_MS})</li>
 *   <li>Properties file ({@code raftkv.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>nodeId</td><td>raftkv.nodeId</td><td>RAFTKV_NODE_ID</td><td>(required)</td></tr>
 *   <tr><td>peers</td><td>raftkv.peers</td><td>RAFTKV_PEERS</td><td>(required, comma separated)</td></tr>
 *   <tr><td>tickIntervalMs</td><td>raftkv.tickIntervalMs</td><td>RAFTKV_TICK_INTERVAL_MS</td><td>100</td></tr>
 *   <tr><td>electionTicks</td><td>raftkv.electionTicks</td><td>RAFTKV_ELECTION_TICKS</td><td>10</td></tr>
 *   <tr><td>heartbeatTicks</td><td>raftkv.heartbeatTicks</td><td>RAFTKV_HEARTBEAT_TICKS</td><td>2</td></tr>
 *   <tr><td>maxEntriesPerMessage</td><td>raftkv.maxEntriesPerMessage</td><td>RAFTKV_MAX_ENTRIES_PER_MESSAGE</td><td>64</td></tr>
 *   <tr><td>sendTimeoutMs</td><td>raftkv.sendTimeoutMs</td><td>RAFTKV_SEND_TIMEOUT_MS</td><td>1000</td></tr>
 *   <tr><td>sendThreads</td><td>raftkv.sendThreads</td><td>RAFTKV_SEND_THREADS</td><td>4</td></tr>
 *   <tr><td>sendQueueCapacity</td><td>raftkv.sendQueueCapacity</td><td>RAFTKV_SEND_QUEUE_CAPACITY</td><td>1024</td></tr>
 *   <tr><td>maxPendingProposals</td><td>raftkv.maxPendingProposals</td><td>RAFTKV_MAX_PENDING_PROPOSALS</td><td>1024</td></tr>
 *   <tr><td>proposalTimeoutMs</td><td>raftkv.proposalTimeoutMs</td><td>RAFTKV_PROPOSAL_TIMEOUT_MS</td><td>5000</td></tr>
 *   <tr><td>snapshotThreshold</td><td>raftkv.snapshotThreshold</td><td>RAFTKV_SNAPSHOT_THRESHOLD</td><td>1000</td></tr>
 *   <tr><td>clientBasePort</td><td>raftkv.clientBasePort</td><td>RAFTKV_CLIENT_BASE_PORT</td><td>50050</td></tr>
 * </table>
 * <p>
 * {@code peers} is ordered: entry {@code i} is the peer address of node {@code i + 1},
 * and the list includes this node's own address.
 */
public final class NodeConfig {

    // Property keys
    static final String PROP_NODE_ID = "raftkv.nodeId";
    static final String PROP_PEERS = "raftkv.peers";
    static final String PROP_TICK_INTERVAL_MS = "raftkv.tickIntervalMs";
    static final String PROP_ELECTION_TICKS = "raftkv.electionTicks";
    static final String PROP_HEARTBEAT_TICKS = "raftkv.heartbeatTicks";
    static final String PROP_MAX_ENTRIES_PER_MESSAGE = "raftkv.maxEntriesPerMessage";
    static final String PROP_SEND_TIMEOUT_MS = "raftkv.sendTimeoutMs";
    static final String PROP_SEND_THREADS = "raftkv.sendThreads";
    static final String PROP_SEND_QUEUE_CAPACITY = "raftkv.sendQueueCapacity";
    static final String PROP_MAX_PENDING_PROPOSALS = "raftkv.maxPendingProposals";
    static final String PROP_PROPOSAL_TIMEOUT_MS = "raftkv.proposalTimeoutMs";
    static final String PROP_SNAPSHOT_THRESHOLD = "raftkv.snapshotThreshold";
    static final String PROP_CLIENT_BASE_PORT = "raftkv.clientBasePort";

    // Defaults
    private static final int DEFAULT_TICK_INTERVAL_MS = 100;
    private static final int DEFAULT_ELECTION_TICKS = 10;
    private static final int DEFAULT_HEARTBEAT_TICKS = 2;
    private static final int DEFAULT_MAX_ENTRIES_PER_MESSAGE = 64;
    private static final int DEFAULT_SEND_TIMEOUT_MS = 1000;
    private static final int DEFAULT_SEND_THREADS = 4;
    private static final int DEFAULT_SEND_QUEUE_CAPACITY = 1024;
    private static final int DEFAULT_MAX_PENDING_PROPOSALS = 1024;
    private static final long DEFAULT_PROPOSAL_TIMEOUT_MS = 5000;
    private static final int DEFAULT_SNAPSHOT_THRESHOLD = 1000;
    private static final int DEFAULT_CLIENT_BASE_PORT = 50050;

    /** Entry payload budget of one append message; the rest of a frame is left for headers. */
    static final long MAX_APPEND_BYTES = MessageCodec.MAX_BODY_BYTES / 2;
    static final int MAX_ENTRIES_PER_MESSAGE_LIMIT = 1_000_000;

    private final long nodeId;
    private final List<String> peers;
    private final int tickIntervalMs;
    private final int electionTicks;
    private final int heartbeatTicks;
    private final int maxEntriesPerMessage;
    private final int sendTimeoutMs;
    private final int sendThreads;
    private final int sendQueueCapacity;
    private final int maxPendingProposals;
    private final long proposalTimeoutMs;
    private final int snapshotThreshold;
    private final int clientBasePort;

    private NodeConfig(Builder b) {
        this.nodeId = b.nodeId;
        this.peers = List.copyOf(b.peers);
        this.tickIntervalMs = b.tickIntervalMs;
        this.electionTicks = b.electionTicks;
        this.heartbeatTicks = b.heartbeatTicks;
        this.maxEntriesPerMessage = b.maxEntriesPerMessage;
        this.sendTimeoutMs = b.sendTimeoutMs;
        this.sendThreads = b.sendThreads;
        this.sendQueueCapacity = b.sendQueueCapacity;
        this.maxPendingProposals = b.maxPendingProposals;
        this.proposalTimeoutMs = b.proposalTimeoutMs;
        this.snapshotThreshold = b.snapshotThreshold;
        this.clientBasePort = b.clientBasePort;
    }

    public long nodeId() {
        return nodeId;
    }

    /** Ordered peer addresses, entry {@code i} belonging to node {@code i + 1}. */
    public List<String> peers() {
        return peers;
    }

    /** This node's own entry in {@link #peers()}. */
    public String selfPeerAddress() {
        return peers.get((int) nodeId - 1);
    }

    /** Initial voters: ids 1 through {@code peers().size()}. */
    public List<Long> voters() {
        return LongStream.rangeClosed(1, peers.size()).boxed().collect(Collectors.toList());
    }

    public int tickIntervalMs() {
        return tickIntervalMs;
    }

    public int electionTicks() {
        return electionTicks;
    }

    public int heartbeatTicks() {
        return heartbeatTicks;
    }

    public int maxEntriesPerMessage() {
        return maxEntriesPerMessage;
    }

    public int sendTimeoutMs() {
        return sendTimeoutMs;
    }

    public int sendThreads() {
        return sendThreads;
    }

    public int sendQueueCapacity() {
        return sendQueueCapacity;
    }

    public int maxPendingProposals() {
        return maxPendingProposals;
    }

    public long proposalTimeoutMs() {
        return proposalTimeoutMs;
    }

    /** Applied entries between log compactions; 0 disables compaction. */
    public int snapshotThreshold() {
        return snapshotThreshold;
    }

    public int clientBasePort() {
        return clientBasePort;
    }

    /** Port of the client-facing listener: base port plus node id. */
    public int clientPort() {
        return clientBasePort + (int) nodeId;
    }

    public RaftConfig toRaftConfig() {
        return new RaftConfig(nodeId, voters(), electionTicks, heartbeatTicks, maxEntriesPerMessage,
                MAX_APPEND_BYTES);
    }

    /**
     * Checks that the largest command the storage accepts, a SET with key and value
     * both at the size limit, fits into one append message.
     *
     * @throws IllegalArgumentException if it does not
     */
    public void requireReplicable(KvStorageConfig storageConfig) {
        long largestCommand = 2L * storageConfig.maxValueSizeBytes() + 16;
        if (largestCommand > MAX_APPEND_BYTES) {
            throw new IllegalArgumentException("maxValueSizeMb " + storageConfig.maxValueSizeMb()
                    + " allows commands of " + largestCommand + " bytes, more than one append message carries ("
                    + MAX_APPEND_BYTES + ")");
        }
    }

    @Override
    public String toString() {
        return "NodeConfig{" +
                "nodeId=" + nodeId +
                ", peers=" + peers +
                ", tickIntervalMs=" + tickIntervalMs +
                ", electionTicks=" + electionTicks +
                ", heartbeatTicks=" + heartbeatTicks +
                ", maxEntriesPerMessage=" + maxEntriesPerMessage +
                ", sendTimeoutMs=" + sendTimeoutMs +
                ", sendThreads=" + sendThreads +
                ", sendQueueCapacity=" + sendQueueCapacity +
                ", maxPendingProposals=" + maxPendingProposals +
                ", proposalTimeoutMs=" + proposalTimeoutMs +
                ", snapshotThreshold=" + snapshotThreshold +
                ", clientBasePort=" + clientBasePort +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder(ConfigSource.load());
    }

    public static Builder builder(ConfigSource source) {
        return new Builder(source);
    }

    /**
     * Splits a comma separated peer list, dropping blanks.
     */
    public static List<String> parsePeers(String csv) {
        if (csv == null) {
            return List.of();
        }
        List<String> peers = new ArrayList<>();
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(peers::add);
        return peers;
    }

    /**
     * Builder for {@link NodeConfig}.
     */
    public static final class Builder {
        private final ConfigSource source;

        private Long nodeId;
        private List<String> peers;
        private Integer tickIntervalMs;
        private Integer electionTicks;
        private Integer heartbeatTicks;
        private Integer maxEntriesPerMessage;
        private Integer sendTimeoutMs;
        private Integer sendThreads;
        private Integer sendQueueCapacity;
        private Integer maxPendingProposals;
        private Long proposalTimeoutMs;
        private Integer snapshotThreshold;
        private Integer clientBasePort;

        private Builder(ConfigSource source) {
            this.source = source;
        }

        public Builder nodeId(long nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder peers(List<String> peers) {
            this.peers = new ArrayList<>(peers);
            return this;
        }

        public Builder peers(String csv) {
            this.peers = parsePeers(csv);
            return this;
        }

        public Builder tickIntervalMs(int tickIntervalMs) {
            this.tickIntervalMs = tickIntervalMs;
            return this;
        }

        public Builder electionTicks(int electionTicks) {
            this.electionTicks = electionTicks;
            return this;
        }

        public Builder heartbeatTicks(int heartbeatTicks) {
            this.heartbeatTicks = heartbeatTicks;
            return this;
        }

        public Builder maxEntriesPerMessage(int maxEntriesPerMessage) {
            this.maxEntriesPerMessage = maxEntriesPerMessage;
            return this;
        }

        public Builder sendTimeoutMs(int sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
            return this;
        }

        public Builder sendThreads(int sendThreads) {
            this.sendThreads = sendThreads;
            return this;
        }

        public Builder sendQueueCapacity(int sendQueueCapacity) {
            this.sendQueueCapacity = sendQueueCapacity;
            return this;
        }

        public Builder maxPendingProposals(int maxPendingProposals) {
            this.maxPendingProposals = maxPendingProposals;
            return this;
        }

        public Builder proposalTimeoutMs(long proposalTimeoutMs) {
            this.proposalTimeoutMs = proposalTimeoutMs;
            return this;
        }

        public Builder snapshotThreshold(int snapshotThreshold) {
            this.snapshotThreshold = snapshotThreshold;
            return this;
        }

        public Builder clientBasePort(int clientBasePort) {
            this.clientBasePort = clientBasePort;
            return this;
        }

        public NodeConfig build() {
            if (nodeId == null) {
                String value = source.resolve(PROP_NODE_ID, "RAFTKV_NODE_ID");
                if (value == null) {
                    throw new IllegalArgumentException("nodeId is required");
                }
                try {
                    nodeId = Long.parseLong(value);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("nodeId must be numeric: '" + value + "'", e);
                }
            }
            if (peers == null) {
                peers = parsePeers(source.resolve(PROP_PEERS, "RAFTKV_PEERS"));
            }
            if (tickIntervalMs == null) {
                tickIntervalMs = source.resolveInt(PROP_TICK_INTERVAL_MS, "RAFTKV_TICK_INTERVAL_MS", DEFAULT_TICK_INTERVAL_MS);
            }
            if (electionTicks == null) {
                electionTicks = source.resolveInt(PROP_ELECTION_TICKS, "RAFTKV_ELECTION_TICKS", DEFAULT_ELECTION_TICKS);
            }
            if (heartbeatTicks == null) {
                heartbeatTicks = source.resolveInt(PROP_HEARTBEAT_TICKS, "RAFTKV_HEARTBEAT_TICKS", DEFAULT_HEARTBEAT_TICKS);
            }
            if (maxEntriesPerMessage == null) {
                maxEntriesPerMessage = source.resolveInt(PROP_MAX_ENTRIES_PER_MESSAGE,
                        "RAFTKV_MAX_ENTRIES_PER_MESSAGE", DEFAULT_MAX_ENTRIES_PER_MESSAGE);
            }
            if (sendTimeoutMs == null) {
                sendTimeoutMs = source.resolveInt(PROP_SEND_TIMEOUT_MS, "RAFTKV_SEND_TIMEOUT_MS", DEFAULT_SEND_TIMEOUT_MS);
            }
            if (sendThreads == null) {
                sendThreads = source.resolveInt(PROP_SEND_THREADS, "RAFTKV_SEND_THREADS", DEFAULT_SEND_THREADS);
            }
            if (sendQueueCapacity == null) {
                sendQueueCapacity = source.resolveInt(PROP_SEND_QUEUE_CAPACITY,
                        "RAFTKV_SEND_QUEUE_CAPACITY", DEFAULT_SEND_QUEUE_CAPACITY);
            }
            if (maxPendingProposals == null) {
                maxPendingProposals = source.resolveInt(PROP_MAX_PENDING_PROPOSALS,
                        "RAFTKV_MAX_PENDING_PROPOSALS", DEFAULT_MAX_PENDING_PROPOSALS);
            }
            if (proposalTimeoutMs == null) {
                proposalTimeoutMs = source.resolveLong(PROP_PROPOSAL_TIMEOUT_MS,
                        "RAFTKV_PROPOSAL_TIMEOUT_MS", DEFAULT_PROPOSAL_TIMEOUT_MS);
            }
            if (snapshotThreshold == null) {
                snapshotThreshold = source.resolveInt(PROP_SNAPSHOT_THRESHOLD,
                        "RAFTKV_SNAPSHOT_THRESHOLD", DEFAULT_SNAPSHOT_THRESHOLD);
            }
            if (clientBasePort == null) {
                clientBasePort = source.resolveInt(PROP_CLIENT_BASE_PORT,
                        "RAFTKV_CLIENT_BASE_PORT", DEFAULT_CLIENT_BASE_PORT);
            }
            validate();
            return new NodeConfig(this);
        }

        private void validate() {
            if (peers.isEmpty()) {
                throw new IllegalArgumentException("peers must not be empty");
            }
            if (nodeId < 1 || nodeId > peers.size()) {
                throw new IllegalArgumentException("nodeId " + nodeId + " has no entry in a peer list of "
                        + peers.size());
            }
            requirePositive("tickIntervalMs", tickIntervalMs);
            requirePositive("heartbeatTicks", heartbeatTicks);
            requirePositive("maxEntriesPerMessage", maxEntriesPerMessage);
            if (maxEntriesPerMessage > MAX_ENTRIES_PER_MESSAGE_LIMIT) {
                throw new IllegalArgumentException("maxEntriesPerMessage must be <= "
                        + MAX_ENTRIES_PER_MESSAGE_LIMIT + ": " + maxEntriesPerMessage);
            }
            requirePositive("sendTimeoutMs", sendTimeoutMs);
            requirePositive("sendThreads", sendThreads);
            requirePositive("sendQueueCapacity", sendQueueCapacity);
            requirePositive("maxPendingProposals", maxPendingProposals);
            if (electionTicks <= heartbeatTicks) {
                throw new IllegalArgumentException("electionTicks (" + electionTicks
                        + ") must be greater than heartbeatTicks (" + heartbeatTicks + ")");
            }
            if (proposalTimeoutMs <= 0) {
                throw new IllegalArgumentException("proposalTimeoutMs must be > 0: " + proposalTimeoutMs);
            }
            if (snapshotThreshold < 0) {
                throw new IllegalArgumentException("snapshotThreshold must be >= 0: " + snapshotThreshold);
            }
            if (clientBasePort < 0 || clientBasePort + peers.size() > 65535) {
                throw new IllegalArgumentException("clientBasePort out of range: " + clientBasePort);
            }
        }

        private static void requirePositive(String name, int value) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0: " + value);
            }
        }
    }
}
