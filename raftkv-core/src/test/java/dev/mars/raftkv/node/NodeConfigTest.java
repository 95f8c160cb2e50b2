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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class NodeConfigTest {

    private static final String PEERS = "127.0.0.1:7001, 127.0.0.1:7002 ,127.0.0.1:7003";

    private static ConfigSource file(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return ConfigSource.of(properties);
    }

    @Test
    void testDefaults() {
        NodeConfig config = NodeConfig.builder(file()).nodeId(2).peers(PEERS).build();

        assertEquals(2, config.nodeId());
        assertEquals(List.of("127.0.0.1:7001", "127.0.0.1:7002", "127.0.0.1:7003"), config.peers());
        assertEquals("127.0.0.1:7002", config.selfPeerAddress());
        assertEquals(List.of(1L, 2L, 3L), config.voters());
        assertEquals(100, config.tickIntervalMs());
        assertEquals(10, config.electionTicks());
        assertEquals(2, config.heartbeatTicks());
        assertEquals(1024, config.maxPendingProposals());
        assertEquals(5000L, config.proposalTimeoutMs());
        assertEquals(1000, config.snapshotThreshold());
        assertEquals(50052, config.clientPort());
    }

    @Test
    void testFileValues() {
        NodeConfig config = NodeConfig.builder(file(
                NodeConfig.PROP_NODE_ID, "3",
                NodeConfig.PROP_PEERS, PEERS,
                NodeConfig.PROP_ELECTION_TICKS, "20",
                NodeConfig.PROP_CLIENT_BASE_PORT, "6000")).build();

        assertEquals(3, config.nodeId());
        assertEquals(20, config.electionTicks());
        assertEquals(6003, config.clientPort());
    }

    @Test
    void testBuilderBeatsFile() {
        NodeConfig config = NodeConfig.builder(file(NodeConfig.PROP_NODE_ID, "3", NodeConfig.PROP_PEERS, PEERS))
                .nodeId(1)
                .snapshotThreshold(0)
                .build();

        assertEquals(1, config.nodeId());
        assertEquals(0, config.snapshotThreshold());
    }

    @Test
    void testToRaftConfig() {
        RaftConfig raft = NodeConfig.builder(file()).nodeId(1).peers(PEERS)
                .electionTicks(15).heartbeatTicks(3).maxEntriesPerMessage(8).build()
                .toRaftConfig();

        assertEquals(new RaftConfig(1, List.of(1L, 2L, 3L), 15, 3, 8, NodeConfig.MAX_APPEND_BYTES), raft);
        assertTrue(raft.maxBytesPerMessage() < MessageCodec.MAX_BODY_BYTES);
    }

    @Test
    void testParsePeers_DropsBlanks() {
        assertEquals(List.of("a:1", "b:2"), NodeConfig.parsePeers(" a:1,, b:2 ,"));
        assertTrue(NodeConfig.parsePeers(null).isEmpty());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).peers(PEERS).build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file(NodeConfig.PROP_NODE_ID, "one")).peers(PEERS).build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).nodeId(4).peers(PEERS).build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).nodeId(1).peers("").build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).nodeId(1).peers(PEERS).electionTicks(2).heartbeatTicks(2).build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).nodeId(1).peers(PEERS).maxPendingProposals(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).nodeId(1).peers(PEERS).clientBasePort(65534).build());
        assertThrows(IllegalArgumentException.class,
                () -> NodeConfig.builder(file()).nodeId(1).peers(PEERS)
                        .maxEntriesPerMessage(NodeConfig.MAX_ENTRIES_PER_MESSAGE_LIMIT + 1).build());
    }

    @Test
    void testRequireReplicable_ValueLimitMustFitOneAppend() {
        NodeConfig config = NodeConfig.builder(file()).nodeId(1).peers(PEERS).build();

        config.requireReplicable(storage(16));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> config.requireReplicable(storage(32)));
        assertTrue(e.getMessage().contains("maxValueSizeMb 32"));
    }

    private static KvStorageConfig storage(int maxValueSizeMb) {
        return KvStorageConfig.builder(file()).maxValueSizeMb(maxValueSizeMb).build();
    }
}
