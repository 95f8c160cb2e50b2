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
import dev.mars.raftkv.storage.KvStorageConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real nodes over loopback TCP.
 */
class ClusterIntegrationTest {

    @TempDir
    Path tempDir;

    private final List<KvNode> nodes = new ArrayList<>();
    private List<String> peers;

    @AfterEach
    void tearDown() {
        nodes.forEach(KvNode::close);
    }

    private static List<String> freePeers(int count) throws IOException {
        List<String> result = new ArrayList<>();
        List<ServerSocket> sockets = new ArrayList<>();
        try {
            for (int i = 0; i < count; i++) {
                ServerSocket socket = new ServerSocket(0);
                sockets.add(socket);
                result.add("127.0.0.1:" + socket.getLocalPort());
            }
        } finally {
            for (ServerSocket socket : sockets) {
                socket.close();
            }
        }
        return result;
    }

    private KvNode newNode(long id) {
        NodeConfig config = NodeConfig.builder(ConfigSource.of(new Properties()))
                .nodeId(id)
                .peers(peers)
                .tickIntervalMs(20)
                .electionTicks(10)
                .heartbeatTicks(2)
                .sendTimeoutMs(500)
                .proposalTimeoutMs(3000)
                .snapshotThreshold(20)
                .build();
        KvStorageConfig storageConfig = KvStorageConfig.builder(ConfigSource.of(new Properties()))
                .dataDir(tempDir.resolve("data_" + id))
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
        return new KvNode(config, storageConfig);
    }

    private KvNode startNode(long id) throws IOException {
        KvNode node = newNode(id);
        node.start();
        nodes.add(node);
        return node;
    }

    private List<KvNode> running() {
        return nodes.stream()
                .filter(n -> n.status().driverState() == DriverState.RUNNING)
                .collect(Collectors.toList());
    }

    private KvNode awaitLeader() {
        await().atMost(Duration.ofSeconds(15))
                .until(() -> running().stream().anyMatch(n -> n.status().isLeader()));
        return running().stream().filter(n -> n.status().isLeader()).findFirst().orElseThrow();
    }

    /** A set can race a just-deposed leader; retry until one sticks. */
    private void setOnLeader(String key, String value) {
        await().atMost(Duration.ofSeconds(20))
                .until(() -> awaitLeader().service().set(key, value));
    }

    @Test
    void testThreeNodes_WriteOnLeaderReachesEveryNode() throws IOException {
        peers = freePeers(3);
        for (long id = 1; id <= 3; id++) {
            startNode(id);
        }

        setOnLeader("language", "java");

        await().atMost(Duration.ofSeconds(10)).until(() ->
                nodes.stream().allMatch(n -> n.service().get("language").equals(Optional.of("java"))));
    }

    @Test
    void testThreeNodes_FollowerRefusesWrites() throws IOException {
        peers = freePeers(3);
        for (long id = 1; id <= 3; id++) {
            startNode(id);
        }
        KvNode leader = awaitLeader();
        await().atMost(Duration.ofSeconds(10)).until(() ->
                nodes.stream().allMatch(n -> n.status().leaderId() == leader.config().nodeId()));

        KvNode follower = nodes.stream().filter(n -> n != leader).findFirst().orElseThrow();

        assertFalse(follower.service().set("k", "v"));
        assertTrue(follower.service().get("k").isEmpty());
    }

    @Test
    void testThreeNodes_SurvivesLeaderLoss() throws IOException {
        peers = freePeers(3);
        for (long id = 1; id <= 3; id++) {
            startNode(id);
        }
        setOnLeader("before", "1");
        KvNode oldLeader = awaitLeader();

        oldLeader.close();
        nodes.remove(oldLeader);

        KvNode newLeader = awaitLeader();
        assertNotEquals(oldLeader.config().nodeId(), newLeader.config().nodeId());
        setOnLeader("after", "2");

        await().atMost(Duration.ofSeconds(10)).until(() -> nodes.stream().allMatch(n ->
                n.service().get("before").equals(Optional.of("1"))
                        && n.service().get("after").equals(Optional.of("2"))));
    }

    @Test
    void testRestartedFollower_CatchesUp() throws IOException {
        peers = freePeers(3);
        for (long id = 1; id <= 3; id++) {
            startNode(id);
        }
        KvNode leader = awaitLeader();
        KvNode follower = nodes.stream().filter(n -> n != leader).findFirst().orElseThrow();
        long followerId = follower.config().nodeId();
        follower.close();
        nodes.remove(follower);

        // Enough writes to force a compaction on the leader while the follower is away
        for (int i = 0; i < 30; i++) {
            setOnLeader("k" + i, "v" + i);
        }

        KvNode restarted = startNode(followerId);

        await().atMost(Duration.ofSeconds(15)).until(() ->
                restarted.service().get("k29").equals(Optional.of("v29")));
        assertEquals(Optional.of("v0"), restarted.service().get("k0"));
    }

    @Test
    void testSingleNode_StateSurvivesRestart() throws IOException {
        peers = freePeers(1);
        KvNode first = startNode(1);
        awaitLeader();
        assertTrue(first.service().set("a", "1"));
        assertTrue(first.service().set("b", "2"));
        assertTrue(first.service().delete("a"));
        long termBefore = first.status().term();
        long appliedBefore = first.storage().lastAppliedIndex();
        first.close();
        nodes.remove(first);

        KvNode second = startNode(1);

        assertEquals(Optional.of("2"), second.service().get("b"));
        assertTrue(second.service().get("a").isEmpty());
        assertEquals(appliedBefore, second.storage().lastAppliedIndex());
        awaitLeader();
        assertTrue(second.status().term() > termBefore);
        assertTrue(second.service().set("c", "3"));
        assertTrue(second.storage().lastAppliedIndex() > appliedBefore);
    }
}
