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
package dev.mars.raftkv.server;

import dev.mars.raftkv.config.ConfigSource;
import dev.mars.raftkv.node.KvNode;
import dev.mars.raftkv.node.NodeConfig;
import dev.mars.raftkv.storage.KvStorageConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ClientServer} in front of a single-node cluster.
 */
class ClientServerTest {

    @TempDir
    Path tempDir;

    private KvNode node;
    private ClientServer server;

    @BeforeEach
    void setUp() throws IOException {
        int peerPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            peerPort = socket.getLocalPort();
        }
        NodeConfig config = NodeConfig.builder(ConfigSource.of(new Properties()))
                .nodeId(1)
                .peers("127.0.0.1:" + peerPort)
                .tickIntervalMs(20)
                .electionTicks(5)
                .heartbeatTicks(1)
                .proposalTimeoutMs(2000)
                .build();
        node = new KvNode(config, KvStorageConfig.builder(ConfigSource.of(new Properties()))
                .dataDir(tempDir)
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build());
        server = new ClientServer(node.service(), new InetSocketAddress("127.0.0.1", 0), 4);
    }

    @AfterEach
    void tearDown() {
        server.close();
        node.close();
    }

    private void startAndAwaitLeader() throws IOException {
        node.start();
        await().atMost(Duration.ofSeconds(10)).until(() -> node.status().isLeader());
    }

    @Nested
    @DisplayName("Request handling")
    class Requests {

        @Test
        void testSetGetDelete() throws IOException {
            startAndAwaitLeader();

            assertEquals(ClientServer.OK, server.execute("SET fruit apple"));
            assertEquals("VALUE apple", server.execute("GET fruit"));
            assertEquals(ClientServer.OK, server.execute("DELETE fruit"));
            assertEquals(ClientServer.NIL, server.execute("GET fruit"));
        }

        @Test
        void testVerbsAreCaseInsensitive() throws IOException {
            startAndAwaitLeader();

            assertEquals(ClientServer.OK, server.execute("set k v"));
            assertEquals("VALUE v", server.execute("  Get   k "));
        }

        @Test
        void testDeleteOfMissingKeySucceeds() throws IOException {
            startAndAwaitLeader();

            assertEquals(ClientServer.OK, server.execute("DELETE never-set"));
        }

        @Test
        void testWrongArity_Usage() {
            assertEquals("ERR usage: SET <key> <value>", server.execute("SET k"));
            assertEquals("ERR usage: SET <key> <value>", server.execute("SET k v extra"));
            assertEquals("ERR usage: GET <key>", server.execute("GET"));
            assertEquals("ERR usage: DELETE <key>", server.execute("DELETE a b"));
        }

        @Test
        void testUnknownVerb() {
            assertEquals(ClientServer.UNKNOWN_COMMAND, server.execute("INCR counter"));
        }

        @Test
        void testWriteWithoutLeader_Error() {
            assertEquals("ERR not applied, no leader known", server.execute("SET k v"));
            assertEquals(ClientServer.NIL, server.execute("GET k"));
        }
    }

    @Test
    void testSocketSession() throws IOException {
        startAndAwaitLeader();
        server.start();

        try (Socket socket = new Socket("127.0.0.1", server.port());
             PrintWriter out = new PrintWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8), true);
             BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
            socket.setSoTimeout(5000);

            out.println("SET city oslo");
            assertEquals("OK", in.readLine());
            out.println("");
            out.println("GET city");
            assertEquals("VALUE oslo", in.readLine());
            out.println("PING");
            assertEquals("ERR unknown command", in.readLine());
        }
    }

    @Test
    void testStartTwice_Rejected() throws IOException {
        server.start();

        assertThrows(IllegalStateException.class, server::start);
    }
}
