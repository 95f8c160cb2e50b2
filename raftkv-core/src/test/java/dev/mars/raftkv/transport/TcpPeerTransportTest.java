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
package dev.mars.raftkv.transport;

import dev.mars.raftkv.raft.LogEntry;
import dev.mars.raftkv.raft.Message;
import dev.mars.raftkv.raft.MessageType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback tests for {@link TcpPeerTransport} and {@link PeerListener}.
 */
class TcpPeerTransportTest {

    private final BlockingQueue<Message> received = new LinkedBlockingQueue<>();
    private PeerListener listener;
    private TcpPeerTransport transport;
    private PeerDirectory directory;

    @BeforeEach
    void setUp() throws IOException {
        listener = new PeerListener(2, new InetSocketAddress("127.0.0.1", 0), received::add, 8);
        listener.start();

        directory = new PeerDirectory();
        directory.put(2, new InetSocketAddress("127.0.0.1", listener.port()));
        transport = new TcpPeerTransport(1, directory, 2, 16, 1000);
    }

    @AfterEach
    void tearDown() {
        transport.close();
        listener.close();
    }

    @Test
    void testSend_DeliversToListener() throws InterruptedException {
        Message message = Message.append(1, 2, 5, 3, 4,
                List.of(LogEntry.normal(4, 5, "SET k v".getBytes(StandardCharsets.UTF_8))), 3);

        transport.send(2, message);

        Message delivered = received.poll(5, TimeUnit.SECONDS);
        assertEquals(message, delivered);
        await().atMost(Duration.ofSeconds(5)).until(() -> transport.sentCount() == 1);
    }

    @Test
    void testSend_ManyMessagesAllArrive() {
        for (int i = 1; i <= 20; i++) {
            transport.send(2, Message.voteRequest(1, 2, i, 0, 0));
        }

        await().atMost(Duration.ofSeconds(10)).until(() -> received.size() == 20);
        assertEquals(0, transport.droppedCount());
    }

    @Test
    void testSend_UnknownRecipientDropped() {
        transport.send(9, Message.voteResponse(1, 9, 1, false));

        assertEquals(1, transport.droppedCount());
        assertEquals(0, transport.sentCount());
    }

    @Test
    void testSend_UnreachablePeerDroppedWithoutThrowing() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        directory.put(3, new InetSocketAddress("127.0.0.1", closedPort));

        assertDoesNotThrow(() -> transport.send(3, Message.voteRequest(1, 3, 2, 0, 0)));

        await().atMost(Duration.ofSeconds(5)).until(() -> transport.droppedCount() == 1);
    }

    @Test
    void testSend_AfterCloseDropped() {
        transport.close();

        transport.send(2, Message.voteRequest(1, 2, 1, 0, 0));

        assertEquals(1, transport.droppedCount());
    }

    @Test
    void testListener_MalformedFrameClosesOnlyThatConnection() throws Exception {
        try (Socket raw = new Socket("127.0.0.1", listener.port())) {
            OutputStream out = raw.getOutputStream();
            out.write("this is not a frame at all".getBytes(StandardCharsets.US_ASCII));
            out.flush();
        }

        transport.send(2, Message.voteResponse(1, 2, 3, true));

        Message delivered = received.poll(5, TimeUnit.SECONDS);
        assertNotNull(delivered);
        assertEquals(MessageType.REQUEST_VOTE_RESPONSE, delivered.type());
        assertTrue(delivered.reject());
        assertTrue(received.isEmpty());
    }
}
