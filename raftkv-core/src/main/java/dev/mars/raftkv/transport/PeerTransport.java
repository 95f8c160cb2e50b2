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

import dev.mars.raftkv.raft.Message;

import java.io.Closeable;

/**
 * Best-effort delivery of protocol messages to other nodes.
 * <p>
 * No delivery confirmation and no retry: the consensus protocol retransmits
 * on its own timer. Implementations never throw from {@link #send}; failures
 * are logged and the message is dropped.
 *
 * @see TcpPeerTransport
 */
public interface PeerTransport extends Closeable {

    /**
     * Queues {@code message} for delivery to {@code recipientId}. Returns without waiting for I/O.
     */
    void send(long recipientId, Message message);

    @Override
    void close();
}
