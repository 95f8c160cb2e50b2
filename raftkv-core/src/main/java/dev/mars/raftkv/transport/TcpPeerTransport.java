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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link PeerTransport} over plain TCP.
 * <p>
 * Each send opens a connection to the recipient, writes one
 * {@link MessageCodec} frame and closes. No connection reuse, no retry.
 * <p>
 * <b>Off the critical path:</b> {@link #send} only encodes and enqueues. A
 * bounded pool of sender threads does the I/O, so a slow or dead peer never
 * blocks the consensus driver. Connect and write together are bounded by
 * {@code sendTimeoutMs}; a watchdog closes the socket when it is exceeded.
 * <p>
 * <b>Drops:</b> unknown recipients, a full send queue and I/O failures drop
 * the message with a log line. The first failure towards a peer is logged at
 * WARN, repeats at DEBUG until the peer is reachable again.
 */
public final class TcpPeerTransport implements PeerTransport {

    private static final Logger LOG = LoggerFactory.getLogger(TcpPeerTransport.class);

    private final long localId;
    private final PeerDirectory directory;
    private final int sendTimeoutMs;
    private final ThreadPoolExecutor senders;
    private final ScheduledExecutorService watchdog;
    private final Set<Long> unreachable = ConcurrentHashMap.newKeySet();
    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private volatile boolean closed;

    /**
     * @param localId           id of this node, used for thread names and logs
     * @param directory         id to address table
     * @param sendThreads       number of sender threads
     * @param sendQueueCapacity messages that may wait for a sender thread
     * @param sendTimeoutMs     bound on connect plus write of one message
     */
    public TcpPeerTransport(long localId, PeerDirectory directory, int sendThreads,
                            int sendQueueCapacity, int sendTimeoutMs) {
        if (sendThreads <= 0 || sendQueueCapacity <= 0 || sendTimeoutMs <= 0) {
            throw new IllegalArgumentException("sendThreads, sendQueueCapacity and sendTimeoutMs must be positive");
        }
        this.localId = localId;
        this.directory = directory;
        this.sendTimeoutMs = sendTimeoutMs;
        this.senders = new ThreadPoolExecutor(sendThreads, sendThreads,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(sendQueueCapacity),
                daemonThreads("peer-sender-" + localId));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("peer-send-watchdog-" + localId));

        LOG.info("TcpPeerTransport initialized: node={}, sendThreads={}, queueCapacity={}, sendTimeout={} ms",
                localId, sendThreads, sendQueueCapacity, sendTimeoutMs);
    }

    @Override
    public void send(long recipientId, Message message) {
        if (closed) {
            LOG.debug("Transport closed, dropping {} to node {}", message.type(), recipientId);
            droppedCount.incrementAndGet();
            return;
        }
        Optional<InetSocketAddress> address = directory.address(recipientId);
        if (address.isEmpty()) {
            LOG.warn("No address for node {}, dropping {}", recipientId, message.type());
            droppedCount.incrementAndGet();
            return;
        }

        byte[] frame;
        try {
            frame = MessageCodec.encode(message);
        } catch (IllegalArgumentException e) {
            LOG.warn("Cannot encode {} to node {}: {}", message.type(), recipientId, e.getMessage());
            droppedCount.incrementAndGet();
            return;
        }

        try {
            senders.execute(() -> deliver(recipientId, address.get(), message, frame));
        } catch (RejectedExecutionException e) {
            droppedCount.incrementAndGet();
            LOG.warn("Send queue full, dropping {} to node {}", message.type(), recipientId);
        }
    }

    private void deliver(long recipientId, InetSocketAddress address, Message message, byte[] frame) {
        Socket socket = new Socket();
        ScheduledFuture<?> timeout = watchdog.schedule(() -> abort(socket, recipientId),
                sendTimeoutMs, TimeUnit.MILLISECONDS);
        try (socket) {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(address.getHostString(), address.getPort()), sendTimeoutMs);
            OutputStream out = socket.getOutputStream();
            out.write(frame);
            out.flush();

            sentCount.incrementAndGet();
            if (unreachable.remove(recipientId)) {
                LOG.info("Node {} reachable again at {}", recipientId, address);
            }
            LOG.trace("Sent {} ({} bytes) to node {}", message.type(), frame.length, recipientId);

        } catch (IOException e) {
            droppedCount.incrementAndGet();
            if (unreachable.add(recipientId)) {
                LOG.warn("Dropped {} to node {} at {}: {}", message.type(), recipientId, address, e.getMessage());
            } else {
                LOG.debug("Dropped {} to node {} at {}: {}", message.type(), recipientId, address, e.getMessage());
            }
        } finally {
            timeout.cancel(false);
        }
    }

    private void abort(Socket socket, long recipientId) {
        if (socket.isClosed()) {
            return;
        }
        LOG.debug("Send to node {} exceeded {} ms, aborting", recipientId, sendTimeoutMs);
        try {
            socket.close();
        } catch (IOException e) {
            LOG.debug("Error aborting socket to node {}: {}", recipientId, e.getMessage());
        }
    }

    /** Messages written to a peer socket so far. */
    public long sentCount() {
        return sentCount.get();
    }

    /** Messages dropped so far, for any reason. */
    public long droppedCount() {
        return droppedCount.get();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Closing TcpPeerTransport for node {} (sent={}, dropped={})",
                localId, sentCount.get(), droppedCount.get());
        senders.shutdown();
        try {
            if (!senders.awaitTermination(sendTimeoutMs, TimeUnit.MILLISECONDS)) {
                senders.shutdownNow();
            }
        } catch (InterruptedException e) {
            senders.shutdownNow();
            Thread.currentThread().interrupt();
        }
        watchdog.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
