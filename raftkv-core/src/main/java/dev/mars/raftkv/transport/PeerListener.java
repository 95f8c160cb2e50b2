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

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Inbound side of the peer transport.
 * <p>
 * Accepts connections, reads {@link MessageCodec} frames until the peer
 * closes the stream and hands each message to a handler, normally the
 * consensus driver's {@code step}. A frame that fails validation closes that
 * connection only.
 * <p>
 * Concurrent connections are bounded; excess connections are closed on accept.
 */
public final class PeerListener implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(PeerListener.class);

    /** Idle read timeout on an accepted connection. */
    private static final int READ_TIMEOUT_MS = 30_000;

    private final long localId;
    private final InetSocketAddress bindAddress;
    private final Consumer<Message> handler;
    private final ThreadPoolExecutor connections;
    private final Set<Socket> openSockets = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean closed;

    /**
     * @param localId        id of this node, used for thread names and logs
     * @param bindAddress    address to listen on; port 0 picks a free port
     * @param handler        receives every decoded message
     * @param maxConnections concurrent inbound connections
     */
    public PeerListener(long localId, InetSocketAddress bindAddress, Consumer<Message> handler, int maxConnections) {
        this.localId = localId;
        this.bindAddress = bindAddress;
        this.handler = handler;
        this.connections = new ThreadPoolExecutor(0, maxConnections,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                TcpPeerTransport.daemonThreads("peer-conn-" + localId));
    }

    /**
     * Binds the server socket and starts accepting.
     *
     * @throws IOException if the address cannot be bound
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("PeerListener already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        InetSocketAddress resolved = bindAddress.isUnresolved()
                ? new InetSocketAddress(bindAddress.getHostString(), bindAddress.getPort())
                : bindAddress;
        try {
            socket.bind(resolved);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;

        acceptThread = new Thread(this::acceptLoop, "peer-listener-" + localId);
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOG.info("PeerListener for node {} listening on {}", localId, serverSocket.getLocalSocketAddress());
    }

    /** The bound port, useful when started with port 0. */
    public int port() {
        if (serverSocket == null) {
            throw new IllegalStateException("PeerListener not started");
        }
        return serverSocket.getLocalPort();
    }

    private void acceptLoop() {
        while (!closed) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (closed || serverSocket.isClosed()) {
                    break;
                }
                LOG.warn("Accept failed on node {}: {}", localId, e.getMessage());
                continue;
            }
            try {
                connections.execute(() -> serve(socket));
            } catch (RejectedExecutionException e) {
                LOG.warn("Too many inbound peer connections on node {}, closing {}",
                        localId, socket.getRemoteSocketAddress());
                closeQuietly(socket);
            }
        }
        LOG.debug("Accept loop for node {} exited", localId);
    }

    private void serve(Socket socket) {
        openSockets.add(socket);
        int received = 0;
        try (socket) {
            socket.setSoTimeout(READ_TIMEOUT_MS);
            DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
            Message message;
            while ((message = MessageCodec.read(in)) != null) {
                received++;
                LOG.trace("Received {} from node {}", message.type(), message.from());
                handler.accept(message);
            }
        } catch (MessageFormatException e) {
            LOG.warn("Malformed frame from {}, closing connection: {}", socket.getRemoteSocketAddress(), e.getMessage());
        } catch (SocketException e) {
            if (!closed) {
                LOG.debug("Peer connection {} reset: {}", socket.getRemoteSocketAddress(), e.getMessage());
            }
        } catch (IOException e) {
            LOG.debug("Peer connection {} failed after {} messages: {}",
                    socket.getRemoteSocketAddress(), received, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Handler failed on message from {}: {}", socket.getRemoteSocketAddress(), e.getMessage(), e);
        } finally {
            openSockets.remove(socket);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Closing PeerListener for node {}", localId);
        if (serverSocket != null) {
            closeQuietly(serverSocket);
        }
        openSockets.forEach(PeerListener::closeQuietly);
        connections.shutdownNow();
        if (acceptThread != null) {
            try {
                acceptThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            LOG.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }
}
