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

import dev.mars.raftkv.node.KvService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Line-oriented client listener.
 * <p>
 * One request per line, one response per line:
 * <pre>
 * SET key value   -&gt; OK | ERR ...
 * GET key         -&gt; VALUE value | NIL
 * DELETE key      -&gt; OK | ERR ...
 * anything else   -&gt; ERR unknown command
 * </pre>
 * Verbs are case-insensitive. Writes answer only after the command has been
 * applied on this node, so a client talking to a follower gets {@code ERR}
 * naming the current leader.
 */
public final class ClientServer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ClientServer.class);

    static final String OK = "OK";
    static final String NIL = "NIL";
    static final String UNKNOWN_COMMAND = "ERR unknown command";

    private final KvService service;
    private final InetSocketAddress bindAddress;
    private final ThreadPoolExecutor workers;
    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean closed;

    public ClientServer(KvService service, InetSocketAddress bindAddress, int maxClients) {
        this.service = service;
        this.bindAddress = bindAddress;
        this.workers = new ThreadPoolExecutor(0, maxClients, 60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), r -> {
                    Thread t = new Thread(r, "kv-client");
                    t.setDaemon(true);
                    return t;
                });
    }

    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("ClientServer already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        try {
            socket.bind(bindAddress);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;
        acceptThread = new Thread(this::acceptLoop, "kv-client-listener");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOG.info("Client listener on {}", serverSocket.getLocalSocketAddress());
    }

    public int port() {
        if (serverSocket == null) {
            throw new IllegalStateException("ClientServer not started");
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
                LOG.warn("Client accept failed: {}", e.getMessage());
                continue;
            }
            try {
                workers.execute(() -> serve(socket));
            } catch (RejectedExecutionException e) {
                LOG.warn("Too many clients, closing {}", socket.getRemoteSocketAddress());
                closeQuietly(socket);
            }
        }
    }

    private void serve(Socket socket) {
        clients.add(socket);
        try (socket;
             BufferedReader in = new BufferedReader(
                     new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             BufferedWriter out = new BufferedWriter(
                     new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                out.write(execute(line));
                out.newLine();
                out.flush();
            }
        } catch (IOException e) {
            if (!closed) {
                LOG.debug("Client {} disconnected: {}", socket.getRemoteSocketAddress(), e.getMessage());
            }
        } finally {
            clients.remove(socket);
        }
    }

    /**
     * Executes one request line and returns the response line.
     */
    String execute(String line) {
        String[] tokens = line.strip().split("\\s+");
        String verb = tokens[0].toUpperCase(Locale.ROOT);
        switch (verb) {
            case "SET":
                if (tokens.length != 3) {
                    return "ERR usage: SET <key> <value>";
                }
                return service.set(tokens[1], tokens[2]) ? OK : notApplied();
            case "GET":
                if (tokens.length != 2) {
                    return "ERR usage: GET <key>";
                }
                Optional<String> value = service.get(tokens[1]);
                return value.map(v -> "VALUE " + v).orElse(NIL);
            case "DELETE":
                if (tokens.length != 2) {
                    return "ERR usage: DELETE <key>";
                }
                return service.delete(tokens[1]) ? OK : notApplied();
            default:
                return UNKNOWN_COMMAND;
        }
    }

    private String notApplied() {
        long leader = service.status().leaderId();
        return leader == 0 ? "ERR not applied, no leader known" : "ERR not applied, leader is node " + leader;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (serverSocket != null) {
            closeQuietly(serverSocket);
        }
        clients.forEach(ClientServer::closeQuietly);
        workers.shutdownNow();
        if (acceptThread != null) {
            try {
                acceptThread.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Client listener closed");
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            LOG.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }
}
