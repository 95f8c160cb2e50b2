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

import dev.mars.raftkv.node.KvNode;
import dev.mars.raftkv.node.NodeConfig;
import dev.mars.raftkv.storage.KvStorageConfig;
import dev.mars.raftkv.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Entry point of a key-value node process.
 *
 * <h2>Usage</h2>
 * <pre>
 * java -jar raftkv-node/target/raftkv-node-1.0-SNAPSHOT.jar 1 127.0.0.1:5001,127.0.0.1:5002,127.0.0.1:5003
 * </pre>
 * The first argument is this node's id (1-based position in the peer list);
 * the second lists the peer transport address of every node, this one
 * included. Clients connect on {@code clientBasePort + id}. Storage lives in
 * {@code <dataDir>/data_<id>}; see {@link KvStorageConfig} and
 * {@link NodeConfig} for the remaining settings.
 */
public final class KvNodeMain {

    private static final Logger LOG = LoggerFactory.getLogger(KvNodeMain.class);

    private static final int MAX_CLIENTS = 128;

    private KvNodeMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        NodeConfig config = parse(args);
        if (config == null) {
            System.exit(1);
            return;
        }

        KvStorageConfig baseStorage = KvStorageConfig.load();
        KvStorageConfig storageConfig = baseStorage.withDataDir(
                baseStorage.dataDir().resolve("data_" + config.nodeId()));
        LOG.info("Starting node with {} and {}", config, storageConfig);

        KvNode node;
        ClientServer clients;
        try {
            node = new KvNode(config, storageConfig);
        } catch (StorageException e) {
            LOG.error("Cannot open storage in {}: {}", storageConfig.dataDir(), e.getMessage(), e);
            System.exit(1);
            return;
        }
        clients = new ClientServer(node.service(), new InetSocketAddress(config.clientPort()), MAX_CLIENTS);
        try {
            node.start();
            clients.start();
        } catch (IOException e) {
            LOG.error("Cannot bind node {}: {}", config.nodeId(), e.getMessage(), e);
            clients.close();
            node.close();
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down node {}", config.nodeId());
            clients.close();
            node.close();
        }, "raftkv-shutdown"));

        node.driver().awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        LOG.info("Node {} driver stopped ({})", config.nodeId(), node.status().driverState());
    }

    /**
     * Validates the command line. Prints usage and returns null when invalid.
     */
    static NodeConfig parse(String[] args) {
        if (args.length != 2) {
            printUsage("expected 2 arguments, got " + args.length);
            return null;
        }
        long nodeId;
        try {
            nodeId = Long.parseLong(args[0]);
        } catch (NumberFormatException e) {
            printUsage("node_id must be a number: '" + args[0] + "'");
            return null;
        }
        try {
            return NodeConfig.builder().nodeId(nodeId).peers(args[1]).build();
        } catch (IllegalArgumentException e) {
            printUsage(e.getMessage());
            return null;
        }
    }

    private static void printUsage(String problem) {
        System.err.println("Error: " + problem);
        System.err.println("Usage: KvNodeMain <node_id> <peer1,peer2,...>");
        System.err.println("  node_id  1-based position of this node in the peer list");
        System.err.println("  peers    comma separated host:port of every node's peer transport");
    }
}
