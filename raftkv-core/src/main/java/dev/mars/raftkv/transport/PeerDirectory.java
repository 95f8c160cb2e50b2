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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit node id to peer address table.
 * <p>
 * Ids need not be contiguous. The table starts from the ordered bootstrap
 * peer list (position {@code i} is node {@code i + 1}) and is then updated by
 * committed membership changes.
 * <p>
 * Addresses are kept unresolved and resolved on each connect, so a peer that
 * changes IP behind the same host name is picked up.
 * <p>
 * <b>Thread Safety:</b> safe for concurrent use.
 */
public final class PeerDirectory {

    private static final Logger LOG = LoggerFactory.getLogger(PeerDirectory.class);

    private final Map<Long, InetSocketAddress> addresses = new ConcurrentHashMap<>();

    public PeerDirectory() {
    }

    public PeerDirectory(Map<Long, InetSocketAddress> initial) {
        initial.forEach(this::put);
    }

    /**
     * Builds a directory from an ordered peer list where entry {@code i} belongs to node {@code i + 1}.
     *
     * @throws IllegalArgumentException if any entry is not {@code host:port}
     */
    public static PeerDirectory fromPeerList(List<String> peers) {
        PeerDirectory directory = new PeerDirectory();
        for (int i = 0; i < peers.size(); i++) {
            directory.put(i + 1, parseAddress(peers.get(i)));
        }
        return directory;
    }

    /**
     * Parses {@code host:port} into an unresolved address.
     *
     * @throws IllegalArgumentException on a malformed address
     */
    public static InetSocketAddress parseAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Peer address must not be empty");
        }
        String trimmed = address.trim();
        int colon = trimmed.lastIndexOf(':');
        if (colon <= 0 || colon == trimmed.length() - 1) {
            throw new IllegalArgumentException("Peer address must be host:port: '" + address + "'");
        }
        String host = trimmed.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(trimmed.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in peer address '" + address + "'", e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in peer address '" + address + "'");
        }
        return InetSocketAddress.createUnresolved(host, port);
    }

    public Optional<InetSocketAddress> address(long nodeId) {
        return Optional.ofNullable(addresses.get(nodeId));
    }

    public void put(long nodeId, InetSocketAddress address) {
        if (nodeId <= 0) {
            throw new IllegalArgumentException("nodeId must be positive: " + nodeId);
        }
        InetSocketAddress previous = addresses.put(nodeId, address);
        if (previous == null) {
            LOG.debug("Peer {} added at {}", nodeId, address);
        } else if (!previous.equals(address)) {
            LOG.info("Peer {} moved from {} to {}", nodeId, previous, address);
        }
    }

    public void remove(long nodeId) {
        if (addresses.remove(nodeId) != null) {
            LOG.info("Peer {} removed", nodeId);
        }
    }

    public boolean contains(long nodeId) {
        return addresses.containsKey(nodeId);
    }

    public int size() {
        return addresses.size();
    }

    /** Sorted copy of the table. */
    public Map<Long, InetSocketAddress> asMap() {
        return new TreeMap<>(addresses);
    }

    @Override
    public String toString() {
        return "PeerDirectory" + asMap();
    }
}
