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
package dev.mars.raftkv.raft;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * A single-step membership change carried in a {@link EntryType#CONF_CHANGE} entry.
 * <p>
 * Format: TYPE(1) + NODE_ID(8) + ADDR_LEN(4) + ADDR(UTF-8).
 *
 * @param type    add or remove
 * @param nodeId  the node being added or removed
 * @param address peer address of an added node ({@code host:port}), empty for removals
 */
public record ConfChange(ConfChangeType type, long nodeId, String address) {

    public ConfChange {
        Objects.requireNonNull(type, "type");
        if (nodeId <= 0) {
            throw new IllegalArgumentException("nodeId must be positive: " + nodeId);
        }
        address = address == null ? "" : address;
    }

    public static ConfChange addNode(long nodeId, String address) {
        return new ConfChange(ConfChangeType.ADD_NODE, nodeId, address);
    }

    public static ConfChange removeNode(long nodeId) {
        return new ConfChange(ConfChangeType.REMOVE_NODE, nodeId, "");
    }

    public byte[] encode() {
        byte[] addr = address.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(1 + 8 + 4 + addr.length);
        buf.put((byte) type.ordinal());
        buf.putLong(nodeId);
        buf.putInt(addr.length);
        buf.put(addr);
        return buf.array();
    }

    /**
     * Decodes a change, or returns empty if the bytes are malformed.
     */
    public static Optional<ConfChange> decode(byte[] bytes) {
        if (bytes == null) {
            return Optional.empty();
        }
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            int typeOrdinal = buf.get();
            ConfChangeType[] types = ConfChangeType.values();
            if (typeOrdinal < 0 || typeOrdinal >= types.length) {
                return Optional.empty();
            }
            long nodeId = buf.getLong();
            int addrLen = buf.getInt();
            if (addrLen < 0 || addrLen != buf.remaining() || nodeId <= 0) {
                return Optional.empty();
            }
            byte[] addr = new byte[addrLen];
            buf.get(addr);
            return Optional.of(new ConfChange(types[typeOrdinal], nodeId, new String(addr, StandardCharsets.UTF_8)));
        } catch (BufferUnderflowException e) {
            return Optional.empty();
        }
    }
}
