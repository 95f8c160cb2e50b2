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

import dev.mars.raftkv.command.Command;
import dev.mars.raftkv.command.CommandCodec;
import dev.mars.raftkv.raft.ProposalDroppedException;
import dev.mars.raftkv.storage.KvStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client-facing key-value operations of a node.
 * <p>
 * Writes go through consensus and report success only once the command is
 * applied to this node's storage. Reads are served from local storage and may
 * be stale on followers.
 */
public final class KvService {

    private static final Logger LOG = LoggerFactory.getLogger(KvService.class);

    private final ConsensusDriver driver;
    private final KvStorage storage;
    private final long proposalTimeoutMs;

    public KvService(ConsensusDriver driver, KvStorage storage, long proposalTimeoutMs) {
        this.driver = driver;
        this.storage = storage;
        this.proposalTimeoutMs = proposalTimeoutMs;
    }

    /**
     * Replicates {@code SET key value}.
     *
     * @return true once applied locally; false if the key or value cannot be
     *         encoded, this node is not the leader, it is overloaded, or the
     *         proposal timed out
     */
    public boolean set(String key, String value) {
        return replicate(new Command.Set(key, value));
    }

    /**
     * Replicates {@code DELETE key}.
     */
    public boolean delete(String key) {
        return replicate(new Command.Delete(key));
    }

    /** Local read. */
    public Optional<String> get(String key) {
        return storage.get(key).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public NodeStatus status() {
        return driver.status();
    }

    private boolean replicate(Command command) {
        byte[] payload;
        try {
            payload = CommandCodec.encode(command);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting {} on key '{}': {}", command.getClass().getSimpleName(), command.key(), e.getMessage());
            return false;
        }

        CompletableFuture<Long> result = driver.submit(payload);
        try {
            long index = result.get(proposalTimeoutMs, TimeUnit.MILLISECONDS);
            LOG.debug("{} applied at index {}", command, index);
            return true;
        } catch (TimeoutException e) {
            result.cancel(false);
            LOG.warn("{} on key '{}' not applied within {} ms", command.getClass().getSimpleName(),
                    command.key(), proposalTimeoutMs);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProposalDroppedException dropped) {
                LOG.debug("Proposal dropped on node {} (leader {}): {}",
                        driver.status().nodeId(), dropped.leaderId(), dropped.getMessage());
            } else if (cause instanceof OverloadedException) {
                LOG.warn("Node {} overloaded: {}", driver.status().nodeId(), cause.getMessage());
            } else {
                LOG.warn("Proposal failed on node {}: {}", driver.status().nodeId(), cause.getMessage());
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(false);
            return false;
        }
    }
}
