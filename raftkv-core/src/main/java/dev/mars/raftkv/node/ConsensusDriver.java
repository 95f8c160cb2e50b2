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
import dev.mars.raftkv.raft.ConfChange;
import dev.mars.raftkv.raft.ConfChangeType;
import dev.mars.raftkv.raft.ConsensusCore;
import dev.mars.raftkv.raft.EntryType;
import dev.mars.raftkv.raft.HardState;
import dev.mars.raftkv.raft.LogEntry;
import dev.mars.raftkv.raft.Message;
import dev.mars.raftkv.raft.ProposalDroppedException;
import dev.mars.raftkv.raft.Ready;
import dev.mars.raftkv.raft.SnapshotData;
import dev.mars.raftkv.storage.KvStorage;
import dev.mars.raftkv.storage.StorageException;
import dev.mars.raftkv.storage.StorageOperationException;
import dev.mars.raftkv.transport.PeerDirectory;
import dev.mars.raftkv.transport.PeerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a {@link ConsensusCore} and connects it to storage and the network.
 * <p>
 * A single driver thread owns the core. Every input (ticks, proposals,
 * inbound messages, membership changes) arrives as an event on a queue, so
 * the core is never touched concurrently. After each batch of events the
 * driver drains ready batches in this order:
 * <ol>
 *   <li>persist the changed term and vote</li>
 *   <li>install a snapshot received from the leader</li>
 *   <li>apply committed entries to storage, in index order</li>
 *   <li>hand outbound messages to the transport</li>
 *   <li>advance the core</li>
 * </ol>
 * <p>
 * Proposals submitted through {@link #submit(byte[])} are bounded by a
 * permit count; each completes once its entry is applied locally, or fails
 * when the entry is overwritten by another leader, superseded by a snapshot,
 * or the driver stops. A storage failure while installing a snapshot or
 * persisting the vote is fatal and stops the driver.
 */
public final class ConsensusDriver implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ConsensusDriver.class);

    private static final long STOP_TIMEOUT_MS = 5000;

    private final NodeConfig config;
    private final ConsensusCore core;
    private final KvStorage storage;
    private final PeerTransport transport;
    private final PeerDirectory directory;

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();
    private final Semaphore proposalPermits;
    private final AtomicBoolean tickQueued = new AtomicBoolean();
    private final AtomicReference<NodeStatus> status = new AtomicReference<>();
    private final CountDownLatch terminated = new CountDownLatch(1);

    // Driver thread only
    private final Map<Long, PendingProposal> pending = new HashMap<>();
    private long appliedSinceCompaction;
    private long persistedTerm;
    private long persistedVote;
    private long lastKnownLeader;

    private volatile DriverState state = DriverState.INITIALIZED;
    private volatile boolean stopRequested;
    private Thread loopThread;
    private ScheduledExecutorService ticker;

    public ConsensusDriver(NodeConfig config, ConsensusCore core, KvStorage storage,
                           PeerTransport transport, PeerDirectory directory) {
        this.config = config;
        this.core = core;
        this.storage = storage;
        this.transport = transport;
        this.directory = directory;
        this.proposalPermits = new Semaphore(config.maxPendingProposals());
        KvStorage.PersistentMeta meta = storage.loadMetadata();
        this.persistedTerm = meta.currentTerm();
        this.persistedVote = meta.votedFor();
        publishStatus();
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Starts the driver thread and the ticker.
     *
     * @throws IllegalStateException if the driver was already started
     */
    public synchronized void start() {
        if (state != DriverState.INITIALIZED) {
            throw new IllegalStateException("Driver is " + state);
        }
        state = DriverState.RUNNING;
        publishStatus();

        loopThread = new Thread(this::run, "consensus-driver-" + core.id());
        loopThread.setDaemon(true);
        loopThread.start();

        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "consensus-ticker-" + core.id());
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleAtFixedRate(this::enqueueTick,
                config.tickIntervalMs(), config.tickIntervalMs(), TimeUnit.MILLISECONDS);
        LOG.info("Consensus driver for node {} started (tick {} ms)", core.id(), config.tickIntervalMs());
    }

    /**
     * Stops the driver and waits for the loop to exit. Outstanding proposals fail.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (state == DriverState.INITIALIZED) {
                state = DriverState.STOPPED;
                publishStatus();
                terminated.countDown();
                return;
            }
            if (stopRequested) {
                return;
            }
            stopRequested = true;
        }
        events.offer(Stop.INSTANCE);
        try {
            if (!awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Consensus driver for node {} did not stop within {} ms", core.id(), STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Waits until the driver loop has exited.
     *
     * @return true if the driver stopped within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public DriverState state() {
        return state;
    }

    /** Latest published status. Safe to call from any thread. */
    public NodeStatus status() {
        return status.get();
    }

    // ========================================================================
    // Inputs (any thread)
    // ========================================================================

    /**
     * Proposes a command without waiting for it. Failures are logged only.
     */
    public void propose(byte[] data) {
        submit(data).whenComplete((index, error) -> {
            if (error != null) {
                LOG.warn("Proposal on node {} not applied: {}", core.id(), error.getMessage());
            } else {
                LOG.trace("Proposal on node {} applied at index {}", core.id(), index);
            }
        });
    }

    /**
     * Proposes a command and returns a future completing with its log index
     * once the entry has been applied to local storage.
     * <p>
     * The future fails with {@link OverloadedException} when too many
     * proposals are outstanding, and with {@link ProposalDroppedException}
     * when this node is not the leader or the entry is lost.
     */
    public CompletableFuture<Long> submit(byte[] data) {
        if (state != DriverState.RUNNING || stopRequested) {
            return CompletableFuture.failedFuture(
                    new ProposalDroppedException("Node " + core.id() + " is not running", leaderHint()));
        }
        if (!proposalPermits.tryAcquire()) {
            return CompletableFuture.failedFuture(new OverloadedException(
                    "Node " + core.id() + " has " + config.maxPendingProposals() + " proposals in flight"));
        }
        CompletableFuture<Long> result = new CompletableFuture<>();
        result.whenComplete((index, error) -> proposalPermits.release());
        enqueue(new Propose(data == null ? new byte[0] : data.clone(), result));
        return result;
    }

    /**
     * Proposes a membership change. The future completes once the change is applied locally.
     * It fails with {@link IllegalArgumentException} if an added node's address is not
     * {@code host:port}.
     */
    public CompletableFuture<Long> proposeConfChange(ConfChange change) {
        if (state != DriverState.RUNNING || stopRequested) {
            return CompletableFuture.failedFuture(
                    new ProposalDroppedException("Node " + core.id() + " is not running", leaderHint()));
        }
        try {
            peerAddress(change);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<Long> result = new CompletableFuture<>();
        enqueue(new ProposeConfChange(change, result));
        return result;
    }

    /**
     * Feeds an inbound protocol message to the core. Messages arriving while
     * the driver is not running are dropped.
     */
    public void step(Message message) {
        if (state != DriverState.RUNNING || stopRequested) {
            LOG.trace("Node {} not running, dropping {}", core.id(), message);
            return;
        }
        events.offer(new Step(message));
    }

    /** Asks the core to start an election now instead of waiting for a timeout. */
    public void campaign() {
        if (state == DriverState.RUNNING && !stopRequested) {
            events.offer(Campaign.INSTANCE);
        }
    }

    private void enqueueTick() {
        // At most one tick waits in the queue; a slow loop skips ticks instead of bursting them
        if (tickQueued.compareAndSet(false, true)) {
            events.offer(Tick.INSTANCE);
        }
    }

    private void enqueue(Event event) {
        events.offer(event);
        // Lost the race with the loop's final drain
        if (state == DriverState.STOPPED && events.remove(event)) {
            fail(event, new ProposalDroppedException("Node " + core.id() + " stopped", leaderHint()));
        }
    }

    private long leaderHint() {
        NodeStatus current = status.get();
        return current == null ? 0 : current.leaderId();
    }

    // ========================================================================
    // Driver loop
    // ========================================================================

    private void run() {
        try {
            boolean stop = false;
            while (!stop) {
                Event event = events.take();
                stop = handle(event);
                Event next;
                while (!stop && (next = events.poll()) != null) {
                    stop = handle(next);
                }
                processReady();
                publishStatus();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Consensus driver for node {} interrupted", core.id());
        } catch (StorageException e) {
            LOG.error("Consensus driver for node {} stopping after storage failure: {}", core.id(), e.getMessage(), e);
        } catch (RuntimeException e) {
            LOG.error("Consensus driver for node {} failed: {}", core.id(), e.getMessage(), e);
        } finally {
            shutdown();
        }
    }

    /** Returns true when the event asks the loop to stop. */
    private boolean handle(Event event) {
        if (event instanceof Stop) {
            return true;
        }
        if (event instanceof Tick) {
            tickQueued.set(false);
            core.tick();
        } else if (event instanceof Campaign) {
            core.campaign();
        } else if (event instanceof Step step) {
            core.step(step.message());
        } else if (event instanceof Propose propose) {
            try {
                long index = core.propose(propose.data());
                track(index, propose.result());
            } catch (ProposalDroppedException | IllegalArgumentException e) {
                propose.result().completeExceptionally(e);
            }
        } else if (event instanceof ProposeConfChange change) {
            try {
                long index = core.proposeConfChange(change.change());
                track(index, change.result());
            } catch (ProposalDroppedException e) {
                change.result().completeExceptionally(e);
            }
        }
        return false;
    }

    private void track(long index, CompletableFuture<Long> result) {
        PendingProposal previous = pending.put(index, new PendingProposal(core.term(), result));
        if (previous != null) {
            // A new leader term reused the index; the older entry can no longer commit
            previous.result().completeExceptionally(new ProposalDroppedException(
                    "Entry " + index + " was replaced in term " + core.term(), core.leaderId()));
        }
    }

    private void processReady() {
        while (core.hasReady()) {
            Ready ready = core.ready();

            ready.hardState().ifPresent(this::persistHardState);
            ready.snapshot().ifPresent(this::installSnapshot);
            for (LogEntry entry : ready.committedEntries()) {
                applyEntry(entry);
            }
            for (Message message : ready.messages()) {
                transport.send(message.to(), message);
            }

            core.advance(ready);
            maybeCompact();
        }
    }

    private void persistHardState(HardState hardState) {
        if (hardState.term() == persistedTerm && hardState.vote() == persistedVote) {
            return;
        }
        storage.updateMetadata(hardState.term(), hardState.vote());
        persistedTerm = hardState.term();
        persistedVote = hardState.vote();
    }

    private void installSnapshot(SnapshotData snapshot) {
        LOG.info("Node {} installing snapshot at index {} (term {}, {} bytes)",
                core.id(), snapshot.index(), snapshot.term(), snapshot.data().length);
        storage.loadSnapshot(snapshot.data());
        appliedSinceCompaction = 0;

        Iterator<Map.Entry<Long, PendingProposal>> it = pending.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, PendingProposal> e = it.next();
            if (e.getKey() <= snapshot.index()) {
                e.getValue().result().completeExceptionally(new ProposalDroppedException(
                        "Entry " + e.getKey() + " was superseded by a snapshot at index " + snapshot.index(),
                        core.leaderId()));
                it.remove();
            }
        }
    }

    private void applyEntry(LogEntry entry) {
        if (entry.type() == EntryType.CONF_CHANGE) {
            if (applyConfChange(entry)) {
                complete(entry);
            }
            return;
        }
        if (entry.data().length > 0) {
            Optional<Command> command = CommandCodec.decode(entry.data());
            if (command.isEmpty()) {
                LOG.warn("Node {} skipping entry {}: not a valid command", core.id(), entry.index());
            } else {
                try {
                    storage.apply(entry.index(), entry.term(), command.get());
                } catch (StorageOperationException e) {
                    LOG.error("Node {} failed to apply entry {}: {}", core.id(), entry.index(), e.getMessage());
                    failPending(entry.index(), e);
                    return;
                }
            }
        }
        appliedSinceCompaction++;
        complete(entry);
    }

    /** Returns false when the entry was skipped; its proposal has then been failed. */
    private boolean applyConfChange(LogEntry entry) {
        Optional<ConfChange> decoded = ConfChange.decode(entry.data());
        if (decoded.isEmpty()) {
            LOG.warn("Node {} skipping entry {}: not a valid membership change", core.id(), entry.index());
            failPending(entry.index(), new IllegalArgumentException("Entry " + entry.index()
                    + " is not a valid membership change"));
            return false;
        }
        ConfChange change = decoded.get();
        // Every node parses the same text, so all of them skip or apply alike
        InetSocketAddress address;
        try {
            address = peerAddress(change);
        } catch (IllegalArgumentException e) {
            LOG.error("Node {} skipping membership change at entry {}: {}", core.id(), entry.index(), e.getMessage());
            failPending(entry.index(), e);
            return false;
        }

        List<Long> voters = core.applyConfChange(change);
        if (change.nodeId() != core.id()) {
            if (change.type() == ConfChangeType.REMOVE_NODE) {
                directory.remove(change.nodeId());
            } else if (address != null) {
                directory.put(change.nodeId(), address);
            }
        }
        LOG.info("Node {} membership now {}", core.id(), voters);
        return true;
    }

    /**
     * Parsed address of an added node, or null when there is none to record.
     *
     * @throws IllegalArgumentException if the address is not {@code host:port}
     */
    private static InetSocketAddress peerAddress(ConfChange change) {
        if (change.type() != ConfChangeType.ADD_NODE || change.address().isEmpty()) {
            return null;
        }
        return PeerDirectory.parseAddress(change.address());
    }

    private void failPending(long index, RuntimeException cause) {
        PendingProposal p = pending.remove(index);
        if (p != null) {
            p.result().completeExceptionally(cause);
        }
    }

    private void complete(LogEntry entry) {
        PendingProposal p = pending.remove(entry.index());
        if (p == null) {
            return;
        }
        if (p.term() == entry.term()) {
            p.result().complete(entry.index());
        } else {
            p.result().completeExceptionally(new ProposalDroppedException(
                    "Entry " + entry.index() + " was overwritten by term " + entry.term(), core.leaderId()));
        }
    }

    private void maybeCompact() {
        if (config.snapshotThreshold() <= 0 || appliedSinceCompaction < config.snapshotThreshold()) {
            return;
        }
        long index = core.appliedIndex();
        byte[] snapshot = storage.snapshot();
        storage.compact();
        core.compact(index, snapshot);
        appliedSinceCompaction = 0;
    }

    private void publishStatus() {
        NodeStatus next = new NodeStatus(core.id(), core.role(), core.term(), core.leaderId(),
                core.commitIndex(), core.appliedIndex(), state, core.voters());
        status.set(next);
        if (next.leaderId() != lastKnownLeader) {
            lastKnownLeader = next.leaderId();
            if (lastKnownLeader != 0) {
                LOG.info("Node {} sees leader {} in term {}", core.id(), lastKnownLeader, next.term());
            }
        }
    }

    private void shutdown() {
        state = DriverState.STOPPED;
        if (ticker != null) {
            ticker.shutdownNow();
        }
        ProposalDroppedException stopped = new ProposalDroppedException(
                "Node " + core.id() + " stopped", core.leaderId());
        pending.values().forEach(p -> p.result().completeExceptionally(stopped));
        pending.clear();
        List<Event> remaining = new ArrayList<>();
        events.drainTo(remaining);
        remaining.forEach(e -> fail(e, stopped));
        publishStatus();
        terminated.countDown();
        LOG.info("Consensus driver for node {} stopped", core.id());
    }

    private static void fail(Event event, RuntimeException cause) {
        if (event instanceof Propose propose) {
            propose.result().completeExceptionally(cause);
        } else if (event instanceof ProposeConfChange change) {
            change.result().completeExceptionally(cause);
        }
    }

    // ========================================================================
    // Events
    // ========================================================================

    private interface Event {
    }

    private enum Tick implements Event {
        INSTANCE
    }

    private enum Campaign implements Event {
        INSTANCE
    }

    private enum Stop implements Event {
        INSTANCE
    }

    private record Step(Message message) implements Event {
    }

    private record Propose(byte[] data, CompletableFuture<Long> result) implements Event {
    }

    private record ProposeConfChange(ConfChange change, CompletableFuture<Long> result) implements Event {
    }

    private record PendingProposal(long term, CompletableFuture<Long> result) {
    }
}
