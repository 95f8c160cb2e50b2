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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

/**
 * In-memory Raft consensus core.
 * <p>
 * Implements leader election and log replication as described in
 * "In Search of an Understandable Consensus Algorithm" (Ongaro and Ousterhout):
 * <ul>
 *   <li><b>Election restriction (§5.4.1):</b> votes only go to candidates whose log is up-to-date</li>
 *   <li><b>Current-term commit rule (§5.4.2):</b> a leader only counts replicas for entries of its own term</li>
 *   <li><b>Log consistency check (§5.3):</b> appends carry the preceding index and term</li>
 * </ul>
 * On top of that: a no-op entry on election, heartbeats every
 * {@code heartbeatTicks}, optimistic replication that rewinds on rejection,
 * snapshot transfer to followers behind the compacted log and single-step
 * membership changes.
 * <p>
 * The core never performs I/O. Everything it wants done is exposed through
 * {@link #ready()}; see {@link ConsensusCore} for the processing contract.
 * <p>
 * The log is volatile. Term and vote are reported through {@link Ready#hardState()}
 * for the caller to persist, and a restarted node can be seeded with the state
 * machine's snapshot so it resumes after the last applied entry.
 * <p>
 * <b>Thread Safety:</b> none. The consensus driver owns the instance.
 */
public final class RaftCore implements ConsensusCore {

    private static final Logger LOG = LoggerFactory.getLogger(RaftCore.class);

    // ========================================================================
    // State
    // ========================================================================

    private final RaftConfig config;
    private final long id;
    private final Random random;
    private final RaftLog raftLog = new RaftLog();
    private final TreeSet<Long> voters;

    /** Replication progress per follower, leader only. */
    private final Map<Long, Progress> progress = new HashMap<>();
    private final Set<Long> votesGranted = new HashSet<>();
    private final Set<Long> votesRejected = new HashSet<>();
    private final List<Message> outbox = new ArrayList<>();

    private StateRole role = StateRole.FOLLOWER;
    private long term;
    private long vote;
    private long leaderId;

    private int electionElapsed;
    private int heartbeatElapsed;
    private int randomizedElectionTimeout;

    /** Index of the latest membership change; no new change until it is applied. */
    private long pendingConfIndex;

    /** Snapshot received from a leader and not yet handed out in a ready batch. */
    private SnapshotData pendingSnapshot;

    /** Snapshot matching the compacted prefix, sent to lagging followers. */
    private SnapshotData latestSnapshot;

    private HardState prevHardState;
    private Ready inFlight;

    // ========================================================================
    // Constructor
    // ========================================================================

    public RaftCore(RaftConfig config) {
        this(config, HardState.EMPTY, null, new Random());
    }

    /**
     * Creates a core resuming from persisted state.
     *
     * @param config          static parameters
     * @param hardState       persisted term and vote
     * @param appliedSnapshot the state machine's snapshot if it already applied entries, else null
     * @param random          source for election timeout jitter
     */
    public RaftCore(RaftConfig config, HardState hardState, SnapshotData appliedSnapshot, Random random) {
        this.config = config;
        this.id = config.id();
        this.random = random;
        this.voters = new TreeSet<>(config.voters());

        if (appliedSnapshot != null && appliedSnapshot.index() > 0) {
            raftLog.restoreApplied(appliedSnapshot.index(), appliedSnapshot.term());
            if (!appliedSnapshot.voters().isEmpty()) {
                voters.clear();
                voters.addAll(appliedSnapshot.voters());
            }
            latestSnapshot = appliedSnapshot;
        }

        this.term = Math.max(hardState.term(), raftLog.snapshotTerm());
        this.vote = hardState.term() == term ? hardState.vote() : 0;
        this.prevHardState = currentHardState();
        resetRandomizedElectionTimeout();

        LOG.info("RaftCore {} initialized: voters={}, term={}, vote={}, log={}",
                id, voters, term, vote, raftLog);
    }

    // ========================================================================
    // Inputs
    // ========================================================================

    @Override
    public void tick() {
        if (role == StateRole.LEADER) {
            heartbeatElapsed++;
            if (heartbeatElapsed >= config.heartbeatTicks()) {
                heartbeatElapsed = 0;
                bcastAppend();
            }
            return;
        }

        electionElapsed++;
        if (electionElapsed >= randomizedElectionTimeout) {
            electionElapsed = 0;
            LOG.debug("Node {} election timeout after {} ticks", id, randomizedElectionTimeout);
            campaign();
        }
    }

    @Override
    public void campaign() {
        if (role == StateRole.LEADER) {
            LOG.debug("Node {} is already leader, ignoring campaign", id);
            return;
        }
        if (!voters.contains(id)) {
            LOG.debug("Node {} is not a voter, cannot campaign", id);
            return;
        }

        becomeCandidate();
        if (votesGranted.size() >= quorum()) {
            becomeLeader();
            return;
        }
        for (long peer : voters) {
            if (peer != id) {
                send(Message.voteRequest(id, peer, term, raftLog.lastIndex(), raftLog.lastTerm()));
            }
        }
    }

    @Override
    public long propose(byte[] data) {
        if (role != StateRole.LEADER) {
            throw new ProposalDroppedException("Node " + id + " is not the leader", leaderId);
        }
        if (data != null && data.length > config.maxBytesPerMessage()) {
            throw new IllegalArgumentException("Proposal of " + data.length
                    + " bytes exceeds the append budget of " + config.maxBytesPerMessage());
        }
        long index = appendEntry(EntryType.NORMAL, data);
        LOG.trace("Node {} proposed entry {} ({} bytes)", id, index, data == null ? 0 : data.length);
        bcastAppend();
        maybeCommit();
        return index;
    }

    @Override
    public long proposeConfChange(ConfChange change) {
        if (role != StateRole.LEADER) {
            throw new ProposalDroppedException("Node " + id + " is not the leader", leaderId);
        }
        if (pendingConfIndex > raftLog.applied()) {
            throw new ProposalDroppedException("A membership change is already pending at index "
                    + pendingConfIndex, leaderId);
        }
        long index = appendEntry(EntryType.CONF_CHANGE, change.encode());
        pendingConfIndex = index;
        LOG.info("Node {} proposed {} at index {}", id, change, index);
        bcastAppend();
        maybeCommit();
        return index;
    }

    @Override
    public List<Long> applyConfChange(ConfChange change) {
        long nodeId = change.nodeId();
        switch (change.type()) {
            case ADD_NODE -> {
                if (voters.add(nodeId) && role == StateRole.LEADER) {
                    progress.put(nodeId, new Progress(0, raftLog.lastIndex() + 1));
                    sendAppend(nodeId);
                }
            }
            case REMOVE_NODE -> {
                if (voters.size() == 1 && voters.contains(nodeId)) {
                    LOG.warn("Node {} refusing to remove the last voter {}", id, nodeId);
                    return List.copyOf(voters);
                }
                voters.remove(nodeId);
                progress.remove(nodeId);
                if (nodeId == id && role == StateRole.LEADER) {
                    LOG.info("Node {} removed from the cluster, stepping down", id);
                    becomeFollower(term, 0);
                }
            }
        }
        LOG.info("Node {} applied {}: voters={}", id, change, voters);

        if (role == StateRole.LEADER && maybeCommit()) {
            bcastAppend();
        }
        return List.copyOf(voters);
    }

    @Override
    public void step(Message m) {
        if (m == null) {
            return;
        }
        if (m.to() != id || m.from() <= 0 || m.from() == id) {
            LOG.debug("Node {} ignoring misaddressed message {}", id, m);
            return;
        }
        LOG.trace("Node {} step {}", id, m);

        if (m.term() > term) {
            boolean fromLeader = m.type() == MessageType.APPEND_ENTRIES || m.type() == MessageType.INSTALL_SNAPSHOT;
            LOG.info("Node {} received {} with higher term {} from {} (term was {})",
                    id, m.type(), m.term(), m.from(), term);
            becomeFollower(m.term(), fromLeader ? m.from() : 0);
        } else if (m.term() < term) {
            // Answer stale leaders and candidates so they learn the newer term
            if (m.type() == MessageType.APPEND_ENTRIES || m.type() == MessageType.INSTALL_SNAPSHOT) {
                send(Message.appendResponse(id, m.from(), term, m.index(), true, raftLog.lastIndex()));
            } else if (m.type() == MessageType.REQUEST_VOTE) {
                send(Message.voteResponse(id, m.from(), term, true));
            }
            LOG.debug("Node {} dropped stale {} from {} (term {} < {})", id, m.type(), m.from(), m.term(), term);
            return;
        }

        switch (m.type()) {
            case REQUEST_VOTE -> handleVoteRequest(m);
            case REQUEST_VOTE_RESPONSE -> {
                if (role == StateRole.CANDIDATE) {
                    handleVoteResponse(m);
                }
            }
            case APPEND_ENTRIES -> {
                if (role == StateRole.LEADER) {
                    LOG.warn("Node {} is leader of term {} but got an append from {}", id, term, m.from());
                    return;
                }
                if (role == StateRole.CANDIDATE) {
                    becomeFollower(term, m.from());
                }
                handleAppendEntries(m);
            }
            case APPEND_ENTRIES_RESPONSE -> {
                if (role == StateRole.LEADER) {
                    handleAppendResponse(m);
                }
            }
            case INSTALL_SNAPSHOT -> {
                if (role == StateRole.LEADER) {
                    LOG.warn("Node {} is leader of term {} but got a snapshot from {}", id, term, m.from());
                    return;
                }
                if (role == StateRole.CANDIDATE) {
                    becomeFollower(term, m.from());
                }
                handleSnapshot(m);
            }
        }
    }

    // ========================================================================
    // Ready / Advance
    // ========================================================================

    @Override
    public boolean hasReady() {
        if (inFlight != null) {
            return false;
        }
        return !outbox.isEmpty()
                || pendingSnapshot != null
                || raftLog.committed() > applyCursor()
                || !currentHardState().equals(prevHardState);
    }

    @Override
    public Ready ready() {
        if (inFlight != null) {
            throw new IllegalStateException("Previous ready batch has not been advanced");
        }
        long from = applyCursor() + 1;
        List<LogEntry> committedEntries = raftLog.committed() >= from
                ? raftLog.slice(from, raftLog.committed())
                : List.of();
        HardState hardState = currentHardState();

        Ready ready = new Ready(
                outbox,
                committedEntries,
                Optional.ofNullable(pendingSnapshot),
                hardState.equals(prevHardState) ? Optional.empty() : Optional.of(hardState));
        outbox.clear();
        inFlight = ready;
        return ready;
    }

    @Override
    public void advance(Ready ready) {
        if (ready != inFlight) {
            throw new IllegalStateException("advance() called with a batch that is not in flight");
        }
        ready.snapshot().ifPresent(snapshot -> {
            raftLog.appliedTo(snapshot.index());
            if (pendingSnapshot == snapshot) {
                pendingSnapshot = null;
            }
        });
        List<LogEntry> entries = ready.committedEntries();
        if (!entries.isEmpty()) {
            raftLog.appliedTo(entries.get(entries.size() - 1).index());
        }
        ready.hardState().ifPresent(hs -> prevHardState = hs);
        inFlight = null;
    }

    @Override
    public void compact(long index, byte[] data) {
        if (index <= raftLog.snapshotIndex()) {
            LOG.debug("Node {} already compacted to {}, ignoring compaction at {}", id, raftLog.snapshotIndex(), index);
            return;
        }
        if (index > raftLog.applied()) {
            throw new IllegalArgumentException("Cannot compact beyond applied index "
                    + raftLog.applied() + ": " + index);
        }
        long snapshotTerm = raftLog.term(index);
        raftLog.compactTo(index);
        latestSnapshot = new SnapshotData(index, snapshotTerm, List.copyOf(voters), data);
        LOG.info("Node {} compacted log to index {} (term {}), snapshot {} bytes",
                id, index, snapshotTerm, data.length);
    }

    // ========================================================================
    // Status
    // ========================================================================

    @Override
    public long id() {
        return id;
    }

    @Override
    public StateRole role() {
        return role;
    }

    @Override
    public long term() {
        return term;
    }

    @Override
    public long leaderId() {
        return leaderId;
    }

    @Override
    public long commitIndex() {
        return raftLog.committed();
    }

    @Override
    public long appliedIndex() {
        return raftLog.applied();
    }

    @Override
    public long lastIndex() {
        return raftLog.lastIndex();
    }

    @Override
    public List<Long> voters() {
        return List.copyOf(voters);
    }

    /** Exposed for tests and diagnostics. */
    RaftLog raftLog() {
        return raftLog;
    }

    // ========================================================================
    // Message Handlers
    // ========================================================================

    private void handleVoteRequest(Message m) {
        boolean canVote = vote == m.from() || (vote == 0 && leaderId == 0);
        boolean upToDate = raftLog.isUpToDate(m.index(), m.logTerm());

        if (canVote && upToDate) {
            vote = m.from();
            electionElapsed = 0;
            LOG.debug("Node {} granted vote to {} for term {}", id, m.from(), term);
            send(Message.voteResponse(id, m.from(), term, false));
        } else {
            LOG.debug("Node {} rejected vote for {} in term {} (canVote={}, upToDate={})",
                    id, m.from(), term, canVote, upToDate);
            send(Message.voteResponse(id, m.from(), term, true));
        }
    }

    private void handleVoteResponse(Message m) {
        if (!voters.contains(m.from())) {
            return;
        }
        if (m.reject()) {
            votesRejected.add(m.from());
        } else {
            votesGranted.add(m.from());
        }
        LOG.debug("Node {} term {} votes: granted={}, rejected={}", id, term, votesGranted, votesRejected);

        if (votesGranted.size() >= quorum()) {
            becomeLeader();
        } else if (votesRejected.size() >= quorum()) {
            becomeFollower(term, 0);
        }
    }

    private void handleAppendEntries(Message m) {
        leaderId = m.from();
        electionElapsed = 0;

        if (m.index() < raftLog.committed()) {
            send(Message.appendResponse(id, m.from(), term, raftLog.committed(), false, 0));
            return;
        }
        if (!entriesContiguous(m)) {
            LOG.warn("Node {} ignoring append with non-contiguous entries from {}", id, m.from());
            return;
        }

        if (raftLog.matchTerm(m.index(), m.logTerm())) {
            AppendPlan plan = AppendPlan.from(m.index() + 1, m.entries(), raftLog);
            if (plan.requiresTruncation() && plan.truncateFromIndex() <= raftLog.committed()) {
                LOG.error("Node {} refusing append from {} that conflicts with committed entry {}",
                        id, m.from(), plan.truncateFromIndex());
                return;
            }
            if (plan.requiresTruncation()) {
                LOG.debug("Node {} truncating log from index {}", id, plan.truncateFromIndex());
            }
            plan.applyTo(raftLog);

            long lastNewIndex = m.index() + m.entries().size();
            raftLog.commitTo(Math.min(m.commit(), lastNewIndex));
            send(Message.appendResponse(id, m.from(), term, lastNewIndex, false, 0));
        } else {
            LOG.debug("Node {} rejected append at {}@{} from {} (last index {})",
                    id, m.index(), m.logTerm(), m.from(), raftLog.lastIndex());
            send(Message.appendResponse(id, m.from(), term, m.index(), true, raftLog.lastIndex()));
        }
    }

    private void handleAppendResponse(Message m) {
        Progress pr = progress.get(m.from());
        if (pr == null) {
            return;
        }

        if (m.reject()) {
            if (m.index() <= pr.match) {
                return;
            }
            pr.next = Math.max(pr.match + 1, Math.min(m.index(), m.rejectHint() + 1));
            LOG.debug("Node {} rewinding follower {} to next={}", id, m.from(), pr.next);
            sendAppend(m.from());
            return;
        }

        long matched = Math.min(m.index(), raftLog.lastIndex());
        if (matched > pr.match) {
            pr.match = matched;
        }
        if (pr.next <= matched) {
            pr.next = matched + 1;
        }
        if (maybeCommit()) {
            bcastAppend();
        }
    }

    private void handleSnapshot(Message m) {
        leaderId = m.from();
        electionElapsed = 0;

        SnapshotData snapshot = m.snapshot();
        if (snapshot == null) {
            LOG.warn("Node {} got INSTALL_SNAPSHOT without a snapshot from {}", id, m.from());
            return;
        }
        if (snapshot.index() <= raftLog.committed()) {
            send(Message.appendResponse(id, m.from(), term, raftLog.committed(), false, 0));
            return;
        }
        if (raftLog.matchTerm(snapshot.index(), snapshot.term())) {
            raftLog.commitTo(snapshot.index());
            LOG.info("Node {} fast-forwarded commit to snapshot index {}", id, snapshot.index());
            send(Message.appendResponse(id, m.from(), term, snapshot.index(), false, 0));
            return;
        }

        raftLog.restore(snapshot.index(), snapshot.term());
        if (!snapshot.voters().isEmpty()) {
            voters.clear();
            voters.addAll(snapshot.voters());
        }
        pendingSnapshot = snapshot;
        latestSnapshot = snapshot;
        LOG.info("Node {} restored snapshot from {} at index {} (term {})",
                id, m.from(), snapshot.index(), snapshot.term());
        send(Message.appendResponse(id, m.from(), term, snapshot.index(), false, 0));
    }

    // ========================================================================
    // Replication
    // ========================================================================

    private void bcastAppend() {
        for (long peer : voters) {
            if (peer != id) {
                sendAppend(peer);
            }
        }
    }

    private void sendAppend(long to) {
        Progress pr = progress.get(to);
        if (pr == null) {
            return;
        }

        long prevIndex = pr.next - 1;
        long prevTerm = raftLog.term(prevIndex);
        if (prevTerm == RaftLog.TERM_UNAVAILABLE) {
            if (prevIndex < raftLog.snapshotIndex()) {
                sendSnapshot(to, pr);
                return;
            }
            pr.next = raftLog.lastIndex() + 1;
            prevIndex = raftLog.lastIndex();
            prevTerm = raftLog.lastTerm();
        }

        List<LogEntry> entries = raftLog.slice(pr.next, pr.next + config.maxEntriesPerMessage() - 1,
                config.maxBytesPerMessage());
        send(Message.append(id, to, term, prevIndex, prevTerm, entries, raftLog.committed()));
        if (!entries.isEmpty()) {
            pr.next = entries.get(entries.size() - 1).index() + 1;
        }
    }

    private void sendSnapshot(long to, Progress pr) {
        if (latestSnapshot == null || latestSnapshot.index() < raftLog.snapshotIndex()) {
            LOG.warn("Node {} has no snapshot to send to {} (compacted to {})", id, to, raftLog.snapshotIndex());
            return;
        }
        LOG.info("Node {} sending snapshot at index {} to follower {}", id, latestSnapshot.index(), to);
        send(Message.installSnapshot(id, to, term, latestSnapshot));
        pr.next = latestSnapshot.index() + 1;
    }

    /**
     * Advances the commit index to the highest index replicated on a quorum,
     * if that entry belongs to the current term.
     */
    private boolean maybeCommit() {
        if (role != StateRole.LEADER || voters.isEmpty()) {
            return false;
        }
        long[] matches = new long[voters.size()];
        int i = 0;
        for (long voter : voters) {
            if (voter == id) {
                matches[i++] = raftLog.lastIndex();
            } else {
                Progress pr = progress.get(voter);
                matches[i++] = pr == null ? 0 : pr.match;
            }
        }
        Arrays.sort(matches);
        long quorumIndex = matches[matches.length - quorum()];

        if (quorumIndex > raftLog.committed() && raftLog.term(quorumIndex) == term) {
            raftLog.commitTo(quorumIndex);
            LOG.debug("Node {} advanced commit index to {}", id, quorumIndex);
            return true;
        }
        return false;
    }

    // ========================================================================
    // State Transitions
    // ========================================================================

    private void becomeFollower(long newTerm, long newLeader) {
        StateRole previous = role;
        if (newTerm != term) {
            term = newTerm;
            vote = 0;
        }
        role = StateRole.FOLLOWER;
        leaderId = newLeader;
        reset();
        if (previous != StateRole.FOLLOWER) {
            LOG.info("Node {} became FOLLOWER in term {} (leader={})", id, term, newLeader);
        }
    }

    private void becomeCandidate() {
        term++;
        vote = id;
        leaderId = 0;
        role = StateRole.CANDIDATE;
        reset();
        votesGranted.add(id);
        LOG.info("Node {} became CANDIDATE in term {}", id, term);
    }

    private void becomeLeader() {
        role = StateRole.LEADER;
        leaderId = id;
        reset();
        for (long voter : voters) {
            Progress pr = new Progress(0, raftLog.lastIndex() + 1);
            progress.put(voter, pr);
        }
        pendingConfIndex = raftLog.lastIndex();
        LOG.info("Node {} became LEADER in term {}", id, term);

        // No-op entry commits everything from earlier terms (§5.4.2)
        appendEntry(EntryType.NORMAL, new byte[0]);
        bcastAppend();
        maybeCommit();
    }

    private void reset() {
        electionElapsed = 0;
        heartbeatElapsed = 0;
        resetRandomizedElectionTimeout();
        votesGranted.clear();
        votesRejected.clear();
        progress.clear();
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private long appendEntry(EntryType type, byte[] data) {
        long index = raftLog.lastIndex() + 1;
        raftLog.append(new LogEntry(index, term, type, data));
        Progress self = progress.get(id);
        if (self != null) {
            self.match = index;
            self.next = index + 1;
        }
        return index;
    }

    private boolean entriesContiguous(Message m) {
        long expected = m.index() + 1;
        for (LogEntry entry : m.entries()) {
            if (entry.index() != expected || entry.term() > m.term()) {
                return false;
            }
            expected++;
        }
        return true;
    }

    private long applyCursor() {
        long applied = raftLog.applied();
        return pendingSnapshot == null ? applied : Math.max(applied, pendingSnapshot.index());
    }

    private HardState currentHardState() {
        return new HardState(term, vote, raftLog.committed());
    }

    private int quorum() {
        return voters.size() / 2 + 1;
    }

    private void resetRandomizedElectionTimeout() {
        randomizedElectionTimeout = config.electionTicks() + random.nextInt(config.electionTicks());
    }

    private void send(Message m) {
        outbox.add(m);
    }

    /**
     * Leader's view of one follower's log.
     */
    private static final class Progress {
        long match;
        long next;

        Progress(long match, long next) {
            this.match = match;
            this.next = next;
        }
    }
}
