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

/**
 * Thrown when the consensus core refuses a proposal: this node is not the
 * leader, a membership change is already in flight, or the node is stopping.
 */
public class ProposalDroppedException extends RuntimeException {

    private final long leaderId;

    public ProposalDroppedException(String message, long leaderId) {
        super(message);
        this.leaderId = leaderId;
    }

    /**
     * The leader this node currently knows of, 0 if none. Clients can retry there.
     */
    public long leaderId() {
        return leaderId;
    }
}
