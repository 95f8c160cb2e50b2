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

import dev.mars.raftkv.raft.StateRole;

import java.util.List;

/**
 * Point-in-time view of a node, published by the driver thread after each loop iteration.
 *
 * @param nodeId       this node
 * @param role         consensus role
 * @param term         current term
 * @param leaderId     known leader, 0 if none
 * @param commitIndex  highest committed index
 * @param appliedIndex highest applied index
 * @param driverState  driver lifecycle state
 * @param voters       current voting members
 */
public record NodeStatus(
        long nodeId,
        StateRole role,
        long term,
        long leaderId,
        long commitIndex,
        long appliedIndex,
        DriverState driverState,
        List<Long> voters
) {

    public NodeStatus {
        voters = List.copyOf(voters);
    }

    public boolean isLeader() {
        return role == StateRole.LEADER;
    }
}
