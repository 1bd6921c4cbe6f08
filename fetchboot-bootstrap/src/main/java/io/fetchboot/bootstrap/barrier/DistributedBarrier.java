package io.fetchboot.bootstrap.barrier;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;

/// Runs a block of work on the leader of a process group first, holding every other rank
/// back until it is complete.
///
/// The protocol has two phases. Every rank meets at {@link BarrierPhase#ENTRY}; rank 0 then
/// performs the work while the others wait at {@link BarrierPhase#EXIT}; rank 0 arrives at
/// the exit once the work is complete, which releases the followers to reuse its result.
/// Followers therefore never observe a partial result, and the work is performed once per
/// group per call.
///
/// If the leader's work fails, the leader aborts the exit phase and rethrows its failure;
/// the followers receive a {@link BarrierAbortedException} carrying the failure as cause.
/// A process with rank -1 is not part of a group and performs the work directly.
public class DistributedBarrier {
    private static final Logger logger = LogManager.getLogger(DistributedBarrier.class);

    /// The rank of a process that is not part of a group
    public static final int NO_GROUP = -1;
    /// The rank that performs guarded work
    public static final int LEADER = 0;

    private final GroupBarrier group;

    /// @param group the group barrier ranks meet at, unused for rank -1
    public DistributedBarrier(GroupBarrier group) {
        this.group = group;
    }

    /// Runs the work under the two-phase protocol.
    ///
    /// @param rank the calling rank, -1 for no group
    /// @param work the work and its reuse path
    /// @param <T> the result type
    /// @return the leader's result on rank 0 and rank -1, the reused result on followers
    /// @throws IOException if the work, or its reuse, fails on this rank
    /// @throws BarrierException if the group barrier cannot be passed
    /// @throws IllegalArgumentException if the rank is below -1 or outside the group
    public <T> T withBarrier(int rank, GuardedWork<T> work) throws IOException {
        if (rank == NO_GROUP) {
            return work.perform();
        }
        if (rank < NO_GROUP || rank >= group.worldSize()) {
            throw new IllegalArgumentException("rank " + rank + " is outside the group of size " + group.worldSize());
        }

        group.await(rank, BarrierPhase.ENTRY);
        if (rank != LEADER) {
            group.await(rank, BarrierPhase.EXIT);
            logger.debug("Rank {} reusing the leader's result", rank);
            return work.reuse();
        }

        T result;
        try {
            result = work.perform();
        } catch (IOException | RuntimeException | Error e) {
            logger.debug("Guarded work failed on the leader, aborting the barrier: {}", e.toString());
            try {
                group.abort(rank, BarrierPhase.EXIT, e);
            } catch (RuntimeException abortFailure) {
                e.addSuppressed(abortFailure);
            }
            throw e;
        }
        group.await(rank, BarrierPhase.EXIT);
        return result;
    }
}
