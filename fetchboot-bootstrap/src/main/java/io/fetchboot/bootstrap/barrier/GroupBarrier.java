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

import java.io.Closeable;

/// A collective barrier over a fixed group of ranks `0..worldSize-1`.
///
/// Each phase is a reusable rendezvous: a call to {@link #await(int, BarrierPhase)} returns
/// once every rank of the group has arrived at the same phase. A rank that cannot complete
/// its part calls {@link #abort(int, BarrierPhase, Throwable)} instead, which releases every
/// rank waiting at that phase, and every rank arriving later, with a
/// {@link BarrierAbortedException}.
public interface GroupBarrier extends Closeable {

    /// @return the number of ranks in the group
    int worldSize();

    /// Waits until every rank has arrived at the phase.
    ///
    /// @param rank the calling rank
    /// @param phase the phase to meet at
    /// @throws BarrierAbortedException if another rank aborted the phase
    /// @throws BarrierTimeoutException if the configured timeout passed first
    /// @throws BarrierException if the group can no longer be reached
    void await(int rank, BarrierPhase phase);

    /// Aborts the current round of a phase on behalf of a rank that will not arrive.
    ///
    /// @param rank the aborting rank
    /// @param phase the phase to abort
    /// @param cause why the rank gives up, passed to the waiting ranks
    void abort(int rank, BarrierPhase phase, Throwable cause);

    @Override
    default void close() {
    }
}
