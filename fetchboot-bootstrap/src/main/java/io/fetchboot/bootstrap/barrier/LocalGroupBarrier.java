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

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/// A {@link GroupBarrier} for ranks running as threads of one JVM.
///
/// Each phase counts arrivals per round. The round closes when `worldSize` ranks have
/// arrived, whether they passed or were aborted, so an aborted phase can be used again by
/// the next round. Used for single process groups and for simulating a group in tests.
public class LocalGroupBarrier implements GroupBarrier {
    private static final Logger logger = LogManager.getLogger(LocalGroupBarrier.class);

    private final int worldSize;
    private final Duration timeout;
    private final Map<BarrierPhase, Round> rounds = new EnumMap<>(BarrierPhase.class);

    /// A barrier whose ranks wait indefinitely.
    /// @param worldSize the number of ranks, at least 1
    public LocalGroupBarrier(int worldSize) {
        this(worldSize, Duration.ZERO);
    }

    /// @param worldSize the number of ranks, at least 1
    /// @param timeout how long a rank waits before giving up, zero to wait indefinitely
    public LocalGroupBarrier(int worldSize, Duration timeout) {
        if (worldSize < 1) {
            throw new IllegalArgumentException("worldSize must be at least 1: " + worldSize);
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        this.worldSize = worldSize;
        this.timeout = timeout;
        for (BarrierPhase phase : BarrierPhase.values()) {
            rounds.put(phase, new Round());
        }
    }

    @Override
    public int worldSize() {
        return worldSize;
    }

    @Override
    public synchronized void await(int rank, BarrierPhase phase) {
        checkRank(rank);
        Round round = rounds.get(phase);
        long generation = round.generation;

        if (round.abortedGeneration == generation) {
            Throwable cause = round.abortCause;
            arrive(round);
            throw new BarrierAbortedException(phase, rank, cause);
        }
        if (arrive(round)) {
            logger.trace("Rank {} released barrier {}", rank, phase);
            return;
        }

        long deadline = timeout.isZero() ? 0 : System.nanoTime() + timeout.toNanos();
        while (round.generation == generation && round.abortedGeneration != generation) {
            try {
                if (deadline == 0) {
                    wait();
                } else {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        round.abortedGeneration = generation;
                        round.abortCause = new BarrierTimeoutException(phase, rank, timeout);
                        notifyAll();
                        throw (BarrierTimeoutException) round.abortCause;
                    }
                    wait(remaining / 1_000_000L, (int) (remaining % 1_000_000L));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                round.abortedGeneration = generation;
                round.abortCause = e;
                notifyAll();
                throw new BarrierAbortedException(phase, rank, e);
            }
        }
        if (round.abortedGeneration == generation) {
            throw new BarrierAbortedException(phase, rank, round.abortCause);
        }
    }

    @Override
    public synchronized void abort(int rank, BarrierPhase phase, Throwable cause) {
        checkRank(rank);
        Round round = rounds.get(phase);
        logger.debug("Rank {} aborts barrier {}", rank, phase);
        if (round.abortedGeneration != round.generation) {
            round.abortedGeneration = round.generation;
            round.abortCause = cause;
        }
        arrive(round);
        notifyAll();
    }

    /// Counts one arrival, closing the round when the whole group has arrived.
    /// @return true if this arrival closed the round
    private boolean arrive(Round round) {
        round.arrived++;
        if (round.arrived < worldSize) {
            return false;
        }
        round.arrived = 0;
        round.generation++;
        notifyAll();
        return true;
    }

    private void checkRank(int rank) {
        if (rank < 0 || rank >= worldSize) {
            throw new IllegalArgumentException("rank " + rank + " is outside the group of size " + worldSize);
        }
    }

    private static class Round {
        long generation;
        int arrived;
        long abortedGeneration = -1;
        Throwable abortCause;
    }
}
