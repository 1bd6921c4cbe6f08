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

/// Signals that a group barrier could not be passed.
public class BarrierException extends RuntimeException {
    private final BarrierPhase phase;
    private final int rank;

    public BarrierException(String message, BarrierPhase phase, int rank, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.rank = rank;
    }

    /// @return the phase the rank was waiting at
    public BarrierPhase getPhase() {
        return phase;
    }

    /// @return the rank that could not pass
    public int getRank() {
        return rank;
    }
}
