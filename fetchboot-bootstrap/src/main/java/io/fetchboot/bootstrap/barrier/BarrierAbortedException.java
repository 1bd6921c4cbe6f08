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

/// Thrown to ranks waiting at a barrier that another rank aborted, typically because the
/// leader's guarded work failed. The cause, when known, is the leader's failure.
public class BarrierAbortedException extends BarrierException {

    public BarrierAbortedException(BarrierPhase phase, int rank, Throwable cause) {
        super("Barrier " + phase + " aborted while rank " + rank + " was waiting"
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), phase, rank, cause);
    }
}
