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

import java.io.IOException;

/// Work that must run once per process group, and how the other ranks pick up its result.
///
/// @param <T> the result type
public interface GuardedWork<T> {

    /// Performs the work. Called on rank 0, or on a process that is not part of a group.
    /// @return the result
    /// @throws IOException if the work fails
    T perform() throws IOException;

    /// Picks up the result of work another rank has completed. Called on every rank other
    /// than 0, after rank 0's {@link #perform()} returned. Defaults to {@link #perform()},
    /// for work that is cheap once its shared artifacts exist.
    /// @return the result
    /// @throws IOException if the result cannot be read
    default T reuse() throws IOException {
        return perform();
    }
}
