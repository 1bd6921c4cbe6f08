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

import java.util.Map;

/// The position of this process in its process group, as the launcher describes it.
///
/// @param rank this process's rank, -1 when it is not part of a group
/// @param worldSize the number of processes in the group
/// @param masterAddress the host rank 0 listens on
/// @param masterPort the port rank 0 listens on
public record ProcessGroup(int rank, int worldSize, String masterAddress, int masterPort) {

    /// Default port of the group leader
    public static final int DEFAULT_MASTER_PORT = 29500;
    /// Default host of the group leader
    public static final String DEFAULT_MASTER_ADDRESS = "127.0.0.1";

    public ProcessGroup {
        if (rank < -1) {
            throw new IllegalArgumentException("rank must be -1 or greater: " + rank);
        }
        if (worldSize < 1) {
            throw new IllegalArgumentException("worldSize must be at least 1: " + worldSize);
        }
        if (rank >= worldSize) {
            throw new IllegalArgumentException("rank " + rank + " is outside the group of size " + worldSize);
        }
    }

    /// @return a group description for a process that is not part of a group
    public static ProcessGroup none() {
        return new ProcessGroup(-1, 1, DEFAULT_MASTER_ADDRESS, DEFAULT_MASTER_PORT);
    }

    /// Reads `RANK` (falling back to `LOCAL_RANK`), `WORLD_SIZE`, `MASTER_ADDR` and
    /// `MASTER_PORT` from the process environment.
    /// @return the group description
    public static ProcessGroup fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /// @param env the environment to read
    /// @return the group description
    /// @throws IllegalArgumentException if a variable is set but not a number
    public static ProcessGroup fromEnvironment(Map<String, String> env) {
        int rank = intValue(env, "RANK", intValue(env, "LOCAL_RANK", -1));
        int worldSize = intValue(env, "WORLD_SIZE", 1);
        String address = env.getOrDefault("MASTER_ADDR", DEFAULT_MASTER_ADDRESS);
        int port = intValue(env, "MASTER_PORT", DEFAULT_MASTER_PORT);
        return new ProcessGroup(rank, worldSize, address, port);
    }

    /// @return true if this process takes part in a group
    public boolean isDistributed() {
        return rank >= 0;
    }

    private static int intValue(Map<String, String> env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}
