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

import io.fetchboot.api.config.FetchbootSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;

/// Creates the {@link GroupBarrier} matching a {@link ProcessGroup}.
public final class GroupBarriers {
    private static final Logger logger = LogManager.getLogger(GroupBarriers.class);

    private GroupBarriers() {
    }

    /// @return a barrier for a group of one, which never waits
    public static GroupBarrier solo() {
        return new LocalGroupBarrier(1);
    }

    /// Creates a barrier for the group with the configured barrier timeout.
    /// @see #forGroup(ProcessGroup, Duration)
    public static GroupBarrier forGroup(ProcessGroup group, FetchbootSettings settings) throws IOException {
        return forGroup(group, settings.barrierTimeout());
    }

    /// Creates a barrier for the group: a local one for processes outside a group or alone in
    /// theirs, a socket barrier rendezvousing at the master address otherwise.
    ///
    /// @param group this process's group description
    /// @param timeout how long ranks wait for each other, zero to wait indefinitely
    /// @return the barrier
    /// @throws IOException if rank 0 cannot listen on the master port
    public static GroupBarrier forGroup(ProcessGroup group, Duration timeout) throws IOException {
        if (!group.isDistributed() || group.worldSize() == 1) {
            return solo();
        }
        logger.debug("Rank {} of {} meets at {}:{}", group.rank(), group.worldSize(), group.masterAddress(), group.masterPort());
        return new SocketGroupBarrier(
                group.rank(),
                group.worldSize(),
                new InetSocketAddress(group.masterAddress(), group.masterPort()),
                timeout);
    }
}
