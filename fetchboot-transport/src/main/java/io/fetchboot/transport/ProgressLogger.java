package io.fetchboot.transport;

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

import org.apache.logging.log4j.Logger;

/// Logs transfer progress in ten percent steps, or every 10 MiB when the total size is
/// unknown. Does nothing unless enabled.
final class ProgressLogger {

    private static final long UNKNOWN_SIZE_STEP = 10L * 1024 * 1024;

    private final Logger logger;
    private final String name;
    private final long total;
    private final boolean enabled;
    private long nextReport;

    /// @param logger the logger to report to at debug level
    /// @param name what is being transferred
    /// @param total expected total size in bytes, or a negative value if unknown
    /// @param alreadyPresent bytes present before this transfer started
    /// @param enabled whether to report at all
    ProgressLogger(Logger logger, String name, long total, long alreadyPresent, boolean enabled) {
        this.logger = logger;
        this.name = name;
        this.total = total;
        this.enabled = enabled && logger.isDebugEnabled();
        this.nextReport = alreadyPresent + step();
    }

    void update(long bytesSoFar) {
        if (!enabled || bytesSoFar < nextReport) {
            return;
        }
        if (total > 0) {
            logger.debug("{}: {}% ({}/{} bytes)", name, (bytesSoFar * 100) / total, bytesSoFar, total);
        } else {
            logger.debug("{}: {} bytes", name, bytesSoFar);
        }
        nextReport = bytesSoFar + step();
    }

    private long step() {
        return total > 0 ? Math.max(1, total / 10) : UNKNOWN_SIZE_STEP;
    }
}
