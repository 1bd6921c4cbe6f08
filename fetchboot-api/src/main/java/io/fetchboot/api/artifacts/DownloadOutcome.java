package io.fetchboot.api.artifacts;

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

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/// Represents the result of a download engine fetch.
///
/// An outcome is never thrown; a failed outcome carries the error detail of the last
/// attempt and guarantees that nothing is left at the destination.
public class DownloadOutcome {
    /// The path the artifact was written to
    private final Path destination;
    /// Size of the artifact on disk, 0 if the fetch failed
    private final long bytesWritten;
    /// Whether the artifact exists and passed size validation
    private final boolean succeeded;
    /// Description of the failure, or null if the fetch succeeded
    private final String errorDetail;
    /// Every transport attempt made, in order
    private final List<TransferAttempt> attempts;

    public DownloadOutcome(
            Path destination,
            long bytesWritten,
            boolean succeeded,
            String errorDetail,
            List<TransferAttempt> attempts
    )
    {
        this.destination = destination;
        this.bytesWritten = bytesWritten;
        this.succeeded = succeeded;
        this.errorDetail = errorDetail;
        this.attempts = List.copyOf(attempts);
    }

    /// @param destination the validated artifact
    /// @param bytes its size
    /// @param attempts the attempts it took
    /// @return a successful outcome
    public static DownloadOutcome succeeded(Path destination, long bytes, List<TransferAttempt> attempts) {
        return new DownloadOutcome(destination, bytes, true, null, attempts);
    }

    /// @param destination the path that was attempted
    /// @param errorDetail why the fetch failed
    /// @param attempts the attempts that were made
    /// @return a failed outcome
    public static DownloadOutcome failed(Path destination, String errorDetail, List<TransferAttempt> attempts) {
        return new DownloadOutcome(destination, 0, false, errorDetail, attempts);
    }

    /// @return the path the artifact was written to
    public Path destination() {
        return destination;
    }

    /// @return size of the artifact on disk, 0 if the fetch failed
    public long bytesWritten() {
        return bytesWritten;
    }

    /// @return whether the artifact exists and passed size validation
    public boolean succeeded() {
        return succeeded;
    }

    /// @return description of the failure, empty if the fetch succeeded
    public Optional<String> errorDetail() {
        return Optional.ofNullable(errorDetail);
    }

    /// @return every transport attempt made, in order
    public List<TransferAttempt> attempts() {
        return attempts;
    }

    /// @return true if more than one transport was needed
    public boolean usedFallback() {
        return attempts.size() > 1;
    }

    @Override
    public String toString() {
        return "DownloadOutcome{" + "destination=" + destination + ", bytesWritten=" + bytesWritten
                + ", succeeded=" + succeeded + (errorDetail != null ? ", error='" + errorDetail + '\'' : "")
                + ", attempts=" + attempts.size() + '}';
    }
}
