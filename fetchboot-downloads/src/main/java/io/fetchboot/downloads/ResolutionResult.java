package io.fetchboot.downloads;

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

import io.fetchboot.api.artifacts.DownloadOutcome;
import io.fetchboot.api.artifacts.RemoteAsset;

import java.util.List;
import java.util.Optional;

/// The explicit result of {@link ArtifactResolver#resolve(String, String, String)}.
///
/// @param requestedSpec the file spec as the caller passed it
/// @param path the path spec the caller should use from here on
/// @param status how the resolution ended
/// @param asset what was resolved, and from where
/// @param attempts every source consulted, in order
/// @param download the download outcome, when a download was attempted
public record ResolutionResult(
        String requestedSpec,
        String path,
        ResolutionStatus status,
        RemoteAsset asset,
        List<SourceAttempt> attempts,
        Optional<DownloadOutcome> download
) {

    public ResolutionResult {
        attempts = List.copyOf(attempts);
    }

    /// @return true if a valid file is present at {@link #path()}
    public boolean isAvailable() {
        return status == ResolutionStatus.LOCAL || status == ResolutionStatus.DOWNLOADED;
    }
}
